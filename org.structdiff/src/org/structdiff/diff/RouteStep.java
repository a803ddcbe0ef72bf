/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.diff;

/**
 * One step of a route: the edge taken, where it started and where it led,
 * plus the total cost of the route up to and including this step.
 * <p>
 * The first step of every route is its start: it has no predecessor, no
 * edge and cost 0.
 */
public final class RouteStep {
	private final Vertex from;

	private final Edge edge;

	private final Vertex into;

	private final long cost;

	/**
	 * Create the start step of a route.
	 *
	 * @param start
	 *            the vertex the route starts at.
	 */
	public RouteStep(Vertex start) {
		this(null, null, start, 0);
	}

	/**
	 * Create a step.
	 *
	 * @param from
	 *            the vertex the edge leaves; null only for a start step.
	 * @param edge
	 *            the edge taken; null only for a start step.
	 * @param into
	 *            the vertex the edge reaches.
	 * @param cost
	 *            cumulative cost including this edge.
	 */
	public RouteStep(Vertex from, Edge edge, Vertex into, long cost) {
		if (into == null || (from == null) != (edge == null))
			throw new IllegalArgumentException();
		this.from = from;
		this.edge = edge;
		this.into = into;
		this.cost = cost;
	}

	/** @return the vertex the edge leaves, or null for a start step. */
	public Vertex getFrom() {
		return from;
	}

	/** @return the edge taken, or null for a start step. */
	public Edge getEdge() {
		return edge;
	}

	/** @return the vertex reached by this step. */
	public Vertex getInto() {
		return into;
	}

	/** @return cost of the route from its start through this step. */
	public long getCost() {
		return cost;
	}

	/** @return true if this is the first step of a route. */
	public boolean isStart() {
		return from == null;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		if (isStart())
			return "Start(" + into + ")";
		return edge + "@" + cost;
	}
}
