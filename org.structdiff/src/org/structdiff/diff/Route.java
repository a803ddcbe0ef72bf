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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.RandomAccess;

import org.structdiff.internal.StructDiffText;

/**
 * The cheapest alignment of two trees, as an ordered list of steps.
 * <p>
 * The first element is the start step; every following step records one
 * {@link Edge}. A route is immutable.
 */
public final class Route extends AbstractList<RouteStep>
		implements RandomAccess {
	private final List<RouteStep> steps;

	/**
	 * Create a route.
	 *
	 * @param steps
	 *            the steps in forward order, starting with the start step.
	 */
	public Route(List<RouteStep> steps) {
		if (steps.isEmpty() || !steps.get(0).isStart())
			throw new IllegalArgumentException(StructDiffText.get().routeEmpty);
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}

	@Override
	public RouteStep get(int index) {
		return steps.get(index);
	}

	@Override
	public int size() {
		return steps.size();
	}

	/** @return total cost of the route. */
	public long getCost() {
		return steps.get(steps.size() - 1).getCost();
	}

	/** @return the edges of the route in order, without the start step. */
	public List<Edge> getEdges() {
		List<Edge> edges = new ArrayList<>(steps.size() - 1);
		for (RouteStep s : steps.subList(1, steps.size()))
			edges.add(s.getEdge());
		return edges;
	}

	/**
	 * Count the edges of one kind.
	 *
	 * @param type
	 *            kind of edge to count.
	 * @return number of steps taking an edge of that kind.
	 */
	public int count(Edge.Type type) {
		int n = 0;
		for (RouteStep s : steps.subList(1, steps.size()))
			if (s.getEdge().getType() == type)
				n++;
		return n;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "Route" + getEdges() + "@" + getCost();
	}
}
