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
 * Outcome of one {@link StructuralDiff} search.
 * <p>
 * Only {@link Outcome#FOUND} carries a route. Every other outcome means the
 * trees could not be diffed structurally and the caller should fall back to
 * a cheaper strategy, such as a line based diff.
 */
public final class SearchResult {
	/** How a search ended */
	public static enum Outcome {
		/** The cheapest route was found. */
		FOUND,

		/** The exploration limit was reached first. */
		LIMIT_EXCEEDED,

		/** The trees nest deeper than the delimiter stack can track. */
		DEPTH_EXCEEDED,

		/** No vertex was left to explore; indicates a defect. */
		EXHAUSTED;
	}

	static SearchResult found(Route route, int visited) {
		return new SearchResult(Outcome.FOUND, route, visited);
	}

	static SearchResult failed(Outcome outcome, int visited) {
		return new SearchResult(outcome, null, visited);
	}

	private final Outcome outcome;

	private final Route route;

	private final int visited;

	private SearchResult(Outcome outcome, Route route, int visited) {
		this.outcome = outcome;
		this.route = route;
		this.visited = visited;
	}

	/** @return how the search ended. */
	public Outcome getOutcome() {
		return outcome;
	}

	/** @return true if a route was found. */
	public boolean isFound() {
		return outcome == Outcome.FOUND;
	}

	/** @return the route; null unless the outcome is {@code FOUND}. */
	public Route getRoute() {
		return route;
	}

	/** @return number of distinct vertices finalized by the search. */
	public int getVisited() {
		return visited;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "SearchResult[" + outcome + ", visited=" + visited
				+ (route != null ? ", cost=" + route.getCost() : "") + "]";
	}
}
