/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.junit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.structdiff.diff.Edge;
import org.structdiff.diff.Route;
import org.structdiff.diff.RouteStep;
import org.structdiff.diff.SearchResult;

/**
 * Assertions and helpers for routes found in tests.
 */
public class RouteAssert {
	/**
	 * Assert a search succeeded and its route is well formed.
	 * <p>
	 * A well formed route starts with a start step at cost 0, each step
	 * leaves the vertex the previous step reached, each step's cost is the
	 * previous cost plus its edge's cost, and the last vertex is terminal.
	 *
	 * @param result
	 *            the search result.
	 * @return the route, for further checks.
	 */
	public static Route assertFound(SearchResult result) {
		assertTrue(result.isFound(), "no route: " + result); //$NON-NLS-1$
		Route route = result.getRoute();
		assertNotNull(route);

		RouteStep first = route.get(0);
		assertTrue(first.isStart());
		assertEquals(0, first.getCost());

		for (int i = 1; i < route.size(); i++) {
			RouteStep prev = route.get(i - 1);
			RouteStep step = route.get(i);
			assertFalse(step.isStart());
			assertEquals(prev.getInto(), step.getFrom());
			assertEquals(prev.getCost() + step.getEdge().getCost(),
					step.getCost());
		}
		assertTrue(route.get(route.size() - 1).getInto().isTerminal());
		return route;
	}

	/**
	 * Get the kinds of a route's edges.
	 *
	 * @param route
	 *            the route.
	 * @return edge types in route order.
	 */
	public static List<Edge.Type> types(Route route) {
		List<Edge.Type> r = new ArrayList<>();
		for (Edge e : route.getEdges())
			r.add(e.getType());
		return r;
	}

	/**
	 * Get a route's edges as seen from the other side.
	 *
	 * @param route
	 *            the route.
	 * @return swapped edge types in route order.
	 */
	public static List<Edge.Type> swappedTypes(Route route) {
		List<Edge.Type> r = new ArrayList<>();
		for (Edge e : route.getEdges())
			r.add(e.swap().getType());
		return r;
	}

	/**
	 * Assert a route contains no edge marking anything as added, removed or
	 * replaced.
	 *
	 * @param route
	 *            the route.
	 */
	public static void assertOnlyMatches(Route route) {
		for (Edge e : route.getEdges())
			assertTrue(e.getType() == Edge.Type.UNCHANGED
					|| e.getType() == Edge.Type.ENTER_UNCHANGED_DELIMITER,
					"unexpected " + e + " in " + route); //$NON-NLS-1$ //$NON-NLS-2$
	}
}
