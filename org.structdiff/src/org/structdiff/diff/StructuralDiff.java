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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.structdiff.errors.DelimiterDepthException;
import org.structdiff.internal.StructDiffText;
import org.structdiff.tree.SyntaxCursor;
import org.structdiff.tree.SyntaxTree;

/**
 * Finds the cheapest alignment of two syntax trees.
 * <p>
 * The trees are walked in lock-step. Each {@link Vertex} pairs a position in
 * the left tree with a position in the right tree, and each {@link Edge}
 * moves one or both positions forward at a cost. A shortest path from the
 * two roots to the vertex where both trees are consumed is the diff: its
 * edges say which subtrees are unchanged, which comments were edited and
 * which nodes are novel on either side.
 * <p>
 * The graph is explored lazily with Dijkstra's algorithm. A vertex reached
 * again at equal or higher cost than already recorded is dropped, and the
 * search gives up once it has finalized more vertices than the configured
 * budget allows, so very large or very different inputs fail fast instead of
 * exhausting memory.
 * <p>
 * Instances hold no per-search state and may be shared between threads.
 */
public class StructuralDiff {
	private static final Logger LOG = LoggerFactory
			.getLogger(StructuralDiff.class);

	private final DiffConfig config;

	/** Create a search using {@link DiffConfig#getDefault()}. */
	public StructuralDiff() {
		this(DiffConfig.getDefault());
	}

	/**
	 * Create a search.
	 *
	 * @param config
	 *            tuning of the search budget.
	 */
	public StructuralDiff(DiffConfig config) {
		if (config == null)
			throw new NullPointerException();
		this.config = config;
	}

	/** @return the configuration of this search. */
	public DiffConfig getConfig() {
		return config;
	}

	/**
	 * Diff two trees with a budget derived from their sizes.
	 *
	 * @param left
	 *            the old tree.
	 * @param right
	 *            the new tree.
	 * @return the result; check {@link SearchResult#isFound()} before using
	 *         its route.
	 */
	public SearchResult diff(SyntaxTree left, SyntaxTree right) {
		int limit = config.getVertexLimit(left.getPositionCount(),
				right.getPositionCount());
		return diff(left.cursor(), right.cursor(), limit);
	}

	/**
	 * Diff two trees starting at the given cursors.
	 *
	 * @param left
	 *            cursor at the first top-level node of the old tree.
	 * @param right
	 *            cursor at the first top-level node of the new tree.
	 * @param limit
	 *            number of vertices the search may finalize before giving
	 *            up.
	 * @return the result; check {@link SearchResult#isFound()} before using
	 *         its route.
	 */
	public SearchResult diff(SyntaxCursor left, SyntaxCursor right,
			int limit) {
		if (left == null || right == null)
			throw new NullPointerException();
		return new State(limit).search(new Vertex(left, right,
				DelimiterStack.EMPTY));
	}

	private static final class State {
		private final int limit;

		private final PriorityQueue<Entry> queue = new PriorityQueue<>();

		/** Cheapest step known to reach each vertex, queued or finalized. */
		private final Map<Vertex, RouteStep> best = new HashMap<>();

		private final Set<Vertex> finalized = new HashSet<>();

		private long sequence;

		State(int limit) {
			this.limit = limit;
		}

		SearchResult search(Vertex start) {
			offer(new RouteStep(start));

			Entry e;
			while ((e = queue.poll()) != null) {
				RouteStep step = e.step;
				Vertex v = step.getInto();
				if (!finalized.add(v))
					continue;

				if (v.isTerminal())
					return SearchResult.found(route(step), finalized.size());

				if (finalized.size() > limit) {
					if (LOG.isDebugEnabled())
						LOG.debug(MessageFormat.format(
								StructDiffText.get().searchLimitExceeded,
								Integer.valueOf(finalized.size()),
								Integer.valueOf(limit)));
					return SearchResult.failed(
							SearchResult.Outcome.LIMIT_EXCEEDED,
							finalized.size());
				}

				try {
					Neighbours.forEach(v, (edge, next) -> relax(step, edge,
							next));
				} catch (DelimiterDepthException tooDeep) {
					if (LOG.isDebugEnabled())
						LOG.debug(MessageFormat.format(
								StructDiffText.get().searchDepthExceeded,
								Integer.valueOf(finalized.size()),
								tooDeep.getMessage()));
					return SearchResult.failed(
							SearchResult.Outcome.DEPTH_EXCEEDED,
							finalized.size());
				}
			}

			LOG.warn(MessageFormat.format(
					StructDiffText.get().searchQueueExhausted,
					Integer.valueOf(finalized.size())));
			return SearchResult.failed(SearchResult.Outcome.EXHAUSTED,
					finalized.size());
		}

		private void relax(RouteStep from, Edge edge, Vertex next) {
			long cost = from.getCost() + edge.getCost();
			RouteStep known = best.get(next);
			if (known != null && known.getCost() <= cost)
				return;
			offer(new RouteStep(from.getInto(), edge, next, cost));
		}

		private void offer(RouteStep step) {
			best.put(step.getInto(), step);
			queue.add(new Entry(step, sequence++));
		}

		private Route route(RouteStep last) {
			List<RouteStep> steps = new ArrayList<>();
			for (RouteStep s = last; s != null; s = s.isStart() ? null
					: best.get(s.getFrom()))
				steps.add(s);
			Collections.reverse(steps);
			return new Route(steps);
		}
	}

	/** Queue entry ordered by cost, then by insertion for stable ties. */
	private static final class Entry implements Comparable<Entry> {
		final RouteStep step;

		final long sequence;

		Entry(RouteStep step, long sequence) {
			this.step = step;
			this.sequence = sequence;
		}

		@Override
		public int compareTo(Entry o) {
			int c = Long.compare(step.getCost(), o.step.getCost());
			return c != 0 ? c : Long.compare(sequence, o.sequence);
		}
	}
}
