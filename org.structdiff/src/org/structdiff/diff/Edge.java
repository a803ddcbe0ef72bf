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
 * One local alignment decision taken while walking two trees.
 * <p>
 * An edge explains how the search moved from one {@link Vertex} to the next:
 * it matched a node on both sides, paired two comments as a replacement,
 * entered a list on one or both sides, or consumed an atom that only one side
 * has. Each decision has a cost; the route search minimizes the sum.
 * <p>
 * The cost model strongly prefers matches. An exact match is always cheaper
 * than any novel or replaced alternative, punctuation matches are penalized
 * so unrelated separators are not paired up by accident, and a replaced
 * comment costs less the more similar the two texts are.
 */
public final class Edge {
	/** Kind of alignment decision */
	public static enum Type {
		/** The nodes at both cursors are structurally identical. */
		UNCHANGED,

		/** Both cursors are on lists with the same delimiters. */
		ENTER_UNCHANGED_DELIMITER,

		/** Both cursors are on different comments, paired as an edit. */
		REPLACED,

		/** The left atom has no counterpart on the right. */
		NOVEL_ATOM_LEFT,

		/** The right atom has no counterpart on the left. */
		NOVEL_ATOM_RIGHT,

		/** The left list's delimiters have no counterpart on the right. */
		ENTER_NOVEL_DELIMITER_LEFT,

		/** The right list's delimiters have no counterpart on the left. */
		ENTER_NOVEL_DELIMITER_RIGHT,

		/** Both sides are on lists, but their delimiters differ. */
		ENTER_NOVEL_DELIMITER_BOTH;

		/** @return true if this decision marks something as added or removed. */
		public boolean isNovel() {
			switch (this) {
			case NOVEL_ATOM_LEFT:
			case NOVEL_ATOM_RIGHT:
			case ENTER_NOVEL_DELIMITER_LEFT:
			case ENTER_NOVEL_DELIMITER_RIGHT:
			case ENTER_NOVEL_DELIMITER_BOTH:
				return true;
			default:
				return false;
			}
		}
	}

	/** Largest depth difference that still raises the cost of a match. */
	static final int MAX_DEPTH_PENALTY = 40;

	static final int PUNCTUATION_PENALTY = 200;

	static final int ENTER_UNCHANGED_COST = 100;

	static final int NOVEL_COST = 300;

	static final int NOVEL_BOTH_COST = 550;

	static final int REPLACED_COST = 500;

	/** Left atom consumed on its own. */
	public static final Edge NOVEL_ATOM_LEFT = new Edge(Type.NOVEL_ATOM_LEFT,
			0, false, 0);

	/** Right atom consumed on its own. */
	public static final Edge NOVEL_ATOM_RIGHT = new Edge(Type.NOVEL_ATOM_RIGHT,
			0, false, 0);

	/** Left list entered on its own. */
	public static final Edge ENTER_NOVEL_DELIMITER_LEFT = new Edge(
			Type.ENTER_NOVEL_DELIMITER_LEFT, 0, false, 0);

	/** Right list entered on its own. */
	public static final Edge ENTER_NOVEL_DELIMITER_RIGHT = new Edge(
			Type.ENTER_NOVEL_DELIMITER_RIGHT, 0, false, 0);

	/** Both lists entered, each as a novel list. */
	public static final Edge ENTER_NOVEL_DELIMITER_BOTH = new Edge(
			Type.ENTER_NOVEL_DELIMITER_BOTH, 0, false, 0);

	/**
	 * Create a match of two structurally identical nodes.
	 *
	 * @param depthDifference
	 *            absolute difference of the nodes' nesting depths.
	 * @param probablyPunctuation
	 *            true if the grammar tagged the node as punctuation.
	 * @return the edge.
	 */
	public static Edge unchanged(int depthDifference,
			boolean probablyPunctuation) {
		return new Edge(Type.UNCHANGED, checkDepth(depthDifference),
				probablyPunctuation, 0);
	}

	/**
	 * Create an edge entering two lists with matching delimiters.
	 *
	 * @param depthDifference
	 *            absolute difference of the lists' nesting depths.
	 * @return the edge.
	 */
	public static Edge enterUnchangedDelimiter(int depthDifference) {
		return new Edge(Type.ENTER_UNCHANGED_DELIMITER,
				checkDepth(depthDifference), false, 0);
	}

	/**
	 * Create an edge pairing two different comments.
	 *
	 * @param similarityPercent
	 *            similarity of the comment texts, 0 to 100.
	 * @return the edge.
	 */
	public static Edge replaced(int similarityPercent) {
		if (similarityPercent < 0 || similarityPercent > 100)
			throw new IllegalArgumentException(
					String.valueOf(similarityPercent));
		return new Edge(Type.REPLACED, 0, false, similarityPercent);
	}

	private static int checkDepth(int depthDifference) {
		if (depthDifference < 0)
			throw new IllegalArgumentException(String.valueOf(depthDifference));
		return depthDifference;
	}

	private final Type type;

	private final int depthDifference;

	private final boolean probablyPunctuation;

	private final int similarityPercent;

	private Edge(Type type, int depthDifference, boolean probablyPunctuation,
			int similarityPercent) {
		this.type = type;
		this.depthDifference = depthDifference;
		this.probablyPunctuation = probablyPunctuation;
		this.similarityPercent = similarityPercent;
	}

	/** @return the kind of decision. */
	public Type getType() {
		return type;
	}

	/** @return nesting depth difference of a match; 0 for other kinds. */
	public int getDepthDifference() {
		return depthDifference;
	}

	/** @return true if a match paired punctuation. */
	public boolean isProbablyPunctuation() {
		return probablyPunctuation;
	}

	/** @return similarity of replaced comments; 0 for other kinds. */
	public int getSimilarityPercent() {
		return similarityPercent;
	}

	/**
	 * Get the cost of taking this edge.
	 *
	 * @return a positive cost; lower is preferred.
	 */
	public int getCost() {
		switch (type) {
		case UNCHANGED: {
			int cost = Math.min(MAX_DEPTH_PENALTY, depthDifference + 1);
			if (probablyPunctuation)
				cost += PUNCTUATION_PENALTY;
			return cost;
		}
		case ENTER_UNCHANGED_DELIMITER:
			return ENTER_UNCHANGED_COST
					+ Math.min(MAX_DEPTH_PENALTY, depthDifference);
		case NOVEL_ATOM_LEFT:
		case NOVEL_ATOM_RIGHT:
		case ENTER_NOVEL_DELIMITER_LEFT:
		case ENTER_NOVEL_DELIMITER_RIGHT:
			return NOVEL_COST;
		case ENTER_NOVEL_DELIMITER_BOTH:
			return NOVEL_BOTH_COST;
		case REPLACED:
			return REPLACED_COST + (100 - similarityPercent);
		default:
			throw new IllegalStateException();
		}
	}

	/** @return the same decision with the two sides exchanged. */
	public Edge swap() {
		switch (type) {
		case NOVEL_ATOM_LEFT:
			return NOVEL_ATOM_RIGHT;
		case NOVEL_ATOM_RIGHT:
			return NOVEL_ATOM_LEFT;
		case ENTER_NOVEL_DELIMITER_LEFT:
			return ENTER_NOVEL_DELIMITER_RIGHT;
		case ENTER_NOVEL_DELIMITER_RIGHT:
			return ENTER_NOVEL_DELIMITER_LEFT;
		default:
			return this;
		}
	}

	@Override
	public int hashCode() {
		return ((type.hashCode() * 31 + depthDifference) * 31
				+ similarityPercent) * 2 + (probablyPunctuation ? 1 : 0);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Edge) {
			Edge e = (Edge) o;
			return type == e.type && depthDifference == e.depthDifference
					&& probablyPunctuation == e.probablyPunctuation
					&& similarityPercent == e.similarityPercent;
		}
		return false;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		switch (type) {
		case UNCHANGED:
			return type + "(" + depthDifference
					+ (probablyPunctuation ? ",punct" : "") + ")";
		case ENTER_UNCHANGED_DELIMITER:
			return type + "(" + depthDifference + ")";
		case REPLACED:
			return type + "(" + similarityPercent + "%)";
		default:
			return type.toString();
		}
	}
}
