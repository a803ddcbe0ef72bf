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

import org.structdiff.tree.SyntaxCursor;

/**
 * A point in the search space: a position in each tree plus the delimiter
 * nesting state that led there.
 * <p>
 * Equality deliberately ignores most of the delimiter stack. Two vertices
 * are equal if their cursors are equal and they agree on whether either
 * side can currently leave a privately entered list. Vertices that differ
 * only in how the enclosing lists were entered are merged, which keeps the
 * number of distinct vertices proportional to the product of the tree sizes.
 */
public final class Vertex {
	private final SyntaxCursor left;

	private final SyntaxCursor right;

	private final DelimiterStack delimiters;

	private final boolean canPopEither;

	private final int hash;

	/**
	 * Create a vertex.
	 *
	 * @param left
	 *            position in the left (old) tree.
	 * @param right
	 *            position in the right (new) tree.
	 * @param delimiters
	 *            lists entered so far.
	 */
	public Vertex(SyntaxCursor left, SyntaxCursor right,
			DelimiterStack delimiters) {
		if (left == null || right == null || delimiters == null)
			throw new NullPointerException();
		this.left = left;
		this.right = right;
		this.delimiters = delimiters;
		this.canPopEither = delimiters.canPopLeft()
				|| delimiters.canPopRight();
		this.hash = (left.hashCode() * 31 + right.hashCode()) * 2
				+ (canPopEither ? 1 : 0);
	}

	/** @return position in the left tree. */
	public SyntaxCursor getLeft() {
		return left;
	}

	/** @return position in the right tree. */
	public SyntaxCursor getRight() {
		return right;
	}

	/** @return lists entered so far. */
	public DelimiterStack getDelimiters() {
		return delimiters;
	}

	/**
	 * Check if this vertex ends the search.
	 *
	 * @return true if both trees are fully consumed and no list is open.
	 */
	public boolean isTerminal() {
		return left.isEnd() && right.isEnd() && delimiters.isEmpty();
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o instanceof Vertex) {
			Vertex v = (Vertex) o;
			return hash == v.hash && canPopEither == v.canPopEither
					&& left.equals(v.left) && right.equals(v.right);
		}
		return false;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "Vertex[" + left + ", " + right + ", " + delimiters + "]";
	}
}
