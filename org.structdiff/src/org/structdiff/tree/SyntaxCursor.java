/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.tree;

/**
 * An immutable position within a syntax tree.
 * <p>
 * A cursor either points at a node or sits just past the last node of a
 * sibling list (the "end" position of that list). Navigation never modifies
 * the cursor, it returns a new one.
 * <p>
 * Cursors are used as hash keys by the route search. Two cursors must be
 * {@code equals} exactly when they denote the same position of the same
 * tree, and {@code hashCode} must be consistent with that.
 */
public interface SyntaxCursor {
	/** @return the node at this position, or null at the end of a list. */
	SyntaxNode getNode();

	/** @return true if this cursor is past the last node of its list. */
	boolean isEnd();

	/** @return number of lists enclosing this position; 0 on the top level. */
	int getDepth();

	/**
	 * Move into the list at this position.
	 *
	 * @return cursor at the list's first child, or at its end if it is empty.
	 * @throws IllegalStateException
	 *             if the cursor is at the end or not on a list.
	 */
	SyntaxCursor firstChild();

	/**
	 * Move to the following sibling.
	 *
	 * @return cursor at the next node, or at the end of this list.
	 * @throws IllegalStateException
	 *             if the cursor is already at the end.
	 */
	SyntaxCursor nextSibling();

	/**
	 * Move to the enclosing list.
	 *
	 * @return cursor positioned on the list node containing this position.
	 * @throws IllegalStateException
	 *             if the cursor is on the top level.
	 */
	SyntaxCursor parent();
}
