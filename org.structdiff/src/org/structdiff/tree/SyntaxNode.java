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
 * A node of a parsed syntax tree, as seen by the structural diff.
 * <p>
 * A node is either an atom (a token without children) or a list (a possibly
 * delimited sequence of child nodes). Implementations must be immutable for
 * the duration of a comparison.
 */
public interface SyntaxNode {
	/** @return true if this node is a token without children. */
	boolean isAtom();

	/** @return true if this node is a sequence of child nodes. */
	boolean isList();

	/**
	 * Get the structural hash of this node.
	 * <p>
	 * Nodes with different hashes are different subtrees. Equal hashes are
	 * only a candidate match and are confirmed by comparing the subtrees.
	 * The hash covers the node kind, atom texts and delimiters of the whole
	 * subtree, but not whitespace or offsets, so re-indented code hashes the
	 * same.
	 *
	 * @return the structural hash.
	 */
	long getStructuralHash();

	/** @return the grammar's classification of this atom, or null. */
	SyntaxHint getHint();

	/** @return true if this list is bounded by open and close tokens. */
	boolean hasDelimiters();

	/** @return the opening delimiter of this list, or null if it has none. */
	String getOpenDelimiter();

	/** @return the closing delimiter of this list, or null if it has none. */
	String getCloseDelimiter();

	/** @return the token text of this atom; null for lists. */
	String getText();

	/** @return offset of the first byte of this node in its source. */
	int getStartOffset();

	/** @return offset one past the last byte of this node in its source. */
	int getEndOffset();
}
