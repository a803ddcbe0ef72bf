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

import java.util.Objects;
import java.util.function.BiConsumer;

import org.structdiff.tree.SyntaxCursor;
import org.structdiff.tree.SyntaxHint;
import org.structdiff.tree.SyntaxNode;

/**
 * Generates the outgoing edges of a vertex.
 * <p>
 * The graph searched by {@link StructuralDiff} is never materialized; this
 * class computes each vertex's successors on demand. Every successor is put
 * into canonical form by {@link #popExhausted(SyntaxCursor, SyntaxCursor,
 * DelimiterStack)} before it is reported, so no vertex ever sits at the end
 * of a list it could leave.
 */
final class Neighbours {
	private Neighbours() {
		// Static utility.
	}

	/**
	 * Report every legal move out of {@code v}.
	 * <p>
	 * At most one of match, replace or enter-both is reported for the pair
	 * of nodes under the cursors. Independently, the left node and the right
	 * node may each be consumed on their own as novel.
	 *
	 * @param v
	 *            the vertex to expand.
	 * @param sink
	 *            receives each edge with the vertex it leads to, in a fixed
	 *            order.
	 * @throws org.structdiff.errors.DelimiterDepthException
	 *             if entering a list would overflow the delimiter stack.
	 */
	static void forEach(Vertex v, BiConsumer<Edge, Vertex> sink) {
		SyntaxCursor lc = v.getLeft();
		SyntaxCursor rc = v.getRight();
		SyntaxNode l = lc.getNode();
		SyntaxNode r = rc.getNode();
		DelimiterStack stack = v.getDelimiters();

		if (l != null && r != null) {
			int depthDifference = Math.abs(lc.getDepth() - rc.getDepth());
			if (sameSubtree(lc, rc)) {
				sink.accept(Edge.unchanged(depthDifference,
						isPunctuation(l)),
						popExhausted(lc.nextSibling(), rc.nextSibling(),
								stack));
			} else if (isComment(l) && isComment(r)) {
				int similarity = CommentSimilarity.percent(
						l.getHint().getText(), r.getHint().getText());
				sink.accept(Edge.replaced(similarity),
						popExhausted(lc.nextSibling(), rc.nextSibling(),
								stack));
			} else if (l.isList() && r.isList()) {
				if (sameDelimiters(l, r)) {
					sink.accept(Edge.enterUnchangedDelimiter(depthDifference),
							popExhausted(lc.firstChild(), rc.firstChild(),
									stack.pushBoth()));
				} else {
					sink.accept(Edge.ENTER_NOVEL_DELIMITER_BOTH,
							popExhausted(lc.firstChild(), rc.firstChild(),
									stack.pushLeft().pushRight()));
				}
			}
		}

		if (l != null) {
			if (l.isAtom())
				sink.accept(Edge.NOVEL_ATOM_LEFT,
						popExhausted(lc.nextSibling(), rc, stack));
			else
				sink.accept(Edge.ENTER_NOVEL_DELIMITER_LEFT,
						popExhausted(lc.firstChild(), rc, stack.pushLeft()));
		}

		if (r != null) {
			if (r.isAtom())
				sink.accept(Edge.NOVEL_ATOM_RIGHT,
						popExhausted(lc, rc.nextSibling(), stack));
			else
				sink.accept(Edge.ENTER_NOVEL_DELIMITER_RIGHT,
						popExhausted(lc, rc.firstChild(), stack.pushRight()));
		}
	}

	/**
	 * Leave every list whose children are exhausted.
	 * <p>
	 * A side at the end of a privately entered list leaves it on its own. A
	 * jointly entered list is only left once both sides reached its end and
	 * neither has a private list open inside it. Repeats until nothing
	 * changes.
	 *
	 * @return the canonical vertex for the given state.
	 */
	static Vertex popExhausted(SyntaxCursor left, SyntaxCursor right,
			DelimiterStack stack) {
		boolean changed;
		do {
			changed = false;

			while (left.isEnd() && stack.canPopLeft()) {
				stack = stack.popLeft();
				left = left.parent().nextSibling();
				changed = true;
			}

			while (right.isEnd() && stack.canPopRight()) {
				stack = stack.popRight();
				right = right.parent().nextSibling();
				changed = true;
			}

			if (left.isEnd() && right.isEnd() && stack.canPopBoth()) {
				stack = stack.popBoth();
				left = left.parent().nextSibling();
				right = right.parent().nextSibling();
				changed = true;
			}
		} while (changed);
		return new Vertex(left, right, stack);
	}

	/**
	 * Compare the subtrees under two cursors.
	 * <p>
	 * The structural hash rejects most pairs cheaply. Equal hashes are
	 * confirmed node by node, so a hash collision is never reported as an
	 * unchanged subtree.
	 */
	static boolean sameSubtree(SyntaxCursor lc, SyntaxCursor rc) {
		SyntaxNode l = lc.getNode();
		SyntaxNode r = rc.getNode();
		if (l.getStructuralHash() != r.getStructuralHash())
			return false;
		if (l.isAtom() || r.isAtom())
			return l.isAtom() && r.isAtom() && hintKind(l) == hintKind(r)
					&& l.getText().equals(r.getText());
		if (l.hasDelimiters() != r.hasDelimiters()
				|| !Objects.equals(l.getOpenDelimiter(), r.getOpenDelimiter())
				|| !Objects.equals(l.getCloseDelimiter(),
						r.getCloseDelimiter()))
			return false;
		SyntaxCursor a = lc.firstChild();
		SyntaxCursor b = rc.firstChild();
		for (; !a.isEnd() && !b.isEnd(); a = a.nextSibling(), b = b
				.nextSibling()) {
			if (!sameSubtree(a, b))
				return false;
		}
		return a.isEnd() && b.isEnd();
	}

	private static SyntaxHint.Kind hintKind(SyntaxNode n) {
		SyntaxHint h = n.getHint();
		return h != null ? h.getKind() : null;
	}

	private static boolean isPunctuation(SyntaxNode n) {
		SyntaxHint h = n.getHint();
		return h != null && h.isPunctuation();
	}

	private static boolean isComment(SyntaxNode n) {
		SyntaxHint h = n.getHint();
		return n.isAtom() && h != null && h.isComment();
	}

	private static boolean sameDelimiters(SyntaxNode l, SyntaxNode r) {
		return l.hasDelimiters() && r.hasDelimiters()
				&& Objects.equals(l.getOpenDelimiter(), r.getOpenDelimiter())
				&& Objects.equals(l.getCloseDelimiter(),
						r.getCloseDelimiter());
	}
}
