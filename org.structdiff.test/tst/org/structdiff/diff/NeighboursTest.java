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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.structdiff.diff.Edge.Type.ENTER_NOVEL_DELIMITER_BOTH;
import static org.structdiff.diff.Edge.Type.ENTER_NOVEL_DELIMITER_LEFT;
import static org.structdiff.diff.Edge.Type.ENTER_NOVEL_DELIMITER_RIGHT;
import static org.structdiff.diff.Edge.Type.ENTER_UNCHANGED_DELIMITER;
import static org.structdiff.diff.Edge.Type.NOVEL_ATOM_LEFT;
import static org.structdiff.diff.Edge.Type.NOVEL_ATOM_RIGHT;
import static org.structdiff.diff.Edge.Type.REPLACED;
import static org.structdiff.diff.Edge.Type.UNCHANGED;
import static org.structdiff.junit.RouteAssert.assertFound;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.structdiff.errors.DelimiterDepthException;
import org.structdiff.junit.TreeReader;
import org.structdiff.tree.SyntaxCursor;
import org.structdiff.tree.SyntaxHint;
import org.structdiff.tree.SyntaxNode;

public class NeighboursTest {
	private final List<Edge> edges = new ArrayList<>();

	private final List<Vertex> targets = new ArrayList<>();

	private static Vertex start(String a, String b) {
		return new Vertex(TreeReader.read(a).cursor(),
				TreeReader.read(b).cursor(), DelimiterStack.EMPTY);
	}

	private List<Edge.Type> expand(Vertex v) {
		edges.clear();
		targets.clear();
		Neighbours.forEach(v, (e, next) -> {
			edges.add(e);
			targets.add(next);
		});
		List<Edge.Type> r = new ArrayList<>();
		for (Edge e : edges)
			r.add(e.getType());
		return r;
	}

	private Vertex follow(Vertex v, Edge.Type type) {
		expand(v);
		for (int i = 0; i < edges.size(); i++)
			if (edges.get(i).getType() == type)
				return targets.get(i);
		throw new AssertionError(type + " not offered by " + v);
	}

	@Test
	void testTerminalHasNoEdges() {
		assertEquals(Collections.emptyList(), expand(start("", "")));
	}

	@Test
	void testIdenticalAtoms() {
		assertEquals(Arrays.asList(UNCHANGED, NOVEL_ATOM_LEFT,
				NOVEL_ATOM_RIGHT), expand(start("a", "a")));
		assertTrue(targets.get(0).isTerminal());
		assertFalse(edges.get(0).isProbablyPunctuation());
	}

	@Test
	void testIdenticalPunctuation() {
		expand(start(";", ";"));
		assertTrue(edges.get(0).isProbablyPunctuation());
		assertEquals(201, edges.get(0).getCost());
	}

	@Test
	void testDifferentAtomsOnlyNovel() {
		assertEquals(Arrays.asList(NOVEL_ATOM_LEFT, NOVEL_ATOM_RIGHT),
				expand(start("a", "b")));
	}

	@Test
	void testDifferentComments() {
		assertEquals(Arrays.asList(REPLACED, NOVEL_ATOM_LEFT,
				NOVEL_ATOM_RIGHT), expand(start("// abc", "// abd")));
		assertEquals(CommentSimilarity.percent("// abc", "// abd"),
				edges.get(0).getSimilarityPercent());
	}

	@Test
	void testCommentAgainstAtom() {
		assertEquals(Arrays.asList(NOVEL_ATOM_LEFT, NOVEL_ATOM_RIGHT),
				expand(start("// abc", "abc")));
	}

	@Test
	void testListsWithSameDelimiters() {
		assertEquals(Arrays.asList(ENTER_UNCHANGED_DELIMITER,
				ENTER_NOVEL_DELIMITER_LEFT, ENTER_NOVEL_DELIMITER_RIGHT),
				expand(start("(a)", "(b)")));
		DelimiterStack both = targets.get(0).getDelimiters();
		assertEquals(1, both.getBothDepth());
		assertEquals(0, both.getLeftDepth());
		assertEquals(0, both.getRightDepth());
		assertEquals(1, targets.get(0).getLeft().getDepth());
		assertEquals(1, targets.get(1).getDelimiters().getLeftDepth());
		assertEquals(1, targets.get(2).getDelimiters().getRightDepth());
	}

	@Test
	void testListsWithDifferentDelimiters() {
		assertEquals(Arrays.asList(ENTER_NOVEL_DELIMITER_BOTH,
				ENTER_NOVEL_DELIMITER_LEFT, ENTER_NOVEL_DELIMITER_RIGHT),
				expand(start("(a)", "[a]")));
		DelimiterStack s = targets.get(0).getDelimiters();
		assertEquals(0, s.getBothDepth());
		assertEquals(1, s.getLeftDepth());
		assertEquals(1, s.getRightDepth());
	}

	@Test
	void testListAgainstAtom() {
		assertEquals(Arrays.asList(ENTER_NOVEL_DELIMITER_LEFT,
				NOVEL_ATOM_RIGHT), expand(start("(a)", "a")));
	}

	@Test
	void testJointListLeftWhenBothExhausted() {
		Vertex inside = follow(start("(a)", "(a b)"),
				ENTER_UNCHANGED_DELIMITER);
		Vertex afterA = follow(inside, UNCHANGED);
		// Right still has b, so the joint list stays open.
		assertTrue(afterA.getLeft().isEnd());
		assertFalse(afterA.getRight().isEnd());
		assertEquals(1, afterA.getDelimiters().getBothDepth());

		Vertex done = follow(afterA, NOVEL_ATOM_RIGHT);
		assertTrue(done.isTerminal());
	}

	@Test
	void testPrivateListLeftOnItsOwn() {
		Vertex inside = follow(start("(a)", "a"), ENTER_NOVEL_DELIMITER_LEFT);
		assertEquals(1, inside.getDelimiters().getLeftDepth());
		Vertex done = follow(inside, UNCHANGED);
		assertEquals(1, edges.get(0).getDepthDifference());
		assertTrue(done.isTerminal());
	}

	@Test
	void testEmptyListLeftImmediately() {
		Vertex v = follow(start("()", "x"), ENTER_NOVEL_DELIMITER_LEFT);
		assertTrue(v.getLeft().isEnd());
		assertTrue(v.getDelimiters().isEmpty());
		assertEquals("x", v.getRight().getNode().getText());
	}

	@Test
	void testPopExhaustedRepeats() {
		// Left at the end of two privately entered lists.
		SyntaxCursor left = TreeReader.read("((a)) b").cursor().firstChild()
				.firstChild().nextSibling();
		SyntaxCursor right = TreeReader.read("b").cursor();
		DelimiterStack s = DelimiterStack.EMPTY.pushLeft().pushLeft();
		Vertex v = Neighbours.popExhausted(left, right, s);
		assertTrue(v.getDelimiters().isEmpty());
		assertEquals(0, v.getLeft().getDepth());
		assertEquals("b", v.getLeft().getNode().getText());
	}

	@Test
	void testOverflowPropagates() {
		DelimiterStack full = DelimiterStack.EMPTY;
		for (int i = 0; i < DelimiterStack.MAX_BOTH_DEPTH; i++)
			full = full.pushBoth();
		Vertex v = new Vertex(TreeReader.read("(a)").cursor(),
				TreeReader.read("(b)").cursor(), full);
		assertThrows(DelimiterDepthException.class, () -> expand(v));
	}

	@Test
	void testHashCollisionAtomsNotUnchanged() {
		assertEquals(Arrays.asList(NOVEL_ATOM_LEFT, NOVEL_ATOM_RIGHT),
				expand(colliding("a", "b")));
		assertEquals(Arrays.asList(UNCHANGED, NOVEL_ATOM_LEFT,
				NOVEL_ATOM_RIGHT), expand(colliding("a", "a")));
	}

	@Test
	void testHashCollisionListsNotUnchanged() {
		assertEquals(ENTER_UNCHANGED_DELIMITER,
				expand(colliding("(a b)", "(a c)")).get(0));
		assertEquals(ENTER_UNCHANGED_DELIMITER,
				expand(colliding("(a b)", "(a b c)")).get(0));
		assertEquals(ENTER_NOVEL_DELIMITER_BOTH,
				expand(colliding("(a)", "[a]")).get(0));
		assertEquals(UNCHANGED, expand(colliding("(a (b))", "(a (b))"))
				.get(0));
	}

	@Test
	void testHashCollisionSearchKeepsCost() {
		Vertex v = colliding("f(a b)", "f(a x b)");
		Route r = assertFound(new StructuralDiff().diff(v.getLeft(),
				v.getRight(), 10_000));
		assertEquals(403, r.getCost());
	}

	private static Vertex colliding(String a, String b) {
		return new Vertex(new CollidingCursor(TreeReader.read(a).cursor()),
				new CollidingCursor(TreeReader.read(b).cursor()),
				DelimiterStack.EMPTY);
	}

	/** Reports the same structural hash for every node. */
	private static final class CollidingCursor implements SyntaxCursor {
		private final SyntaxCursor c;

		CollidingCursor(SyntaxCursor c) {
			this.c = c;
		}

		@Override
		public SyntaxNode getNode() {
			SyntaxNode n = c.getNode();
			return n != null ? new CollidingNode(n) : null;
		}

		@Override
		public boolean isEnd() {
			return c.isEnd();
		}

		@Override
		public int getDepth() {
			return c.getDepth();
		}

		@Override
		public SyntaxCursor firstChild() {
			return new CollidingCursor(c.firstChild());
		}

		@Override
		public SyntaxCursor nextSibling() {
			return new CollidingCursor(c.nextSibling());
		}

		@Override
		public SyntaxCursor parent() {
			return new CollidingCursor(c.parent());
		}

		@Override
		public int hashCode() {
			return c.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof CollidingCursor
					&& c.equals(((CollidingCursor) o).c);
		}
	}

	private static final class CollidingNode implements SyntaxNode {
		private final SyntaxNode n;

		CollidingNode(SyntaxNode n) {
			this.n = n;
		}

		@Override
		public boolean isAtom() {
			return n.isAtom();
		}

		@Override
		public boolean isList() {
			return n.isList();
		}

		@Override
		public long getStructuralHash() {
			return 42;
		}

		@Override
		public SyntaxHint getHint() {
			return n.getHint();
		}

		@Override
		public boolean hasDelimiters() {
			return n.hasDelimiters();
		}

		@Override
		public String getOpenDelimiter() {
			return n.getOpenDelimiter();
		}

		@Override
		public String getCloseDelimiter() {
			return n.getCloseDelimiter();
		}

		@Override
		public String getText() {
			return n.getText();
		}

		@Override
		public int getStartOffset() {
			return n.getStartOffset();
		}

		@Override
		public int getEndOffset() {
			return n.getEndOffset();
		}
	}
}
