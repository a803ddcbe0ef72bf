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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.structdiff.junit.TreeReader;
import org.structdiff.tree.SyntaxCursor;
import org.structdiff.tree.SyntaxTree;

public class VertexTest {
	private final SyntaxTree left = TreeReader.read("a (b)");

	private final SyntaxTree right = TreeReader.read("a (b)");

	@Test
	void testEqualCursorsAndStack() {
		Vertex a = new Vertex(left.cursor(), right.cursor(),
				DelimiterStack.EMPTY);
		Vertex b = new Vertex(left.cursor(), right.cursor(),
				DelimiterStack.EMPTY);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	@Test
	void testCursorsFromDifferentTreesDiffer() {
		SyntaxTree other = TreeReader.read("a (b)");
		Vertex a = new Vertex(left.cursor(), right.cursor(),
				DelimiterStack.EMPTY);
		Vertex b = new Vertex(other.cursor(), right.cursor(),
				DelimiterStack.EMPTY);
		assertNotEquals(a, b);
	}

	@Test
	void testDifferentPositionsDiffer() {
		Vertex a = new Vertex(left.cursor(), right.cursor(),
				DelimiterStack.EMPTY);
		Vertex b = new Vertex(left.cursor().nextSibling(), right.cursor(),
				DelimiterStack.EMPTY);
		assertNotEquals(a, b);
	}

	@Test
	void testStacksWithSamePoppabilityMerge() {
		SyntaxCursor l = left.cursor().nextSibling().firstChild();
		SyntaxCursor r = right.cursor().nextSibling().firstChild();
		Vertex joint = new Vertex(l, r, DelimiterStack.EMPTY.pushBoth());
		Vertex nested = new Vertex(l, r,
				DelimiterStack.EMPTY.pushBoth().pushBoth());
		assertEquals(joint, nested);
		assertEquals(joint.hashCode(), nested.hashCode());

		Vertex leftOnly = new Vertex(l, r, DelimiterStack.EMPTY.pushLeft());
		Vertex rightOnly = new Vertex(l, r, DelimiterStack.EMPTY.pushRight());
		assertEquals(leftOnly, rightOnly);
		assertNotEquals(joint, leftOnly);
	}

	@Test
	void testTerminal() {
		SyntaxCursor lEnd = left.cursor().nextSibling().nextSibling();
		SyntaxCursor rEnd = right.cursor().nextSibling().nextSibling();
		assertTrue(new Vertex(lEnd, rEnd, DelimiterStack.EMPTY).isTerminal());
		assertFalse(new Vertex(lEnd, rEnd, DelimiterStack.EMPTY.pushBoth())
				.isTerminal());
		assertFalse(new Vertex(lEnd, right.cursor(), DelimiterStack.EMPTY)
				.isTerminal());
		assertTrue(new Vertex(TreeReader.read("").cursor(),
				TreeReader.read("").cursor(), DelimiterStack.EMPTY)
						.isTerminal());
	}

	@Test
	void testNullsRejected() {
		assertThrows(NullPointerException.class,
				() -> new Vertex(null, right.cursor(), DelimiterStack.EMPTY));
		assertThrows(NullPointerException.class,
				() -> new Vertex(left.cursor(), right.cursor(), null));
	}
}
