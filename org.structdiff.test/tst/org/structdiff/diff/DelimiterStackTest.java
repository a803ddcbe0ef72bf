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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.structdiff.errors.DelimiterDepthException;

public class DelimiterStackTest {
	@Test
	void testEmpty() {
		DelimiterStack s = DelimiterStack.EMPTY;
		assertTrue(s.isEmpty());
		assertFalse(s.canPopLeft());
		assertFalse(s.canPopRight());
		assertFalse(s.canPopBoth());
		assertNull(s.popLeft());
		assertNull(s.popRight());
		assertNull(s.popBoth());
		assertEquals("DelimiterStack[0/0]", s.toString());
	}

	@Test
	void testPushPopLeft() {
		DelimiterStack s = DelimiterStack.EMPTY.pushLeft();
		assertFalse(s.isEmpty());
		assertTrue(s.canPopLeft());
		assertFalse(s.canPopRight());
		assertFalse(s.canPopBoth());
		assertEquals(1, s.getLeftDepth());
		assertEquals(DelimiterStack.EMPTY, s.popLeft());
		assertNull(s.popRight());
	}

	@Test
	void testPushPopRight() {
		DelimiterStack s = DelimiterStack.EMPTY.pushRight().pushRight();
		assertEquals(2, s.getRightDepth());
		assertEquals(0, s.getLeftDepth());
		assertEquals(DelimiterStack.EMPTY, s.popRight().popRight());
	}

	@Test
	void testPushPopBoth() {
		DelimiterStack s = DelimiterStack.EMPTY.pushBoth();
		assertEquals(1, s.getBothDepth());
		assertTrue(s.canPopBoth());
		assertFalse(s.isEmpty());
		assertEquals(DelimiterStack.EMPTY, s.popBoth());
	}

	@Test
	void testPrivateListsBlockJointPop() {
		DelimiterStack s = DelimiterStack.EMPTY.pushBoth().pushLeft();
		assertFalse(s.canPopBoth());
		assertNull(s.popBoth());
		assertTrue(s.popLeft().canPopBoth());

		s = DelimiterStack.EMPTY.pushBoth().pushRight();
		assertNull(s.popBoth());
	}

	@Test
	void testLevelsKeepTheirOwnCounts() {
		DelimiterStack s = DelimiterStack.EMPTY.pushLeft().pushLeft()
				.pushRight().pushBoth();
		// A fresh joint level hides the counts of the one below.
		assertEquals(0, s.getLeftDepth());
		assertEquals(0, s.getRightDepth());
		assertFalse(s.canPopLeft());
		assertEquals("DelimiterStack[2/1 | 0/0]", s.toString());

		DelimiterStack back = s.pushRight().popRight().popBoth();
		assertEquals(2, back.getLeftDepth());
		assertEquals(1, back.getRightDepth());
	}

	@Test
	void testUpperWordSlots() {
		DelimiterStack s = DelimiterStack.EMPTY;
		for (int i = 0; i < 10; i++)
			s = s.pushBoth();
		s = s.pushLeft().pushLeft().pushLeft().pushRight();
		assertEquals(10, s.getBothDepth());
		assertEquals(3, s.getLeftDepth());
		assertEquals(1, s.getRightDepth());

		DelimiterStack lower = s.popLeft().popLeft().popLeft().popRight()
				.popBoth();
		assertEquals(9, lower.getBothDepth());
		assertEquals(0, lower.getLeftDepth());
	}

	@Test
	void testBothDepthLimit() {
		DelimiterStack s = DelimiterStack.EMPTY;
		for (int i = 0; i < DelimiterStack.MAX_BOTH_DEPTH; i++)
			s = s.pushBoth();
		assertEquals(DelimiterStack.MAX_BOTH_DEPTH, s.getBothDepth());
		DelimiterStack full = s;
		DelimiterDepthException e = assertThrows(
				DelimiterDepthException.class, () -> full.pushBoth());
		assertEquals(DelimiterStack.MAX_BOTH_DEPTH, e.getLimit());
		// The deepest level still tracks private lists.
		assertEquals(1, full.pushLeft().getLeftDepth());
	}

	@Test
	void testSideDepthLimit() {
		DelimiterStack s = DelimiterStack.EMPTY.pushBoth();
		for (int i = 0; i < DelimiterStack.MAX_SIDE_DEPTH; i++)
			s = s.pushLeft();
		assertEquals(DelimiterStack.MAX_SIDE_DEPTH, s.getLeftDepth());
		DelimiterStack full = s;
		assertThrows(DelimiterDepthException.class, () -> full.pushLeft());
		// Saturating one slot leaves its neighbours alone.
		assertEquals(0, full.getRightDepth());
		assertEquals(DelimiterStack.MAX_SIDE_DEPTH - 1,
				full.popLeft().getLeftDepth());

		DelimiterStack r = DelimiterStack.EMPTY;
		for (int i = 0; i < DelimiterStack.MAX_SIDE_DEPTH; i++)
			r = r.pushRight();
		DelimiterStack fullRight = r;
		assertThrows(DelimiterDepthException.class,
				() -> fullRight.pushRight());
	}

	@Test
	void testEqualsAndHashCode() {
		DelimiterStack a = DelimiterStack.EMPTY.pushBoth().pushLeft();
		DelimiterStack b = DelimiterStack.EMPTY.pushBoth().pushLeft();
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, DelimiterStack.EMPTY.pushBoth().pushRight());
		assertNotEquals(a, DelimiterStack.EMPTY.pushLeft());
		assertEquals(DelimiterStack.EMPTY, a.popLeft().popBoth());
	}
}
