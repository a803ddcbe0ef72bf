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

import org.structdiff.errors.DelimiterDepthException;

/**
 * Nesting state of the delimiters entered while walking two trees.
 * <p>
 * Conceptually a stack of levels. A new level starts whenever both sides
 * enter a matching list together ("both" depth). Within a level each side may
 * additionally have entered lists on its own; those private counts must drop
 * back to zero before the level itself can be left.
 * <p>
 * The private counts are packed into fixed 8 bit slots, one slot per "both"
 * level, so a stack is a handful of primitives that is cheap to copy, compare
 * and hash. The price is a hard limit of {@value #MAX_BOTH_DEPTH} jointly
 * entered levels and {@value #MAX_SIDE_DEPTH} private levels per side within
 * any one of them. Exceeding either limit throws
 * {@link DelimiterDepthException}.
 * <p>
 * Instances are immutable; every operation returns a new stack.
 */
public final class DelimiterStack {
	/** Largest number of lists both sides may have entered together. */
	public static final int MAX_BOTH_DEPTH = 15;

	/** Largest number of lists one side may enter alone within a level. */
	public static final int MAX_SIDE_DEPTH = 255;

	private static final int SLOT_BITS = 8;

	private static final int SLOTS_PER_WORD = Long.SIZE / SLOT_BITS;

	private static final long SLOT_MASK = (1L << SLOT_BITS) - 1;

	/** Stack with no delimiters entered on either side. */
	public static final DelimiterStack EMPTY = new DelimiterStack(0, 0, 0, 0,
			0);

	/** Left side private counts for levels 0-7 and 8-15. */
	private final long leftLow;

	private final long leftHigh;

	private final long rightLow;

	private final long rightHigh;

	private final int both;

	private DelimiterStack(long leftLow, long leftHigh, long rightLow,
			long rightHigh, int both) {
		this.leftLow = leftLow;
		this.leftHigh = leftHigh;
		this.rightLow = rightLow;
		this.rightHigh = rightHigh;
		this.both = both;
	}

	/**
	 * Enter a list on both sides together.
	 *
	 * @return stack with a new, empty level on top.
	 * @throws DelimiterDepthException
	 *             if {@link #MAX_BOTH_DEPTH} levels are already open.
	 */
	public DelimiterStack pushBoth() {
		if (both >= MAX_BOTH_DEPTH)
			throw new DelimiterDepthException(MAX_BOTH_DEPTH);
		// Slots above the current level are always zero.
		return new DelimiterStack(leftLow, leftHigh, rightLow, rightHigh,
				both + 1);
	}

	/**
	 * Enter a list on the left side only.
	 *
	 * @return stack with the current level's left count raised by one.
	 * @throws DelimiterDepthException
	 *             if the count is already {@link #MAX_SIDE_DEPTH}.
	 */
	public DelimiterStack pushLeft() {
		int n = slot(leftLow, leftHigh, both);
		if (n >= MAX_SIDE_DEPTH)
			throw new DelimiterDepthException(MAX_SIDE_DEPTH);
		return new DelimiterStack(setLow(leftLow, both, n + 1),
				setHigh(leftHigh, both, n + 1), rightLow, rightHigh, both);
	}

	/**
	 * Enter a list on the right side only.
	 *
	 * @return stack with the current level's right count raised by one.
	 * @throws DelimiterDepthException
	 *             if the count is already {@link #MAX_SIDE_DEPTH}.
	 */
	public DelimiterStack pushRight() {
		int n = slot(rightLow, rightHigh, both);
		if (n >= MAX_SIDE_DEPTH)
			throw new DelimiterDepthException(MAX_SIDE_DEPTH);
		return new DelimiterStack(leftLow, leftHigh,
				setLow(rightLow, both, n + 1), setHigh(rightHigh, both, n + 1),
				both);
	}

	/**
	 * Leave a list entered by the left side alone.
	 *
	 * @return the new stack, or null if the current level has no private
	 *         left list open.
	 */
	public DelimiterStack popLeft() {
		int n = slot(leftLow, leftHigh, both);
		if (n == 0)
			return null;
		return new DelimiterStack(setLow(leftLow, both, n - 1),
				setHigh(leftHigh, both, n - 1), rightLow, rightHigh, both);
	}

	/**
	 * Leave a list entered by the right side alone.
	 *
	 * @return the new stack, or null if the current level has no private
	 *         right list open.
	 */
	public DelimiterStack popRight() {
		int n = slot(rightLow, rightHigh, both);
		if (n == 0)
			return null;
		return new DelimiterStack(leftLow, leftHigh,
				setLow(rightLow, both, n - 1), setHigh(rightHigh, both, n - 1),
				both);
	}

	/**
	 * Leave a list entered by both sides together.
	 *
	 * @return the new stack, or null if no joint level is open or either
	 *         side still has a private list open within it.
	 */
	public DelimiterStack popBoth() {
		if (!canPopBoth())
			return null;
		return new DelimiterStack(leftLow, leftHigh, rightLow, rightHigh,
				both - 1);
	}

	/** @return true if {@link #popLeft()} would succeed. */
	public boolean canPopLeft() {
		return slot(leftLow, leftHigh, both) != 0;
	}

	/** @return true if {@link #popRight()} would succeed. */
	public boolean canPopRight() {
		return slot(rightLow, rightHigh, both) != 0;
	}

	/** @return true if {@link #popBoth()} would succeed. */
	public boolean canPopBoth() {
		return both > 0 && !canPopLeft() && !canPopRight();
	}

	/** @return true if nothing is open on either side. */
	public boolean isEmpty() {
		return both == 0 && !canPopLeft() && !canPopRight();
	}

	/** @return number of levels entered by both sides together. */
	public int getBothDepth() {
		return both;
	}

	/** @return number of lists the left side entered alone at this level. */
	public int getLeftDepth() {
		return slot(leftLow, leftHigh, both);
	}

	/** @return number of lists the right side entered alone at this level. */
	public int getRightDepth() {
		return slot(rightLow, rightHigh, both);
	}

	private static int slot(long low, long high, int level) {
		if (level < SLOTS_PER_WORD)
			return (int) ((low >>> (level * SLOT_BITS)) & SLOT_MASK);
		return (int) ((high >>> ((level - SLOTS_PER_WORD) * SLOT_BITS))
				& SLOT_MASK);
	}

	private static long setLow(long low, int level, int value) {
		if (level >= SLOTS_PER_WORD)
			return low;
		int shift = level * SLOT_BITS;
		return (low & ~(SLOT_MASK << shift)) | ((long) value << shift);
	}

	private static long setHigh(long high, int level, int value) {
		if (level < SLOTS_PER_WORD)
			return high;
		int shift = (level - SLOTS_PER_WORD) * SLOT_BITS;
		return (high & ~(SLOT_MASK << shift)) | ((long) value << shift);
	}

	@Override
	public int hashCode() {
		return Long.hashCode(leftLow ^ (leftHigh * 31)) * 31
				+ Long.hashCode(rightLow ^ (rightHigh * 31)) + both;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof DelimiterStack) {
			DelimiterStack s = (DelimiterStack) o;
			return leftLow == s.leftLow && leftHigh == s.leftHigh
					&& rightLow == s.rightLow && rightHigh == s.rightHigh
					&& both == s.both;
		}
		return false;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		StringBuilder r = new StringBuilder("DelimiterStack[");
		for (int level = 0; level <= both; level++) {
			if (level > 0)
				r.append(" | ");
			r.append(slot(leftLow, leftHigh, level)).append('/')
					.append(slot(rightLow, rightHigh, level));
		}
		return r.append(']').toString();
	}
}
