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
 * A byte range of one side, classified by a route.
 * <p>
 * Ranges use 0 based offsets, {@code [start, end)}.
 */
public final class ChangeRegion {
	/** Classification of a region */
	public static enum Kind {
		/** Present with the same structure on both sides. */
		UNCHANGED,

		/** Paired with a different node on the other side. */
		REPLACED,

		/** Only present on this side. */
		NOVEL;
	}

	private final int start;

	private final int end;

	private final Kind kind;

	/**
	 * Create a region.
	 *
	 * @param start
	 *            offset of the first byte.
	 * @param end
	 *            offset one past the last byte; must be &gt;= start.
	 * @param kind
	 *            the classification.
	 */
	public ChangeRegion(int start, int end, Kind kind) {
		if (end < start)
			throw new IllegalArgumentException(start + ">" + end); //$NON-NLS-1$
		this.start = start;
		this.end = end;
		this.kind = kind;
	}

	/** @return offset of the first byte. */
	public int getStart() {
		return start;
	}

	/** @return offset one past the last byte. */
	public int getEnd() {
		return end;
	}

	/** @return the classification. */
	public Kind getKind() {
		return kind;
	}

	@Override
	public int hashCode() {
		return (start * 31 + end) * 31 + kind.hashCode();
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof ChangeRegion) {
			ChangeRegion r = (ChangeRegion) o;
			return start == r.start && end == r.end && kind == r.kind;
		}
		return false;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return kind + "(" + start + "-" + end + ")";
	}
}
