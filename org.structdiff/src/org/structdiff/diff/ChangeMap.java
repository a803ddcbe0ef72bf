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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.structdiff.diff.ChangeRegion.Kind;
import org.structdiff.tree.SyntaxNode;

/**
 * Per-side classification of the byte ranges a route touched.
 * <p>
 * This is the view a renderer needs: for each side, which ranges are
 * unchanged, which were replaced and which are novel. Matched subtrees are
 * reported as a single range; for entered lists only the delimiters are
 * reported, their children get ranges of their own. Undelimited lists
 * contribute no range of their own.
 */
public final class ChangeMap {
	private static final Comparator<ChangeRegion> BY_START = Comparator
			.comparingInt(ChangeRegion::getStart)
			.thenComparingInt(ChangeRegion::getEnd);

	/**
	 * Classify the nodes visited by a route.
	 *
	 * @param route
	 *            a route found by {@link StructuralDiff}.
	 * @return the classification of both sides.
	 */
	public static ChangeMap of(Route route) {
		List<ChangeRegion> left = new ArrayList<>();
		List<ChangeRegion> right = new ArrayList<>();
		for (RouteStep s : route) {
			if (s.isStart())
				continue;
			SyntaxNode l = s.getFrom().getLeft().getNode();
			SyntaxNode r = s.getFrom().getRight().getNode();
			switch (s.getEdge().getType()) {
			case UNCHANGED:
				whole(left, l, Kind.UNCHANGED);
				whole(right, r, Kind.UNCHANGED);
				break;
			case ENTER_UNCHANGED_DELIMITER:
				delimiters(left, l, Kind.UNCHANGED);
				delimiters(right, r, Kind.UNCHANGED);
				break;
			case REPLACED:
				whole(left, l, Kind.REPLACED);
				whole(right, r, Kind.REPLACED);
				break;
			case NOVEL_ATOM_LEFT:
				whole(left, l, Kind.NOVEL);
				break;
			case NOVEL_ATOM_RIGHT:
				whole(right, r, Kind.NOVEL);
				break;
			case ENTER_NOVEL_DELIMITER_LEFT:
				delimiters(left, l, Kind.NOVEL);
				break;
			case ENTER_NOVEL_DELIMITER_RIGHT:
				delimiters(right, r, Kind.NOVEL);
				break;
			case ENTER_NOVEL_DELIMITER_BOTH:
				delimiters(left, l, Kind.NOVEL);
				delimiters(right, r, Kind.NOVEL);
				break;
			default:
				throw new IllegalStateException();
			}
		}
		left.sort(BY_START);
		right.sort(BY_START);
		return new ChangeMap(left, right);
	}

	private static void whole(List<ChangeRegion> out, SyntaxNode n,
			Kind kind) {
		out.add(new ChangeRegion(n.getStartOffset(), n.getEndOffset(), kind));
	}

	private static void delimiters(List<ChangeRegion> out, SyntaxNode n,
			Kind kind) {
		if (!n.hasDelimiters())
			return;
		int start = n.getStartOffset();
		int end = n.getEndOffset();
		out.add(new ChangeRegion(start,
				start + n.getOpenDelimiter().getBytes(UTF_8).length, kind));
		out.add(new ChangeRegion(
				end - n.getCloseDelimiter().getBytes(UTF_8).length, end, kind));
	}

	private final List<ChangeRegion> left;

	private final List<ChangeRegion> right;

	private ChangeMap(List<ChangeRegion> left, List<ChangeRegion> right) {
		this.left = Collections.unmodifiableList(left);
		this.right = Collections.unmodifiableList(right);
	}

	/** @return regions of the left (old) side, ordered by offset. */
	public List<ChangeRegion> getLeft() {
		return left;
	}

	/** @return regions of the right (new) side, ordered by offset. */
	public List<ChangeRegion> getRight() {
		return right;
	}

	/**
	 * Find the classification of a left side offset.
	 *
	 * @param offset
	 *            byte offset in the left source.
	 * @return kind of the region covering the offset, or null if the route
	 *         did not classify it (whitespace, undelimited list bounds).
	 */
	public Kind getLeftKind(int offset) {
		return kindAt(left, offset);
	}

	/**
	 * Find the classification of a right side offset.
	 *
	 * @param offset
	 *            byte offset in the right source.
	 * @return kind of the region covering the offset, or null if the route
	 *         did not classify it.
	 */
	public Kind getRightKind(int offset) {
		return kindAt(right, offset);
	}

	private static Kind kindAt(List<ChangeRegion> regions, int offset) {
		// Regions never overlap, so the last one starting at or before
		// offset is the only candidate.
		int lo = 0;
		int hi = regions.size() - 1;
		int found = -1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			if (regions.get(mid).getStart() <= offset) {
				found = mid;
				lo = mid + 1;
			} else {
				hi = mid - 1;
			}
		}
		if (found < 0)
			return null;
		ChangeRegion r = regions.get(found);
		return offset < r.getEnd() ? r.getKind() : null;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "ChangeMap[left=" + left + ", right=" + right + "]";
	}
}
