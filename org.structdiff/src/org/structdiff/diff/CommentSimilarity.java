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

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Scores how alike two comment texts are.
 * <p>
 * The score is the normalized Levenshtein similarity expressed as a whole
 * percentage: 100 for identical texts, 0 when every character differs.
 */
public final class CommentSimilarity {
	/** Score of two identical texts. */
	public static final int MAX_SCORE = 100;

	private static final LevenshteinDistance DISTANCE = LevenshteinDistance
			.getDefaultInstance();

	private CommentSimilarity() {
		// Static utility.
	}

	/**
	 * Compute the similarity of two texts.
	 *
	 * @param a
	 *            first text.
	 * @param b
	 *            second text.
	 * @return similarity in percent, between 0 and {@link #MAX_SCORE}
	 *         inclusive. Symmetric in its arguments.
	 */
	public static int percent(String a, String b) {
		int max = Math.max(a.length(), b.length());
		if (max == 0)
			return MAX_SCORE;
		int distance = DISTANCE.apply(a, b).intValue();
		return (int) Math.round(MAX_SCORE * (1.0 - (double) distance / max));
	}
}
