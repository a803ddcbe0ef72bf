/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.errors;

import java.text.MessageFormat;

import org.structdiff.internal.StructDiffText;

/**
 * Thrown when a delimiter stack would need more nesting than its fixed-size
 * encoding can hold.
 * <p>
 * The route search catches this and reports the comparison as too deep to
 * diff structurally, in the same way it reports an exhausted exploration
 * budget.
 */
public class DelimiterDepthException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final int limit;

	/**
	 * Construct the exception for an overflowing nesting counter.
	 *
	 * @param limit
	 *            the largest depth the overflowing counter supports
	 */
	public DelimiterDepthException(int limit) {
		this.limit = limit;
	}

	/**
	 * Get the depth limit
	 *
	 * @return the largest depth the overflowing counter supports
	 */
	public int getLimit() {
		return limit;
	}

	@Override
	public String getMessage() {
		return MessageFormat.format(StructDiffText.get().delimiterDepthExceeded,
				Integer.valueOf(limit));
	}
}
