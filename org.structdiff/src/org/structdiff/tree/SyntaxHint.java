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
 * Classification a grammar attaches to an atom.
 * <p>
 * Most atoms carry no hint at all. Punctuation atoms make a match more
 * expensive, comment atoms may be paired up as replacements of each other.
 */
public final class SyntaxHint {
	/** Kind of hint */
	public static enum Kind {
		/** Operator or separator noise such as {@code ;} or {@code ,}. */
		PUNCTUATION,

		/** A comment; its text is compared when two comments differ. */
		COMMENT;
	}

	/** Shared hint for all punctuation atoms. */
	public static final SyntaxHint PUNCTUATION = new SyntaxHint(
			Kind.PUNCTUATION, null);

	/**
	 * Create a comment hint.
	 *
	 * @param text
	 *            full text of the comment, including its markers.
	 * @return the hint.
	 */
	public static SyntaxHint comment(String text) {
		if (text == null)
			throw new NullPointerException();
		return new SyntaxHint(Kind.COMMENT, text);
	}

	private final Kind kind;

	private final String text;

	private SyntaxHint(Kind kind, String text) {
		this.kind = kind;
		this.text = text;
	}

	/** @return the kind of this hint. */
	public Kind getKind() {
		return kind;
	}

	/** @return true if this hint marks punctuation. */
	public boolean isPunctuation() {
		return kind == Kind.PUNCTUATION;
	}

	/** @return true if this hint marks a comment. */
	public boolean isComment() {
		return kind == Kind.COMMENT;
	}

	/** @return text of the comment; null for punctuation. */
	public String getText() {
		return text;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() * 31 + (text != null ? text.hashCode() : 0);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof SyntaxHint) {
			SyntaxHint h = (SyntaxHint) o;
			return kind == h.kind
					&& (text == null ? h.text == null : text.equals(h.text));
		}
		return false;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return text == null ? kind.toString() : kind + "(" + text + ")";
	}
}
