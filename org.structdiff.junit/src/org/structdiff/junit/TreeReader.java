/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.junit;

import java.util.ArrayDeque;
import java.util.Deque;

import org.structdiff.tree.SyntaxTree;

/**
 * Reads C-like snippets into {@link SyntaxTree}s for tests.
 * <p>
 * This is not a parser for any real language, just enough tokenizing to
 * write readable test inputs:
 * <ul>
 * <li>{@code ( )}, {@code [ ]} and {@code { }} delimit lists;</li>
 * <li>{@code // ...} up to the end of the line and {@code /* ... *}{@code /}
 * are comments;</li>
 * <li>runs of letters, digits and {@code _} are atoms, as are double quoted
 * strings;</li>
 * <li>every other non-blank character is a punctuation atom.</li>
 * </ul>
 * Offsets in the resulting tree are byte offsets into the UTF-8 encoding of
 * the snippet.
 */
public class TreeReader {
	private static final String OPEN = "([{"; //$NON-NLS-1$

	private static final String CLOSE = ")]}"; //$NON-NLS-1$

	/**
	 * Read a snippet.
	 *
	 * @param source
	 *            the snippet.
	 * @return the tree.
	 * @throws IllegalArgumentException
	 *             if brackets are unbalanced or a comment or string is not
	 *             terminated.
	 */
	public static SyntaxTree read(String source) {
		return new TreeReader(source).read();
	}

	private final String src;

	private final SyntaxTree.Builder builder = SyntaxTree.builder();

	private final Deque<Character> expected = new ArrayDeque<>();

	/** UTF-8 offset of each char index, plus one past the end. */
	private final int[] bytes;

	private int pos;

	private TreeReader(String source) {
		this.src = source;
		this.bytes = new int[source.length() + 1];
		for (int i = 0; i < source.length(); i++)
			bytes[i + 1] = bytes[i] + utf8Length(source.charAt(i));
	}

	private SyntaxTree read() {
		while (pos < src.length()) {
			char c = src.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
			} else if (src.startsWith("//", pos)) { //$NON-NLS-1$
				int end = src.indexOf('\n', pos);
				comment(end < 0 ? src.length() : end);
			} else if (src.startsWith("/*", pos)) { //$NON-NLS-1$
				int end = src.indexOf("*/", pos + 2); //$NON-NLS-1$
				if (end < 0)
					throw error("unterminated comment"); //$NON-NLS-1$
				comment(end + 2);
			} else if (OPEN.indexOf(c) >= 0) {
				builder.openList(String.valueOf(c), bytes[pos]);
				expected.push(Character.valueOf(CLOSE.charAt(OPEN.indexOf(c))));
				pos++;
			} else if (CLOSE.indexOf(c) >= 0) {
				Character want = expected.poll();
				if (want == null || want.charValue() != c)
					throw error("unexpected " + c); //$NON-NLS-1$
				builder.closeList(String.valueOf(c), bytes[++pos]);
			} else if (c == '"') {
				int end = src.indexOf('"', pos + 1);
				if (end < 0)
					throw error("unterminated string"); //$NON-NLS-1$
				builder.atom(src.substring(pos, end + 1), bytes[pos]);
				pos = end + 1;
			} else if (isWord(c)) {
				int start = pos;
				while (pos < src.length() && isWord(src.charAt(pos)))
					pos++;
				builder.atom(src.substring(start, pos), bytes[start]);
			} else {
				int n = Character.charCount(src.codePointAt(pos));
				builder.punctuation(src.substring(pos, pos + n), bytes[pos]);
				pos += n;
			}
		}
		if (!expected.isEmpty())
			throw error("missing " + expected.peek()); //$NON-NLS-1$
		return builder.build();
	}

	private void comment(int end) {
		builder.comment(src.substring(pos, end), bytes[pos]);
		pos = end;
	}

	private static int utf8Length(char c) {
		if (c < 0x80)
			return 1;
		if (c < 0x800 || Character.isSurrogate(c))
			return 2; // a surrogate pair encodes to 4 bytes
		return 3;
	}

	private static boolean isWord(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private IllegalArgumentException error(String what) {
		return new IllegalArgumentException(what + " at " + pos + " in: " //$NON-NLS-1$ //$NON-NLS-2$
				+ src);
	}
}
