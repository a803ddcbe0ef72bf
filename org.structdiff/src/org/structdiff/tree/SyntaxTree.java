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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.structdiff.internal.StructDiffText;

/**
 * An immutable, in-memory syntax tree.
 * <p>
 * The tree is a sequence of top-level nodes. It is produced by a
 * {@link Builder}, which a parser adapter drives in document order: atoms are
 * appended to the innermost open list, lists are opened and closed around
 * their children. Structural hashes are computed once while building.
 * <p>
 * Offsets are byte offsets into the UTF-8 encoded source. An atom ends the
 * UTF-8 length of its text after its start.
 *
 * <pre>
 * SyntaxTree t = SyntaxTree.builder()
 * 		.atom("f", 0)
 * 		.openList("(", 1)
 * 		.atom("a", 2)
 * 		.closeList(")", 4)
 * 		.build();
 * </pre>
 */
public final class SyntaxTree {
	private static final long FNV_OFFSET = 0xcbf29ce484222325L;

	private static final long FNV_PRIME = 0x100000001b3L;

	private static final long ATOM_SEED = 0x9e3779b97f4a7c15L;

	private static final long LIST_SEED = 0xc2b2ae3d27d4eb4fL;

	/** @return a new builder for an empty tree. */
	public static Builder builder() {
		return new Builder();
	}

	private final List<Node> roots;

	private final int size;

	private final int positions;

	private SyntaxTree(List<Node> roots) {
		this.roots = Collections.unmodifiableList(roots);
		int nodes = 0;
		int lists = 0;
		Deque<Node> todo = new ArrayDeque<>(roots);
		while (!todo.isEmpty()) {
			Node n = todo.pop();
			nodes++;
			if (n.isList()) {
				lists++;
				todo.addAll(n.children);
			}
		}
		this.size = nodes;
		this.positions = nodes + lists + 1;
	}

	/** @return cursor at the first top-level node, or at the end if empty. */
	public SyntaxCursor cursor() {
		return new Cursor(this, null, roots, 0, 0);
	}

	/** @return the top-level nodes of this tree. */
	public List<? extends SyntaxNode> getRoots() {
		return roots;
	}

	/** @return number of nodes in this tree, at all depths. */
	public int size() {
		return size;
	}

	/**
	 * Get the number of distinct cursor positions.
	 * <p>
	 * Every node is a position, and so is the end of every sibling list,
	 * including the top level.
	 *
	 * @return number of positions a {@link SyntaxCursor} can take.
	 */
	public int getPositionCount() {
		return positions;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (Node n : roots) {
			if (r.length() > 0)
				r.append(' ');
			n.format(r);
		}
		return "SyntaxTree[" + r + "]";
	}

	static long hash(String s) {
		long h = FNV_OFFSET;
		for (int i = 0; i < s.length(); i++) {
			h ^= s.charAt(i);
			h *= FNV_PRIME;
		}
		return h;
	}

	static long mix(long h, long v) {
		h ^= v;
		h *= FNV_PRIME;
		return h ^ (h >>> 29);
	}

	private static final class Node implements SyntaxNode {
		final String text;

		final String open;

		final String close;

		final SyntaxHint hint;

		final List<Node> children;

		final int start;

		final int end;

		final long structuralHash;

		Node parent;

		int index;

		Node(String text, SyntaxHint hint, int start) {
			this.text = text;
			this.open = null;
			this.close = null;
			this.hint = hint;
			this.children = null;
			this.start = start;
			this.end = start + text.getBytes(UTF_8).length;

			long h = mix(ATOM_SEED, hint != null ? hint.getKind().ordinal() + 1 : 0);
			this.structuralHash = mix(h, hash(text));
		}

		Node(String open, String close, List<Node> children, int start,
				int end) {
			this.text = null;
			this.open = open;
			this.close = close;
			this.hint = null;
			this.children = Collections.unmodifiableList(children);
			this.start = start;
			this.end = end;

			long h = mix(LIST_SEED, open != null ? hash(open) : 0);
			h = mix(h, close != null ? hash(close) : 0);
			for (Node c : children)
				h = mix(h, c.structuralHash);
			this.structuralHash = mix(h, children.size());
		}

		@Override
		public boolean isAtom() {
			return children == null;
		}

		@Override
		public boolean isList() {
			return children != null;
		}

		@Override
		public long getStructuralHash() {
			return structuralHash;
		}

		@Override
		public SyntaxHint getHint() {
			return hint;
		}

		@Override
		public boolean hasDelimiters() {
			return open != null;
		}

		@Override
		public String getOpenDelimiter() {
			return open;
		}

		@Override
		public String getCloseDelimiter() {
			return close;
		}

		@Override
		public String getText() {
			return text;
		}

		@Override
		public int getStartOffset() {
			return start;
		}

		@Override
		public int getEndOffset() {
			return end;
		}

		@SuppressWarnings("nls")
		void format(StringBuilder r) {
			if (isAtom()) {
				r.append(text);
				return;
			}
			r.append(open != null ? open : "{{");
			for (int i = 0; i < children.size(); i++) {
				if (i > 0)
					r.append(' ');
				children.get(i).format(r);
			}
			r.append(close != null ? close : "}}");
		}

		@Override
		public String toString() {
			StringBuilder r = new StringBuilder();
			format(r);
			return r.toString();
		}
	}

	private static final class Cursor implements SyntaxCursor {
		private final SyntaxTree tree;

		/** Enclosing list, null on the top level. */
		private final Node owner;

		private final List<Node> siblings;

		private final int index;

		private final int depth;

		Cursor(SyntaxTree tree, Node owner, List<Node> siblings, int index,
				int depth) {
			this.tree = tree;
			this.owner = owner;
			this.siblings = siblings;
			this.index = index;
			this.depth = depth;
		}

		@Override
		public SyntaxNode getNode() {
			return index < siblings.size() ? siblings.get(index) : null;
		}

		@Override
		public boolean isEnd() {
			return index >= siblings.size();
		}

		@Override
		public int getDepth() {
			return depth;
		}

		@Override
		public SyntaxCursor firstChild() {
			if (isEnd())
				throw new IllegalStateException(
						StructDiffText.get().cursorAtEnd);
			Node n = siblings.get(index);
			if (!n.isList())
				throw new IllegalStateException(MessageFormat.format(
						StructDiffText.get().cursorNotOnList, n));
			return new Cursor(tree, n, n.children, 0, depth + 1);
		}

		@Override
		public SyntaxCursor nextSibling() {
			if (isEnd())
				throw new IllegalStateException(
						StructDiffText.get().cursorAtEnd);
			return new Cursor(tree, owner, siblings, index + 1, depth);
		}

		@Override
		public SyntaxCursor parent() {
			if (owner == null)
				throw new IllegalStateException(
						StructDiffText.get().cursorAtRoot);
			Node up = owner.parent;
			List<Node> upSiblings = up != null ? up.children : tree.roots;
			return new Cursor(tree, up, upSiblings, owner.index, depth - 1);
		}

		@Override
		public int hashCode() {
			Object key = owner != null ? owner : tree;
			return System.identityHashCode(key) * 31 + index;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Cursor) {
				Cursor c = (Cursor) o;
				return tree == c.tree && owner == c.owner && index == c.index;
			}
			return false;
		}

		@SuppressWarnings("nls")
		@Override
		public String toString() {
			SyntaxNode n = getNode();
			return "Cursor[" + depth + ":" + index + " "
					+ (n != null ? n.toString() : "<end>") + "]";
		}
	}

	/**
	 * Assembles a {@link SyntaxTree} from nodes reported in document order.
	 * <p>
	 * A builder produces a single tree; it cannot be reused after
	 * {@link #build()}.
	 */
	public static final class Builder {
		private final List<Node> roots = new ArrayList<>();

		private final Deque<Frame> open = new ArrayDeque<>();

		private boolean built;

		Builder() {
			// Use SyntaxTree.builder().
		}

		/**
		 * Append a plain atom.
		 *
		 * @param text
		 *            token text.
		 * @param start
		 *            offset of the token's first byte.
		 * @return {@code this}
		 */
		public Builder atom(String text, int start) {
			return add(new Node(text, null, start));
		}

		/**
		 * Append a punctuation atom.
		 *
		 * @param text
		 *            token text, e.g. {@code ";"}.
		 * @param start
		 *            offset of the token's first byte.
		 * @return {@code this}
		 */
		public Builder punctuation(String text, int start) {
			return add(new Node(text, SyntaxHint.PUNCTUATION, start));
		}

		/**
		 * Append a comment atom.
		 *
		 * @param text
		 *            full comment text, including its markers.
		 * @param start
		 *            offset of the comment's first byte.
		 * @return {@code this}
		 */
		public Builder comment(String text, int start) {
			return add(new Node(text, SyntaxHint.comment(text), start));
		}

		/**
		 * Start a list; following nodes become its children.
		 *
		 * @param openDelimiter
		 *            opening token, or null for an undelimited list.
		 * @param start
		 *            offset of the list's first byte.
		 * @return {@code this}
		 */
		public Builder openList(String openDelimiter, int start) {
			checkNotBuilt();
			open.push(new Frame(openDelimiter, start));
			return this;
		}

		/**
		 * Finish the innermost open list.
		 *
		 * @param closeDelimiter
		 *            closing token; must be null exactly when the opening
		 *            token was null.
		 * @param end
		 *            offset one past the list's last byte.
		 * @return {@code this}
		 */
		public Builder closeList(String closeDelimiter, int end) {
			checkNotBuilt();
			Frame f = open.poll();
			if (f == null)
				throw new IllegalStateException(
						StructDiffText.get().noListToClose);
			if ((f.openDelimiter == null) != (closeDelimiter == null))
				throw new IllegalArgumentException(
						StructDiffText.get().emptyListDelimiter);
			Node list = new Node(f.openDelimiter, closeDelimiter, f.children,
					f.start, end);
			for (Node c : f.children)
				c.parent = list;
			return add(list);
		}

		/**
		 * Finish the tree.
		 *
		 * @return the immutable tree.
		 * @throws IllegalStateException
		 *             if a list is still open.
		 */
		public SyntaxTree build() {
			checkNotBuilt();
			if (!open.isEmpty())
				throw new IllegalStateException(MessageFormat.format(
						StructDiffText.get().listNotClosed,
						Integer.valueOf(open.size())));
			built = true;
			return new SyntaxTree(roots);
		}

		private Builder add(Node n) {
			checkNotBuilt();
			List<Node> into = open.isEmpty() ? roots : open.peek().children;
			n.index = into.size();
			into.add(n);
			return this;
		}

		private void checkNotBuilt() {
			if (built)
				throw new IllegalStateException(
						StructDiffText.get().treeAlreadyBuilt);
		}
	}

	private static final class Frame {
		final String openDelimiter;

		final int start;

		final List<Node> children = new ArrayList<>();

		Frame(String openDelimiter, int start) {
			this.openDelimiter = openDelimiter;
			this.start = start;
		}
	}
}
