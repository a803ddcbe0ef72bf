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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.text.MessageFormat;
import java.util.Properties;

import org.structdiff.internal.StructDiffText;

/**
 * Tuning of the structural route search.
 * <p>
 * The search gives up once it has finalized
 * {@code min(sizeFactor * positions(left) * positions(right), graphLimit)}
 * vertices. The first term scales the budget with the input, the second
 * caps the absolute work for very large files.
 * <p>
 * {@link #getDefault()} reads {@code structdiff.properties} next to this
 * class and lets system properties of the same names override it.
 */
public class DiffConfig {
	/** Key of the absolute vertex limit. */
	public static final String KEY_GRAPH_LIMIT = "structdiff.graphLimit"; //$NON-NLS-1$

	/** Key of the per-position budget multiplier. */
	public static final String KEY_SIZE_FACTOR = "structdiff.sizeFactor"; //$NON-NLS-1$

	/** Default absolute vertex limit. */
	public static final int DEFAULT_GRAPH_LIMIT = 3_000_000;

	/** Default per-position budget multiplier. */
	public static final int DEFAULT_SIZE_FACTOR = 2;

	private static final String RESOURCE = "structdiff.properties"; //$NON-NLS-1$

	private static volatile DiffConfig defaultConfig;

	/**
	 * Get the configuration built from the bundled defaults and system
	 * properties.
	 *
	 * @return the shared default configuration.
	 */
	public static DiffConfig getDefault() {
		DiffConfig c = defaultConfig;
		if (c == null) {
			Properties p = new Properties();
			try (InputStream in = DiffConfig.class
					.getResourceAsStream(RESOURCE)) {
				if (in != null)
					p.load(in);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			for (String key : new String[] { KEY_GRAPH_LIMIT,
					KEY_SIZE_FACTOR }) {
				String v = System.getProperty(key);
				if (v != null)
					p.setProperty(key, v);
			}
			c = fromProperties(p);
			defaultConfig = c;
		}
		return c;
	}

	/**
	 * Read a configuration from properties.
	 *
	 * @param p
	 *            source of {@link #KEY_GRAPH_LIMIT} and
	 *            {@link #KEY_SIZE_FACTOR}; missing keys take their defaults.
	 * @return the configuration.
	 * @throws IllegalArgumentException
	 *             if a value is not a positive integer.
	 */
	public static DiffConfig fromProperties(Properties p) {
		return new DiffConfig(
				getInt(p, KEY_GRAPH_LIMIT, DEFAULT_GRAPH_LIMIT),
				getInt(p, KEY_SIZE_FACTOR, DEFAULT_SIZE_FACTOR));
	}

	private static int getInt(Properties p, String key, int defaultValue) {
		String v = p.getProperty(key);
		if (v == null)
			return defaultValue;
		try {
			return checkPositive(key, Integer.parseInt(v.trim()));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(MessageFormat.format(
					StructDiffText.get().invalidConfigValue, key, v), e);
		}
	}

	private static int checkPositive(String key, int value) {
		if (value <= 0)
			throw new IllegalArgumentException(MessageFormat.format(
					StructDiffText.get().invalidConfigValue, key,
					Integer.valueOf(value)));
		return value;
	}

	private final int graphLimit;

	private final int sizeFactor;

	/**
	 * Create a configuration.
	 *
	 * @param graphLimit
	 *            absolute limit on finalized vertices.
	 * @param sizeFactor
	 *            multiplier applied to the product of the tree sizes.
	 * @throws IllegalArgumentException
	 *             if either value is not positive.
	 */
	public DiffConfig(int graphLimit, int sizeFactor) {
		this.graphLimit = checkPositive(KEY_GRAPH_LIMIT, graphLimit);
		this.sizeFactor = checkPositive(KEY_SIZE_FACTOR, sizeFactor);
	}

	/** @return absolute limit on finalized vertices. */
	public int getGraphLimit() {
		return graphLimit;
	}

	/** @return multiplier applied to the product of the tree sizes. */
	public int getSizeFactor() {
		return sizeFactor;
	}

	/**
	 * Compute the vertex budget for a pair of trees.
	 *
	 * @param leftPositions
	 *            cursor positions in the left tree.
	 * @param rightPositions
	 *            cursor positions in the right tree.
	 * @return number of vertices the search may finalize.
	 */
	public int getVertexLimit(int leftPositions, int rightPositions) {
		long budget = (long) sizeFactor * leftPositions * rightPositions;
		return (int) Math.min(budget, graphLimit);
	}
}
