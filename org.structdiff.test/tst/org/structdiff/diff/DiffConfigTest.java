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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class DiffConfigTest {
	@Test
	void testBundledDefaults() {
		DiffConfig c = DiffConfig.getDefault();
		assertEquals(DiffConfig.DEFAULT_GRAPH_LIMIT, c.getGraphLimit());
		assertEquals(DiffConfig.DEFAULT_SIZE_FACTOR, c.getSizeFactor());
		assertSame(c, DiffConfig.getDefault());
	}

	@Test
	void testMissingKeysTakeDefaults() {
		DiffConfig c = DiffConfig.fromProperties(new Properties());
		assertEquals(DiffConfig.DEFAULT_GRAPH_LIMIT, c.getGraphLimit());
		assertEquals(DiffConfig.DEFAULT_SIZE_FACTOR, c.getSizeFactor());
	}

	@Test
	void testFromProperties() {
		Properties p = new Properties();
		p.setProperty(DiffConfig.KEY_GRAPH_LIMIT, " 1000 ");
		p.setProperty(DiffConfig.KEY_SIZE_FACTOR, "3");
		DiffConfig c = DiffConfig.fromProperties(p);
		assertEquals(1000, c.getGraphLimit());
		assertEquals(3, c.getSizeFactor());
	}

	@Test
	void testInvalidValues() {
		Properties p = new Properties();
		p.setProperty(DiffConfig.KEY_GRAPH_LIMIT, "lots");
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> DiffConfig.fromProperties(p));
		assertTrue(e.getMessage().contains(DiffConfig.KEY_GRAPH_LIMIT));

		p.setProperty(DiffConfig.KEY_GRAPH_LIMIT, "0");
		assertThrows(IllegalArgumentException.class,
				() -> DiffConfig.fromProperties(p));

		assertThrows(IllegalArgumentException.class,
				() -> new DiffConfig(10, -1));
	}

	@Test
	void testVertexLimit() {
		DiffConfig c = new DiffConfig(1000, 2);
		assertEquals(2 * 6 * 7, c.getVertexLimit(6, 7));
		assertEquals(1000, c.getVertexLimit(100, 100));
	}

	@Test
	void testVertexLimitDoesNotOverflow() {
		DiffConfig c = new DiffConfig(Integer.MAX_VALUE, 2);
		assertEquals(Integer.MAX_VALUE,
				c.getVertexLimit(1_000_000, 1_000_000));
	}
}
