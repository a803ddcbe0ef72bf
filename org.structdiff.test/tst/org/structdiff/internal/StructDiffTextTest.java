/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Locale;

import org.junit.jupiter.api.Test;
import org.structdiff.errors.DelimiterDepthException;
import org.structdiff.nls.NLS;

public class StructDiffTextTest {
	@Test
	void testAllMessagesLoaded() throws Exception {
		NLS.setLocale(Locale.ROOT);
		StructDiffText t = StructDiffText.get();
		for (Field f : StructDiffText.class.getFields()) {
			if (f.getType() != String.class
					|| Modifier.isStatic(f.getModifiers()))
				continue;
			String v = (String) f.get(t);
			assertNotNull(v, f.getName());
			assertFalse(v.isEmpty(), f.getName());
		}
	}

	@Test
	void testExceptionMessage() {
		NLS.setLocale(Locale.ROOT);
		assertEquals("Delimiter nesting exceeds the supported depth of 15",
				new DelimiterDepthException(15).getMessage());
	}
}
