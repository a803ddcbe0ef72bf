/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.nls;

public class GermanTranslatedBundle extends TranslationBundle {
	public static GermanTranslatedBundle get() {
		return NLS.getBundleFor(GermanTranslatedBundle.class);
	}

	public String routeFound;
}
