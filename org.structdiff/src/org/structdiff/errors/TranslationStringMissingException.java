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

import java.util.Locale;

/**
 * A bundle field has no entry in the properties file.
 * <p>
 * Raised while a bundle is filled, so a message that was added to
 * {@link org.structdiff.internal.StructDiffText} but not to its
 * {@code .properties} file fails on first use instead of printing null.
 */
public class TranslationStringMissingException
		extends TranslationBundleException {
	private static final long serialVersionUID = 1L;

	private final String key;

	/**
	 * @param bundleClass
	 *            class whose fields were being filled.
	 * @param locale
	 *            locale the properties were looked up for.
	 * @param key
	 *            name of the field without a property.
	 * @param cause
	 *            the failed property lookup.
	 */
	public TranslationStringMissingException(Class<?> bundleClass,
			Locale locale, String key, Exception cause) {
		super("No property " + key + " for " + bundleClass.getName() //$NON-NLS-1$ //$NON-NLS-2$
				+ " in locale " + locale, bundleClass, locale, cause); //$NON-NLS-1$
		this.key = key;
	}

	/** @return name of the field without a property. */
	public String getKey() {
		return key;
	}
}
