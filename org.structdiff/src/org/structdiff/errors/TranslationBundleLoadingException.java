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
 * No properties file was found next to a bundle class, for the requested
 * locale or any of its fallbacks.
 */
public class TranslationBundleLoadingException
		extends TranslationBundleException {
	private static final long serialVersionUID = 1L;

	/**
	 * @param bundleClass
	 *            class whose properties were missing.
	 * @param locale
	 *            locale the properties were looked up for.
	 * @param cause
	 *            the failed lookup.
	 */
	public TranslationBundleLoadingException(Class<?> bundleClass,
			Locale locale, Exception cause) {
		super("No properties for " + bundleClass.getName() //$NON-NLS-1$
				+ " in locale " + locale, //$NON-NLS-1$
				bundleClass, locale, cause);
	}
}
