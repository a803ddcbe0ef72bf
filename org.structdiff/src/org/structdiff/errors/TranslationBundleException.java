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
 * Failure to prepare a message bundle such as
 * {@link org.structdiff.internal.StructDiffText}.
 * <p>
 * A bundle is a class whose public {@code String} fields are filled from the
 * properties file of the same name. Failures are unchecked because a broken
 * bundle is a packaging error, not something callers of the diff can handle.
 */
public abstract class TranslationBundleException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final Class<?> bundleClass;

	private final Locale locale;

	/**
	 * @param message
	 *            describes the bundle and locale that failed.
	 * @param bundleClass
	 *            class whose fields were being filled.
	 * @param locale
	 *            locale the properties were looked up for.
	 * @param cause
	 *            the lookup failure.
	 */
	protected TranslationBundleException(String message, Class<?> bundleClass,
			Locale locale, Exception cause) {
		super(message, cause);
		this.bundleClass = bundleClass;
		this.locale = locale;
	}

	/** @return class whose fields were being filled. */
	public final Class<?> getBundleClass() {
		return bundleClass;
	}

	/** @return locale the properties were looked up for. */
	public final Locale getLocale() {
		return locale;
	}
}
