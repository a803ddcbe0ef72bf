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

import java.lang.reflect.InvocationTargetException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-thread access to {@link TranslationBundle}s.
 * <p>
 * The locale is inherited by child threads. Bundles are loaded once per
 * locale and type and shared between all threads using that locale.
 *
 * <pre>
 * NLS.setLocale(Locale.GERMAN);
 * StructDiffText t = NLS.getBundleFor(StructDiffText.class);
 * </pre>
 */
public class NLS {
	private static final InheritableThreadLocal<Locale> local = new InheritableThreadLocal<>();

	private static final Map<Locale, Map<Class<?>, TranslationBundle>> cache = new ConcurrentHashMap<>();

	/**
	 * Set the locale used by the calling thread and its future children.
	 *
	 * @param locale
	 *            the preferred locale
	 */
	public static void setLocale(Locale locale) {
		local.set(locale);
	}

	/**
	 * Make the calling thread use the JVM default locale.
	 */
	public static void useJVMDefaultLocale() {
		local.set(Locale.getDefault());
	}

	/**
	 * Get the bundle of the given type for the calling thread's locale.
	 *
	 * @param <T>
	 *            required bundle type
	 * @param type
	 *            required bundle type
	 * @return the populated bundle instance
	 * @throws org.structdiff.errors.TranslationBundleLoadingException
	 *             if no properties file backs the bundle
	 * @throws org.structdiff.errors.TranslationStringMissingException
	 *             if a field of the bundle has no translation
	 */
	public static <T extends TranslationBundle> T getBundleFor(Class<T> type) {
		Locale locale = local.get();
		if (locale == null) {
			locale = Locale.getDefault();
			local.set(locale);
		}
		Map<Class<?>, TranslationBundle> bundles = cache
				.computeIfAbsent(locale, l -> new ConcurrentHashMap<>());
		TranslationBundle bundle = bundles.get(type);
		if (bundle == null) {
			bundle = newBundle(type, locale);
			// Another thread may have won the race; keep its instance.
			TranslationBundle old = bundles.putIfAbsent(type, bundle);
			if (old != null)
				bundle = old;
		}
		return type.cast(bundle);
	}

	private static <T extends TranslationBundle> T newBundle(Class<T> type,
			Locale locale) {
		try {
			T bundle = type.getDeclaredConstructor().newInstance();
			bundle.load(locale);
			return bundle;
		} catch (InstantiationException | IllegalAccessException
				| InvocationTargetException | NoSuchMethodException e) {
			throw new Error(e);
		}
	}

	static void clear() {
		cache.clear();
	}

	private NLS() {
		// Static access only.
	}
}
