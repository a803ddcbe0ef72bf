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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.structdiff.errors.TranslationBundleLoadingException;
import org.structdiff.errors.TranslationStringMissingException;

/**
 * Base class for message bundles whose texts are injected into public
 * {@code String} fields.
 * <p>
 * A subclass declares one public, non-final {@code String} field per message.
 * The class name doubles as the resource bundle base name, so
 * {@code org.structdiff.internal.StructDiffText} is populated from
 * {@code org/structdiff/internal/StructDiffText.properties} (or one of its
 * locale specific variants). Every field must have a key of the same name;
 * a missing key is an error rather than a silently empty message.
 * <p>
 * Instances are obtained through {@link NLS#getBundleFor(Class)}, never
 * constructed directly by callers.
 */
public abstract class TranslationBundle {
	private Locale effectiveLocale;

	private ResourceBundle resourceBundle;

	/**
	 * Get the locale the field values were actually taken from.
	 *
	 * @return the locale of the resource bundle that was found, which may be
	 *         less specific than the requested one.
	 */
	public Locale effectiveLocale() {
		return effectiveLocale;
	}

	/**
	 * Get the resource bundle backing this translation bundle.
	 *
	 * @return the resource bundle backing this translation bundle.
	 */
	public ResourceBundle resourceBundle() {
		return resourceBundle;
	}

	void load(Locale locale) {
		Class<? extends TranslationBundle> bundleClass = getClass();
		try {
			resourceBundle = ResourceBundle.getBundle(bundleClass.getName(),
					locale, bundleClass.getClassLoader());
		} catch (MissingResourceException e) {
			throw new TranslationBundleLoadingException(bundleClass, locale, e);
		}
		effectiveLocale = resourceBundle.getLocale();

		for (Field field : bundleClass.getFields()) {
			if (field.getType() != String.class
					|| Modifier.isStatic(field.getModifiers())) {
				continue;
			}
			try {
				field.set(this, resourceBundle.getString(field.getName()));
			} catch (MissingResourceException e) {
				throw new TranslationStringMissingException(bundleClass,
						locale, field.getName(), e);
			} catch (IllegalAccessException e) {
				throw new Error(e);
			}
		}
	}
}
