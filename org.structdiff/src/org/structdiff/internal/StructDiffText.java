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

import org.structdiff.nls.NLS;
import org.structdiff.nls.TranslationBundle;

/**
 * Translation bundle for StructDiff
 */
public class StructDiffText extends TranslationBundle {

	/**
	 * Get an instance of this translation bundle.
	 *
	 * @return an instance of this translation bundle
	 */
	public static StructDiffText get() {
		return NLS.getBundleFor(StructDiffText.class);
	}

	// @formatter:off
	/***/ public String cursorAtEnd;
	/***/ public String cursorAtRoot;
	/***/ public String cursorNotOnList;
	/***/ public String delimiterDepthExceeded;
	/***/ public String emptyListDelimiter;
	/***/ public String invalidConfigValue;
	/***/ public String listNotClosed;
	/***/ public String noListToClose;
	/***/ public String routeEmpty;
	/***/ public String searchDepthExceeded;
	/***/ public String searchLimitExceeded;
	/***/ public String searchQueueExhausted;
	/***/ public String treeAlreadyBuilt;
}
