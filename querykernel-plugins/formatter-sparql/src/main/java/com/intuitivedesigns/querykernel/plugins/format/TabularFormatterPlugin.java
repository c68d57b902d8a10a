/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.intuitivedesigns.querykernel.config.KernelConfig;

/**
 * Columns and positional rows.
 * <p>
 * ID: TABULAR
 */
public final class TabularFormatterPlugin implements SparqlFormatterPlugin {

    public static final String ID = "TABULAR";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TabularResultFormatter create(KernelConfig config) {
        return new TabularResultFormatter(SparqlFormatters.mapper(), FormatOptions.from(config));
    }
}
