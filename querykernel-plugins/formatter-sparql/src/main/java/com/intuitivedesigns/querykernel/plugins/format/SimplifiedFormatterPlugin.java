/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.intuitivedesigns.querykernel.config.KernelConfig;

/**
 * Flat variable-to-value objects.
 * <p>
 * ID: SIMPLIFIED
 */
public final class SimplifiedFormatterPlugin implements SparqlFormatterPlugin {

    public static final String ID = "SIMPLIFIED";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SimplifiedResultFormatter create(KernelConfig config) {
        return new SimplifiedResultFormatter(SparqlFormatters.mapper(), FormatOptions.from(config));
    }
}
