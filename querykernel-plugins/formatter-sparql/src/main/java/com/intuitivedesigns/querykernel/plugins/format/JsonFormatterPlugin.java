/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.intuitivedesigns.querykernel.config.KernelConfig;

/**
 * Standard SPARQL JSON plus optional metadata.
 * <p>
 * ID: JSON
 */
public final class JsonFormatterPlugin implements SparqlFormatterPlugin {

    public static final String ID = "JSON";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public JsonResultFormatter create(KernelConfig config) {
        return new JsonResultFormatter(SparqlFormatters.mapper(), FormatOptions.from(config));
    }
}
