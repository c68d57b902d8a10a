/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.intuitivedesigns.querykernel.config.KernelConfig;

/**
 * Output switches shared by every SPARQL formatter.
 *
 * @param includeMetadata append a {@code metadata} object (variables, links, count, query)
 * @param prettyPrint indent the JSON output
 */
public record FormatOptions(boolean includeMetadata, boolean prettyPrint) {

    public static final String KEY_INCLUDE_METADATA = "format.include.metadata";
    public static final String KEY_PRETTY_PRINT = "format.pretty.print";

    public static FormatOptions from(KernelConfig config) {
        return new FormatOptions(
                config.getBoolean(KEY_INCLUDE_METADATA, true),
                config.getBoolean(KEY_PRETTY_PRINT, false));
    }
}
