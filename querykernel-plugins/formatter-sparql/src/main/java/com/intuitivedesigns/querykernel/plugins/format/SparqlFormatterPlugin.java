/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.querykernel.spi.FormatterPlugin;

/**
 * Service type for formatters of SPARQL 1.1 JSON result documents.
 * Implementations are listed in {@code META-INF/services}.
 */
public interface SparqlFormatterPlugin extends FormatterPlugin<JsonNode, String> {
}
