/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Standard SPARQL JSON, passed through unchanged apart from the optional metadata block.
 */
public final class JsonResultFormatter extends SparqlResultFormatter {

    public JsonResultFormatter(ObjectMapper mapper, FormatOptions options) {
        super(mapper, options);
    }

    @Override
    protected JsonNode shape(JsonNode raw) {
        return raw.deepCopy();
    }
}
