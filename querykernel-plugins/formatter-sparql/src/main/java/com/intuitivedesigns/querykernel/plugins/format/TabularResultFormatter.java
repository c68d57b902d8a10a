/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result-set layout: {@code columns} (name + label) and positional {@code rows}.
 */
public final class TabularResultFormatter extends SparqlResultFormatter {

    public TabularResultFormatter(ObjectMapper mapper, FormatOptions options) {
        super(mapper, options);
    }

    @Override
    protected JsonNode shape(JsonNode raw) {
        ObjectNode out = mapper.createObjectNode();
        if (raw.has("boolean")) {
            out.put("type", TYPE_ASK);
            out.set("value", raw.get("boolean").deepCopy());
        } else if (hasBindings(raw)) {
            List<String> vars = variables(raw);
            out.put("type", TYPE_SELECT);
            out.set("columns", columns(vars));
            out.set("rows", rows(bindings(raw), vars));
        } else if (isEmptySelect(raw)) {
            out.put("type", TYPE_SELECT);
            out.set("columns", raw.path("head").has("vars")
                    ? raw.path("head").get("vars").deepCopy()
                    : mapper.createArrayNode());
            out.set("rows", mapper.createArrayNode());
        } else {
            out.put("type", TYPE_GRAPH);
            out.set("results", raw.deepCopy());
        }
        return out;
    }

    private ArrayNode columns(List<String> vars) {
        ArrayNode columns = mapper.createArrayNode();
        for (String var : vars) {
            columns.addObject().put("name", var).put("label", var);
        }
        return columns;
    }

    private ArrayNode rows(ArrayNode bindings, List<String> vars) {
        ArrayNode rows = mapper.createArrayNode();
        for (JsonNode binding : bindings) {
            ArrayNode row = rows.addArray();
            for (String var : vars) {
                JsonNode value = binding.path(var).get("value");
                if (value == null) {
                    row.addNull();
                } else {
                    JsonNode copy = value.deepCopy();
                    row.add(copy);
                }
            }
        }
        return rows;
    }
}
