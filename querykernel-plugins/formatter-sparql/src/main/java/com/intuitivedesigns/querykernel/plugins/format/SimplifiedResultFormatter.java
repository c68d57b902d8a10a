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
 * Flattens bindings into plain objects.
 *
 * <pre>
 * [{"s": {"type": "uri", "value": "http://x"}}]  ->  [{"s": "http://x"}]
 * </pre>
 *
 * Datatypes and language tags survive as {@code <var>_datatype} and {@code <var>_lang};
 * unbound variables map to {@code null}.
 */
public final class SimplifiedResultFormatter extends SparqlResultFormatter {

    public SimplifiedResultFormatter(ObjectMapper mapper, FormatOptions options) {
        super(mapper, options);
    }

    @Override
    protected JsonNode shape(JsonNode raw) {
        ObjectNode out = mapper.createObjectNode();
        if (raw.has("boolean")) {
            out.put("type", TYPE_ASK);
            out.set("result", raw.get("boolean").deepCopy());
        } else if (hasBindings(raw)) {
            out.put("type", TYPE_SELECT);
            out.set("results", simplify(bindings(raw), variables(raw)));
        } else if (isEmptySelect(raw)) {
            out.put("type", TYPE_SELECT);
            out.set("results", mapper.createArrayNode());
        } else {
            out.put("type", TYPE_GRAPH);
            out.set("results", raw.deepCopy());
        }
        return out;
    }

    private ArrayNode simplify(ArrayNode bindings, List<String> vars) {
        ArrayNode rows = mapper.createArrayNode();
        for (JsonNode binding : bindings) {
            ObjectNode row = rows.addObject();
            for (String var : vars) {
                JsonNode term = binding.get(var);
                if (term == null) {
                    row.putNull(var);
                    continue;
                }
                row.set(var, term.path("value").deepCopy());
                if (term.has("datatype")) {
                    row.set(var + "_datatype", term.get("datatype").deepCopy());
                }
                if (term.has("xml:lang")) {
                    row.set(var + "_lang", term.get("xml:lang").deepCopy());
                }
            }
        }
        return rows;
    }
}
