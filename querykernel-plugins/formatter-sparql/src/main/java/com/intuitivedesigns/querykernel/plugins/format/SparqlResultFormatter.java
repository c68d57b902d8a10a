/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.querykernel.core.ResultFormatter;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for formatters of SPARQL JSON result documents
 * ({@code {"head": {"vars": [...]}, "results": {"bindings": [...]}}} or {@code {"boolean": ...}}).
 *
 * <p>Output is serialized to a JSON string, so cached values are immutable.</p>
 */
public abstract class SparqlResultFormatter implements ResultFormatter<JsonNode, String> {

    protected static final String TYPE_ASK = "ASK";
    protected static final String TYPE_SELECT = "SELECT";
    protected static final String TYPE_GRAPH = "GRAPH";

    protected final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final FormatOptions options;

    protected SparqlResultFormatter(ObjectMapper mapper, FormatOptions options) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.options = Objects.requireNonNull(options, "options");
        this.writer = options.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public final String format(JsonNode raw, String queryText) {
        Objects.requireNonNull(raw, "raw");
        JsonNode shaped = shape(raw);
        if (options.includeMetadata() && shaped.isObject()) {
            ObjectNode metadata = extractMetadata(raw);
            if (queryText != null && !queryText.isEmpty()) {
                metadata.put("query", queryText);
            }
            ((ObjectNode) shaped).set("metadata", metadata);
        }
        try {
            return writer.writeValueAsString(shaped);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize formatted result", e);
        }
    }

    /**
     * Builds the output tree. Must not mutate {@code raw}.
     */
    protected abstract JsonNode shape(JsonNode raw);

    protected ObjectNode extractMetadata(JsonNode raw) {
        ObjectNode metadata = mapper.createObjectNode();
        JsonNode head = raw.path("head");
        if (head.isObject()) {
            metadata.set("variables", head.has("vars") ? head.get("vars").deepCopy() : mapper.createArrayNode());
            metadata.set("links", head.has("links") ? head.get("links").deepCopy() : mapper.createArrayNode());
        }
        if (hasBindings(raw)) {
            metadata.put("count", raw.path("results").path("bindings").size());
        } else if (raw.has("boolean")) {
            metadata.put("type", TYPE_ASK);
        }
        return metadata;
    }

    protected static boolean hasBindings(JsonNode raw) {
        return raw.path("results").has("bindings");
    }

    /**
     * Head without a non-empty results section: an empty SELECT.
     */
    protected static boolean isEmptySelect(JsonNode raw) {
        if (!raw.has("head")) return false;
        JsonNode results = raw.get("results");
        return results == null || results.isNull() || results.isEmpty();
    }

    protected static List<String> variables(JsonNode raw) {
        List<String> vars = new ArrayList<>();
        for (JsonNode v : raw.path("head").path("vars")) {
            vars.add(v.asText());
        }
        return vars;
    }

    protected ArrayNode bindings(JsonNode raw) {
        JsonNode node = raw.path("results").path("bindings");
        return node.isArray() ? (ArrayNode) node : mapper.createArrayNode();
    }
}
