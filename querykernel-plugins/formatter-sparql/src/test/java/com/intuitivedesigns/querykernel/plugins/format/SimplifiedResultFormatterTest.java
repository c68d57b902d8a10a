/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimplifiedResultFormatterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SimplifiedResultFormatter formatter = new SimplifiedResultFormatter(mapper, new FormatOptions(true, false));

    @Test
    void flattensSelectBindings() throws Exception {
        JsonNode raw = mapper.readTree(SparqlFormattersTest.SELECT_DOC);

        JsonNode out = mapper.readTree(formatter.format(raw, "SELECT ?law ?title"));

        assertEquals("SELECT", out.get("type").asText());
        JsonNode first = out.get("results").get(0);
        assertEquals("http://data.legilux.public.lu/eli/etat/leg/loi/2020/01", first.get("law").asText());
        assertEquals("Loi du 1er janvier", first.get("title").asText());
        assertEquals("fr", first.get("title_lang").asText());

        JsonNode second = out.get("results").get(1);
        assertTrue(second.get("title").isNull(), "unbound variable maps to null");
        assertFalse(second.has("title_lang"));
    }

    @Test
    void addsMetadata() throws Exception {
        JsonNode raw = mapper.readTree(SparqlFormattersTest.SELECT_DOC);

        JsonNode metadata = mapper.readTree(formatter.format(raw, "SELECT ?law ?title")).get("metadata");

        assertEquals(2, metadata.get("count").asInt());
        assertEquals("law", metadata.get("variables").get(0).asText());
        assertEquals(0, metadata.get("links").size());
        assertEquals("SELECT ?law ?title", metadata.get("query").asText());
    }

    @Test
    void askAndEmptyAndGraphResults() throws Exception {
        JsonNode ask = mapper.readTree(formatter.format(mapper.readTree("{\"head\":{},\"boolean\":true}"), null));
        assertEquals("ASK", ask.get("type").asText());
        assertTrue(ask.get("result").asBoolean());
        assertEquals("ASK", ask.get("metadata").get("type").asText());
        assertFalse(ask.get("metadata").has("query"));

        JsonNode empty = mapper.readTree(formatter.format(mapper.readTree("{\"head\":{\"vars\":[\"s\"]}}"), null));
        assertEquals("SELECT", empty.get("type").asText());
        assertEquals(0, empty.get("results").size());

        JsonNode graph = mapper.readTree(formatter.format(mapper.readTree("{\"@graph\":[]}"), null));
        assertEquals("GRAPH", graph.get("type").asText());
        assertTrue(graph.get("results").has("@graph"));
    }

    @Test
    void doesNotMutateRawInput() throws Exception {
        JsonNode raw = mapper.readTree(SparqlFormattersTest.SELECT_DOC);
        JsonNode before = raw.deepCopy();

        new JsonResultFormatter(mapper, new FormatOptions(true, false)).format(raw, "Q");
        formatter.format(raw, "Q");

        assertEquals(before, raw);
    }
}
