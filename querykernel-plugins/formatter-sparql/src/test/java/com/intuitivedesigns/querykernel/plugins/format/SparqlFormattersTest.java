/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.querykernel.cache.CachePolicy;
import com.intuitivedesigns.querykernel.cache.CacheSettings;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.core.CachingExecutor;
import com.intuitivedesigns.querykernel.core.RemoteExecutor;
import com.intuitivedesigns.querykernel.core.ResultFormatter;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SparqlFormattersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SELECT_DOC = "{"
            + "\"head\":{\"vars\":[\"law\",\"title\"]},"
            + "\"results\":{\"bindings\":["
            + "{\"law\":{\"type\":\"uri\",\"value\":\"http://data.legilux.public.lu/eli/etat/leg/loi/2020/01\"},"
            + "\"title\":{\"type\":\"literal\",\"value\":\"Loi du 1er janvier\",\"xml:lang\":\"fr\"}},"
            + "{\"law\":{\"type\":\"uri\",\"value\":\"http://data.legilux.public.lu/eli/etat/leg/loi/2020/02\"}}"
            + "]}}";

    @Test
    void discoversAllBuiltInFormatters() {
        Map<String, ResultFormatter<JsonNode, String>> formatters = SparqlFormatters.discover(KernelConfig.empty());

        assertEquals(List.of("JSON", "SIMPLIFIED", "TABULAR"), List.copyOf(formatters.keySet()));
        assertInstanceOf(SimplifiedResultFormatter.class, formatters.get("SIMPLIFIED"));
    }

    @Test
    void prettyPrintFollowsConfig() throws Exception {
        JsonNode raw = MAPPER.readTree(SELECT_DOC);
        KernelConfig pretty = KernelConfig.fromMap(Map.of(FormatOptions.KEY_PRETTY_PRINT, "true"));

        String compact = SparqlFormatters.discover(KernelConfig.empty()).get("JSON").format(raw, null);
        String indented = SparqlFormatters.discover(pretty).get("JSON").format(raw, null);

        assertFalse(compact.contains("\n"));
        assertTrue(indented.contains("\n"));
        assertEquals(MAPPER.readTree(compact), MAPPER.readTree(indented));
    }

    @Test
    void cachesFormattedDocumentsEndToEnd() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RemoteExecutor<JsonNode> remote = (query, endpoint) -> {
            calls.incrementAndGet();
            try {
                return MAPPER.readTree(SELECT_DOC);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
        CachingExecutor<JsonNode, String> exec = new CachingExecutor<>(
                remote,
                SparqlFormatters.discover(KernelConfig.empty()),
                new CacheSettings(true, 300, 10, CachePolicy.LFU, "SIMPLIFIED"));

        String first = exec.execute("SELECT ?law ?title WHERE { ... }", "https://data.legilux.public.lu/sparqlendpoint");
        String again = exec.execute("SELECT ?law ?title WHERE { ... }", "https://data.legilux.public.lu/sparqlendpoint", "simplified");
        String table = exec.execute("SELECT ?law ?title WHERE { ... }", "https://data.legilux.public.lu/sparqlendpoint", "tabular");

        assertEquals(first, again);
        assertEquals("SELECT", MAPPER.readTree(table).get("type").asText());
        assertEquals(2, calls.get());
        assertEquals(2, exec.getCacheStats().size());
    }

    @Test
    void updateConfigAppliesFormatterOptions() throws Exception {
        RemoteExecutor<JsonNode> remote = (query, endpoint) -> {
            try {
                return MAPPER.readTree(SELECT_DOC);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
        CachingExecutor<JsonNode, String> exec = new CachingExecutor<>(
                remote, SparqlFormatters::discover, KernelConfig.empty(), MetricsRuntime.noop(), Clock.systemUTC());
        String before = exec.execute("SELECT ?law WHERE { ... }", "https://data.legilux.public.lu/sparqlendpoint", "JSON");
        assertFalse(before.contains("\n"));
        assertTrue(MAPPER.readTree(before).has("metadata"));

        exec.updateConfig(KernelConfig.fromMap(Map.of(
                "cache.enabled", "false",
                FormatOptions.KEY_PRETTY_PRINT, "true",
                FormatOptions.KEY_INCLUDE_METADATA, "false")));

        String after = exec.execute("SELECT ?law WHERE { ... }", "https://data.legilux.public.lu/sparqlendpoint", "JSON");
        assertTrue(after.contains("\n"));
        assertFalse(MAPPER.readTree(after).has("metadata"));
    }
}
