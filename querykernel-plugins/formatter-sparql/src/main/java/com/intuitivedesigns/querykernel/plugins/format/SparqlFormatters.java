/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.core.ResultFormatter;
import com.intuitivedesigns.querykernel.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the per-format formatter set handed to the caching executor.
 */
public final class SparqlFormatters {

    private static final Logger log = LoggerFactory.getLogger(SparqlFormatters.class);

    // ObjectMapper is thread-safe once configured
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SparqlFormatters() {}

    static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Scans the classpath for {@link SparqlFormatterPlugin}s and instantiates each one.
     */
    public static Map<String, ResultFormatter<JsonNode, String>> discover(KernelConfig config) {
        return fromRegistry(new ServicePluginRegistry<>(SparqlFormatterPlugin.class), config);
    }

    public static Map<String, ResultFormatter<JsonNode, String>> fromRegistry(
            ServicePluginRegistry<SparqlFormatterPlugin> registry, KernelConfig config) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(config, "config");

        Map<String, ResultFormatter<JsonNode, String>> out = new LinkedHashMap<>();
        for (String id : registry.availableIds()) {
            out.put(id, registry.require(id, "format").create(config));
        }
        log.info("Result formatters loaded: {}", out.keySet());
        return Collections.unmodifiableMap(out);
    }
}
