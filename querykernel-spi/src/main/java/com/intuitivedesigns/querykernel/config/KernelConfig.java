/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration backed by {@link Properties}.
 * Loads from -Dqk.config.path or ENV 'QK_CONFIG_PATH'.
 *
 * <p>Instances are immutable snapshots. Hosting services build a new one
 * and hand it to the executor instead of mutating a shared instance.</p>
 */
public final class KernelConfig {

    public static final String PATH_PROPERTY = "qk.config.path";
    public static final String PATH_ENV = "QK_CONFIG_PATH";

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    private final Properties props;

    private KernelConfig(Properties props) {
        this.props = props;
    }

    public static KernelConfig empty() {
        return new KernelConfig(new Properties());
    }

    public static KernelConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new KernelConfig(copy);
    }

    public static KernelConfig fromMap(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        source.forEach((k, v) -> {
            if (k != null && v != null) copy.setProperty(k, v);
        });
        return new KernelConfig(copy);
    }

    /**
     * Resolves the config path from the system property first, then the environment.
     * A missing path yields an empty config (all defaults).
     *
     * @throws UncheckedIOException if a path is set but the file cannot be read
     */
    public static KernelConfig load() {
        // 1. System property (-Dqk.config.path)
        String path = System.getProperty(PATH_PROPERTY);

        // 2. Environment variable
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified, using defaults. Usage: -D{}=/path/to/querykernel.properties", PATH_PROPERTY);
            return empty();
        }
        return load(path);
    }

    public static KernelConfig load(String path) {
        Objects.requireNonNull(path, "path");
        log.info("Loading configuration from: {}", path);
        Properties loaded = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            loaded.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties.", loaded.size());
        return new KernelConfig(loaded);
    }

    /**
     * Returns a copy of this config with {@code key} set to {@code value}.
     */
    public KernelConfig with(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Properties copy = new Properties();
        for (String name : props.stringPropertyNames()) {
            copy.setProperty(name, props.getProperty(name));
        }
        copy.setProperty(key, value);
        return new KernelConfig(copy);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
