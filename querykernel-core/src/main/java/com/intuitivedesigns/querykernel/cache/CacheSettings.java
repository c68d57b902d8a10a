/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import com.intuitivedesigns.querykernel.config.ConfigurationException;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.spi.PluginIds;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable, validated cache configuration.
 *
 * <p>Construction is the validation step: an instance that exists is valid, so
 * swapping one into a running executor can never leave it half-configured.</p>
 *
 * @param enabled whether {@code execute} consults the cache at all
 * @param ttlSeconds maximum entry age, &gt; 0
 * @param maxSize entry bound, &gt; 0
 * @param policy eviction policy
 * @param defaultFormat format id used when a caller passes none
 */
public record CacheSettings(
        boolean enabled,
        int ttlSeconds,
        int maxSize,
        CachePolicy policy,
        String defaultFormat
) {

    // ---- Config keys ----
    public static final String KEY_ENABLED = "cache.enabled";
    public static final String KEY_TTL_SECONDS = "cache.ttl.seconds";
    public static final String KEY_MAX_SIZE = "cache.max.size";
    public static final String KEY_POLICY = "cache.policy";
    public static final String KEY_DEFAULT_FORMAT = "format.default";

    // ---- Defaults ----
    public static final boolean DEFAULT_ENABLED = true;
    public static final int DEFAULT_TTL_SECONDS = 300;
    public static final int DEFAULT_MAX_SIZE = 100;
    public static final CachePolicy DEFAULT_POLICY = CachePolicy.LRU;
    public static final String DEFAULT_FORMAT = "JSON";

    public CacheSettings {
        if (ttlSeconds <= 0) {
            throw new ConfigurationException(KEY_TTL_SECONDS, "ttlSeconds must be > 0, got " + ttlSeconds);
        }
        if (maxSize <= 0) {
            throw new ConfigurationException(KEY_MAX_SIZE, "maxSize must be > 0, got " + maxSize);
        }
        if (policy == null) {
            throw new ConfigurationException(KEY_POLICY, "policy must not be null");
        }
        defaultFormat = PluginIds.normalize(defaultFormat);
        if (defaultFormat.isEmpty()) {
            throw new ConfigurationException(KEY_DEFAULT_FORMAT, "defaultFormat must not be blank");
        }
    }

    public CacheSettings(boolean enabled, int ttlSeconds, int maxSize, CachePolicy policy) {
        this(enabled, ttlSeconds, maxSize, policy, DEFAULT_FORMAT);
    }

    public static CacheSettings defaults() {
        return new CacheSettings(DEFAULT_ENABLED, DEFAULT_TTL_SECONDS, DEFAULT_MAX_SIZE, DEFAULT_POLICY, DEFAULT_FORMAT);
    }

    /**
     * Parses the cache keys of {@code config}. Absent keys take their defaults;
     * present but malformed keys are rejected rather than defaulted.
     *
     * @throws ConfigurationException on any malformed or out-of-range value
     */
    public static CacheSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        final boolean enabled = parseBoolean(config, KEY_ENABLED, DEFAULT_ENABLED);
        final int ttl = parsePositiveInt(config, KEY_TTL_SECONDS, DEFAULT_TTL_SECONDS);
        final int maxSize = parsePositiveInt(config, KEY_MAX_SIZE, DEFAULT_MAX_SIZE);
        final CachePolicy policy = config.hasPath(KEY_POLICY)
                ? CachePolicy.parse(config.getString(KEY_POLICY, null))
                : DEFAULT_POLICY;
        final String defaultFormat = config.getString(KEY_DEFAULT_FORMAT, DEFAULT_FORMAT);

        return new CacheSettings(enabled, ttl, maxSize, policy, defaultFormat);
    }

    /**
     * @return true when switching from {@code other} to this requires a fresh cache
     */
    public boolean requiresRebuild(CacheSettings other) {
        return other == null
                || ttlSeconds != other.ttlSeconds
                || maxSize != other.maxSize
                || policy != other.policy;
    }

    public CacheSettings withEnabled(boolean value) {
        return new CacheSettings(value, ttlSeconds, maxSize, policy, defaultFormat);
    }

    public CacheSettings withTtlSeconds(int value) {
        return new CacheSettings(enabled, value, maxSize, policy, defaultFormat);
    }

    public CacheSettings withMaxSize(int value) {
        return new CacheSettings(enabled, ttlSeconds, value, policy, defaultFormat);
    }

    public CacheSettings withPolicy(CachePolicy value) {
        return new CacheSettings(enabled, ttlSeconds, maxSize, value, defaultFormat);
    }

    public CacheSettings withDefaultFormat(String value) {
        return new CacheSettings(enabled, ttlSeconds, maxSize, policy, value);
    }

    private static int parsePositiveInt(KernelConfig config, String key, int defaultValue) {
        final String raw = config.getString(key, null);
        if (raw == null) return defaultValue;
        final int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "Expected an integer for '" + key + "', got '" + raw + "'", e);
        }
        if (value <= 0) {
            throw new ConfigurationException(key, "'" + key + "' must be > 0, got " + value);
        }
        return value;
    }

    private static boolean parseBoolean(KernelConfig config, String key, boolean defaultValue) {
        final String raw = config.getString(key, null);
        if (raw == null) return defaultValue;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new ConfigurationException(key, "Expected true/false for '" + key + "', got '" + raw + "'");
        }
    }
}
