/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

public final class QueryCacheFactory {

    private static final Logger log = LoggerFactory.getLogger(QueryCacheFactory.class);

    private QueryCacheFactory() {}

    public static <V> QueryCache<V> create(CacheSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clock, "clock");
        log.info("Creating {} query cache (Size={}, TTL={}s)", settings.policy(), settings.maxSize(), settings.ttlSeconds());
        return new PolicyCache<>(settings.policy(), settings.maxSize(), settings.ttlSeconds(), clock);
    }
}
