/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * Point-in-time view of a cache. {@code size} is 0 while caching is disabled.
 */
public record CacheStats(
        boolean enabled,
        int size,
        int maxSize,
        int ttlSeconds,
        CachePolicy policy
) {
}
