/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * Internal cache record. Replaced, never mutated, on overwrite.
 *
 * @param value the cached value
 * @param insertedAtMillis clock time of the last {@code set}
 * @param slot arena slot holding this key's ordering metadata
 */
record CacheEntry<V>(V value, long insertedAtMillis, int slot) {

    boolean isExpired(long nowMillis, long ttlMillis) {
        return nowMillis - insertedAtMillis >= ttlMillis;
    }
}
