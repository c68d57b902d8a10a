/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import java.util.Optional;

/**
 * Bounded, TTL-aware store of formatted query results.
 *
 * <p><b>Thread-safety Contract:</b></p>
 * Implementations provide their own mutual exclusion; callers never synchronize externally.
 * No operation performs I/O.
 *
 * <p><b>Totality:</b></p>
 * Nothing throws for "not found". Absence is expressed through return values.
 *
 * @param <V> The type of value being cached.
 */
public interface QueryCache<V> {

    /**
     * @return the value, or {@code Optional.empty()} if absent or older than the TTL.
     *         Expired entries are removed as a side effect.
     */
    Optional<V> get(CacheKey key);

    /**
     * Inserts or wholesale-replaces the entry for {@code key}, timestamped now.
     * A new key arriving at capacity evicts exactly one victim first; an overwrite never evicts.
     */
    void set(CacheKey key, V value);

    /**
     * @return true if an entry was present and removed
     */
    boolean invalidate(CacheKey key);

    void clear();

    /**
     * @return current entry count, including expired entries not yet visited
     */
    int size();

    int maxSize();

    int ttlSeconds();

    CachePolicy policy();
}
