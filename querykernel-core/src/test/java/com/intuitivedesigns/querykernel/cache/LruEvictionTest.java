/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.intuitivedesigns.querykernel.cache.PolicyCacheTest.key;
import static org.junit.jupiter.api.Assertions.*;

class LruEvictionTest {

    private final CacheKey a = key("A");
    private final CacheKey b = key("B");
    private final CacheKey c = key("C");

    private final PolicyCache<String> cache = new PolicyCache<>(CachePolicy.LRU, 2, 300, new ManualClock(0));

    @Test
    void readProtectsEntry() {
        cache.set(a, "a");
        cache.set(b, "b");
        cache.get(a);

        cache.set(c, "c");

        assertEquals(Optional.of("a"), cache.get(a));
        assertEquals(Optional.empty(), cache.get(b));
        assertEquals(Optional.of("c"), cache.get(c));
    }

    @Test
    void withoutReadsOldestGoesFirst() {
        cache.set(a, "a");
        cache.set(b, "b");

        cache.set(c, "c");

        assertEquals(Optional.empty(), cache.get(a));
        assertEquals(Optional.of("b"), cache.get(b));
    }

    @Test
    void overwriteRefreshesRecency() {
        cache.set(a, "a");
        cache.set(b, "b");
        cache.set(a, "a2");

        cache.set(c, "c");

        assertEquals(Optional.of("a2"), cache.get(a));
        assertEquals(Optional.empty(), cache.get(b));
    }

    @Test
    void missDoesNotReorder() {
        cache.set(a, "a");
        cache.set(b, "b");
        cache.get(c);

        cache.set(c, "c");

        assertEquals(Optional.empty(), cache.get(a));
    }
}
