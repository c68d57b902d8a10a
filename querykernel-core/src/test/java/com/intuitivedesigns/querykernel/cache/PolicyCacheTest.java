/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every policy shares.
 */
class PolicyCacheTest {

    private static final CacheKey A = key("A");
    private static final CacheKey B = key("B");
    private static final CacheKey C = key("C");

    static CacheKey key(String query) {
        return CacheKey.derive(query, "E", "JSON");
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void getReturnsWhatWasSet(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 10, 60, new ManualClock(0));

        assertEquals(Optional.empty(), cache.get(A));
        cache.set(A, "F1");

        assertEquals(Optional.of("F1"), cache.get(A));
        assertEquals(1, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void sizeNeverExceedsMaxSize(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 3, 60, new ManualClock(0));

        for (int i = 0; i < 50; i++) {
            cache.set(key("Q" + i), "V" + i);
            if (i % 3 == 0) cache.get(key("Q" + (i / 2)));
            assertTrue(cache.size() <= 3, "size after set #" + i);
        }
        assertEquals(3, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void entryLivesForExactlyTtl(CachePolicy policy) {
        ManualClock clock = new ManualClock(1_000_000);
        PolicyCache<String> cache = new PolicyCache<>(policy, 10, 300, clock);
        cache.set(A, "F1");

        clock.advanceMillis(299_999);
        assertEquals(Optional.of("F1"), cache.get(A));

        clock.advanceMillis(1);
        assertEquals(Optional.empty(), cache.get(A));
        assertEquals(0, cache.size(), "expired entry is purged by the lookup");
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void expiredEntriesStayCountedUntilVisited(CachePolicy policy) {
        ManualClock clock = new ManualClock(0);
        PolicyCache<String> cache = new PolicyCache<>(policy, 10, 5, clock);
        cache.set(A, "1");
        cache.set(B, "2");

        clock.advanceSeconds(10);
        assertEquals(2, cache.size());

        cache.get(A);
        assertEquals(1, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void overwriteRefreshesTtlAndReplacesValue(CachePolicy policy) {
        ManualClock clock = new ManualClock(0);
        PolicyCache<String> cache = new PolicyCache<>(policy, 10, 10, clock);
        cache.set(A, "old");

        clock.advanceSeconds(8);
        cache.set(A, "new");
        clock.advanceSeconds(8);

        assertEquals(Optional.of("new"), cache.get(A));
        assertEquals(1, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void overwriteAtCapacityNeverEvicts(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 2, 60, new ManualClock(0));
        cache.set(A, "a");
        cache.set(B, "b");

        cache.set(A, "a2");
        cache.set(B, "b2");

        assertEquals(2, cache.size());
        assertEquals(Optional.of("a2"), cache.get(A));
        assertEquals(Optional.of("b2"), cache.get(B));
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void invalidateReportsWhetherSomethingWasRemoved(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 2, 60, new ManualClock(0));
        cache.set(A, "a");

        assertTrue(cache.invalidate(A));
        assertFalse(cache.invalidate(A));
        assertFalse(cache.invalidate(B));
        assertEquals(0, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void invalidatedSlotsAreReused(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 2, 60, new ManualClock(0));
        cache.set(A, "a");
        cache.set(B, "b");
        cache.invalidate(A);

        cache.set(C, "c");

        assertEquals(2, cache.size());
        assertEquals(Optional.of("b"), cache.get(B));
        assertEquals(Optional.of("c"), cache.get(C));
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void clearRemovesEverythingAndCacheStaysUsable(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 2, 60, new ManualClock(0));
        cache.set(A, "a");
        cache.set(B, "b");

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(Optional.empty(), cache.get(A));

        cache.set(A, "a");
        cache.set(B, "b");
        cache.set(C, "c");
        assertEquals(2, cache.size());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void nullKeysAreAbsentNotErrors(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 2, 60, new ManualClock(0));

        assertEquals(Optional.empty(), cache.get(null));
        assertFalse(cache.invalidate(null));
        assertThrows(NullPointerException.class, () -> cache.set(A, null));
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void growsPastInitialSlotAllocation(CachePolicy policy) {
        PolicyCache<Integer> cache = new PolicyCache<>(policy, 5_000, 60, new ManualClock(0));
        for (int i = 0; i < 6_000; i++) {
            cache.set(key("Q" + i), i);
        }
        assertEquals(5_000, cache.size());
        assertEquals(Optional.of(5_999), cache.get(key("Q5999")));
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void exposesItsParameters(CachePolicy policy) {
        PolicyCache<String> cache = new PolicyCache<>(policy, 7, 42);

        assertEquals(policy, cache.policy());
        assertEquals(7, cache.maxSize());
        assertEquals(42, cache.ttlSeconds());
    }

    @ParameterizedTest
    @EnumSource(CachePolicy.class)
    void rejectsNonPositiveBounds(CachePolicy policy) {
        assertThrows(IllegalArgumentException.class, () -> new PolicyCache<String>(policy, 0, 60));
        assertThrows(IllegalArgumentException.class, () -> new PolicyCache<String>(policy, 10, 0));
    }
}
