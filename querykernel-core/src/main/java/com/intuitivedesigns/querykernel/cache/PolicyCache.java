/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single cache engine behind every policy.
 *
 * Characteristics:
 * - Thread-safe (one coarse lock over the map and the policy metadata)
 * - Bounded (size never exceeds maxSize once {@link #set} returns)
 * - Lazy TTL (expired entries are purged when looked up, no background sweep)
 *
 * <p>The policy only decides which slot to evict and whether reads reorder;
 * storage, expiry and bookkeeping live here.</p>
 */
public final class PolicyCache<V> implements QueryCache<V> {

    private static final Logger log = LoggerFactory.getLogger(PolicyCache.class);

    private static final int MAX_INITIAL_SLOTS = 1_024;

    private final CachePolicy policy;
    private final int maxSize;
    private final int ttlSeconds;
    private final long ttlMillis;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CacheKey, CacheEntry<V>> entries;
    private final SlotArena<CacheKey> arena;
    private final EvictionStrategy strategy;

    public PolicyCache(CachePolicy policy, int maxSize, int ttlSeconds) {
        this(policy, maxSize, ttlSeconds, Clock.systemUTC());
    }

    public PolicyCache(CachePolicy policy, int maxSize, int ttlSeconds, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, got " + maxSize);
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);
        }
        this.maxSize = maxSize;
        this.ttlSeconds = ttlSeconds;
        this.ttlMillis = ttlSeconds * 1_000L;

        // Metadata arrays grow on demand; do not pre-allocate huge caps
        int initialSlots = Math.min(maxSize, MAX_INITIAL_SLOTS);
        this.entries = new HashMap<>();
        this.arena = new SlotArena<>(initialSlots);
        this.strategy = policy.newStrategy(initialSlots);
    }

    @Override
    public Optional<V> get(CacheKey key) {
        if (key == null) return Optional.empty();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.millis(), ttlMillis)) {
                remove(key, entry.slot());
                log.debug("Expired entry purged key={}", key);
                return Optional.empty();
            }
            strategy.onAccess(entry.slot());
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(CacheKey key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> existing = entries.get(key);
            if (existing != null) {
                entries.put(key, new CacheEntry<>(value, now, existing.slot()));
                strategy.onOverwrite(existing.slot());
                return;
            }

            if (entries.size() >= maxSize) {
                evictOne();
            }

            int slot = arena.allocate(key);
            entries.put(key, new CacheEntry<>(value, now, slot));
            strategy.onInsert(slot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean invalidate(CacheKey key) {
        if (key == null) return false;
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            remove(key, entry.slot());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            arena.clear();
            strategy.clear();
        } finally {
            lock.unlock();
        }
        log.debug("{} cache cleared.", policy);
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int maxSize() {
        return maxSize;
    }

    @Override
    public int ttlSeconds() {
        return ttlSeconds;
    }

    @Override
    public CachePolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return "PolicyCache{policy=" + policy + ", maxSize=" + maxSize + ", ttlSeconds=" + ttlSeconds + "}";
    }

    // Caller holds the lock
    private void evictOne() {
        int victim = strategy.pickVictim();
        if (victim == SlotArena.NIL) {
            throw new IllegalStateException("Eviction strategy tracks no entries but cache holds " + entries.size());
        }
        CacheKey victimKey = arena.key(victim);
        remove(victimKey, victim);
        log.debug("{} evicted key={}", policy, victimKey);
    }

    // Caller holds the lock
    private void remove(CacheKey key, int slot) {
        entries.remove(key);
        strategy.onRemove(slot);
        arena.release(slot);
    }
}
