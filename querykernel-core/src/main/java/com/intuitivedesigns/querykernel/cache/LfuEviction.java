/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import java.util.Arrays;
import java.util.TreeSet;

import static com.intuitivedesigns.querykernel.cache.SlotArena.NIL;

/**
 * Least Frequently Used.
 *
 * <p>Counters start at 1 on insert, grow by one per hit and survive overwrites.
 * Victim: lowest counter, then oldest stamp. A stamp is a monotonic sequence number
 * refreshed on every insert and overwrite, so two sets in the same millisecond still
 * order deterministically.</p>
 *
 * <p>Slots are kept in a tree ordered by (count, stamp). A slot must be taken out of
 * the tree before its count or stamp changes, and put back afterwards.</p>
 */
final class LfuEviction implements EvictionStrategy {

    private long[] counts;
    private long[] stamps;
    private long nextStamp;

    private final TreeSet<Integer> byFrequency = new TreeSet<>(this::compareSlots);

    LfuEviction(int initialSlots) {
        int n = Math.max(1, initialSlots);
        this.counts = new long[n];
        this.stamps = new long[n];
    }

    @Override
    public void onInsert(int slot) {
        ensure(slot);
        counts[slot] = 1;
        stamps[slot] = nextStamp++;
        byFrequency.add(slot);
    }

    @Override
    public void onOverwrite(int slot) {
        byFrequency.remove(slot);
        stamps[slot] = nextStamp++;
        byFrequency.add(slot);
    }

    @Override
    public void onAccess(int slot) {
        byFrequency.remove(slot);
        counts[slot]++;
        byFrequency.add(slot);
    }

    @Override
    public void onRemove(int slot) {
        byFrequency.remove(slot);
    }

    @Override
    public int pickVictim() {
        return byFrequency.isEmpty() ? NIL : byFrequency.first();
    }

    @Override
    public void clear() {
        byFrequency.clear();
    }

    private int compareSlots(Integer a, Integer b) {
        int byCount = Long.compare(counts[a], counts[b]);
        if (byCount != 0) return byCount;
        int byStamp = Long.compare(stamps[a], stamps[b]);
        return byStamp != 0 ? byStamp : Integer.compare(a, b);
    }

    private void ensure(int slot) {
        if (slot < counts.length) return;
        int grown = Math.max(slot + 1, SlotArena.grow(counts.length));
        counts = Arrays.copyOf(counts, grown);
        stamps = Arrays.copyOf(stamps, grown);
    }
}
