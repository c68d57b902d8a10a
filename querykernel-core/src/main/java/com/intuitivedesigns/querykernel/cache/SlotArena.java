/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import java.util.Arrays;

/**
 * Index-addressed storage of keys. Freed slots are recycled through an intrusive free list,
 * so slot numbers stay below the peak number of live keys.
 */
final class SlotArena<K> {

    static final int NIL = -1;

    private Object[] keys;
    private int[] nextFree;
    private int freeHead = NIL;
    private int highWater;

    SlotArena(int initialSlots) {
        int n = Math.max(1, initialSlots);
        this.keys = new Object[n];
        this.nextFree = new int[n];
    }

    int allocate(K key) {
        int slot;
        if (freeHead != NIL) {
            slot = freeHead;
            freeHead = nextFree[slot];
        } else {
            if (highWater == keys.length) {
                int grown = SlotArena.grow(keys.length);
                keys = Arrays.copyOf(keys, grown);
                nextFree = Arrays.copyOf(nextFree, grown);
            }
            slot = highWater++;
        }
        keys[slot] = key;
        nextFree[slot] = NIL;
        return slot;
    }

    void release(int slot) {
        keys[slot] = null;
        nextFree[slot] = freeHead;
        freeHead = slot;
    }

    @SuppressWarnings("unchecked")
    K key(int slot) {
        return (K) keys[slot];
    }

    void clear() {
        Arrays.fill(keys, 0, highWater, null);
        freeHead = NIL;
        highWater = 0;
    }

    static int grow(int length) {
        int grown = length + (length >> 1) + 1;
        return grown < 0 ? Integer.MAX_VALUE - 8 : grown;
    }
}
