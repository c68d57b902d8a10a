/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import java.util.Arrays;

import static com.intuitivedesigns.querykernel.cache.SlotArena.NIL;

/**
 * Doubly-linked list of arena slots kept in parallel {@code prev}/{@code next} arrays.
 * Every operation is O(1) apart from occasional array growth.
 */
final class SlotList {

    private int[] prev;
    private int[] next;
    private boolean[] linked;
    private int head = NIL;
    private int tail = NIL;

    SlotList(int initialSlots) {
        int n = Math.max(1, initialSlots);
        this.prev = new int[n];
        this.next = new int[n];
        this.linked = new boolean[n];
    }

    void addLast(int slot) {
        ensure(slot);
        prev[slot] = tail;
        next[slot] = NIL;
        if (tail == NIL) {
            head = slot;
        } else {
            next[tail] = slot;
        }
        tail = slot;
        linked[slot] = true;
    }

    void remove(int slot) {
        if (slot >= linked.length || !linked[slot]) return;
        int p = prev[slot];
        int n = next[slot];
        if (p == NIL) head = n; else next[p] = n;
        if (n == NIL) tail = p; else prev[n] = p;
        prev[slot] = NIL;
        next[slot] = NIL;
        linked[slot] = false;
    }

    void moveToLast(int slot) {
        if (slot == tail) return;
        remove(slot);
        addLast(slot);
    }

    int first() {
        return head;
    }

    void clear() {
        Arrays.fill(linked, false);
        head = NIL;
        tail = NIL;
    }

    private void ensure(int slot) {
        if (slot < prev.length) return;
        int grown = Math.max(slot + 1, SlotArena.grow(prev.length));
        prev = Arrays.copyOf(prev, grown);
        next = Arrays.copyOf(next, grown);
        linked = Arrays.copyOf(linked, grown);
    }
}
