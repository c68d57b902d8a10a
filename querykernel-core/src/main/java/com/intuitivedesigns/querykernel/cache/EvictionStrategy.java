/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * Decides what to evict and whether a read reorders anything.
 *
 * <p>Strategies see only arena slot indices, never keys or values. The owning
 * {@link PolicyCache} calls every method while holding its lock, so
 * implementations need no synchronization of their own.</p>
 */
interface EvictionStrategy {

    /** A new key was placed in {@code slot}. */
    void onInsert(int slot);

    /** The key in {@code slot} received a new value. */
    void onOverwrite(int slot);

    /** The key in {@code slot} was read and was still live. */
    void onAccess(int slot);

    /** The key in {@code slot} left the cache for any reason. */
    void onRemove(int slot);

    /**
     * @return the slot to evict next, or {@link SlotArena#NIL} if nothing is tracked
     */
    int pickVictim();

    void clear();
}
