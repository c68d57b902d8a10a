/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * First In First Out: strict (last-)insertion order. Reads never protect an entry.
 */
final class FifoEviction extends OrderedEviction {

    FifoEviction(int initialSlots) {
        super(initialSlots);
    }

    @Override
    public void onAccess(int slot) {
        // reads never reorder
    }
}
