/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * Least Recently Used: head of the list is the coldest entry, every hit moves to the tail.
 */
final class LruEviction extends OrderedEviction {

    LruEviction(int initialSlots) {
        super(initialSlots);
    }

    @Override
    public void onAccess(int slot) {
        order.moveToLast(slot);
    }
}
