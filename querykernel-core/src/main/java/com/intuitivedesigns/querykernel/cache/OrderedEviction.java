/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

/**
 * Shared machinery for policies that evict from the head of a single ordered list.
 * Inserts and overwrites both go to the tail; subclasses decide what a read does.
 */
abstract class OrderedEviction implements EvictionStrategy {

    protected final SlotList order;

    OrderedEviction(int initialSlots) {
        this.order = new SlotList(initialSlots);
    }

    @Override
    public void onInsert(int slot) {
        order.addLast(slot);
    }

    @Override
    public void onOverwrite(int slot) {
        order.moveToLast(slot);
    }

    @Override
    public void onRemove(int slot) {
        order.remove(slot);
    }

    @Override
    public int pickVictim() {
        return order.first();
    }

    @Override
    public void clear() {
        order.clear();
    }
}
