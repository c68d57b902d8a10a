/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import com.intuitivedesigns.querykernel.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported replacement policies.
 */
public enum CachePolicy {

    /** Least Recently Used. Reads move an entry to the protected end. */
    LRU {
        @Override
        EvictionStrategy newStrategy(int initialSlots) {
            return new LruEviction(initialSlots);
        }
    },

    /** Least Frequently Used. Ties go to the oldest insertion. */
    LFU {
        @Override
        EvictionStrategy newStrategy(int initialSlots) {
            return new LfuEviction(initialSlots);
        }
    },

    /** First In First Out. Reads never reorder. */
    FIFO {
        @Override
        EvictionStrategy newStrategy(int initialSlots) {
            return new FifoEviction(initialSlots);
        }
    };

    abstract EvictionStrategy newStrategy(int initialSlots);

    /**
     * Case-insensitive lookup.
     *
     * @throws ConfigurationException for blank or unknown names
     */
    public static CachePolicy parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(CacheSettings.KEY_POLICY, "Cache policy must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(CacheSettings.KEY_POLICY,
                    "Unknown cache policy '" + name + "'. Available options: " + Arrays.toString(values()), e);
        }
    }
}
