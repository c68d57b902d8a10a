/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

/**
 * Raised when a configuration value is out of range or unrecognized.
 * Always thrown before any state is mutated.
 */
public class ConfigurationException extends IllegalArgumentException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return the offending configuration key
     */
    public String key() {
        return key;
    }
}
