/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

import java.util.Set;

/**
 * No formatter is registered for the requested format id.
 */
public class UnsupportedFormatException extends QueryExecutionException {

    private final String formatId;

    public UnsupportedFormatException(String formatId, Set<String> available) {
        super("Unsupported result format '" + formatId + "'. Available options: " + available);
        this.formatId = formatId;
    }

    public String formatId() {
        return formatId;
    }
}
