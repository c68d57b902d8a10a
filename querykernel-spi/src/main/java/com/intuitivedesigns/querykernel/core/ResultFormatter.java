/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

/**
 * Shapes a raw query result into a named presentation format.
 * Implementations must be pure: the same input always yields an equal output,
 * and the returned value must not be mutated afterwards (it may be cached).
 *
 * @param <R> raw result type
 * @param <F> formatted value type
 */
@FunctionalInterface
public interface ResultFormatter<R, F> {

    /**
     * @param raw the raw result returned by the remote executor
     * @param queryText the query that produced it, for metadata
     * @return the formatted value
     */
    F format(R raw, String queryText);
}
