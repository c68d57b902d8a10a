/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import java.util.function.DoubleSupplier;

/**
 * Vendor-agnostic metrics seam used by the caching executor.
 *
 * <p>Gauges are pull-based: the caller hands over a {@link DoubleSupplier} once and the backend
 * samples it on scrape. Timers receive one duration per remote call.</p>
 *
 * <p>{@link #noop()} records nothing and is the default for callers that do not care about metrics.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = () -> null;

    static MetricsRuntime noop() {
        return NOOP;
    }

    /**
     * Returns the underlying registry (a Micrometer {@code MeterRegistry} for the Micrometer runtime).
     * Typed as Object so callers need no compile-time dependency on the backend.
     */
    Object registry();

    default boolean enabled() { return false; }

    /**
     * @return implementation id, e.g. "MICROMETER" or "NOOP"
     */
    default String type() { return "NOOP"; }

    default void timer(String name, long durationMillis) {}

    /**
     * Registers {@code source} as the value of gauge {@code name}. Only the first registration
     * of a name takes effect.
     */
    default void gauge(String name, DoubleSupplier source) {}

    @Override
    default void close() {}
}
