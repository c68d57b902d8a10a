/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Micrometer-backed {@link MetricsRuntime}.
 *
 * <ul>
 * <li>Meters land in a {@link CompositeMeterRegistry}; an in-memory {@link SimpleMeterRegistry} is always
 * attached and the host adds its own backends (Prometheus, JMX, ...) via {@link #addRegistry}.</li>
 * <li>Gauges sample their supplier on scrape, so the cache-size gauge follows the live cache,
 * including rebuilds and clears, without the executor pushing values.</li>
 * <li>Timers are resolved once per name.</li>
 * </ul>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    public static final String KEY_ENABLED = "metrics.enabled";

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Set<String> gauges = ConcurrentHashMap.newKeySet();

    public MicrometerMetricsRuntime(MeterRegistry... backends) {
        registry.add(new SimpleMeterRegistry());
        for (MeterRegistry backend : backends) {
            addRegistry(backend);
        }
    }

    /**
     * Micrometer runtime when {@code metrics.enabled=true}, {@link MetricsRuntime#noop()} otherwise.
     */
    public static MetricsRuntime fromConfig(KernelConfig config) {
        final boolean enabled = config.getBoolean(KEY_ENABLED, false);
        log.info("Metrics runtime: {}", enabled ? "MICROMETER" : "NOOP");
        return enabled ? new MicrometerMetricsRuntime() : MetricsRuntime.noop();
    }

    public void addRegistry(MeterRegistry backend) {
        registry.add(Objects.requireNonNull(backend, "backend"));
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void timer(String name, long durationMillis) {
        timers.computeIfAbsent(name, n -> Timer.builder(n).register(registry))
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, DoubleSupplier source) {
        Objects.requireNonNull(source, "source");
        if (!gauges.add(name)) {
            log.debug("Gauge {} already registered, keeping the first source", name);
            return;
        }
        // Strong reference: the supplier is often a lambda nobody else holds
        Gauge.builder(name, source, DoubleSupplier::getAsDouble)
                .strongReference(true)
                .register(registry);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed");
    }
}
