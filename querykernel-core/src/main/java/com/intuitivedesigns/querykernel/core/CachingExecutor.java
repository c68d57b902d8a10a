/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

import com.intuitivedesigns.querykernel.cache.CacheKey;
import com.intuitivedesigns.querykernel.cache.CacheSettings;
import com.intuitivedesigns.querykernel.cache.CacheStats;
import com.intuitivedesigns.querykernel.cache.QueryCache;
import com.intuitivedesigns.querykernel.cache.QueryCacheFactory;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.spi.PluginIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Memoizes formatted results of remote read queries.
 *
 * <p><b>Flow:</b> derive key, consult cache, on miss call the {@link RemoteExecutor},
 * format with the {@link ResultFormatter} registered for the format id, populate, return.</p>
 *
 * <p><b>Formatters:</b> either a fixed map, or a factory that is re-run by
 * {@link #updateConfig(KernelConfig)} whenever a {@code format.*} option changes.</p>
 *
 * <p><b>Concurrency:</b></p>
 * <ul>
 * <li>Settings, formatters and cache are published together through one volatile snapshot; readers never lock.</li>
 * <li>The remote call happens outside every lock.</li>
 * <li>Concurrent misses on one key may each call the remote executor; the last {@code set} wins.</li>
 * </ul>
 *
 * @param <R> raw result type
 * @param <F> formatted (cached) value type
 */
public final class CachingExecutor<R, F> {

    private static final Logger log = LoggerFactory.getLogger(CachingExecutor.class);

    public static final String METRIC_CACHE_SIZE = "querykernel.cache.size";
    public static final String METRIC_REMOTE_LATENCY = "querykernel.remote.latency";

    private static final int LOG_QUERY_CHARS = 50;
    private static final String FORMAT_PREFIX = "format.";

    private final RemoteExecutor<R> remote;
    // null when the formatter map was supplied fixed
    private final Function<KernelConfig, ? extends Map<String, ? extends ResultFormatter<R, F>>> formatterFactory;
    private final MetricsRuntime metrics;
    private final Clock clock;

    private final ReentrantLock updateLock = new ReentrantLock();
    private volatile State<R, F> state;

    public CachingExecutor(RemoteExecutor<R> remote,
                           Map<String, ? extends ResultFormatter<R, F>> formatters,
                           CacheSettings settings) {
        this(remote, formatters, settings, MetricsRuntime.noop(), Clock.systemUTC());
    }

    public CachingExecutor(RemoteExecutor<R> remote,
                           Map<String, ? extends ResultFormatter<R, F>> formatters,
                           CacheSettings settings,
                           MetricsRuntime metrics,
                           Clock clock) {
        this(remote, null, normalizeFormatters(Objects.requireNonNull(formatters, "formatters")),
                Map.of(), settings, metrics, clock);
    }

    /**
     * Builds the executor from {@code config}: cache settings through {@link CacheSettings#from},
     * formatters through {@code formatterFactory}.
     *
     * @throws com.intuitivedesigns.querykernel.config.ConfigurationException if a cache key is invalid
     */
    public CachingExecutor(RemoteExecutor<R> remote,
                           Function<KernelConfig, ? extends Map<String, ? extends ResultFormatter<R, F>>> formatterFactory,
                           KernelConfig config,
                           MetricsRuntime metrics,
                           Clock clock) {
        this(remote,
                Objects.requireNonNull(formatterFactory, "formatterFactory"),
                buildFormatters(formatterFactory, Objects.requireNonNull(config, "config")),
                formatOptions(config),
                CacheSettings.from(config),
                metrics,
                clock);
    }

    private CachingExecutor(RemoteExecutor<R> remote,
                            Function<KernelConfig, ? extends Map<String, ? extends ResultFormatter<R, F>>> formatterFactory,
                            Map<String, ResultFormatter<R, F>> formatters,
                            Map<String, String> formatOptions,
                            CacheSettings settings,
                            MetricsRuntime metrics,
                            Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.formatterFactory = formatterFactory;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(settings, "settings");

        QueryCache<F> cache = settings.enabled() ? QueryCacheFactory.create(settings, clock) : null;
        this.state = new State<>(settings, formatters, formatOptions, cache);
        metrics.gauge(METRIC_CACHE_SIZE, this::liveCacheSize);
        log.info("CachingExecutor ready (enabled={}, formats={})", settings.enabled(), formatters.keySet());
    }

    /**
     * Runs {@code queryText} against {@code endpointId}, returning a cached result when one is live.
     *
     * @param formatId registered format id (case-insensitive), or {@code null} for the configured default
     * @throws UnsupportedFormatException if no formatter is registered for the format
     * @throws RemoteExecutionException if the remote call fails; nothing is cached in that case
     */
    public F execute(String queryText, String endpointId, String formatId) throws QueryExecutionException {
        Objects.requireNonNull(queryText, "queryText");
        Objects.requireNonNull(endpointId, "endpointId");

        final State<R, F> current = state;
        final String format = resolveFormat(current.settings(), formatId);
        final ResultFormatter<R, F> formatter = current.formatters().get(format);
        if (formatter == null) {
            throw new UnsupportedFormatException(formatId == null ? format : formatId, current.formatters().keySet());
        }

        final QueryCache<F> cache = current.settings().enabled() ? current.cache() : null;
        CacheKey key = null;
        if (cache != null) {
            key = CacheKey.derive(queryText, endpointId, format);
            Optional<F> hit = cache.get(key);
            if (hit.isPresent()) {
                log.debug("Cache hit for query: {}", abbreviate(queryText));
                return hit.get();
            }
            log.debug("Cache miss for query: {}", abbreviate(queryText));
        }

        final R raw = callRemote(queryText, endpointId);
        final F formatted = formatter.format(raw, queryText);
        if (formatted == null) {
            throw new IllegalStateException("Formatter for '" + format + "' returned null");
        }

        if (cache != null) {
            cache.set(key, formatted);
        }
        return formatted;
    }

    /**
     * Same as {@link #execute(String, String, String)} with the configured default format.
     */
    public F execute(String queryText, String endpointId) throws QueryExecutionException {
        return execute(queryText, endpointId, null);
    }

    /**
     * Applies new settings. A change of ttl, maxSize or policy discards the cache and starts
     * an empty one; toggling {@code enabled} alone keeps the existing cache.
     */
    public void updateConfig(CacheSettings newSettings) {
        Objects.requireNonNull(newSettings, "newSettings");
        updateLock.lock();
        try {
            apply(newSettings, null, null);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Parses {@code config} and applies it. When the executor was built with a formatter factory
     * and any {@code format.*} option differs from the last applied one, the formatters are
     * rebuilt and the live cache is cleared, since its entries were produced by the old ones.
     *
     * @throws com.intuitivedesigns.querykernel.config.ConfigurationException before any state changes
     */
    public void updateConfig(KernelConfig config) {
        Objects.requireNonNull(config, "config");
        final CacheSettings newSettings = CacheSettings.from(config);
        final Map<String, String> newOptions = formatOptions(config);

        updateLock.lock();
        try {
            Map<String, ResultFormatter<R, F>> rebuilt = null;
            if (!newOptions.equals(state.formatOptions())) {
                if (formatterFactory == null) {
                    log.warn("Formatter options changed to {} but this executor uses a fixed formatter set", newOptions);
                } else {
                    rebuilt = buildFormatters(formatterFactory, config);
                    log.info("Formatter options changed to {}, formatters rebuilt", newOptions);
                }
            }
            apply(newSettings, rebuilt, newOptions);
        } finally {
            updateLock.unlock();
        }
    }

    // Caller holds updateLock. null formatters/options keep the current ones.
    private void apply(CacheSettings newSettings,
                       Map<String, ResultFormatter<R, F>> newFormatters,
                       Map<String, String> newOptions) {
        final State<R, F> old = state;
        QueryCache<F> cache = old.cache();

        if (newSettings.requiresRebuild(old.settings())) {
            cache = newSettings.enabled() ? QueryCacheFactory.create(newSettings, clock) : null;
            log.info("Cache parameters changed ({} -> {}), previous entries discarded",
                    describe(old.settings()), describe(newSettings));
        } else {
            if (cache != null && newFormatters != null) {
                cache.clear();
            }
            if (cache == null && newSettings.enabled()) {
                cache = QueryCacheFactory.create(newSettings, clock);
            }
        }

        if (old.settings().enabled() != newSettings.enabled()) {
            log.info("Query caching {}", newSettings.enabled() ? "enabled" : "disabled");
        }

        state = new State<>(newSettings,
                newFormatters == null ? old.formatters() : newFormatters,
                newOptions == null ? old.formatOptions() : newOptions,
                cache);
    }

    public void clearCache() {
        final QueryCache<F> cache = state.cache();
        if (cache == null) return;
        cache.clear();
        log.info("Query cache cleared");
    }

    /**
     * Drops the cached result of one query, if any.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String queryText, String endpointId, String formatId) {
        final State<R, F> current = state;
        if (current.cache() == null) return false;
        final String format = resolveFormat(current.settings(), formatId);
        return current.cache().invalidate(CacheKey.derive(queryText, endpointId, format));
    }

    public CacheStats getCacheStats() {
        final State<R, F> current = state;
        final CacheSettings s = current.settings();
        return new CacheStats(s.enabled(), liveSize(current), s.maxSize(), s.ttlSeconds(), s.policy());
    }

    public CacheSettings settings() {
        return state.settings();
    }

    // --- Internals ---

    private R callRemote(String queryText, String endpointId) throws RemoteExecutionException {
        final long start = System.nanoTime();
        try {
            return remote.execute(queryText, endpointId);
        } catch (RemoteExecutionException e) {
            log.warn("Remote execution failed endpoint={} reason={}: {}", endpointId, e.reason(), e.getMessage());
            throw e;
        } finally {
            metrics.timer(METRIC_REMOTE_LATENCY, (System.nanoTime() - start) / 1_000_000);
        }
    }

    // Disabled counts as empty even while a kept cache still holds entries
    private static int liveSize(State<?, ?> current) {
        return (current.settings().enabled() && current.cache() != null) ? current.cache().size() : 0;
    }

    private double liveCacheSize() {
        return liveSize(state);
    }

    private static String resolveFormat(CacheSettings settings, String formatId) {
        return PluginIds.normalize(formatId == null ? settings.defaultFormat() : formatId);
    }

    private static <R, F> Map<String, ResultFormatter<R, F>> buildFormatters(
            Function<KernelConfig, ? extends Map<String, ? extends ResultFormatter<R, F>>> factory,
            KernelConfig config) {
        return normalizeFormatters(Objects.requireNonNull(factory.apply(config), "formatter factory returned null"));
    }

    // format.default selects a formatter rather than configuring one
    private static Map<String, String> formatOptions(KernelConfig config) {
        Map<String, String> out = new TreeMap<>();
        for (String key : config.keys()) {
            if (key.startsWith(FORMAT_PREFIX) && !key.equals(CacheSettings.KEY_DEFAULT_FORMAT)) {
                out.put(key, config.getString(key, "").trim());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static <R, F> Map<String, ResultFormatter<R, F>> normalizeFormatters(
            Map<String, ? extends ResultFormatter<R, F>> source) {
        Map<String, ResultFormatter<R, F>> tmp = new LinkedHashMap<>();
        source.forEach((id, formatter) -> {
            String key = PluginIds.normalize(id);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Formatter id must not be blank");
            }
            if (tmp.putIfAbsent(key, Objects.requireNonNull(formatter, "formatter for " + id)) != null) {
                throw new IllegalArgumentException("Duplicate formatter id '" + key + "'");
            }
        });
        return Collections.unmodifiableMap(tmp);
    }

    private static String describe(CacheSettings s) {
        return s.policy() + "/" + s.maxSize() + "/" + s.ttlSeconds() + "s";
    }

    private static String abbreviate(String queryText) {
        return queryText.length() <= LOG_QUERY_CHARS ? queryText : queryText.substring(0, LOG_QUERY_CHARS) + "...";
    }

    private record State<R, F>(CacheSettings settings,
                               Map<String, ResultFormatter<R, F>> formatters,
                               Map<String, String> formatOptions,
                               QueryCache<F> cache) {
    }
}
