/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.analytics.cache;

import com.arpnetworking.analytics.configuration.AnalyticsConfiguration;
import com.arpnetworking.analytics.configuration.CacheConfiguration;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Memoizes expensive computations per {@link CacheNamespace}.
 *
 * <p>Each namespace is a Guava cache bounded by entry count with least
 * recently used eviction. Entries carry their own time to live which is
 * checked on read; an expired entry is recomputed. Concurrent requests for
 * the same missing key wait for a single computation. Failed computations
 * are not cached and their exception propagates to every waiting caller.</p>
 *
 * @author Inscope Metrics
 */
public final class ComputationCache {

    /**
     * Create a cache sized from configuration using the system ticker.
     *
     * @param configuration The analytics configuration.
     * @return New {@link ComputationCache}.
     */
    public static ComputationCache create(final AnalyticsConfiguration configuration) {
        return create(configuration, Ticker.systemTicker());
    }

    /**
     * Create a cache sized from configuration.
     *
     * @param configuration The analytics configuration.
     * @param ticker The time source.
     * @return New {@link ComputationCache}.
     */
    public static ComputationCache create(final AnalyticsConfiguration configuration, final Ticker ticker) {
        final Map<CacheNamespace, CacheConfiguration> namespaces = new EnumMap<>(CacheNamespace.class);
        namespaces.put(CacheNamespace.TIME_SERIES, configuration.getTimeSeriesCache());
        namespaces.put(CacheNamespace.DECOMPOSITION, configuration.getDecompositionCache());
        namespaces.put(CacheNamespace.FORECAST, configuration.getForecastCache());
        return new ComputationCache(namespaces, ticker);
    }

    /**
     * Public constructor.
     *
     * @param namespaces Configuration of every namespace.
     * @param ticker The time source.
     */
    public ComputationCache(final Map<CacheNamespace, CacheConfiguration> namespaces, final Ticker ticker) {
        _ticker = ticker;
        _configurations = new EnumMap<>(CacheNamespace.class);
        _caches = new EnumMap<>(CacheNamespace.class);
        for (final CacheNamespace namespace : CacheNamespace.values()) {
            final CacheConfiguration configuration = namespaces.get(namespace);
            Preconditions.checkArgument(configuration != null, "Missing cache configuration; namespace=%s", namespace);
            _configurations.put(namespace, configuration);
            _caches.put(namespace, CacheBuilder.newBuilder()
                    .concurrencyLevel(1)
                    .maximumSize(configuration.getMaxEntries())
                    .ticker(ticker)
                    .build());
        }
    }

    /**
     * Return the cached value or compute, store and return it, using the
     * default time to live of the key's namespace.
     *
     * @param key The key.
     * @param compute The computation; must not return null.
     * @param <T> The value type.
     * @return The value.
     */
    public <T> T getOrCompute(final CacheKey key, final Supplier<T> compute) {
        return getOrCompute(key, _configurations.get(key.getNamespace()).getTtl(), compute);
    }

    /**
     * Return the cached value or compute, store and return it.
     *
     * @param key The key.
     * @param ttl The time to live of a newly computed value.
     * @param compute The computation; must not return null.
     * @param <T> The value type.
     * @return The value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(final CacheKey key, final Duration ttl, final Supplier<T> compute) {
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "Invalid ttl; ttl=%s", ttl);
        final Cache<String, CacheEntry> cache = _caches.get(key.getNamespace());
        final String id = key.getKey();

        final CacheEntry cached = cache.getIfPresent(id);
        if (cached != null) {
            if (!cached.isExpired(_ticker.read())) {
                LOGGER.trace()
                        .setMessage("Cache hit")
                        .addData("namespace", key.getNamespace())
                        .addData("key", id)
                        .log();
                return (T) cached.getValue();
            }
            cache.asMap().remove(id, cached);
        }

        try {
            final CacheEntry entry = cache.get(id, () -> {
                LOGGER.debug()
                        .setMessage("Cache miss; computing")
                        .addData("namespace", key.getNamespace())
                        .addData("key", id)
                        .log();
                final T value = compute.get();
                Preconditions.checkState(value != null, "Computation returned null; key=%s", id);
                return new CacheEntry(value, _ticker.read(), ttl);
            });
            return (T) entry.getValue();
        } catch (final UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        } catch (final ExecutionError e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        } catch (final ExecutionException e) {
            throw new IllegalStateException(String.format("Cache computation failed; key=%s", id), e.getCause());
        }
    }

    /**
     * Remove one entry.
     *
     * @param key The key.
     */
    public void invalidate(final CacheKey key) {
        _caches.get(key.getNamespace()).invalidate(key.getKey());
    }

    /**
     * Remove every entry whose canonical key matches a glob pattern in which
     * {@code *} matches any sequence of characters.
     *
     * @param pattern The glob pattern.
     * @return The number of entries removed.
     */
    public int invalidate(final String pattern) {
        final Pattern regex = Pattern.compile(
                GLOB_SPLITTER.splitToList(pattern).stream()
                        .map(Pattern::quote)
                        .collect(Collectors.joining(".*")));
        int removed = 0;
        for (final Cache<String, CacheEntry> cache : _caches.values()) {
            for (final String id : cache.asMap().keySet()) {
                if (regex.matcher(id).matches() && cache.asMap().remove(id) != null) {
                    ++removed;
                }
            }
        }
        LOGGER.info()
                .setMessage("Invalidated cache entries")
                .addData("pattern", pattern)
                .addData("removed", removed)
                .log();
        return removed;
    }

    /**
     * Remove every entry of every namespace.
     */
    public void invalidateAll() {
        _caches.values().forEach(Cache::invalidateAll);
        LOGGER.info().setMessage("Invalidated all cache entries").log();
    }

    /**
     * Remove expired entries. Expired entries are otherwise removed only when
     * read or evicted for capacity.
     */
    public void cleanUp() {
        final long now = _ticker.read();
        for (final Cache<String, CacheEntry> cache : _caches.values()) {
            cache.asMap().entrySet().removeIf(entry -> entry.getValue().isExpired(now));
            cache.cleanUp();
        }
    }

    /**
     * The number of entries in a namespace, including expired entries not yet removed.
     *
     * @param namespace The namespace.
     * @return The number of entries.
     */
    public long size(final CacheNamespace namespace) {
        return _caches.get(namespace).size();
    }

    private final Ticker _ticker;
    private final Map<CacheNamespace, CacheConfiguration> _configurations;
    private final Map<CacheNamespace, Cache<String, CacheEntry>> _caches;

    private static final Splitter GLOB_SPLITTER = Splitter.on('*');
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputationCache.class);
}
