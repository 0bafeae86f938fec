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
import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.base.Ticker;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tests for the {@link ComputationCache}.
 *
 * @author Inscope Metrics
 */
public class ComputationCacheTest {

    @Before
    public void setUp() {
        _ticker = new ManualTicker();
        _cache = ComputationCache.create(new AnalyticsConfiguration.Builder().build(), _ticker);
    }

    @Test
    public void testComputesOnce() {
        final AtomicInteger calls = new AtomicInteger();
        final CacheKey key = key(CacheNamespace.TIME_SERIES, "cpu");
        Assert.assertEquals("value", _cache.getOrCompute(key, () -> "value" + suffix(calls)));
        Assert.assertEquals("value", _cache.getOrCompute(key, () -> "value" + suffix(calls)));
        Assert.assertEquals(1, calls.get());
        Assert.assertEquals(1, _cache.size(CacheNamespace.TIME_SERIES));
        Assert.assertEquals(0, _cache.size(CacheNamespace.FORECAST));
    }

    @Test
    public void testNamespacesAreSeparate() {
        final AtomicInteger calls = new AtomicInteger();
        _cache.getOrCompute(key(CacheNamespace.TIME_SERIES, "cpu"), calls::incrementAndGet);
        _cache.getOrCompute(key(CacheNamespace.FORECAST, "cpu"), calls::incrementAndGet);
        Assert.assertEquals(2, calls.get());
    }

    @Test
    public void testExpiresAfterTtl() {
        final AtomicInteger calls = new AtomicInteger();
        final CacheKey key = key(CacheNamespace.TIME_SERIES, "cpu");
        Assert.assertEquals(Integer.valueOf(1), _cache.getOrCompute(key, calls::incrementAndGet));
        _ticker.advance(Duration.ofMinutes(4));
        Assert.assertEquals(Integer.valueOf(1), _cache.getOrCompute(key, calls::incrementAndGet));
        _ticker.advance(Duration.ofMinutes(1));
        Assert.assertEquals(Integer.valueOf(2), _cache.getOrCompute(key, calls::incrementAndGet));
    }

    @Test
    public void testExplicitTtl() {
        final AtomicInteger calls = new AtomicInteger();
        final CacheKey key = key(CacheNamespace.FORECAST, "cpu");
        _cache.getOrCompute(key, Duration.ofSeconds(10), calls::incrementAndGet);
        _ticker.advance(Duration.ofSeconds(11));
        _cache.getOrCompute(key, Duration.ofSeconds(10), calls::incrementAndGet);
        Assert.assertEquals(2, calls.get());
    }

    @Test
    public void testCleanUpRemovesExpired() {
        _cache.getOrCompute(key(CacheNamespace.TIME_SERIES, "cpu"), () -> "a");
        _cache.getOrCompute(key(CacheNamespace.FORECAST, "cpu"), () -> "b");
        _ticker.advance(Duration.ofMinutes(6));
        _cache.cleanUp();
        Assert.assertEquals(0, _cache.size(CacheNamespace.TIME_SERIES));
        Assert.assertEquals(1, _cache.size(CacheNamespace.FORECAST));
    }

    @Test
    public void testSizeBounded() {
        for (int i = 0; i < 150; ++i) {
            _cache.getOrCompute(key(CacheNamespace.TIME_SERIES, "metric" + i), () -> "value");
        }
        Assert.assertEquals(100, _cache.size(CacheNamespace.TIME_SERIES));
    }

    @Test
    public void testPatternInvalidation() {
        _cache.getOrCompute(key(CacheNamespace.TIME_SERIES, "cpu.usage"), () -> "a");
        _cache.getOrCompute(key(CacheNamespace.FORECAST, "cpu.usage"), () -> "b");
        _cache.getOrCompute(key(CacheNamespace.TIME_SERIES, "memory.usage"), () -> "c");
        Assert.assertEquals(2, _cache.invalidate("*:cpu.usage:*"));
        Assert.assertEquals(0, _cache.size(CacheNamespace.FORECAST));
        Assert.assertEquals(1, _cache.size(CacheNamespace.TIME_SERIES));
        Assert.assertEquals(0, _cache.invalidate("nothing*"));
    }

    @Test
    public void testInvalidateKeyAndAll() {
        final CacheKey cpu = key(CacheNamespace.TIME_SERIES, "cpu");
        _cache.getOrCompute(cpu, () -> "a");
        _cache.getOrCompute(key(CacheNamespace.DECOMPOSITION, "cpu"), () -> "b");
        _cache.invalidate(cpu);
        Assert.assertEquals(0, _cache.size(CacheNamespace.TIME_SERIES));
        Assert.assertEquals(1, _cache.size(CacheNamespace.DECOMPOSITION));
        _cache.invalidateAll();
        Assert.assertEquals(0, _cache.size(CacheNamespace.DECOMPOSITION));
    }

    @Test
    public void testFailureNotCached() {
        final CacheKey key = key(CacheNamespace.TIME_SERIES, "cpu");
        try {
            _cache.getOrCompute(key, () -> {
                throw new IllegalStateException("boom");
            });
            Assert.fail("Expected exception");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("boom", e.getMessage());
        }
        Assert.assertEquals("ok", _cache.getOrCompute(key, () -> "ok"));
    }

    @Test
    public void testConcurrentRequestsShareComputation() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final CacheKey key = key(CacheNamespace.DECOMPOSITION, "cpu");
            final AtomicInteger calls = new AtomicInteger();
            final CountDownLatch started = new CountDownLatch(1);
            final CountDownLatch release = new CountDownLatch(1);
            final Future<Integer> first = executor.submit(() -> _cache.getOrCompute(key, () -> {
                started.countDown();
                await(release);
                return calls.incrementAndGet();
            }));
            Assert.assertTrue(started.await(5, TimeUnit.SECONDS));
            final Future<Integer> second = executor.submit(() -> _cache.getOrCompute(key, calls::incrementAndGet));
            release.countDown();
            Assert.assertEquals(Integer.valueOf(1), first.get(5, TimeUnit.SECONDS));
            Assert.assertEquals(Integer.valueOf(1), second.get(5, TimeUnit.SECONDS));
            Assert.assertEquals(1, calls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    private static void await(final CountDownLatch latch) {
        try {
            Assert.assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static String suffix(final AtomicInteger calls) {
        calls.incrementAndGet();
        return "";
    }

    private static CacheKey key(final CacheNamespace namespace, final String metricId) {
        final DateRange range = TestBeanFactory.createRange(SamplingInterval.DAY, 10);
        return new CacheKey.Builder()
                .setNamespace(namespace)
                .setOperation("test")
                .addMetricId(metricId)
                .setRange(range)
                .setInterval(SamplingInterval.DAY)
                .build();
    }

    private ManualTicker _ticker;
    private ComputationCache _cache;

    private static final class ManualTicker extends Ticker {

        @Override
        public long read() {
            return _nanos.get();
        }

        void advance(final Duration duration) {
            _nanos.addAndGet(duration.toNanos());
        }

        private final AtomicLong _nanos = new AtomicLong();
    }
}
