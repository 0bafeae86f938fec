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

import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.Instant;

/**
 * Tests for the {@link CacheKey}.
 *
 * @author Inscope Metrics
 */
public class CacheKeyTest {

    @Test
    public void testCanonicalForm() {
        final CacheKey key = new CacheKey.Builder()
                .setNamespace(CacheNamespace.FORECAST)
                .setOperation("forecast")
                .addMetricId("cpu")
                .setRange(DateRange.of(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z")))
                .setInterval(SamplingInterval.DAY)
                .putParameter("method", "auto")
                .putParameter("horizon", 7)
                .build();
        Assert.assertEquals(
                "forecast:cpu:{\"end\":\"2024-02-01T00:00:00Z\",\"horizon\":7,\"interval\":\"1 day\","
                        + "\"method\":\"auto\",\"start\":\"2024-01-01T00:00:00Z\"}",
                key.getKey());
    }

    @Test
    public void testParameterOrderIrrelevant() {
        final CacheKey first = new CacheKey.Builder()
                .setNamespace(CacheNamespace.DECOMPOSITION)
                .setOperation("decompose")
                .addMetricId("cpu")
                .putParameter("windowSize", 7)
                .putParameter("seasonalPeriod", 24)
                .build();
        final CacheKey second = new CacheKey.Builder()
                .setNamespace(CacheNamespace.DECOMPOSITION)
                .setOperation("decompose")
                .addMetricId("cpu")
                .putParameter("seasonalPeriod", 24)
                .putParameter("windowSize", 7)
                .build();
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
        Assert.assertEquals(first.getKey(), second.getKey());
    }

    @Test
    public void testNamespaceDistinguishes() {
        final CacheKey timeSeries = new CacheKey.Builder()
                .setNamespace(CacheNamespace.TIME_SERIES)
                .setOperation("op")
                .addMetricId("cpu")
                .build();
        final CacheKey forecast = new CacheKey.Builder()
                .setNamespace(CacheNamespace.FORECAST)
                .setOperation("op")
                .addMetricId("cpu")
                .build();
        Assert.assertEquals(timeSeries.getKey(), forecast.getKey());
        Assert.assertNotEquals(timeSeries, forecast);
    }

    @Test
    public void testMetricOrderMatters() {
        final CacheKey ab = new CacheKey.Builder()
                .setNamespace(CacheNamespace.TIME_SERIES)
                .setOperation("correlation")
                .addMetricId("a")
                .addMetricId("b")
                .build();
        Assert.assertEquals("correlation:a,b:{}", ab.getKey());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testOperationRequired() {
        new CacheKey.Builder().setNamespace(CacheNamespace.TIME_SERIES).setOperation("").build();
    }
}
