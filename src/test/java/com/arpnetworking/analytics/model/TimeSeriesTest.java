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
package com.arpnetworking.analytics.model;

import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.Instant;
import java.util.Optional;

/**
 * Tests for the {@link TimeSeries} and related model classes.
 *
 * @author Inscope Metrics
 */
public class TimeSeriesTest {

    @Test
    public void testBuild() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1.0, 2.0, 3.0);
        Assert.assertEquals(3, series.size());
        Assert.assertFalse(series.isEmpty());
        Assert.assertArrayEquals(new double[] {1.0, 2.0, 3.0}, series.values(), 0.0);
        Assert.assertEquals(TestBeanFactory.START, series.getPoints().get(0).getTimestamp());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testPointOutsideRange() {
        new TimeSeries.Builder()
                .setMetricId("cpu")
                .setRange(DateRange.of(TestBeanFactory.START, TestBeanFactory.START.plusSeconds(60)))
                .setInterval(SamplingInterval.HOUR)
                .setPoints(ImmutableList.of(new TimeSeriesPoint(TestBeanFactory.START.plusSeconds(120), 1.0)))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testPointsOutOfOrder() {
        new TimeSeries.Builder()
                .setMetricId("cpu")
                .setRange(TestBeanFactory.createRange(SamplingInterval.DAY, 2))
                .setInterval(SamplingInterval.DAY)
                .setPoints(ImmutableList.of(
                        new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 1), 1.0),
                        new TimeSeriesPoint(TestBeanFactory.START, 2.0)))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testMissingTimestamp() {
        new TimeSeries.Builder()
                .setMetricId("cpu")
                .setRange(TestBeanFactory.createRange(SamplingInterval.DAY, 2))
                .setInterval(SamplingInterval.DAY)
                .setPoints(ImmutableList.of(new TimeSeriesPoint(null, 1.0)))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testEmptyMetricId() {
        TestBeanFactory.createTimeSeriesBuilder(SamplingInterval.DAY, 1.0).setMetricId("").build();
    }

    @Test
    public void testWithPointsKeepsIdentity() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1.0, 2.0);
        final TimeSeries replaced = series.withPoints(ImmutableList.of(series.getPoints().get(1)));
        Assert.assertEquals(series.getMetricId(), replaced.getMetricId());
        Assert.assertEquals(series.getRange(), replaced.getRange());
        Assert.assertEquals(1, replaced.size());
    }

    @Test
    public void testDateRangeContainsBounds() {
        final Instant start = Instant.parse("2024-01-01T00:00:00Z");
        final Instant end = Instant.parse("2024-01-02T00:00:00Z");
        final DateRange range = DateRange.of(start, end);
        Assert.assertTrue(range.isOrdered());
        Assert.assertTrue(range.contains(start));
        Assert.assertTrue(range.contains(end));
        Assert.assertFalse(range.contains(end.plusMillis(1)));
        Assert.assertFalse(DateRange.of(end, start).isOrdered());
    }

    @Test
    public void testSamplingIntervalLabels() {
        Assert.assertEquals(Optional.of(SamplingInterval.HOUR), SamplingInterval.fromLabel("1 hour"));
        Assert.assertEquals(Optional.of(SamplingInterval.WEEK), SamplingInterval.fromLabel("WEEK"));
        Assert.assertFalse(SamplingInterval.fromLabel("fortnight").isPresent());
        Assert.assertEquals(SamplingInterval.DAY, SamplingInterval.parse("fortnight"));
        Assert.assertEquals(12, SamplingInterval.MONTH.getDefaultSeasonalPeriod());
        Assert.assertEquals(24, SamplingInterval.HOUR.getDefaultSeasonalPeriod());
    }

    @Test
    public void testSamplingIntervalArithmetic() {
        final Instant endOfJanuary = Instant.parse("2020-01-31T00:00:00Z");
        Assert.assertTrue(SamplingInterval.MONTH.isCalendarBased());
        Assert.assertFalse(SamplingInterval.WEEK.isCalendarBased());
        Assert.assertEquals(Instant.parse("2020-02-29T00:00:00Z"), SamplingInterval.MONTH.plus(endOfJanuary, 1));
        Assert.assertEquals(Instant.parse("2020-03-31T00:00:00Z"), SamplingInterval.MONTH.plus(endOfJanuary, 2));
        Assert.assertEquals(Instant.parse("2024-12-31T00:00:00Z"), SamplingInterval.MONTH.plus(endOfJanuary, 59));
        Assert.assertEquals(Instant.parse("2020-02-02T00:00:00Z"), SamplingInterval.DAY.plus(endOfJanuary, 2));
        Assert.assertEquals(Instant.parse("2020-01-30T23:00:00Z"), SamplingInterval.HOUR.plus(endOfJanuary, -1));
    }
}
