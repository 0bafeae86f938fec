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
package com.arpnetworking.analytics.downsampling;

import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.test.TestBeanFactory;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Tests for the {@link Downsampler}.
 *
 * @author Inscope Metrics
 */
public class DownsamplerTest {

    @Before
    public void setUp() {
        _executor = Executors.newFixedThreadPool(4);
    }

    @After
    public void tearDown() {
        _executor.shutdownNow();
    }

    @Test
    public void testSmallSeriesUnchanged() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1, 2, 3, 4, 5);
        for (final DownsamplingMethod method : DownsamplingMethod.values()) {
            Assert.assertSame(series, _downsampler.downsample(series, 5, method));
            final DownsampledSeries result = _downsampler.downsampleWithMetadata(series, 10, method);
            Assert.assertFalse(result.wasDownsampled());
            Assert.assertEquals(5, result.getTotalPoints());
        }
    }

    @Test
    public void testBoundedSize() {
        final TimeSeries series = TestBeanFactory.createRandomTimeSeries(1000, 20.0, 31L);
        for (final DownsamplingMethod method : DownsamplingMethod.values()) {
            final DownsampledSeries result = _downsampler.downsampleWithMetadata(series, 100, method);
            MatcherAssert.assertThat(method.getName(), result.getDownsampledPoints(), Matchers.lessThanOrEqualTo(100));
            MatcherAssert.assertThat(method.getName(), result.getDownsampledPoints(), Matchers.greaterThan(2));
            Assert.assertTrue(result.wasDownsampled());
            Assert.assertEquals(1000, result.getTotalPoints());
            Assert.assertEquals(method, result.getMethod());
        }
    }

    @Test
    public void testEndpointsKept() {
        final TimeSeries series = TestBeanFactory.createRandomTimeSeries(500, 20.0, 37L);
        final TimeSeriesPoint first = series.getPoints().get(0);
        final TimeSeriesPoint last = series.getPoints().get(499);
        for (final DownsamplingMethod method : new DownsamplingMethod[] {
                DownsamplingMethod.LTTB,
                DownsamplingMethod.MIN_MAX,
                DownsamplingMethod.FIRST_LAST_SIGNIFICANT}) {
            final List<TimeSeriesPoint> points = _downsampler.downsample(series, 50, method).getPoints();
            Assert.assertEquals(method.getName(), first, points.get(0));
            Assert.assertEquals(method.getName(), last, points.get(points.size() - 1));
        }
    }

    @Test
    public void testLttbKeepsSpike() {
        final double[] values = new double[1000];
        values[500] = 100.0;
        final TimeSeries series = TestBeanFactory.createTimeSeries(values);
        final TimeSeries lttb = _downsampler.downsample(series, 50, DownsamplingMethod.LTTB);
        Assert.assertEquals(50, lttb.size());
        MatcherAssert.assertThat(lttb.getPoints(), Matchers.hasItem(series.getPoints().get(500)));
        final TimeSeries minMax = _downsampler.downsample(series, 50, DownsamplingMethod.MIN_MAX);
        MatcherAssert.assertThat(minMax.getPoints(), Matchers.hasItem(series.getPoints().get(500)));
    }

    @Test
    public void testAverageBuckets() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        final TimeSeries result = _downsampler.downsample(series, 5, DownsamplingMethod.AVERAGE);
        Assert.assertArrayEquals(new double[] {1.5, 3.5, 5.5, 7.5, 9.5}, result.values(), 1e-12);
        Assert.assertEquals(
                TestBeanFactory.START.plus(Duration.ofHours(12)),
                result.getPoints().get(0).getTimestamp());
    }

    @Test
    public void testFirstLastSignificant() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(0, 0, 0, 10, 10, 10, 0, 0, 0, 0);
        final TimeSeries result = _downsampler.downsample(series, 5, DownsamplingMethod.FIRST_LAST_SIGNIFICANT);
        Assert.assertEquals(4, result.size());
        Assert.assertEquals(series.getPoints().get(3), result.getPoints().get(1));
        Assert.assertEquals(series.getPoints().get(6), result.getPoints().get(2));
    }

    @Test
    public void testParallelMatchesSequential() {
        final TimeSeries series = TestBeanFactory.createRandomTimeSeries(5000, 0.0, 41L);
        final Downsampler sequential = new Downsampler(ChunkProcessor.sequential(7), 0.1);
        final Downsampler parallel = new Downsampler(ChunkProcessor.parallel(7, _executor), 0.1);
        for (final DownsamplingMethod method : DownsamplingMethod.values()) {
            Assert.assertEquals(
                    method.getName(),
                    sequential.downsample(series, 300, method),
                    parallel.downsample(series, 300, method));
        }
    }

    @Test
    public void testHourlySeriesKeepsInterval() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(SamplingInterval.HOUR, new double[200]);
        final TimeSeries result = _downsampler.downsample(series, 20, DownsamplingMethod.AVERAGE);
        Assert.assertEquals(SamplingInterval.HOUR, result.getInterval());
        Assert.assertEquals(series.getMetricId(), result.getMetricId());
    }

    @Test(expected = ValidationException.class)
    public void testMaxPointsTooSmall() {
        _downsampler.downsample(TestBeanFactory.createTimeSeries(1, 2, 3, 4), 2, DownsamplingMethod.LTTB);
    }

    private ExecutorService _executor;
    private final Downsampler _downsampler = new Downsampler();
}
