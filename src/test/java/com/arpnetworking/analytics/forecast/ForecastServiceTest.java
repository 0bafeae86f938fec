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
package com.arpnetworking.analytics.forecast;

import com.arpnetworking.analytics.exceptions.ComputationException;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.test.TestBeanFactory;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link ForecastService}.
 *
 * @author Inscope Metrics
 */
public class ForecastServiceTest {

    @Test
    public void testNaive() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(5, 6, 7),
                3,
                ForecastMethod.NAIVE,
                ForecastOptions.DEFAULT);
        Assert.assertEquals(ForecastMethod.NAIVE, result.getMethod());
        Assert.assertArrayEquals(new double[] {7, 7, 7}, result.getForecast().values(), 0.0);
        Assert.assertEquals(0.95, result.getConfidenceLevel(), 0.0);
        Assert.assertEquals(7.0, result.getModelParameters().get("lastValue"), 0.0);
        for (int i = 0; i < 3; ++i) {
            Assert.assertEquals(
                    TestBeanFactory.timestamp(SamplingInterval.DAY, 3 + i),
                    result.getForecast().getPoints().get(i).getTimestamp());
        }
    }

    @Test
    public void testLinearRegression() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(ramp(10, 30));
        final ForecastResult result = _service.generateForecast(
                series,
                5,
                ForecastMethod.LINEAR_REGRESSION,
                ForecastOptions.DEFAULT);
        final double[] forecast = result.getForecast().values();
        for (int h = 0; h < 5; ++h) {
            Assert.assertEquals(40.0 + h, forecast[h], 0.5);
        }
        MatcherAssert.assertThat(result.getAccuracy(), Matchers.greaterThanOrEqualTo(0.95));
        Assert.assertEquals(1.0, result.getModelParameters().get("slope"), 1e-9);
        Assert.assertEquals(10.0, result.getModelParameters().get("intercept"), 1e-9);
    }

    @Test
    public void testBandsContainForecastAndWiden() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createRandomTimeSeries(60, 50.0, 9L),
                10,
                ForecastMethod.MOVING_AVERAGE,
                ForecastOptions.DEFAULT);
        final double[] forecast = result.getForecast().values();
        final double[] upper = result.getUpper().values();
        final double[] lower = result.getLower().values();
        Assert.assertEquals(10, forecast.length);
        double previousWidth = 0.0;
        for (int h = 0; h < forecast.length; ++h) {
            MatcherAssert.assertThat(lower[h], Matchers.lessThanOrEqualTo(forecast[h]));
            MatcherAssert.assertThat(upper[h], Matchers.greaterThanOrEqualTo(forecast[h]));
            final double width = upper[h] - forecast[h];
            MatcherAssert.assertThat(width, Matchers.greaterThan(previousWidth));
            previousWidth = width;
        }
    }

    @Test
    public void testSeasonalNaiveRepeatsLastSeason() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(repeat(new double[] {1, 5, 3, 7}, 5));
        final ForecastResult result = _service.generateForecast(
                series,
                6,
                ForecastMethod.SEASONAL_NAIVE,
                new ForecastOptions.Builder().setSeasonalPeriod(4).build());
        Assert.assertEquals(ForecastMethod.SEASONAL_NAIVE, result.getMethod());
        Assert.assertArrayEquals(new double[] {1, 5, 3, 7, 1, 5}, result.getForecast().values(), 0.0);
        Assert.assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void testSeasonalNaiveFallsBackToNaive() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(1, 2, 3, 4, 5),
                2,
                ForecastMethod.SEASONAL_NAIVE,
                ForecastOptions.DEFAULT);
        Assert.assertEquals(ForecastMethod.NAIVE, result.getMethod());
        Assert.assertArrayEquals(new double[] {5, 5}, result.getForecast().values(), 0.0);
        MatcherAssert.assertThat(
                result.getWarnings(),
                Matchers.hasItem(Matchers.startsWith("Insufficient history for seasonal naive forecast")));
    }

    @Test
    public void testAutoSelectsLinearForTrend() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(ramp(1, 40)),
                5,
                ForecastMethod.AUTO,
                ForecastOptions.DEFAULT);
        Assert.assertEquals(ForecastMethod.LINEAR_REGRESSION, result.getMethod());
    }

    @Test
    public void testAutoSelectsSeasonalForPattern() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(repeat(new double[] {10, 50, 30, 70}, 10)),
                4,
                ForecastMethod.AUTO,
                new ForecastOptions.Builder().setSeasonalPeriod(4).build());
        Assert.assertEquals(ForecastMethod.SEASONAL_NAIVE, result.getMethod());
    }

    @Test
    public void testAutoShortHistoryUsesNaive() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(5, 6, 7),
                2,
                ForecastMethod.AUTO,
                ForecastOptions.DEFAULT);
        Assert.assertEquals(ForecastMethod.NAIVE, result.getMethod());
        Assert.assertFalse(result.getWarnings().isEmpty());
    }

    @Test
    public void testValidationWithHistory() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(ramp(10, 30)),
                5,
                ForecastMethod.LINEAR_REGRESSION,
                new ForecastOptions.Builder().setValidateWithHistory(true).build());
        Assert.assertTrue(result.getValidationMetrics().isPresent());
        final ValidationMetrics metrics = result.getValidationMetrics().get();
        Assert.assertEquals(0.0, metrics.getMape(), 1e-9);
        Assert.assertEquals(0.0, metrics.getRmse(), 1e-9);
        Assert.assertEquals(1.0, result.getAccuracy(), 1e-9);
    }

    @Test
    public void testValidationSkippedForShortHistory() {
        final ForecastResult result = _service.generateForecast(
                TestBeanFactory.createTimeSeries(1, 2, 3, 4),
                3,
                ForecastMethod.NAIVE,
                new ForecastOptions.Builder().setValidateWithHistory(true).build());
        Assert.assertFalse(result.getValidationMetrics().isPresent());
        MatcherAssert.assertThat(
                result.getWarnings(),
                Matchers.hasItem(Matchers.startsWith("Insufficient history for validation")));
    }

    @Test
    public void testNonNegativeClamp() {
        final TimeSeries declining = TestBeanFactory.createTimeSeries(10, 8, 6, 4, 2);
        final ForecastResult clamped = _service.generateForecast(
                declining,
                3,
                ForecastMethod.LINEAR_REGRESSION,
                ForecastOptions.DEFAULT);
        for (final double value : clamped.getForecast().values()) {
            MatcherAssert.assertThat(value, Matchers.greaterThanOrEqualTo(0.0));
        }
        for (final double value : clamped.getLower().values()) {
            MatcherAssert.assertThat(value, Matchers.greaterThanOrEqualTo(0.0));
        }

        final ForecastResult unclamped = _service.generateForecast(
                declining,
                3,
                ForecastMethod.LINEAR_REGRESSION,
                new ForecastOptions.Builder().setNonNegative(false).build());
        Assert.assertArrayEquals(new double[] {0, -2, -4}, unclamped.getForecast().values(), 1e-9);
    }

    @Test
    public void testQuantile() {
        Assert.assertEquals(1.959964, ForecastService.quantile(0.95, 1000), 1e-5);
        Assert.assertEquals(2.228139, ForecastService.quantile(0.95, 12), 1e-5);
    }

    @Test(expected = ValidationException.class)
    public void testHorizonZero() {
        _service.generateForecast(TestBeanFactory.createTimeSeries(1, 2, 3), 0, ForecastMethod.NAIVE, ForecastOptions.DEFAULT);
    }

    @Test(expected = ValidationException.class)
    public void testHorizonTooLarge() {
        _service.generateForecast(TestBeanFactory.createTimeSeries(1, 2, 3), 366, ForecastMethod.NAIVE, ForecastOptions.DEFAULT);
    }

    @Test(expected = ValidationException.class)
    public void testConfidenceLevelOutOfRange() {
        _service.generateForecast(
                TestBeanFactory.createTimeSeries(1, 2, 3),
                1,
                ForecastMethod.NAIVE,
                new ForecastOptions.Builder().setConfidenceLevel(1.0).build());
    }

    @Test(expected = ComputationException.class)
    public void testEmptySeries() {
        _service.generateForecast(TestBeanFactory.createTimeSeries(), 1, ForecastMethod.NAIVE, ForecastOptions.DEFAULT);
    }

    @Test(expected = ComputationException.class)
    public void testLinearRegressionNeedsThreePoints() {
        _service.generateForecast(
                TestBeanFactory.createTimeSeries(1, 2),
                1,
                ForecastMethod.LINEAR_REGRESSION,
                ForecastOptions.DEFAULT);
    }

    @Test
    public void testValidationMetrics() {
        final ValidationMetrics metrics = ValidationMetrics.compute(new double[] {100, 200}, new double[] {110, 180});
        Assert.assertEquals(0.1, metrics.getMape(), 1e-12);
        Assert.assertEquals(Math.sqrt(250.0), metrics.getRmse(), 1e-12);
        Assert.assertEquals(15.0, metrics.getMae(), 1e-12);
        Assert.assertEquals(0.9, metrics.toAccuracy(), 1e-12);

        final ValidationMetrics zeros = ValidationMetrics.compute(new double[] {0, 0}, new double[] {1, 1});
        Assert.assertTrue(Double.isNaN(zeros.getMape()));
        Assert.assertEquals(0.5, zeros.toAccuracy(), 0.0);
    }

    private static double[] ramp(final double start, final int size) {
        final double[] values = new double[size];
        for (int i = 0; i < size; ++i) {
            values[i] = start + i;
        }
        return values;
    }

    private static double[] repeat(final double[] pattern, final int times) {
        final double[] values = new double[pattern.length * times];
        for (int i = 0; i < values.length; ++i) {
            values[i] = pattern[i % pattern.length];
        }
        return values;
    }

    private final ForecastService _service = new ForecastService();
}
