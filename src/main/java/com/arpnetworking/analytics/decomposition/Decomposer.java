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
package com.arpnetworking.analytics.decomposition;

import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.Decomposition;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Classical additive decomposition into trend, seasonal and residual
 * components.
 *
 * <p>The trend is a centered moving average. Points closer than half a
 * window to either end average over the widest symmetric window that fits,
 * so the first and last points are their own trend. The seasonal component
 * is the mean-centered average of the detrended values at each phase of the
 * period. The residual is whatever remains.</p>
 *
 * @author Inscope Metrics
 */
public final class Decomposer {

    /**
     * Decompose using the default seasonal period of the series' interval.
     *
     * @param series The series.
     * @param windowSize The trend window; at least 3.
     * @return The decomposition.
     */
    public Decomposition decompose(final TimeSeries series, final int windowSize) {
        return decompose(series, windowSize, series.getInterval().getDefaultSeasonalPeriod());
    }

    /**
     * Decompose with an explicit seasonal period.
     *
     * @param series The series.
     * @param windowSize The trend window; at least 3.
     * @param seasonalPeriod The seasonal period; at least 1.
     * @return The decomposition.
     */
    public Decomposition decompose(final TimeSeries series, final int windowSize, final int seasonalPeriod) {
        validateParameters(series.getMetricId(), windowSize, seasonalPeriod);

        final double[] values = series.values();
        final int n = values.length;
        if (n > 0 && n < 2 * seasonalPeriod) {
            LOGGER.warn()
                    .setMessage("Series shorter than two seasonal periods; seasonal component is low confidence")
                    .addData("metricId", series.getMetricId())
                    .addData("length", n)
                    .addData("seasonalPeriod", seasonalPeriod)
                    .log();
        }

        final double[] trend = n < windowSize ? values.clone() : centeredMovingAverage(values, windowSize);
        final double[] seasonal = seasonalComponent(values, trend, seasonalPeriod);
        final double[] residual = new double[n];
        for (int i = 0; i < n; ++i) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }

        return new Decomposition.Builder()
                .setOriginal(series)
                .setTrend(withValues(series, trend))
                .setSeasonal(withValues(series, seasonal))
                .setResidual(withValues(series, residual))
                .setSeasonalPeriod(seasonalPeriod)
                .setWindowSize(windowSize)
                .build();
    }

    /**
     * Check decomposition parameters without a series.
     *
     * @param metricId The metric identifier, for error context.
     * @param windowSize The trend window; at least 3.
     * @param seasonalPeriod The seasonal period; at least 1.
     */
    public static void validateParameters(final String metricId, final int windowSize, final int seasonalPeriod) {
        if (windowSize < MIN_WINDOW_SIZE) {
            throw new ValidationException(
                    "Window size too small",
                    ErrorContext.of("decompose", metricId)
                            .addParameter("windowSize", windowSize)
                            .addParameter("minimum", MIN_WINDOW_SIZE));
        }
        if (seasonalPeriod < 1) {
            throw new ValidationException(
                    "Seasonal period must be positive",
                    ErrorContext.of("decompose", metricId).addParameter("seasonalPeriod", seasonalPeriod));
        }
    }

    static double[] centeredMovingAverage(final double[] values, final int windowSize) {
        final int n = values.length;
        final int halfWindow = windowSize / 2;
        final double[] trend = new double[n];
        for (int i = 0; i < n; ++i) {
            final int reach = Math.min(halfWindow, Math.min(i, n - 1 - i));
            double sum = 0.0;
            for (int j = i - reach; j <= i + reach; ++j) {
                sum += values[j];
            }
            trend[i] = sum / (2 * reach + 1);
        }
        return trend;
    }

    static double[] seasonalComponent(final double[] values, final double[] trend, final int period) {
        final int n = values.length;
        final double[] phaseSums = new double[period];
        final int[] phaseCounts = new int[period];
        for (int i = 0; i < n; ++i) {
            phaseSums[i % period] += values[i] - trend[i];
            ++phaseCounts[i % period];
        }
        final double[] pattern = new double[period];
        double patternSum = 0.0;
        for (int phase = 0; phase < period; ++phase) {
            pattern[phase] = phaseCounts[phase] > 0 ? phaseSums[phase] / phaseCounts[phase] : 0.0;
            patternSum += pattern[phase];
        }
        final double patternMean = patternSum / period;
        final double[] seasonal = new double[n];
        for (int i = 0; i < n; ++i) {
            seasonal[i] = pattern[i % period] - patternMean;
        }
        return seasonal;
    }

    private static TimeSeries withValues(final TimeSeries series, final double[] values) {
        final List<TimeSeriesPoint> points = series.getPoints();
        final ImmutableList.Builder<TimeSeriesPoint> component = ImmutableList.builderWithExpectedSize(points.size());
        for (int i = 0; i < points.size(); ++i) {
            component.add(points.get(i).withValue(values[i]));
        }
        return series.withPoints(component.build());
    }

    private static final int MIN_WINDOW_SIZE = 3;
    private static final Logger LOGGER = LoggerFactory.getLogger(Decomposer.class);
}
