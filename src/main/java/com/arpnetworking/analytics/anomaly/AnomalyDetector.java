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
package com.arpnetworking.analytics.anomaly;

import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.Anomaly;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.stat.StatUtils;

import java.util.List;

/**
 * Flags points whose z-score against a baseline exceeds a threshold.
 *
 * <p>In global mode the baseline is the whole series. In local mode it is
 * the {@code lookbackWindow} points preceding each point; the point itself
 * is never part of its own local baseline. A baseline with zero deviation
 * flags nothing.</p>
 *
 * @author Inscope Metrics
 */
public final class AnomalyDetector {

    /**
     * Detect anomalies against the whole-series baseline.
     *
     * @param series The series.
     * @param threshold The z-score threshold; strictly positive.
     * @return The anomalies in series order.
     */
    public ImmutableList<Anomaly> detectAnomalies(final TimeSeries series, final double threshold) {
        validateThreshold(series, threshold);
        final double[] values = series.values();
        if (values.length < MIN_POINTS) {
            return ImmutableList.of();
        }
        final double mean = StatUtils.mean(values);
        final double standardDeviation = Math.sqrt(StatUtils.populationVariance(values, mean));
        if (standardDeviation == 0) {
            return ImmutableList.of();
        }

        final List<TimeSeriesPoint> points = series.getPoints();
        final ImmutableList.Builder<Anomaly> anomalies = ImmutableList.builder();
        for (int i = 0; i < values.length; ++i) {
            final double zScore = Math.abs(values[i] - mean) / standardDeviation;
            if (zScore > threshold) {
                anomalies.add(new Anomaly(points.get(i), zScore, mean, standardDeviation));
            }
        }
        return log(series, anomalies.build());
    }

    /**
     * Detect anomalies against a trailing window of preceding points.
     *
     * @param series The series.
     * @param threshold The z-score threshold; strictly positive.
     * @param lookbackWindow The number of preceding points in each baseline; at least 2.
     * @return The anomalies in series order.
     */
    public ImmutableList<Anomaly> detectAnomalies(final TimeSeries series, final double threshold, final int lookbackWindow) {
        validateThreshold(series, threshold);
        if (lookbackWindow < MIN_BASELINE) {
            throw new ValidationException(
                    "Lookback window too small",
                    ErrorContext.of("detectAnomalies", series.getMetricId())
                            .addParameter("lookbackWindow", lookbackWindow)
                            .addParameter("minimum", MIN_BASELINE));
        }
        final double[] values = series.values();
        if (values.length < MIN_POINTS) {
            return ImmutableList.of();
        }

        final List<TimeSeriesPoint> points = series.getPoints();
        final ImmutableList.Builder<Anomaly> anomalies = ImmutableList.builder();
        for (int i = MIN_BASELINE; i < values.length; ++i) {
            final int from = Math.max(0, i - lookbackWindow);
            final double mean = StatUtils.mean(values, from, i - from);
            final double standardDeviation = Math.sqrt(StatUtils.populationVariance(values, mean, from, i - from));
            if (standardDeviation == 0) {
                continue;
            }
            final double zScore = Math.abs(values[i] - mean) / standardDeviation;
            if (zScore > threshold) {
                anomalies.add(new Anomaly(points.get(i), zScore, mean, standardDeviation));
            }
        }
        return log(series, anomalies.build());
    }

    private static void validateThreshold(final TimeSeries series, final double threshold) {
        if (!Double.isFinite(threshold) || threshold <= 0) {
            throw new ValidationException(
                    "Threshold must be positive",
                    ErrorContext.of("detectAnomalies", series.getMetricId()).addParameter("threshold", threshold));
        }
    }

    private static ImmutableList<Anomaly> log(final TimeSeries series, final ImmutableList<Anomaly> anomalies) {
        LOGGER.debug()
                .setMessage("Anomaly detection complete")
                .addData("metricId", series.getMetricId())
                .addData("points", series.size())
                .addData("anomalies", anomalies.size())
                .log();
        return anomalies;
    }

    private static final int MIN_POINTS = 3;
    private static final int MIN_BASELINE = 2;
    private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetector.class);
}
