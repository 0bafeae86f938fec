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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Forecasts the mean of the trailing window for every step. The window
 * shrinks to the history length when the history is shorter.
 *
 * @author Inscope Metrics
 */
final class MovingAverageForecaster implements Forecaster {

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.MOVING_AVERAGE;
    }

    @Override
    public int getMinimumHistory() {
        return 1;
    }

    @Override
    public PointForecast forecast(final double[] history, final int horizon, final ForecastContext context) {
        final int n = history.length;
        final int window = Math.min(context.getWindowSize(), n);
        final ImmutableList<String> warnings = window < context.getWindowSize()
                ? ImmutableList.of(String.format(
                        "Moving average window reduced to history length; requested=%d, used=%d",
                        context.getWindowSize(),
                        window))
                : ImmutableList.of();

        final double average = StatUtils.mean(history, n - window, window);
        final double[] values = new double[horizon];
        Arrays.fill(values, average);

        final double[] actuals = new double[n - window];
        final double[] predictions = new double[n - window];
        for (int t = window; t < n; ++t) {
            actuals[t - window] = history[t];
            predictions[t - window] = StatUtils.mean(history, t - window, window);
        }
        return new PointForecast(
                ForecastMethod.MOVING_AVERAGE,
                values,
                actuals,
                predictions,
                0,
                ValidationMetrics.compute(actuals, predictions).toAccuracy(),
                ImmutableMap.of("windowSize", (double) window, "average", average),
                warnings);
    }
}
