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

import java.util.Arrays;

/**
 * Forecasts the value observed one seasonal period earlier, cycling through
 * the last full season. Falls back to {@link NaiveForecaster} when the
 * history does not exceed one period.
 *
 * @author Inscope Metrics
 */
final class SeasonalNaiveForecaster implements Forecaster {

    SeasonalNaiveForecaster(final NaiveForecaster fallback) {
        _fallback = fallback;
    }

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.SEASONAL_NAIVE;
    }

    @Override
    public int getMinimumHistory() {
        return 1;
    }

    @Override
    public PointForecast forecast(final double[] history, final int horizon, final ForecastContext context) {
        final int period = context.getSeasonalPeriod();
        final int n = history.length;
        if (n < period + 1) {
            final PointForecast naive = _fallback.forecast(history, horizon, context);
            return new PointForecast(
                    naive.getMethod(),
                    naive.getValues(),
                    naive.getFittedActuals(),
                    naive.getFittedValues(),
                    0,
                    naive.getAccuracy(),
                    naive.getModelParameters(),
                    ImmutableList.of(String.format(
                            "Insufficient history for seasonal naive forecast; using naive; length=%d, seasonalPeriod=%d",
                            n,
                            period)));
        }

        final double[] values = new double[horizon];
        for (int h = 0; h < horizon; ++h) {
            values[h] = history[n - period + (h % period)];
        }
        final double[] actuals = Arrays.copyOfRange(history, period, n);
        final double[] predictions = Arrays.copyOfRange(history, 0, n - period);
        return new PointForecast(
                ForecastMethod.SEASONAL_NAIVE,
                values,
                actuals,
                predictions,
                0,
                ValidationMetrics.compute(actuals, predictions).toAccuracy(),
                ImmutableMap.of("seasonalPeriod", (double) period),
                ImmutableList.of());
    }

    private final NaiveForecaster _fallback;
}
