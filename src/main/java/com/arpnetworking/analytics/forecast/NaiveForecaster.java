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
 * Forecasts the last observed value for every step.
 *
 * @author Inscope Metrics
 */
final class NaiveForecaster implements Forecaster {

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.NAIVE;
    }

    @Override
    public int getMinimumHistory() {
        return 1;
    }

    @Override
    public PointForecast forecast(final double[] history, final int horizon, final ForecastContext context) {
        final double last = history[history.length - 1];
        final double[] values = new double[horizon];
        Arrays.fill(values, last);

        final int fitted = history.length - 1;
        final double[] actuals = Arrays.copyOfRange(history, 1, history.length);
        final double[] predictions = Arrays.copyOfRange(history, 0, fitted);
        return new PointForecast(
                ForecastMethod.NAIVE,
                values,
                actuals,
                predictions,
                0,
                ValidationMetrics.compute(actuals, predictions).toAccuracy(),
                ImmutableMap.of("lastValue", last),
                ImmutableList.of());
    }
}
