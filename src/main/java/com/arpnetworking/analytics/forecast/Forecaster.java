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

/**
 * Strategy producing point forecasts from a history of values.
 *
 * @author Inscope Metrics
 */
interface Forecaster {

    /**
     * The method implemented.
     *
     * @return The method.
     */
    ForecastMethod getMethod();

    /**
     * The smallest history this forecaster accepts.
     *
     * @return The minimum number of values.
     */
    int getMinimumHistory();

    /**
     * Forecast {@code horizon} values following the history.
     *
     * @param history The history; at least {@link #getMinimumHistory()} values.
     * @param horizon The number of steps to forecast.
     * @param context The request parameters.
     * @return The point forecast.
     */
    PointForecast forecast(double[] history, int horizon, ForecastContext context);
}
