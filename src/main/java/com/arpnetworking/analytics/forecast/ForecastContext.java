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
 * Parameters shared by every forecaster for one request.
 *
 * @author Inscope Metrics
 */
final class ForecastContext {

    ForecastContext(final String metricId, final int windowSize, final int seasonalPeriod) {
        _metricId = metricId;
        _windowSize = windowSize;
        _seasonalPeriod = seasonalPeriod;
    }

    String getMetricId() {
        return _metricId;
    }

    int getWindowSize() {
        return _windowSize;
    }

    int getSeasonalPeriod() {
        return _seasonalPeriod;
    }

    private final String _metricId;
    private final int _windowSize;
    private final int _seasonalPeriod;
}
