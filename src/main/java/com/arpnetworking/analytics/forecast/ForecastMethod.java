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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Forecasting methods. The concrete methods are declared from simplest to
 * most complex; automatic selection breaks ties toward the earlier constant.
 *
 * @author Inscope Metrics
 */
public enum ForecastMethod {
    /**
     * Repeat the last observed value.
     */
    NAIVE("naive"),
    /**
     * Repeat the value one season earlier.
     */
    SEASONAL_NAIVE("seasonal_naive"),
    /**
     * Repeat the mean of the trailing window.
     */
    MOVING_AVERAGE("moving_average"),
    /**
     * Extrapolate an ordinary least squares line over the time index.
     */
    LINEAR_REGRESSION("linear_regression"),
    /**
     * Backtest the concrete methods and use the most accurate.
     */
    AUTO("auto");

    ForecastMethod(final String name) {
        _name = name;
    }

    @JsonValue
    public String getName() {
        return _name;
    }

    /**
     * Look up a method by its external name, for example "seasonal_naive".
     *
     * @param name The name.
     * @return The method, if any.
     */
    public static Optional<ForecastMethod> fromName(final String name) {
        for (final ForecastMethod method : values()) {
            if (method._name.equalsIgnoreCase(name) || method.name().equalsIgnoreCase(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static ForecastMethod fromJson(final String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException(
                String.format("Unknown forecast method; name=%s", name)));
    }

    private final String _name;
}
