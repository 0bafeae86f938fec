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

/**
 * Raw output of a {@link Forecaster}: the point forecast and the one-step
 * fitted values over the history used to estimate uncertainty.
 *
 * @author Inscope Metrics
 */
final class PointForecast {

    PointForecast(
            final ForecastMethod method,
            final double[] values,
            final double[] fittedActuals,
            final double[] fittedValues,
            final int parameterCount,
            final double accuracy,
            final ImmutableMap<String, Double> modelParameters,
            final ImmutableList<String> warnings) {
        _method = method;
        _values = values;
        _fittedActuals = fittedActuals;
        _fittedValues = fittedValues;
        _parameterCount = parameterCount;
        _accuracy = accuracy;
        _modelParameters = modelParameters;
        _warnings = warnings;
    }

    ForecastMethod getMethod() {
        return _method;
    }

    double[] getValues() {
        return _values;
    }

    double[] getFittedActuals() {
        return _fittedActuals;
    }

    double[] getFittedValues() {
        return _fittedValues;
    }

    /**
     * Residual standard deviation of the one-step fitted errors, with one
     * degree of freedom removed per estimated model parameter.
     *
     * @return The residual standard deviation, or zero without enough residuals.
     */
    double residualStandardDeviation() {
        final int degreesOfFreedom = _fittedActuals.length - _parameterCount;
        if (degreesOfFreedom <= 0) {
            return 0.0;
        }
        double sumOfSquares = 0.0;
        for (int i = 0; i < _fittedActuals.length; ++i) {
            final double error = _fittedActuals[i] - _fittedValues[i];
            sumOfSquares += error * error;
        }
        return Math.sqrt(sumOfSquares / degreesOfFreedom);
    }

    boolean hasResiduals() {
        return _fittedActuals.length - _parameterCount > 0;
    }

    double getAccuracy() {
        return _accuracy;
    }

    ImmutableMap<String, Double> getModelParameters() {
        return _modelParameters;
    }

    ImmutableList<String> getWarnings() {
        return _warnings;
    }

    private final ForecastMethod _method;
    private final double[] _values;
    private final double[] _fittedActuals;
    private final double[] _fittedValues;
    private final int _parameterCount;
    private final double _accuracy;
    private final ImmutableMap<String, Double> _modelParameters;
    private final ImmutableList<String> _warnings;
}
