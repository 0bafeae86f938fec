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
import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Extrapolates an ordinary least squares fit of value against time index.
 * Accuracy is the coefficient of determination of the fit.
 *
 * @author Inscope Metrics
 */
final class LinearRegressionForecaster implements Forecaster {

    @Override
    public ForecastMethod getMethod() {
        return ForecastMethod.LINEAR_REGRESSION;
    }

    @Override
    public int getMinimumHistory() {
        return MIN_HISTORY;
    }

    @Override
    public PointForecast forecast(final double[] history, final int horizon, final ForecastContext context) {
        final int n = history.length;
        if (n < MIN_HISTORY) {
            throw new ComputationException(
                    "Linear regression requires at least 3 data points",
                    ErrorContext.of("linearRegression", context.getMetricId()).addParameter("length", n));
        }
        final SimpleRegression regression = new SimpleRegression();
        for (int t = 0; t < n; ++t) {
            regression.addData(t, history[t]);
        }
        final double slope = regression.getSlope();
        final double intercept = regression.getIntercept();

        final double[] values = new double[horizon];
        for (int h = 0; h < horizon; ++h) {
            values[h] = intercept + slope * (n + h);
        }
        final double[] predictions = new double[n];
        for (int t = 0; t < n; ++t) {
            predictions[t] = intercept + slope * t;
        }
        final double rSquared = ValidationMetrics.compute(history, predictions).getR2();
        return new PointForecast(
                ForecastMethod.LINEAR_REGRESSION,
                values,
                history.clone(),
                predictions,
                2,
                Math.max(0.0, Math.min(1.0, rSquared)),
                ImmutableMap.of("slope", slope, "intercept", intercept, "rSquared", rSquared),
                ImmutableList.of());
    }

    private static final int MIN_HISTORY = 3;
}
