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

import com.google.common.base.MoreObjects;

/**
 * Error metrics of predictions against actual values. MAPE is a fraction,
 * not a percentage, and excludes zero actuals; it is {@code NaN} when every
 * actual is zero or there are no values.
 *
 * @author Inscope Metrics
 */
public final class ValidationMetrics {

    /**
     * Compute the metrics of aligned actual and predicted values.
     *
     * @param actual The actual values.
     * @param predicted The predicted values; same length as {@code actual}.
     * @return The metrics.
     */
    public static ValidationMetrics compute(final double[] actual, final double[] predicted) {
        final int n = actual.length;
        if (n == 0) {
            return new ValidationMetrics(Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        double percentageSum = 0.0;
        int percentageCount = 0;
        double squaredSum = 0.0;
        double absoluteSum = 0.0;
        double actualSum = 0.0;
        for (int i = 0; i < n; ++i) {
            final double error = actual[i] - predicted[i];
            if (actual[i] != 0) {
                percentageSum += Math.abs(error / actual[i]);
                ++percentageCount;
            }
            squaredSum += error * error;
            absoluteSum += Math.abs(error);
            actualSum += actual[i];
        }
        final double actualMean = actualSum / n;
        double totalSquares = 0.0;
        for (final double value : actual) {
            totalSquares += (value - actualMean) * (value - actualMean);
        }
        final double r2;
        if (totalSquares == 0) {
            r2 = squaredSum == 0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - squaredSum / totalSquares;
        }
        return new ValidationMetrics(
                percentageCount > 0 ? percentageSum / percentageCount : Double.NaN,
                Math.sqrt(squaredSum / n),
                absoluteSum / n,
                r2);
    }

    /**
     * Public constructor.
     *
     * @param mape Mean absolute percentage error as a fraction.
     * @param rmse Root mean squared error.
     * @param mae Mean absolute error.
     * @param r2 Coefficient of determination.
     */
    public ValidationMetrics(final double mape, final double rmse, final double mae, final double r2) {
        _mape = mape;
        _rmse = rmse;
        _mae = mae;
        _r2 = r2;
    }

    public double getMape() {
        return _mape;
    }

    public double getRmse() {
        return _rmse;
    }

    public double getMae() {
        return _mae;
    }

    public double getR2() {
        return _r2;
    }

    /**
     * Accuracy in [0, 1] derived from the MAPE, or 0.5 when the MAPE is undefined.
     *
     * @return The accuracy.
     */
    public double toAccuracy() {
        if (Double.isNaN(_mape)) {
            return UNDEFINED_ACCURACY;
        }
        return 1.0 - Math.min(1.0, _mape);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Mape", _mape)
                .add("Rmse", _rmse)
                .add("Mae", _mae)
                .add("R2", _r2)
                .toString();
    }

    private final double _mape;
    private final double _rmse;
    private final double _mae;
    private final double _r2;

    private static final double UNDEFINED_ACCURACY = 0.5;
}
