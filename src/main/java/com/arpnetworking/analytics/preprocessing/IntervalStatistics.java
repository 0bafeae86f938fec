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
package com.arpnetworking.analytics.preprocessing;

import com.google.common.base.MoreObjects;

import java.time.Duration;

/**
 * Spacing statistics of consecutive timestamps.
 *
 * @author Inscope Metrics
 */
public final class IntervalStatistics {

    /**
     * Public constructor.
     *
     * @param mean Mean spacing.
     * @param median Median spacing.
     * @param min Smallest spacing.
     * @param max Largest spacing.
     * @param coefficientOfVariation Standard deviation of the spacing over its mean.
     * @param regular Whether the coefficient of variation is within tolerance.
     */
    public IntervalStatistics(
            final Duration mean,
            final Duration median,
            final Duration min,
            final Duration max,
            final double coefficientOfVariation,
            final boolean regular) {
        _mean = mean;
        _median = median;
        _min = min;
        _max = max;
        _coefficientOfVariation = coefficientOfVariation;
        _regular = regular;
    }

    public Duration getMean() {
        return _mean;
    }

    public Duration getMedian() {
        return _median;
    }

    public Duration getMin() {
        return _min;
    }

    public Duration getMax() {
        return _max;
    }

    public double getCoefficientOfVariation() {
        return _coefficientOfVariation;
    }

    public boolean isRegular() {
        return _regular;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Mean", _mean)
                .add("Median", _median)
                .add("Min", _min)
                .add("Max", _max)
                .add("CoefficientOfVariation", _coefficientOfVariation)
                .add("Regular", _regular)
                .toString();
    }

    private final Duration _mean;
    private final Duration _median;
    private final Duration _min;
    private final Duration _max;
    private final double _coefficientOfVariation;
    private final boolean _regular;

    static final IntervalStatistics EMPTY =
            new IntervalStatistics(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, 0.0, true);
}
