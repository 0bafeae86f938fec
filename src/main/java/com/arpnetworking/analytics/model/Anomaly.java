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
package com.arpnetworking.analytics.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A point whose deviation from its baseline exceeded the detection threshold.
 *
 * @author Inscope Metrics
 */
public final class Anomaly {

    /**
     * Public constructor.
     *
     * @param point The flagged point.
     * @param zScore Absolute standardized deviation of the point.
     * @param baselineMean Mean of the baseline the point was compared against.
     * @param baselineStandardDeviation Population standard deviation of the baseline.
     */
    public Anomaly(
            final TimeSeriesPoint point,
            final double zScore,
            final double baselineMean,
            final double baselineStandardDeviation) {
        _point = point;
        _zScore = zScore;
        _baselineMean = baselineMean;
        _baselineStandardDeviation = baselineStandardDeviation;
    }

    public TimeSeriesPoint getPoint() {
        return _point;
    }

    public double getZScore() {
        return _zScore;
    }

    public double getBaselineMean() {
        return _baselineMean;
    }

    public double getBaselineStandardDeviation() {
        return _baselineStandardDeviation;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Anomaly other = (Anomaly) object;

        return Double.compare(_zScore, other._zScore) == 0
                && Double.compare(_baselineMean, other._baselineMean) == 0
                && Double.compare(_baselineStandardDeviation, other._baselineStandardDeviation) == 0
                && Objects.equal(_point, other._point);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_point, _zScore, _baselineMean, _baselineStandardDeviation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Point", _point)
                .add("ZScore", _zScore)
                .add("BaselineMean", _baselineMean)
                .add("BaselineStandardDeviation", _baselineStandardDeviation)
                .toString();
    }

    private final TimeSeriesPoint _point;
    private final double _zScore;
    private final double _baselineMean;
    private final double _baselineStandardDeviation;
}
