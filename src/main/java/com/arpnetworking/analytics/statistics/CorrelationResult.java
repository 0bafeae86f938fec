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
package com.arpnetworking.analytics.statistics;

import com.google.common.base.MoreObjects;

/**
 * A Pearson correlation coefficient with its interpretation.
 *
 * @author Inscope Metrics
 */
public final class CorrelationResult {

    /**
     * Public constructor.
     *
     * @param coefficient The coefficient in [-1, 1].
     * @param sampleSize The number of value pairs the coefficient was computed over.
     */
    public CorrelationResult(final double coefficient, final int sampleSize) {
        _coefficient = coefficient;
        _sampleSize = sampleSize;
    }

    public double getCoefficient() {
        return _coefficient;
    }

    public int getSampleSize() {
        return _sampleSize;
    }

    public CorrelationStrength getStrength() {
        return CorrelationStrength.fromCoefficient(_coefficient);
    }

    public String getInterpretation() {
        return CorrelationStrength.interpret(_coefficient);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Coefficient", _coefficient)
                .add("SampleSize", _sampleSize)
                .add("Strength", getStrength())
                .toString();
    }

    private final double _coefficient;
    private final int _sampleSize;
}
