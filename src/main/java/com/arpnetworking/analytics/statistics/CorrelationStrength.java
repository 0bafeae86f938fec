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

/**
 * Human readable strength of a correlation coefficient.
 *
 * @author Inscope Metrics
 */
public enum CorrelationStrength {
    /**
     * |r| above 0.9.
     */
    VERY_STRONG("Very strong"),
    /**
     * |r| above 0.7.
     */
    STRONG("Strong"),
    /**
     * |r| above 0.5.
     */
    MODERATE("Moderate"),
    /**
     * |r| above 0.3.
     */
    WEAK("Weak"),
    /**
     * |r| of 0.3 or less.
     */
    VERY_WEAK("Very weak or no");

    CorrelationStrength(final String description) {
        _description = description;
    }

    /**
     * Classify a coefficient by its magnitude.
     *
     * @param coefficient The correlation coefficient.
     * @return The strength band.
     */
    public static CorrelationStrength fromCoefficient(final double coefficient) {
        final double magnitude = Math.abs(coefficient);
        if (magnitude > 0.9) {
            return VERY_STRONG;
        } else if (magnitude > 0.7) {
            return STRONG;
        } else if (magnitude > 0.5) {
            return MODERATE;
        } else if (magnitude > 0.3) {
            return WEAK;
        }
        return VERY_WEAK;
    }

    /**
     * Describe a coefficient including its direction, for example
     * "Strong positive correlation".
     *
     * @param coefficient The correlation coefficient.
     * @return The interpretation.
     */
    public static String interpret(final double coefficient) {
        return fromCoefficient(coefficient)._description
                + (coefficient >= 0 ? " positive" : " negative")
                + " correlation";
    }

    public String getDescription() {
        return _description;
    }

    private final String _description;
}
