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
 * Human readable complexity of a sample entropy value.
 *
 * @author Inscope Metrics
 */
public enum EntropyComplexity {
    /**
     * No template matches; the series is maximally irregular at this tolerance.
     */
    MAXIMUM("Maximum complexity (no repeating patterns)"),
    /**
     * Entropy above 2.5.
     */
    VERY_HIGH("Very high complexity (highly irregular)"),
    /**
     * Entropy above 1.5.
     */
    HIGH("High complexity (irregular patterns)"),
    /**
     * Entropy above 0.8.
     */
    MODERATE("Moderate complexity"),
    /**
     * Entropy above 0.3.
     */
    LOW("Low complexity (some regularity)"),
    /**
     * Entropy of 0.3 or less.
     */
    VERY_LOW("Very low complexity (highly regular)");

    EntropyComplexity(final String description) {
        _description = description;
    }

    /**
     * Classify a sample entropy value.
     *
     * @param entropy The sample entropy.
     * @return The complexity band.
     */
    public static EntropyComplexity fromEntropy(final double entropy) {
        if (Double.isInfinite(entropy)) {
            return MAXIMUM;
        } else if (entropy > 2.5) {
            return VERY_HIGH;
        } else if (entropy > 1.5) {
            return HIGH;
        } else if (entropy > 0.8) {
            return MODERATE;
        } else if (entropy > 0.3) {
            return LOW;
        }
        return VERY_LOW;
    }

    public String getDescription() {
        return _description;
    }

    private final String _description;
}
