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
 * A sample entropy value with the parameters it was computed with.
 *
 * @author Inscope Metrics
 */
public final class EntropyResult {

    /**
     * Public constructor.
     *
     * @param entropy The sample entropy; may be positive infinity.
     * @param embeddingDimension The template length.
     * @param tolerance The tolerance as a fraction of the standard deviation.
     */
    public EntropyResult(final double entropy, final int embeddingDimension, final double tolerance) {
        _entropy = entropy;
        _embeddingDimension = embeddingDimension;
        _tolerance = tolerance;
    }

    public double getEntropy() {
        return _entropy;
    }

    public int getEmbeddingDimension() {
        return _embeddingDimension;
    }

    public double getTolerance() {
        return _tolerance;
    }

    public EntropyComplexity getComplexity() {
        return EntropyComplexity.fromEntropy(_entropy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Entropy", _entropy)
                .add("EmbeddingDimension", _embeddingDimension)
                .add("Tolerance", _tolerance)
                .add("Complexity", getComplexity())
                .toString();
    }

    private final double _entropy;
    private final int _embeddingDimension;
    private final double _tolerance;
}
