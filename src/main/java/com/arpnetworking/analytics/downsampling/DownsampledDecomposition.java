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
package com.arpnetworking.analytics.downsampling;

import com.arpnetworking.analytics.model.Decomposition;
import com.google.common.base.MoreObjects;

/**
 * A decomposition whose components were downsampled independently for
 * display. Components may differ in length.
 *
 * @author Inscope Metrics
 */
public final class DownsampledDecomposition {

    /**
     * Downsample every component of a decomposition.
     *
     * @param decomposition The decomposition.
     * @param downsampler The downsampler.
     * @param maxPoints The maximum number of points per component.
     * @param method The method.
     * @return New {@link DownsampledDecomposition}.
     */
    public static DownsampledDecomposition of(
            final Decomposition decomposition,
            final Downsampler downsampler,
            final int maxPoints,
            final DownsamplingMethod method) {
        return new DownsampledDecomposition(
                downsampler.downsampleWithMetadata(decomposition.getOriginal(), maxPoints, method),
                downsampler.downsampleWithMetadata(decomposition.getTrend(), maxPoints, method),
                downsampler.downsampleWithMetadata(decomposition.getSeasonal(), maxPoints, method),
                downsampler.downsampleWithMetadata(decomposition.getResidual(), maxPoints, method),
                decomposition.getSeasonalPeriod(),
                decomposition.getWindowSize());
    }

    public DownsampledSeries getOriginal() {
        return _original;
    }

    public DownsampledSeries getTrend() {
        return _trend;
    }

    public DownsampledSeries getSeasonal() {
        return _seasonal;
    }

    public DownsampledSeries getResidual() {
        return _residual;
    }

    public int getSeasonalPeriod() {
        return _seasonalPeriod;
    }

    public int getWindowSize() {
        return _windowSize;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Original", _original)
                .add("SeasonalPeriod", _seasonalPeriod)
                .add("WindowSize", _windowSize)
                .toString();
    }

    private DownsampledDecomposition(
            final DownsampledSeries original,
            final DownsampledSeries trend,
            final DownsampledSeries seasonal,
            final DownsampledSeries residual,
            final int seasonalPeriod,
            final int windowSize) {
        _original = original;
        _trend = trend;
        _seasonal = seasonal;
        _residual = residual;
        _seasonalPeriod = seasonalPeriod;
        _windowSize = windowSize;
    }

    private final DownsampledSeries _original;
    private final DownsampledSeries _trend;
    private final DownsampledSeries _seasonal;
    private final DownsampledSeries _residual;
    private final int _seasonalPeriod;
    private final int _windowSize;
}
