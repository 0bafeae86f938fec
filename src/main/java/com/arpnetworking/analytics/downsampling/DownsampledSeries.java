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

import com.arpnetworking.analytics.model.TimeSeries;
import com.google.common.base.MoreObjects;

/**
 * A series prepared for rendering with a record of how much it was reduced.
 *
 * @author Inscope Metrics
 */
public final class DownsampledSeries {

    /**
     * Public constructor.
     *
     * @param series The rendered series.
     * @param totalPoints The number of points before reduction.
     * @param method The method applied.
     */
    public DownsampledSeries(final TimeSeries series, final int totalPoints, final DownsamplingMethod method) {
        _series = series;
        _totalPoints = totalPoints;
        _method = method;
    }

    public TimeSeries getSeries() {
        return _series;
    }

    public int getTotalPoints() {
        return _totalPoints;
    }

    public int getDownsampledPoints() {
        return _series.size();
    }

    public boolean wasDownsampled() {
        return _series.size() < _totalPoints;
    }

    public DownsamplingMethod getMethod() {
        return _method;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Series", _series)
                .add("TotalPoints", _totalPoints)
                .add("DownsampledPoints", getDownsampledPoints())
                .add("Method", _method)
                .toString();
    }

    private final TimeSeries _series;
    private final int _totalPoints;
    private final DownsamplingMethod _method;
}
