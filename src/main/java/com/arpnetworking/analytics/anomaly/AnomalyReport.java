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
package com.arpnetworking.analytics.anomaly;

import com.arpnetworking.analytics.model.Anomaly;
import com.arpnetworking.analytics.model.TimeSeries;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Anomalies found in a series together with the detection parameters.
 *
 * @author Inscope Metrics
 */
public final class AnomalyReport {

    /**
     * Public constructor.
     *
     * @param series The analyzed series.
     * @param threshold The z-score threshold.
     * @param lookbackWindow The local baseline window, if local detection was used.
     * @param anomalies The anomalies.
     */
    public AnomalyReport(
            final TimeSeries series,
            final double threshold,
            final Optional<Integer> lookbackWindow,
            final ImmutableList<Anomaly> anomalies) {
        _series = series;
        _threshold = threshold;
        _lookbackWindow = lookbackWindow;
        _anomalies = anomalies;
    }

    public TimeSeries getSeries() {
        return _series;
    }

    public double getThreshold() {
        return _threshold;
    }

    public Optional<Integer> getLookbackWindow() {
        return _lookbackWindow;
    }

    public ImmutableList<Anomaly> getAnomalies() {
        return _anomalies;
    }

    public int getTotalPoints() {
        return _series.size();
    }

    public int getAnomalyCount() {
        return _anomalies.size();
    }

    /**
     * Share of points flagged, in percent.
     *
     * @return The percentage; zero for an empty series.
     */
    public double getAnomalyPercentage() {
        return _series.isEmpty() ? 0.0 : 100.0 * _anomalies.size() / _series.size();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Series", _series)
                .add("Threshold", _threshold)
                .add("LookbackWindow", _lookbackWindow)
                .add("AnomalyCount", _anomalies.size())
                .toString();
    }

    private final TimeSeries _series;
    private final double _threshold;
    private final Optional<Integer> _lookbackWindow;
    private final ImmutableList<Anomaly> _anomalies;
}
