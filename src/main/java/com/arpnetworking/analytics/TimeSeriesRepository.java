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
package com.arpnetworking.analytics;

import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeriesPoint;

import java.io.IOException;
import java.util.List;

/**
 * Source of raw metric observations. Implementations are supplied by the
 * host process and must be thread safe.
 *
 * @author Inscope Metrics
 */
public interface TimeSeriesRepository {

    /**
     * Fetch the raw points of a metric. Points may be unordered and may carry
     * missing timestamps or non-finite values; the engine preprocesses them.
     *
     * @param metricId The metric identifier.
     * @param range The requested range.
     * @param interval The requested sampling interval.
     * @return The raw points; empty when the metric has no data in the range.
     * @throws IOException if the underlying store cannot be read.
     */
    List<TimeSeriesPoint> getTimeSeries(String metricId, DateRange range, SamplingInterval interval) throws IOException;
}
