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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Instant;
import java.util.List;

/**
 * An ordered sequence of observations of one metric. Every timestamp is
 * non-null, timestamps are non-decreasing and every point lies within the
 * range.
 *
 * @author Inscope Metrics
 */
public final class TimeSeries {

    /**
     * Create a builder initialized with the metric, range and interval of an
     * existing series and no points.
     *
     * @param template The series to copy the header from.
     * @return New {@link Builder}.
     */
    public static Builder builderFrom(final TimeSeries template) {
        return new Builder()
                .setMetricId(template._metricId)
                .setRange(template._range)
                .setInterval(template._interval);
    }

    public String getMetricId() {
        return _metricId;
    }

    public DateRange getRange() {
        return _range;
    }

    public SamplingInterval getInterval() {
        return _interval;
    }

    public ImmutableList<TimeSeriesPoint> getPoints() {
        return _points;
    }

    /**
     * The number of points.
     *
     * @return The number of points.
     */
    public int size() {
        return _points.size();
    }

    public boolean isEmpty() {
        return _points.isEmpty();
    }

    /**
     * The values of the points in order.
     *
     * @return New array of values.
     */
    public double[] values() {
        final double[] values = new double[_points.size()];
        for (int i = 0; i < values.length; ++i) {
            values[i] = _points.get(i).getValue();
        }
        return values;
    }

    /**
     * Create a series with the same header and different points.
     *
     * @param points The new points.
     * @return New {@link TimeSeries}.
     */
    public TimeSeries withPoints(final List<TimeSeriesPoint> points) {
        return builderFrom(this).setPoints(points).build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final TimeSeries other = (TimeSeries) object;

        return Objects.equal(_metricId, other._metricId)
                && Objects.equal(_range, other._range)
                && _interval == other._interval
                && Objects.equal(_points, other._points);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_metricId, _range, _interval, _points);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("MetricId", _metricId)
                .add("Range", _range)
                .add("Interval", _interval)
                .add("Size", _points.size())
                .toString();
    }

    private TimeSeries(final Builder builder) {
        _metricId = builder._metricId;
        _range = builder._range;
        _interval = builder._interval;
        _points = ImmutableList.copyOf(builder._points);
    }

    private final String _metricId;
    private final DateRange _range;
    private final SamplingInterval _interval;
    private final ImmutableList<TimeSeriesPoint> _points;

    /**
     * Builder implementation for {@link TimeSeries}.
     */
    public static final class Builder extends OvalBuilder<TimeSeries> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(TimeSeries::new);
        }

        /**
         * Set the metric identifier. Required. Cannot be null or empty.
         *
         * @param value The metric identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setMetricId(final String value) {
            _metricId = value;
            return this;
        }

        /**
         * Set the range. Required. Cannot be null.
         *
         * @param value The range.
         * @return This {@link Builder} instance.
         */
        public Builder setRange(final DateRange value) {
            _range = value;
            return this;
        }

        /**
         * Set the sampling interval. Required. Cannot be null.
         *
         * @param value The sampling interval.
         * @return This {@link Builder} instance.
         */
        public Builder setInterval(final SamplingInterval value) {
            _interval = value;
            return this;
        }

        /**
         * Set the points. Optional. Cannot be null. Defaults to no points.
         *
         * @param value The points.
         * @return This {@link Builder} instance.
         */
        public Builder setPoints(final List<TimeSeriesPoint> value) {
            _points = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validatePoints(final List<TimeSeriesPoint> points) {
            if (_range == null || !_range.isOrdered()) {
                return false;
            }
            Instant previous = null;
            for (final TimeSeriesPoint point : points) {
                final Instant timestamp = point.getTimestamp();
                if (timestamp == null || !_range.contains(timestamp)) {
                    return false;
                }
                if (previous != null && timestamp.isBefore(previous)) {
                    return false;
                }
                previous = timestamp;
            }
            return true;
        }

        @NotNull
        @NotEmpty
        private String _metricId;
        @NotNull
        private DateRange _range;
        @NotNull
        private SamplingInterval _interval;
        @NotNull
        @ValidateWithMethod(methodName = "validatePoints", parameterType = List.class)
        private List<TimeSeriesPoint> _points = ImmutableList.of();
    }
}
