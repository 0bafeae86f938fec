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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A single timestamped observation. The timestamp may be null and the value
 * non-finite only in raw input that has not been preprocessed.
 *
 * @author Inscope Metrics
 */
public final class TimeSeriesPoint {

    /**
     * Public constructor.
     *
     * @param timestamp The observation time; may be null in raw input.
     * @param value The observed value.
     */
    @JsonCreator
    public TimeSeriesPoint(
            @JsonProperty("timestamp") @Nullable final Instant timestamp,
            @JsonProperty("value") final double value) {
        _timestamp = timestamp;
        _value = value;
    }

    @Nullable
    public Instant getTimestamp() {
        return _timestamp;
    }

    public double getValue() {
        return _value;
    }

    /**
     * Create a copy of this point with a different value.
     *
     * @param value The new value.
     * @return New {@link TimeSeriesPoint} at the same timestamp.
     */
    public TimeSeriesPoint withValue(final double value) {
        return new TimeSeriesPoint(_timestamp, value);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final TimeSeriesPoint other = (TimeSeriesPoint) object;

        return Double.compare(_value, other._value) == 0
                && Objects.equal(_timestamp, other._timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("Value", _value)
                .toString();
    }

    private final Instant _timestamp;
    private final double _value;
}
