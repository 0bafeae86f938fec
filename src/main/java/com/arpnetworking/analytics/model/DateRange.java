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

/**
 * Inclusive time range. A range whose start is after its end can be
 * represented so that callers can report it; see {@link #isOrdered()}.
 *
 * @author Inscope Metrics
 */
public final class DateRange {

    /**
     * Create a range.
     *
     * @param start The inclusive start.
     * @param end The inclusive end.
     * @return New {@link DateRange}.
     */
    @JsonCreator
    public static DateRange of(
            @JsonProperty("start") final Instant start,
            @JsonProperty("end") final Instant end) {
        return new DateRange(start, end);
    }

    public Instant getStart() {
        return _start;
    }

    public Instant getEnd() {
        return _end;
    }

    /**
     * Whether the start is not after the end.
     *
     * @return True if the range is well formed.
     */
    public boolean isOrdered() {
        return !_start.isAfter(_end);
    }

    /**
     * Whether the instant lies within the range, bounds included.
     *
     * @param instant The instant to test.
     * @return True if contained.
     */
    public boolean contains(final Instant instant) {
        return !instant.isBefore(_start) && !instant.isAfter(_end);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DateRange other = (DateRange) object;

        return Objects.equal(_start, other._start)
                && Objects.equal(_end, other._end);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_start, _end);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Start", _start)
                .add("End", _end)
                .toString();
    }

    private DateRange(final Instant start, final Instant end) {
        _start = java.util.Objects.requireNonNull(start, "start");
        _end = java.util.Objects.requireNonNull(end, "end");
    }

    private final Instant _start;
    private final Instant _end;
}
