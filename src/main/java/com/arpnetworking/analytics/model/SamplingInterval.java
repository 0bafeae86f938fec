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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Nominal sampling interval of a series.
 *
 * @author Inscope Metrics
 */
public enum SamplingInterval {
    /**
     * Hourly samples; daily seasonality.
     */
    HOUR("1 hour", Duration.ofHours(1), 24, null),
    /**
     * Daily samples; weekly seasonality.
     */
    DAY("1 day", Duration.ofDays(1), 7, null),
    /**
     * Weekly samples; monthly seasonality.
     */
    WEEK("1 week", Duration.ofDays(7), 4, null),
    /**
     * Monthly samples on calendar month boundaries in UTC (nominally 30
     * days); yearly seasonality.
     */
    MONTH("1 month", Duration.ofDays(30), 12, ChronoUnit.MONTHS);

    SamplingInterval(
            final String label,
            final Duration duration,
            final int defaultSeasonalPeriod,
            @Nullable final ChronoUnit calendarUnit) {
        _label = label;
        _duration = duration;
        _defaultSeasonalPeriod = defaultSeasonalPeriod;
        _calendarUnit = calendarUnit;
    }

    @JsonValue
    public String getLabel() {
        return _label;
    }

    public Duration getDuration() {
        return _duration;
    }

    public int getDefaultSeasonalPeriod() {
        return _defaultSeasonalPeriod;
    }

    /**
     * Whether steps follow the UTC calendar rather than a fixed duration.
     *
     * @return True for calendar based intervals.
     */
    public boolean isCalendarBased() {
        return _calendarUnit != null;
    }

    /**
     * Advance an instant by a number of steps. Calendar based intervals are
     * added in UTC and measured from {@code start}, so month ends clamp
     * without drifting: January 31 plus two months is March 31.
     *
     * @param start The starting instant.
     * @param steps The number of steps; may be negative.
     * @return The advanced instant.
     */
    public Instant plus(final Instant start, final long steps) {
        if (_calendarUnit == null) {
            return start.plus(_duration.multipliedBy(steps));
        }
        return start.atZone(ZoneOffset.UTC).plus(steps, _calendarUnit).toInstant();
    }

    /**
     * Look up an interval by its label, for example "1 day".
     *
     * @param label The label.
     * @return The matching interval, if any.
     */
    public static Optional<SamplingInterval> fromLabel(final String label) {
        for (final SamplingInterval interval : values()) {
            if (interval._label.equalsIgnoreCase(label.trim()) || interval.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(interval);
            }
        }
        return Optional.empty();
    }

    /**
     * Parse a label, falling back to {@link #DAY} for unknown labels.
     *
     * @param label The label.
     * @return The matching interval or {@link #DAY}.
     */
    @JsonCreator
    public static SamplingInterval parse(final String label) {
        final Optional<SamplingInterval> interval = fromLabel(label);
        if (interval.isEmpty()) {
            LOGGER.warn()
                    .setMessage("Unknown sampling interval; using default")
                    .addData("label", label)
                    .addData("default", DAY._label)
                    .log();
            return DAY;
        }
        return interval.get();
    }

    private final String _label;
    private final Duration _duration;
    private final int _defaultSeasonalPeriod;
    @Nullable
    private final ChronoUnit _calendarUnit;

    private static final Logger LOGGER = LoggerFactory.getLogger(SamplingInterval.class);
}
