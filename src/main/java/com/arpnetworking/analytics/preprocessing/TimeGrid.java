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
package com.arpnetworking.analytics.preprocessing;

import com.arpnetworking.analytics.model.SamplingInterval;
import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Grid of timestamps at whole steps from an anchor. A step matching a
 * calendar based interval follows that interval's calendar arithmetic;
 * any other step is a fixed duration.
 *
 * @author Inscope Metrics
 */
final class TimeGrid {

    /**
     * Create a grid for a step.
     *
     * @param step The step between slots.
     * @param interval The nominal interval of the series.
     * @return The grid.
     */
    static TimeGrid create(final Duration step, final SamplingInterval interval) {
        final long nominalNanos = interval.getDuration().toNanos();
        final boolean calendar = interval.isCalendarBased()
                && Math.abs(step.toNanos() - nominalNanos) <= nominalNanos * CALENDAR_TOLERANCE;
        return new TimeGrid(step, calendar ? interval : null);
    }

    /**
     * The timestamp of a slot.
     *
     * @param anchor The timestamp of slot zero.
     * @param slot The slot index.
     * @return The timestamp of the slot.
     */
    Instant slot(final Instant anchor, final long slot) {
        if (_calendarInterval == null) {
            return anchor.plus(_step.multipliedBy(slot));
        }
        return _calendarInterval.plus(anchor, slot);
    }

    /**
     * The last slot at or before a timestamp that is not before the anchor.
     *
     * @param anchor The timestamp of slot zero.
     * @param timestamp The timestamp.
     * @return The slot index.
     */
    long floorSlot(final Instant anchor, final Instant timestamp) {
        long slot = Duration.between(anchor, timestamp).toNanos() / _step.toNanos();
        while (slot > 0 && slot(anchor, slot).isAfter(timestamp)) {
            --slot;
        }
        while (!slot(anchor, slot + 1).isAfter(timestamp)) {
            ++slot;
        }
        return slot;
    }

    /**
     * The slot nearest to a timestamp that is not before the anchor.
     *
     * @param anchor The timestamp of slot zero.
     * @param timestamp The timestamp.
     * @param tiesUp Whether a timestamp halfway between slots goes to the later one.
     * @return The slot index.
     */
    long nearestSlot(final Instant anchor, final Instant timestamp, final boolean tiesUp) {
        final long floor = floorSlot(anchor, timestamp);
        final long below = Duration.between(slot(anchor, floor), timestamp).toNanos();
        final long above = Duration.between(timestamp, slot(anchor, floor + 1)).toNanos();
        if (above < below || (tiesUp && above == below)) {
            return floor + 1;
        }
        return floor;
    }

    /**
     * Number of empty slots between two consecutive points. A point more
     * than half a step beyond the previous one's next slot leaves room for
     * at least one missing slot.
     *
     * @param previous The earlier timestamp.
     * @param next The later timestamp.
     * @return The number of missing slots.
     */
    long gapSlots(final Instant previous, final Instant next) {
        return Math.max(0, nearestSlot(previous, next, false) - 1);
    }

    Duration getStep() {
        return _step;
    }

    boolean isCalendarBased() {
        return _calendarInterval != null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Step", _step)
                .add("CalendarInterval", _calendarInterval)
                .toString();
    }

    private TimeGrid(final Duration step, @Nullable final SamplingInterval calendarInterval) {
        _step = step;
        _calendarInterval = calendarInterval;
    }

    private final Duration _step;
    @Nullable
    private final SamplingInterval _calendarInterval;

    private static final double CALENDAR_TOLERANCE = 0.1;
}
