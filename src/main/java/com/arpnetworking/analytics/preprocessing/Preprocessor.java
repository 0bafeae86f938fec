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

import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Validates and cleans raw series. Problems with individual points are
 * reported as {@link ValidationIssue} instances rather than failing the call;
 * only invalid options raise a {@link ValidationException}.
 *
 * <p>Cleaning runs in a fixed order: screening of invalid points, sorting,
 * duplicate removal, interval detection, outlier detection, timestamp
 * normalization and finally gap filling by linear interpolation. Removing
 * outliers repeats detection against the surviving values until none are
 * left, so cleaned output is stable under a second pass. Monthly series
 * sit on calendar month boundaries.</p>
 *
 * <p>This class is stateless and thread safe.</p>
 *
 * @author Inscope Metrics
 */
public final class Preprocessor {

    /**
     * Preprocess an existing series.
     *
     * @param series The series.
     * @param options The preprocessing options.
     * @return The cleaned series with its validation report and metadata.
     */
    public PreprocessResult preprocess(final TimeSeries series, final PreprocessOptions options) {
        return preprocess(series.getMetricId(), series.getRange(), series.getInterval(), series.getPoints(), options);
    }

    /**
     * Preprocess raw points which may carry null timestamps, non-finite
     * values, duplicates and points outside the range.
     *
     * @param metricId The metric identifier.
     * @param range The range the points were requested for.
     * @param interval The nominal sampling interval.
     * @param rawPoints The raw points in any order.
     * @param options The preprocessing options.
     * @return The cleaned series with its validation report and metadata.
     */
    public PreprocessResult preprocess(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final List<TimeSeriesPoint> rawPoints,
            final PreprocessOptions options) {
        validateOptions(metricId, range, options);

        final ImmutableList.Builder<ValidationIssue> errors = ImmutableList.builder();
        final ImmutableList.Builder<ValidationIssue> warnings = ImmutableList.builder();
        final TimeSeries.Builder seriesBuilder = new TimeSeries.Builder()
                .setMetricId(metricId)
                .setRange(range)
                .setInterval(interval);

        if (rawPoints.isEmpty()) {
            errors.add(new ValidationIssue(IssueType.EMPTY_INPUT, "No data points supplied", null));
            return createResult(seriesBuilder.build(), errors, warnings, 0, 0, 0, IntervalStatistics.EMPTY);
        }

        // Screen points that cannot be placed on the time axis
        final List<Candidate> candidates = new ArrayList<>(rawPoints.size());
        int nonFiniteCount = 0;
        for (int i = 0; i < rawPoints.size(); ++i) {
            final TimeSeriesPoint point = rawPoints.get(i);
            final Instant timestamp = point.getTimestamp();
            if (timestamp == null) {
                errors.add(new ValidationIssue(IssueType.INVALID_TIMESTAMP, "Missing timestamp", i));
                continue;
            }
            if (!range.contains(timestamp)) {
                errors.add(new ValidationIssue(
                        IssueType.OUT_OF_RANGE,
                        String.format("Timestamp outside requested range; timestamp=%s", timestamp),
                        i));
                continue;
            }
            double value = point.getValue();
            if (!Double.isFinite(value)) {
                errors.add(new ValidationIssue(
                        IssueType.INVALID_VALUE,
                        String.format("Non-finite value treated as missing; value=%s", value),
                        i));
                value = Double.NaN;
                ++nonFiniteCount;
            }
            candidates.add(new Candidate(i, timestamp, value));
        }
        candidates.sort(Comparator.comparing(candidate -> candidate._timestamp));

        final List<Candidate> unique = new ArrayList<>(candidates.size());
        for (final Candidate candidate : candidates) {
            if (!unique.isEmpty() && unique.get(unique.size() - 1)._timestamp.equals(candidate._timestamp)) {
                errors.add(new ValidationIssue(
                        IssueType.DUPLICATE_TIMESTAMP,
                        String.format("Duplicate timestamp; timestamp=%s", candidate._timestamp),
                        candidate._index));
                continue;
            }
            unique.add(candidate);
        }

        final double[] finiteValues = unique.stream()
                .mapToDouble(candidate -> candidate._value)
                .filter(Double::isFinite)
                .toArray();
        if (finiteValues.length < 2) {
            errors.add(new ValidationIssue(
                    IssueType.INSUFFICIENT_DATA,
                    String.format("At least 2 valid data points required; found=%d", finiteValues.length),
                    null));
            final List<TimeSeriesPoint> remaining = new ArrayList<>();
            for (final Candidate candidate : unique) {
                if (Double.isFinite(candidate._value)) {
                    remaining.add(candidate.toPoint());
                }
            }
            return createResult(
                    seriesBuilder.setPoints(remaining).build(),
                    errors,
                    warnings,
                    rawPoints.size(),
                    nonFiniteCount,
                    0,
                    IntervalStatistics.EMPTY);
        }

        // Interval detection
        final IntervalStatistics intervalStatistics = computeIntervalStatistics(unique);
        final Optional<Duration> expectedInterval = options.getExpectedInterval();
        final Duration step = expectedInterval.orElse(intervalStatistics.getMedian());
        if (expectedInterval.isPresent()) {
            final long expectedNanos = expectedInterval.get().toNanos();
            final long medianNanos = intervalStatistics.getMedian().toNanos();
            if (Math.abs(medianNanos - expectedNanos) > expectedNanos * REGULARITY_TOLERANCE) {
                warnings.add(new ValidationIssue(
                        IssueType.INTERVAL_MISMATCH,
                        String.format(
                                "Detected interval differs from expected; detected=%s, expected=%s",
                                intervalStatistics.getMedian(),
                                expectedInterval.get()),
                        null));
            }
        }
        if (!intervalStatistics.isRegular()) {
            warnings.add(new ValidationIssue(
                    IssueType.IRREGULAR_INTERVAL,
                    String.format(
                            "Irregular spacing between points; coefficientOfVariation=%.3f",
                            intervalStatistics.getCoefficientOfVariation()),
                    null));
        }

        final TimeGrid grid = TimeGrid.create(step, interval);
        long gapSlotCount = 0;
        for (int i = 1; i < unique.size(); ++i) {
            gapSlotCount += grid.gapSlots(unique.get(i - 1)._timestamp, unique.get(i)._timestamp);
        }
        checkGeneratedPoints(metricId, gapSlotCount + unique.size(), step);

        // Outlier detection; removal repeats until no further outliers surface
        final double outlierThreshold = options.getOutlierThreshold();
        final boolean[] outliers = new boolean[unique.size()];
        int outlierCount = markOutliers(unique, outliers, outlierThreshold);
        if (options.isRemoveOutliers()) {
            int found = outlierCount;
            while (found > 0) {
                found = markOutliers(unique, outliers, outlierThreshold);
                outlierCount += found;
            }
        }
        final List<Candidate> working = new ArrayList<>(unique.size());
        for (int i = 0; i < unique.size(); ++i) {
            final Candidate candidate = unique.get(i);
            working.add(outliers[i] && options.isRemoveOutliers() ? candidate.withValue(Double.NaN) : candidate);
        }
        if (outlierCount > 0) {
            warnings.add(new ValidationIssue(
                    IssueType.OUTLIERS,
                    String.format(
                            "Values beyond outlier threshold; count=%d, threshold=%s, removed=%s",
                            outlierCount,
                            outlierThreshold,
                            options.isRemoveOutliers()),
                    null));
        }

        final int missingValueCount = nonFiniteCount + (int) gapSlotCount;
        if (missingValueCount > 0) {
            warnings.add(new ValidationIssue(
                    IssueType.MISSING_VALUES,
                    String.format(
                            "Missing values detected; nonFinite=%d, gapSlots=%d, filled=%s",
                            nonFiniteCount,
                            gapSlotCount,
                            options.isFillMissingValues()),
                    null));
        }

        List<Candidate> cleaned = working;
        if (options.isNormalizeTimestamps()) {
            cleaned = snapToGrid(cleaned, grid, range, warnings);
        } else if (options.isFillMissingValues()) {
            cleaned = insertGapSlots(cleaned, grid);
        }

        final List<TimeSeriesPoint> points = new ArrayList<>(cleaned.size());
        if (options.isFillMissingValues()) {
            final double[] remaining = cleaned.stream()
                    .mapToDouble(candidate -> candidate._value)
                    .filter(Double::isFinite)
                    .toArray();
            final double fallback = StatUtils.mean(remaining.length > 0 ? remaining : finiteValues);
            points.addAll(interpolate(cleaned, fallback));
        } else {
            for (final Candidate candidate : cleaned) {
                if (Double.isFinite(candidate._value)) {
                    points.add(candidate.toPoint());
                }
            }
        }

        if (points.size() < 2) {
            errors.add(new ValidationIssue(
                    IssueType.INSUFFICIENT_DATA,
                    String.format("Fewer than 2 points remain after cleaning; remaining=%d", points.size()),
                    null));
        }

        LOGGER.debug()
                .setMessage("Preprocessed series")
                .addData("metricId", metricId)
                .addData("originalLength", rawPoints.size())
                .addData("processedLength", points.size())
                .addData("missingValues", missingValueCount)
                .addData("outliers", outlierCount)
                .log();

        return createResult(
                seriesBuilder.setPoints(points).build(),
                errors,
                warnings,
                rawPoints.size(),
                missingValueCount,
                outlierCount,
                intervalStatistics);
    }

    private static void validateOptions(final String metricId, final DateRange range, final PreprocessOptions options) {
        final double threshold = options.getOutlierThreshold();
        if (!Double.isFinite(threshold) || threshold <= 0) {
            throw new ValidationException(
                    "Outlier threshold must be positive",
                    ErrorContext.of("preprocess", metricId).addParameter("outlierThreshold", threshold));
        }
        final Optional<Duration> expectedInterval = options.getExpectedInterval();
        if (expectedInterval.isPresent() && (expectedInterval.get().isNegative() || expectedInterval.get().isZero())) {
            throw new ValidationException(
                    "Expected interval must be positive",
                    ErrorContext.of("preprocess", metricId).addParameter("expectedInterval", expectedInterval.get()));
        }
        if (!range.isOrdered()) {
            throw new ValidationException(
                    "Range start is after range end",
                    ErrorContext.of("preprocess", metricId)
                            .addParameter("start", range.getStart())
                            .addParameter("end", range.getEnd()));
        }
    }

    private static void checkGeneratedPoints(final String metricId, final long points, final Duration step) {
        if (points > MAX_GENERATED_POINTS) {
            throw new ValidationException(
                    "Interval too small for the span of the series",
                    ErrorContext.of("preprocess", metricId)
                            .addParameter("interval", step)
                            .addParameter("points", points)
                            .addParameter("maximum", MAX_GENERATED_POINTS));
        }
    }

    private static IntervalStatistics computeIntervalStatistics(final List<Candidate> candidates) {
        if (candidates.size() < 2) {
            return IntervalStatistics.EMPTY;
        }
        final double[] spacingValues = new double[candidates.size() - 1];
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (int i = 1; i < candidates.size(); ++i) {
            final long spacing = Duration.between(candidates.get(i - 1)._timestamp, candidates.get(i)._timestamp).toNanos();
            spacingValues[i - 1] = spacing;
            min = Math.min(min, spacing);
            max = Math.max(max, spacing);
        }
        final double mean = StatUtils.mean(spacingValues);
        final double standardDeviation = Math.sqrt(StatUtils.populationVariance(spacingValues, mean));
        final double coefficientOfVariation = mean > 0 ? standardDeviation / mean : 0.0;
        return new IntervalStatistics(
                Duration.ofNanos(Math.round(mean)),
                Duration.ofNanos(Math.round(new Median().evaluate(spacingValues))),
                Duration.ofNanos(min),
                Duration.ofNanos(max),
                coefficientOfVariation,
                coefficientOfVariation <= REGULARITY_TOLERANCE);
    }

    private static int markOutliers(final List<Candidate> candidates, final boolean[] outliers, final double threshold) {
        final double[] survivors = new double[candidates.size()];
        int count = 0;
        for (int i = 0; i < candidates.size(); ++i) {
            if (!outliers[i] && Double.isFinite(candidates.get(i)._value)) {
                survivors[count++] = candidates.get(i)._value;
            }
        }
        if (count < 2) {
            return 0;
        }
        final double mean = StatUtils.mean(survivors, 0, count);
        final double standardDeviation = Math.sqrt(StatUtils.populationVariance(survivors, mean, 0, count));
        if (standardDeviation == 0) {
            return 0;
        }
        int found = 0;
        for (int i = 0; i < candidates.size(); ++i) {
            final double value = candidates.get(i)._value;
            if (!outliers[i] && Double.isFinite(value) && Math.abs(value - mean) > threshold * standardDeviation) {
                outliers[i] = true;
                ++found;
            }
        }
        return found;
    }

    private static List<Candidate> insertGapSlots(final List<Candidate> candidates, final TimeGrid grid) {
        final List<Candidate> filled = new ArrayList<>();
        for (int i = 0; i < candidates.size(); ++i) {
            final Candidate current = candidates.get(i);
            filled.add(current);
            if (i + 1 < candidates.size()) {
                final long slots = grid.gapSlots(current._timestamp, candidates.get(i + 1)._timestamp);
                for (long k = 1; k <= slots; ++k) {
                    filled.add(new Candidate(-1, grid.slot(current._timestamp, k), Double.NaN));
                }
            }
        }
        return filled;
    }

    private static List<Candidate> snapToGrid(
            final List<Candidate> candidates,
            final TimeGrid grid,
            final DateRange range,
            final ImmutableList.Builder<ValidationIssue> warnings) {
        final Instant anchor = candidates.get(0)._timestamp;
        final int lastSlot = (int) grid.floorSlot(anchor, candidates.get(candidates.size() - 1)._timestamp);
        final boolean extraSlotInRange = range.contains(grid.slot(anchor, lastSlot + 1L));
        final Candidate[] slots = new Candidate[lastSlot + 2];
        final long[] distances = new long[slots.length];
        int collisions = 0;
        int highestSlot = 0;
        for (final Candidate candidate : candidates) {
            int slot = (int) grid.nearestSlot(anchor, candidate._timestamp, true);
            if (slot > lastSlot && !extraSlotInRange) {
                slot = lastSlot;
            }
            final long distance = Math.abs(Duration.between(grid.slot(anchor, slot), candidate._timestamp).toNanos());
            if (slots[slot] != null) {
                ++collisions;
                if (distance >= distances[slot]) {
                    continue;
                }
            }
            slots[slot] = candidate;
            distances[slot] = distance;
            highestSlot = Math.max(highestSlot, slot);
        }
        if (collisions > 0) {
            warnings.add(new ValidationIssue(
                    IssueType.TIMESTAMP_COLLISION,
                    String.format("Points collapsed onto the same grid slot; count=%d", collisions),
                    null));
        }
        final List<Candidate> snapped = new ArrayList<>(highestSlot + 1);
        for (int slot = 0; slot <= highestSlot; ++slot) {
            final Instant timestamp = grid.slot(anchor, slot);
            final double value = slots[slot] == null ? Double.NaN : slots[slot]._value;
            snapped.add(new Candidate(slots[slot] == null ? -1 : slots[slot]._index, timestamp, value));
        }
        return snapped;
    }

    private static List<TimeSeriesPoint> interpolate(final List<Candidate> candidates, final double fallback) {
        final List<TimeSeriesPoint> points = new ArrayList<>(candidates.size());
        int previousFinite = -1;
        for (int i = 0; i < candidates.size(); ++i) {
            final Candidate candidate = candidates.get(i);
            if (Double.isFinite(candidate._value)) {
                points.add(candidate.toPoint());
                previousFinite = i;
                continue;
            }
            int nextFinite = i + 1;
            while (nextFinite < candidates.size() && !Double.isFinite(candidates.get(nextFinite)._value)) {
                ++nextFinite;
            }
            final double value;
            if (previousFinite >= 0 && nextFinite < candidates.size()) {
                final Candidate before = candidates.get(previousFinite);
                final Candidate after = candidates.get(nextFinite);
                final double span = after._timestamp.toEpochMilli() - before._timestamp.toEpochMilli();
                final double elapsed = candidate._timestamp.toEpochMilli() - before._timestamp.toEpochMilli();
                value = before._value + (after._value - before._value) * (elapsed / span);
            } else {
                value = fallback;
            }
            points.add(new TimeSeriesPoint(candidate._timestamp, value));
        }
        return points;
    }

    private static PreprocessResult createResult(
            final TimeSeries series,
            final ImmutableList.Builder<ValidationIssue> errors,
            final ImmutableList.Builder<ValidationIssue> warnings,
            final int originalLength,
            final int missingValueCount,
            final int outlierCount,
            final IntervalStatistics intervalStatistics) {
        return new PreprocessResult(
                series,
                new ValidationReport(errors.build(), warnings.build()),
                new PreprocessMetadata.Builder()
                        .setOriginalLength(originalLength)
                        .setProcessedLength(series.size())
                        .setMissingValueCount(missingValueCount)
                        .setOutlierCount(outlierCount)
                        .setInterval(intervalStatistics)
                        .build());
    }

    private static final double REGULARITY_TOLERANCE = 0.1;
    private static final long MAX_GENERATED_POINTS = 1_000_000;
    private static final Logger LOGGER = LoggerFactory.getLogger(Preprocessor.class);

    private static final class Candidate {

        Candidate(final int index, final Instant timestamp, final double value) {
            _index = index;
            _timestamp = timestamp;
            _value = value;
        }

        Candidate withValue(final double value) {
            return new Candidate(_index, _timestamp, value);
        }

        TimeSeriesPoint toPoint() {
            return new TimeSeriesPoint(_timestamp, _value);
        }

        private final int _index;
        private final Instant _timestamp;
        private final double _value;
    }
}
