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

import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tests for the {@link Preprocessor}.
 *
 * @author Inscope Metrics
 */
public class PreprocessorTest {

    @Test
    public void testCleanSeriesUnchanged() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1.0, 2.0, 3.0, 4.0, 5.0);
        final PreprocessResult result = _preprocessor.preprocess(series, FILL_AND_NORMALIZE);
        Assert.assertTrue(result.getValidation().isValid());
        Assert.assertTrue(result.getValidation().getErrors().isEmpty());
        Assert.assertTrue(result.getValidation().getWarnings().isEmpty());
        Assert.assertEquals(series, result.getSeries());
        Assert.assertEquals(5, result.getMetadata().getOriginalLength());
        Assert.assertEquals(5, result.getMetadata().getProcessedLength());
        Assert.assertFalse(result.getMetadata().hasMissingValues());
        Assert.assertFalse(result.getMetadata().hasOutliers());
        Assert.assertTrue(result.getMetadata().getInterval().isRegular());
    }

    @Test
    public void testIdempotent() {
        final TimeSeries series = TestBeanFactory.createTimeSeriesBuilder(SamplingInterval.DAY, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0)
                .setPoints(points(1.0, 2.0, 3.0, null, 5.0, 6.0))
                .build();
        final TimeSeries once = _preprocessor.preprocess(series, FILL_AND_NORMALIZE).getSeries();
        final TimeSeries twice = _preprocessor.preprocess(once, FILL_AND_NORMALIZE).getSeries();
        Assert.assertEquals(once, twice);

        final TimeSeries onceFillOnly = _preprocessor.preprocess(series, FILL_ONLY).getSeries();
        Assert.assertEquals(onceFillOnly, _preprocessor.preprocess(onceFillOnly, FILL_ONLY).getSeries());

        // The spike masks a smaller outlier until it is removed
        final double[] values = new double[20];
        Arrays.fill(values, 10.0);
        values[18] = 13.0;
        values[19] = 100.0;
        final PreprocessOptions removeAndFill = new PreprocessOptions.Builder()
                .setRemoveOutliers(true)
                .setFillMissingValues(true)
                .build();
        final PreprocessResult cleaned = _preprocessor.preprocess(TestBeanFactory.createTimeSeries(values), removeAndFill);
        Assert.assertEquals(2, cleaned.getMetadata().getOutlierCount());
        Assert.assertEquals(10.0, cleaned.getSeries().getPoints().get(18).getValue(), 1e-9);
        Assert.assertEquals(10.0, cleaned.getSeries().getPoints().get(19).getValue(), 1e-9);
        final PreprocessResult recleaned = _preprocessor.preprocess(cleaned.getSeries(), removeAndFill);
        Assert.assertEquals(cleaned.getSeries(), recleaned.getSeries());
        Assert.assertFalse(recleaned.getMetadata().hasOutliers());
    }

    @Test
    public void testMonthlySeriesStaysOnCalendarMonths() {
        final ImmutableList.Builder<TimeSeriesPoint> raw = ImmutableList.builder();
        for (int i = 0; i < 60; ++i) {
            raw.add(new TimeSeriesPoint(month(i), i));
        }
        final PreprocessResult result = _preprocessor.preprocess(
                "revenue",
                DateRange.of(month(0), month(59)),
                SamplingInterval.MONTH,
                raw.build(),
                MONTHLY);
        MatcherAssert.assertThat(
                issueTypes(result.getValidation().getWarnings()),
                Matchers.not(Matchers.hasItem(IssueType.TIMESTAMP_COLLISION)));
        Assert.assertFalse(result.getMetadata().hasMissingValues());
        final List<TimeSeriesPoint> points = result.getSeries().getPoints();
        Assert.assertEquals(60, points.size());
        for (int i = 0; i < 60; ++i) {
            Assert.assertEquals(month(i), points.get(i).getTimestamp());
            Assert.assertEquals(i, points.get(i).getValue(), 0.0);
        }
        Assert.assertEquals(Instant.parse("2024-12-01T00:00:00Z"), points.get(59).getTimestamp());
    }

    @Test
    public void testMonthlyGapFilledOnCalendarMonth() {
        final ImmutableList.Builder<TimeSeriesPoint> raw = ImmutableList.builder();
        for (int i = 0; i < 24; ++i) {
            if (i != 13) {
                raw.add(new TimeSeriesPoint(month(i), i));
            }
        }
        final PreprocessResult result = _preprocessor.preprocess(
                "revenue",
                DateRange.of(month(0), month(23)),
                SamplingInterval.MONTH,
                raw.build(),
                MONTHLY);
        final List<TimeSeriesPoint> points = result.getSeries().getPoints();
        Assert.assertEquals(24, points.size());
        Assert.assertEquals(1, result.getMetadata().getMissingValueCount());
        Assert.assertEquals(Instant.parse("2021-02-01T00:00:00Z"), points.get(13).getTimestamp());
        Assert.assertEquals(12.0 + 2.0 * 31 / 59, points.get(13).getValue(), 1e-9);
        Assert.assertEquals(month(23), points.get(23).getTimestamp());

        final PreprocessResult fillOnly = _preprocessor.preprocess(
                "revenue",
                DateRange.of(month(0), month(23)),
                SamplingInterval.MONTH,
                raw.build(),
                new PreprocessOptions.Builder()
                        .setFillMissingValues(true)
                        .setExpectedInterval(Duration.ofDays(30))
                        .build());
        Assert.assertEquals(points, fillOnly.getSeries().getPoints());
    }

    @Test
    public void testNormalizeFillsGap() {
        final List<TimeSeriesPoint> raw = points(1.0, 2.0, 3.0, null, 5.0, 6.0);
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.DAY, 6),
                SamplingInterval.DAY,
                raw,
                FILL_AND_NORMALIZE);
        final TimeSeries series = result.getSeries();
        Assert.assertEquals(6, series.size());
        Assert.assertEquals(TestBeanFactory.timestamp(SamplingInterval.DAY, 3), series.getPoints().get(3).getTimestamp());
        Assert.assertEquals(4.0, series.getPoints().get(3).getValue(), 1e-9);
        Assert.assertTrue(result.getMetadata().hasMissingValues());
        Assert.assertEquals(1, result.getMetadata().getMissingValueCount());
        MatcherAssert.assertThat(issueTypes(result.getValidation().getWarnings()), Matchers.hasItem(IssueType.MISSING_VALUES));
    }

    @Test
    public void testFillWithoutNormalizeInsertsGapSlots() {
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.DAY, 6),
                SamplingInterval.DAY,
                points(10.0, null, null, 40.0, 50.0, 60.0),
                FILL_ONLY);
        Assert.assertArrayEquals(new double[] {10.0, 20.0, 30.0, 40.0, 50.0, 60.0}, result.getSeries().values(), 1e-9);
    }

    @Test
    public void testGapsKeptWithoutFill() {
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.DAY, 6),
                SamplingInterval.DAY,
                points(1.0, 2.0, 3.0, null, 5.0, 6.0),
                PreprocessOptions.DEFAULT);
        Assert.assertEquals(5, result.getSeries().size());
        Assert.assertTrue(result.getMetadata().hasMissingValues());
        Assert.assertTrue(result.getValidation().isValid());
    }

    @Test
    public void testNonFiniteValueInterpolated() {
        final List<TimeSeriesPoint> raw = ImmutableList.of(
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 0), 1.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 1), Double.NaN),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 2), 3.0));
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.DAY, 3),
                SamplingInterval.DAY,
                raw,
                FILL_AND_NORMALIZE);
        Assert.assertArrayEquals(new double[] {1.0, 2.0, 3.0}, result.getSeries().values(), 1e-9);
        final ValidationIssue issue = result.getValidation().getErrors().get(0);
        Assert.assertEquals(IssueType.INVALID_VALUE, issue.getType());
        Assert.assertEquals(Optional.of(1), issue.getIndex());
        Assert.assertTrue(result.getValidation().isValid());
    }

    @Test
    public void testOutliersReported() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1, 1, 1, 1, 1, 1, 1, 1, 1, 50);
        final PreprocessResult result = _preprocessor.preprocess(
                series,
                new PreprocessOptions.Builder().setOutlierThreshold(2.5).build());
        Assert.assertTrue(result.getMetadata().hasOutliers());
        Assert.assertEquals(1, result.getMetadata().getOutlierCount());
        Assert.assertEquals(50.0, result.getSeries().getPoints().get(9).getValue(), 0.0);
        MatcherAssert.assertThat(issueTypes(result.getValidation().getWarnings()), Matchers.hasItem(IssueType.OUTLIERS));
    }

    @Test
    public void testOutliersRemovedAndFilled() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1, 1, 1, 1, 1, 1, 1, 1, 1, 50);
        final PreprocessResult result = _preprocessor.preprocess(
                series,
                new PreprocessOptions.Builder()
                        .setRemoveOutliers(true)
                        .setFillMissingValues(true)
                        .setOutlierThreshold(2.5)
                        .build());
        Assert.assertEquals(10, result.getSeries().size());
        Assert.assertEquals(1.0, result.getSeries().getPoints().get(9).getValue(), 1e-9);
    }

    @Test
    public void testOutliersRemovedWithoutFill() {
        final TimeSeries series = TestBeanFactory.createTimeSeries(1, 1, 1, 1, 1, 1, 1, 1, 1, 50);
        final PreprocessResult result = _preprocessor.preprocess(
                series,
                new PreprocessOptions.Builder().setRemoveOutliers(true).setOutlierThreshold(2.5).build());
        Assert.assertEquals(9, result.getSeries().size());
    }

    @Test
    public void testEmptyInput() {
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.DAY, 3),
                SamplingInterval.DAY,
                ImmutableList.of(),
                FILL_AND_NORMALIZE);
        Assert.assertFalse(result.getValidation().isValid());
        Assert.assertEquals(IssueType.EMPTY_INPUT, result.getValidation().getErrors().get(0).getType());
        Assert.assertTrue(result.getSeries().isEmpty());
    }

    @Test
    public void testSinglePointInsufficient() {
        final PreprocessResult result = _preprocessor.preprocess(
                TestBeanFactory.createTimeSeries(42.0),
                FILL_AND_NORMALIZE);
        Assert.assertFalse(result.getValidation().isValid());
        MatcherAssert.assertThat(
                issueTypes(result.getValidation().getErrors()),
                Matchers.hasItem(IssueType.INSUFFICIENT_DATA));
    }

    @Test
    public void testInvalidPointsScreened() {
        final DateRange range = TestBeanFactory.createRange(SamplingInterval.DAY, 4);
        final List<TimeSeriesPoint> raw = ImmutableList.of(
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 2), 3.0),
                new TimeSeriesPoint(null, 100.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 0), 1.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 1), 2.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 1), 7.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 10), 9.0),
                new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, 3), 4.0));
        final PreprocessResult result = _preprocessor.preprocess("cpu", range, SamplingInterval.DAY, raw, PreprocessOptions.DEFAULT);

        Assert.assertTrue(result.getValidation().isValid());
        Assert.assertArrayEquals(new double[] {1.0, 2.0, 3.0, 4.0}, result.getSeries().values(), 0.0);
        final List<ValidationIssue> errors = result.getValidation().getErrors();
        MatcherAssert.assertThat(
                issueTypes(errors),
                Matchers.containsInAnyOrder(
                        IssueType.INVALID_TIMESTAMP,
                        IssueType.OUT_OF_RANGE,
                        IssueType.DUPLICATE_TIMESTAMP));
        for (final ValidationIssue error : errors) {
            if (error.getType() == IssueType.INVALID_TIMESTAMP) {
                Assert.assertEquals(Optional.of(1), error.getIndex());
            } else if (error.getType() == IssueType.DUPLICATE_TIMESTAMP) {
                Assert.assertEquals(Optional.of(4), error.getIndex());
            } else {
                Assert.assertEquals(Optional.of(5), error.getIndex());
            }
        }
    }

    @Test
    public void testIntervalMismatchWarning() {
        final PreprocessResult result = _preprocessor.preprocess(
                TestBeanFactory.createTimeSeries(SamplingInterval.HOUR, 1.0, 2.0, 3.0, 4.0),
                new PreprocessOptions.Builder().setExpectedInterval(Duration.ofMinutes(30)).build());
        MatcherAssert.assertThat(
                issueTypes(result.getValidation().getWarnings()),
                Matchers.hasItem(IssueType.INTERVAL_MISMATCH));
    }

    @Test
    public void testNormalizeSnapsJitteredTimestamps() {
        final Instant start = TestBeanFactory.START;
        final List<TimeSeriesPoint> raw = ImmutableList.of(
                new TimeSeriesPoint(start, 1.0),
                new TimeSeriesPoint(start.plus(Duration.ofMinutes(62)), 2.0),
                new TimeSeriesPoint(start.plus(Duration.ofMinutes(118)), 3.0),
                new TimeSeriesPoint(start.plus(Duration.ofMinutes(180)), 4.0));
        final PreprocessResult result = _preprocessor.preprocess(
                "cpu",
                DateRange.of(start, start.plus(Duration.ofHours(3))),
                SamplingInterval.HOUR,
                raw,
                new PreprocessOptions.Builder()
                        .setNormalizeTimestamps(true)
                        .setExpectedInterval(Duration.ofHours(1))
                        .build());
        final TimeSeries series = result.getSeries();
        Assert.assertEquals(4, series.size());
        for (int i = 0; i < 4; ++i) {
            Assert.assertEquals(start.plus(Duration.ofHours(i)), series.getPoints().get(i).getTimestamp());
            Assert.assertEquals(i + 1.0, series.getPoints().get(i).getValue(), 0.0);
        }
    }

    @Test(expected = ValidationException.class)
    public void testInvalidOutlierThreshold() {
        _preprocessor.preprocess(
                TestBeanFactory.createTimeSeries(1.0, 2.0),
                new PreprocessOptions.Builder().setOutlierThreshold(0.0).build());
    }

    private static List<TimeSeriesPoint> points(final Double... values) {
        final ImmutableList.Builder<TimeSeriesPoint> points = ImmutableList.builder();
        for (int i = 0; i < values.length; ++i) {
            if (values[i] != null) {
                points.add(new TimeSeriesPoint(TestBeanFactory.timestamp(SamplingInterval.DAY, i), values[i]));
            }
        }
        return points.build();
    }

    private static Instant month(final int index) {
        return ZonedDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).plusMonths(index).toInstant();
    }

    private static List<IssueType> issueTypes(final List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::getType).collect(Collectors.toList());
    }

    private final Preprocessor _preprocessor = new Preprocessor();

    private static final PreprocessOptions FILL_AND_NORMALIZE = new PreprocessOptions.Builder()
            .setFillMissingValues(true)
            .setNormalizeTimestamps(true)
            .setExpectedInterval(Duration.ofDays(1))
            .build();
    private static final PreprocessOptions MONTHLY = new PreprocessOptions.Builder()
            .setFillMissingValues(true)
            .setNormalizeTimestamps(true)
            .setExpectedInterval(Duration.ofDays(30))
            .build();
    private static final PreprocessOptions FILL_ONLY = new PreprocessOptions.Builder()
            .setFillMissingValues(true)
            .build();
}
