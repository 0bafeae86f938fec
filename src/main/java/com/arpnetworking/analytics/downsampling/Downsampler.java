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

import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a series to at most a given number of points for rendering. A
 * series that already fits is returned unchanged. The first and last points
 * are always kept by {@link DownsamplingMethod#LTTB},
 * {@link DownsamplingMethod#MIN_MAX} and
 * {@link DownsamplingMethod#FIRST_LAST_SIGNIFICANT}.
 *
 * @author Inscope Metrics
 */
public final class Downsampler {

    /**
     * Public constructor for sequential processing with the default
     * significance threshold.
     */
    public Downsampler() {
        this(ChunkProcessor.sequential(DEFAULT_CHUNK_SIZE), DEFAULT_SIGNIFICANCE_THRESHOLD);
    }

    /**
     * Public constructor.
     *
     * @param chunkProcessor Processor for bucket based methods.
     * @param significanceThreshold Fraction of the value range a point must
     * move from the last kept point to be significant.
     */
    public Downsampler(final ChunkProcessor chunkProcessor, final double significanceThreshold) {
        _chunkProcessor = chunkProcessor;
        _significanceThreshold = significanceThreshold;
    }

    /**
     * Downsample a series.
     *
     * @param series The series.
     * @param maxPoints The maximum number of points; at least 3.
     * @param method The method.
     * @return A series of at most {@code maxPoints} points.
     */
    public TimeSeries downsample(final TimeSeries series, final int maxPoints, final DownsamplingMethod method) {
        if (maxPoints < MIN_POINTS) {
            throw new ValidationException(
                    "Maximum points too small",
                    ErrorContext.of("downsample", series.getMetricId())
                            .addParameter("maxPoints", maxPoints)
                            .addParameter("minimum", MIN_POINTS)
                            .addParameter("method", method.getName()));
        }
        if (series.size() <= maxPoints) {
            return series;
        }
        final List<TimeSeriesPoint> points = series.getPoints();
        final List<TimeSeriesPoint> sampled;
        switch (method) {
            case LTTB:
                sampled = largestTriangleThreeBuckets(points, maxPoints);
                break;
            case MIN_MAX:
                sampled = minMax(points, maxPoints);
                break;
            case AVERAGE:
                sampled = average(points, maxPoints);
                break;
            case FIRST_LAST_SIGNIFICANT:
                sampled = firstLastSignificant(points, maxPoints);
                break;
            default:
                throw new IllegalArgumentException(String.format("Unsupported downsampling method; method=%s", method));
        }
        LOGGER.debug()
                .setMessage("Downsampled series")
                .addData("metricId", series.getMetricId())
                .addData("method", method.getName())
                .addData("from", points.size())
                .addData("to", sampled.size())
                .log();
        return series.withPoints(sampled);
    }

    /**
     * Downsample a series and describe the reduction.
     *
     * @param series The series.
     * @param maxPoints The maximum number of points; at least 3.
     * @param method The method.
     * @return The downsampled series with its metadata.
     */
    public DownsampledSeries downsampleWithMetadata(
            final TimeSeries series,
            final int maxPoints,
            final DownsamplingMethod method) {
        return new DownsampledSeries(downsample(series, maxPoints, method), series.size(), method);
    }

    private static List<TimeSeriesPoint> largestTriangleThreeBuckets(final List<TimeSeriesPoint> points, final int target) {
        final int n = points.size();
        final Instant origin = points.get(0).getTimestamp();
        final double[] x = new double[n];
        final double[] y = new double[n];
        for (int i = 0; i < n; ++i) {
            x[i] = Duration.between(origin, points.get(i).getTimestamp()).toMillis();
            y[i] = points.get(i).getValue();
        }

        final List<TimeSeriesPoint> sampled = new ArrayList<>(target);
        sampled.add(points.get(0));
        final double bucketSize = (double) (n - 2) / (target - 2);
        int anchor = 0;
        for (int i = 0; i < target - 2; ++i) {
            final int averageFrom = (int) Math.floor((i + 1) * bucketSize) + 1;
            final int averageTo = Math.min((int) Math.floor((i + 2) * bucketSize) + 1, n);
            double averageX = 0.0;
            double averageY = 0.0;
            for (int j = averageFrom; j < averageTo; ++j) {
                averageX += x[j];
                averageY += y[j];
            }
            final int averageCount = averageTo - averageFrom;
            if (averageCount > 0) {
                averageX /= averageCount;
                averageY /= averageCount;
            } else {
                averageX = x[n - 1];
                averageY = y[n - 1];
            }

            final int rangeFrom = (int) Math.floor(i * bucketSize) + 1;
            final int rangeTo = Math.min((int) Math.floor((i + 1) * bucketSize) + 1, n - 1);
            double maxArea = -1.0;
            int selected = rangeFrom;
            for (int j = rangeFrom; j < rangeTo; ++j) {
                final double area = Math.abs(
                        (x[anchor] - averageX) * (y[j] - y[anchor])
                                - (x[anchor] - x[j]) * (averageY - y[anchor])) * 0.5;
                if (area > maxArea) {
                    maxArea = area;
                    selected = j;
                }
            }
            sampled.add(points.get(selected));
            anchor = selected;
        }
        sampled.add(points.get(n - 1));
        return sampled;
    }

    private List<TimeSeriesPoint> minMax(final List<TimeSeriesPoint> points, final int target) {
        final int n = points.size();
        final int bucketCount = (target - 2) / 2;
        final List<TimeSeriesPoint> sampled = new ArrayList<>(target);
        sampled.add(points.get(0));
        if (bucketCount > 0) {
            final int bucketSize = (n - 2 + bucketCount - 1) / bucketCount;
            sampled.addAll(_chunkProcessor.process(
                    buckets(1, n - 1, bucketSize),
                    chunk -> {
                        final List<TimeSeriesPoint> extremes = new ArrayList<>(chunk.size() * 2);
                        for (final int[] bucket : chunk) {
                            int min = bucket[0];
                            int max = bucket[0];
                            for (int j = bucket[0] + 1; j < bucket[1]; ++j) {
                                if (points.get(j).getValue() < points.get(min).getValue()) {
                                    min = j;
                                }
                                if (points.get(j).getValue() > points.get(max).getValue()) {
                                    max = j;
                                }
                            }
                            extremes.add(points.get(Math.min(min, max)));
                            if (min != max) {
                                extremes.add(points.get(Math.max(min, max)));
                            }
                        }
                        return extremes;
                    }));
        }
        sampled.add(points.get(n - 1));
        return sampled;
    }

    private List<TimeSeriesPoint> average(final List<TimeSeriesPoint> points, final int target) {
        final int n = points.size();
        final int bucketSize = (n + target - 1) / target;
        return _chunkProcessor.process(
                buckets(0, n, bucketSize),
                chunk -> {
                    final List<TimeSeriesPoint> averages = new ArrayList<>(chunk.size());
                    for (final int[] bucket : chunk) {
                        final Instant first = points.get(bucket[0]).getTimestamp();
                        double offsetSum = 0.0;
                        double valueSum = 0.0;
                        for (int j = bucket[0]; j < bucket[1]; ++j) {
                            offsetSum += Duration.between(first, points.get(j).getTimestamp()).toNanos();
                            valueSum += points.get(j).getValue();
                        }
                        final int count = bucket[1] - bucket[0];
                        averages.add(new TimeSeriesPoint(
                                first.plusNanos(Math.round(offsetSum / count)),
                                valueSum / count));
                    }
                    return averages;
                });
    }

    private List<TimeSeriesPoint> firstLastSignificant(final List<TimeSeriesPoint> points, final int target) {
        final int n = points.size();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (final TimeSeriesPoint point : points) {
            min = Math.min(min, point.getValue());
            max = Math.max(max, point.getValue());
        }
        final double threshold = (max - min) * _significanceThreshold;

        final List<TimeSeriesPoint> significant = new ArrayList<>();
        double lastKept = points.get(0).getValue();
        for (int i = 1; i < n - 1; ++i) {
            final double value = points.get(i).getValue();
            if (Math.abs(value - lastKept) > threshold) {
                significant.add(points.get(i));
                lastKept = value;
            }
        }

        final List<TimeSeriesPoint> sampled = new ArrayList<>(target);
        sampled.add(points.get(0));
        final int room = target - 2;
        if (significant.size() <= room) {
            sampled.addAll(significant);
        } else {
            final double step = (double) significant.size() / room;
            for (int k = 0; k < room; ++k) {
                sampled.add(significant.get((int) Math.floor(k * step)));
            }
        }
        sampled.add(points.get(n - 1));
        return sampled;
    }

    private static List<int[]> buckets(final int from, final int to, final int bucketSize) {
        final ImmutableList.Builder<int[]> buckets = ImmutableList.builder();
        for (int start = from; start < to; start += bucketSize) {
            buckets.add(new int[] {start, Math.min(start + bucketSize, to)});
        }
        return buckets.build();
    }

    private final ChunkProcessor _chunkProcessor;
    private final double _significanceThreshold;

    private static final int MIN_POINTS = 3;
    private static final int DEFAULT_CHUNK_SIZE = 1000;
    private static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 0.1;
    private static final Logger LOGGER = LoggerFactory.getLogger(Downsampler.class);
}
