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
package com.arpnetworking.analytics.statistics;

import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Pearson correlation between two series and sample entropy of one series.
 *
 * @author Inscope Metrics
 */
public final class CorrelationAnalyzer {

    /**
     * Pearson correlation coefficient of two series.
     *
     * <p>Without alignment the series are paired by position and must have
     * the same length. With alignment points are paired by timestamp, closest
     * pairs first, each point used at most once, within half of the smaller
     * of the two median spacings; unmatched points are ignored. The result
     * does not depend on the order of the arguments. A series with zero
     * variance correlates 0 with anything.</p>
     *
     * @param a The first series.
     * @param b The second series.
     * @param align Whether to pair points by timestamp.
     * @return The coefficient in [-1, 1] and the number of pairs.
     */
    public CorrelationResult calculateCorrelation(final TimeSeries a, final TimeSeries b, final boolean align) {
        final double[][] pairs;
        if (align) {
            pairs = alignByTimestamp(a, b);
        } else {
            if (a.size() != b.size()) {
                throw new ValidationException(
                        "Series must have the same length",
                        context(a, b).addParameter("lengthA", a.size()).addParameter("lengthB", b.size()));
            }
            pairs = new double[][] {a.values(), b.values()};
        }
        final int count = pairs[0].length;
        if (count < MIN_PAIRS) {
            throw new ValidationException(
                    "At least 2 data points required",
                    context(a, b).addParameter("pairs", count).addParameter("aligned", align));
        }
        return new CorrelationResult(pearson(pairs[0], pairs[1]), count);
    }

    /**
     * Sample entropy of a series with Chebyshev distance and self-matches
     * excluded.
     *
     * @param series The series.
     * @param embeddingDimension The template length m; at least 1.
     * @param tolerance The match tolerance r as a fraction of the series' standard deviation.
     * @return The entropy; positive infinity when no templates match.
     */
    public EntropyResult calculateSampleEntropy(final TimeSeries series, final int embeddingDimension, final double tolerance) {
        if (embeddingDimension < 1) {
            throw new ValidationException(
                    "Embedding dimension must be positive",
                    ErrorContext.of("calculateSampleEntropy", series.getMetricId())
                            .addParameter("embeddingDimension", embeddingDimension));
        }
        if (!Double.isFinite(tolerance) || tolerance < 0) {
            throw new ValidationException(
                    "Tolerance must be non-negative",
                    ErrorContext.of("calculateSampleEntropy", series.getMetricId()).addParameter("tolerance", tolerance));
        }
        final double[] values = series.values();
        if (values.length < embeddingDimension + 2) {
            throw new ValidationException(
                    String.format("Need at least %d data points", embeddingDimension + 2),
                    ErrorContext.of("calculateSampleEntropy", series.getMetricId())
                            .addParameter("length", values.length)
                            .addParameter("embeddingDimension", embeddingDimension));
        }
        final double standardDeviation = Math.sqrt(StatUtils.populationVariance(values));
        if (standardDeviation == 0) {
            return new EntropyResult(0.0, embeddingDimension, tolerance);
        }
        final double radius = tolerance * standardDeviation;
        final int templates = values.length - embeddingDimension;
        long shortMatches = 0;
        long longMatches = 0;
        for (int i = 0; i < templates - 1; ++i) {
            for (int j = i + 1; j < templates; ++j) {
                if (matches(values, i, j, embeddingDimension, radius)) {
                    ++shortMatches;
                    if (Math.abs(values[i + embeddingDimension] - values[j + embeddingDimension]) <= radius) {
                        ++longMatches;
                    }
                }
            }
        }
        final double entropy = shortMatches == 0 || longMatches == 0
                ? Double.POSITIVE_INFINITY
                : -Math.log((double) longMatches / shortMatches);
        return new EntropyResult(entropy, embeddingDimension, tolerance);
    }

    static double pearson(final double[] x, final double[] y) {
        // Canonical pair order; swapping the arguments yields identical input
        final double[][] forward = sortPairs(x, y);
        final double[][] backward = sortPairs(y, x);
        final double[][] canonical = comparePairs(forward, backward) <= 0 ? forward : backward;
        final double coefficient = PEARSONS_CORRELATION.correlation(canonical[0], canonical[1]);
        // Zero variance yields NaN
        if (Double.isNaN(coefficient)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, coefficient));
    }

    private static double[][] sortPairs(final double[] x, final double[] y) {
        final Integer[] order = new Integer[x.length];
        for (int i = 0; i < order.length; ++i) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> x[i]).thenComparingDouble(i -> y[i]));
        final double[][] sorted = new double[2][x.length];
        for (int i = 0; i < order.length; ++i) {
            sorted[0][i] = x[order[i]];
            sorted[1][i] = y[order[i]];
        }
        return sorted;
    }

    private static int comparePairs(final double[][] left, final double[][] right) {
        final int first = Arrays.compare(left[0], right[0]);
        return first != 0 ? first : Arrays.compare(left[1], right[1]);
    }

    private static boolean matches(final double[] values, final int i, final int j, final int length, final double radius) {
        for (int k = 0; k < length; ++k) {
            if (Math.abs(values[i + k] - values[j + k]) > radius) {
                return false;
            }
        }
        return true;
    }

    private static double[][] alignByTimestamp(final TimeSeries a, final TimeSeries b) {
        final List<TimeSeriesPoint> first = a.getPoints();
        final List<TimeSeriesPoint> second = b.getPoints();
        if (first.size() < MIN_PAIRS || second.size() < MIN_PAIRS) {
            throw new ValidationException(
                    "At least 2 data points required",
                    context(a, b).addParameter("lengthA", a.size()).addParameter("lengthB", b.size()));
        }
        final long tolerance = Math.min(medianSpacing(first), medianSpacing(second)) / 2;

        final List<Match> candidates = new ArrayList<>();
        int from = 0;
        for (int i = 0; i < first.size(); ++i) {
            final Instant timestamp = first.get(i).getTimestamp();
            while (from < second.size() && offset(second.get(from), timestamp) < -tolerance) {
                ++from;
            }
            for (int j = from; j < second.size() && offset(second.get(j), timestamp) <= tolerance; ++j) {
                candidates.add(new Match(i, j, timestamp, second.get(j).getTimestamp()));
            }
        }
        // Closest pairs first; each point joins at most one pair
        candidates.sort(MATCH_ORDER);
        final boolean[] firstUsed = new boolean[first.size()];
        final boolean[] secondUsed = new boolean[second.size()];
        final double[] firstValues = new double[Math.min(first.size(), second.size())];
        final double[] secondValues = new double[firstValues.length];
        int count = 0;
        for (final Match match : candidates) {
            if (!firstUsed[match._first] && !secondUsed[match._second]) {
                firstUsed[match._first] = true;
                secondUsed[match._second] = true;
                firstValues[count] = first.get(match._first).getValue();
                secondValues[count] = second.get(match._second).getValue();
                ++count;
            }
        }
        return new double[][] {Arrays.copyOf(firstValues, count), Arrays.copyOf(secondValues, count)};
    }

    private static long medianSpacing(final List<TimeSeriesPoint> points) {
        final double[] spacings = new double[points.size() - 1];
        for (int i = 1; i < points.size(); ++i) {
            spacings[i - 1] = Duration.between(points.get(i - 1).getTimestamp(), points.get(i).getTimestamp()).toNanos();
        }
        return Math.round(new Median().evaluate(spacings));
    }

    private static long offset(final TimeSeriesPoint candidate, final Instant reference) {
        return Duration.between(reference, candidate.getTimestamp()).toNanos();
    }

    private static ErrorContext.Builder context(final TimeSeries a, final TimeSeries b) {
        return new ErrorContext.Builder()
                .setOperation("calculateCorrelation")
                .addParameter("metricA", a.getMetricId())
                .addParameter("metricB", b.getMetricId());
    }

    private static final int MIN_PAIRS = 2;
    private static final PearsonsCorrelation PEARSONS_CORRELATION = new PearsonsCorrelation();
    private static final Comparator<Match> MATCH_ORDER = Comparator.<Match>comparingLong(match -> match._distance)
            .thenComparing(match -> match._earlier)
            .thenComparing(match -> match._later);

    private static final class Match {

        Match(final int first, final int second, final Instant firstTimestamp, final Instant secondTimestamp) {
            _first = first;
            _second = second;
            _distance = Math.abs(Duration.between(firstTimestamp, secondTimestamp).toNanos());
            _earlier = firstTimestamp.isBefore(secondTimestamp) ? firstTimestamp : secondTimestamp;
            _later = firstTimestamp.isBefore(secondTimestamp) ? secondTimestamp : firstTimestamp;
        }

        private final int _first;
        private final int _second;
        private final long _distance;
        private final Instant _earlier;
        private final Instant _later;
    }
}
