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
package com.arpnetworking.analytics.forecast;

import com.arpnetworking.analytics.exceptions.ComputationException;
import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Produces forecasts with confidence intervals.
 *
 * <p>The band around each step {@code h} is
 * {@code forecast ± q × σ × sqrt(h)} where {@code σ} is the residual standard
 * deviation of the method's one-step fitted errors and {@code q} the
 * two-sided quantile for the confidence level: Student's t with
 * {@code n - 2} degrees of freedom for histories of at most 32 points, the
 * standard normal otherwise.</p>
 *
 * <p>This class is stateless and thread safe.</p>
 *
 * @author Inscope Metrics
 */
public final class ForecastService {

    /**
     * Generate a forecast continuing the series at its sampling interval.
     *
     * @param series The history.
     * @param horizon The number of steps; between 1 and 365.
     * @param method The method, or {@link ForecastMethod#AUTO}.
     * @param options The options.
     * @return The forecast.
     */
    public ForecastResult generateForecast(
            final TimeSeries series,
            final int horizon,
            final ForecastMethod method,
            final ForecastOptions options) {
        final String metricId = series.getMetricId();
        validate(metricId, horizon, method, options);
        if (series.isEmpty()) {
            throw new ComputationException(
                    "No data available for forecast",
                    ErrorContext.of("generateForecast", metricId).addParameter("method", method.getName()));
        }

        final double[] history = series.values();
        final ForecastContext context = new ForecastContext(
                metricId,
                options.getWindowSize(),
                options.getSeasonalPeriod().orElse(series.getInterval().getDefaultSeasonalPeriod()));
        final ImmutableList.Builder<String> warnings = ImmutableList.builder();

        final ForecastMethod selected = method == ForecastMethod.AUTO
                ? selectMethod(history, horizon, context, options, warnings)
                : method;
        final PointForecast pointForecast = FORECASTERS.get(selected).forecast(history, horizon, context);
        warnings.addAll(pointForecast.getWarnings());
        if (!pointForecast.hasResiduals()) {
            warnings.add("Not enough history to estimate uncertainty; confidence interval has zero width");
        }

        final double[] values = clamp(pointForecast.getValues(), options);
        final double margin = quantile(options.getConfidenceLevel(), history.length)
                * pointForecast.residualStandardDeviation();
        final double[] upper = new double[horizon];
        final double[] lower = new double[horizon];
        for (int h = 0; h < horizon; ++h) {
            final double width = margin * Math.sqrt(h + 1);
            upper[h] = values[h] + width;
            lower[h] = options.isNonNegative() ? Math.max(0.0, values[h] - width) : values[h] - width;
        }

        double accuracy = pointForecast.getAccuracy();
        ValidationMetrics validationMetrics = null;
        if (options.isValidateWithHistory()) {
            final Forecaster forecaster = FORECASTERS.get(pointForecast.getMethod());
            if (history.length < 2 * horizon || history.length - horizon < forecaster.getMinimumHistory()) {
                warnings.add(String.format(
                        "Insufficient history for validation; length=%d, horizon=%d",
                        history.length,
                        horizon));
            } else {
                validationMetrics = backtest(forecaster, history, horizon, context, options);
                if (!Double.isNaN(validationMetrics.getMape())) {
                    accuracy = validationMetrics.toAccuracy();
                }
            }
        }

        final List<Instant> timestamps = forecastTimestamps(series, horizon);
        final ForecastResult result = new ForecastResult.Builder()
                .setForecast(toSeries(series, timestamps, values))
                .setUpper(toSeries(series, timestamps, upper))
                .setLower(toSeries(series, timestamps, lower))
                .setConfidenceLevel(options.getConfidenceLevel())
                .setAccuracy(Math.max(0.0, Math.min(1.0, accuracy)))
                .setMethod(pointForecast.getMethod())
                .setValidationMetrics(validationMetrics)
                .setModelParameters(pointForecast.getModelParameters())
                .setWarnings(warnings.build())
                .build();

        LOGGER.debug()
                .setMessage("Generated forecast")
                .addData("metricId", metricId)
                .addData("requestedMethod", method.getName())
                .addData("method", result.getMethod().getName())
                .addData("horizon", horizon)
                .addData("accuracy", result.getAccuracy())
                .log();
        return result;
    }

    /**
     * Two-sided quantile for a confidence level given the history length.
     *
     * @param confidenceLevel The confidence level in (0, 1).
     * @param historyLength The number of historical values.
     * @return The quantile.
     */
    static double quantile(final double confidenceLevel, final int historyLength) {
        final double probability = 1.0 - (1.0 - confidenceLevel) / 2.0;
        final int degreesOfFreedom = historyLength - 2;
        if (degreesOfFreedom >= 1 && degreesOfFreedom <= MAX_T_DEGREES_OF_FREEDOM) {
            return new TDistribution(degreesOfFreedom).inverseCumulativeProbability(probability);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(probability);
    }

    private ForecastMethod selectMethod(
            final double[] history,
            final int horizon,
            final ForecastContext context,
            final ForecastOptions options,
            final ImmutableList.Builder<String> warnings) {
        if (history.length < MIN_AUTO_HISTORY) {
            warnings.add(String.format(
                    "Fewer than %d data points; automatic selection uses naive; length=%d",
                    MIN_AUTO_HISTORY,
                    history.length));
            return ForecastMethod.NAIVE;
        }
        final int holdout = Math.min(horizon, Math.max(1, history.length / 5));
        final int trainingLength = history.length - holdout;

        final Map<ForecastMethod, ValidationMetrics> candidates = new EnumMap<>(ForecastMethod.class);
        for (final Forecaster forecaster : FORECASTERS.values()) {
            if (trainingLength < forecaster.getMinimumHistory()) {
                continue;
            }
            if (forecaster.getMethod() == ForecastMethod.SEASONAL_NAIVE && trainingLength < context.getSeasonalPeriod() + 1) {
                continue;
            }
            candidates.put(forecaster.getMethod(), backtest(forecaster, history, holdout, context, options));
        }
        final boolean useMape = candidates.values().stream().noneMatch(metrics -> Double.isNaN(metrics.getMape()));

        ForecastMethod best = ForecastMethod.NAIVE;
        double bestScore = Double.POSITIVE_INFINITY;
        for (final Map.Entry<ForecastMethod, ValidationMetrics> candidate : candidates.entrySet()) {
            final double score = useMape ? candidate.getValue().getMape() : candidate.getValue().getRmse();
            if (score < bestScore) {
                best = candidate.getKey();
                bestScore = score;
            }
        }
        LOGGER.debug()
                .setMessage("Selected forecast method")
                .addData("metricId", context.getMetricId())
                .addData("method", best.getName())
                .addData("criterion", useMape ? "mape" : "rmse")
                .addData("score", bestScore)
                .addData("candidates", candidates)
                .log();
        return best;
    }

    private static ValidationMetrics backtest(
            final Forecaster forecaster,
            final double[] history,
            final int holdout,
            final ForecastContext context,
            final ForecastOptions options) {
        final int trainingLength = history.length - holdout;
        final double[] training = Arrays.copyOfRange(history, 0, trainingLength);
        final double[] actual = Arrays.copyOfRange(history, trainingLength, history.length);
        final double[] predicted = clamp(forecaster.forecast(training, holdout, context).getValues(), options);
        return ValidationMetrics.compute(actual, predicted);
    }

    private static double[] clamp(final double[] values, final ForecastOptions options) {
        if (!options.isNonNegative()) {
            return values;
        }
        final double[] clamped = new double[values.length];
        for (int i = 0; i < values.length; ++i) {
            clamped[i] = Math.max(0.0, values[i]);
        }
        return clamped;
    }

    private static List<Instant> forecastTimestamps(final TimeSeries series, final int horizon) {
        final Instant last = series.getPoints().get(series.size() - 1).getTimestamp();
        final SamplingInterval interval = series.getInterval();
        final ImmutableList.Builder<Instant> timestamps = ImmutableList.builderWithExpectedSize(horizon);
        for (int h = 1; h <= horizon; ++h) {
            timestamps.add(interval.plus(last, h));
        }
        return timestamps.build();
    }

    private static TimeSeries toSeries(final TimeSeries history, final List<Instant> timestamps, final double[] values) {
        final ImmutableList.Builder<TimeSeriesPoint> points = ImmutableList.builderWithExpectedSize(values.length);
        for (int i = 0; i < values.length; ++i) {
            points.add(new TimeSeriesPoint(timestamps.get(i), values[i]));
        }
        return new TimeSeries.Builder()
                .setMetricId(history.getMetricId())
                .setInterval(history.getInterval())
                .setRange(DateRange.of(timestamps.get(0), timestamps.get(timestamps.size() - 1)))
                .setPoints(points.build())
                .build();
    }

    private static void validate(
            final String metricId,
            final int horizon,
            final ForecastMethod method,
            final ForecastOptions options) {
        if (horizon < MIN_HORIZON || horizon > MAX_HORIZON) {
            throw new ValidationException(
                    String.format("Horizon must be between %d and %d", MIN_HORIZON, MAX_HORIZON),
                    ErrorContext.of("generateForecast", metricId)
                            .addParameter("horizon", horizon)
                            .addParameter("method", method.getName()));
        }
        if (options.getWindowSize() < 1) {
            throw new ValidationException(
                    "Window size must be positive",
                    ErrorContext.of("generateForecast", metricId).addParameter("windowSize", options.getWindowSize()));
        }
        final double confidenceLevel = options.getConfidenceLevel();
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new ValidationException(
                    "Confidence level must be strictly between 0 and 1",
                    ErrorContext.of("generateForecast", metricId).addParameter("confidenceLevel", confidenceLevel));
        }
        if (options.getSeasonalPeriod().isPresent() && options.getSeasonalPeriod().get() < 1) {
            throw new ValidationException(
                    "Seasonal period must be positive",
                    ErrorContext.of("generateForecast", metricId)
                            .addParameter("seasonalPeriod", options.getSeasonalPeriod().get()));
        }
    }

    private static final int MIN_HORIZON = 1;
    private static final int MAX_HORIZON = 365;
    private static final int MIN_AUTO_HISTORY = 10;
    private static final int MAX_T_DEGREES_OF_FREEDOM = 30;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();
    private static final Map<ForecastMethod, Forecaster> FORECASTERS;
    private static final Logger LOGGER = LoggerFactory.getLogger(ForecastService.class);

    static {
        final NaiveForecaster naive = new NaiveForecaster();
        final Map<ForecastMethod, Forecaster> forecasters = new EnumMap<>(ForecastMethod.class);
        forecasters.put(ForecastMethod.NAIVE, naive);
        forecasters.put(ForecastMethod.SEASONAL_NAIVE, new SeasonalNaiveForecaster(naive));
        forecasters.put(ForecastMethod.MOVING_AVERAGE, new MovingAverageForecaster());
        forecasters.put(ForecastMethod.LINEAR_REGRESSION, new LinearRegressionForecaster());
        FORECASTERS = Collections.unmodifiableMap(forecasters);
    }
}
