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
package com.arpnetworking.analytics;

import com.arpnetworking.analytics.anomaly.AnomalyDetector;
import com.arpnetworking.analytics.anomaly.AnomalyReport;
import com.arpnetworking.analytics.cache.CacheKey;
import com.arpnetworking.analytics.cache.CacheNamespace;
import com.arpnetworking.analytics.cache.ComputationCache;
import com.arpnetworking.analytics.configuration.AnalyticsConfiguration;
import com.arpnetworking.analytics.decomposition.Decomposer;
import com.arpnetworking.analytics.downsampling.DownsampledDecomposition;
import com.arpnetworking.analytics.downsampling.DownsampledSeries;
import com.arpnetworking.analytics.downsampling.Downsampler;
import com.arpnetworking.analytics.downsampling.DownsamplingMethod;
import com.arpnetworking.analytics.exceptions.AnalyticsException;
import com.arpnetworking.analytics.exceptions.ComputationException;
import com.arpnetworking.analytics.exceptions.DependencyException;
import com.arpnetworking.analytics.exceptions.ErrorContext;
import com.arpnetworking.analytics.exceptions.ValidationException;
import com.arpnetworking.analytics.forecast.ForecastMethod;
import com.arpnetworking.analytics.forecast.ForecastOptions;
import com.arpnetworking.analytics.forecast.ForecastResult;
import com.arpnetworking.analytics.forecast.ForecastService;
import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.Decomposition;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.analytics.model.TimeSeriesPoint;
import com.arpnetworking.analytics.preprocessing.PreprocessOptions;
import com.arpnetworking.analytics.preprocessing.PreprocessResult;
import com.arpnetworking.analytics.preprocessing.Preprocessor;
import com.arpnetworking.analytics.statistics.CorrelationAnalyzer;
import com.arpnetworking.analytics.statistics.CorrelationResult;
import com.arpnetworking.analytics.statistics.EntropyResult;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for request handlers. Loads raw series from the
 * {@link TimeSeriesRepository} through the computation cache, preprocesses
 * them and dispatches to the analytics components. Decompositions and
 * forecasts are memoized in their own cache namespaces.
 *
 * <p>Failures surface as {@link AnalyticsException} subclasses: invalid
 * requests as {@link ValidationException}, repository failures and missing
 * data as {@link DependencyException} and series that cannot be analyzed as
 * {@link ComputationException}.</p>
 *
 * @author Inscope Metrics
 */
public final class AnalyticsEngine {

    /**
     * Public constructor.
     *
     * @param repository The source of raw series.
     * @param cache The computation cache.
     * @param preprocessor The preprocessor.
     * @param decomposer The decomposer.
     * @param anomalyDetector The anomaly detector.
     * @param correlationAnalyzer The correlation and entropy analyzer.
     * @param forecastService The forecast service.
     * @param downsampler The downsampler.
     * @param configuration The analytics configuration.
     */
    @Inject
    public AnalyticsEngine(
            final TimeSeriesRepository repository,
            final ComputationCache cache,
            final Preprocessor preprocessor,
            final Decomposer decomposer,
            final AnomalyDetector anomalyDetector,
            final CorrelationAnalyzer correlationAnalyzer,
            final ForecastService forecastService,
            final Downsampler downsampler,
            final AnalyticsConfiguration configuration) {
        _repository = repository;
        _cache = cache;
        _preprocessor = preprocessor;
        _decomposer = decomposer;
        _anomalyDetector = anomalyDetector;
        _correlationAnalyzer = correlationAnalyzer;
        _forecastService = forecastService;
        _downsampler = downsampler;
        _configuration = configuration;
    }

    /**
     * Load and preprocess a series.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @return The cleaned series.
     */
    public TimeSeries getTimeSeries(final String metricId, final DateRange range, final SamplingInterval interval) {
        validateRequest("getTimeSeries", metricId, range);
        return loadSeries("getTimeSeries", metricId, range, interval);
    }

    /**
     * Load, preprocess and downsample a series for display using the
     * configured point limit and method.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @return The downsampled series with its metadata.
     */
    public DownsampledSeries getDownsampledTimeSeries(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval) {
        return getDownsampledTimeSeries(
                metricId,
                range,
                interval,
                _configuration.getMaxPoints(),
                _configuration.getDownsamplingMethod());
    }

    /**
     * Load, preprocess and downsample a series for display.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param maxPoints The maximum number of points returned.
     * @param method The downsampling method.
     * @return The downsampled series with its metadata.
     */
    public DownsampledSeries getDownsampledTimeSeries(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final int maxPoints,
            final DownsamplingMethod method) {
        validateRequest("getTimeSeries", metricId, range);
        final TimeSeries series = loadSeries("getTimeSeries", metricId, range, interval);
        return _downsampler.downsampleWithMetadata(series, maxPoints, method);
    }

    /**
     * Load raw points and preprocess them with caller supplied options. The
     * result carries the full validation report and is not required to be
     * valid.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param options The preprocessing options.
     * @return The preprocessing result.
     */
    public PreprocessResult preprocess(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final PreprocessOptions options) {
        validateRequest("preprocess", metricId, range);
        return _preprocessor.preprocess(metricId, range, interval, loadRaw(metricId, range, interval), options);
    }

    /**
     * Decompose a series using the default seasonal period of its interval.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param windowSize The trend window; at least 3.
     * @return The decomposition.
     */
    public Decomposition decompose(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final int windowSize) {
        return decompose(metricId, range, interval, windowSize, interval.getDefaultSeasonalPeriod());
    }

    /**
     * Decompose a series.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param windowSize The trend window; at least 3.
     * @param seasonalPeriod The seasonal period; at least 1.
     * @return The decomposition.
     */
    public Decomposition decompose(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final int windowSize,
            final int seasonalPeriod) {
        validateRequest("decompose", metricId, range);
        Decomposer.validateParameters(metricId, windowSize, seasonalPeriod);
        final CacheKey key = new CacheKey.Builder()
                .setNamespace(CacheNamespace.DECOMPOSITION)
                .setOperation("decompose")
                .addMetricId(metricId)
                .setRange(range)
                .setInterval(interval)
                .putParameter("windowSize", windowSize)
                .putParameter("seasonalPeriod", seasonalPeriod)
                .build();
        return _cache.getOrCompute(
                key,
                () -> _decomposer.decompose(
                        loadSeries("decompose", metricId, range, interval),
                        windowSize,
                        seasonalPeriod));
    }

    /**
     * Decompose a series with the configured window and downsample every
     * component for display with the configured method.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @return The downsampled components.
     */
    public DownsampledDecomposition decomposeForDisplay(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval) {
        return DownsampledDecomposition.of(
                decompose(metricId, range, interval, _configuration.getDecompositionWindowSize()),
                _downsampler,
                _configuration.getDecompositionMaxPoints(),
                _configuration.getDownsamplingMethod());
    }

    /**
     * Detect anomalies against the whole series using the configured threshold.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @return The anomaly report.
     */
    public AnomalyReport detectAnomalies(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval) {
        return detectAnomalies(metricId, range, interval, _configuration.getAnomalyThreshold());
    }

    /**
     * Detect anomalies against the whole series.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param threshold The z-score threshold.
     * @return The anomaly report.
     */
    public AnomalyReport detectAnomalies(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final double threshold) {
        validateRequest("detectAnomalies", metricId, range);
        final TimeSeries series = loadSeries("detectAnomalies", metricId, range, interval);
        return new AnomalyReport(
                series,
                threshold,
                Optional.empty(),
                _anomalyDetector.detectAnomalies(series, threshold));
    }

    /**
     * Detect anomalies against a trailing window of preceding points.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param threshold The z-score threshold.
     * @param lookbackWindow The number of preceding points forming the baseline.
     * @return The anomaly report.
     */
    public AnomalyReport detectAnomalies(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final double threshold,
            final int lookbackWindow) {
        validateRequest("detectAnomalies", metricId, range);
        final TimeSeries series = loadSeries("detectAnomalies", metricId, range, interval);
        return new AnomalyReport(
                series,
                threshold,
                Optional.of(lookbackWindow),
                _anomalyDetector.detectAnomalies(series, threshold, lookbackWindow));
    }

    /**
     * Forecast a series.
     *
     * @param metricId The metric identifier.
     * @param range The range of the history.
     * @param interval The sampling interval.
     * @param horizon The number of steps; between 1 and 365.
     * @param method The method, or {@link ForecastMethod#AUTO}.
     * @param options The options.
     * @return The forecast.
     */
    public ForecastResult generateForecast(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final int horizon,
            final ForecastMethod method,
            final ForecastOptions options) {
        validateRequest("generateForecast", metricId, range);
        final CacheKey key = new CacheKey.Builder()
                .setNamespace(CacheNamespace.FORECAST)
                .setOperation("forecast")
                .addMetricId(metricId)
                .setRange(range)
                .setInterval(interval)
                .putParameter("horizon", horizon)
                .putParameter("method", method.getName())
                .putParameter("windowSize", options.getWindowSize())
                .putParameter("confidenceLevel", options.getConfidenceLevel())
                .putParameter("seasonalPeriod", options.getSeasonalPeriod().orElse(0))
                .putParameter("validateWithHistory", options.isValidateWithHistory())
                .putParameter("nonNegative", options.isNonNegative())
                .build();
        return _cache.getOrCompute(
                key,
                () -> _forecastService.generateForecast(
                        loadSeries("generateForecast", metricId, range, interval),
                        horizon,
                        method,
                        options));
    }

    /**
     * Correlate two metrics over the same range.
     *
     * @param metricIdA The first metric identifier.
     * @param metricIdB The second metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param align Whether to pair points by timestamp instead of by index.
     * @return The correlation.
     */
    public CorrelationResult calculateCorrelation(
            final String metricIdA,
            final String metricIdB,
            final DateRange range,
            final SamplingInterval interval,
            final boolean align) {
        validateRequest("calculateCorrelation", metricIdA, range);
        validateRequest("calculateCorrelation", metricIdB, range);
        return _correlationAnalyzer.calculateCorrelation(
                loadSeries("calculateCorrelation", metricIdA, range, interval),
                loadSeries("calculateCorrelation", metricIdB, range, interval),
                align);
    }

    /**
     * Sample entropy of a series.
     *
     * @param metricId The metric identifier.
     * @param range The range.
     * @param interval The sampling interval.
     * @param embeddingDimension The template length; at least 1.
     * @param tolerance The match tolerance as a fraction of the standard deviation.
     * @return The entropy.
     */
    public EntropyResult calculateEntropy(
            final String metricId,
            final DateRange range,
            final SamplingInterval interval,
            final int embeddingDimension,
            final double tolerance) {
        validateRequest("calculateEntropy", metricId, range);
        return _correlationAnalyzer.calculateSampleEntropy(
                loadSeries("calculateEntropy", metricId, range, interval),
                embeddingDimension,
                tolerance);
    }

    /**
     * Drop every cached raw series and result.
     */
    public void invalidateAll() {
        _cache.invalidateAll();
    }

    /**
     * Drop cached entries whose canonical key matches a glob pattern, for
     * example {@code "*cpu.usage*"} after new data for that metric arrived.
     *
     * @param pattern The glob pattern; {@code *} matches any characters.
     * @return The number of entries removed.
     */
    public int invalidate(final String pattern) {
        return _cache.invalidate(pattern);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Repository", _repository)
                .add("Configuration", _configuration)
                .toString();
    }

    private TimeSeries loadSeries(
            final String operation,
            final String metricId,
            final DateRange range,
            final SamplingInterval interval) {
        final PreprocessResult result = _preprocessor.preprocess(
                metricId,
                range,
                interval,
                loadRaw(metricId, range, interval),
                preprocessOptions(interval));
        if (!result.getValidation().isValid()) {
            throw new ComputationException(
                    "Series cannot be analyzed after preprocessing",
                    ErrorContext.of(operation, metricId)
                            .addParameter("interval", interval.getLabel())
                            .addParameter("errors", result.getValidation().getErrors().size()));
        }
        if (!result.getValidation().getWarnings().isEmpty()) {
            LOGGER.debug()
                    .setMessage("Preprocessing reported warnings")
                    .addData("operation", operation)
                    .addData("metricId", metricId)
                    .addData("warnings", result.getValidation().getWarnings())
                    .log();
        }
        return result.getSeries();
    }

    private List<TimeSeriesPoint> loadRaw(final String metricId, final DateRange range, final SamplingInterval interval) {
        final CacheKey key = new CacheKey.Builder()
                .setNamespace(CacheNamespace.TIME_SERIES)
                .setOperation("timeSeries")
                .addMetricId(metricId)
                .setRange(range)
                .setInterval(interval)
                .build();
        return _cache.getOrCompute(key, () -> fetch(metricId, range, interval));
    }

    private ImmutableList<TimeSeriesPoint> fetch(final String metricId, final DateRange range, final SamplingInterval interval) {
        final List<TimeSeriesPoint> points;
        try {
            points = _repository.getTimeSeries(metricId, range, interval);
        } catch (final AnalyticsException e) {
            throw e;
        } catch (final IOException | RuntimeException e) {
            LOGGER.warn()
                    .setMessage("Repository failed to load series")
                    .addData("metricId", metricId)
                    .addData("range", range)
                    .addData("interval", interval.getLabel())
                    .setThrowable(e)
                    .log();
            throw new DependencyException(
                    "Failed to load time series",
                    ErrorContext.of("getTimeSeries", metricId)
                            .addParameter("start", range.getStart())
                            .addParameter("end", range.getEnd())
                            .addParameter("interval", interval.getLabel()),
                    e);
        }
        if (points == null || points.isEmpty()) {
            throw new DependencyException(
                    "No data available",
                    ErrorContext.of("getTimeSeries", metricId)
                            .addParameter("start", range.getStart())
                            .addParameter("end", range.getEnd())
                            .addParameter("interval", interval.getLabel()));
        }
        LOGGER.debug()
                .setMessage("Loaded series")
                .addData("metricId", metricId)
                .addData("points", points.size())
                .log();
        return ImmutableList.copyOf(points);
    }

    private PreprocessOptions preprocessOptions(final SamplingInterval interval) {
        return new PreprocessOptions.Builder()
                .setFillMissingValues(_configuration.isFillMissingValues())
                .setNormalizeTimestamps(_configuration.isNormalizeTimestamps())
                .setRemoveOutliers(_configuration.isRemoveOutliers())
                .setOutlierThreshold(_configuration.getOutlierThreshold())
                .setExpectedInterval(interval.getDuration())
                .build();
    }

    private static void validateRequest(final String operation, final String metricId, final DateRange range) {
        if (Strings.isNullOrEmpty(metricId)) {
            throw new ValidationException("Metric identifier is required", ErrorContext.of(operation, null));
        }
        if (!range.isOrdered()) {
            throw new ValidationException(
                    "Range start must not be after end",
                    ErrorContext.of(operation, metricId)
                            .addParameter("start", range.getStart())
                            .addParameter("end", range.getEnd()));
        }
    }

    private final TimeSeriesRepository _repository;
    private final ComputationCache _cache;
    private final Preprocessor _preprocessor;
    private final Decomposer _decomposer;
    private final AnomalyDetector _anomalyDetector;
    private final CorrelationAnalyzer _correlationAnalyzer;
    private final ForecastService _forecastService;
    private final Downsampler _downsampler;
    private final AnalyticsConfiguration _configuration;

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsEngine.class);
}
