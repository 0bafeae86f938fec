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
package com.arpnetworking.analytics.configuration;

import com.arpnetworking.analytics.downsampling.DownsamplingMethod;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Representation of analytics engine configuration.
 *
 * @author Inscope Metrics
 */
@JsonDeserialize(builder = AnalyticsConfiguration.Builder.class)
public final class AnalyticsConfiguration {

    /**
     * Name of the default configuration resource on the classpath.
     */
    public static final String DEFAULT_RESOURCE = "analytics.json";

    /**
     * Load the default configuration from the classpath.
     *
     * @return The configuration.
     * @throws IOException if the resource is missing or malformed.
     */
    public static AnalyticsConfiguration loadDefault() throws IOException {
        try (InputStream stream = AnalyticsConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IOException(String.format("Configuration resource not found; resource=%s", DEFAULT_RESOURCE));
            }
            return load(stream);
        }
    }

    /**
     * Load configuration from a file.
     *
     * @param path The file.
     * @return The configuration.
     * @throws IOException if the file cannot be read or is malformed.
     */
    public static AnalyticsConfiguration load(final Path path) throws IOException {
        try (InputStream stream = Files.newInputStream(path)) {
            return load(stream);
        }
    }

    /**
     * Load configuration from a stream of JSON.
     *
     * @param stream The stream; not closed.
     * @return The configuration.
     * @throws IOException if the content is malformed.
     */
    public static AnalyticsConfiguration load(final InputStream stream) throws IOException {
        return OBJECT_MAPPER.readValue(stream, AnalyticsConfiguration.class);
    }

    public CacheConfiguration getTimeSeriesCache() {
        return _timeSeriesCache;
    }

    public CacheConfiguration getDecompositionCache() {
        return _decompositionCache;
    }

    public CacheConfiguration getForecastCache() {
        return _forecastCache;
    }

    public boolean isFillMissingValues() {
        return _fillMissingValues;
    }

    public boolean isNormalizeTimestamps() {
        return _normalizeTimestamps;
    }

    public boolean isRemoveOutliers() {
        return _removeOutliers;
    }

    public double getOutlierThreshold() {
        return _outlierThreshold;
    }

    public double getAnomalyThreshold() {
        return _anomalyThreshold;
    }

    public int getDecompositionWindowSize() {
        return _decompositionWindowSize;
    }

    public int getMaxPoints() {
        return _maxPoints;
    }

    public int getDecompositionMaxPoints() {
        return _decompositionMaxPoints;
    }

    public DownsamplingMethod getDownsamplingMethod() {
        return _downsamplingMethod;
    }

    public double getSignificanceThreshold() {
        return _significanceThreshold;
    }

    public int getChunkSize() {
        return _chunkSize;
    }

    public int getParallelism() {
        return _parallelism;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("TimeSeriesCache", _timeSeriesCache)
                .add("DecompositionCache", _decompositionCache)
                .add("ForecastCache", _forecastCache)
                .add("FillMissingValues", _fillMissingValues)
                .add("NormalizeTimestamps", _normalizeTimestamps)
                .add("RemoveOutliers", _removeOutliers)
                .add("OutlierThreshold", _outlierThreshold)
                .add("AnomalyThreshold", _anomalyThreshold)
                .add("DecompositionWindowSize", _decompositionWindowSize)
                .add("MaxPoints", _maxPoints)
                .add("DecompositionMaxPoints", _decompositionMaxPoints)
                .add("DownsamplingMethod", _downsamplingMethod)
                .add("SignificanceThreshold", _significanceThreshold)
                .add("ChunkSize", _chunkSize)
                .add("Parallelism", _parallelism)
                .toString();
    }

    private AnalyticsConfiguration(final Builder builder) {
        _timeSeriesCache = builder._timeSeriesCache;
        _decompositionCache = builder._decompositionCache;
        _forecastCache = builder._forecastCache;
        _fillMissingValues = builder._fillMissingValues;
        _normalizeTimestamps = builder._normalizeTimestamps;
        _removeOutliers = builder._removeOutliers;
        _outlierThreshold = builder._outlierThreshold;
        _anomalyThreshold = builder._anomalyThreshold;
        _decompositionWindowSize = builder._decompositionWindowSize;
        _maxPoints = builder._maxPoints;
        _decompositionMaxPoints = builder._decompositionMaxPoints;
        _downsamplingMethod = builder._downsamplingMethod;
        _significanceThreshold = builder._significanceThreshold;
        _chunkSize = builder._chunkSize;
        _parallelism = builder._parallelism;
    }

    private final CacheConfiguration _timeSeriesCache;
    private final CacheConfiguration _decompositionCache;
    private final CacheConfiguration _forecastCache;
    private final boolean _fillMissingValues;
    private final boolean _normalizeTimestamps;
    private final boolean _removeOutliers;
    private final double _outlierThreshold;
    private final double _anomalyThreshold;
    private final int _decompositionWindowSize;
    private final int _maxPoints;
    private final int _decompositionMaxPoints;
    private final DownsamplingMethod _downsamplingMethod;
    private final double _significanceThreshold;
    private final int _chunkSize;
    private final int _parallelism;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createInstance()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Builder implementation for {@link AnalyticsConfiguration}. Every field
     * has a default.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<AnalyticsConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnalyticsConfiguration::new);
        }

        /**
         * Set the raw time series cache. Optional. Defaults to 5 minutes and 100 entries.
         *
         * @param value The cache configuration.
         * @return This {@link Builder} instance.
         */
        public Builder setTimeSeriesCache(final CacheConfiguration value) {
            _timeSeriesCache = value;
            return this;
        }

        /**
         * Set the decomposition cache. Optional. Defaults to 15 minutes and 50 entries.
         *
         * @param value The cache configuration.
         * @return This {@link Builder} instance.
         */
        public Builder setDecompositionCache(final CacheConfiguration value) {
            _decompositionCache = value;
            return this;
        }

        /**
         * Set the forecast cache. Optional. Defaults to 30 minutes and 50 entries.
         *
         * @param value The cache configuration.
         * @return This {@link Builder} instance.
         */
        public Builder setForecastCache(final CacheConfiguration value) {
            _forecastCache = value;
            return this;
        }

        /**
         * Set whether loaded series have gaps filled. Optional. Defaults to true.
         *
         * @param value Whether to fill missing values.
         * @return This {@link Builder} instance.
         */
        public Builder setFillMissingValues(final Boolean value) {
            _fillMissingValues = value;
            return this;
        }

        /**
         * Set whether loaded series are snapped onto their interval grid.
         * Optional. Defaults to true.
         *
         * @param value Whether to normalize timestamps.
         * @return This {@link Builder} instance.
         */
        public Builder setNormalizeTimestamps(final Boolean value) {
            _normalizeTimestamps = value;
            return this;
        }

        /**
         * Set whether outliers are removed from loaded series. Optional.
         * Defaults to false.
         *
         * @param value Whether to remove outliers.
         * @return This {@link Builder} instance.
         */
        public Builder setRemoveOutliers(final Boolean value) {
            _removeOutliers = value;
            return this;
        }

        /**
         * Set the preprocessing outlier threshold in standard deviations.
         * Optional. Defaults to 3.
         *
         * @param value The outlier threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setOutlierThreshold(final Double value) {
            _outlierThreshold = value;
            return this;
        }

        /**
         * Set the default anomaly z-score threshold. Optional. Defaults to 3.
         *
         * @param value The anomaly threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setAnomalyThreshold(final Double value) {
            _anomalyThreshold = value;
            return this;
        }

        /**
         * Set the default decomposition trend window. Optional. Defaults to 7.
         *
         * @param value The window size.
         * @return This {@link Builder} instance.
         */
        public Builder setDecompositionWindowSize(final Integer value) {
            _decompositionWindowSize = value;
            return this;
        }

        /**
         * Set the default maximum points of a rendered series. Optional.
         * Defaults to 1000.
         *
         * @param value The maximum points.
         * @return This {@link Builder} instance.
         */
        public Builder setMaxPoints(final Integer value) {
            _maxPoints = value;
            return this;
        }

        /**
         * Set the default maximum points of each rendered decomposition
         * component. Optional. Defaults to 500.
         *
         * @param value The maximum points.
         * @return This {@link Builder} instance.
         */
        public Builder setDecompositionMaxPoints(final Integer value) {
            _decompositionMaxPoints = value;
            return this;
        }

        /**
         * Set the default downsampling method. Optional. Defaults to LTTB.
         *
         * @param value The method.
         * @return This {@link Builder} instance.
         */
        public Builder setDownsamplingMethod(final DownsamplingMethod value) {
            _downsamplingMethod = value;
            return this;
        }

        /**
         * Set the significance threshold of first-last-significant
         * downsampling as a fraction of the value range. Optional. Defaults to 0.1.
         *
         * @param value The threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setSignificanceThreshold(final Double value) {
            _significanceThreshold = value;
            return this;
        }

        /**
         * Set the number of buckets per downsampling chunk. Optional. Defaults to 1000.
         *
         * @param value The chunk size.
         * @return This {@link Builder} instance.
         */
        public Builder setChunkSize(final Integer value) {
            _chunkSize = value;
            return this;
        }

        /**
         * Set the number of threads processing downsampling chunks; zero
         * processes on the calling thread. Optional. Defaults to 0.
         *
         * @param value The parallelism.
         * @return This {@link Builder} instance.
         */
        public Builder setParallelism(final Integer value) {
            _parallelism = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validatePositive(final Double value) {
            return Double.isFinite(value) && value > 0;
        }

        @NotNull
        private CacheConfiguration _timeSeriesCache = CacheConfiguration.of(Duration.ofMinutes(5), 100);
        @NotNull
        private CacheConfiguration _decompositionCache = CacheConfiguration.of(Duration.ofMinutes(15), 50);
        @NotNull
        private CacheConfiguration _forecastCache = CacheConfiguration.of(Duration.ofMinutes(30), 50);
        @NotNull
        private Boolean _fillMissingValues = true;
        @NotNull
        private Boolean _normalizeTimestamps = true;
        @NotNull
        private Boolean _removeOutliers = false;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _outlierThreshold = 3.0;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _anomalyThreshold = 3.0;
        @NotNull
        @Min(3)
        private Integer _decompositionWindowSize = 7;
        @NotNull
        @Min(3)
        private Integer _maxPoints = 1000;
        @NotNull
        @Min(3)
        private Integer _decompositionMaxPoints = 500;
        @NotNull
        private DownsamplingMethod _downsamplingMethod = DownsamplingMethod.LTTB;
        @NotNull
        @Range(min = 0, max = 1)
        private Double _significanceThreshold = 0.1;
        @NotNull
        @Min(1)
        private Integer _chunkSize = 1000;
        @NotNull
        @Min(0)
        private Integer _parallelism = 0;
    }
}
