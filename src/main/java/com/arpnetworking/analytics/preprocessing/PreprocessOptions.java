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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotNull;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Independently toggleable preprocessing steps. Every step is off by default.
 *
 * @author Inscope Metrics
 */
public final class PreprocessOptions {

    /**
     * Options with every step disabled.
     */
    public static final PreprocessOptions DEFAULT = new Builder().build();

    public boolean isFillMissingValues() {
        return _fillMissingValues;
    }

    public boolean isRemoveOutliers() {
        return _removeOutliers;
    }

    public double getOutlierThreshold() {
        return _outlierThreshold;
    }

    public boolean isNormalizeTimestamps() {
        return _normalizeTimestamps;
    }

    public Optional<Duration> getExpectedInterval() {
        return _expectedInterval;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final PreprocessOptions other = (PreprocessOptions) object;

        return _fillMissingValues == other._fillMissingValues
                && _removeOutliers == other._removeOutliers
                && Double.compare(_outlierThreshold, other._outlierThreshold) == 0
                && _normalizeTimestamps == other._normalizeTimestamps
                && Objects.equal(_expectedInterval, other._expectedInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_fillMissingValues, _removeOutliers, _outlierThreshold, _normalizeTimestamps, _expectedInterval);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("FillMissingValues", _fillMissingValues)
                .add("RemoveOutliers", _removeOutliers)
                .add("OutlierThreshold", _outlierThreshold)
                .add("NormalizeTimestamps", _normalizeTimestamps)
                .add("ExpectedInterval", _expectedInterval)
                .toString();
    }

    private PreprocessOptions(final Builder builder) {
        _fillMissingValues = builder._fillMissingValues;
        _removeOutliers = builder._removeOutliers;
        _outlierThreshold = builder._outlierThreshold;
        _normalizeTimestamps = builder._normalizeTimestamps;
        _expectedInterval = Optional.ofNullable(builder._expectedInterval);
    }

    private final boolean _fillMissingValues;
    private final boolean _removeOutliers;
    private final double _outlierThreshold;
    private final boolean _normalizeTimestamps;
    private final Optional<Duration> _expectedInterval;

    /**
     * Builder implementation for {@link PreprocessOptions}.
     */
    public static final class Builder extends OvalBuilder<PreprocessOptions> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(PreprocessOptions::new);
        }

        /**
         * Set whether gaps and non-finite values are filled by interpolation.
         * Optional. Defaults to false.
         *
         * @param value Whether to fill missing values.
         * @return This {@link Builder} instance.
         */
        public Builder setFillMissingValues(final Boolean value) {
            _fillMissingValues = value;
            return this;
        }

        /**
         * Set whether outliers are removed. Optional. Defaults to false.
         *
         * @param value Whether to remove outliers.
         * @return This {@link Builder} instance.
         */
        public Builder setRemoveOutliers(final Boolean value) {
            _removeOutliers = value;
            return this;
        }

        /**
         * Set the outlier threshold in standard deviations. Optional. Defaults to 3.
         *
         * @param value The outlier threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setOutlierThreshold(final Double value) {
            _outlierThreshold = value;
            return this;
        }

        /**
         * Set whether timestamps are snapped onto a regular grid. Optional.
         * Defaults to false.
         *
         * @param value Whether to normalize timestamps.
         * @return This {@link Builder} instance.
         */
        public Builder setNormalizeTimestamps(final Boolean value) {
            _normalizeTimestamps = value;
            return this;
        }

        /**
         * Set the expected spacing of points. Optional. Defaults to the
         * detected median spacing.
         *
         * @param value The expected interval.
         * @return This {@link Builder} instance.
         */
        public Builder setExpectedInterval(@Nullable final Duration value) {
            _expectedInterval = value;
            return this;
        }

        @NotNull
        private Boolean _fillMissingValues = false;
        @NotNull
        private Boolean _removeOutliers = false;
        @NotNull
        private Double _outlierThreshold = 3.0;
        @NotNull
        private Boolean _normalizeTimestamps = false;
        private Duration _expectedInterval;
    }
}
