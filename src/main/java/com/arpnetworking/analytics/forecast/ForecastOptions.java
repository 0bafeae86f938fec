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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Options for a forecast request. Ranges are checked by
 * {@link ForecastService} so that violations surface as validation errors
 * naming the request.
 *
 * @author Inscope Metrics
 */
public final class ForecastOptions {

    /**
     * Options with every default applied.
     */
    public static final ForecastOptions DEFAULT = new Builder().build();

    public int getWindowSize() {
        return _windowSize;
    }

    public double getConfidenceLevel() {
        return _confidenceLevel;
    }

    public Optional<Integer> getSeasonalPeriod() {
        return _seasonalPeriod;
    }

    public boolean isValidateWithHistory() {
        return _validateWithHistory;
    }

    public boolean isNonNegative() {
        return _nonNegative;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ForecastOptions other = (ForecastOptions) object;

        return _windowSize == other._windowSize
                && Double.compare(_confidenceLevel, other._confidenceLevel) == 0
                && Objects.equal(_seasonalPeriod, other._seasonalPeriod)
                && _validateWithHistory == other._validateWithHistory
                && _nonNegative == other._nonNegative;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_windowSize, _confidenceLevel, _seasonalPeriod, _validateWithHistory, _nonNegative);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("WindowSize", _windowSize)
                .add("ConfidenceLevel", _confidenceLevel)
                .add("SeasonalPeriod", _seasonalPeriod)
                .add("ValidateWithHistory", _validateWithHistory)
                .add("NonNegative", _nonNegative)
                .toString();
    }

    private ForecastOptions(final Builder builder) {
        _windowSize = builder._windowSize;
        _confidenceLevel = builder._confidenceLevel;
        _seasonalPeriod = Optional.ofNullable(builder._seasonalPeriod);
        _validateWithHistory = builder._validateWithHistory;
        _nonNegative = builder._nonNegative;
    }

    private final int _windowSize;
    private final double _confidenceLevel;
    private final Optional<Integer> _seasonalPeriod;
    private final boolean _validateWithHistory;
    private final boolean _nonNegative;

    /**
     * Builder implementation for {@link ForecastOptions}.
     */
    public static final class Builder extends OvalBuilder<ForecastOptions> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ForecastOptions::new);
        }

        /**
         * Set the moving average window. Optional. Defaults to 7.
         *
         * @param value The window size.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowSize(final Integer value) {
            _windowSize = value;
            return this;
        }

        /**
         * Set the two-sided confidence level of the interval. Optional.
         * Defaults to 0.95.
         *
         * @param value The confidence level.
         * @return This {@link Builder} instance.
         */
        public Builder setConfidenceLevel(final Double value) {
            _confidenceLevel = value;
            return this;
        }

        /**
         * Set the seasonal period. Optional. Defaults to the default period
         * of the series' sampling interval.
         *
         * @param value The seasonal period.
         * @return This {@link Builder} instance.
         */
        public Builder setSeasonalPeriod(@Nullable final Integer value) {
            _seasonalPeriod = value;
            return this;
        }

        /**
         * Set whether to backtest the method against the tail of the history.
         * Optional. Defaults to false.
         *
         * @param value Whether to validate.
         * @return This {@link Builder} instance.
         */
        public Builder setValidateWithHistory(final Boolean value) {
            _validateWithHistory = value;
            return this;
        }

        /**
         * Set whether forecasts and lower bounds are clamped at zero.
         * Optional. Defaults to true.
         *
         * @param value Whether values are non-negative.
         * @return This {@link Builder} instance.
         */
        public Builder setNonNegative(final Boolean value) {
            _nonNegative = value;
            return this;
        }

        @NotNull
        private Integer _windowSize = 7;
        @NotNull
        private Double _confidenceLevel = 0.95;
        private Integer _seasonalPeriod;
        @NotNull
        private Boolean _validateWithHistory = false;
        @NotNull
        private Boolean _nonNegative = true;
    }
}
