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

import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A forecast with its confidence band, accuracy and provenance. The
 * forecast, upper and lower series share timestamps.
 *
 * @author Inscope Metrics
 */
public final class ForecastResult {

    public TimeSeries getForecast() {
        return _forecast;
    }

    public TimeSeries getUpper() {
        return _upper;
    }

    public TimeSeries getLower() {
        return _lower;
    }

    public double getConfidenceLevel() {
        return _confidenceLevel;
    }

    public double getAccuracy() {
        return _accuracy;
    }

    /**
     * The method that produced the values. For an automatic request this is
     * the selected method; for a seasonal naive request without enough
     * history it is {@link ForecastMethod#NAIVE}.
     *
     * @return The method.
     */
    public ForecastMethod getMethod() {
        return _method;
    }

    public Optional<ValidationMetrics> getValidationMetrics() {
        return _validationMetrics;
    }

    public ImmutableMap<String, Double> getModelParameters() {
        return _modelParameters;
    }

    public ImmutableList<String> getWarnings() {
        return _warnings;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Forecast", _forecast)
                .add("ConfidenceLevel", _confidenceLevel)
                .add("Accuracy", _accuracy)
                .add("Method", _method)
                .add("ValidationMetrics", _validationMetrics)
                .add("ModelParameters", _modelParameters)
                .add("Warnings", _warnings)
                .toString();
    }

    private ForecastResult(final Builder builder) {
        _forecast = builder._forecast;
        _upper = builder._upper;
        _lower = builder._lower;
        _confidenceLevel = builder._confidenceLevel;
        _accuracy = builder._accuracy;
        _method = builder._method;
        _validationMetrics = Optional.ofNullable(builder._validationMetrics);
        _modelParameters = builder._modelParameters;
        _warnings = builder._warnings;
    }

    private final TimeSeries _forecast;
    private final TimeSeries _upper;
    private final TimeSeries _lower;
    private final double _confidenceLevel;
    private final double _accuracy;
    private final ForecastMethod _method;
    private final Optional<ValidationMetrics> _validationMetrics;
    private final ImmutableMap<String, Double> _modelParameters;
    private final ImmutableList<String> _warnings;

    /**
     * Builder implementation for {@link ForecastResult}.
     */
    public static final class Builder extends OvalBuilder<ForecastResult> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ForecastResult::new);
        }

        /**
         * Set the forecast series. Required. Cannot be null.
         *
         * @param value The forecast.
         * @return This {@link Builder} instance.
         */
        public Builder setForecast(final TimeSeries value) {
            _forecast = value;
            return this;
        }

        /**
         * Set the upper bound series. Required. Cannot be null.
         *
         * @param value The upper bound.
         * @return This {@link Builder} instance.
         */
        public Builder setUpper(final TimeSeries value) {
            _upper = value;
            return this;
        }

        /**
         * Set the lower bound series. Required. Cannot be null.
         *
         * @param value The lower bound.
         * @return This {@link Builder} instance.
         */
        public Builder setLower(final TimeSeries value) {
            _lower = value;
            return this;
        }

        /**
         * Set the confidence level. Required. Must be in [0, 1].
         *
         * @param value The confidence level.
         * @return This {@link Builder} instance.
         */
        public Builder setConfidenceLevel(final Double value) {
            _confidenceLevel = value;
            return this;
        }

        /**
         * Set the accuracy. Required. Must be in [0, 1].
         *
         * @param value The accuracy.
         * @return This {@link Builder} instance.
         */
        public Builder setAccuracy(final Double value) {
            _accuracy = value;
            return this;
        }

        /**
         * Set the method. Required. Cannot be null.
         *
         * @param value The method.
         * @return This {@link Builder} instance.
         */
        public Builder setMethod(final ForecastMethod value) {
            _method = value;
            return this;
        }

        /**
         * Set the backtest metrics. Optional. Can be null.
         *
         * @param value The metrics.
         * @return This {@link Builder} instance.
         */
        public Builder setValidationMetrics(@Nullable final ValidationMetrics value) {
            _validationMetrics = value;
            return this;
        }

        /**
         * Set the fitted model parameters. Optional. Defaults to empty.
         *
         * @param value The parameters.
         * @return This {@link Builder} instance.
         */
        public Builder setModelParameters(final ImmutableMap<String, Double> value) {
            _modelParameters = value;
            return this;
        }

        /**
         * Set the warnings. Optional. Defaults to empty.
         *
         * @param value The warnings.
         * @return This {@link Builder} instance.
         */
        public Builder setWarnings(final ImmutableList<String> value) {
            _warnings = value;
            return this;
        }

        @NotNull
        private TimeSeries _forecast;
        @NotNull
        private TimeSeries _upper;
        @NotNull
        private TimeSeries _lower;
        @NotNull
        @Range(min = 0, max = 1)
        private Double _confidenceLevel;
        @NotNull
        @Range(min = 0, max = 1)
        private Double _accuracy;
        @NotNull
        private ForecastMethod _method;
        private ValidationMetrics _validationMetrics;
        @NotNull
        private ImmutableMap<String, Double> _modelParameters = ImmutableMap.of();
        @NotNull
        private ImmutableList<String> _warnings = ImmutableList.of();
    }
}
