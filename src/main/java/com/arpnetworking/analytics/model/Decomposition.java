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
package com.arpnetworking.analytics.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Additive decomposition of a series. The four component series share the
 * timestamps of the original and satisfy
 * {@code original[i] = trend[i] + seasonal[i] + residual[i]} up to floating
 * point error.
 *
 * @author Inscope Metrics
 */
public final class Decomposition {

    public TimeSeries getTrend() {
        return _trend;
    }

    public TimeSeries getSeasonal() {
        return _seasonal;
    }

    public TimeSeries getResidual() {
        return _residual;
    }

    public TimeSeries getOriginal() {
        return _original;
    }

    public int getSeasonalPeriod() {
        return _seasonalPeriod;
    }

    public int getWindowSize() {
        return _windowSize;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Decomposition other = (Decomposition) object;

        return _seasonalPeriod == other._seasonalPeriod
                && _windowSize == other._windowSize
                && Objects.equal(_trend, other._trend)
                && Objects.equal(_seasonal, other._seasonal)
                && Objects.equal(_residual, other._residual)
                && Objects.equal(_original, other._original);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_trend, _seasonal, _residual, _original, _seasonalPeriod, _windowSize);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Original", _original)
                .add("SeasonalPeriod", _seasonalPeriod)
                .add("WindowSize", _windowSize)
                .toString();
    }

    private Decomposition(final Builder builder) {
        _trend = builder._trend;
        _seasonal = builder._seasonal;
        _residual = builder._residual;
        _original = builder._original;
        _seasonalPeriod = builder._seasonalPeriod;
        _windowSize = builder._windowSize;
    }

    private final TimeSeries _trend;
    private final TimeSeries _seasonal;
    private final TimeSeries _residual;
    private final TimeSeries _original;
    private final int _seasonalPeriod;
    private final int _windowSize;

    /**
     * Builder implementation for {@link Decomposition}.
     */
    public static final class Builder extends OvalBuilder<Decomposition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Decomposition::new);
        }

        /**
         * Set the trend component. Required. Cannot be null.
         *
         * @param value The trend.
         * @return This {@link Builder} instance.
         */
        public Builder setTrend(final TimeSeries value) {
            _trend = value;
            return this;
        }

        /**
         * Set the seasonal component. Required. Cannot be null.
         *
         * @param value The seasonal component.
         * @return This {@link Builder} instance.
         */
        public Builder setSeasonal(final TimeSeries value) {
            _seasonal = value;
            return this;
        }

        /**
         * Set the residual component. Required. Cannot be null.
         *
         * @param value The residual.
         * @return This {@link Builder} instance.
         */
        public Builder setResidual(final TimeSeries value) {
            _residual = value;
            return this;
        }

        /**
         * Set the original series. Required. Cannot be null.
         *
         * @param value The original series.
         * @return This {@link Builder} instance.
         */
        public Builder setOriginal(final TimeSeries value) {
            _original = value;
            return this;
        }

        /**
         * Set the seasonal period. Required. Must be at least 1.
         *
         * @param value The seasonal period.
         * @return This {@link Builder} instance.
         */
        public Builder setSeasonalPeriod(final Integer value) {
            _seasonalPeriod = value;
            return this;
        }

        /**
         * Set the trend window size. Required. Must be at least 1.
         *
         * @param value The window size.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowSize(final Integer value) {
            _windowSize = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateOriginal(final TimeSeries original) {
            return _trend != null && _seasonal != null && _residual != null
                    && _trend.size() == original.size()
                    && _seasonal.size() == original.size()
                    && _residual.size() == original.size();
        }

        @NotNull
        private TimeSeries _trend;
        @NotNull
        private TimeSeries _seasonal;
        @NotNull
        private TimeSeries _residual;
        @NotNull
        @ValidateWithMethod(methodName = "validateOriginal", parameterType = TimeSeries.class)
        private TimeSeries _original;
        @NotNull
        @Min(1)
        private Integer _seasonalPeriod;
        @NotNull
        @Min(1)
        private Integer _windowSize;
    }
}
