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
package com.arpnetworking.analytics.exceptions;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Describes the operation that failed. Parameters keep their insertion order.
 *
 * @author Inscope Metrics
 */
public final class ErrorContext {

    /**
     * Shortcut for a context with only an operation and a metric identifier.
     *
     * @param operation The operation name.
     * @param metricId The metric identifier; may be null.
     * @return New {@link Builder} instance.
     */
    public static Builder of(final String operation, @Nullable final String metricId) {
        return new Builder().setOperation(operation).setMetricId(metricId);
    }

    public String getOperation() {
        return _operation;
    }

    public Optional<String> getMetricId() {
        return _metricId;
    }

    public ImmutableMap<String, Object> getParameters() {
        return _parameters;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Operation", _operation)
                .add("MetricId", _metricId)
                .add("Parameters", _parameters)
                .toString();
    }

    private ErrorContext(final Builder builder) {
        _operation = builder._operation;
        _metricId = Optional.ofNullable(builder._metricId);
        _parameters = ImmutableMap.copyOf(builder._parameters);
    }

    private final String _operation;
    private final Optional<String> _metricId;
    private final ImmutableMap<String, Object> _parameters;

    /**
     * Builder implementation for {@link ErrorContext}.
     */
    public static final class Builder extends OvalBuilder<ErrorContext> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ErrorContext::new);
        }

        /**
         * Set the operation. Required. Cannot be null or empty.
         *
         * @param value The operation.
         * @return This {@link Builder} instance.
         */
        public Builder setOperation(final String value) {
            _operation = value;
            return this;
        }

        /**
         * Set the metric identifier. Optional. Can be null.
         *
         * @param value The metric identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setMetricId(@Nullable final String value) {
            _metricId = value;
            return this;
        }

        /**
         * Add a parameter. Null values are rendered as the string "null".
         *
         * @param name The parameter name.
         * @param value The parameter value.
         * @return This {@link Builder} instance.
         */
        public Builder addParameter(final String name, @Nullable final Object value) {
            _parameters.put(name, value == null ? "null" : value);
            return this;
        }

        @NotNull
        @NotEmpty
        private String _operation;
        private String _metricId;
        @NotNull
        private final Map<String, Object> _parameters = new LinkedHashMap<>();
    }
}
