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
package com.arpnetworking.analytics.cache;

import com.arpnetworking.analytics.model.DateRange;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Identifies a cached computation. The canonical form is
 * {@code operation:metricIds:parameters} where the parameters are serialized
 * as JSON with sorted keys, so equal requests produce equal keys regardless
 * of the order options were added.
 *
 * @author Inscope Metrics
 */
public final class CacheKey {

    public CacheNamespace getNamespace() {
        return _namespace;
    }

    public String getOperation() {
        return _operation;
    }

    public ImmutableList<String> getMetricIds() {
        return _metricIds;
    }

    /**
     * The canonical string form of the key.
     *
     * @return The canonical key.
     */
    public String getKey() {
        return _key;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final CacheKey other = (CacheKey) object;

        return _namespace == other._namespace
                && Objects.equal(_key, other._key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_namespace, _key);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Namespace", _namespace)
                .add("Key", _key)
                .toString();
    }

    private CacheKey(final Builder builder) {
        _namespace = builder._namespace;
        _operation = builder._operation;
        _metricIds = ImmutableList.copyOf(builder._metricIds);
        final Map<String, Object> parameters = new TreeMap<>(builder._parameters);
        if (builder._range != null) {
            parameters.put("end", builder._range.getEnd().toString());
            parameters.put("start", builder._range.getStart().toString());
        }
        if (builder._interval != null) {
            parameters.put("interval", builder._interval.getLabel());
        }
        try {
            _key = _operation + ":" + METRIC_JOINER.join(_metricIds) + ":" + OBJECT_MAPPER.writeValueAsString(parameters);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(
                    String.format("Cache key parameters are not serializable; operation=%s", _operation),
                    e);
        }
    }

    private final CacheNamespace _namespace;
    private final String _operation;
    private final ImmutableList<String> _metricIds;
    private final String _key;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createInstance()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final Joiner METRIC_JOINER = Joiner.on(",");

    /**
     * Builder implementation for {@link CacheKey}.
     */
    public static final class Builder extends OvalBuilder<CacheKey> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CacheKey::new);
        }

        /**
         * Set the namespace. Required. Cannot be null.
         *
         * @param value The namespace.
         * @return This {@link Builder} instance.
         */
        public Builder setNamespace(final CacheNamespace value) {
            _namespace = value;
            return this;
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
         * Add a metric identifier. Metrics keep the order they were added in.
         *
         * @param value The metric identifier.
         * @return This {@link Builder} instance.
         */
        public Builder addMetricId(final String value) {
            _metricIds.add(value);
            return this;
        }

        /**
         * Set the range. Optional. Can be null.
         *
         * @param value The range.
         * @return This {@link Builder} instance.
         */
        public Builder setRange(@Nullable final DateRange value) {
            _range = value;
            return this;
        }

        /**
         * Set the sampling interval. Optional. Can be null.
         *
         * @param value The interval.
         * @return This {@link Builder} instance.
         */
        public Builder setInterval(@Nullable final SamplingInterval value) {
            _interval = value;
            return this;
        }

        /**
         * Add a parameter. The value must be serializable to JSON.
         *
         * @param name The parameter name.
         * @param value The parameter value.
         * @return This {@link Builder} instance.
         */
        public Builder putParameter(final String name, final Object value) {
            _parameters.put(name, value);
            return this;
        }

        @NotNull
        private CacheNamespace _namespace;
        @NotNull
        @NotEmpty
        private String _operation;
        @NotNull
        private final List<String> _metricIds = new ArrayList<>();
        private DateRange _range;
        private SamplingInterval _interval;
        @NotNull
        private final Map<String, Object> _parameters = new TreeMap<>();
    }
}
