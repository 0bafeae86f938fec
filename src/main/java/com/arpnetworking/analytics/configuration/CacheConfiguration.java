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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Duration;

/**
 * Time to live and capacity of one cache namespace.
 *
 * @author Inscope Metrics
 */
@JsonDeserialize(builder = CacheConfiguration.Builder.class)
public final class CacheConfiguration {

    /**
     * Shortcut constructor.
     *
     * @param ttl The default time to live.
     * @param maxEntries The maximum number of entries.
     * @return New {@link CacheConfiguration}.
     */
    public static CacheConfiguration of(final Duration ttl, final int maxEntries) {
        return new Builder().setTtl(ttl).setMaxEntries(maxEntries).build();
    }

    public Duration getTtl() {
        return _ttl;
    }

    public int getMaxEntries() {
        return _maxEntries;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Ttl", _ttl)
                .add("MaxEntries", _maxEntries)
                .toString();
    }

    private CacheConfiguration(final Builder builder) {
        _ttl = builder._ttl;
        _maxEntries = builder._maxEntries;
    }

    private final Duration _ttl;
    private final int _maxEntries;

    /**
     * Builder implementation for {@link CacheConfiguration}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<CacheConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CacheConfiguration::new);
        }

        /**
         * Set the default time to live. Required. Must be positive.
         *
         * @param value The time to live.
         * @return This {@link Builder} instance.
         */
        public Builder setTtl(final Duration value) {
            _ttl = value;
            return this;
        }

        /**
         * Set the maximum number of entries. Required. Must be at least 1.
         *
         * @param value The maximum number of entries.
         * @return This {@link Builder} instance.
         */
        public Builder setMaxEntries(final Integer value) {
            _maxEntries = value;
            return this;
        }

        @SuppressWarnings("unused")
        private boolean validateTtl(final Duration ttl) {
            return !ttl.isNegative() && !ttl.isZero();
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateTtl", parameterType = Duration.class)
        private Duration _ttl;
        @NotNull
        @Min(1)
        private Integer _maxEntries;
    }
}
