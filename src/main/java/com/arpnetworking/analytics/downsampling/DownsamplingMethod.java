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
package com.arpnetworking.analytics.downsampling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Point reduction algorithms.
 *
 * @author Inscope Metrics
 */
public enum DownsamplingMethod {
    /**
     * Largest-triangle-three-buckets; preserves visual shape.
     */
    LTTB("lttb"),
    /**
     * Keeps the minimum and maximum of each bucket; preserves extremes.
     */
    MIN_MAX("min-max"),
    /**
     * Replaces each bucket with its mean point; smooths noise.
     */
    AVERAGE("average"),
    /**
     * Keeps points that differ significantly from the last kept point.
     */
    FIRST_LAST_SIGNIFICANT("first-last-significant");

    DownsamplingMethod(final String name) {
        _name = name;
    }

    @JsonValue
    public String getName() {
        return _name;
    }

    /**
     * Look up a method by its external name, for example "min-max".
     *
     * @param name The name.
     * @return The method, if any.
     */
    public static Optional<DownsamplingMethod> fromName(final String name) {
        for (final DownsamplingMethod method : values()) {
            if (method._name.equalsIgnoreCase(name) || method.name().equalsIgnoreCase(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static DownsamplingMethod fromJson(final String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException(
                String.format("Unknown downsampling method; name=%s", name)));
    }

    private final String _name;
}
