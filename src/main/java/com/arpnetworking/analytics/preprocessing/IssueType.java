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

/**
 * Kinds of findings recorded while preprocessing a series.
 *
 * @author Inscope Metrics
 */
public enum IssueType {
    /**
     * No points were supplied.
     */
    EMPTY_INPUT,
    /**
     * Fewer than two usable points remain.
     */
    INSUFFICIENT_DATA,
    /**
     * A point has no timestamp.
     */
    INVALID_TIMESTAMP,
    /**
     * A point's value is NaN or infinite.
     */
    INVALID_VALUE,
    /**
     * A point repeats an earlier timestamp.
     */
    DUPLICATE_TIMESTAMP,
    /**
     * A point lies outside the requested range.
     */
    OUT_OF_RANGE,
    /**
     * The spacing between points varies by more than the regularity tolerance.
     */
    IRREGULAR_INTERVAL,
    /**
     * The detected spacing differs from the expected interval.
     */
    INTERVAL_MISMATCH,
    /**
     * The series has gaps or missing values.
     */
    MISSING_VALUES,
    /**
     * The series has values beyond the outlier threshold.
     */
    OUTLIERS,
    /**
     * Several points snapped to the same grid slot during normalization.
     */
    TIMESTAMP_COLLISION
}
