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

/**
 * Independent partitions of the computation cache, each with its own
 * capacity and default time to live.
 *
 * @author Inscope Metrics
 */
public enum CacheNamespace {
    /**
     * Raw series loaded from the repository and derived per-series results.
     */
    TIME_SERIES,
    /**
     * Decompositions.
     */
    DECOMPOSITION,
    /**
     * Forecasts.
     */
    FORECAST
}
