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

import com.arpnetworking.analytics.model.TimeSeries;
import com.google.common.base.MoreObjects;

/**
 * The cleaned series with the validation report and metadata describing it.
 *
 * @author Inscope Metrics
 */
public final class PreprocessResult {

    /**
     * Public constructor.
     *
     * @param series The cleaned series.
     * @param validation The validation report.
     * @param metadata The metadata.
     */
    public PreprocessResult(final TimeSeries series, final ValidationReport validation, final PreprocessMetadata metadata) {
        _series = series;
        _validation = validation;
        _metadata = metadata;
    }

    public TimeSeries getSeries() {
        return _series;
    }

    public ValidationReport getValidation() {
        return _validation;
    }

    public PreprocessMetadata getMetadata() {
        return _metadata;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Series", _series)
                .add("Validation", _validation)
                .add("Metadata", _metadata)
                .toString();
    }

    private final TimeSeries _series;
    private final ValidationReport _validation;
    private final PreprocessMetadata _metadata;
}
