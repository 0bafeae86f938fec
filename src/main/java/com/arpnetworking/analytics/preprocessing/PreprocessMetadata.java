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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;

/**
 * Describes what preprocessing found and changed.
 *
 * @author Inscope Metrics
 */
public final class PreprocessMetadata {

    public int getOriginalLength() {
        return _originalLength;
    }

    public int getProcessedLength() {
        return _processedLength;
    }

    public boolean hasMissingValues() {
        return _missingValueCount > 0;
    }

    public int getMissingValueCount() {
        return _missingValueCount;
    }

    public boolean hasOutliers() {
        return _outlierCount > 0;
    }

    public int getOutlierCount() {
        return _outlierCount;
    }

    public IntervalStatistics getInterval() {
        return _interval;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("OriginalLength", _originalLength)
                .add("ProcessedLength", _processedLength)
                .add("MissingValueCount", _missingValueCount)
                .add("OutlierCount", _outlierCount)
                .add("Interval", _interval)
                .toString();
    }

    private PreprocessMetadata(final Builder builder) {
        _originalLength = builder._originalLength;
        _processedLength = builder._processedLength;
        _missingValueCount = builder._missingValueCount;
        _outlierCount = builder._outlierCount;
        _interval = builder._interval;
    }

    private final int _originalLength;
    private final int _processedLength;
    private final int _missingValueCount;
    private final int _outlierCount;
    private final IntervalStatistics _interval;

    /**
     * Builder implementation for {@link PreprocessMetadata}.
     */
    public static final class Builder extends OvalBuilder<PreprocessMetadata> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(PreprocessMetadata::new);
        }

        /**
         * Set the number of raw input points. Required. Cannot be negative.
         *
         * @param value The original length.
         * @return This {@link Builder} instance.
         */
        public Builder setOriginalLength(final Integer value) {
            _originalLength = value;
            return this;
        }

        /**
         * Set the number of output points. Required. Cannot be negative.
         *
         * @param value The processed length.
         * @return This {@link Builder} instance.
         */
        public Builder setProcessedLength(final Integer value) {
            _processedLength = value;
            return this;
        }

        /**
         * Set the number of missing values, counting non-finite values and
         * points absent from gaps. Optional. Defaults to zero.
         *
         * @param value The missing value count.
         * @return This {@link Builder} instance.
         */
        public Builder setMissingValueCount(final Integer value) {
            _missingValueCount = value;
            return this;
        }

        /**
         * Set the number of outliers. Optional. Defaults to zero.
         *
         * @param value The outlier count.
         * @return This {@link Builder} instance.
         */
        public Builder setOutlierCount(final Integer value) {
            _outlierCount = value;
            return this;
        }

        /**
         * Set the interval statistics. Required. Cannot be null.
         *
         * @param value The interval statistics.
         * @return This {@link Builder} instance.
         */
        public Builder setInterval(final IntervalStatistics value) {
            _interval = value;
            return this;
        }

        @NotNull
        @Min(0)
        private Integer _originalLength;
        @NotNull
        @Min(0)
        private Integer _processedLength;
        @NotNull
        @Min(0)
        private Integer _missingValueCount = 0;
        @NotNull
        @Min(0)
        private Integer _outlierCount = 0;
        @NotNull
        private IntervalStatistics _interval;
    }
}
