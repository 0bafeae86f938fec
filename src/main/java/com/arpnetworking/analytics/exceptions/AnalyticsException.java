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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Base class for failures of analytics operations. Carries the operation
 * name, the metric being analyzed (if any) and the parameters of the call.
 *
 * @author Inscope Metrics
 */
public class AnalyticsException extends RuntimeException {

    /**
     * Protected constructor.
     *
     * @param description Human readable description of the failure.
     * @param context The operation context.
     * @param cause The cause; may be null.
     */
    protected AnalyticsException(final String description, final ErrorContext context, @Nullable final Throwable cause) {
        super(formatMessage(description, context), cause);
        _description = description;
        _context = context;
    }

    public String getDescription() {
        return _description;
    }

    public String getOperation() {
        return _context.getOperation();
    }

    public Optional<String> getMetricId() {
        return _context.getMetricId();
    }

    public ImmutableMap<String, Object> getParameters() {
        return _context.getParameters();
    }

    private static String formatMessage(final String description, final ErrorContext context) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", context.getOperation());
        context.getMetricId().ifPresent(metricId -> data.put("metricId", metricId));
        data.putAll(context.getParameters());
        return description + "; " + MESSAGE_JOINER.join(data);
    }

    private final String _description;
    private final transient ErrorContext _context;

    private static final Joiner.MapJoiner MESSAGE_JOINER = Joiner.on(", ").withKeyValueSeparator("=");
    @Serial
    private static final long serialVersionUID = 3179473361539841470L;
}
