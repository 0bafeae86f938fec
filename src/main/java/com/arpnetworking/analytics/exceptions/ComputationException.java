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

import java.io.Serial;
import javax.annotation.Nullable;

/**
 * Thrown when the input is too degenerate for an operation and no fallback exists.
 *
 * @author Inscope Metrics
 */
public final class ComputationException extends AnalyticsException {

    /**
     * Public constructor.
     *
     * @param description Human readable description of the failure.
     * @param context The operation context.
     */
    public ComputationException(final String description, final ErrorContext.Builder context) {
        this(description, context, null);
    }

    /**
     * Public constructor.
     *
     * @param description Human readable description of the failure.
     * @param context The operation context.
     * @param cause The cause; may be null.
     */
    public ComputationException(final String description, final ErrorContext.Builder context, @Nullable final Throwable cause) {
        super(description, context.build(), cause);
    }

    @Serial
    private static final long serialVersionUID = 2947081634492810553L;
}
