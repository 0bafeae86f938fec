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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Set;

/**
 * Errors and warnings found while preprocessing. The report is invalid only
 * when the input was empty or too short to analyze; every other finding
 * leaves it valid.
 *
 * @author Inscope Metrics
 */
public final class ValidationReport {

    /**
     * Public constructor.
     *
     * @param errors The errors.
     * @param warnings The warnings.
     */
    public ValidationReport(final ImmutableList<ValidationIssue> errors, final ImmutableList<ValidationIssue> warnings) {
        _errors = errors;
        _warnings = warnings;
        _valid = errors.stream().noneMatch(issue -> FATAL_TYPES.contains(issue.getType()));
    }

    public boolean isValid() {
        return _valid;
    }

    public ImmutableList<ValidationIssue> getErrors() {
        return _errors;
    }

    public ImmutableList<ValidationIssue> getWarnings() {
        return _warnings;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Valid", _valid)
                .add("Errors", _errors)
                .add("Warnings", _warnings)
                .toString();
    }

    private final boolean _valid;
    private final ImmutableList<ValidationIssue> _errors;
    private final ImmutableList<ValidationIssue> _warnings;

    private static final Set<IssueType> FATAL_TYPES = Set.of(IssueType.EMPTY_INPUT, IssueType.INSUFFICIENT_DATA);
}
