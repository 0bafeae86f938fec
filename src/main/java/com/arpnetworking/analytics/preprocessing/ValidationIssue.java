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
import com.google.common.base.Objects;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A single preprocessing finding, optionally naming the index of the raw
 * input point it concerns.
 *
 * @author Inscope Metrics
 */
public final class ValidationIssue {

    /**
     * Public constructor.
     *
     * @param type The kind of issue.
     * @param message Human readable description.
     * @param index Index into the raw input; may be null.
     */
    public ValidationIssue(final IssueType type, final String message, @Nullable final Integer index) {
        _type = type;
        _message = message;
        _index = Optional.ofNullable(index);
    }

    public IssueType getType() {
        return _type;
    }

    public String getMessage() {
        return _message;
    }

    public Optional<Integer> getIndex() {
        return _index;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ValidationIssue other = (ValidationIssue) object;

        return _type == other._type
                && Objects.equal(_message, other._message)
                && Objects.equal(_index, other._index);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_type, _message, _index);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Type", _type)
                .add("Message", _message)
                .add("Index", _index)
                .toString();
    }

    private final IssueType _type;
    private final String _message;
    private final Optional<Integer> _index;
}
