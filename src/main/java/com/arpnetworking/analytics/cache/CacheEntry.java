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

import com.google.common.base.MoreObjects;

import java.time.Duration;

/**
 * An immutable cached value with the time it was stored and its time to live.
 *
 * @author Inscope Metrics
 */
final class CacheEntry {

    CacheEntry(final Object value, final long insertedAtNanos, final Duration ttl) {
        _value = value;
        _insertedAtNanos = insertedAtNanos;
        _ttl = ttl;
    }

    Object getValue() {
        return _value;
    }

    boolean isExpired(final long nowNanos) {
        return nowNanos - _insertedAtNanos >= _ttl.toNanos();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Value", _value)
                .add("InsertedAtNanos", _insertedAtNanos)
                .add("Ttl", _ttl)
                .toString();
    }

    private final Object _value;
    private final long _insertedAtNanos;
    private final Duration _ttl;
}
