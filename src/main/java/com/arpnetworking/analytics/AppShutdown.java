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
package com.arpnetworking.analytics;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Collects shutdown callbacks registered while the engine is wired and runs
 * them when the host process stops it.
 *
 * @author Inscope Metrics
 */
public final class AppShutdown implements LifecycleRegistration {

    @Override
    public void registerShutdown(final Supplier<CompletionStage<Void>> callback) {
        _callbacks.add(callback);
    }

    /**
     * Run every registered callback and wait for all of them to complete.
     * Callbacks run at most once.
     */
    public void shutdown() {
        final List<Supplier<CompletionStage<Void>>> callbacks = List.copyOf(_callbacks);
        _callbacks.clear();
        LOGGER.info()
                .setMessage("Running shutdown callbacks")
                .addData("count", callbacks.size())
                .log();
        final CompletableFuture<?>[] stages = callbacks.stream()
                .map(callback -> callback.get().toCompletableFuture())
                .toArray(CompletableFuture<?>[]::new);
        CompletableFuture.allOf(stages).join();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Callbacks", _callbacks.size())
                .toString();
    }

    private final List<Supplier<CompletionStage<Void>>> _callbacks = new CopyOnWriteArrayList<>();

    private static final Logger LOGGER = LoggerFactory.getLogger(AppShutdown.class);
}
