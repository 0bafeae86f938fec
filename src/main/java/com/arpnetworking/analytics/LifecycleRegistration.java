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

import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Accepts callbacks to run when the host process shuts the engine down.
 *
 * @author Inscope Metrics
 */
public interface LifecycleRegistration {

    /**
     * Register a callback to run on shutdown.
     *
     * @param callback Releases a resource; the returned stage completes once it is released.
     */
    void registerShutdown(Supplier<CompletionStage<Void>> callback);
}
