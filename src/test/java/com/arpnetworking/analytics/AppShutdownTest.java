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

import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for the {@link AppShutdown}.
 *
 * @author Inscope Metrics
 */
public class AppShutdownTest {

    @Test
    public void testCallbacksRunOnce() {
        final AppShutdown shutdown = new AppShutdown();
        final AtomicInteger calls = new AtomicInteger();
        shutdown.registerShutdown(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });
        shutdown.registerShutdown(() -> CompletableFuture.runAsync(calls::incrementAndGet));

        shutdown.shutdown();
        Assert.assertEquals(2, calls.get());
        shutdown.shutdown();
        Assert.assertEquals(2, calls.get());
    }
}
