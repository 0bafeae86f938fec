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

import com.arpnetworking.analytics.cache.ComputationCache;
import com.arpnetworking.analytics.configuration.AnalyticsConfiguration;
import com.arpnetworking.analytics.model.SamplingInterval;
import com.arpnetworking.analytics.model.TimeSeries;
import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.analytics.downsampling.Downsampler;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Tests for the {@link GuiceModule}.
 *
 * @author Inscope Metrics
 */
public class GuiceModuleTest {

    @Test
    public void testEngineWiring() {
        final TimeSeriesRepository repository = (metricId, range, interval) ->
                TestBeanFactory.createPoints(interval, 1, 2, 3, 4, 5);
        final Injector injector = Guice.createInjector(
                new GuiceModule(new AnalyticsConfiguration.Builder().setParallelism(2).build(), repository, new AppShutdown()));

        final AnalyticsEngine engine = injector.getInstance(AnalyticsEngine.class);
        Assert.assertSame(engine, injector.getInstance(AnalyticsEngine.class));
        Assert.assertSame(injector.getInstance(ComputationCache.class), injector.getInstance(ComputationCache.class));

        final TimeSeries series = engine.getTimeSeries(
                "cpu",
                TestBeanFactory.createRange(SamplingInterval.HOUR, 5),
                SamplingInterval.HOUR);
        Assert.assertEquals(5, series.size());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testWorkerPoolReleasedOnShutdown() {
        final LifecycleRegistration lifecycle = Mockito.mock(LifecycleRegistration.class);
        final Injector injector = Guice.createInjector(new GuiceModule(
                new AnalyticsConfiguration.Builder().setParallelism(2).build(),
                (metricId, range, interval) -> TestBeanFactory.createPoints(interval, 1, 2, 3),
                lifecycle));
        injector.getInstance(Downsampler.class);
        injector.getInstance(Downsampler.class);

        final ArgumentCaptor<Supplier<CompletionStage<Void>>> callback = ArgumentCaptor.forClass(Supplier.class);
        Mockito.verify(lifecycle, Mockito.times(1)).registerShutdown(callback.capture());
        Assert.assertTrue(callback.getValue().get().toCompletableFuture().isDone());
    }

    @Test
    public void testSequentialDownsamplerRegistersNothing() {
        final LifecycleRegistration lifecycle = Mockito.mock(LifecycleRegistration.class);
        final Injector injector = Guice.createInjector(new GuiceModule(
                new AnalyticsConfiguration.Builder().setParallelism(0).build(),
                (metricId, range, interval) -> TestBeanFactory.createPoints(interval, 1, 2, 3),
                lifecycle));
        injector.getInstance(Downsampler.class);
        Mockito.verifyNoInteractions(lifecycle);
    }
}
