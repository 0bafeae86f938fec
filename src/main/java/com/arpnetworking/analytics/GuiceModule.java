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

import com.arpnetworking.analytics.anomaly.AnomalyDetector;
import com.arpnetworking.analytics.cache.ComputationCache;
import com.arpnetworking.analytics.configuration.AnalyticsConfiguration;
import com.arpnetworking.analytics.decomposition.Decomposer;
import com.arpnetworking.analytics.downsampling.ChunkProcessor;
import com.arpnetworking.analytics.downsampling.Downsampler;
import com.arpnetworking.analytics.forecast.ForecastService;
import com.arpnetworking.analytics.preprocessing.Preprocessor;
import com.arpnetworking.analytics.statistics.CorrelationAnalyzer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The Guice module wiring the analytics engine. The host process supplies
 * the configuration, the repository and the lifecycle that releases the
 * chunk worker pool on shutdown.
 *
 * @author Inscope Metrics
 */
public class GuiceModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     * @param repository The source of raw series.
     * @param lifecycle The shutdown hook.
     */
    public GuiceModule(
            final AnalyticsConfiguration configuration,
            final TimeSeriesRepository repository,
            final LifecycleRegistration lifecycle) {
        _configuration = configuration;
        _repository = repository;
        _lifecycle = lifecycle;
    }

    @Override
    protected void configure() {
        bind(AnalyticsConfiguration.class).toInstance(_configuration);
        bind(TimeSeriesRepository.class).toInstance(_repository);
        bind(LifecycleRegistration.class).toInstance(_lifecycle);

        bind(Preprocessor.class).in(Singleton.class);
        bind(Decomposer.class).in(Singleton.class);
        bind(AnomalyDetector.class).in(Singleton.class);
        bind(CorrelationAnalyzer.class).in(Singleton.class);
        bind(ForecastService.class).in(Singleton.class);
        bind(AnalyticsEngine.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ComputationCache provideComputationCache(final AnalyticsConfiguration configuration) {
        return ComputationCache.create(configuration);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private Downsampler provideDownsampler(final AnalyticsConfiguration configuration, final LifecycleRegistration lifecycle) {
        final ChunkProcessor chunkProcessor;
        if (configuration.getParallelism() > 0) {
            final ExecutorService executor = Executors.newFixedThreadPool(
                    configuration.getParallelism(),
                    new ThreadFactoryBuilder()
                            .setNameFormat("analytics-chunk-%d")
                            .setDaemon(true)
                            .build());
            lifecycle.registerShutdown(() -> {
                executor.shutdown();
                return CompletableFuture.completedFuture(null);
            });
            chunkProcessor = ChunkProcessor.parallel(configuration.getChunkSize(), executor);
        } else {
            chunkProcessor = ChunkProcessor.sequential(configuration.getChunkSize());
        }
        return new Downsampler(chunkProcessor, configuration.getSignificanceThreshold());
    }

    private final AnalyticsConfiguration _configuration;
    private final TimeSeriesRepository _repository;
    private final LifecycleRegistration _lifecycle;
}
