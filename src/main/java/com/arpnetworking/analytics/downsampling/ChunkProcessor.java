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
package com.arpnetworking.analytics.downsampling;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Applies a function to fixed size chunks of a list, either on the calling
 * thread or on an executor. Results are concatenated in input order, so both
 * modes produce the same output for a deterministic function.
 *
 * @author Inscope Metrics
 */
public final class ChunkProcessor {

    /**
     * Create a processor that runs every chunk on the calling thread.
     *
     * @param chunkSize The maximum number of items per chunk.
     * @return New {@link ChunkProcessor}.
     */
    public static ChunkProcessor sequential(final int chunkSize) {
        return new ChunkProcessor(chunkSize, Optional.empty());
    }

    /**
     * Create a processor that submits each chunk to an executor.
     *
     * @param chunkSize The maximum number of items per chunk.
     * @param executor The executor; owned by the caller.
     * @return New {@link ChunkProcessor}.
     */
    public static ChunkProcessor parallel(final int chunkSize, final ExecutorService executor) {
        return new ChunkProcessor(chunkSize, Optional.of(executor));
    }

    /**
     * Process the items chunk by chunk.
     *
     * @param items The items.
     * @param function The function applied to each chunk.
     * @param <T> The item type.
     * @param <R> The result type.
     * @return The concatenated chunk results in input order.
     */
    public <T, R> ImmutableList<R> process(final List<T> items, final Function<List<T>, List<R>> function) {
        final List<List<T>> chunks = Lists.partition(items, _chunkSize);
        final ImmutableList.Builder<R> results = ImmutableList.builder();
        if (_executor.isEmpty() || chunks.size() < 2) {
            for (final List<T> chunk : chunks) {
                results.addAll(function.apply(chunk));
            }
            return results.build();
        }

        final List<Future<List<R>>> futures = new ArrayList<>(chunks.size());
        for (final List<T> chunk : chunks) {
            futures.add(_executor.get().submit(() -> function.apply(chunk)));
        }
        try {
            for (final Future<List<R>> future : futures) {
                results.addAll(future.get());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Interrupted while processing chunks", e);
        } catch (final ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            LOGGER.warn()
                    .setMessage("Chunk processing failed")
                    .addData("chunks", chunks.size())
                    .setThrowable(e.getCause())
                    .log();
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Chunk processing failed", e.getCause());
        }
        return results.build();
    }

    public int getChunkSize() {
        return _chunkSize;
    }

    public boolean isParallel() {
        return _executor.isPresent();
    }

    private ChunkProcessor(final int chunkSize, final Optional<ExecutorService> executor) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException(String.format("Invalid chunk size; chunkSize=%d", chunkSize));
        }
        _chunkSize = chunkSize;
        _executor = executor;
    }

    private final int _chunkSize;
    private final Optional<ExecutorService> _executor;

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkProcessor.class);
}
