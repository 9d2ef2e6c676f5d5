package io.diskjockey.sampler;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.diskjockey.core.pipeline.EvaluationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// A fixed pool of worker threads. Each batch is submitted in full and the
/// caller waits on every future before the next batch starts.
public final class ExecutorEvaluationPool implements EvaluationPool {

    private static final Logger logger = LogManager.getLogger(ExecutorEvaluationPool.class);

    private final int workers;
    private final ExecutorService executor;

    public ExecutorEvaluationPool(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("worker count must be at least 1, got " + workers);
        }
        this.workers = workers;
        this.executor = Executors.newFixedThreadPool(workers, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "dj-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        logger.debug("Started evaluation pool with {} workers", workers);
    }

    @Override
    public List<EvaluationResult> evaluateAll(LogPosterior posterior, List<double[]> positions)
        throws InterruptedException {
        List<Future<EvaluationResult>> futures = new ArrayList<>(positions.size());
        for (double[] position : positions) {
            double[] copy = position.clone();
            futures.add(executor.submit(() -> SerialEvaluationPool.evaluateOne(posterior, copy)));
        }
        List<EvaluationResult> results = new ArrayList<>(positions.size());
        try {
            for (Future<EvaluationResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    results.add(EvaluationResult.fatal(e.getCause() != null ? e.getCause() : e));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        return results;
    }

    @Override
    public int parallelism() {
        return workers;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Evaluation workers still busy after 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
