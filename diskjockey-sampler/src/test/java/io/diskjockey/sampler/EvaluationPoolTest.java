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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class EvaluationPoolTest {

    private static List<double[]> positions(int n) {
        List<double[]> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(new double[]{i});
        }
        return list;
    }

    @Test
    void resultsFollowPositionOrder() throws Exception {
        LogPosterior slowForSmall = x -> {
            try {
                Thread.sleep((long) (20 - x[0]));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return EvaluationResult.ok(-x[0]);
        };
        try (ExecutorEvaluationPool pool = new ExecutorEvaluationPool(4)) {
            List<EvaluationResult> results = pool.evaluateAll(slowForSmall, positions(12));
            for (int i = 0; i < 12; i++) {
                assertThat(results.get(i).lnProbability()).isEqualTo(-i);
            }
        }
    }

    @Test
    void batchRunsConcurrently() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(4);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        LogPosterior barrier = x -> {
            threads.add(Thread.currentThread().getName());
            allStarted.countDown();
            try {
                return allStarted.await(5, TimeUnit.SECONDS)
                    ? EvaluationResult.ok(0.0)
                    : EvaluationResult.rejected("workers did not overlap");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return EvaluationResult.fatal(e);
            }
        };
        try (ExecutorEvaluationPool pool = new ExecutorEvaluationPool(4)) {
            assertThat(pool.evaluateAll(barrier, positions(4)))
                .allSatisfy(r -> assertThat(r.outcome()).isEqualTo(EvaluationResult.Outcome.OK));
        }
        assertThat(threads).hasSize(4).allSatisfy(name -> assertThat(name).startsWith("dj-worker-"));
    }

    @Test
    void throwingPosteriorBecomesFatalResult() throws Exception {
        LogPosterior oddFails = x -> {
            if (((int) x[0]) % 2 == 1) {
                throw new IllegalArgumentException("odd " + x[0]);
            }
            return EvaluationResult.ok(0.0);
        };
        try (EvaluationPool serial = new SerialEvaluationPool();
             EvaluationPool parallel = new ExecutorEvaluationPool(2)) {
            for (EvaluationPool pool : List.of(serial, parallel)) {
                List<EvaluationResult> results = pool.evaluateAll(oddFails, positions(4));
                assertThat(results).extracting(EvaluationResult::outcome).containsExactly(
                    EvaluationResult.Outcome.OK, EvaluationResult.Outcome.FATAL,
                    EvaluationResult.Outcome.OK, EvaluationResult.Outcome.FATAL);
                assertThat(results.get(1).cause()).isInstanceOf(IllegalArgumentException.class);
            }
        }
    }

    @Test
    void parallelismIsReported() {
        try (ExecutorEvaluationPool pool = new ExecutorEvaluationPool(3)) {
            assertThat(pool.parallelism()).isEqualTo(3);
        }
        assertThat(new SerialEvaluationPool().parallelism()).isEqualTo(1);
    }
}
