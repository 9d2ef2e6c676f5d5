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
import io.diskjockey.core.pipeline.FatalEvaluationException;
import io.diskjockey.sampler.random.RandomGenerators;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class EnsembleSamplerTest {

    private static final double[] MEAN = {1.5, -2.0};
    private static final double[] SIGMA = {0.5, 2.0};

    @Test
    void recoversGaussianMoments() throws Exception {
        EnsembleSampler sampler = new EnsembleSampler(TestPosteriors.gaussian(MEAN, SIGMA),
            new SerialEvaluationPool(), RandomGenerators.create(42L), StretchDistribution.DEFAULT_SCALE, false);
        sampler.initialize(TestPosteriors.ball(RandomGenerators.create(7L), 32, new double[]{0.0, 0.0}, 0.1));

        Moments moments = new Moments(2);
        for (int it = 0; it < 3000; it++) {
            sampler.iterate();
            if (it >= 500) {
                sampler.walkers().forEach(w -> moments.add(w.position()));
            }
        }

        assertThat(moments.mean(0)).isCloseTo(MEAN[0], within(0.05));
        assertThat(moments.mean(1)).isCloseTo(MEAN[1], within(0.25));
        assertThat(Math.sqrt(moments.variance(0))).isCloseTo(SIGMA[0], within(0.05));
        assertThat(Math.sqrt(moments.variance(1))).isCloseTo(SIGMA[1], within(0.2));
        assertThat(sampler.acceptanceFraction()).isBetween(0.2, 0.9);
        assertEquals(3000, sampler.iterations());
    }

    @Test
    void neverAcceptsZeroDensityPositions() throws Exception {
        LogPosterior positiveOnly = x -> x[0] <= 0.0
            ? EvaluationResult.rejected("x must be positive")
            : EvaluationResult.ok(-0.5 * ((x[0] - 0.2) * (x[0] - 0.2) + x[1] * x[1]));
        EnsembleSampler sampler = new EnsembleSampler(positiveOnly, new SerialEvaluationPool(),
            RandomGenerators.create(3L), 2.0, false);
        sampler.initialize(TestPosteriors.ball(RandomGenerators.create(4L), 8, new double[]{0.5, 0.0}, 0.2));

        for (int it = 0; it < 500; it++) {
            sampler.iterate();
            for (WalkerState w : sampler.walkers()) {
                assertThat(w.position()[0]).isPositive();
                assertThat(w.lnProbability()).isFinite();
            }
        }
    }

    @Test
    void walkersStuckAtZeroDensityEscape() throws Exception {
        LogPosterior positiveOnly = x -> x[0] <= 0.0
            ? EvaluationResult.rejected("x must be positive")
            : EvaluationResult.ok(-0.5 * (x[0] * x[0] + x[1] * x[1]));
        EnsembleSampler sampler = new EnsembleSampler(positiveOnly, new SerialEvaluationPool(),
            RandomGenerators.create(9L), 2.0, true);
        double[][] start = TestPosteriors.ball(RandomGenerators.create(10L), 8, new double[]{1.0, 0.0}, 0.5);
        start[0][0] = 0.0;
        sampler.initialize(start);
        assertThat(sampler.walkers().get(0).lnProbability()).isEqualTo(Double.NEGATIVE_INFINITY);

        for (int it = 0; it < 200; it++) {
            sampler.iterate();
        }
        assertThat(sampler.walkers()).allSatisfy(w -> assertThat(w.lnProbability()).isFinite());
    }

    @Test
    void fatalEvaluationAbortsWithoutMovingWalkers() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        LogPosterior failing = x -> calls.incrementAndGet() > 8
            ? EvaluationResult.fatal(new IOException("disk full"))
            : EvaluationResult.ok(-0.5 * x[0] * x[0]);
        EnsembleSampler sampler = new EnsembleSampler(failing, new SerialEvaluationPool(),
            RandomGenerators.create(1L), 2.0, false);
        sampler.initialize(TestPosteriors.ball(RandomGenerators.create(2L), 8, new double[]{0.0, 0.0}, 1.0));
        double[][] before = sampler.positions();

        assertThatThrownBy(sampler::iterate)
            .isInstanceOf(FatalEvaluationException.class)
            .hasRootCauseInstanceOf(IOException.class)
            .hasMessageContaining("disk full");
        assertArrayEquals(before, sampler.positions());
        assertEquals(0, sampler.iterations());
    }

    @Test
    void posteriorThrowingIsFatal() throws Exception {
        LogPosterior broken = x -> {
            throw new IllegalStateException("bug");
        };
        EnsembleSampler sampler = new EnsembleSampler(broken, new SerialEvaluationPool(),
            RandomGenerators.create(1L), 2.0, false);

        assertThatThrownBy(() -> sampler.initialize(new double[][]{{0.0}, {1.0}}))
            .isInstanceOf(FatalEvaluationException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void chainDoesNotDependOnPoolSize() throws Exception {
        LogPosterior posterior = TestPosteriors.gaussian(MEAN, SIGMA);
        double[][] start = TestPosteriors.ball(RandomGenerators.create(21L), 12, new double[]{0.0, 0.0}, 0.5);

        EnsembleSampler serial = new EnsembleSampler(posterior, new SerialEvaluationPool(),
            RandomGenerators.create(99L), 2.0, false);
        serial.initialize(start);
        try (ExecutorEvaluationPool pool = new ExecutorEvaluationPool(4)) {
            EnsembleSampler parallel = new EnsembleSampler(posterior, pool, RandomGenerators.create(99L), 2.0, false);
            parallel.initialize(start);
            for (int it = 0; it < 100; it++) {
                serial.iterate();
                parallel.iterate();
            }
            assertArrayEquals(serial.positions(), parallel.positions());
            assertArrayEquals(serial.lnProbabilities(), parallel.lnProbabilities());
            assertEquals(serial.accepted(), parallel.accepted());
        }
    }

    @Test
    void populationRules() {
        assertThatThrownBy(() -> EnsembleSampler.checkPopulation(7, 2, false))
            .hasMessageContaining("even");
        assertThatThrownBy(() -> EnsembleSampler.checkPopulation(4, 3, false))
            .hasMessageContaining("twice");
        EnsembleSampler.checkPopulation(4, 3, true);
        EnsembleSampler.checkPopulation(6, 3, false);
        assertThatThrownBy(() -> EnsembleSampler.checkPopulation(0, 3, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initializeRejectsRaggedPositions() {
        EnsembleSampler sampler = new EnsembleSampler(TestPosteriors.gaussian(MEAN, SIGMA),
            new SerialEvaluationPool(), RandomGenerators.create(1L), 2.0, true);
        assertThatThrownBy(() -> sampler.initialize(new double[][]{{0.0, 1.0}, {0.0}}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(sampler::iterate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void walkerListIsASnapshot() throws Exception {
        EnsembleSampler sampler = new EnsembleSampler(TestPosteriors.gaussian(MEAN, SIGMA),
            new SerialEvaluationPool(), RandomGenerators.create(1L), 2.0, false);
        sampler.initialize(TestPosteriors.ball(RandomGenerators.create(2L), 4, MEAN, 0.1));
        List<WalkerState> snapshot = sampler.walkers();
        double[] first = snapshot.get(0).position();
        first[0] = 1e9;

        assertThat(sampler.walkers().get(0).position()[0]).isLessThan(10.0);
        assertThatThrownBy(() -> snapshot.set(0, null)).isInstanceOf(UnsupportedOperationException.class);
    }

    static final class Moments {
        private final double[] sum;
        private final double[] sumSq;
        private long n;

        Moments(int dims) {
            sum = new double[dims];
            sumSq = new double[dims];
        }

        void add(double[] x) {
            for (int i = 0; i < x.length; i++) {
                sum[i] += x[i];
                sumSq[i] += x[i] * x[i];
            }
            n++;
        }

        double mean(int i) {
            return sum[i] / n;
        }

        double variance(int i) {
            double m = mean(i);
            return sumSq[i] / n - m * m;
        }
    }
}
