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
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Affine-invariant ensemble sampler with the two-half stretch update.
///
/// ## Iteration
///
/// ```text
///   walkers  [ 0 .. W/2 )          [ W/2 .. W )
///   step 1   update, evaluate  <-- partners
///   step 2   partners          --> update, evaluate
/// ```
///
/// Within a half-step the partner half is never written, so all proposals of
/// that half are evaluated through the [EvaluationPool] at once. Every random
/// draw (partner index, stretch scale, acceptance uniform) is taken on the
/// calling thread before the batch is dispatched, so a seeded run gives the
/// same chain for any pool size.
///
/// A `FATAL` evaluation aborts the iteration with [FatalEvaluationException]
/// before any walker of that half is updated.
public final class EnsembleSampler {

    private static final Logger logger = LogManager.getLogger(EnsembleSampler.class);

    private final LogPosterior posterior;
    private final EvaluationPool pool;
    private final RestorableUniformRandomProvider rng;
    private final StretchDistribution stretch;
    private final boolean testMode;

    private WalkerState[] walkers;
    private int dimensions;
    private long iterations;
    private long proposed;
    private long accepted;

    public EnsembleSampler(LogPosterior posterior, EvaluationPool pool, RestorableUniformRandomProvider rng,
                           double stretchScale, boolean testMode) {
        this.posterior = Objects.requireNonNull(posterior, "posterior");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.rng = Objects.requireNonNull(rng, "rng");
        this.stretch = new StretchDistribution(rng, stretchScale);
        this.testMode = testMode;
    }

    /// Validates a population size for a parameter space.
    ///
    /// @throws IllegalArgumentException if the count is odd, below two, or
    ///     (outside test mode) below twice the dimension count
    public static void checkPopulation(int walkers, int dimensions, boolean testMode) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("parameter space needs at least one dimension");
        }
        if (walkers < 2 || walkers % 2 != 0) {
            throw new IllegalArgumentException("walker count must be even and at least 2, got " + walkers);
        }
        if (!testMode && walkers < 2 * dimensions) {
            throw new IllegalArgumentException(
                "walker count " + walkers + " is below twice the " + dimensions + " free parameters");
        }
    }

    /// Starts from fresh positions, evaluating each one.
    ///
    /// @param positions one row per walker
    public void initialize(double[][] positions) throws InterruptedException {
        int[] shape = checkShape(positions);
        List<double[]> rows = new ArrayList<>(Arrays.asList(positions));
        List<EvaluationResult> results = pool.evaluateAll(posterior, rows);
        requireNoFatal(rows, results);
        WalkerState[] states = new WalkerState[shape[0]];
        int finite = 0;
        for (int k = 0; k < states.length; k++) {
            double lnp = results.get(k).lnProbability();
            states[k] = new WalkerState(positions[k], lnp);
            if (Double.isFinite(lnp)) {
                finite++;
            }
        }
        if (finite == 0) {
            logger.warn("No starting position has positive posterior density; walkers will only move by luck");
        }
        install(states, shape[1], 0L, 0L, 0L);
    }

    /// Restores a checkpointed population without re-evaluating it.
    public void restore(double[][] positions, double[] lnProbabilities, long iterationsCompleted,
                        long proposedSoFar, long acceptedSoFar) {
        int[] shape = checkShape(positions);
        if (lnProbabilities.length != shape[0]) {
            throw new IllegalArgumentException(
                lnProbabilities.length + " log-probabilities for " + shape[0] + " walkers");
        }
        WalkerState[] states = new WalkerState[shape[0]];
        for (int k = 0; k < states.length; k++) {
            states[k] = new WalkerState(positions[k], lnProbabilities[k]);
        }
        install(states, shape[1], iterationsCompleted, proposedSoFar, acceptedSoFar);
    }

    private void install(WalkerState[] states, int dims, long iterationsCompleted, long proposedSoFar,
                         long acceptedSoFar) {
        this.walkers = states;
        this.dimensions = dims;
        this.iterations = iterationsCompleted;
        this.proposed = proposedSoFar;
        this.accepted = acceptedSoFar;
    }

    private int[] checkShape(double[][] positions) {
        if (positions.length == 0) {
            throw new IllegalArgumentException("no walker positions");
        }
        int dims = positions[0].length;
        for (double[] row : positions) {
            if (row.length != dims) {
                throw new IllegalArgumentException("walker positions have mixed dimensions");
            }
        }
        checkPopulation(positions.length, dims, testMode);
        return new int[]{positions.length, dims};
    }

    /// Advances every walker once: the first half against the second, then
    /// the second half against the updated first.
    public void iterate() throws InterruptedException {
        if (walkers == null) {
            throw new IllegalStateException("sampler has not been initialized");
        }
        int half = walkers.length / 2;
        halfStep(0, half, half, walkers.length);
        halfStep(half, walkers.length, 0, half);
        iterations++;
    }

    private void halfStep(int from, int to, int partnerFrom, int partnerTo) throws InterruptedException {
        int n = to - from;
        int partners = partnerTo - partnerFrom;
        double[] z = new double[n];
        double[] u = new double[n];
        List<double[]> proposals = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            int partner = partnerFrom + rng.nextInt(partners);
            z[k] = stretch.sample();
            u[k] = rng.nextDouble();
            proposals.add(StretchMove.propose(walkers[from + k].position(), walkers[partner].position(), z[k]));
        }

        List<EvaluationResult> results = pool.evaluateAll(posterior, proposals);
        requireNoFatal(proposals, results);

        for (int k = 0; k < n; k++) {
            WalkerState current = walkers[from + k];
            double lnp = results.get(k).lnProbability();
            double lnRatio = StretchMove.lnAcceptance(dimensions, z[k], lnp, current.lnProbability());
            proposed++;
            if (StretchMove.accept(lnRatio, u[k])) {
                walkers[from + k] = new WalkerState(proposals.get(k), lnp);
                accepted++;
            }
        }
    }

    private static void requireNoFatal(List<double[]> positions, List<EvaluationResult> results) {
        for (int k = 0; k < results.size(); k++) {
            EvaluationResult result = results.get(k);
            if (result.isFatal()) {
                Throwable cause = result.cause();
                if (cause instanceof FatalEvaluationException fatal) {
                    throw fatal;
                }
                throw new FatalEvaluationException(positions.get(k), cause);
            }
        }
    }

    /// Current population, in walker order.
    public List<WalkerState> walkers() {
        if (walkers == null) {
            return List.of();
        }
        return Collections.unmodifiableList(Arrays.asList(walkers.clone()));
    }

    /// Positions as one row per walker.
    public double[][] positions() {
        double[][] rows = new double[walkers.length][];
        for (int k = 0; k < walkers.length; k++) {
            rows[k] = walkers[k].position();
        }
        return rows;
    }

    public double[] lnProbabilities() {
        double[] lnp = new double[walkers.length];
        for (int k = 0; k < walkers.length; k++) {
            lnp[k] = walkers[k].lnProbability();
        }
        return lnp;
    }

    public int dimensions() {
        return dimensions;
    }

    public int walkerCount() {
        return walkers == null ? 0 : walkers.length;
    }

    /// Iterations completed since the chain began, including before a resume.
    public long iterations() {
        return iterations;
    }

    public long proposed() {
        return proposed;
    }

    public long accepted() {
        return accepted;
    }

    /// Fraction of proposals accepted so far, 0 before the first iteration.
    public double acceptanceFraction() {
        return proposed == 0 ? 0.0 : (double) accepted / proposed;
    }

    public RestorableUniformRandomProvider rng() {
        return rng;
    }

    public EvaluationPool pool() {
        return pool;
    }
}
