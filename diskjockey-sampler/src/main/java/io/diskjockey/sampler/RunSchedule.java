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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Runs a sampler for a number of loops of a fixed number of iterations.
///
/// Loops are numbered from 0. A resumed run passes the number of loops its
/// checkpoint completed and continues from there.
public final class RunSchedule {

    private static final Logger logger = LogManager.getLogger(RunSchedule.class);

    private final int loops;
    private final int samplesPerLoop;

    public RunSchedule(int loops, int samplesPerLoop) {
        if (loops < 1) {
            throw new IllegalArgumentException("loops must be at least 1, got " + loops);
        }
        if (samplesPerLoop < 1) {
            throw new IllegalArgumentException("samples per loop must be at least 1, got " + samplesPerLoop);
        }
        this.loops = loops;
        this.samplesPerLoop = samplesPerLoop;
    }

    public int loops() {
        return loops;
    }

    public int samplesPerLoop() {
        return samplesPerLoop;
    }

    /// Runs the remaining loops.
    ///
    /// @param loopsCompleted loops already finished by an earlier run
    /// @return the number of loops completed when the schedule ends
    public int run(EnsembleSampler sampler, int loopsCompleted, SamplerObserver observer)
        throws InterruptedException, IOException {
        if (loopsCompleted < 0 || loopsCompleted > loops) {
            throw new IllegalArgumentException(
                "completed loop count " + loopsCompleted + " is outside 0.." + loops);
        }
        if (loopsCompleted == loops) {
            logger.info("All {} loops already complete", loops);
            return loops;
        }
        for (int loop = loopsCompleted; loop < loops; loop++) {
            long started = System.nanoTime();
            for (int s = 0; s < samplesPerLoop; s++) {
                sampler.iterate();
                observer.onIteration(loop, sampler.iterations(), sampler.walkers());
            }
            observer.onLoopComplete(loop, sampler);
            logger.info("Loop {}/{} done: {} iterations, acceptance {}, {} s",
                loop + 1, loops, sampler.iterations(),
                String.format("%.3f", sampler.acceptanceFraction()),
                String.format("%.1f", (System.nanoTime() - started) / 1e9));
        }
        return loops;
    }
}
