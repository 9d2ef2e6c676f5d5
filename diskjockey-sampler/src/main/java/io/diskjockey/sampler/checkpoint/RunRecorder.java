package io.diskjockey.sampler.checkpoint;

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

import io.diskjockey.sampler.EnsembleSampler;
import io.diskjockey.sampler.SamplerObserver;
import io.diskjockey.sampler.WalkerState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Persists a sampling run: every iteration goes to the chain file, and each
/// completed loop flushes the chain and then replaces the checkpoint.
public final class RunRecorder implements SamplerObserver {

    private static final Logger logger = LogManager.getLogger(RunRecorder.class);

    private final ChainWriter chain;
    private final Path checkpoint;
    private final String model;
    private final List<String> parameterNames;

    public RunRecorder(ChainWriter chain, Path checkpoint) {
        this(chain, checkpoint, null, null);
    }

    /// @param model model kind tag stored in each checkpoint
    /// @param parameterNames ordered free-parameter names stored in each checkpoint
    public RunRecorder(ChainWriter chain, Path checkpoint, String model, List<String> parameterNames) {
        this.chain = chain;
        this.checkpoint = checkpoint;
        this.model = model;
        this.parameterNames = parameterNames;
    }

    @Override
    public void onIteration(int loop, long iteration, List<WalkerState> walkers) throws IOException {
        chain.appendAll(loop, iteration, walkers);
    }

    @Override
    public void onLoopComplete(int loop, EnsembleSampler sampler) throws IOException {
        chain.flush();
        CheckpointManager.save(checkpoint, CheckpointManager.capture(sampler, loop + 1, model, parameterNames));
        logger.debug("Checkpoint for loop {} written to {}", loop + 1, checkpoint);
    }
}
