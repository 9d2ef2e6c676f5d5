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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.diskjockey.core.json.DiskJockeyGsonConfig;
import io.diskjockey.sampler.EnsembleSampler;
import io.diskjockey.sampler.random.RandomGenerators;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/// Saves and loads sampler checkpoints.
///
/// ## Atomic Writes
///
/// ```text
///   1. Serialize the state without a checksum, hash it (SHA-256)
///   2. Write the state with its checksum to pos0.json.tmp
///   3. Rename the temp file over pos0.json (atomic on POSIX)
/// ```
///
/// An interrupted save leaves the previous checkpoint intact, so a run that
/// dies mid-loop resumes from the last completed loop.
///
/// @see CheckpointState
public final class CheckpointManager {

    /// Checkpoint file name inside a run directory.
    public static final String CHECKPOINT_FILE = "pos0.json";

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private CheckpointManager() {
    }

    /// Captures a sampler at a loop boundary without naming its coordinates.
    public static CheckpointState capture(EnsembleSampler sampler, int loopsCompleted) {
        return capture(sampler, loopsCompleted, null, null);
    }

    /// Captures a sampler at a loop boundary.
    ///
    /// @param model the model kind tag, or `null`
    /// @param parameterNames the ordered free-parameter names, or `null`
    public static CheckpointState capture(EnsembleSampler sampler, int loopsCompleted, String model,
                                          List<String> parameterNames) {
        return new CheckpointState.Builder()
            .model(model)
            .parameterNames(parameterNames)
            .walkerPositions(sampler.positions())
            .lnProbabilities(sampler.lnProbabilities())
            .loopsCompleted(loopsCompleted)
            .iterationsCompleted(sampler.iterations())
            .proposed(sampler.proposed())
            .accepted(sampler.accepted())
            .rngState(RandomGenerators.saveState(sampler.rng()))
            .build();
    }

    /// Puts a sampler back into a checkpointed state, generator included.
    public static void restore(EnsembleSampler sampler, CheckpointState state) throws CheckpointException {
        try {
            sampler.restore(state.walkerPositions(), state.lnProbabilities(), state.iterationsCompleted(),
                state.proposed(), state.accepted());
            if (state.rngState() != null) {
                RandomGenerators.restoreState(sampler.rng(), state.rngState());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new CheckpointException("Checkpoint does not fit this sampler: " + e.getMessage(), e);
        }
    }

    /// Saves checkpoint state to a file atomically.
    ///
    /// @throws IOException if writing fails
    public static void save(Path path, CheckpointState state) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(state, "state cannot be null");

        Gson gson = DiskJockeyGsonConfig.gson();
        String checksum = computeChecksum(gson.toJson(state.toBuilder().checksum(null).build()));
        String finalJson = gson.toJson(state.toBuilder().checksum(checksum).build());

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(finalJson);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /// Loads and verifies a checkpoint.
    ///
    /// @throws CheckpointException if the file is missing, unparseable, of
    ///     another version, fails its checksum, or has inconsistent shapes
    public static CheckpointState load(Path path) throws IOException, CheckpointException {
        return load(path, true);
    }

    /// Loads a checkpoint with optional checksum verification.
    public static CheckpointState load(Path path, boolean verifyChecksum) throws IOException, CheckpointException {
        Objects.requireNonNull(path, "path cannot be null");

        if (!Files.exists(path)) {
            throw new CheckpointException("Checkpoint file not found: " + path);
        }
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);

        CheckpointState state;
        try {
            state = DiskJockeyGsonConfig.gson().fromJson(json, CheckpointState.class);
        } catch (JsonParseException e) {
            throw new CheckpointException("Invalid checkpoint JSON in " + path + ": " + e.getMessage(), e);
        }
        if (state == null) {
            throw new CheckpointException("Checkpoint file is empty: " + path);
        }
        if (state.version() != CheckpointState.CURRENT_VERSION) {
            throw new CheckpointException(
                "Unsupported checkpoint version: " + state.version() +
                " (expected: " + CheckpointState.CURRENT_VERSION + ")");
        }
        validateShape(state);

        if (verifyChecksum && state.checksum() != null) {
            String expected = computeChecksum(
                DiskJockeyGsonConfig.gson().toJson(state.toBuilder().checksum(null).build()));
            if (!expected.equals(state.checksum())) {
                throw new CheckpointException(
                    "Checkpoint checksum mismatch: expected " + expected + " but found " + state.checksum());
            }
        }
        return state;
    }

    private static void validateShape(CheckpointState state) throws CheckpointException {
        double[][] positions = state.positions();
        if (positions == null || positions.length == 0) {
            throw new CheckpointException("Checkpoint has no positions");
        }
        if (positions.length != state.dimensions()) {
            throw new CheckpointException(
                "Checkpoint declares ndim " + state.dimensions() + " but has " + positions.length + " rows");
        }
        for (double[] row : positions) {
            if (row == null || row.length != state.walkers()) {
                throw new CheckpointException(
                    "Checkpoint declares " + state.walkers() + " walkers but a position row differs");
            }
        }
        if (state.parameterNames() != null && state.parameterNames().size() != state.dimensions()) {
            throw new CheckpointException(
                "Checkpoint names " + state.parameterNames().size() + " parameters for ndim " + state.dimensions());
        }
        if (state.lnProbabilities() == null) {
            throw new CheckpointException("Checkpoint has no log-probabilities");
        }
        if (state.lnProbabilities().length != state.walkers()) {
            throw new CheckpointException(
                "Checkpoint has " + state.lnProbabilities().length + " log-probabilities for "
                    + state.walkers() + " walkers");
        }
    }

    private static String computeChecksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Thrown when a checkpoint cannot be loaded or does not fit the run.
    public static class CheckpointException extends Exception {
        public CheckpointException(String message) {
            super(message);
        }

        public CheckpointException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
