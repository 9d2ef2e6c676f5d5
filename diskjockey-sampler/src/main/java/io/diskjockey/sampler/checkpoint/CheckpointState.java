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

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.List;

/// Sampler state at a loop boundary.
///
/// ## JSON Schema
///
/// ```json
/// {
///   "version": 1,
///   "timestamp": "2026-01-07T10:30:00Z",
///   "checksum": "sha256:abc123...",
///   "model": "standard",
///   "parameter_names": ["incl", "PA", ...6 names...],
///   "ndim": 6,
///   "nwalkers": 24,
///   "loops_completed": 3,
///   "iterations_completed": 300,
///   "proposed": 7200,
///   "accepted": 2450,
///   "positions": [[...24 values...], ...6 rows...],
///   "lnprob": [...24 values...],
///   "rng_state": "base64..."
/// }
/// ```
///
/// `positions` holds one column per walker: `positions[d][k]` is coordinate
/// `d` of walker `k`, and `parameter_names[d]` names that coordinate.
///
/// @see CheckpointManager
public final class CheckpointState {

    /// Current checkpoint format version.
    public static final int CURRENT_VERSION = 1;

    @SerializedName("version")
    private final int version;

    @SerializedName("timestamp")
    private final String timestamp;

    @SerializedName("checksum")
    private final String checksum;

    @SerializedName("model")
    private final String model;

    @SerializedName("parameter_names")
    private final List<String> parameterNames;

    @SerializedName("ndim")
    private final int dimensions;

    @SerializedName("nwalkers")
    private final int walkers;

    @SerializedName("loops_completed")
    private final int loopsCompleted;

    @SerializedName("iterations_completed")
    private final long iterationsCompleted;

    @SerializedName("proposed")
    private final long proposed;

    @SerializedName("accepted")
    private final long accepted;

    @SerializedName("positions")
    private final double[][] positions;

    @SerializedName("lnprob")
    private final double[] lnProbabilities;

    @SerializedName("rng_state")
    private final String rngState;

    private CheckpointState(Builder builder) {
        this.version = CURRENT_VERSION;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now().toString();
        this.checksum = builder.checksum;
        this.model = builder.model;
        this.parameterNames = builder.parameterNames;
        this.positions = builder.positions;
        this.dimensions = builder.positions != null ? builder.positions.length : 0;
        this.walkers = builder.positions != null && builder.positions.length > 0 ? builder.positions[0].length : 0;
        this.loopsCompleted = builder.loopsCompleted;
        this.iterationsCompleted = builder.iterationsCompleted;
        this.proposed = builder.proposed;
        this.accepted = builder.accepted;
        this.lnProbabilities = builder.lnProbabilities;
        this.rngState = builder.rngState;
    }

    public int version() {
        return version;
    }

    public String timestamp() {
        return timestamp;
    }

    public String checksum() {
        return checksum;
    }

    /// Model kind tag the positions were sampled under, `null` if none was recorded.
    public String model() {
        return model;
    }

    /// Ordered free-parameter names, one per coordinate; `null` if none were recorded.
    public List<String> parameterNames() {
        return parameterNames;
    }

    public int dimensions() {
        return dimensions;
    }

    public int walkers() {
        return walkers;
    }

    public int loopsCompleted() {
        return loopsCompleted;
    }

    public long iterationsCompleted() {
        return iterationsCompleted;
    }

    public long proposed() {
        return proposed;
    }

    public long accepted() {
        return accepted;
    }

    /// Positions with one column per walker, as stored.
    public double[][] positions() {
        return positions;
    }

    /// Positions with one row per walker, as the sampler takes them.
    public double[][] walkerPositions() {
        return transpose(positions);
    }

    public double[] lnProbabilities() {
        return lnProbabilities;
    }

    /// Base64 generator state, `null` if none was recorded.
    public String rngState() {
        return rngState;
    }

    /// A builder holding every field of this state.
    public Builder toBuilder() {
        return new Builder()
            .timestamp(timestamp)
            .checksum(checksum)
            .model(model)
            .parameterNames(parameterNames)
            .positions(positions)
            .loopsCompleted(loopsCompleted)
            .iterationsCompleted(iterationsCompleted)
            .proposed(proposed)
            .accepted(accepted)
            .lnProbabilities(lnProbabilities)
            .rngState(rngState);
    }

    static double[][] transpose(double[][] m) {
        if (m == null || m.length == 0) {
            return new double[0][0];
        }
        double[][] t = new double[m[0].length][m.length];
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m[i].length; j++) {
                t[j][i] = m[i][j];
            }
        }
        return t;
    }

    @Override
    public String toString() {
        return String.format("CheckpointState[model=%s, loops=%d, iterations=%d, ndim=%d, nwalkers=%d]",
            model, loopsCompleted, iterationsCompleted, dimensions, walkers);
    }

    /// Builder for creating CheckpointState instances.
    public static final class Builder {
        private String timestamp;
        private String checksum;
        private String model;
        private List<String> parameterNames;
        private double[][] positions;
        private int loopsCompleted;
        private long iterationsCompleted;
        private long proposed;
        private long accepted;
        private double[] lnProbabilities;
        private String rngState;

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder parameterNames(List<String> parameterNames) {
            this.parameterNames = parameterNames == null ? null : List.copyOf(parameterNames);
            return this;
        }

        /// Sets positions with one column per walker.
        public Builder positions(double[][] positions) {
            this.positions = positions;
            return this;
        }

        /// Sets positions from one row per walker.
        public Builder walkerPositions(double[][] rows) {
            this.positions = transpose(rows);
            return this;
        }

        public Builder loopsCompleted(int loopsCompleted) {
            if (loopsCompleted < 0) {
                throw new IllegalArgumentException("loopsCompleted must be non-negative");
            }
            this.loopsCompleted = loopsCompleted;
            return this;
        }

        public Builder iterationsCompleted(long iterationsCompleted) {
            if (iterationsCompleted < 0) {
                throw new IllegalArgumentException("iterationsCompleted must be non-negative");
            }
            this.iterationsCompleted = iterationsCompleted;
            return this;
        }

        public Builder proposed(long proposed) {
            this.proposed = proposed;
            return this;
        }

        public Builder accepted(long accepted) {
            this.accepted = accepted;
            return this;
        }

        public Builder lnProbabilities(double[] lnProbabilities) {
            this.lnProbabilities = lnProbabilities;
            return this;
        }

        public Builder rngState(String rngState) {
            this.rngState = rngState;
            return this;
        }

        public CheckpointState build() {
            if (positions == null || positions.length == 0) {
                throw new IllegalStateException("positions must be set");
            }
            return new CheckpointState(this);
        }
    }
}
