package io.diskjockey.sampler.random;

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

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Base64;

/// Seeded, restorable random generators for the sampler and optimizer.
///
/// All draws of a run come from one generator owned by the controlling
/// thread. Its state is stored in every checkpoint as base64 text so that a
/// resumed run continues the same stream.
public final class RandomGenerators {

    /// Supported generator algorithms.
    public enum Algorithm {
        /// 256-bit state, period 2^256 - 1. The default.
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /// 128-bit state, period 2^128 - 1.
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
        /// Mersenne Twister, 19937-bit state.
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /// Creates a generator of the given algorithm from a fixed seed.
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /// Creates the default generator from a fixed seed.
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /// Creates the default generator from a random seed.
    public static RestorableUniformRandomProvider create() {
        return (RestorableUniformRandomProvider) Algorithm.XO_SHI_RO_256_PP.getSource().create();
    }

    /// Encodes the generator's current state as base64 text.
    public static String saveState(RestorableUniformRandomProvider rng) {
        RandomProviderState state = rng.saveState();
        return Base64.getEncoder().encodeToString(((RandomProviderDefaultState) state).getState());
    }

    /// Restores a state produced by [#saveState(RestorableUniformRandomProvider)].
    ///
    /// @throws IllegalArgumentException if the text is not valid base64
    /// @throws IllegalStateException if the state size does not match the generator
    public static void restoreState(RestorableUniformRandomProvider rng, String encoded) {
        byte[] bytes = Base64.getDecoder().decode(encoded);
        rng.restoreState(new RandomProviderDefaultState(bytes));
    }
}
