package io.diskjockey.command;

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

import picocli.CommandLine;

/// The `-s/--seed` option shared by commands that draw random numbers.
///
/// Precedence is command line, then the configuration's `seed`, then the
/// clock.
public class RandomSeedOption {

    /// A seed as given on the command line; `value` is `null` when absent.
    public record Seed(Long value) {

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "unset";
        }
    }

    /// Parses `--seed` values, rejecting anything that is not a long.
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.isBlank()) {
                return new Seed(null);
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for the sampler or optimizer (default: config seed, else current time)",
        converter = SeedConverter.class
    )
    private Seed seed;

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    /// Picks the effective seed.
    ///
    /// @param configured the configuration's seed, may be `null`
    public long resolve(Long configured) {
        if (isSeedSpecified()) {
            return seed.value();
        }
        if (configured != null) {
            return configured;
        }
        return System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return seed != null ? seed.toString() : "unset";
    }
}
