package io.diskjockey.run;

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

import io.diskjockey.config.ConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RunDirectoryTest {

    @Test
    void formatsTwoDigitIndex(@TempDir Path home) {
        assertThat(RunDirectory.pathFor(home, "output/", 3)).isEqualTo(home.resolve("output/run03"));
        assertThat(RunDirectory.pathFor(home, "fit_", 12)).isEqualTo(home.resolve("fit_run12"));
    }

    @Test
    void takesFirstUnusedIndex(@TempDir Path home) throws Exception {
        Path config = Files.writeString(home.resolve("config.yaml"), "out_base: output/\n");
        Files.createDirectories(home.resolve("output/run00"));
        Files.createDirectories(home.resolve("output/run01"));

        RunDirectory dir = RunDirectory.prepare(home, "output/", null, config);

        assertThat(dir.index()).isEqualTo(2);
        assertThat(dir.resumed()).isFalse();
        assertThat(dir.path()).isDirectory();
        assertThat(dir.resolve("config.yaml")).hasContent("out_base: output/");
    }

    @Test
    void existingRequestedIndexIsResumed(@TempDir Path home) throws Exception {
        Path existing = Files.createDirectories(home.resolve("output/run04"));
        Files.writeString(existing.resolve("marker"), "kept");

        RunDirectory dir = RunDirectory.prepare(home, "output/", 4, null);

        assertThat(dir.resumed()).isTrue();
        assertThat(dir.path()).isEqualTo(existing);
        assertThat(existing.resolve("marker")).hasContent("kept");
    }

    @Test
    void missingRequestedIndexIsCreatedFresh(@TempDir Path home) throws Exception {
        RunDirectory dir = RunDirectory.prepare(home, "output/", 7, null);

        assertThat(dir.resumed()).isFalse();
        assertThat(dir.index()).isEqualTo(7);
        assertThat(home.resolve("output/run07")).isDirectory();
    }

    @Test
    void negativeIndexIsRejected(@TempDir Path home) {
        assertThatThrownBy(() -> RunDirectory.prepare(home, "output/", -1, null))
            .isInstanceOf(ConfigurationException.class);
    }
}
