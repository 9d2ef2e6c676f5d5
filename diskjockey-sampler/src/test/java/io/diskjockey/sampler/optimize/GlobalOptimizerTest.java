package io.diskjockey.sampler.optimize;

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
import io.diskjockey.sampler.LogPosterior;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class GlobalOptimizerTest {

    private static final LogPosterior BOWL = x -> EvaluationResult.ok(
        -0.5 * ((x[0] - 1.5) * (x[0] - 1.5) / 0.25 + (x[1] + 2.0) * (x[1] + 2.0)));

    private static final List<String> NAMES = List.of("M_star", "r_c");

    @Test
    void findsGaussianPeak() {
        GlobalOptimizer optimizer = new GlobalOptimizer(BOWL, NAMES,
            new double[]{-5.0, -5.0}, new double[]{5.0, 5.0}, 5000, 17L);
        OptimizationResult result = optimizer.optimize(new double[]{-3.0, 3.0});

        assertThat(result.position()[0]).isCloseTo(1.5, within(1e-3));
        assertThat(result.position()[1]).isCloseTo(-2.0, within(1e-3));
        assertThat(result.lnProbability()).isCloseTo(0.0, within(1e-5));
        assertThat(result.evaluations()).isPositive().isLessThanOrEqualTo(5000);
        assertThat(result.names()).isEqualTo(NAMES);
    }

    @Test
    void rejectedRegionIsAvoided() {
        LogPosterior halfPlane = x -> x[0] > 1.0
            ? EvaluationResult.rejected("M_star too large")
            : BOWL.evaluate(x);
        GlobalOptimizer optimizer = new GlobalOptimizer(halfPlane, NAMES,
            new double[]{-5.0, -5.0}, new double[]{5.0, 5.0}, 5000, 3L);
        OptimizationResult result = optimizer.optimize(new double[]{0.0, 0.0});

        assertThat(result.position()[0]).isLessThanOrEqualTo(1.0).isGreaterThan(0.9);
        assertThat(result.lnProbability()).isFinite();
    }

    @Test
    void exhaustedBudgetReturnsBestSoFar() {
        GlobalOptimizer optimizer = new GlobalOptimizer(BOWL, NAMES,
            new double[]{-5.0, -5.0}, new double[]{5.0, 5.0}, 20, 1L);
        OptimizationResult result = optimizer.optimize(new double[]{4.0, 4.0});

        assertThat(result.converged()).isFalse();
        assertThat(result.evaluations()).isLessThanOrEqualTo(20);
        assertThat(result.lnProbability()).isFinite();
    }

    @Test
    void fatalEvaluationStopsTheSearch() {
        LogPosterior failing = x -> EvaluationResult.fatal(new IOException("simulator missing"));
        GlobalOptimizer optimizer = new GlobalOptimizer(failing, NAMES,
            new double[]{-1.0, -1.0}, new double[]{1.0, 1.0}, 100, 1L);

        assertThatThrownBy(() -> optimizer.optimize(new double[]{0.0, 0.0}))
            .isInstanceOf(FatalEvaluationException.class)
            .hasMessageContaining("simulator missing");
    }

    @Test
    void boundsAreValidated() {
        assertThatThrownBy(() -> new GlobalOptimizer(BOWL, NAMES, new double[]{1.0, 0.0},
            new double[]{1.0, 1.0}, 10, 1L))
            .hasMessageContaining("M_star");
        assertThatThrownBy(() -> new GlobalOptimizer(BOWL, NAMES, new double[]{0.0},
            new double[]{1.0}, 10, 1L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultIsWrittenAsJson(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve(GlobalOptimizer.RESULT_FILE);
        GlobalOptimizer.write(file, new OptimizationResult(NAMES, new double[]{1.0, 2.0}, -4.5, 12, true));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(json).contains("\"names\"").contains("\"M_star\"").contains("\"lnprob\": -4.5")
            .contains("\"evaluations\": 12");
    }
}
