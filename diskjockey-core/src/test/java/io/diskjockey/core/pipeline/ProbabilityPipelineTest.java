package io.diskjockey.core.pipeline;

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

import io.diskjockey.core.constants.PhysicalConstants;
import io.diskjockey.core.model.DiskParameters;
import io.diskjockey.core.model.GeometricPrior;
import io.diskjockey.core.visibility.VisibilityDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ProbabilityPipelineTest {

    @TempDir
    Path tempDir;

    private Path home;
    private Path scratch;

    @BeforeEach
    void setUp() throws IOException {
        home = PipelineFixtures.home(tempDir.resolve("home"));
        scratch = Files.createDirectories(tempDir.resolve("scratch"));
    }

    private ProbabilityPipeline pipeline(FakeSimulator simulator, VisibilityDataset data) {
        return new ProbabilityPipeline(PipelineFixtures.context(home, scratch, simulator, data));
    }

    private void assertNoWorkspacesLeft() throws IOException {
        try (Stream<Path> entries = Files.list(scratch)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void modelGeneratedDataScoresAsPriorAlone() throws Exception {
        ProbabilityPipeline template = pipeline(new FakeSimulator(), PipelineFixtures.emptyData());
        DiskParameters truth = PipelineFixtures.converter().convert(PipelineFixtures.truth());
        VisibilityDataset synthetic = template.synthesize(truth);
        assertThat(synthetic.size()).isEqualTo(2);

        ProbabilityPipeline pipeline = pipeline(new FakeSimulator(), synthetic);
        EvaluationResult result = pipeline.evaluate(PipelineFixtures.truth());

        double lnPrior = new GeometricPrior().lnPrior(truth, PipelineFixtures.GRID);
        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.OK);
        assertEquals(lnPrior, result.lnProbability(), 1e-9);
        assertNoWorkspacesLeft();
    }

    @Test
    void mismatchedModelScoresBelowTruth() throws Exception {
        ProbabilityPipeline template = pipeline(new FakeSimulator(), PipelineFixtures.emptyData());
        VisibilityDataset synthetic = template.synthesize(
            PipelineFixtures.converter().convert(PipelineFixtures.truth()));
        ProbabilityPipeline pipeline = pipeline(new FakeSimulator(), synthetic);

        double[] off = PipelineFixtures.truth();
        off[2] = 70.0; // incl
        assertThat(pipeline.lnProbability(off)).isLessThan(pipeline.lnProbability(PipelineFixtures.truth()));
    }

    @Test
    void stagesInputsAndShiftsCameraWavelengths() throws Exception {
        FakeSimulator simulator = new FakeSimulator();
        ProbabilityPipeline pipeline = pipeline(simulator, PipelineFixtures.emptyData());
        assertThat(pipeline.evaluate(PipelineFixtures.truth()).outcome()).isEqualTo(EvaluationResult.Outcome.OK);

        assertThat(simulator.calls()).hasSize(1);
        assertThat(simulator.calls().get(0).npix()).isEqualTo(PipelineFixtures.NPIX);
        assertThat(simulator.calls().get(0).incl()).isEqualTo(40.0);
        assertThat(simulator.calls().get(0).posang()).isEqualTo(30.0);
        double desired = PipelineFixtures.SIZE_ARCSEC * 140.0;
        assertThat(simulator.calls().get(0).sizeAu())
            .isCloseTo(desired * (1.0 - PhysicalConstants.RADMC_SIZEAU_SHIFT), offset(1e-9));
        assertThat(simulator.workspaces().get(0)).doesNotExist();
        assertNoWorkspacesLeft();
    }

    @Test
    void modelExceptionRejectsAndCleansUp() throws IOException {
        FakeSimulator simulator = new FakeSimulator();
        ProbabilityPipeline pipeline = pipeline(simulator, PipelineFixtures.emptyData());
        double[] vector = PipelineFixtures.truth();
        vector[1] = -5.0; // r_c

        EvaluationResult result = pipeline.evaluate(vector);

        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.REJECTED);
        assertThat(result.lnProbability()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(result.reason()).contains("r_c");
        assertThat(simulator.calls()).isEmpty();
        assertNoWorkspacesLeft();
    }

    @Test
    void unreadableImageRejectsAndCleansUp() throws IOException {
        for (FakeSimulator.Mode mode : new FakeSimulator.Mode[]{FakeSimulator.Mode.TRUNCATED_IMAGE, FakeSimulator.Mode.NO_IMAGE}) {
            FakeSimulator simulator = new FakeSimulator(mode);
            EvaluationResult result = pipeline(simulator, PipelineFixtures.emptyData()).evaluate(PipelineFixtures.truth());

            assertThat(result.outcome()).as(mode.name()).isEqualTo(EvaluationResult.Outcome.REJECTED);
            assertThat(result.lnProbability()).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(simulator.workspaces()).hasSize(1);
            assertThat(simulator.workspaces().get(0)).doesNotExist();
        }
        assertNoWorkspacesLeft();
    }

    @Test
    void simulatorFailureIsFatalAfterCleanup() throws IOException {
        FakeSimulator simulator = new FakeSimulator(FakeSimulator.Mode.CRASH);
        ProbabilityPipeline pipeline = pipeline(simulator, PipelineFixtures.emptyData());

        EvaluationResult result = pipeline.evaluate(PipelineFixtures.truth());
        assertThat(result.isFatal()).isTrue();
        assertThat(result.cause()).hasMessageContaining("segmentation fault");
        assertThat(simulator.workspaces().get(0)).doesNotExist();

        assertThatThrownBy(() -> pipeline.lnProbability(PipelineFixtures.truth()))
            .isInstanceOf(FatalEvaluationException.class)
            .satisfies(e -> assertThat(((FatalEvaluationException) e).vector()).containsExactly(PipelineFixtures.truth()));
        assertNoWorkspacesLeft();
    }

    @Test
    void missingStaticFileIsFatal() throws IOException {
        Files.delete(home.resolve("lines.inp"));
        FakeSimulator simulator = new FakeSimulator();
        EvaluationResult result = pipeline(simulator, PipelineFixtures.emptyData()).evaluate(PipelineFixtures.truth());

        assertThat(result.isFatal()).isTrue();
        assertThat(simulator.calls()).isEmpty();
        assertNoWorkspacesLeft();
    }

    @Test
    void zeroPriorDensityRejectsWithoutSimulating() throws IOException {
        FakeSimulator simulator = new FakeSimulator();
        double[] faceOn = PipelineFixtures.truth();
        faceOn[2] = 0.0; // incl: sin(0) = 0

        EvaluationResult result = pipeline(simulator, PipelineFixtures.emptyData()).evaluate(faceOn);

        assertThat(result.outcome()).isEqualTo(EvaluationResult.Outcome.REJECTED);
        assertThat(simulator.calls()).isEmpty();
        assertNoWorkspacesLeft();
    }

    static Stream<double[]> pathologicalVectors() {
        double[] t = PipelineFixtures.truth();
        return Stream.of(
            new double[]{0.0, t[1], t[2], t[3], t[4], t[5]},
            new double[]{t[0], -10.0, t[2], t[3], t[4], t[5]},
            new double[]{t[0], 1e6, t[2], t[3], t[4], t[5]},
            new double[]{t[0], t[1], 200.0, t[3], t[4], t[5]},
            new double[]{Double.NaN, t[1], t[2], t[3], t[4], t[5]},
            new double[]{t[0], Double.POSITIVE_INFINITY, t[2], t[3], t[4], t[5]},
            new double[]{1e-300, t[1], t[2], t[3], t[4], t[5]},
            new double[]{t[0], t[1]},
            new double[0]);
    }

    @ParameterizedTest
    @MethodSource("pathologicalVectors")
    void neverReturnsNaN(double[] vector) throws IOException {
        double lnp = pipeline(new FakeSimulator(), PipelineFixtures.emptyData()).lnProbability(vector);
        assertThat(Double.isNaN(lnp)).isFalse();
        assertThat(Double.isFinite(lnp) || lnp == Double.NEGATIVE_INFINITY).isTrue();
        assertNoWorkspacesLeft();
    }
}
