package io.diskjockey.core.gridding;

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
import io.diskjockey.core.image.SkyImage;
import io.diskjockey.core.visibility.ModelVisibilities;
import io.diskjockey.core.visibility.VisibilityChannel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class FourierTransformTest {

    private static final double DL = 0.25 * PhysicalConstants.ARCSEC;

    private static SkyImage image(int n, double[][] pixels) {
        double[] axis = new double[n];
        for (int i = 0; i < n; i++) {
            axis[i] = (i - n / 2) * 0.25;
        }
        return new SkyImage(new double[][][]{pixels}, axis, axis.clone(), new double[]{1300.0}, DL, DL);
    }

    @Test
    void centeredPointSourceHasFlatRealSpectrum() {
        int n = 16;
        double[][] pixels = new double[n][n];
        pixels[n / 2][n / 2] = 3.0;

        FourierGrid grid = FourierTransform.transform(image(n, pixels), 0);

        double expected = 3.0 * DL * DL;
        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                assertEquals(expected, grid.re()[j][i], expected * 1e-12);
                assertEquals(0.0, grid.im()[j][i], expected * 1e-12);
            }
        }
    }

    @Test
    void transformIsBitReproducible() {
        int n = 32;
        double[][] pixels = new double[n][n];
        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                pixels[j][i] = Math.exp(-((i - 14.3) * (i - 14.3) + (j - 17.9) * (j - 17.9)) / 20.0);
            }
        }
        FourierGrid first = FourierTransform.transform(image(n, pixels), 0);
        FourierGrid second = FourierTransform.transform(image(n, pixels), 0);

        assertThat(second.re()).isDeepEqualTo(first.re());
        assertThat(second.im()).isDeepEqualTo(first.im());
    }

    @Test
    void frequencyAxisIsCenteredInKiloLambda() {
        double[] f = FourierGrid.shiftedFrequencies(8, DL);
        double step = 1.0 / (8 * DL) * 1e-3;
        assertEquals(-4 * step, f[0], step * 1e-12);
        assertEquals(0.0, f[4], 0.0);
        assertEquals(3 * step, f[7], step * 1e-12);
    }

    @Test
    void nonPowerOfTwoImageIsRejected() {
        assertThatThrownBy(() -> FourierTransform.transform(image(12, new double[12][12]), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constantGridInterpolatesToConstant() {
        int n = 32;
        double[] axis = FourierGrid.shiftedFrequencies(n, DL);
        double[][] re = new double[n][n];
        double[][] im = new double[n][n];
        for (double[] row : re) {
            Arrays.fill(row, 2.5);
        }
        for (double[] row : im) {
            Arrays.fill(row, -1.0);
        }
        VisibilityChannel channel = new VisibilityChannel(1300.0, new double[]{0.0, 37.2, -101.9},
            new double[]{0.0, -12.5, 88.0}, new double[3], new double[3], new double[]{1, 1, 1});

        InterpolationPlan plan = InterpolationPlan.plan(channel, axis, axis);
        ModelVisibilities model = plan.interpolate(new FourierGrid(re, im, axis, axis));

        assertThat(plan.size()).isEqualTo(3);
        for (int k = 0; k < 3; k++) {
            assertEquals(2.5, model.re(k), 1e-12);
            assertEquals(-1.0, model.im(k), 1e-12);
        }
    }

    @Test
    void samplesOutsideGridAreRejected() {
        double[] axis = FourierGrid.shiftedFrequencies(16, DL);
        double edge = axis[axis.length - 1];
        VisibilityChannel channel = new VisibilityChannel(1300.0, new double[]{edge}, new double[]{0.0},
            new double[1], new double[1], new double[]{1});
        assertThatThrownBy(() -> InterpolationPlan.plan(channel, axis, axis))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("npix");
    }

    @Test
    void spheroidIsNormalizedAndSymmetric() {
        assertEquals(1.0, Spheroidal.corrfun(0.0), 1e-3);
        assertEquals(Spheroidal.gcffun(0.4), Spheroidal.gcffun(-0.4), 0.0);
        assertEquals(0.0, Spheroidal.gcffun(1.0), 1e-12);
        assertEquals(0.0, Spheroidal.spheroid(1.2), 0.0);
        assertThat(Spheroidal.corrfun(0.9)).isLessThan(Spheroidal.corrfun(0.1));
    }

    @Test
    void griddingCorrectionZeroesOutsideFieldAndBoostsEdges() {
        int n = 8;
        double[][] pixels = new double[n][n];
        for (double[] row : pixels) {
            Arrays.fill(row, 1.0);
        }
        SkyImage sky = image(n, pixels);
        GriddingCorrection.apply(sky);

        double center = sky.data()[0][n / 2][n / 2];
        assertEquals(1.0 / (Spheroidal.corrfun(0.0) * Spheroidal.corrfun(0.0)), center, 1e-12);
        assertThat(sky.data()[0][n / 2][1]).isGreaterThan(center);
    }
}
