package io.diskjockey.core.velocity;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class VelocityMapperTest {

    private static final double LAM0 = PhysicalConstants.restWavelength("12CO", "2-1");

    @Test
    void tenChannelsWithCentralExclusion() {
        double[] vels = new double[10];
        for (int i = 0; i < vels.length; i++) {
            vels[i] = -4.5 + i;
        }
        boolean[] mask = VelocityMapper.channelMask(List.of(new VelocityRange(-1.0, 1.0)), vels);
        assertArrayEquals(new boolean[]{true, true, true, true, false, false, true, true, true, true}, mask);
    }

    @Test
    void rangeEndpointsAreExcluded() {
        double[] vels = {-1.0, Math.nextDown(-1.0), 1.0, Math.nextUp(1.0), 0.0};
        boolean[] mask = VelocityMapper.channelMask(List.of(new VelocityRange(-1.0, 1.0)), vels);
        assertArrayEquals(new boolean[]{false, true, false, true, false}, mask);
    }

    @Test
    void noExclusionKeepsEveryChannel() {
        double[] vels = {-3.0, 0.0, 3.0};
        assertArrayEquals(new boolean[]{true, true, true}, VelocityMapper.channelMask(null, vels));
        assertArrayEquals(new boolean[]{true, true, true}, VelocityMapper.channelMask(List.of(), vels));
    }

    @Test
    void anyMatchingRangeExcludes() {
        double[] vels = {-6.0, -4.0, 0.0, 4.0, 6.0};
        boolean[] mask = VelocityMapper.channelMask(
            List.of(new VelocityRange(-5.0, -3.0), new VelocityRange(3.0, 5.0)), vels);
        assertArrayEquals(new boolean[]{true, false, true, false, true}, mask);
    }

    @Test
    void invertedRangeIsRejected() {
        assertThatThrownBy(() -> new VelocityRange(2.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-30.0, -1.0, 0.0, 0.25, 12.0})
    void velocityAndWavelengthAreInverse(double v) {
        double[] lams = VelocityMapper.wavelengths(LAM0, new double[]{v});
        double[] back = VelocityMapper.velocities(LAM0, lams);
        assertEquals(v, back[0], 1e-9);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-20.0, -2.0, 3.5, 15.0})
    void relativisticShiftMatchesFirstOrder(double vSys) {
        double beta = vSys / PhysicalConstants.C_KMS;
        double shifted = VelocityMapper.dopplerShift(vSys, new double[]{LAM0})[0];
        assertEquals(LAM0 * (1.0 - beta), shifted, LAM0 * beta * beta);
        assertThat(VelocityMapper.dopplerShift(0.0, new double[]{LAM0})[0]).isEqualTo(LAM0);
    }

    @Test
    void shiftByOppositeVelocityRestoresWavelength() {
        double[] lams = {LAM0 * 0.9999, LAM0, LAM0 * 1.0001};
        double[] roundTrip = VelocityMapper.dopplerShift(-7.0, VelocityMapper.dopplerShift(7.0, lams));
        assertArrayEquals(lams, roundTrip, 1e-9);
    }
}
