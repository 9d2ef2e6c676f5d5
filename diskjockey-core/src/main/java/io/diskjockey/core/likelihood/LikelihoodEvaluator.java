package io.diskjockey.core.likelihood;

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
import io.diskjockey.core.gridding.FourierGrid;
import io.diskjockey.core.gridding.FourierTransform;
import io.diskjockey.core.gridding.InterpolationPlan;
import io.diskjockey.core.image.SkyImage;
import io.diskjockey.core.visibility.ModelVisibilities;
import io.diskjockey.core.visibility.VisibilityChannel;
import io.diskjockey.core.visibility.VisibilityDataset;

import java.util.ArrayList;
import java.util.List;

/// Scores a gridding-corrected sky image against the observed channels.
///
/// Built once per run: the field of view and pixel count fix the Fourier grid
/// axes, so each channel's [InterpolationPlan] is computed here and shared
/// read-only by every evaluation. Per image and channel:
///
/// ```text
///   image ──FFT──▶ grid ──plan──▶ model vis ──phase shift (μ + half pixel)──▶ χ² vs data
/// ```
///
/// The simulator centers its images half a pixel off the phase center, so
/// the centroid offset is corrected by `+½ pixel` in RA and `-½ pixel` in Dec.
public final class LikelihoodEvaluator {

    private final VisibilityDataset data;
    private final List<InterpolationPlan> plans;
    private final int npix;
    private final double dl;
    private final double halfPixel;

    private LikelihoodEvaluator(VisibilityDataset data, List<InterpolationPlan> plans, int npix, double dl) {
        this.data = data;
        this.plans = plans;
        this.npix = npix;
        this.dl = dl;
        this.halfPixel = dl / (PhysicalConstants.ARCSEC * 2.0);
    }

    /// Plans the interpolation for every channel of a dataset.
    ///
    /// @param data the active, conjugated channels
    /// @param npix pixels per image side, a power of two
    /// @param sizeArcsec full field of view in arcsec
    /// @return the evaluator
    /// @throws IllegalArgumentException if a (u,v) sample falls outside the Fourier grid
    public static LikelihoodEvaluator plan(VisibilityDataset data, int npix, double sizeArcsec) {
        if (npix < 2 || (npix & (npix - 1)) != 0) {
            throw new IllegalArgumentException("npix must be a power of two, got " + npix);
        }
        if (!(sizeArcsec > 0.0)) {
            throw new IllegalArgumentException("size_arcsec must be positive, got " + sizeArcsec);
        }
        double dl = sizeArcsec * PhysicalConstants.ARCSEC / npix;
        double[] axis = FourierGrid.shiftedFrequencies(npix, dl);
        List<InterpolationPlan> plans = new ArrayList<>(data.size());
        for (VisibilityChannel channel : data) {
            plans.add(InterpolationPlan.plan(channel, axis, axis));
        }
        return new LikelihoodEvaluator(data, List.copyOf(plans), npix, dl);
    }

    public VisibilityDataset data() {
        return data;
    }

    public int npix() {
        return npix;
    }

    /// Angular pixel size in radians.
    public double pixelAngle() {
        return dl;
    }

    /// Half a pixel in arcsec.
    public double halfPixel() {
        return halfPixel;
    }

    /// Model visibilities for every channel, phase-shifted to the centroid.
    ///
    /// @param image a gridding-corrected sky image with one channel per data channel
    /// @param muRa centroid RA offset in arcsec
    /// @param muDec centroid Dec offset in arcsec
    /// @return one model per channel
    /// @throws IllegalArgumentException if the image shape does not match the plans
    public List<ModelVisibilities> modelVisibilities(SkyImage image, double muRa, double muDec) {
        requireShape(image);
        List<ModelVisibilities> models = new ArrayList<>(plans.size());
        for (int c = 0; c < plans.size(); c++) {
            FourierGrid grid = FourierTransform.transform(image, c);
            ModelVisibilities model = plans.get(c).interpolate(grid);
            model.phaseShift(muRa + halfPixel, muDec - halfPixel);
            models.add(model);
        }
        return models;
    }

    /// Sum of the channel log-likelihoods.
    ///
    /// @param image a gridding-corrected sky image with one channel per data channel
    /// @param muRa centroid RA offset in arcsec
    /// @param muDec centroid Dec offset in arcsec
    /// @return `-½ Σ w |V_data - V_model|²` over all channels
    public double lnLikelihood(SkyImage image, double muRa, double muDec) {
        List<ModelVisibilities> models = modelVisibilities(image, muRa, muDec);
        double sum = 0.0;
        for (int c = 0; c < models.size(); c++) {
            sum += data.get(c).lnLikelihood(models.get(c));
        }
        return sum;
    }

    private void requireShape(SkyImage image) {
        if (image.nlam() != data.size()) {
            throw new IllegalArgumentException("Image has " + image.nlam() + " channels, data has " + data.size());
        }
        if (image.nx() != npix || image.ny() != npix) {
            throw new IllegalArgumentException("Image is " + image.nx() + "x" + image.ny()
                + ", expected " + npix + "x" + npix);
        }
    }
}
