package io.diskjockey.core.visibility;

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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/// Ordered, read-only sequence of [VisibilityChannel], one per spectral channel.
///
/// ## Lifecycle
///
/// ```text
///   load(data file) ──► select(mask) ──► conjugate() ──► shared read-only
/// ```
///
/// Each step returns a new dataset; none mutates its receiver.
public final class VisibilityDataset implements Iterable<VisibilityChannel> {

    private final List<VisibilityChannel> channels;

    public VisibilityDataset(List<VisibilityChannel> channels) {
        Objects.requireNonNull(channels, "channels cannot be null");
        this.channels = List.copyOf(channels);
    }

    public int size() {
        return channels.size();
    }

    public VisibilityChannel get(int index) {
        return channels.get(index);
    }

    public List<VisibilityChannel> channels() {
        return channels;
    }

    /// Returns the channel wavelengths in order.
    public double[] wavelengths() {
        double[] lams = new double[channels.size()];
        for (int i = 0; i < lams.length; i++) {
            lams[i] = channels.get(i).lam();
        }
        return lams;
    }

    /// Keeps only the channels whose mask entry is true.
    ///
    /// @param mask one entry per channel
    /// @return the filtered dataset
    /// @throws IllegalArgumentException if the mask length differs from the channel count
    public VisibilityDataset select(boolean[] mask) {
        if (mask.length != channels.size()) {
            throw new IllegalArgumentException(
                "mask has " + mask.length + " entries for " + channels.size() + " channels");
        }
        List<VisibilityChannel> kept = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                kept.add(channels.get(i));
            }
        }
        return new VisibilityDataset(kept);
    }

    /// Returns a dataset with every channel conjugated.
    public VisibilityDataset conjugate() {
        List<VisibilityChannel> conj = new ArrayList<>(channels.size());
        for (VisibilityChannel channel : channels) {
            conj.add(channel.conjugate());
        }
        return new VisibilityDataset(conj);
    }

    @Override
    public Iterator<VisibilityChannel> iterator() {
        return channels.iterator();
    }

    @Override
    public String toString() {
        return "VisibilityDataset[channels=" + channels.size() + "]";
    }
}
