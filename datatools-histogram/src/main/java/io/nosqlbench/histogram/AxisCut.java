package io.nosqlbench.histogram;

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

/// Result of [HistogramAxis#cut]: the truncated axis and a mask over the bins of
/// the source axis, `true` where the bin is retained.
///
/// @param axis the truncated axis
/// @param mask one entry per source bin
public record AxisCut(HistogramAxis axis, boolean[] mask) {

    /// Index of the first retained source bin.
    public int firstBin() {
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                return i;
            }
        }
        return mask.length;
    }

    /// Number of retained source bins.
    public int retainedBins() {
        int count = 0;
        for (boolean retained : mask) {
            if (retained) {
                count++;
            }
        }
        return count;
    }
}
