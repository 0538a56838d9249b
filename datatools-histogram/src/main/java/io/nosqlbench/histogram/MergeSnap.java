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

import java.util.Locale;

/// Which end of an axis the merge window is anchored to when the merge factor
/// does not divide the bin count.
public enum MergeSnap {
    /// Groups start at the lowest edge; the remainder falls off the high end.
    LOW,
    /// Groups end at the highest edge; the remainder falls off the low end.
    HIGH;

    /// Parses `"low"` or `"high"`.
    ///
    /// @throws HistogramValidationException for an unknown keyword
    public static MergeSnap fromKeyword(String keyword) {
        return Keywords.parse(MergeSnap.class, keyword);
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
