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

/// How a point is snapped to one of the two edges bounding its bin.
///
/// @see HistogramAxis#edgeIndex(double, EdgeSnap)
public enum EdgeSnap {
    /// The closer of the two edges; ties go to the low edge.
    NEAREST,
    /// Always the lower bounding edge.
    LOW,
    /// Always the upper bounding edge.
    HIGH,
    /// Both bounding edges, see [HistogramAxis#bracketingEdges(double)].
    BOTH;

    /// Parses a lowercase snap keyword such as `"nearest"`.
    ///
    /// @throws HistogramValidationException for an unknown keyword
    public static EdgeSnap fromKeyword(String keyword) {
        return Keywords.parse(EdgeSnap.class, keyword);
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
