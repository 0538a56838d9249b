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

/// How each side of a cut is resolved to an edge of the axis.
public enum CutSnap {
    /// Nearest edge to the requested bound.
    NEAREST,
    /// Outward edge: the low edge of the low bin, the high edge of the high bin.
    EXPAND,
    /// Low edge of the bin holding the bound.
    LOW,
    /// High edge of the bin holding the bound.
    HIGH,
    /// Like [#EXPAND], then the boundary edge is replaced by the exact bound.
    CLIP;

    /// The edge snapping used to locate this side of a cut.
    ///
    /// @param lowSide whether this is the low side of the cut
    EdgeSnap edgeSnap(boolean lowSide) {
        switch (this) {
            case NEAREST:
                return EdgeSnap.NEAREST;
            case LOW:
                return EdgeSnap.LOW;
            case HIGH:
                return EdgeSnap.HIGH;
            default:
                return lowSide ? EdgeSnap.LOW : EdgeSnap.HIGH;
        }
    }

    /// Parses a lowercase snap keyword such as `"clip"`.
    ///
    /// @throws HistogramValidationException for an unknown keyword
    public static CutSnap fromKeyword(String keyword) {
        return Keywords.parse(CutSnap.class, keyword);
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
