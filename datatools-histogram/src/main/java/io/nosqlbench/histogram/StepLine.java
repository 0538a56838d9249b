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


/// Step-function geometry of a one-dimensional histogram, ready for a line or
/// filled-region renderer.
///
/// @param x x coordinates, two per bin (low edge, high edge)
/// @param y y coordinates matching `x`
/// @param extent `{xmin, xmax, ymin, ymax}` of the points
public record StepLine(double[] x, double[] y, double[] extent) {

    public int size() {
        return x.length;
    }
}
