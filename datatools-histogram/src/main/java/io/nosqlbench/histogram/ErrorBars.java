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


/// Points and symmetric error bars of a one-dimensional histogram.
///
/// @param x bin centers
/// @param y bin values
/// @param xerr half bin widths
/// @param yerr bin uncertainties, relative to `y` when requested as ratios
public record ErrorBars(double[] x, double[] y, double[] xerr, double[] yerr) {
}
