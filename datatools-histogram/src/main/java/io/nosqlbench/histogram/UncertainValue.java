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


/// A value with its standard uncertainty, as produced by whole-histogram
/// reductions such as [Histogram#sum()] and [Histogram#integral()].
///
/// @param value the central value
/// @param uncert the standard deviation of `value`
public record UncertainValue(double value, double uncert) {

    @Override
    public String toString() {
        return value + " +/- " + uncert;
    }
}
