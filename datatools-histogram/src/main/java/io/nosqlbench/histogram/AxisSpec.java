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

/// The ways a [HistogramAxis] can be described before it is built.
///
/// ```java
/// List<AxisSpec> specs = List.of(
///     AxisSpec.uniform(10, 0, 100, "x"),
///     AxisSpec.edges(new double[] {1, 10, 100, 1000}, "energy (keV)"));
/// Histogram h = new Histogram(specs);
/// ```
///
/// Each variant is resolved by [HistogramAxis#of(AxisSpec)].
public sealed interface AxisSpec permits AxisSpec.Edges, AxisSpec.CountAndRange, AxisSpec.CopyOf {

    /// The axis label, or null for none.
    String label();

    /// An explicit, strictly increasing edge sequence.
    ///
    /// @param edges the bin edges including the upper edge of the last bin
    /// @param label the axis label, may be null
    record Edges(double[] edges, String label) implements AxisSpec {
    }

    /// A uniform split of `range` into `bins` bins.
    ///
    /// @param bins the number of bins
    /// @param range `{low, high}`; required
    /// @param label the axis label, may be null
    record CountAndRange(int bins, double[] range, String label) implements AxisSpec {
    }

    /// A copy of an existing axis, optionally relabeled.
    ///
    /// @param axis the axis to copy
    /// @param label replacement label, or null to keep the label of `axis`
    record CopyOf(HistogramAxis axis, String label) implements AxisSpec {
    }

    static AxisSpec edges(double[] edges) {
        return new Edges(edges, null);
    }

    static AxisSpec edges(double[] edges, String label) {
        return new Edges(edges, label);
    }

    static AxisSpec uniform(int bins, double low, double high) {
        return new CountAndRange(bins, new double[] {low, high}, null);
    }

    static AxisSpec uniform(int bins, double low, double high, String label) {
        return new CountAndRange(bins, new double[] {low, high}, label);
    }

    static AxisSpec copyOf(HistogramAxis axis) {
        return new CopyOf(axis, null);
    }
}
