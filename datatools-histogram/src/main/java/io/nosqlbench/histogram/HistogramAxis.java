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

import java.util.Arrays;

/// One dimension of a [Histogram]: a continuous range of the real line divided into
/// bins without gaps.
///
/// ## Binning Convention
///
/// Bins are half-open, `edges[i] <= x < edges[i+1]`. The bins do not have to be
/// uniform, but the edges must be strictly increasing and there must be at least
/// one bin.
///
/// ```text
///   edges:   e0      e1      e2      e3
///            |-------|-------|-------|
///   bin:   -1    0       1       2      3 (= nbins)
/// ```
///
/// ## Usage
///
/// ```java
/// // 100 uniform bins from 0 to 10 (101 edges); both are equal
/// HistogramAxis a1 = new HistogramAxis(100, 0, 10);
/// HistogramAxis a2 = new HistogramAxis(linspace(0, 10, 101));
///
/// // 4 bins on a log scale, labeled
/// HistogramAxis a3 = new HistogramAxis(new double[] {1, 10, 100, 1000, 10000}, "E (keV)");
/// ```
///
/// Labels are descriptive only; [#equals(Object)] compares edges within a small
/// floating point tolerance and ignores labels.
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. [#setEdges(double[])] and [#setLabel(String)]
/// mutate the instance.
public final class HistogramAxis {

    static final double DEFAULT_RTOL = 1e-5;
    static final double DEFAULT_ATOL = 1e-8;

    private double[] edges;
    private String label;

    /// Creates `nbins` uniform bins covering `[low, high]`.
    ///
    /// @param nbins number of bins, at least 1
    /// @param low lowest edge
    /// @param high highest edge, greater than `low`
    public HistogramAxis(int nbins, double low, double high) {
        this(nbins, low, high, null);
    }

    /// Creates `nbins` uniform bins covering `[low, high]`.
    ///
    /// @param nbins number of bins, at least 1
    /// @param low lowest edge
    /// @param high highest edge, greater than `low`
    /// @param label axis label including units, may be null
    public HistogramAxis(int nbins, double low, double high, String label) {
        this(uniformEdges(nbins, low, high), label);
    }

    /// Creates an axis from explicit edges, which are copied.
    ///
    /// @param edges strictly increasing edges, at least two
    public HistogramAxis(double[] edges) {
        this(edges, null);
    }

    /// Creates an axis from explicit edges, which are copied.
    ///
    /// @param edges strictly increasing edges, at least two
    /// @param label axis label including units, may be null
    public HistogramAxis(double[] edges, String label) {
        if (edges == null) {
            throw new HistogramTypeException("bin edges must be given as an array, got null");
        }
        setEdges(edges);
        setLabel(label);
    }

    /// Copy constructor.
    public HistogramAxis(HistogramAxis other) {
        this(other.edges, other.label);
    }

    /// Resolves an [AxisSpec] into a new axis.
    public static HistogramAxis of(AxisSpec spec) {
        if (spec instanceof AxisSpec.Edges e) {
            return new HistogramAxis(e.edges(), e.label());
        }
        if (spec instanceof AxisSpec.CountAndRange c) {
            if (c.range() == null) {
                throw new HistogramTypeException(
                    "a range is required when bins are given as a count (bins: " + c.bins() + ")");
            }
            if (c.range().length != 2) {
                throw new HistogramValidationException(
                    "range must have exactly two values (input range: " + Arrays.toString(c.range()) + ")");
            }
            return new HistogramAxis(c.bins(), c.range()[0], c.range()[1], c.label());
        }
        if (spec instanceof AxisSpec.CopyOf c) {
            if (c.axis() == null) {
                throw new HistogramTypeException("no axis given to copy");
            }
            HistogramAxis copy = c.axis().copy();
            if (c.label() != null) {
                copy.setLabel(c.label());
            }
            return copy;
        }
        throw new HistogramTypeException("not an axis specification: " + spec);
    }

    private static double[] uniformEdges(int nbins, double low, double high) {
        if (nbins < 1) {
            throw new HistogramValidationException("number of bins must be at least 1, got: " + nbins);
        }
        if (!(low < high)) {
            throw new HistogramValidationException(
                "range must be from low to high (input range: [" + low + ", " + high + "])");
        }
        double[] edges = new double[nbins + 1];
        double step = (high - low) / nbins;
        for (int i = 0; i < nbins; i++) {
            edges[i] = low + i * step;
        }
        edges[nbins] = high;
        return edges;
    }

    /// Returns a copy of the bin edges from low to high.
    public double[] getEdges() {
        return edges.clone();
    }

    /// Returns edge `i`, `0 <= i <= nbins`.
    public double edge(int i) {
        return edges[i];
    }

    /// Replaces all edges. The array is copied and validated.
    ///
    /// @throws HistogramValidationException for fewer than two edges, non-finite
    ///     edges, or edges that are not strictly increasing
    public void setEdges(double[] newEdges) {
        if (newEdges.length < 2) {
            throw new HistogramValidationException(
                "an axis needs at least two edges, got " + newEdges.length);
        }
        for (int i = 0; i < newEdges.length; i++) {
            if (!Double.isFinite(newEdges[i])) {
                throw new HistogramValidationException("bin edges must be finite, edge " + i + " is " + newEdges[i]);
            }
            if (i > 0 && !(newEdges[i - 1] < newEdges[i])) {
                throw new HistogramValidationException("bin edges must be strictly increasing");
            }
        }
        this.edges = newEdges.clone();
    }

    /// The label of this axis including units if applicable, e.g. "distance (m)",
    /// or null when unlabeled.
    public String getLabel() {
        return label;
    }

    /// Sets the label; null or empty removes it.
    public void setLabel(String label) {
        this.label = (label == null || label.isEmpty()) ? null : label;
    }

    public int nbins() {
        return edges.length - 1;
    }

    public double min() {
        return edges[0];
    }

    public double max() {
        return edges[edges.length - 1];
    }

    /// `{min, max}`
    public double[] limits() {
        return new double[] {min(), max()};
    }

    public double[] binwidths() {
        double[] widths = new double[nbins()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = edges[i + 1] - edges[i];
        }
        return widths;
    }

    public double[] bincenters() {
        double[] centers = new double[nbins()];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = 0.5 * (edges[i] + edges[i + 1]);
        }
        return centers;
    }

    /// A value guaranteed to be outside the range of this axis.
    public double overflow() {
        return max() + 1.0;
    }

    /// Width of the second bin (index 1), kept as the historical default.
    /// Single-bin axes report the width of their only bin.
    public double binwidth() {
        return binwidth(Math.min(1, nbins() - 1));
    }

    /// Width of bin `b`.
    public double binwidth(int b) {
        return edges[b + 1] - edges[b];
    }

    /// Returns `min <= x < max`, consistent with [#bin(double)].
    public boolean inaxis(double x) {
        return edges[0] <= x && x < edges[edges.length - 1];
    }

    /// Bin index for `x` following `low <= x < high`.
    ///
    /// @return a negative index below the axis, `nbins` at or above [#max()] (and
    ///     for NaN), otherwise the bin holding `x`
    public int bin(double x) {
        if (Double.isNaN(x)) {
            return nbins();
        }
        // first edge strictly greater than x
        int lo = 0;
        int hi = edges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] <= x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    /// Index of the edge `x` snaps to, always within `[0, nbins]`.
    ///
    /// @param x position along this axis
    /// @param snap [EdgeSnap#NEAREST], [EdgeSnap#LOW] or [EdgeSnap#HIGH]
    /// @throws HistogramValidationException for [EdgeSnap#BOTH]; use
    ///     [#bracketingEdges(double)] instead
    public int edgeIndex(double x, EdgeSnap snap) {
        int[] bracket = bracketingEdges(x);
        int lowEdge = bracket[0];
        int highEdge = bracket[1];
        switch (snap) {
            case NEAREST:
                double dlow = Math.abs(x - edges[lowEdge]);
                double dhigh = Math.abs(edges[highEdge] - x);
                return (dlow <= dhigh) ? lowEdge : highEdge;
            case LOW:
                return lowEdge;
            case HIGH:
                return highEdge;
            default:
                throw new HistogramValidationException(
                    "snap '" + snap.keyword() + "' yields two edges, use bracketingEdges()");
        }
    }

    /// Indices of the low and high edges of the bin holding `x`, each clamped to
    /// `[0, nbins]` independently. Below the axis both are 0; at or above it both
    /// are `nbins`.
    public int[] bracketingEdges(double x) {
        int b = bin(x);
        int lowEdge = Math.max(b, 0);
        int highEdge = Math.min(b + 1, edges.length - 1);
        return new int[] {lowEdge, highEdge};
    }

    /// Checks whether all bins have the same width as the median width, within
    /// `1e-8 + 1e-5 * |median|`.
    public boolean isuniform() {
        return isuniform(DEFAULT_RTOL, DEFAULT_ATOL);
    }

    /// Checks whether every bin width lies within `atol + rtol * |median|` of the
    /// median width.
    public boolean isuniform(double rtol, double atol) {
        double[] widths = binwidths();
        double median = median(widths);
        double tolerance = atol + rtol * Math.abs(median);
        for (double w : widths) {
            if (Math.abs(w - median) > tolerance) {
                return false;
            }
        }
        return true;
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return 0.5 * (sorted[mid - 1] + sorted[mid]);
    }

    /// Truncates this axis to `[low, high]` snapping both sides to the nearest edge.
    ///
    /// @see #cut(Double, Double, CutSnap, CutSnap)
    public AxisCut cut(Double low, Double high) {
        return cut(low, high, CutSnap.NEAREST, CutSnap.NEAREST);
    }

    /// Truncates this axis using the same snap on both sides.
    ///
    /// @see #cut(Double, Double, CutSnap, CutSnap)
    public AxisCut cut(Double low, Double high, CutSnap snap) {
        return cut(low, high, snap, snap);
    }

    /// Returns a truncated copy of this axis and the mask of retained bins.
    ///
    /// Whole bins are kept unless a side uses [CutSnap#CLIP], in which case that
    /// boundary edge becomes exactly the requested bound. Clipping usually makes a
    /// uniform axis non-uniform.
    ///
    /// @param low lowest bin includes this point, null for the lowest edge
    /// @param high highest bin includes this point, null for the highest edge
    /// @param lowSnap how the low side snaps
    /// @param highSnap how the high side snaps
    /// @return the new axis and a mask over the bins of this axis
    /// @throws HistogramValidationException when the result has no bins
    public AxisCut cut(Double low, Double high, CutSnap lowSnap, CutSnap highSnap) {
        int lowEdge = (low == null) ? 0 : edgeIndex(low, lowSnap.edgeSnap(true));
        int highEdge = (high == null) ? edges.length - 1 : edgeIndex(high, highSnap.edgeSnap(false));
        // a clipped bound sitting on an edge closes the bin below it
        if (high != null && highSnap == CutSnap.CLIP && highEdge > 0 && high == edges[highEdge - 1]) {
            highEdge--;
        }
        if (highEdge <= lowEdge) {
            throw new HistogramValidationException(
                "cut [" + low + ", " + high + "] leaves no bins on axis " + this);
        }

        double[] newEdges = Arrays.copyOfRange(edges, lowEdge, highEdge + 1);
        boolean[] mask = new boolean[nbins()];
        Arrays.fill(mask, lowEdge, highEdge, true);

        if (low != null && lowSnap == CutSnap.CLIP) {
            newEdges[0] = low;
        }
        if (high != null && highSnap == CutSnap.CLIP) {
            newEdges[newEdges.length - 1] = high;
        }
        return new AxisCut(new HistogramAxis(newEdges, label), mask);
    }

    /// Merges every two neighboring bins, anchored at the low edge.
    public HistogramAxis mergebins() {
        return mergebins(2);
    }

    /// Merges every `n` neighboring bins, anchored at the low edge, dropping any
    /// remainder.
    public HistogramAxis mergebins(int n) {
        return mergebins(n, MergeSnap.LOW, true);
    }

    /// Merges every `n` neighboring bins.
    ///
    /// @param n number of bins to merge
    /// @param snap which end the groups are anchored to when `n` does not divide
    ///     the number of bins
    /// @param clip drop the leftover partial group (true) or keep it as one
    ///     irregular bin reaching the outermost edge (false)
    /// @return a new axis
    public HistogramAxis mergebins(int n, MergeSnap snap, boolean clip) {
        int[] kept = mergedEdgeIndices(n, snap, clip);
        double[] newEdges = new double[kept.length];
        for (int i = 0; i < kept.length; i++) {
            newEdges[i] = edges[kept[i]];
        }
        return new HistogramAxis(newEdges, label);
    }

    /// Indices into [#getEdges()] of the edges that survive a merge. Consecutive
    /// pairs delimit the source bins summed into each merged bin.
    int[] mergedEdgeIndices(int n, MergeSnap snap, boolean clip) {
        if (n < 1) {
            throw new HistogramValidationException("number of bins to merge must be at least 1, got: " + n);
        }
        int nbins = nbins();
        int groups = nbins / n;
        int remainder = nbins % n;
        boolean partial = remainder != 0 && !clip;
        int offset = (remainder != 0 && snap == MergeSnap.HIGH) ? remainder : 0;

        int[] kept = new int[groups + 1 + (partial ? 1 : 0)];
        int k = 0;
        if (partial && snap == MergeSnap.HIGH) {
            kept[k++] = 0;
        }
        for (int g = 0; g <= groups; g++) {
            kept[k++] = offset + g * n;
        }
        if (partial && snap == MergeSnap.LOW) {
            kept[k] = nbins;
        }
        if (kept.length < 2) {
            throw new HistogramValidationException(
                "cannot merge " + n + " bins of an axis with " + nbins + " bins");
        }
        return kept;
    }

    /// Deep copy of this axis.
    public HistogramAxis copy() {
        return new HistogramAxis(this);
    }

    /// Compares edges within a relative tolerance of 1e-5 and an absolute tolerance
    /// of 1e-8. Labels are ignored.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HistogramAxis)) {
            return false;
        }
        double[] other = ((HistogramAxis) o).edges;
        if (other.length != edges.length) {
            return false;
        }
        for (int i = 0; i < edges.length; i++) {
            if (Math.abs(edges[i] - other[i]) > DEFAULT_ATOL + DEFAULT_RTOL * Math.abs(other[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(nbins());
    }

    /// The edges only; the label is not included.
    @Override
    public String toString() {
        return Arrays.toString(edges);
    }
}
