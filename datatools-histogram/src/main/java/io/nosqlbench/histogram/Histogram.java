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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntFunction;

/// # Histogram
///
/// A dense N-dimensional binned data container over a fixed, ordered set of
/// [HistogramAxis] instances.
///
/// ## Layout
///
/// ```text
///   axes   : (a0, a1, ..., aN-1)          one per dimension, N >= 1
///   shape  : (a0.nbins, a1.nbins, ...)
///   data   : prod(shape) values, row-major (last axis fastest)
///   uncert : same size as data, or absent when not tracked
/// ```
///
/// Bin values carry a [BinType]. A fresh histogram is [BinType#LONG] and
/// zero-filled; it is promoted to [BinType#DOUBLE] by division, by floating point
/// operands, and by fractional fill weights.
///
/// ## Uncertainty
///
/// Uncertainty is optional. When it is not tracked, [#getUncert()] returns null
/// and [#getEffectiveUncert()] computes the Poisson estimate `sqrt(|data|)` on
/// demand. Arithmetic propagates uncertainty in quadrature whenever at least one
/// histogram operand tracks it:
///
/// | Operation | Result uncertainty |
/// |-----------|--------------------|
/// | `a + b`, `a - b` | `sqrt(ua^2 + ub^2)` |
/// | `a * b`, `a / b` | `abs(r) * sqrt((ua/a)^2 + (ub/b)^2)`, zero denominators contribute 0 |
/// | `a * c`, `a / c` (scalar or array `c`) | `ua * abs(c)`, `ua / abs(c)` |
///
/// ## Usage
///
/// ```java
/// Histogram h = Histogram.builder()
///     .axis(10, 0, 100, "x")
///     .axis(10, -0.5, 100.5, "y")
///     .label("z")
///     .title("Random Data")
///     .build();
/// h.fill(xs, ys);
///
/// Histogram px = h.projection(0);
/// Histogram coarse = h.rebin(2, 1);
/// for (Histogram slice : h.slices(0)) {
///     ...
/// }
/// ```
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. Fill, in-place arithmetic and the setters mutate
/// the receiver's buffers; every other operation returns a new histogram with
/// freshly allocated buffers.
public class Histogram {

    private static final Logger logger = LogManager.getLogger(Histogram.class);

    /// Histograms up to this many cells print their values in [#toString()].
    private static final int TO_STRING_LIMIT = 64;

    private final List<HistogramAxis> axes;
    private final GridShape grid;
    private BinType type;
    private double[] data;
    private double[] uncert;
    private String label;
    private String title;

    /// Creates a zero-filled [BinType#LONG] histogram over copies of `axes`.
    ///
    /// @throws HistogramTypeException when no axis is given
    public Histogram(HistogramAxis... axes) {
        this(copyAxes(Arrays.asList(axes)), null, BinType.LONG, null, null, null);
    }

    /// Creates a zero-filled [BinType#LONG] histogram, one axis per spec.
    ///
    /// @throws HistogramTypeException when no spec is given
    public Histogram(List<AxisSpec> specs) {
        this(resolveAxes(specs), null, BinType.LONG, null, null, null);
    }

    /// Takes ownership of `ownedAxes`, `data` and `uncert`.
    private Histogram(List<HistogramAxis> ownedAxes, double[] data, BinType type,
                      double[] uncert, String label, String title) {
        if (ownedAxes.isEmpty()) {
            throw new HistogramTypeException("a histogram needs at least one axis");
        }
        this.axes = Collections.unmodifiableList(ownedAxes);
        int[] shape = new int[ownedAxes.size()];
        for (int k = 0; k < shape.length; k++) {
            shape[k] = ownedAxes.get(k).nbins();
        }
        this.grid = new GridShape(shape);
        this.type = type;
        if (data == null) {
            this.data = new double[grid.size()];
        } else {
            requireSize("data", data.length);
            this.data = data;
            coerceAll(this.data, type);
        }
        if (uncert != null) {
            requireSize("uncert", uncert.length);
        }
        this.uncert = uncert;
        this.label = emptyToNull(label);
        this.title = emptyToNull(title);
    }

    /// Rebuilds a histogram from its persisted parts. This is the entry point used
    /// by serializers; all arrays are copied.
    ///
    /// @param edges bin edges per axis, in axis order
    /// @param axisLabels label per axis, may be null or hold nulls
    /// @param data row-major bin values
    /// @param type storage type of `data`
    /// @param uncert row-major uncertainties, or null when not tracked
    /// @param label histogram label, may be null
    /// @param title histogram title, may be null
    public static Histogram fromParts(List<double[]> edges, List<String> axisLabels, double[] data,
                                      BinType type, double[] uncert, String label, String title) {
        if (axisLabels != null && axisLabels.size() != edges.size()) {
            throw new HistogramValidationException(
                "got " + axisLabels.size() + " axis labels for " + edges.size() + " axes");
        }
        List<HistogramAxis> axes = new ArrayList<>(edges.size());
        for (int k = 0; k < edges.size(); k++) {
            axes.add(new HistogramAxis(edges.get(k), axisLabels == null ? null : axisLabels.get(k)));
        }
        return new Histogram(axes,
            data == null ? null : data.clone(),
            Objects.requireNonNull(type, "type"),
            uncert == null ? null : uncert.clone(),
            label, title);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<HistogramAxis> copyAxes(List<HistogramAxis> axes) {
        List<HistogramAxis> copies = new ArrayList<>(axes.size());
        for (HistogramAxis axis : axes) {
            copies.add(Objects.requireNonNull(axis, "axis").copy());
        }
        return copies;
    }

    private static List<HistogramAxis> resolveAxes(List<AxisSpec> specs) {
        List<HistogramAxis> resolved = new ArrayList<>(specs.size());
        for (AxisSpec spec : specs) {
            resolved.add(HistogramAxis.of(spec));
        }
        return resolved;
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }

    private static void coerceAll(double[] values, BinType type) {
        if (type == BinType.LONG) {
            for (int i = 0; i < values.length; i++) {
                values[i] = type.coerce(values[i]);
            }
        }
    }

    private void requireSize(String what, int length) {
        if (length != grid.size()) {
            throw new HistogramValidationException(
                what + " has " + length + " values but shape " + grid + " needs " + grid.size());
        }
    }

    private void requireAxis(int axis) {
        if (axis < 0 || axis >= dim()) {
            throw new HistogramValidationException(
                "axis " + axis + " does not exist in a " + dim() + "-dimensional histogram");
        }
    }

    private void requireOneDimensional(String operation) {
        if (dim() != 1) {
            throw new HistogramValidationException(
                operation + " needs a one-dimensional histogram, this one has " + dim() + " dimensions");
        }
    }

    //
    // Shape and metadata
    //

    /// The axes in dimension order. The list is unmodifiable and holds this
    /// histogram's own axis objects.
    public List<HistogramAxis> getAxes() {
        return axes;
    }

    public HistogramAxis axis(int k) {
        requireAxis(k);
        return axes.get(k);
    }

    public int dim() {
        return axes.size();
    }

    public int[] shape() {
        return grid.shape();
    }

    /// Total number of bins.
    public int size() {
        return grid.size();
    }

    public BinType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = emptyToNull(label);
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = emptyToNull(title);
    }

    //
    // Data access
    //

    /// A row-major copy of the bin values.
    public double[] getData() {
        return data.clone();
    }

    /// Replaces all bin values and switches the storage to [BinType#DOUBLE].
    public void setData(double[] values) {
        requireSize("data", values.length);
        this.data = values.clone();
        this.type = BinType.DOUBLE;
    }

    /// Replaces all bin values and switches the storage to [BinType#LONG].
    public void setData(long[] values) {
        requireSize("data", values.length);
        this.data = BinType.exactLongs(values);
        this.type = BinType.LONG;
    }

    /// Value of the bin at `index`, one coordinate per axis.
    public double getValue(int... index) {
        return data[grid.flatIndex(index)];
    }

    /// Sets the bin at `index`. A fractional value promotes [BinType#LONG] storage.
    public void setValue(double value, int... index) {
        int flat = grid.flatIndex(index);
        promoteFor(value);
        data[flat] = type.coerce(value);
    }

    public boolean hasUncert() {
        return uncert != null;
    }

    /// A row-major copy of the tracked uncertainties, or null when not tracked.
    public double[] getUncert() {
        return uncert == null ? null : uncert.clone();
    }

    /// Sets the tracked uncertainties; null stops tracking.
    public void setUncert(double[] values) {
        if (values == null) {
            this.uncert = null;
            return;
        }
        requireSize("uncert", values.length);
        this.uncert = values.clone();
    }

    /// Tracked uncertainty of the bin at `index`, or its Poisson estimate.
    public double getUncertValue(int... index) {
        int flat = grid.flatIndex(index);
        return uncert != null ? uncert[flat] : Math.sqrt(Math.abs(data[flat]));
    }

    /// The tracked uncertainties, or the Poisson estimate `sqrt(|data|)` when
    /// uncertainty is not tracked. Always a fresh array.
    public double[] getEffectiveUncert() {
        return uncert != null ? uncert.clone() : poisson(data);
    }

    private static double[] poisson(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.sqrt(Math.abs(values[i]));
        }
        return result;
    }

    private void promoteFor(double value) {
        if (type == BinType.LONG && BinType.of(value) == BinType.DOUBLE) {
            logger.debug("promoting bin storage to DOUBLE to hold {}", value);
            type = BinType.DOUBLE;
        }
    }

    /// Sets every bin to zero; tracked uncertainties are zeroed too.
    public void reset() {
        Arrays.fill(data, 0.0);
        if (uncert != null) {
            Arrays.fill(uncert, 0.0);
        }
    }

    /// Sets every bin to `value`, leaving uncertainty untouched.
    public void set(double value) {
        promoteFor(value);
        Arrays.fill(data, type.coerce(value));
    }

    /// Sets every bin to `value` and every uncertainty to `uncertValue`, which
    /// starts tracking uncertainty if needed.
    public void set(double value, double uncertValue) {
        set(value);
        if (uncert == null) {
            uncert = new double[grid.size()];
        }
        Arrays.fill(uncert, uncertValue);
    }

    /// Replaces NaN bin values by `value`.
    public void clearNans(double value) {
        promoteFor(value);
        for (int i = 0; i < data.length; i++) {
            if (Double.isNaN(data[i])) {
                data[i] = value;
            }
        }
    }

    /// Deep copy with the same storage type.
    @Override
    public Histogram clone() {
        return clone(type);
    }

    /// Deep copy coerced to `newType`. Axes are copied, metadata is kept.
    public Histogram clone(BinType newType) {
        return new Histogram(copyAxes(axes), data.clone(), newType,
            uncert == null ? null : uncert.clone(), label, title);
    }

    //
    // Filling
    //

    /// Adds one count per sample. `coords` holds one array per axis, all of the
    /// same length. Samples outside any axis are dropped.
    public void fill(double[]... coords) {
        fillWeighted(coords, null, null);
    }

    /// Adds `weights[i]` for each sample.
    ///
    /// @see #fillWeighted(double[][], double[], double[])
    public void fillWeighted(double[][] coords, double[] weights) {
        fillWeighted(coords, weights, null);
    }

    /// Adds `weights[i]` for each sample `i` at `(coords[0][i], coords[1][i], ...)`.
    ///
    /// Samples outside the range of any axis are silently dropped. When uncertainty
    /// is tracked, each accepted sample adds `weightUncerts[i]^2` (or `weight^2` when
    /// no weight uncertainties are given) to the bin's variance.
    ///
    /// @param coords one coordinate array per axis
    /// @param weights one weight per sample, or null for unit weights
    /// @param weightUncerts one uncertainty per weight, or null
    public void fillWeighted(double[][] coords, double[] weights, double[] weightUncerts) {
        if (coords.length != dim()) {
            throw new HistogramValidationException(
                "got " + coords.length + " coordinate arrays for " + dim() + " axes");
        }
        int n = coords[0].length;
        for (double[] c : coords) {
            if (c.length != n) {
                throw new HistogramValidationException("coordinate arrays differ in length");
            }
        }
        if (weights != null && weights.length != n) {
            throw new HistogramValidationException(
                "got " + weights.length + " weights for " + n + " samples");
        }
        if (weightUncerts != null && weightUncerts.length != n) {
            throw new HistogramValidationException(
                "got " + weightUncerts.length + " weight uncertainties for " + n + " samples");
        }
        if (weights != null) {
            for (double w : weights) {
                promoteFor(w);
            }
        }

        int dropped = 0;
        samples:
        for (int i = 0; i < n; i++) {
            int flat = 0;
            for (int k = 0; k < coords.length; k++) {
                HistogramAxis axis = axes.get(k);
                int b = axis.bin(coords[k][i]);
                if (b < 0 || b >= axis.nbins()) {
                    dropped++;
                    continue samples;
                }
                flat += b * grid.inner(k);
            }
            double w = (weights == null) ? 1.0 : weights[i];
            data[flat] += w;
            if (uncert != null) {
                double wu = (weightUncerts == null) ? w : weightUncerts[i];
                uncert[flat] = Math.sqrt(uncert[flat] * uncert[flat] + wu * wu);
            }
        }
        if (dropped > 0) {
            logger.debug("dropped {} of {} samples outside the histogram range", dropped, n);
        }
    }

    /// Adds one count at `point`.
    public void fillOne(double[] point) {
        fillOne(point, 1.0);
    }

    /// Adds `weight` at `point`, which has one coordinate per axis.
    public void fillOne(double[] point, double weight) {
        double[][] coords = new double[point.length][];
        for (int k = 0; k < point.length; k++) {
            coords[k] = new double[] {point[k]};
        }
        fillWeighted(coords, new double[] {weight});
    }

    /// Adds one count per row of `sample`; each row is a point.
    public void fillFromSample(double[][] sample) {
        fillFromSample(sample, null);
    }

    /// Adds `weights[i]` at point `sample[i]`.
    public void fillFromSample(double[][] sample, double[] weights) {
        double[][] coords = new double[dim()][sample.length];
        for (int i = 0; i < sample.length; i++) {
            if (sample[i].length != dim()) {
                throw new HistogramValidationException(
                    "sample point " + i + " has " + sample[i].length + " coordinates for " + dim() + " axes");
            }
            for (int k = 0; k < dim(); k++) {
                coords[k][i] = sample[i][k];
            }
        }
        fillWeighted(coords, weights);
    }

    //
    // Point queries
    //

    /// Value of the bin holding `point`, or 0 when the point is outside.
    public double valueAt(double... point) {
        return valueAtOrDefault(point, 0.0);
    }

    /// Value of the bin holding `point`, or `overflowValue` when the point is
    /// outside any axis.
    public double valueAtOrDefault(double[] point, double overflowValue) {
        if (point.length != dim()) {
            throw new HistogramValidationException(
                "point has " + point.length + " coordinates for " + dim() + " axes");
        }
        int flat = 0;
        for (int k = 0; k < point.length; k++) {
            HistogramAxis axis = axes.get(k);
            int b = axis.bin(point[k]);
            if (b < 0 || b >= axis.nbins()) {
                return overflowValue;
            }
            flat += b * grid.inner(k);
        }
        return data[flat];
    }

    /// Multilinear interpolation between bin centers. Outside the outermost bin
    /// centers the value is held constant along that axis.
    public double interpolate(double... point) {
        if (point.length != dim()) {
            throw new HistogramValidationException(
                "point has " + point.length + " coordinates for " + dim() + " axes");
        }
        int d = dim();
        int[] lower = new int[d];
        int[] upper = new int[d];
        double[] frac = new double[d];
        for (int k = 0; k < d; k++) {
            double[] centers = axes.get(k).bincenters();
            double x = point[k];
            int n = centers.length;
            if (n == 1 || x <= centers[0]) {
                lower[k] = 0;
                upper[k] = 0;
            } else if (x >= centers[n - 1]) {
                lower[k] = n - 1;
                upper[k] = n - 1;
            } else {
                int j = axes.get(k).bin(x);
                if (x < centers[j]) {
                    j--;
                }
                lower[k] = j;
                upper[k] = j + 1;
                frac[k] = (x - centers[j]) / (centers[j + 1] - centers[j]);
            }
        }
        double result = 0.0;
        for (int corner = 0; corner < (1 << d); corner++) {
            double weight = 1.0;
            int flat = 0;
            for (int k = 0; k < d; k++) {
                boolean up = ((corner >> k) & 1) == 1;
                weight *= up ? frac[k] : 1.0 - frac[k];
                flat += (up ? upper[k] : lower[k]) * grid.inner(k);
            }
            if (weight != 0.0) {
                result += weight * data[flat];
            }
        }
        return result;
    }

    //
    // Arithmetic
    //

    private record Combined(double[] data, double[] uncert, BinType type) {
    }

    /// Computes `this op that` into a new histogram. Neither operand is modified.
    ///
    /// @throws HistogramValidationException when a histogram operand has different
    ///     axes or a value array has the wrong length
    public Histogram apply(BinaryOp op, Operand that) {
        Combined c = combine(op, that, false);
        return new Histogram(copyAxes(axes), c.data(), c.type(), c.uncert(), label, title);
    }

    /// Computes `that op this` into a new histogram.
    public Histogram applyReflected(BinaryOp op, Operand that) {
        Combined c = combine(op, that, true);
        return new Histogram(copyAxes(axes), c.data(), c.type(), c.uncert(), label, title);
    }

    /// Computes `this op that` into this histogram's own buffers. The axes are
    /// left untouched. [BinType#LONG] storage is promoted when the result needs it,
    /// except that dividing [BinType#LONG] storage by another histogram is refused.
    ///
    /// @return this histogram
    /// @throws HistogramTypeException for in-place division of [BinType#LONG]
    ///     storage by a histogram
    public Histogram applyInPlace(BinaryOp op, Operand that) {
        if (op == BinaryOp.DIVIDE && type == BinType.LONG && that instanceof Operand.Grid) {
            throw new HistogramTypeException(
                "in-place division of integer bins by a histogram would truncate; clone(BinType.DOUBLE) first");
        }
        Combined c = combine(op, that, false);
        if (c.type() != type) {
            logger.debug("promoting bin storage from {} to {} for in-place {}", type, c.type(), op);
            type = c.type();
        }
        System.arraycopy(c.data(), 0, data, 0, data.length);
        if (c.uncert() == null) {
            uncert = null;
        } else if (uncert == null) {
            uncert = c.uncert();
        } else {
            System.arraycopy(c.uncert(), 0, uncert, 0, uncert.length);
        }
        return this;
    }

    private Combined combine(BinaryOp op, Operand that, boolean reflected) {
        double[] other;
        double[] otherUncert = null;
        boolean otherTracks = false;
        if (that instanceof Operand.Scalar s) {
            other = new double[grid.size()];
            Arrays.fill(other, s.value());
        } else if (that instanceof Operand.Values v) {
            if (v.values().length != grid.size()) {
                throw new HistogramValidationException(
                    "operand has " + v.values().length + " values but shape " + grid + " needs " + grid.size());
            }
            other = v.values();
        } else {
            Histogram h = ((Operand.Grid) that).histogram();
            if (!axes.equals(h.axes)) {
                throw new HistogramValidationException(
                    "histogram axes differ: " + axes + " vs " + h.axes);
            }
            other = h.data;
            otherUncert = h.getEffectiveUncert();
            otherTracks = h.hasUncert();
        }

        BinType resultType = type.promote(that.type(), op == BinaryOp.DIVIDE);
        double[] left = reflected ? other : data;
        double[] right = reflected ? data : other;
        double[] result = new double[grid.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = resultType.coerce(op.apply(left[i], right[i]));
        }

        double[] resultUncert = null;
        if (hasUncert() || otherTracks) {
            double[] own = getEffectiveUncert();
            if (otherUncert == null && !reflected && !op.isAdditive()) {
                resultUncert = scaleUncert(op, own, other);
            } else {
                double[] leftUncert = reflected ? otherUncert : own;
                double[] rightUncert = reflected ? own : otherUncert;
                resultUncert = propagate(op, left, leftUncert, right, rightUncert, result);
            }
        }
        return new Combined(result, resultUncert, resultType);
    }

    /// Uncertainty of `a * c` or `a / c` for an exact factor `c`.
    private static double[] scaleUncert(BinaryOp op, double[] u, double[] factor) {
        double[] result = new double[u.length];
        for (int i = 0; i < u.length; i++) {
            double c = Math.abs(factor[i]);
            if (op == BinaryOp.MULTIPLY) {
                result[i] = u[i] * c;
            } else {
                result[i] = (c == 0.0) ? 0.0 : u[i] / c;
            }
        }
        return result;
    }

    /// Quadrature propagation; a null uncertainty array means exact values.
    private static double[] propagate(BinaryOp op, double[] left, double[] leftUncert,
                                      double[] right, double[] rightUncert, double[] result) {
        double[] out = new double[result.length];
        for (int i = 0; i < out.length; i++) {
            double ul = (leftUncert == null) ? 0.0 : leftUncert[i];
            double ur = (rightUncert == null) ? 0.0 : rightUncert[i];
            if (op.isAdditive()) {
                out[i] = Math.sqrt(ul * ul + ur * ur);
            } else {
                double rl = ratio(ul, left[i]);
                double rr = ratio(ur, right[i]);
                out[i] = Math.abs(result[i]) * Math.sqrt(rl * rl + rr * rr);
            }
        }
        return out;
    }

    private static double ratio(double u, double value) {
        return (value == 0.0) ? 0.0 : u / value;
    }

    public Histogram plus(long value) {
        return apply(BinaryOp.ADD, Operand.of(value));
    }

    public Histogram plus(double value) {
        return apply(BinaryOp.ADD, Operand.of(value));
    }

    public Histogram plus(long[] values) {
        return apply(BinaryOp.ADD, Operand.of(values));
    }

    public Histogram plus(double[] values) {
        return apply(BinaryOp.ADD, Operand.of(values));
    }

    public Histogram plus(Histogram that) {
        return apply(BinaryOp.ADD, Operand.of(that));
    }

    public Histogram minus(long value) {
        return apply(BinaryOp.SUBTRACT, Operand.of(value));
    }

    public Histogram minus(double value) {
        return apply(BinaryOp.SUBTRACT, Operand.of(value));
    }

    public Histogram minus(long[] values) {
        return apply(BinaryOp.SUBTRACT, Operand.of(values));
    }

    public Histogram minus(double[] values) {
        return apply(BinaryOp.SUBTRACT, Operand.of(values));
    }

    public Histogram minus(Histogram that) {
        return apply(BinaryOp.SUBTRACT, Operand.of(that));
    }

    public Histogram times(long value) {
        return apply(BinaryOp.MULTIPLY, Operand.of(value));
    }

    public Histogram times(double value) {
        return apply(BinaryOp.MULTIPLY, Operand.of(value));
    }

    public Histogram times(long[] values) {
        return apply(BinaryOp.MULTIPLY, Operand.of(values));
    }

    public Histogram times(double[] values) {
        return apply(BinaryOp.MULTIPLY, Operand.of(values));
    }

    public Histogram times(Histogram that) {
        return apply(BinaryOp.MULTIPLY, Operand.of(that));
    }

    /// Always yields [BinType#DOUBLE]; bins divided by zero become 0.
    public Histogram dividedBy(double value) {
        return apply(BinaryOp.DIVIDE, Operand.of(value));
    }

    public Histogram dividedBy(double[] values) {
        return apply(BinaryOp.DIVIDE, Operand.of(values));
    }

    public Histogram dividedBy(Histogram that) {
        return apply(BinaryOp.DIVIDE, Operand.of(that));
    }

    /// `value - this`
    public Histogram subtractFrom(double value) {
        return applyReflected(BinaryOp.SUBTRACT, Operand.of(value));
    }

    /// `value / this`
    public Histogram divideInto(double value) {
        return applyReflected(BinaryOp.DIVIDE, Operand.of(value));
    }

    public Histogram addInPlace(long value) {
        return applyInPlace(BinaryOp.ADD, Operand.of(value));
    }

    public Histogram addInPlace(double value) {
        return applyInPlace(BinaryOp.ADD, Operand.of(value));
    }

    public Histogram addInPlace(long[] values) {
        return applyInPlace(BinaryOp.ADD, Operand.of(values));
    }

    public Histogram addInPlace(Histogram that) {
        return applyInPlace(BinaryOp.ADD, Operand.of(that));
    }

    public Histogram subtractInPlace(long value) {
        return applyInPlace(BinaryOp.SUBTRACT, Operand.of(value));
    }

    public Histogram subtractInPlace(double value) {
        return applyInPlace(BinaryOp.SUBTRACT, Operand.of(value));
    }

    public Histogram subtractInPlace(long[] values) {
        return applyInPlace(BinaryOp.SUBTRACT, Operand.of(values));
    }

    public Histogram subtractInPlace(Histogram that) {
        return applyInPlace(BinaryOp.SUBTRACT, Operand.of(that));
    }

    public Histogram multiplyInPlace(long value) {
        return applyInPlace(BinaryOp.MULTIPLY, Operand.of(value));
    }

    public Histogram multiplyInPlace(double value) {
        return applyInPlace(BinaryOp.MULTIPLY, Operand.of(value));
    }

    public Histogram multiplyInPlace(Histogram that) {
        return applyInPlace(BinaryOp.MULTIPLY, Operand.of(that));
    }

    /// Divides in place, promoting [BinType#LONG] storage first.
    public Histogram divideInPlace(double value) {
        return applyInPlace(BinaryOp.DIVIDE, Operand.of(value));
    }

    public Histogram divideInPlace(double[] values) {
        return applyInPlace(BinaryOp.DIVIDE, Operand.of(values));
    }

    /// @throws HistogramTypeException when this histogram has [BinType#LONG] storage
    public Histogram divideInPlace(Histogram that) {
        return applyInPlace(BinaryOp.DIVIDE, Operand.of(that));
    }

    //
    // Structural operations
    //

    /// Cuts axis 0 to `[low, high]`, snapping to the nearest edges.
    public Histogram cut(Double low, Double high) {
        return cut(low, high, 0, CutSnap.NEAREST, CutSnap.NEAREST);
    }

    /// Cuts axis `axis` to `[low, high]`, snapping to the nearest edges.
    public Histogram cut(Double low, Double high, int axis) {
        return cut(low, high, axis, CutSnap.NEAREST, CutSnap.NEAREST);
    }

    public Histogram cut(Double low, Double high, int axis, CutSnap snap) {
        return cut(low, high, axis, snap, snap);
    }

    /// Restricts one axis to `[low, high]` and keeps only the data of the retained
    /// bins. Other axes are untouched.
    ///
    /// @param low lower bound, null for the lowest edge
    /// @param high upper bound, null for the highest edge
    /// @param axis the axis to cut
    /// @param lowSnap snapping of the low side
    /// @param highSnap snapping of the high side
    /// @see HistogramAxis#cut(Double, Double, CutSnap, CutSnap)
    public Histogram cut(Double low, Double high, int axis, CutSnap lowSnap, CutSnap highSnap) {
        requireAxis(axis);
        AxisCut cut = axes.get(axis).cut(low, high, lowSnap, highSnap);
        List<HistogramAxis> newAxes = copyAxes(axes);
        newAxes.set(axis, cut.axis());
        double[] newData = grid.select(data, axis, cut.mask());
        double[] newUncert = (uncert == null) ? null : grid.select(uncert, axis, cut.mask());
        return new Histogram(newAxes, newData, type, newUncert, label, title);
    }

    /// Merges every two bins of axis 0.
    public Histogram rebin() {
        return rebin(2, 0);
    }

    /// Merges every `n` bins of axis 0.
    public Histogram rebin(int n) {
        return rebin(n, 0);
    }

    public Histogram rebin(int n, int axis) {
        return rebin(n, axis, MergeSnap.LOW, true);
    }

    /// Merges every `n` bins along `axis`, summing their values. Uncertainties are
    /// combined in quadrature. Bins dropped from the axis by `clip` are dropped from
    /// the data as well.
    ///
    /// @see HistogramAxis#mergebins(int, MergeSnap, boolean)
    public Histogram rebin(int n, int axis, MergeSnap snap, boolean clip) {
        requireAxis(axis);
        HistogramAxis source = axes.get(axis);
        int[] bounds = source.mergedEdgeIndices(n, snap, clip);
        List<HistogramAxis> newAxes = copyAxes(axes);
        newAxes.set(axis, source.mergebins(n, snap, clip));
        double[] newData = grid.reduceGroups(data, axis, bounds, false);
        double[] newUncert = (uncert == null) ? null : grid.reduceGroups(uncert, axis, bounds, true);
        return new Histogram(newAxes, newData, type, newUncert, label, title);
    }

    /// The sub-histogram at bin `i` of `axis`, with that axis removed.
    public Histogram slice(int axis, int i) {
        requireAxis(axis);
        if (dim() < 2) {
            throw new HistogramValidationException("cannot slice a one-dimensional histogram");
        }
        if (i < 0 || i >= grid.extent(axis)) {
            throw new IndexOutOfBoundsException("bin " + i + " outside axis " + axis);
        }
        List<HistogramAxis> remaining = copyAxes(axes);
        remaining.remove(axis);
        double[] sliceData = grid.take(data, axis, i);
        double[] sliceUncert = (uncert == null) ? null : grid.take(uncert, axis, i);
        return new Histogram(remaining, sliceData, type, sliceUncert, label, title);
    }

    /// Slices along axis 0.
    public Iterable<Histogram> slices() {
        return slices(0);
    }

    /// One sub-histogram per bin along `axis`, each with that axis removed.
    ///
    /// The sequence is lazy and restartable: every iteration builds the slices
    /// from the current contents of this histogram.
    public Iterable<Histogram> slices(int axis) {
        requireAxis(axis);
        if (dim() < 2) {
            throw new HistogramValidationException("cannot slice a one-dimensional histogram");
        }
        return () -> new IndexedIterator<>(grid.extent(axis), i -> slice(axis, i));
    }

    /// The bin values of each slice along `axis`, row-major over the remaining axes.
    public Iterable<double[]> slicesData(int axis) {
        requireAxis(axis);
        return () -> new IndexedIterator<>(grid.extent(axis), i -> grid.take(data, axis, i));
    }

    /// The uncertainties (tracked or Poisson) of each slice along `axis`.
    public Iterable<double[]> slicesUncert(int axis) {
        requireAxis(axis);
        return () -> new IndexedIterator<>(grid.extent(axis),
            i -> grid.take(uncert != null ? uncert : poisson(data), axis, i));
    }

    private static final class IndexedIterator<T> implements Iterator<T> {
        private final int count;
        private final IntFunction<T> producer;
        private int next;

        IndexedIterator(int count, IntFunction<T> producer) {
            this.count = count;
            this.producer = producer;
        }

        @Override
        public boolean hasNext() {
            return next < count;
        }

        @Override
        public T next() {
            if (next >= count) {
                throw new NoSuchElementException();
            }
            return producer.apply(next++);
        }
    }

    /// Sums out every axis except `axis`.
    public Histogram projection(int axis) {
        requireAxis(axis);
        int[] others = new int[dim() - 1];
        for (int k = 0, j = 0; k < dim(); k++) {
            if (k != axis) {
                others[j++] = k;
            }
        }
        return sumOverAxes(others);
    }

    /// Sums the data over the given axes, which are removed. Uncertainties are
    /// combined in quadrature. With no axes this is a copy.
    ///
    /// @throws HistogramValidationException for repeated or unknown axes, or when
    ///     every axis would be removed; use [#sum()] for the grand total
    public Histogram sumOverAxes(int... sumAxes) {
        boolean[] summed = new boolean[dim()];
        for (int k : sumAxes) {
            requireAxis(k);
            if (summed[k]) {
                throw new HistogramValidationException("axis " + k + " given more than once");
            }
            summed[k] = true;
        }
        if (sumAxes.length == dim()) {
            throw new HistogramValidationException("summing over every axis leaves no histogram; use sum()");
        }
        GridShape shape = grid;
        double[] newData = data;
        double[] newUncert = uncert;
        List<HistogramAxis> newAxes = copyAxes(axes);
        for (int k = dim() - 1; k >= 0; k--) {
            if (!summed[k]) {
                continue;
            }
            int[] whole = {0, shape.extent(k)};
            newData = shape.reduceGroups(newData, k, whole, false);
            if (newUncert != null) {
                newUncert = shape.reduceGroups(newUncert, k, whole, true);
            }
            shape = shape.without(k);
            newAxes.remove(k);
        }
        return new Histogram(newAxes,
            newData == data ? data.clone() : newData,
            type,
            (newUncert != null && newUncert == uncert) ? uncert.clone() : newUncert,
            label, title);
    }

    /// Sum of all bins with its uncertainty (tracked or Poisson) in quadrature.
    public UncertainValue sum() {
        double total = 0.0;
        double variance = 0.0;
        double[] u = getEffectiveUncert();
        for (int i = 0; i < data.length; i++) {
            total += data[i];
            variance += u[i] * u[i];
        }
        return new UncertainValue(total, Math.sqrt(variance));
    }

    /// Sum of all bins weighted by their volume.
    public UncertainValue integral() {
        double[] volumes = binvolumes();
        double[] u = getEffectiveUncert();
        double total = 0.0;
        double variance = 0.0;
        for (int i = 0; i < data.length; i++) {
            total += data[i] * volumes[i];
            double uv = u[i] * volumes[i];
            variance += uv * uv;
        }
        return new UncertainValue(total, Math.sqrt(variance));
    }

    /// A one-dimensional histogram of this histogram's bin values over the range
    /// of the non-NaN values. The largest value is counted in the last bin.
    public Histogram occupancy(int bins) {
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            if (!Double.isNaN(v)) {
                lo = Math.min(lo, v);
                hi = Math.max(hi, v);
            }
        }
        if (lo > hi) {
            throw new HistogramValidationException("no values to take the occupancy of");
        }
        if (lo == hi) {
            return occupancy(bins, lo - 0.5, hi + 0.5);
        }
        return occupancy(bins, lo, Math.nextUp(hi));
    }

    /// A one-dimensional histogram counting how many bins of this histogram hold a
    /// value in each of `bins` uniform ranges over `[low, high)`. NaN values are
    /// skipped.
    public Histogram occupancy(int bins, double low, double high) {
        Histogram result = new Histogram(new HistogramAxis(bins, low, high, label));
        double[] values = Arrays.stream(data).filter(v -> !Double.isNaN(v)).toArray();
        result.fill(values);
        return result;
    }

    /// Gaussian smoothing with standard deviation `sigma` in units of bins along
    /// every axis. Edges reflect; the kernel is truncated at four sigma. Tracked
    /// uncertainties are propagated with the squared kernel weights.
    public Histogram smooth(double sigma) {
        if (!(sigma > 0.0)) {
            throw new HistogramValidationException("smoothing sigma must be positive, got: " + sigma);
        }
        int radius = (int) (4.0 * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double norm = 0.0;
        for (int j = -radius; j <= radius; j++) {
            kernel[j + radius] = Math.exp(-0.5 * j * j / (sigma * sigma));
            norm += kernel[j + radius];
        }
        double[] squaredKernel = new double[kernel.length];
        for (int j = 0; j < kernel.length; j++) {
            kernel[j] /= norm;
            squaredKernel[j] = kernel[j] * kernel[j];
        }

        double[] smoothed = data.clone();
        double[] variance = null;
        if (uncert != null) {
            variance = new double[uncert.length];
            for (int i = 0; i < uncert.length; i++) {
                variance[i] = uncert[i] * uncert[i];
            }
        }
        for (int k = 0; k < dim(); k++) {
            smoothed = convolve(smoothed, k, kernel);
            if (variance != null) {
                variance = convolve(variance, k, squaredKernel);
            }
        }
        double[] smoothedUncert = null;
        if (variance != null) {
            smoothedUncert = new double[variance.length];
            for (int i = 0; i < variance.length; i++) {
                smoothedUncert[i] = Math.sqrt(variance[i]);
            }
        }
        return new Histogram(copyAxes(axes), smoothed, BinType.DOUBLE, smoothedUncert, label, title);
    }

    private double[] convolve(double[] values, int axis, double[] kernel) {
        int radius = kernel.length / 2;
        int n = grid.extent(axis);
        int inner = grid.inner(axis);
        int outer = grid.outer(axis);
        double[] result = new double[values.length];
        for (int o = 0; o < outer; o++) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < inner; j++) {
                    double acc = 0.0;
                    for (int t = -radius; t <= radius; t++) {
                        int src = reflect(i + t, n);
                        acc += kernel[t + radius] * values[(o * n + src) * inner + j];
                    }
                    result[(o * n + i) * inner + j] = acc;
                }
            }
        }
        return result;
    }

    /// Mirror boundary `(d c b a | a b c d | d c b a)`.
    private static int reflect(int i, int n) {
        int period = 2 * n;
        int m = Math.floorMod(i, period);
        return (m < n) ? m : period - 1 - m;
    }

    //
    // Geometry for renderers
    //

    /// Step-line geometry of a one-dimensional histogram over all bins.
    public StepLine asline() {
        return asline(null, null);
    }

    /// Step-line geometry of the bins whose low edge is at least `xlow` and whose
    /// high edge is below `xhigh`.
    ///
    /// @param xlow lower limit, null for none
    /// @param xhigh upper limit, null for none
    /// @throws HistogramValidationException when no bin is in range
    public StepLine asline(Double xlow, Double xhigh) {
        requireOneDimensional("asline");
        HistogramAxis axis = axes.get(0);
        int n = axis.nbins();
        int first = -1;
        int last = -1;
        for (int i = 0; i < n; i++) {
            boolean inRange = (xlow == null || axis.edge(i) >= xlow)
                && (xhigh == null || axis.edge(i + 1) < xhigh);
            if (inRange) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first < 0) {
            throw new HistogramValidationException("range [" + xlow + ", " + xhigh + ") holds no bins");
        }
        int count = last - first + 1;
        double[] x = new double[2 * count];
        double[] y = new double[2 * count];
        double ymin = Double.POSITIVE_INFINITY;
        double ymax = Double.NEGATIVE_INFINITY;
        for (int b = 0; b < count; b++) {
            int i = first + b;
            x[2 * b] = axis.edge(i);
            x[2 * b + 1] = axis.edge(i + 1);
            y[2 * b] = data[i];
            y[2 * b + 1] = data[i];
            ymin = Math.min(ymin, data[i]);
            ymax = Math.max(ymax, data[i]);
        }
        return new StepLine(x, y, new double[] {x[0], x[x.length - 1], ymin, ymax});
    }

    /// Closed step-region geometry down to `min(0, smallest value)`.
    public StepLine aspolygon() {
        return aspolygon(null, null, null);
    }

    /// Step-region geometry: the step line plus a baseline at `ymin` under its
    /// first and last points.
    ///
    /// @param ymin baseline, null for `min(0, smallest value in range)`
    /// @param xlow lower limit, null for none
    /// @param xhigh upper limit, null for none
    public StepLine aspolygon(Double ymin, Double xlow, Double xhigh) {
        StepLine line = asline(xlow, xhigh);
        double[] ext = line.extent();
        double base = (ymin == null) ? Math.min(0.0, ext[2]) : ymin;
        int n = line.size();
        double[] x = new double[n + 2];
        double[] y = new double[n + 2];
        x[0] = line.x()[0];
        y[0] = base;
        System.arraycopy(line.x(), 0, x, 1, n);
        System.arraycopy(line.y(), 0, y, 1, n);
        x[n + 1] = line.x()[n - 1];
        y[n + 1] = base;
        double[] extent = {ext[0], ext[1], Math.min(base, ext[2]), Math.max(base, ext[3])};
        return new StepLine(x, y, extent);
    }

    /// Bin centers, values, half widths and uncertainties of a one-dimensional
    /// histogram.
    ///
    /// @param asRatio give the uncertainties relative to the values (0 where the
    ///     value is 0)
    public ErrorBars errorbars(boolean asRatio) {
        requireOneDimensional("errorbars");
        HistogramAxis axis = axes.get(0);
        double[] xerr = axis.binwidths();
        for (int i = 0; i < xerr.length; i++) {
            xerr[i] *= 0.5;
        }
        double[] yerr = getEffectiveUncert();
        if (asRatio) {
            for (int i = 0; i < yerr.length; i++) {
                yerr[i] = Math.abs(ratio(yerr[i], data[i]));
            }
        }
        return new ErrorBars(axis.bincenters(), data.clone(), xerr, yerr);
    }

    //
    // Derived geometry and statistics
    //

    /// Edges of each axis, in axis order.
    public List<double[]> edges() {
        List<double[]> result = new ArrayList<>(dim());
        for (HistogramAxis axis : axes) {
            result.add(axis.getEdges());
        }
        return result;
    }

    public double[] binwidths(int axis) {
        return axis(axis).binwidths();
    }

    public double binwidth(int b, int axis) {
        return axis(axis).binwidth(b);
    }

    /// The volume (product of widths) of every bin, row-major.
    public double[] binvolumes() {
        double[] volumes = new double[grid.size()];
        Arrays.fill(volumes, 1.0);
        for (int k = 0; k < dim(); k++) {
            double[] widths = axes.get(k).binwidths();
            for (int i = 0; i < volumes.length; i++) {
                volumes[i] *= widths[grid.coordinate(i, k)];
            }
        }
        return volumes;
    }

    /// Bin-center coordinates of every bin: `grid()[k][i]` is the center along axis
    /// `k` of bin `i` in row-major order.
    public double[][] grid() {
        double[][] coords = new double[dim()][grid.size()];
        for (int k = 0; k < dim(); k++) {
            double[] centers = axes.get(k).bincenters();
            for (int i = 0; i < grid.size(); i++) {
                coords[k][i] = centers[grid.coordinate(i, k)];
            }
        }
        return coords;
    }

    /// Per axis, a value guaranteed to be outside that axis.
    public double[] overflow() {
        double[] result = new double[dim()];
        for (int k = 0; k < dim(); k++) {
            result[k] = axes.get(k).overflow();
        }
        return result;
    }

    /// True when every axis has uniform bins.
    public boolean isUniform() {
        for (HistogramAxis axis : axes) {
            if (!axis.isuniform()) {
                return false;
            }
        }
        return true;
    }

    /// Data-weighted mean bin center along each axis.
    public double[] mean() {
        double total = 0.0;
        double[] sums = new double[dim()];
        double[][] centers = centersPerAxis();
        for (int i = 0; i < data.length; i++) {
            total += data[i];
            for (int k = 0; k < dim(); k++) {
                sums[k] += data[i] * centers[k][grid.coordinate(i, k)];
            }
        }
        for (int k = 0; k < dim(); k++) {
            sums[k] /= total;
        }
        return sums;
    }

    /// Data-weighted variance of the bin centers along each axis.
    public double[] var() {
        double[] mean = mean();
        double total = 0.0;
        double[] sums = new double[dim()];
        double[][] centers = centersPerAxis();
        for (int i = 0; i < data.length; i++) {
            total += data[i];
            for (int k = 0; k < dim(); k++) {
                double d = centers[k][grid.coordinate(i, k)] - mean[k];
                sums[k] += data[i] * d * d;
            }
        }
        for (int k = 0; k < dim(); k++) {
            sums[k] /= total;
        }
        return sums;
    }

    public double[] std() {
        double[] v = var();
        for (int k = 0; k < v.length; k++) {
            v[k] = Math.sqrt(v[k]);
        }
        return v;
    }

    private double[][] centersPerAxis() {
        double[][] centers = new double[dim()][];
        for (int k = 0; k < dim(); k++) {
            centers[k] = axes.get(k).bincenters();
        }
        return centers;
    }

    /// Smallest non-NaN bin value.
    public double min() {
        return min(false);
    }

    /// Smallest non-NaN bin value, lowered by its uncertainty when `withUncert`.
    public double min(boolean withUncert) {
        double[] u = withUncert ? getEffectiveUncert() : null;
        double result = Double.NaN;
        for (int i = 0; i < data.length; i++) {
            double v = withUncert ? data[i] - u[i] : data[i];
            if (!Double.isNaN(v) && (Double.isNaN(result) || v < result)) {
                result = v;
            }
        }
        return result;
    }

    /// Largest non-NaN bin value.
    public double max() {
        return max(false);
    }

    /// Largest non-NaN bin value, raised by its uncertainty when `withUncert`.
    public double max(boolean withUncert) {
        double[] u = withUncert ? getEffectiveUncert() : null;
        double result = Double.NaN;
        for (int i = 0; i < data.length; i++) {
            double v = withUncert ? data[i] + u[i] : data[i];
            if (!Double.isNaN(v) && (Double.isNaN(result) || v > result)) {
                result = v;
            }
        }
        return result;
    }

    /// `{a0.min, a0.max, ..., value min, value max}` over every axis, without padding.
    public double[] extent() {
        return extent(dim() + 1, false, 0.0);
    }

    /// Plot extent: the limits of the first `maxdim` axes, followed by the value
    /// range when fewer than `maxdim` axes exist.
    ///
    /// @param maxdim number of `{min, max}` pairs to return at most
    /// @param withUncert widen the value range by the uncertainties
    /// @param pad fraction of each range added on both of its sides
    public double[] extent(int maxdim, boolean withUncert, double pad) {
        if (maxdim < 1) {
            throw new HistogramValidationException("maxdim must be at least 1, got: " + maxdim);
        }
        int pairs = Math.min(maxdim, dim() + 1);
        double[] ext = new double[2 * pairs];
        for (int k = 0; k < pairs; k++) {
            double lo;
            double hi;
            if (k < dim()) {
                lo = axes.get(k).min();
                hi = axes.get(k).max();
            } else {
                lo = min(withUncert);
                hi = max(withUncert);
            }
            double margin = pad * (hi - lo);
            ext[2 * k] = lo - margin;
            ext[2 * k + 1] = hi + margin;
        }
        return ext;
    }

    /// True when axes (including their labels), values, uncertainties, label and
    /// title all agree, values within the axis equality tolerance.
    public boolean isIdentical(Histogram that) {
        if (that == null || dim() != that.dim() || !axes.equals(that.axes)) {
            return false;
        }
        for (int k = 0; k < dim(); k++) {
            if (!Objects.equals(axes.get(k).getLabel(), that.axes.get(k).getLabel())) {
                return false;
            }
        }
        if (!Objects.equals(label, that.label) || !Objects.equals(title, that.title)) {
            return false;
        }
        if ((uncert == null) != (that.uncert == null)) {
            return false;
        }
        return allClose(data, that.data) && (uncert == null || allClose(uncert, that.uncert));
    }

    private static boolean allClose(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            if (Double.isNaN(a[i]) && Double.isNaN(b[i])) {
                continue;
            }
            if (!(Math.abs(a[i] - b[i]) <= HistogramAxis.DEFAULT_ATOL + HistogramAxis.DEFAULT_RTOL * Math.abs(b[i]))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Histogram[shape=").append(grid)
            .append(", type=").append(type);
        if (label != null) {
            sb.append(", label=").append(label);
        }
        if (title != null) {
            sb.append(", title=").append(title);
        }
        if (grid.size() <= TO_STRING_LIMIT) {
            sb.append(", data=").append(Arrays.toString(data));
        }
        return sb.append(uncert != null ? ", uncert tracked]" : "]").toString();
    }

    /// Fluent construction of a [Histogram] with initial contents.
    public static final class Builder {
        private final List<HistogramAxis> axes = new ArrayList<>();
        private double[] data;
        private BinType type = BinType.LONG;
        private double[] uncert;
        private String label;
        private String title;

        private Builder() {
        }

        /// Adds a copy of `axis`.
        public Builder axis(HistogramAxis axis) {
            axes.add(axis.copy());
            return this;
        }

        public Builder axis(AxisSpec spec) {
            axes.add(HistogramAxis.of(spec));
            return this;
        }

        public Builder axis(int nbins, double low, double high) {
            axes.add(new HistogramAxis(nbins, low, high));
            return this;
        }

        public Builder axis(int nbins, double low, double high, String axisLabel) {
            axes.add(new HistogramAxis(nbins, low, high, axisLabel));
            return this;
        }

        public Builder axis(double[] edges) {
            axes.add(new HistogramAxis(edges));
            return this;
        }

        public Builder axis(double[] edges, String axisLabel) {
            axes.add(new HistogramAxis(edges, axisLabel));
            return this;
        }

        /// Integer initial values, row-major.
        public Builder data(long[] values) {
            this.data = BinType.exactLongs(values);
            this.type = BinType.LONG;
            return this;
        }

        /// Floating point initial values, row-major.
        public Builder data(double[] values) {
            this.data = values.clone();
            this.type = BinType.DOUBLE;
            return this;
        }

        /// Initial uncertainties, row-major; enables uncertainty tracking.
        public Builder uncert(double[] values) {
            this.uncert = values.clone();
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Histogram build() {
            return new Histogram(new ArrayList<>(axes), data, type, uncert, label, title);
        }
    }
}
