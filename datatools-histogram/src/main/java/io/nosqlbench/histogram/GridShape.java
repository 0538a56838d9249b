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

/// Row-major index arithmetic for a dense grid.
///
/// For a dimension `k`, every flat index decomposes as
/// `outer * (shape[k] * inner) + i * inner + j`, where `inner` is the product of
/// the extents after `k` and `outer` ranges over the extents before it. All of the
/// per-axis reductions and selections of [Histogram] are written in those terms.
final class GridShape {

    private final int[] shape;
    private final int[] strides;
    private final int size;

    GridShape(int[] shape) {
        this.shape = shape.clone();
        this.strides = new int[shape.length];
        int stride = 1;
        for (int k = shape.length - 1; k >= 0; k--) {
            strides[k] = stride;
            stride = Math.multiplyExact(stride, shape[k]);
        }
        this.size = stride;
    }

    int dim() {
        return shape.length;
    }

    int size() {
        return size;
    }

    int extent(int axis) {
        return shape[axis];
    }

    int[] shape() {
        return shape.clone();
    }

    /// Product of the extents after `axis`.
    int inner(int axis) {
        return strides[axis];
    }

    /// Product of the extents before `axis`.
    int outer(int axis) {
        return size / (shape[axis] * strides[axis]);
    }

    int flatIndex(int[] index) {
        if (index.length != shape.length) {
            throw new HistogramValidationException(
                "index " + Arrays.toString(index) + " does not match " + shape.length + " dimensions");
        }
        int flat = 0;
        for (int k = 0; k < shape.length; k++) {
            if (index[k] < 0 || index[k] >= shape[k]) {
                throw new IndexOutOfBoundsException(
                    "index " + Arrays.toString(index) + " outside shape " + Arrays.toString(shape));
            }
            flat += index[k] * strides[k];
        }
        return flat;
    }

    /// Coordinate of `flat` along `axis`.
    int coordinate(int flat, int axis) {
        return (flat / strides[axis]) % shape[axis];
    }

    /// Shape with `axis` removed.
    GridShape without(int axis) {
        int[] next = new int[shape.length - 1];
        for (int k = 0, j = 0; k < shape.length; k++) {
            if (k != axis) {
                next[j++] = shape[k];
            }
        }
        return new GridShape(next);
    }

    /// Sums `values` over consecutive groups along `axis`. Group `g` covers the
    /// indices `[bounds[g], bounds[g+1])`; indices outside every group are dropped.
    /// With `squared` set the values are squared before summing and the square root
    /// is taken afterwards, which combines uncertainties in quadrature.
    double[] reduceGroups(double[] values, int axis, int[] bounds, boolean squared) {
        int groups = bounds.length - 1;
        int inner = inner(axis);
        int outer = outer(axis);
        int n = shape[axis];
        double[] result = new double[outer * groups * inner];
        for (int o = 0; o < outer; o++) {
            for (int g = 0; g < groups; g++) {
                for (int i = bounds[g]; i < bounds[g + 1]; i++) {
                    int src = (o * n + i) * inner;
                    int dst = (o * groups + g) * inner;
                    for (int j = 0; j < inner; j++) {
                        double v = values[src + j];
                        result[dst + j] += squared ? v * v : v;
                    }
                }
            }
        }
        if (squared) {
            for (int i = 0; i < result.length; i++) {
                result[i] = Math.sqrt(result[i]);
            }
        }
        return result;
    }

    /// Keeps the indices along `axis` where `mask` is set.
    double[] select(double[] values, int axis, boolean[] mask) {
        int kept = 0;
        for (boolean m : mask) {
            if (m) {
                kept++;
            }
        }
        int inner = inner(axis);
        int outer = outer(axis);
        int n = shape[axis];
        double[] result = new double[outer * kept * inner];
        int dst = 0;
        for (int o = 0; o < outer; o++) {
            for (int i = 0; i < n; i++) {
                if (mask[i]) {
                    System.arraycopy(values, (o * n + i) * inner, result, dst, inner);
                    dst += inner;
                }
            }
        }
        return result;
    }

    /// The values at index `i` along `axis`, with that dimension removed.
    double[] take(double[] values, int axis, int i) {
        int inner = inner(axis);
        int outer = outer(axis);
        int n = shape[axis];
        double[] result = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            System.arraycopy(values, (o * n + i) * inner, result, o * inner, inner);
        }
        return result;
    }

    @Override
    public String toString() {
        return Arrays.toString(shape);
    }
}
