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

/// The right-hand side of a [BinaryOp] applied to a [Histogram].
///
/// | Variant | Shape | Uncertainty |
/// |---------|-------|-------------|
/// | [Scalar] | broadcast to every cell | none |
/// | [Values] | one value per cell, row-major | none |
/// | [Grid] | histogram with equal axes | tracked, or Poisson when untracked |
public sealed interface Operand permits Operand.Scalar, Operand.Values, Operand.Grid {

    /// Storage type the operand contributes to type promotion.
    BinType type();

    /// A single value applied to every cell.
    record Scalar(double value, BinType type) implements Operand {
    }

    /// One value per cell in row-major order.
    record Values(double[] values, BinType type) implements Operand {
    }

    /// Another histogram; its axes must equal the receiver's.
    record Grid(Histogram histogram) implements Operand {
        @Override
        public BinType type() {
            return histogram.getType();
        }
    }

    static Operand of(long value) {
        return new Scalar(value, BinType.LONG);
    }

    static Operand of(double value) {
        return new Scalar(value, BinType.DOUBLE);
    }

    static Operand of(long[] values) {
        double[] converted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = values[i];
        }
        return new Values(converted, BinType.LONG);
    }

    static Operand of(double[] values) {
        return new Values(values.clone(), BinType.DOUBLE);
    }

    static Operand of(Histogram histogram) {
        return new Grid(histogram);
    }
}
