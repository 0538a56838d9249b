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

/// Storage type of histogram bin values.
///
/// Values are always held as doubles. [#LONG] storage keeps them integral by
/// truncating toward zero on every assignment, which mirrors integer arrays.
///
/// A double holds every integer up to [#MAX_EXACT_LONG] (2^53) in magnitude.
/// Integer input beyond that cannot be stored exactly and is rejected by
/// [Histogram#setData(long[])] and [Histogram.Builder#data(long[])].
public enum BinType {
    LONG,
    DOUBLE;

    /// Largest integer magnitude a [#LONG] bin holds exactly.
    public static final long MAX_EXACT_LONG = 1L << 53;

    /// Converts integer input to bin storage.
    ///
    /// @throws HistogramValidationException when a value exceeds [#MAX_EXACT_LONG]
    static double[] exactLongs(long[] values) {
        double[] converted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i]) > MAX_EXACT_LONG || values[i] == Long.MIN_VALUE) {
                throw new HistogramValidationException(
                    "integer bin value " + values[i] + " at " + i + " exceeds the exact range of +/-" + MAX_EXACT_LONG);
            }
            converted[i] = values[i];
        }
        return converted;
    }

    /// The type a binary operation between `this` and `other` produces.
    ///
    /// @param other the type of the other operand
    /// @param division whether the operation is a division
    /// @return [#DOUBLE] for divisions or when either side is [#DOUBLE], else [#LONG]
    public BinType promote(BinType other, boolean division) {
        if (division || this == DOUBLE || other == DOUBLE) {
            return DOUBLE;
        }
        return LONG;
    }

    /// Coerces a value into this storage type.
    public double coerce(double value) {
        if (this == LONG && Double.isFinite(value)) {
            return (double) (long) value;
        }
        return value;
    }

    /// The type needed to hold `value` without loss.
    public static BinType of(double value) {
        return (Double.isFinite(value) && value == Math.rint(value)) ? LONG : DOUBLE;
    }
}
