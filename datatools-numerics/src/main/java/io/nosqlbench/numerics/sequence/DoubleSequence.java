package io.nosqlbench.numerics.sequence;

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

/// A [NumericSequence] backed by a `double[]`.
///
/// This is the result type of every derived quantity (centered values,
/// z-scores, predictions). The library hands ownership of freshly computed
/// arrays to this class through [#wrap(double[])] to avoid a second copy.
public final class DoubleSequence extends AbstractNumericSequence {

    private final double[] values;

    DoubleSequence(double[] values) {
        this.values = values;
    }

    /// Wraps an array without copying it.
    ///
    /// The caller gives up the array: it must not be modified afterward.
    ///
    /// @param values freshly computed values
    /// @return a sequence over the array
    public static DoubleSequence wrap(double[] values) {
        return new DoubleSequence(values);
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public double valueAt(int index) {
        return values[index];
    }

    @Override
    public NumericType type() {
        return NumericType.DOUBLE;
    }

    @Override
    public DoubleSequence select(int[] indices) {
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return new DoubleSequence(selected);
    }

    @Override
    public double[] toDoubleArray() {
        return Arrays.copyOf(values, values.length);
    }
}
