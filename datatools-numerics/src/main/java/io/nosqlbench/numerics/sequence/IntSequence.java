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

/// A [NumericSequence] backed by an `int[]`.
///
/// Also holds widened `byte` and `short` input, and the binary labels
/// produced by logistic regression.
public final class IntSequence extends AbstractNumericSequence {

    private final int[] values;

    IntSequence(int[] values) {
        this.values = values;
    }

    /// Wraps an array without copying it. The caller must not modify it afterward.
    public static IntSequence wrap(int[] values) {
        return new IntSequence(values);
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
    public long longValueAt(int index) {
        return values[index];
    }

    /// Returns the element without promotion.
    public int intAt(int index) {
        return values[index];
    }

    /// @return a fresh copy of the elements
    public int[] toIntArray() {
        return Arrays.copyOf(values, values.length);
    }

    @Override
    public NumericType type() {
        return NumericType.INT;
    }

    @Override
    public IntSequence select(int[] indices) {
        int[] selected = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return new IntSequence(selected);
    }
}
