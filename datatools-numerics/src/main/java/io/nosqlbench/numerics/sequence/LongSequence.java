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

/// A [NumericSequence] backed by a `long[]`.
///
/// [#valueAt(int)] loses precision above 2^53; [#longValueAt(int)] is exact.
public final class LongSequence extends AbstractNumericSequence {

    private final long[] values;

    LongSequence(long[] values) {
        this.values = values;
    }

    /// Wraps an array without copying it. The caller must not modify it afterward.
    public static LongSequence wrap(long[] values) {
        return new LongSequence(values);
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

    @Override
    public NumericType type() {
        return NumericType.LONG;
    }

    @Override
    public LongSequence select(int[] indices) {
        long[] selected = new long[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return new LongSequence(selected);
    }
}
