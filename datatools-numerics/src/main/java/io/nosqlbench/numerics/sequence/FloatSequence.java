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

/// A [NumericSequence] backed by a `float[]`.
public final class FloatSequence extends AbstractNumericSequence {

    private final float[] values;

    FloatSequence(float[] values) {
        this.values = values;
    }

    /// Wraps an array without copying it. The caller must not modify it afterward.
    public static FloatSequence wrap(float[] values) {
        return new FloatSequence(values);
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
        return NumericType.FLOAT;
    }

    @Override
    public FloatSequence select(int[] indices) {
        float[] selected = new float[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return new FloatSequence(selected);
    }
}
