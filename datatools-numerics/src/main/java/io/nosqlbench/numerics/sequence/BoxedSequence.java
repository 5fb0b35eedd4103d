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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// A [NumericSequence] over a snapshot of boxed numbers.
///
/// The element type is derived from the runtime classes of the elements
/// (see [NumericType#common]). An empty collection is [NumericType#DOUBLE].
final class BoxedSequence extends AbstractNumericSequence {

    private final List<Number> values;
    private final NumericType type;

    private BoxedSequence(List<Number> values, NumericType type) {
        this.values = values;
        this.type = type;
    }

    static BoxedSequence copyOf(Collection<? extends Number> source) {
        List<Number> values = new ArrayList<>(source.size());
        NumericType type = null;
        for (Number value : source) {
            Objects.requireNonNull(value, "values cannot contain null");
            NumericType elementType = NumericType.forBoxedType(value.getClass());
            type = type == null ? elementType : NumericType.common(type, elementType);
            values.add(value);
        }
        return new BoxedSequence(List.copyOf(values), type == null ? NumericType.DOUBLE : type);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public double valueAt(int index) {
        return values.get(index).doubleValue();
    }

    @Override
    public long longValueAt(int index) {
        return type.isIntegral() ? values.get(index).longValue() : (long) valueAt(index);
    }

    @Override
    public NumericType type() {
        return type;
    }

    @Override
    public BoxedSequence select(int[] indices) {
        List<Number> selected = new ArrayList<>(indices.length);
        for (int index : indices) {
            selected.add(values.get(index));
        }
        return new BoxedSequence(List.copyOf(selected), type);
    }
}
