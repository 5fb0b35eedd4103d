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

import java.util.Collection;
import java.util.Objects;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/// # NumericSequence
///
/// An ordered, finite sequence of numeric scalars sharing one [NumericType].
/// This is the input and output type of every function in the maths, stats
/// and regression packages.
///
/// ## Purpose
/// - Lets a single function accept `int[]`, `long[]`, `float[]`, `double[]`
///   or any collection of boxed numbers without an overload per container
/// - Promotes every element to `double` through [#valueAt(int)], which is
///   what the statistics layer computes with
/// - Keeps the element type visible through [#type()] so element-type
///   preserving transforms can return the same kind of sequence
///
/// ## Usage
/// ```java
/// NumericSequence x = NumericSequence.of(1, 2, 3, 4);
/// NumericSequence y = NumericSequence.of(List.of(2.0, 4.0, 6.0, 8.0));
/// double r = Correlation.pearsonr(x, y);
/// ```
///
/// ## Implementation Notes
/// - The `of` factories copy their input. The typed `wrap` factories share
///   the caller's array, so the caller must not modify it afterward
/// - Library functions never mutate a sequence and always return new ones
/// - Implementations are safe for concurrent reads
public interface NumericSequence {

    /// @return the number of elements
    int size();

    /// Returns the element at `index`, promoted to `double`.
    ///
    /// @param index the 0-based element index
    /// @return the promoted value
    /// @throws IndexOutOfBoundsException if index is invalid
    double valueAt(int index);

    /// Returns the element at `index` as a `long`.
    ///
    /// Integral sequences return the exact value. Floating-point sequences
    /// truncate toward zero.
    ///
    /// @param index the 0-based element index
    /// @return the value as a long
    default long longValueAt(int index) {
        return (long) valueAt(index);
    }

    /// @return the element type of this sequence
    NumericType type();

    /// Returns a new sequence holding the elements at the given positions,
    /// in the order given, with the same element type as this one.
    ///
    /// @param indices positions to copy
    /// @return the selected elements
    /// @throws IndexOutOfBoundsException if any index is invalid
    NumericSequence select(int[] indices);

    default boolean isEmpty() {
        return size() == 0;
    }

    /// @return a fresh array holding every element promoted to `double`
    default double[] toDoubleArray() {
        double[] values = new double[size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = valueAt(i);
        }
        return values;
    }

    /// @return the promoted elements in order
    default DoubleStream doubles() {
        return IntStream.range(0, size()).mapToDouble(this::valueAt);
    }

    static NumericSequence of(double... values) {
        return new DoubleSequence(Objects.requireNonNull(values, "values cannot be null").clone());
    }

    static NumericSequence of(float... values) {
        return new FloatSequence(Objects.requireNonNull(values, "values cannot be null").clone());
    }

    static NumericSequence of(int... values) {
        return new IntSequence(Objects.requireNonNull(values, "values cannot be null").clone());
    }

    static NumericSequence of(long... values) {
        return new LongSequence(Objects.requireNonNull(values, "values cannot be null").clone());
    }

    static NumericSequence of(short... values) {
        Objects.requireNonNull(values, "values cannot be null");
        int[] widened = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            widened[i] = values[i];
        }
        return new IntSequence(widened);
    }

    static NumericSequence of(byte... values) {
        Objects.requireNonNull(values, "values cannot be null");
        int[] widened = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            widened[i] = values[i];
        }
        return new IntSequence(widened);
    }

    /// Builds a sequence from boxed numbers.
    ///
    /// The element type is the common type of all elements: a list of
    /// `Integer` is [NumericType#INT], a mix of `Integer` and `Long` is
    /// [NumericType#LONG], and any other mix is [NumericType#DOUBLE].
    ///
    /// @param values the values, in iteration order
    /// @return a sequence snapshot of the collection
    /// @throws NullPointerException if the collection or any element is null
    static NumericSequence of(Collection<? extends Number> values) {
        return BoxedSequence.copyOf(Objects.requireNonNull(values, "values cannot be null"));
    }
}
