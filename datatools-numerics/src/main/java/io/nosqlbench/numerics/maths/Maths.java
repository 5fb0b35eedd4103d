package io.nosqlbench.numerics.maths;

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

import io.nosqlbench.numerics.sequence.DoubleSequence;
import io.nosqlbench.numerics.sequence.FloatSequence;
import io.nosqlbench.numerics.sequence.IntSequence;
import io.nosqlbench.numerics.sequence.LongSequence;
import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SequenceChecks;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Elementary math over integers and {@link NumericSequence}s.
 *
 * <h2>Purpose</h2>
 *
 * <p>Stateless building blocks for the statistics layer and the regression
 * estimators:
 * <ul>
 *   <li><b>integer arithmetic</b> - {@link #gcd}, {@link #factorial}</li>
 *   <li><b>reductions</b> - {@link #sum}, {@link #prod}, {@link #dot}</li>
 *   <li><b>element-wise maps</b> - {@link #absolute}, {@link #reciprocal},
 *       {@link #linear}, {@link #power}, {@link #log}, {@link #exp},
 *       {@link #sigmoid}</li>
 *   <li><b>near-duplicate elimination</b> - {@link #set}</li>
 * </ul>
 *
 * <h2>Element Types</h2>
 *
 * <p>Maps that derive new quantities return {@link DoubleSequence}s.
 * {@link #absolute} and {@link #set} keep the element type of their input.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * NumericSequence x = NumericSequence.of(-2, 0, 3);
 * NumericSequence magnitudes = Maths.absolute(x);   // INT[2, 0, 3]
 * NumericSequence shifted = Maths.linear(x, 2.0, 1.0);  // DOUBLE[-3.0, 1.0, 7.0]
 * }</pre>
 */
public final class Maths {

    /**
     * Default tolerance used by {@link #set(NumericSequence)}.
     */
    public static final double DEFAULT_SET_EPSILON = 1e-6;

    private Maths() {
        // Utility class
    }

    // ========== Integer arithmetic ==========

    /**
     * Greatest common divisor by the Euclidean algorithm on absolute values.
     * {@code gcd(0, 0)} is 0.
     */
    public static long gcd(long m, long n) {
        m = Math.abs(m);
        n = Math.abs(n);
        while (n != 0) {
            long t = m % n;
            m = n;
            n = t;
        }
        return m;
    }

    /**
     * Greatest common divisor of two ints.
     * <p>
     * {@code gcd(Integer.MIN_VALUE, 0)} is {@code 2^31}, which has no int form.
     *
     * @throws ArithmeticException if the divisor does not fit in an int
     * @see #gcd(long, long)
     */
    public static int gcd(int m, int n) {
        return Math.toIntExact(gcd((long) m, (long) n));
    }

    /**
     * Iterative product over {@code 1..|n|}. {@code factorial(0)} is 1.
     * Overflow is not detected.
     */
    public static long factorial(long n) {
        long limit = Math.abs(n);
        long f = 1;
        for (long c = 1; c <= limit; c++) {
            f *= c;
        }
        return f;
    }

    /**
     * Factorial of an int, overflowing past {@code 12!}.
     *
     * @see #factorial(long)
     */
    public static int factorial(int n) {
        int limit = Math.abs(n);
        int f = 1;
        for (int c = 1; c <= limit; c++) {
            f *= c;
        }
        return f;
    }

    // ========== Checks and reductions ==========

    /**
     * Returns true if every element is strictly greater than zero.
     * An empty sequence is vacuously positive.
     */
    public static boolean isPositive(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        for (int i = 0; i < seq.size(); i++) {
            if (!(seq.valueAt(i) > 0)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Additive reduction. An empty sequence sums to 0.
     */
    public static double sum(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        double sum = 0.0;
        for (int i = 0; i < seq.size(); i++) {
            sum += seq.valueAt(i);
        }
        return sum;
    }

    /**
     * Multiplicative reduction.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the sequence is empty
     */
    public static double prod(NumericSequence seq) {
        SequenceChecks.requireNonEmpty(seq, "prod");
        double prod = 1.0;
        for (int i = 0; i < seq.size(); i++) {
            prod *= seq.valueAt(i);
        }
        return prod;
    }

    /**
     * Inner product of two sequences.
     *
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     */
    public static double dot(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "dot");
        double sum = 0.0;
        for (int i = 0; i < x.size(); i++) {
            sum += x.valueAt(i) * y.valueAt(i);
        }
        return sum;
    }

    // ========== Element-wise maps ==========

    /**
     * Element-wise magnitude with the same element type as the input.
     */
    public static NumericSequence absolute(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        int n = seq.size();
        switch (seq.type()) {
            case INT: {
                int[] out = new int[n];
                for (int i = 0; i < n; i++) {
                    out[i] = Math.abs((int) seq.longValueAt(i));
                }
                return IntSequence.wrap(out);
            }
            case LONG: {
                long[] out = new long[n];
                for (int i = 0; i < n; i++) {
                    out[i] = Math.abs(seq.longValueAt(i));
                }
                return LongSequence.wrap(out);
            }
            case FLOAT: {
                float[] out = new float[n];
                for (int i = 0; i < n; i++) {
                    out[i] = Math.abs((float) seq.valueAt(i));
                }
                return FloatSequence.wrap(out);
            }
            default:
                return map(seq, Math::abs);
        }
    }

    /**
     * Element-wise {@code 1/x}.
     *
     * @throws InvalidValueException if any element is exactly zero
     */
    public static DoubleSequence reciprocal(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        for (int i = 0; i < seq.size(); i++) {
            if (seq.valueAt(i) == 0.0) {
                throw new InvalidValueException("reciprocal", "Input contains a zero at index " + i);
            }
        }
        return map(seq, v -> 1.0 / v);
    }

    /**
     * Element-wise {@code a*x + b}.
     */
    public static DoubleSequence linear(NumericSequence seq, double a, double b) {
        SequenceChecks.requireNonNull(seq);
        return map(seq, v -> a * v + b);
    }

    /**
     * Element-wise {@code x^exponent} via {@link Math#pow}. Negative bases
     * with fractional exponents yield NaN.
     */
    public static DoubleSequence power(NumericSequence seq, double exponent) {
        SequenceChecks.requireNonNull(seq);
        return map(seq, v -> Math.pow(v, exponent));
    }

    /**
     * Element-wise natural logarithm.
     *
     * @throws InvalidValueException if any element is not strictly positive
     */
    public static DoubleSequence log(NumericSequence seq) {
        if (!isPositive(seq)) {
            throw new InvalidValueException("log", "Input contains non-positive values");
        }
        return map(seq, Math::log);
    }

    /**
     * Element-wise {@code e^x}.
     */
    public static DoubleSequence exp(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        return map(seq, Math::exp);
    }

    /**
     * Element-wise logistic function {@code 1/(1+e^-x)}.
     */
    public static DoubleSequence sigmoid(NumericSequence seq) {
        SequenceChecks.requireNonNull(seq);
        return map(seq, Maths::sigmoid);
    }

    /**
     * Scalar logistic function {@code 1/(1+e^-x)}.
     */
    public static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    // ========== Near-duplicate elimination ==========

    /**
     * Near-duplicate elimination with {@link #DEFAULT_SET_EPSILON}.
     *
     * @see #set(NumericSequence, double)
     */
    public static NumericSequence set(NumericSequence seq) {
        return set(seq, DEFAULT_SET_EPSILON);
    }

    /**
     * Keeps the first element, then each later element only when no kept
     * element lies within {@code epsilon} of it.
     *
     * <p>Runs in O(n·k) for n inputs and k kept values, which suits small
     * inputs such as label sets. The result has the input's element type
     * and keeps first-occurrence order.
     *
     * @param seq a non-empty sequence
     * @param epsilon absolute distance under which two values are the same
     * @return the distinct values
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code seq} is empty
     * @throws IllegalArgumentException if {@code epsilon} is negative or NaN
     */
    public static NumericSequence set(NumericSequence seq, double epsilon) {
        SequenceChecks.requireNonEmpty(seq, "set");
        if (!(epsilon >= 0)) {
            throw new IllegalArgumentException("epsilon must be non-negative, got " + epsilon);
        }

        int[] kept = new int[seq.size()];
        int count = 0;
        kept[count++] = 0;

        for (int i = 1; i < seq.size(); i++) {
            double value = seq.valueAt(i);
            boolean duplicate = false;
            for (int k = 0; k < count; k++) {
                if (Math.abs(seq.valueAt(kept[k]) - value) <= epsilon) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                kept[count++] = i;
            }
        }

        return seq.select(Arrays.copyOf(kept, count));
    }

    private static DoubleSequence map(NumericSequence seq, DoubleUnaryOperator op) {
        double[] out = new double[seq.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = op.applyAsDouble(seq.valueAt(i));
        }
        return DoubleSequence.wrap(out);
    }
}
