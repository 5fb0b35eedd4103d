package io.nosqlbench.numerics.stats;

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

import io.nosqlbench.numerics.maths.InvalidValueException;
import io.nosqlbench.numerics.maths.Maths;
import io.nosqlbench.numerics.sequence.DoubleSequence;
import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SequenceChecks;

import java.util.Arrays;

/**
 * Summary statistics over a {@link NumericSequence}.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>means</b> - arithmetic, harmonic, geometric and power means</li>
 *   <li><b>dispersion</b> - variance and standard deviation, with harmonic
 *       and geometric standard deviations</li>
 *   <li><b>shape</b> - skewness and raw (non-excess) kurtosis</li>
 *   <li><b>robust</b> - median and median absolute deviation</li>
 * </ul>
 *
 * <p>Every input is promoted to {@code double}. Dispersion functions take a
 * degrees-of-freedom offset {@code ddof}: 0 for population statistics, 1 for
 * sample statistics.
 *
 * <h2>Failures</h2>
 *
 * <p>Size and domain preconditions are checked before any computation.
 * Shape statistics of a constant sequence are {@code NaN} rather than an
 * error.
 *
 * @see Transformations
 * @see Correlation
 */
public final class Statistics {

    /**
     * Scale factor making the median absolute deviation a consistent
     * estimator of the standard deviation for normal data.
     */
    public static final double MAD_NORMAL_SCALE = 1.4826;

    private Statistics() {
        // Utility class
    }

    // ========== Means ==========

    /**
     * Arithmetic mean.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     */
    public static double mean(NumericSequence x) {
        SequenceChecks.requireNonEmpty(x, "mean");
        return Maths.sum(x) / x.size();
    }

    /**
     * Harmonic mean, {@code n / Σ(1/x)}.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     * @throws InvalidValueException if any element is zero
     */
    public static double hmean(NumericSequence x) {
        SequenceChecks.requireNonEmpty(x, "hmean");
        DoubleSequence reciprocals = Maths.reciprocal(x);
        return x.size() / Maths.sum(reciprocals);
    }

    /**
     * Geometric mean, {@code (Πx)^(1/n)}. The product is not rescaled, so
     * long sequences of large values can overflow.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     * @throws InvalidValueException if any element is not strictly positive
     */
    public static double gmean(NumericSequence x) {
        SequenceChecks.requireNonEmpty(x, "gmean");
        requirePositive(x, "gmean");
        return Math.pow(Maths.prod(x), 1.0 / x.size());
    }

    /**
     * Power mean, {@code (Σx^p / n)^(1/p)}. A power of 0 is the limiting
     * case and returns {@link #gmean}.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     * @throws InvalidValueException if any element is not strictly positive
     */
    public static double pmean(NumericSequence x, double p) {
        SequenceChecks.requireNonEmpty(x, "pmean");
        requirePositive(x, "pmean");
        if (p == 0.0) {
            return gmean(x);
        }
        double meanOfPowers = Maths.sum(Maths.power(x, p)) / x.size();
        return Math.pow(meanOfPowers, 1.0 / p);
    }

    // ========== Dispersion ==========

    /**
     * Population variance.
     *
     * @see #var(NumericSequence, int)
     */
    public static double var(NumericSequence x) {
        return var(x, 0);
    }

    /**
     * Variance, {@code Σ(x - mean)² / (n - ddof)}.
     *
     * @param x at least two values
     * @param ddof degrees-of-freedom offset, non-negative
     * @return the variance
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} has fewer than two values
     * @throws DegenerateDivisionException if {@code n - ddof <= 0}
     */
    public static double var(NumericSequence x, int ddof) {
        requireDispersionInput(x, ddof, "var");
        DoubleSequence centered = Transformations.center(x);
        double sxx = Maths.dot(centered, centered);
        return sxx / (x.size() - ddof);
    }

    public static double std(NumericSequence x) {
        return std(x, 0);
    }

    /**
     * Standard deviation, the square root of {@link #var(NumericSequence, int)}.
     */
    public static double std(NumericSequence x, int ddof) {
        return Math.sqrt(var(x, ddof));
    }

    public static double hstd(NumericSequence x) {
        return hstd(x, 0);
    }

    /**
     * Harmonic standard deviation, {@code 1 / std(1/x)}.
     *
     * @throws InvalidValueException if any element is zero
     */
    public static double hstd(NumericSequence x, int ddof) {
        return 1.0 / std(Maths.reciprocal(x), ddof);
    }

    public static double gstd(NumericSequence x) {
        return gstd(x, 0);
    }

    /**
     * Geometric standard deviation, {@code exp(std(log x))}.
     *
     * @throws InvalidValueException if any element is not strictly positive
     */
    public static double gstd(NumericSequence x, int ddof) {
        return Math.exp(std(Maths.log(x), ddof));
    }

    // ========== Shape ==========

    /**
     * Skewness, {@code Σd³·√n / (Σd²)^1.5} with {@code d = x - mean}.
     * Zero for symmetric data, NaN for constant data.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} has fewer than two values
     */
    public static double skewness(NumericSequence x) {
        SequenceChecks.requireMinimumSize(x, 2, "skewness");
        DoubleSequence centered = Transformations.center(x);
        double m2 = 0;
        double m3 = 0;
        for (int i = 0; i < centered.size(); i++) {
            double d = centered.valueAt(i);
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
        }
        return m3 * Math.sqrt(x.size()) / Math.pow(m2, 1.5);
    }

    /**
     * Raw kurtosis, {@code Σd⁴·n / (Σd²)²}, without the -3 excess offset.
     * A normal distribution has kurtosis 3.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} has fewer than two values
     */
    public static double kurtosis(NumericSequence x) {
        SequenceChecks.requireMinimumSize(x, 2, "kurtosis");
        DoubleSequence centered = Transformations.center(x);
        double m2 = 0;
        double m4 = 0;
        for (int i = 0; i < centered.size(); i++) {
            double d2 = centered.valueAt(i) * centered.valueAt(i);
            m2 += d2;
            m4 += d2 * d2;
        }
        return m4 * x.size() / (m2 * m2);
    }

    // ========== Robust statistics ==========

    /**
     * Median of a sorted copy. An even count averages the two middle values.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     */
    public static double median(NumericSequence x) {
        SequenceChecks.requireNonEmpty(x, "median");
        double[] sorted = x.toDoubleArray();
        Arrays.sort(sorted);

        int size = sorted.length;
        if (size % 2 == 0) {
            return (sorted[size / 2 - 1] + sorted[size / 2]) / 2;
        }
        return sorted[size / 2];
    }

    public static double medianAbsDeviation(NumericSequence x) {
        return medianAbsDeviation(x, false);
    }

    /**
     * Median absolute deviation, {@code median(|x - median(x)|)}.
     *
     * @param x input values
     * @param rescaled multiply by {@link #MAD_NORMAL_SCALE} for consistency with
     *                 the standard deviation of normal data
     * @return the median absolute deviation
     */
    public static double medianAbsDeviation(NumericSequence x, boolean rescaled) {
        double med = median(x);
        NumericSequence deviations = Maths.absolute(Maths.linear(x, 1.0, -med));
        double mad = median(deviations);
        return rescaled ? mad * MAD_NORMAL_SCALE : mad;
    }

    // ========== Summary ==========

    /**
     * Population summary of {@code x}.
     *
     * @see #describe(NumericSequence, int)
     */
    public static DescriptiveSummary describe(NumericSequence x) {
        return describe(x, 0);
    }

    /**
     * Computes count, range, mean, variance and shape statistics in two passes.
     *
     * @param x at least two values
     * @param ddof degrees-of-freedom offset applied to the variance only
     * @return the summary
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} has fewer than two values
     * @throws DegenerateDivisionException if {@code n - ddof <= 0}
     */
    public static DescriptiveSummary describe(NumericSequence x, int ddof) {
        requireDispersionInput(x, ddof, "describe");
        int count = x.size();

        // First pass: min, max, mean
        double min = x.valueAt(0);
        double max = x.valueAt(0);
        double sum = 0;
        for (int i = 0; i < count; i++) {
            double v = x.valueAt(i);
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double mean = sum / count;

        // Second pass: central moments
        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (int i = 0; i < count; i++) {
            double d = x.valueAt(i) - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }

        double variance = m2 / (count - ddof);
        double skewness = m3 * Math.sqrt(count) / Math.pow(m2, 1.5);
        double kurtosis = m4 * count / (m2 * m2);

        return new DescriptiveSummary(count, min, max, mean, variance, ddof, skewness, kurtosis);
    }

    static void requireDispersionInput(NumericSequence x, int ddof, String operation) {
        SequenceChecks.requireNonNegativeDdof(ddof);
        SequenceChecks.requireMinimumSize(x, 2, operation);
        if (x.size() - ddof <= 0) {
            throw new DegenerateDivisionException(operation, x.size(), ddof);
        }
    }

    private static void requirePositive(NumericSequence x, String operation) {
        if (!Maths.isPositive(x)) {
            throw new InvalidValueException(operation, "Input contains non-positive values");
        }
    }
}
