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

import io.nosqlbench.numerics.maths.Maths;
import io.nosqlbench.numerics.sequence.DoubleSequence;
import io.nosqlbench.numerics.sequence.NumericSequence;

/**
 * Centering and standard-score transformations.
 *
 * <p>Each function returns a new {@link DoubleSequence} of the input length.
 */
public final class Transformations {

    private Transformations() {
        // Utility class
    }

    /**
     * Subtracts the mean from every element.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} is empty
     */
    public static DoubleSequence center(NumericSequence x) {
        double mean = Statistics.mean(x);
        return Maths.linear(x, 1.0, -mean);
    }

    public static DoubleSequence zscore(NumericSequence x) {
        return zscore(x, 0);
    }

    /**
     * Standard scores, {@code (x - mean) / std(x, ddof)}.
     *
     * <p>An exactly constant sequence has a zero standard deviation, so every
     * score is NaN.
     *
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if {@code x} has fewer than two values
     * @throws DegenerateDivisionException if {@code n - ddof <= 0}
     */
    public static DoubleSequence zscore(NumericSequence x, int ddof) {
        Statistics.requireDispersionInput(x, ddof, "zscore");
        DoubleSequence centered = center(x);
        double sxx = Maths.dot(centered, centered);
        double std = Math.sqrt(sxx / (x.size() - ddof));

        double[] z = new double[centered.size()];
        for (int i = 0; i < z.length; i++) {
            z[i] = centered.valueAt(i) / std;
        }
        return DoubleSequence.wrap(z);
    }

    public static DoubleSequence gzscore(NumericSequence x) {
        return gzscore(x, 0);
    }

    /**
     * Geometric standard scores, the z-scores of {@code log(x)}.
     *
     * @throws io.nosqlbench.numerics.maths.InvalidValueException if any element is not strictly positive
     */
    public static DoubleSequence gzscore(NumericSequence x, int ddof) {
        return zscore(Maths.log(x), ddof);
    }
}
