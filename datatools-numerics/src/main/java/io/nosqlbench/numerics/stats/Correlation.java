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
import io.nosqlbench.numerics.sequence.SequenceChecks;

/**
 * Linear and rank-based correlation between two sequences.
 *
 * <p>Both coefficients lie in [-1, 1]. When either input has no variation
 * the coefficient is undefined and {@code NaN} is returned instead of an
 * exception, so callers must test the result with {@link Double#isNaN}.
 */
public final class Correlation {

    private Correlation() {
        // Utility class
    }

    /**
     * Pearson product-moment correlation coefficient.
     *
     * <pre>
     * r = Σ(x_c · y_c) / (‖x_c‖ · ‖y_c‖)
     * </pre>
     *
     * <p>where {@code x_c} and {@code y_c} are the centered inputs. The
     * result is clamped to [-1, 1] to absorb rounding.
     *
     * @return the coefficient, or NaN when the denominator is not positive
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the inputs are empty
     */
    public static double pearsonr(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "pearsonr");
        SequenceChecks.requireNonEmpty(x, "pearsonr");

        DoubleSequence xCentered = Transformations.center(x);
        DoubleSequence yCentered = Transformations.center(y);

        double sxx = Maths.dot(xCentered, xCentered);
        double syy = Maths.dot(yCentered, yCentered);
        double sxy = Maths.dot(xCentered, yCentered);

        double denom = Math.sqrt(sxx) * Math.sqrt(syy);
        if (!(denom > 0)) {
            return Double.NaN;
        }

        double r = sxy / denom;
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Rank-order correlation: {@link #pearsonr} applied to the outputs of
     * {@link Ranking#rankdata} for each input.
     *
     * <p>Ties are not averaged; see {@link Ranking#rankdata} for the exact
     * positions used.
     *
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the inputs are empty
     */
    public static double spearmanr(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "spearmanr");
        SequenceChecks.requireNonEmpty(x, "spearmanr");

        return pearsonr(Ranking.rankdata(x), Ranking.rankdata(y));
    }
}
