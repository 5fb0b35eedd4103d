package io.nosqlbench.numerics.regression;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Simple linear regression by ordinary least squares.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The slope and intercept come from the closed-form normal equations:
 * <pre>
 * coeff     = (n·Sxy - Sx·Sy) / (n·Sxx - Sx²)
 * intercept = (Sy - coeff·Sx) / n
 * </pre>
 *
 * <p>A zero denominator (every {@code x} equal) makes the slope undefined;
 * the fit then stores {@code NaN} as the slope, and every prediction is NaN.
 *
 * <h2>Score</h2>
 *
 * <p>{@link #score} is the coefficient of determination
 * {@code R² = 1 - SSres/SStot}. {@code SStot} is computed from the targets
 * with the single-pass {@code Syy - Sy²/n} form; a constant target gives
 * {@code SStot = 0} and a NaN score.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe for {@link #fit}. See {@link Regressor}.
 *
 * @see SimpleLogisticRegression
 */
public class SimpleLinearRegression implements Regressor {

    private static final Logger logger = LogManager.getLogger(SimpleLinearRegression.class);

    private FittedParameters parameters;

    /**
     * Fits the slope and intercept.
     *
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if fewer than two points are given
     */
    @Override
    public void fit(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "fit");
        SequenceChecks.requireMinimumSize(x, 2, "fit");

        double sx = Maths.sum(x);
        double sy = Maths.sum(y);
        double sxx = Maths.dot(x, x);
        double sxy = Maths.dot(x, y);
        double size = x.size();
        double num = size * sxy - sx * sy;
        double denom = size * sxx - sx * sx;

        double coeff;
        if (denom != 0) {
            coeff = num / denom;
        } else {
            logger.warn("Degenerate linear fit over {} points: all x values are equal, slope is NaN", x.size());
            coeff = Double.NaN;
        }
        double intercept = (sy - coeff * sx) / size;

        parameters = new FittedParameters(coeff, intercept);
        logger.debug("Fitted {} over {} points", parameters, x.size());
    }

    /**
     * Predicts {@code coeff·x + intercept} for each input value.
     */
    @Override
    public DoubleSequence predict(NumericSequence x) {
        SequenceChecks.requireNonNull(x);
        FittedParameters fitted = requireFitted();
        return Maths.linear(x, fitted.coeff(), fitted.intercept());
    }

    /**
     * Returns the coefficient of determination of {@code predict(x)} against {@code y}.
     *
     * @return R², or NaN when {@code y} is constant
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the inputs are empty
     */
    @Override
    public double score(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "score");
        SequenceChecks.requireNonEmpty(x, "score");

        DoubleSequence yPredicted = predict(x);

        double ssres = 0;
        for (int i = 0; i < y.size(); i++) {
            double res = y.valueAt(i) - yPredicted.valueAt(i);
            ssres += res * res;
        }

        double sy = Maths.sum(y);
        double syy = Maths.dot(y, y);
        double sstot = syy - sy * sy / y.size();
        if (sstot == 0) {
            return Double.NaN;
        }
        return 1.0 - ssres / sstot;
    }

    @Override
    public Optional<FittedParameters> parameters() {
        return Optional.ofNullable(parameters);
    }

    private FittedParameters requireFitted() {
        FittedParameters fitted = parameters;
        if (fitted == null) {
            throw new ModelNotFittedException(getClass());
        }
        return fitted;
    }

    @Override
    public String toString() {
        return "SimpleLinearRegression[" + (parameters == null ? "unfit" : parameters) + "]";
    }
}
