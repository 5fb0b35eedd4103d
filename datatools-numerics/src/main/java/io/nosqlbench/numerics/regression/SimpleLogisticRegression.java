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

import io.nosqlbench.numerics.maths.InvalidValueException;
import io.nosqlbench.numerics.maths.Maths;
import io.nosqlbench.numerics.sequence.IntSequence;
import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SequenceChecks;
import io.nosqlbench.numerics.stats.Metrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Binary logistic regression on a single feature, fitted by batch gradient descent.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Starting from {@code coeff = intercept = 0}, each iteration:
 * <ol>
 *   <li>labels every point with the current parameters
 *       ({@code sigmoid(coeff·x + intercept) >= 0.5})</li>
 *   <li>computes the residual {@code r = label - truth}</li>
 *   <li>computes the gradients {@code dCoeff = mean(x·r)} and {@code dIntercept = mean(r)}</li>
 *   <li>steps both parameters by {@code -learningRate·gradient}</li>
 * </ol>
 *
 * <p>The loop stops once both relative gradients
 * {@code |g| / max(|param|, 1e-8)} are at most the gradient threshold, or
 * when the iteration cap is reached. Either way the parameters reached are
 * kept; {@link #lastConvergence()} tells the two cases apart.
 *
 * <h2>Labels</h2>
 *
 * <p>Targets must contain both classes {@code 0} and {@code 1} and nothing
 * else. Predictions are an {@code INT} sequence of the same labels.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SimpleLogisticRegression model = new SimpleLogisticRegression(
 *     LogisticRegressionConfig.builder().learningRate(0.01).build());
 * model.fit(x, y);
 * IntSequence labels = model.predict(xTest);
 * double accuracy = model.score(xTest, yTest);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe for {@link #fit}. See {@link Regressor}.
 *
 * @see LogisticRegressionConfig
 * @see ConvergenceReport
 */
public class SimpleLogisticRegression implements Regressor {

    private static final Logger logger = LogManager.getLogger(SimpleLogisticRegression.class);

    /// Floor for the denominator of a relative gradient.
    static final double RELATIVE_GRADIENT_FLOOR = 1e-8;

    private final LogisticRegressionConfig config;

    private FittedParameters parameters;
    private ConvergenceReport convergence;

    /**
     * Creates an estimator with {@link LogisticRegressionConfig#DEFAULT}.
     */
    public SimpleLogisticRegression() {
        this(LogisticRegressionConfig.DEFAULT);
    }

    /**
     * Creates an estimator with the given hyperparameters.
     *
     * @param config the hyperparameters
     */
    public SimpleLogisticRegression(LogisticRegressionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Runs gradient descent on {@code x} and the binary labels {@code y}.
     *
     * <p>The new parameters and convergence report are published together once
     * the loop ends; a fit that throws leaves the previous state in place.
     *
     * @throws HyperparameterException if the configuration is out of range
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if fewer than two points are given
     * @throws InvalidValueException if {@code y} does not hold exactly the labels 0 and 1
     */
    @Override
    public void fit(NumericSequence x, NumericSequence y) {
        LogisticRegressionConfig.validate(
            config.learningRate(), config.gradientThreshold(), config.iterationThreshold());
        SequenceChecks.requireSameSize(x, y, "fit");
        SequenceChecks.requireMinimumSize(x, 2, "fit");
        requireBinaryLabels(y);

        int size = x.size();
        double learningRate = config.learningRate();
        double threshold = config.gradientThreshold();
        int maxIterations = config.iterationThreshold();

        logger.debug("Fitting logistic regression over {} points with {}", size, config);

        double coeff = 0.0;
        double intercept = 0.0;
        double dCoeff = 0.0;
        double dIntercept = 0.0;
        boolean converged = false;
        int iteration = 0;

        while (!converged && iteration < maxIterations) {
            iteration++;

            double sumXr = 0.0;
            double sumR = 0.0;
            for (int i = 0; i < size; i++) {
                double xi = x.valueAt(i);
                double residual = label(coeff * xi + intercept) - y.valueAt(i);
                sumXr += xi * residual;
                sumR += residual;
            }
            dCoeff = sumXr / size;
            dIntercept = sumR / size;

            coeff -= learningRate * dCoeff;
            intercept -= learningRate * dIntercept;

            converged = relativeGradient(dCoeff, coeff) <= threshold
                && relativeGradient(dIntercept, intercept) <= threshold;

            logger.trace("Iteration {}: coeff={}, intercept={}, dCoeff={}, dIntercept={}",
                iteration, coeff, intercept, dCoeff, dIntercept);
        }

        parameters = new FittedParameters(coeff, intercept);
        convergence = new ConvergenceReport(iteration, converged, dCoeff, dIntercept);

        if (converged) {
            logger.debug("Converged after {} iterations: {}", iteration, parameters);
        } else {
            logger.warn("Logistic regression did not converge within {} iterations "
                    + "(dCoeff={}, dIntercept={}); keeping {}",
                maxIterations, dCoeff, dIntercept, parameters);
        }
    }

    /**
     * Predicts a {@code 0}/{@code 1} label for each input value.
     */
    @Override
    public IntSequence predict(NumericSequence x) {
        SequenceChecks.requireNonNull(x);
        FittedParameters fitted = requireFitted();
        int[] labels = new int[x.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = label(fitted.apply(x.valueAt(i)));
        }
        return IntSequence.wrap(labels);
    }

    /**
     * Returns the accuracy of {@code predict(x)} against {@code y}.
     *
     * @return the fraction of correctly labelled points
     * @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
     * @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the inputs are empty
     */
    @Override
    public double score(NumericSequence x, NumericSequence y) {
        SequenceChecks.requireSameSize(x, y, "score");
        return Metrics.accuracyScore(y, predict(x));
    }

    @Override
    public Optional<FittedParameters> parameters() {
        return Optional.ofNullable(parameters);
    }

    /// @return the report of the most recent successful fit, or empty before the first one
    public Optional<ConvergenceReport> lastConvergence() {
        return Optional.ofNullable(convergence);
    }

    public LogisticRegressionConfig getConfig() {
        return config;
    }

    private static int label(double z) {
        return Maths.sigmoid(z) >= 0.5 ? 1 : 0;
    }

    private static double relativeGradient(double gradient, double parameter) {
        return Math.abs(gradient) / Math.max(Math.abs(parameter), RELATIVE_GRADIENT_FLOOR);
    }

    private static void requireBinaryLabels(NumericSequence y) {
        NumericSequence labels = Maths.set(y);
        boolean binary = labels.size() == 2;
        for (int i = 0; binary && i < labels.size(); i++) {
            double label = labels.valueAt(i);
            binary = label == 0.0 || label == 1.0;
        }
        if (!binary) {
            throw new InvalidValueException("fit",
                "Labels must be exactly the two classes 0 and 1, got distinct values " + labels);
        }
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
        return "SimpleLogisticRegression[" + (parameters == null ? "unfit" : parameters) + ", " + config + "]";
    }
}
