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

import io.nosqlbench.numerics.sequence.NumericSequence;

import java.util.Optional;

/// Common contract of the single-feature estimators.
///
/// ## Lifecycle
///
/// ```
/// new ──► unfit ──fit(x, y)──► fitted ──fit(x, y)──► fitted (overwritten)
/// ```
///
/// A fit that throws leaves the previous state in place. Reading an unfit
/// estimator throws [ModelNotFittedException].
///
/// ## Usage
///
/// ```java
/// Regressor model = new SimpleLinearRegression();
/// model.fit(x, y);
/// NumericSequence predicted = model.predict(xTest);
/// double quality = model.score(xTest, yTest);
/// ```
///
/// ## Thread Safety
///
/// Implementations are NOT thread-safe for `fit`: callers must serialize
/// fits on one instance. `predict`, `score` and the getters may run
/// concurrently with each other once no fit is in progress.
///
/// @see SimpleLinearRegression
/// @see SimpleLogisticRegression
public interface Regressor {

    /// Fits the model to training values `x` and targets `y`.
    ///
    /// @param x training values
    /// @param y target values, same length as `x`
    void fit(NumericSequence x, NumericSequence y);

    /// Predicts targets for `x`.
    ///
    /// @param x input values
    /// @return one prediction per input value
    /// @throws ModelNotFittedException if the model is not fitted
    NumericSequence predict(NumericSequence x);

    /// Scores predictions for `x` against `y`; higher is better.
    ///
    /// @param x test values
    /// @param y true targets, same length as `x`
    /// @return the model-specific score
    /// @throws ModelNotFittedException if the model is not fitted
    double score(NumericSequence x, NumericSequence y);

    /// @return the fitted parameters, or empty before the first successful fit
    Optional<FittedParameters> parameters();

    default boolean isFitted() {
        return parameters().isPresent();
    }

    /// @return the fitted slope
    /// @throws ModelNotFittedException if the model is not fitted
    default double getCoeff() {
        return parameters().orElseThrow(() -> new ModelNotFittedException(getClass())).coeff();
    }

    /// @return the fitted intercept
    /// @throws ModelNotFittedException if the model is not fitted
    default double getIntercept() {
        return parameters().orElseThrow(() -> new ModelNotFittedException(getClass())).intercept();
    }
}
