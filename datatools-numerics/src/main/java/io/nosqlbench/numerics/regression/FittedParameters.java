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

/// Parameters of a fitted single-feature model, `coeff * x + intercept`.
///
/// Estimators publish one instance at the end of a successful fit, so both
/// values always come from the same fit.
///
/// @param coeff the slope; NaN for a degenerate linear fit
/// @param intercept the intercept
public record FittedParameters(double coeff, double intercept) {

    /// Evaluates `coeff * x + intercept`.
    public double apply(double x) {
        return coeff * x + intercept;
    }

    @Override
    public String toString() {
        return String.format("FittedParameters[coeff=%.6f, intercept=%.6f]", coeff, intercept);
    }
}
