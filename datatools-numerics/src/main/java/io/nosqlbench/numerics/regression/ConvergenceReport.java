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

/**
 * Outcome of the last gradient-descent run of a {@link SimpleLogisticRegression}.
 *
 * @param iterations number of iterations that ran
 * @param converged whether both relative gradients fell under the threshold
 *                  before the iteration cap was reached
 * @param coeffGradient gradient of the slope in the final iteration
 * @param interceptGradient gradient of the intercept in the final iteration
 */
public record ConvergenceReport(int iterations, boolean converged, double coeffGradient, double interceptGradient) {

    @Override
    public String toString() {
        return String.format("ConvergenceReport[iterations=%d, converged=%s, dCoeff=%.6g, dIntercept=%.6g]",
            iterations, converged, coeffGradient, interceptGradient);
    }
}
