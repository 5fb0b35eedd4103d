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

import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SequenceChecks;

/// Classification metrics.
public final class Metrics {

    private Metrics() {} // Utility class

    /// Fraction of positions where the predicted label equals the true label.
    ///
    /// Labels compare by exact equality of their promoted values.
    ///
    /// @param yTrue ground-truth labels
    /// @param yPredicted predicted labels
    /// @return accuracy in [0, 1]
    /// @throws io.nosqlbench.numerics.sequence.SizeMismatchException if the lengths differ
    /// @throws io.nosqlbench.numerics.sequence.InsufficientDataException if the inputs are empty
    public static double accuracyScore(NumericSequence yTrue, NumericSequence yPredicted) {
        SequenceChecks.requireSameSize(yTrue, yPredicted, "accuracyScore");
        SequenceChecks.requireNonEmpty(yTrue, "accuracyScore");

        int matches = 0;
        for (int i = 0; i < yTrue.size(); i++) {
            if (yTrue.valueAt(i) == yPredicted.valueAt(i)) {
                matches++;
            }
        }
        return (double) matches / yTrue.size();
    }
}
