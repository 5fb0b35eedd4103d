package io.nosqlbench.numerics.sequence;

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

import java.util.Objects;

/// Eager precondition checks shared by the maths, stats and regression packages.
///
/// Each check runs at the entry of the operation that first needs it, before
/// any computation, and names that operation in its message.
public final class SequenceChecks {

    private SequenceChecks() {} // Utility class

    /// @return `x`, after checking it is not null
    public static NumericSequence requireNonNull(NumericSequence x) {
        return Objects.requireNonNull(x, "sequence cannot be null");
    }

    /// Checks that `x` holds at least one element.
    ///
    /// @throws InsufficientDataException if `x` is empty
    public static NumericSequence requireNonEmpty(NumericSequence x, String operation) {
        return requireMinimumSize(x, 1, operation);
    }

    /// Checks that `x` holds at least `minimum` elements.
    ///
    /// @throws InsufficientDataException if `x` is shorter
    public static NumericSequence requireMinimumSize(NumericSequence x, int minimum, String operation) {
        requireNonNull(x);
        if (x.size() < minimum) {
            throw new InsufficientDataException(operation, x.size(), minimum);
        }
        return x;
    }

    /// Checks that `x` and `y` have the same length.
    ///
    /// @throws SizeMismatchException if they differ
    public static void requireSameSize(NumericSequence x, NumericSequence y, String operation) {
        requireNonNull(x);
        requireNonNull(y);
        if (x.size() != y.size()) {
            throw new SizeMismatchException(operation, x.size(), y.size());
        }
    }

    /// Checks a degrees-of-freedom offset.
    ///
    /// @throws IllegalArgumentException if `ddof` is negative
    public static int requireNonNegativeDdof(int ddof) {
        if (ddof < 0) {
            throw new IllegalArgumentException("ddof must be non-negative, got " + ddof);
        }
        return ddof;
    }
}
