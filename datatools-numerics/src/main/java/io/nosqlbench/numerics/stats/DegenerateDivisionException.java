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

/// Thrown when a denominator that must be positive is not, although every
/// input was individually valid. The usual cause is a degrees-of-freedom
/// offset that consumes the whole sample (`n - ddof <= 0`).
public class DegenerateDivisionException extends ArithmeticException {

    private final String operation;
    private final int sampleSize;
    private final int ddof;

    public DegenerateDivisionException(String operation, int sampleSize, int ddof) {
        super(String.format("Size minus degree of freedom is not positive for %s: %d - %d",
            operation, sampleSize, ddof));
        this.operation = operation;
        this.sampleSize = sampleSize;
        this.ddof = ddof;
    }

    public String getOperation() {
        return operation;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getDdof() {
        return ddof;
    }
}
