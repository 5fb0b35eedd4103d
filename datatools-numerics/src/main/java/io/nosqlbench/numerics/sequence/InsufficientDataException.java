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

/// Thrown when a sequence is empty or too short for the requested computation.
public class InsufficientDataException extends IllegalArgumentException {

    private final String operation;
    private final int actualSize;
    private final int requiredSize;

    public InsufficientDataException(String operation, int actualSize, int requiredSize) {
        super(String.format("Input has not enough values for %s: %d < %d", operation, actualSize, requiredSize));
        this.operation = operation;
        this.actualSize = actualSize;
        this.requiredSize = requiredSize;
    }

    public String getOperation() {
        return operation;
    }

    public int getActualSize() {
        return actualSize;
    }

    /// @return the smallest size the operation accepts
    public int getRequiredSize() {
        return requiredSize;
    }
}
