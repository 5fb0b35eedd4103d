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

/// Thrown when two sequences that are processed element-wise differ in length.
public class SizeMismatchException extends IllegalArgumentException {

    private final String operation;
    private final int leftSize;
    private final int rightSize;

    public SizeMismatchException(String operation, int leftSize, int rightSize) {
        super(String.format("Inputs have not the same size for %s: %d != %d", operation, leftSize, rightSize));
        this.operation = operation;
        this.leftSize = leftSize;
        this.rightSize = rightSize;
    }

    public String getOperation() {
        return operation;
    }

    public int getLeftSize() {
        return leftSize;
    }

    public int getRightSize() {
        return rightSize;
    }
}
