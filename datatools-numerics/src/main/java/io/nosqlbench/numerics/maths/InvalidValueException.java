package io.nosqlbench.numerics.maths;

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

/// Thrown when an input violates the domain of an operation, such as a zero
/// passed to a reciprocal or a non-positive value passed to a logarithm.
public class InvalidValueException extends IllegalArgumentException {

    private final String operation;

    public InvalidValueException(String operation, String message) {
        super(message + " for " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
