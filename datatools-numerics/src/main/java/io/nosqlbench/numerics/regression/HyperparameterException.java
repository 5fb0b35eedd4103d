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

/// Thrown when an estimator hyperparameter is outside its allowed range.
public class HyperparameterException extends IllegalArgumentException {

    private final String parameter;
    private final double value;

    public HyperparameterException(String parameter, double value, String constraint) {
        super(String.format("Parameter %s must be %s, got %s", parameter, constraint, value));
        this.parameter = parameter;
        this.value = value;
    }

    /// @return the name of the offending parameter
    public String getParameter() {
        return parameter;
    }

    public double getValue() {
        return value;
    }
}
