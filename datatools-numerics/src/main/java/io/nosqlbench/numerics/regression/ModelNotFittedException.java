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

/// Thrown when an estimator is asked for parameters, predictions or a score
/// before a successful call to `fit`.
public class ModelNotFittedException extends IllegalStateException {

    public ModelNotFittedException(Class<? extends Regressor> estimator) {
        super(estimator.getSimpleName() + " is not fitted yet; call fit before using this estimator");
    }
}
