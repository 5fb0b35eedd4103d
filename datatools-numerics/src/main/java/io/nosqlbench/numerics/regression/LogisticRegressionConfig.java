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

/// Hyperparameters of [SimpleLogisticRegression].
///
/// ## Parameters
///
/// | Parameter | JSON name | Default | Range |
/// |-----------|-----------|---------|-------|
/// | learning rate | `learning_rate` | 0.001 | > 0 |
/// | relative gradient threshold | `gradient_threshold` | 0.01 | (0, 1) |
/// | iteration cap | `iteration_threshold` | 100 | > 0 |
///
/// Values are validated on construction, so an instance is always usable.
///
/// ## Usage
///
/// ```java
/// LogisticRegressionConfig config = LogisticRegressionConfig.builder()
///     .learningRate(0.01)
///     .iterationThreshold(500)
///     .build();
///
/// String json = config.toJson();
/// LogisticRegressionConfig restored = LogisticRegressionConfig.fromJson(json);
/// ```
///
/// @param learningRate step size of gradient descent
/// @param gradientThreshold relative gradient below which a parameter counts as converged
/// @param iterationThreshold maximum number of gradient-descent iterations
/// @see NumericsGsonConfig
public record LogisticRegressionConfig(double learningRate, double gradientThreshold, int iterationThreshold) {

    public static final double DEFAULT_LEARNING_RATE = 0.001;
    public static final double DEFAULT_GRADIENT_THRESHOLD = 0.01;
    public static final int DEFAULT_ITERATION_THRESHOLD = 100;

    /// Configuration with every default.
    public static final LogisticRegressionConfig DEFAULT = new LogisticRegressionConfig(
        DEFAULT_LEARNING_RATE, DEFAULT_GRADIENT_THRESHOLD, DEFAULT_ITERATION_THRESHOLD);

    /// @throws HyperparameterException if any value is out of range
    public LogisticRegressionConfig {
        validate(learningRate, gradientThreshold, iterationThreshold);
    }

    static void validate(double learningRate, double gradientThreshold, int iterationThreshold) {
        if (!(learningRate > 0) || Double.isInfinite(learningRate)) {
            throw new HyperparameterException("learning_rate", learningRate, "positive and finite");
        }
        if (!(gradientThreshold > 0 && gradientThreshold < 1)) {
            throw new HyperparameterException("gradient_threshold", gradientThreshold, "a fraction in (0, 1)");
        }
        if (iterationThreshold <= 0) {
            throw new HyperparameterException("iteration_threshold", iterationThreshold, "positive");
        }
    }

    /// Reads a configuration from JSON. Absent fields take their defaults.
    ///
    /// @param json a JSON object
    /// @return the configuration
    /// @throws HyperparameterException if a value is out of range
    /// @throws com.google.gson.JsonParseException if the JSON is malformed or has unknown fields
    public static LogisticRegressionConfig fromJson(String json) {
        return NumericsGsonConfig.gson().fromJson(json, LogisticRegressionConfig.class);
    }

    /// @return this configuration as a pretty-printed JSON object
    public String toJson() {
        return NumericsGsonConfig.gson().toJson(this, LogisticRegressionConfig.class);
    }

    /// @return a builder starting from the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder starting from this configuration
    public Builder toBuilder() {
        return new Builder()
            .learningRate(learningRate)
            .gradientThreshold(gradientThreshold)
            .iterationThreshold(iterationThreshold);
    }

    /// Fluent builder; validation happens in [#build()].
    public static final class Builder {
        private double learningRate = DEFAULT_LEARNING_RATE;
        private double gradientThreshold = DEFAULT_GRADIENT_THRESHOLD;
        private int iterationThreshold = DEFAULT_ITERATION_THRESHOLD;

        private Builder() {
        }

        public Builder learningRate(double learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder gradientThreshold(double gradientThreshold) {
            this.gradientThreshold = gradientThreshold;
            return this;
        }

        public Builder iterationThreshold(int iterationThreshold) {
            this.iterationThreshold = iterationThreshold;
            return this;
        }

        /// @throws HyperparameterException if any value is out of range
        public LogisticRegressionConfig build() {
            return new LogisticRegressionConfig(learningRate, gradientThreshold, iterationThreshold);
        }
    }
}
