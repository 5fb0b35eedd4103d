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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/// Centralized Gson configuration for estimator settings.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floating-point values | Allowed | NaN and Infinity round-trip |
/// | [LogisticRegressionConfig] adapter | Registered | snake_case fields, defaults for absent fields |
///
/// ## Thread Safety
///
/// The [Gson] instance is thread-safe and shared.
public final class NumericsGsonConfig {

    static final String LEARNING_RATE = "learning_rate";
    static final String GRADIENT_THRESHOLD = "gradient_threshold";
    static final String ITERATION_THRESHOLD = "iteration_threshold";

    private static final Gson INSTANCE = builder().create();

    private NumericsGsonConfig() {
        // Utility class
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the numerics defaults, for callers that
    /// need to customize the configuration further.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(LogisticRegressionConfig.class, new LogisticRegressionConfigAdapter().nullSafe());
    }

    /// Reads and writes [LogisticRegressionConfig] with snake_case names.
    /// Absent fields fall back to the defaults; unknown fields are rejected.
    static final class LogisticRegressionConfigAdapter extends TypeAdapter<LogisticRegressionConfig> {

        @Override
        public void write(JsonWriter out, LogisticRegressionConfig config) throws IOException {
            out.beginObject();
            out.name(LEARNING_RATE).value(config.learningRate());
            out.name(GRADIENT_THRESHOLD).value(config.gradientThreshold());
            out.name(ITERATION_THRESHOLD).value(config.iterationThreshold());
            out.endObject();
        }

        @Override
        public LogisticRegressionConfig read(JsonReader in) throws IOException {
            LogisticRegressionConfig.Builder builder = LogisticRegressionConfig.builder();
            in.beginObject();
            while (in.hasNext()) {
                String name = in.nextName();
                if (in.peek() == JsonToken.NULL) {
                    in.nextNull();
                    continue;
                }
                try {
                    switch (name) {
                        case LEARNING_RATE -> builder.learningRate(in.nextDouble());
                        case GRADIENT_THRESHOLD -> builder.gradientThreshold(in.nextDouble());
                        case ITERATION_THRESHOLD -> builder.iterationThreshold(in.nextInt());
                        default -> throw new JsonParseException(
                            "Unknown logistic regression parameter '" + name + "' at " + in.getPath());
                    }
                } catch (NumberFormatException | IllegalStateException e) {
                    throw new JsonParseException(
                        "Invalid value for logistic regression parameter '" + name + "' at " + in.getPath(), e);
                }
            }
            in.endObject();
            return builder.build();
        }
    }
}
