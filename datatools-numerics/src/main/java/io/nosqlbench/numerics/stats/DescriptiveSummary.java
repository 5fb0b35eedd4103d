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

/// Descriptive statistics of one sequence, computed by [Statistics#describe].
///
/// Skewness and kurtosis use the same population formulas as
/// [Statistics#skewness] and [Statistics#kurtosis] regardless of `ddof`;
/// only the variance honors the offset.
///
/// @param count number of observations
/// @param min smallest observed value
/// @param max largest observed value
/// @param mean arithmetic mean
/// @param variance variance with the `ddof` offset
/// @param ddof degrees-of-freedom offset used for the variance
/// @param skewness asymmetry measure (0 = symmetric)
/// @param kurtosis raw kurtosis (3 = normal)
public record DescriptiveSummary(
    int count,
    double min,
    double max,
    double mean,
    double variance,
    int ddof,
    double skewness,
    double kurtosis
) {

    /// Returns the standard deviation.
    public double stdDev() {
        return Math.sqrt(variance);
    }

    /// Returns the range (max - min).
    public double range() {
        return max - min;
    }

    /// Returns the excess kurtosis (kurtosis - 3).
    public double excessKurtosis() {
        return kurtosis - 3;
    }

    @Override
    public String toString() {
        return String.format(
            "DescriptiveSummary[n=%d, range=[%.4f, %.4f], mean=%.4f, stdDev=%.4f, ddof=%d, skew=%.4f, kurt=%.4f]",
            count, min, max, mean, stdDev(), ddof, skewness, kurtosis);
    }
}
