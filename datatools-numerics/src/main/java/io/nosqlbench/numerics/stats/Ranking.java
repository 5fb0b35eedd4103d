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

import io.nosqlbench.numerics.sequence.IntSequence;
import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SequenceChecks;

import java.util.Arrays;
import java.util.Comparator;

/// Ranking of sequence values.
public final class Ranking {

    private Ranking() {} // Utility class

    /// Pairs each value with its index, sorts the pairs ascending by value
    /// with a stable sort, and returns the indices in sorted order.
    ///
    /// The result is a permutation of `0..n-1` such that
    /// `x[r[0]] <= x[r[1]] <= ...`. Equal values keep their original order
    /// and are not averaged. Integral values are compared exactly, so
    /// `long` values beyond 2^53 still sort correctly.
    ///
    /// ```java
    /// Ranking.rankdata(NumericSequence.of(30, 10, 20)); // INT[1, 2, 0]
    /// ```
    ///
    /// @param x values to rank
    /// @return the sorting permutation of `x`
    public static IntSequence rankdata(NumericSequence x) {
        SequenceChecks.requireNonNull(x);
        Integer[] order = new Integer[x.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Object sort is stable
        Comparator<Integer> byValue = x.type().isIntegral()
            ? (a, b) -> Long.compare(x.longValueAt(a), x.longValueAt(b))
            : (a, b) -> Double.compare(x.valueAt(a), x.valueAt(b));
        Arrays.sort(order, byValue);

        int[] ranks = new int[order.length];
        for (int i = 0; i < ranks.length; i++) {
            ranks[i] = order[i];
        }
        return IntSequence.wrap(ranks);
    }
}
