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

import io.nosqlbench.numerics.sequence.InsufficientDataException;
import io.nosqlbench.numerics.sequence.NumericSequence;
import io.nosqlbench.numerics.sequence.SizeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class CorrelationTest {

    @Test
    void testPerfectCorrelation() {
        NumericSequence x = NumericSequence.of(1, 2, 3, 4);

        assertEquals(1.0, Correlation.pearsonr(x, NumericSequence.of(3.0, 5.0, 7.0, 9.0)), 1e-12);
        assertEquals(-1.0, Correlation.pearsonr(x, NumericSequence.of(8, 6, 4, 2)), 1e-12);
    }

    @Test
    void testPearsonOnKnownData() {
        NumericSequence x = NumericSequence.of(1, 2, 3, 4, 5);
        NumericSequence y = NumericSequence.of(2, 1, 4, 3, 5);

        assertEquals(0.8, Correlation.pearsonr(x, y), 1e-12);
    }

    @Test
    void testPearsonIsBounded() {
        Random random = new Random(99);
        for (int trial = 0; trial < 50; trial++) {
            double[] xs = new double[20];
            double[] ys = new double[20];
            for (int i = 0; i < xs.length; i++) {
                xs[i] = random.nextGaussian();
                ys[i] = xs[i] * random.nextDouble() + random.nextGaussian();
            }
            double r = Correlation.pearsonr(NumericSequence.of(xs), NumericSequence.of(ys));
            assertTrue(r >= -1.0 && r <= 1.0, "r out of range: " + r);
        }
    }

    @Test
    void testConstantInputGivesNaN() {
        NumericSequence x = NumericSequence.of(1, 2, 3);

        assertTrue(Double.isNaN(Correlation.pearsonr(x, NumericSequence.of(5, 5, 5))));
        assertTrue(Double.isNaN(Correlation.pearsonr(NumericSequence.of(1), NumericSequence.of(2))));
    }

    @Test
    void testPearsonRejectsBadInput() {
        assertThrows(SizeMismatchException.class,
            () -> Correlation.pearsonr(NumericSequence.of(1, 2), NumericSequence.of(1, 2, 3)));
        assertThrows(InsufficientDataException.class,
            () -> Correlation.pearsonr(NumericSequence.of(new double[0]), NumericSequence.of(new double[0])));
    }

    @Test
    void testSpearmanOnMonotonicData() {
        NumericSequence x = NumericSequence.of(1, 2, 3, 4);

        assertEquals(1.0, Correlation.spearmanr(x, NumericSequence.of(1, 8, 27, 64)), 1e-12);
        assertEquals(-1.0, Correlation.spearmanr(x, NumericSequence.of(10.0, 1.0, 0.1, 0.01)), 1e-12);
    }

    @Test
    void testSpearmanRejectsMismatch() {
        assertThrows(SizeMismatchException.class,
            () -> Correlation.spearmanr(NumericSequence.of(1, 2), NumericSequence.of(1)));
    }
}
