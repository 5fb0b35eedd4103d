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

import io.nosqlbench.numerics.maths.InvalidValueException;
import io.nosqlbench.numerics.sequence.InsufficientDataException;
import io.nosqlbench.numerics.sequence.NumericSequence;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class StatisticsTest {

    private static final NumericSequence ONE_TO_FIVE = NumericSequence.of(1, 2, 3, 4, 5);

    @Test
    void testMean() {
        assertEquals(3.0, Statistics.mean(ONE_TO_FIVE), 1e-12);
        assertEquals(2.5, Statistics.mean(NumericSequence.of(2.5f)), 1e-12);
        assertThrows(InsufficientDataException.class, () -> Statistics.mean(NumericSequence.of(new double[0])));
    }

    @Test
    void testHarmonicMean() {
        assertEquals(3.0 / 1.75, Statistics.hmean(NumericSequence.of(1, 2, 4)), 1e-12);
        assertThrows(InvalidValueException.class, () -> Statistics.hmean(NumericSequence.of(1, 0, 2)));
        assertThrows(InsufficientDataException.class, () -> Statistics.hmean(NumericSequence.of(new double[0])));
    }

    @Test
    void testGeometricMean() {
        assertEquals(2.0, Statistics.gmean(NumericSequence.of(1, 2, 4)), 1e-12);
        assertThrows(InvalidValueException.class, () -> Statistics.gmean(NumericSequence.of(1, -2, 4)));
    }

    @Test
    void testPowerMean() {
        NumericSequence x = NumericSequence.of(1, 2, 4);

        assertEquals(Statistics.mean(x), Statistics.pmean(x, 1), 1e-12);
        assertEquals(Math.sqrt(21.0 / 3.0), Statistics.pmean(x, 2), 1e-12);
        assertEquals(Statistics.hmean(x), Statistics.pmean(x, -1), 1e-12);
        assertEquals(Statistics.gmean(x), Statistics.pmean(x, 0), 1e-12);
    }

    @Test
    void testPowerMeansAreOrdered() {
        NumericSequence x = NumericSequence.of(0.5, 3.0, 7.0, 11.0);

        double h = Statistics.hmean(x);
        double g = Statistics.gmean(x);
        double a = Statistics.mean(x);
        double q = Statistics.pmean(x, 2);

        assertTrue(h <= g && g <= a && a <= q, "Expected hmean <= gmean <= mean <= pmean(2)");
    }

    @Test
    void testVariance() {
        assertEquals(2.0, Statistics.var(ONE_TO_FIVE), 1e-12);
        assertEquals(2.5, Statistics.var(ONE_TO_FIVE, 1), 1e-12);
        assertEquals(Math.sqrt(2.0), Statistics.std(ONE_TO_FIVE), 1e-12);
        assertEquals(Math.sqrt(2.5), Statistics.std(ONE_TO_FIVE, 1), 1e-12);
        assertEquals(0.0, Statistics.var(NumericSequence.of(7, 7, 7)), 1e-12);
    }

    @Test
    void testVarianceRejectsDegenerateInput() {
        assertThrows(InsufficientDataException.class, () -> Statistics.var(NumericSequence.of(5)));

        DegenerateDivisionException ex = assertThrows(DegenerateDivisionException.class,
            () -> Statistics.var(NumericSequence.of(1, 2), 2));
        assertEquals("var", ex.getOperation());
        assertEquals(2, ex.getSampleSize());
        assertEquals(2, ex.getDdof());

        assertThrows(IllegalArgumentException.class, () -> Statistics.var(ONE_TO_FIVE, -1));
    }

    @Test
    void testHarmonicAndGeometricStd() {
        assertEquals(3.20713, Statistics.hstd(NumericSequence.of(1, 2, 4)), 1e-4);
        assertEquals(Math.exp(Math.sqrt(2.0 / 3.0)),
            Statistics.gstd(NumericSequence.of(1.0, Math.E, Math.E * Math.E)), 1e-9);
        assertThrows(InvalidValueException.class, () -> Statistics.gstd(NumericSequence.of(1, 0, 2)));
    }

    @Test
    void testSkewness() {
        assertEquals(0.0, Statistics.skewness(ONE_TO_FIVE), 1e-12);
        assertTrue(Statistics.skewness(NumericSequence.of(1, 2, 10)) > 0);
        assertTrue(Statistics.skewness(NumericSequence.of(-10, 2, 1)) < 0);
        assertThrows(InsufficientDataException.class, () -> Statistics.skewness(NumericSequence.of(1)));
    }

    @Test
    void testKurtosisIsNotExcess() {
        assertEquals(1.7, Statistics.kurtosis(ONE_TO_FIVE), 1e-12);
        assertThrows(InsufficientDataException.class, () -> Statistics.kurtosis(NumericSequence.of(1)));
    }

    @Test
    void testShapeOfConstantInputIsNaN() {
        assertTrue(Double.isNaN(Statistics.skewness(NumericSequence.of(4, 4, 4))));
        assertTrue(Double.isNaN(Statistics.kurtosis(NumericSequence.of(4, 4, 4))));
    }

    @Test
    void testGaussianShape() {
        Random random = new Random(12345);
        double[] values = new double[20000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian();
        }
        NumericSequence x = NumericSequence.of(values);

        assertEquals(0.0, Statistics.skewness(x), 0.1);
        assertEquals(3.0, Statistics.kurtosis(x), 0.15);
    }

    @Test
    void testMedian() {
        assertEquals(2.5, Statistics.median(NumericSequence.of(1, 3, 2, 4)), 1e-12);
        assertEquals(2.0, Statistics.median(NumericSequence.of(1, 3, 2)), 1e-12);
        assertEquals(9.0, Statistics.median(NumericSequence.of(9L)), 1e-12);
        assertThrows(InsufficientDataException.class, () -> Statistics.median(NumericSequence.of(new double[0])));
    }

    @Test
    void testMedianDoesNotReorderInput() {
        double[] values = {5, 1, 4};
        NumericSequence x = NumericSequence.of(values);
        Statistics.median(x);

        assertArrayEquals(values, x.toDoubleArray());
    }

    @Test
    void testMedianAbsDeviation() {
        NumericSequence withOutlier = NumericSequence.of(1, 2, 3, 4, 100);

        assertEquals(1.0, Statistics.medianAbsDeviation(withOutlier), 1e-12);
        assertEquals(Statistics.MAD_NORMAL_SCALE, Statistics.medianAbsDeviation(withOutlier, true), 1e-12);
        assertEquals(0.0, Statistics.medianAbsDeviation(NumericSequence.of(3, 3, 3)), 1e-12);
    }

    @Test
    void testDescribe() {
        DescriptiveSummary summary = Statistics.describe(ONE_TO_FIVE, 1);

        assertEquals(5, summary.count());
        assertEquals(1.0, summary.min(), 1e-12);
        assertEquals(5.0, summary.max(), 1e-12);
        assertEquals(4.0, summary.range(), 1e-12);
        assertEquals(3.0, summary.mean(), 1e-12);
        assertEquals(2.5, summary.variance(), 1e-12);
        assertEquals(Math.sqrt(2.5), summary.stdDev(), 1e-12);
        assertEquals(1, summary.ddof());
        assertEquals(0.0, summary.skewness(), 1e-12);
        assertEquals(1.7, summary.kurtosis(), 1e-12);
        assertEquals(-1.3, summary.excessKurtosis(), 1e-12);
    }

    @Test
    void testDescribeAgreesWithSingleStatistics() {
        Random random = new Random(42);
        double[] values = new double[500];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble() * 10 - 3;
        }
        NumericSequence x = NumericSequence.of(values);
        DescriptiveSummary summary = Statistics.describe(x);

        assertEquals(Statistics.mean(x), summary.mean(), 1e-9);
        assertEquals(Statistics.var(x), summary.variance(), 1e-9);
        assertEquals(Statistics.skewness(x), summary.skewness(), 1e-9);
        assertEquals(Statistics.kurtosis(x), summary.kurtosis(), 1e-9);
        assertEquals(0, summary.ddof());
    }

    @Test
    void testDescribeRejectsDegenerateInput() {
        assertThrows(InsufficientDataException.class, () -> Statistics.describe(NumericSequence.of(1.0)));
        assertThrows(DegenerateDivisionException.class, () -> Statistics.describe(NumericSequence.of(1, 2), 3));
    }
}
