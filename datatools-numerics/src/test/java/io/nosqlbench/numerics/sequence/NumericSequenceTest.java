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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NumericSequenceTest {

    @Test
    void testFactoriesPickElementType() {
        assertEquals(NumericType.DOUBLE, NumericSequence.of(1.0, 2.0).type());
        assertEquals(NumericType.FLOAT, NumericSequence.of(1f, 2f).type());
        assertEquals(NumericType.INT, NumericSequence.of(1, 2).type());
        assertEquals(NumericType.LONG, NumericSequence.of(1L, 2L).type());
        assertEquals(NumericType.INT, NumericSequence.of((short) 1, (short) 2).type());
        assertEquals(NumericType.INT, NumericSequence.of((byte) 1, (byte) 2).type());
    }

    @Test
    void testFactoryCopiesInput() {
        double[] values = {1.0, 2.0, 3.0};
        NumericSequence seq = NumericSequence.of(values);
        values[0] = 99.0;

        assertEquals(1.0, seq.valueAt(0));
    }

    @Test
    void testWrapSharesInput() {
        int[] values = {1, 2, 3};
        IntSequence seq = IntSequence.wrap(values);
        values[0] = 99;

        assertEquals(99, seq.intAt(0));
    }

    @Test
    void testToIntArrayReturnsCopy() {
        IntSequence seq = IntSequence.wrap(new int[]{4, 5});
        int[] copy = seq.toIntArray();
        copy[0] = 0;

        assertEquals(4, seq.intAt(0));
    }

    @Test
    void testBoxedCollectionPromotesMixedTypes() {
        assertEquals(NumericType.INT, NumericSequence.of(List.of(1, 2, 3)).type());
        assertEquals(NumericType.LONG, NumericSequence.of(List.<Number>of(1, 2L)).type());
        assertEquals(NumericType.DOUBLE, NumericSequence.of(List.<Number>of(1, 2.5f)).type());
        assertEquals(NumericType.DOUBLE, NumericSequence.of(new ArrayList<Integer>()).type());
    }

    @Test
    void testBoxedCollectionIsSnapshot() {
        List<Double> source = new ArrayList<>(List.of(1.0, 2.0));
        NumericSequence seq = NumericSequence.of(source);
        source.add(3.0);

        assertEquals(2, seq.size());
    }

    @Test
    void testNullElementRejected() {
        List<Integer> source = new ArrayList<>();
        source.add(1);
        source.add(null);

        assertThrows(NullPointerException.class, () -> NumericSequence.of(source));
    }

    @Test
    void testNullArrayRejected() {
        double[] values = null;
        assertThrows(NullPointerException.class, () -> NumericSequence.of(values));
    }

    @Test
    void testSelectKeepsType() {
        NumericSequence seq = NumericSequence.of(10L, 20L, 30L);
        NumericSequence selected = seq.select(new int[]{2, 0});

        assertEquals(NumericType.LONG, selected.type());
        assertEquals(NumericSequence.of(30L, 10L), selected);
    }

    @Test
    void testLongValuesKeepPrecision() {
        long big = (1L << 60) + 1;
        NumericSequence seq = NumericSequence.of(big);

        assertEquals(big, seq.longValueAt(0));
    }

    @Test
    void testEqualityRequiresSameType() {
        assertEquals(NumericSequence.of(1, 2), NumericSequence.of(List.of(1, 2)));
        assertEquals(NumericSequence.of(1, 2).hashCode(), NumericSequence.of(List.of(1, 2)).hashCode());
        assertNotEquals(NumericSequence.of(1, 2), NumericSequence.of(1.0, 2.0));
        assertEquals(NumericSequence.of(Double.NaN), NumericSequence.of(Double.NaN));
    }

    @Test
    void testToString() {
        assertEquals("INT[1, 2]", NumericSequence.of(1, 2).toString());
        assertEquals("DOUBLE[0.5]", NumericSequence.of(0.5).toString());
    }

    @Test
    void testDoublesAndArrays() {
        NumericSequence seq = NumericSequence.of(1f, 2f, 3f);

        assertArrayEquals(new double[]{1, 2, 3}, seq.toDoubleArray());
        assertEquals(6.0, seq.doubles().sum());
        assertFalse(seq.isEmpty());
        assertTrue(NumericSequence.of(new double[0]).isEmpty());
    }

    @Test
    void testCommonType() {
        assertEquals(NumericType.INT, NumericType.common(NumericType.INT, NumericType.INT));
        assertEquals(NumericType.LONG, NumericType.common(NumericType.INT, NumericType.LONG));
        assertEquals(NumericType.DOUBLE, NumericType.common(NumericType.INT, NumericType.FLOAT));
        assertEquals(NumericType.DOUBLE, NumericType.common(NumericType.FLOAT, NumericType.DOUBLE));
    }

    @Test
    void testSequenceChecks() {
        NumericSequence two = NumericSequence.of(1, 2);
        NumericSequence three = NumericSequence.of(1, 2, 3);

        SizeMismatchException mismatch = assertThrows(SizeMismatchException.class,
            () -> SequenceChecks.requireSameSize(two, three, "dot"));
        assertEquals("Inputs have not the same size for dot: 2 != 3", mismatch.getMessage());
        assertEquals(2, mismatch.getLeftSize());
        assertEquals(3, mismatch.getRightSize());

        InsufficientDataException insufficient = assertThrows(InsufficientDataException.class,
            () -> SequenceChecks.requireMinimumSize(NumericSequence.of(1), 2, "var"));
        assertEquals("Input has not enough values for var: 1 < 2", insufficient.getMessage());
        assertEquals("var", insufficient.getOperation());

        assertThrows(IllegalArgumentException.class, () -> SequenceChecks.requireNonNegativeDdof(-1));
        assertEquals(1, SequenceChecks.requireNonNegativeDdof(1));
        assertThrows(NullPointerException.class, () -> SequenceChecks.requireNonNull(null));
    }
}
