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

/// Value semantics shared by the array-backed sequences.
///
/// Two sequences are equal when they have the same element type and the
/// same elements in the same order. Floating-point elements compare with
/// [Double#compare], so `NaN` equals `NaN`.
abstract class AbstractNumericSequence implements NumericSequence {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericSequence)) return false;
        NumericSequence other = (NumericSequence) o;
        if (type() != other.type() || size() != other.size()) {
            return false;
        }
        for (int i = 0; i < size(); i++) {
            if (type().isIntegral()) {
                if (longValueAt(i) != other.longValueAt(i)) return false;
            } else if (Double.compare(valueAt(i), other.valueAt(i)) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = type().hashCode();
        for (int i = 0; i < size(); i++) {
            long bits = type().isIntegral() ? longValueAt(i) : Double.doubleToLongBits(valueAt(i));
            result = 31 * result + Long.hashCode(bits);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type().name()).append('[');
        for (int i = 0; i < size(); i++) {
            if (i > 0) sb.append(", ");
            if (type().isIntegral()) {
                sb.append(longValueAt(i));
            } else {
                sb.append(valueAt(i));
            }
        }
        return sb.append(']').toString();
    }
}
