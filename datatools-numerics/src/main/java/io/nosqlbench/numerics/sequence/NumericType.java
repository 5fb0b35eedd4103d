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

/// Element type carried by a [NumericSequence].
///
/// Narrow integral inputs (`byte`, `short`) are widened to [#INT] when a
/// sequence is built, so four types cover every supported element.
/// Operations that preserve the element type, such as absolute value and
/// near-duplicate elimination, dispatch on this value.
public enum NumericType {
    INT(true),
    LONG(true),
    FLOAT(false),
    DOUBLE(false);

    private final boolean integral;

    NumericType(boolean integral) {
        this.integral = integral;
    }

    /// @return true for [#INT] and [#LONG]
    public boolean isIntegral() {
        return integral;
    }

    /// Returns the element type used to hold boxed values of the given class.
    ///
    /// @param type a boxed numeric class
    /// @return the matching element type, [#DOUBLE] for anything not recognized
    public static NumericType forBoxedType(Class<?> type) {
        if (type == Integer.class || type == Short.class || type == Byte.class) {
            return INT;
        }
        if (type == Long.class) {
            return LONG;
        }
        if (type == Float.class) {
            return FLOAT;
        }
        return DOUBLE;
    }

    /// Returns a type able to hold the values of both types.
    ///
    /// Two integral types widen to [#LONG]; any other mix widens to [#DOUBLE].
    ///
    /// @param a first type
    /// @param b second type
    /// @return the common type
    public static NumericType common(NumericType a, NumericType b) {
        if (a == b) {
            return a;
        }
        return a.integral && b.integral ? LONG : DOUBLE;
    }
}
