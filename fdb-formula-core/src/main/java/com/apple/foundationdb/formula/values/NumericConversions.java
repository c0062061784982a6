/*
 * NumericConversions.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.formula.values;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;

/**
 * Conversions between the two numeric representations.
 */
@API(API.Status.UNSTABLE)
public final class NumericConversions {
    private NumericConversions() {
        // private constructor - static methods only in this class. No instances.
    }

    public static boolean isNumeric(@Nonnull FormulaValue value) {
        return value.getKind() == ValueKind.NUMBER || value.getKind() == ValueKind.DECIMAL;
    }

    /**
     * Read a number or decimal as a double.
     * @param value a number or decimal value
     * @return its value as a double
     * @throws IllegalArgumentException if the value is not numeric
     */
    public static double toDouble(@Nonnull FormulaValue value) {
        switch (value.getKind()) {
            case NUMBER:
                return ((NumberValue)value).getValue();
            case DECIMAL:
                return ((DecimalValue)value).getValue().doubleValue();
            default:
                throw new IllegalArgumentException("not a numeric value: " + value);
        }
    }

    /**
     * Read a number or decimal as a {@link BigDecimal}.
     * @param value a number or decimal value
     * @return its value, or {@code null} for a non-finite number
     * @throws IllegalArgumentException if the value is not numeric
     */
    @Nullable
    public static BigDecimal toBigDecimal(@Nonnull FormulaValue value) {
        switch (value.getKind()) {
            case NUMBER:
                final double number = ((NumberValue)value).getValue();
                return Double.isFinite(number) ? BigDecimal.valueOf(number) : null;
            case DECIMAL:
                return ((DecimalValue)value).getValue();
            default:
                throw new IllegalArgumentException("not a numeric value: " + value);
        }
    }

    /**
     * Build a numeric value of the kind the context's result type asks for: a decimal for a decimal result, a
     * number otherwise. Results that cannot be represented become an overflow error.
     * @param irContext the context of the result
     * @param value the result
     * @return the typed result
     */
    @Nonnull
    public static FormulaValue numberOrDecimal(@Nonnull IRContext irContext, double value) {
        if (!Double.isFinite(value)) {
            return CommonErrors.overflow(irContext);
        }
        if (irContext.getResultType().getCode() == FormulaType.TypeCode.DECIMAL) {
            return decimal(irContext, BigDecimal.valueOf(value));
        }
        return new NumberValue(irContext, value);
    }

    /**
     * Build a decimal value, or an overflow error if it is out of range.
     * @param irContext the context of the result
     * @param value the result
     * @return the decimal or an error
     */
    @Nonnull
    public static FormulaValue decimal(@Nonnull IRContext irContext, @Nonnull BigDecimal value) {
        final BigDecimal rounded = value.round(DecimalValue.MATH_CONTEXT);
        if (!DecimalValue.isInRange(rounded)) {
            return CommonErrors.overflow(irContext);
        }
        return new DecimalValue(irContext, rounded);
    }
}
