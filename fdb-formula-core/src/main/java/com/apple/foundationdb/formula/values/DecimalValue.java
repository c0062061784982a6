/*
 * DecimalValue.java
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
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * A fixed-point decimal with 28 significant digits. Its magnitude never exceeds {@link #MAX_VALUE}; arithmetic
 * that would go beyond it is an overflow.
 */
@API(API.Status.STABLE)
public final class DecimalValue extends FormulaValue {
    /**
     * Precision used for all decimal arithmetic.
     */
    public static final MathContext MATH_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);
    public static final BigDecimal MAX_VALUE = new BigDecimal("79228162514264337593543950335");
    public static final BigDecimal MIN_VALUE = MAX_VALUE.negate();

    @Nonnull
    private final BigDecimal value;

    public DecimalValue(@Nonnull IRContext irContext, @Nonnull BigDecimal value) {
        super(irContext);
        if (!isInRange(value)) {
            throw new ArithmeticException("decimal value out of range: " + value);
        }
        this.value = value.round(MATH_CONTEXT);
    }

    @Nonnull
    public static DecimalValue of(@Nonnull BigDecimal value) {
        return new DecimalValue(IRContext.notInSource(FormulaType.DECIMAL), value);
    }

    @Nonnull
    public static DecimalValue of(@Nonnull String value) {
        return of(new BigDecimal(value));
    }

    public static boolean isInRange(@Nonnull BigDecimal value) {
        return value.abs().compareTo(MAX_VALUE) <= 0;
    }

    @Nonnull
    public BigDecimal getValue() {
        return value;
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.DECIMAL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DecimalValue && ((DecimalValue)o).value.compareTo(value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return "Decimal(" + value.toPlainString() + ")";
    }
}
