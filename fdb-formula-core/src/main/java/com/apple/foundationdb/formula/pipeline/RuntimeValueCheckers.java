/*
 * RuntimeValueCheckers.java
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

package com.apple.foundationdb.formula.pipeline;

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Standard {@link RuntimeValueChecker}s. The numeric checkers look at number and decimal arguments and pass
 * every other kind through, so they can be used with any argument type.
 */
@API(API.Status.STABLE)
public final class RuntimeValueCheckers {
    private static final RuntimeValueChecker<FormulaValue> DEFERRED = (irContext, index, arg) -> arg;

    private RuntimeValueCheckers() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static RuntimeValueChecker<FormulaValue> deferred() {
        return DEFERRED;
    }

    /**
     * Reject infinite and NaN numbers with a numeric error.
     * @return the checker
     */
    @Nonnull
    public static RuntimeValueChecker<FormulaValue> finite() {
        return (irContext, index, arg) -> {
            if (arg.getKind() == ValueKind.NUMBER && !Double.isFinite(((NumberValue)arg).getValue())) {
                return CommonErrors.numeric(irContext, "Arguments must be finite.");
            }
            return arg;
        };
    }

    /**
     * Reject negative and non-finite numbers.
     * @return the checker
     */
    @Nonnull
    public static RuntimeValueChecker<FormulaValue> positiveNumber() {
        return (irContext, index, arg) -> {
            final int sign = signOf(arg);
            if (sign == Integer.MIN_VALUE) {
                return CommonErrors.numeric(irContext, "Arguments must be finite.");
            }
            return sign < 0 ? CommonErrors.argumentOutOfRange(irContext) : arg;
        };
    }

    /**
     * Reject zero, negative and non-finite numbers.
     * @return the checker
     */
    @Nonnull
    public static RuntimeValueChecker<FormulaValue> strictPositiveNumber() {
        return (irContext, index, arg) -> {
            final int sign = signOf(arg);
            if (sign == Integer.MIN_VALUE) {
                return CommonErrors.numeric(irContext, "Arguments must be finite.");
            }
            return sign <= 0 && isNumeric(arg) ? CommonErrors.argumentOutOfRange(irContext) : arg;
        };
    }

    /**
     * Reject a zero divisor at argument position 1.
     * @return the checker
     */
    @Nonnull
    public static RuntimeValueChecker<FormulaValue> divideByZero() {
        return (irContext, index, arg) -> index == 1 && isNumeric(arg) && signOf(arg) == 0
                ? CommonErrors.divByZero(irContext)
                : arg;
    }

    /**
     * Run several checkers in order, stopping at the first that returns an error.
     * @param checkers the checkers
     * @return the combined checker
     */
    @Nonnull
    @SafeVarargs
    public static RuntimeValueChecker<FormulaValue> all(@Nonnull RuntimeValueChecker<FormulaValue>... checkers) {
        final List<RuntimeValueChecker<FormulaValue>> copy = ImmutableList.copyOf(checkers);
        return (irContext, index, arg) -> {
            FormulaValue current = arg;
            for (RuntimeValueChecker<FormulaValue> checker : copy) {
                current = checker.check(irContext, index, current);
                if (current.getKind() == ValueKind.ERROR) {
                    break;
                }
            }
            return current;
        };
    }

    private static boolean isNumeric(@Nonnull FormulaValue arg) {
        return arg.getKind() == ValueKind.NUMBER || arg.getKind() == ValueKind.DECIMAL;
    }

    // Integer.MIN_VALUE for a non-finite number; 1 for values that are not numeric
    private static int signOf(@Nonnull FormulaValue arg) {
        switch (arg.getKind()) {
            case NUMBER:
                final double value = ((NumberValue)arg).getValue();
                return Double.isFinite(value) ? (int)Math.signum(value) : Integer.MIN_VALUE;
            case DECIMAL:
                return ((DecimalValue)arg).getValue().signum();
            default:
                return 1;
        }
    }
}
