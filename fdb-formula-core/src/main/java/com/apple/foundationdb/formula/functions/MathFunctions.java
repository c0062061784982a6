/*
 * MathFunctions.java
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

package com.apple.foundationdb.formula.functions;

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import com.apple.foundationdb.formula.values.TableValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Numeric builtins. Functions that accept both numbers and decimals compute in the representation of their
 * first argument; results that are not finite become errors rather than infinite or NaN numbers.
 */
@API(API.Status.UNSTABLE)
public final class MathFunctions {
    private static final int MAX_DECIMAL_DIGITS = 28;

    private MathFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static FormulaValue abs(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final FormulaValue x = args.get(0);
        if (x.getKind() == ValueKind.DECIMAL) {
            return NumericConversions.decimal(irContext, ((DecimalValue)x).getValue().abs());
        }
        return number(irContext, Math.abs(NumericConversions.toDouble(x)));
    }

    /**
     * {@code Int(x)}: round down to the nearest integer, toward negative infinity.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the number
     * @return the integer
     */
    @Nonnull
    public static FormulaValue intFloor(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final FormulaValue x = args.get(0);
        if (x.getKind() == ValueKind.DECIMAL) {
            return NumericConversions.decimal(irContext, ((DecimalValue)x).getValue().setScale(0, RoundingMode.FLOOR));
        }
        return number(irContext, Math.floor(NumericConversions.toDouble(x)));
    }

    /**
     * {@code Mod(x, y)}: the remainder of a floored division, {@code x - y * floor(x / y)}. The result is zero or
     * has the sign of {@code y}. The pipeline rejects a zero divisor before this runs.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the dividend and the divisor
     * @return the remainder
     */
    @Nonnull
    public static FormulaValue mod(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final FormulaValue dividend = args.get(0);
        final FormulaValue divisor = args.get(1);
        if (dividend.getKind() == ValueKind.DECIMAL || divisor.getKind() == ValueKind.DECIMAL) {
            final BigDecimal x = NumericConversions.toBigDecimal(dividend);
            final BigDecimal y = NumericConversions.toBigDecimal(divisor);
            if (x == null || y == null) {
                return CommonErrors.overflow(irContext);
            }
            if (y.signum() == 0) {
                return CommonErrors.divByZero(irContext);
            }
            final BigDecimal quotient = x.divide(y, 0, RoundingMode.FLOOR);
            return NumericConversions.decimal(irContext.withResultType(FormulaType.DECIMAL), x.subtract(y.multiply(quotient)));
        }
        final double x = NumericConversions.toDouble(dividend);
        final double y = NumericConversions.toDouble(divisor);
        if (y == 0) {
            return CommonErrors.divByZero(irContext);
        }
        final double remainder = x - y * Math.floor(x / y);
        // floating point error can push the remainder onto the divisor itself
        return number(irContext, Math.abs(remainder) >= Math.abs(y) ? 0.0 : remainder);
    }

    @Nonnull
    public static FormulaValue round(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return roundWith(irContext, args, RoundingMode.HALF_UP);
    }

    @Nonnull
    public static FormulaValue roundUp(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return roundWith(irContext, args, RoundingMode.UP);
    }

    @Nonnull
    public static FormulaValue roundDown(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return roundWith(irContext, args, RoundingMode.DOWN);
    }

    /**
     * {@code Trunc(x[, digits])}: drop digits beyond the given position, toward zero.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the number and the optional digit count
     * @return the truncated number
     */
    @Nonnull
    public static FormulaValue trunc(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return roundWith(irContext, args, RoundingMode.DOWN);
    }

    /**
     * Round a number to a number of digits. The digit count is truncated toward zero; a negative count rounds to
     * the left of the decimal point. Midpoints under {@link RoundingMode#HALF_UP} go away from zero.
     * @param number the number
     * @param digits the number of digits
     * @param mode {@link RoundingMode#HALF_UP}, {@link RoundingMode#UP} or {@link RoundingMode#DOWN}
     * @return the rounded number
     */
    public static double round(double number, double digits, @Nonnull RoundingMode mode) {
        final double multiplier = Math.pow(10, digits < 0 ? Math.ceil(digits) : Math.floor(digits));
        if (digits == 0 || multiplier == 0 || !Double.isFinite(multiplier)) {
            return roundToInteger(number, mode);
        }
        return roundToInteger(number * multiplier, mode) / multiplier;
    }

    private static double roundToInteger(double x, @Nonnull RoundingMode mode) {
        final double magnitude = Math.abs(x);
        final double rounded;
        switch (mode) {
            case UP:
                rounded = Math.ceil(magnitude);
                break;
            case DOWN:
                rounded = Math.floor(magnitude);
                break;
            default:
                final double floor = Math.floor(magnitude);
                rounded = magnitude - floor >= 0.5 ? floor + 1 : floor;
                break;
        }
        return Math.copySign(rounded, x);
    }

    @Nonnull
    private static FormulaValue roundWith(@Nonnull IRContext irContext, @Nonnull List<FormulaValue> args, @Nonnull RoundingMode mode) {
        final FormulaValue x = args.get(0);
        final double digits = args.size() > 1 ? NumericConversions.toDouble(args.get(1)) : 0;
        if (x.getKind() == ValueKind.DECIMAL) {
            final int scale = (int)Math.max(-MAX_DECIMAL_DIGITS, Math.min(MAX_DECIMAL_DIGITS, digits < 0 ? Math.ceil(digits) : Math.floor(digits)));
            return NumericConversions.decimal(irContext, ((DecimalValue)x).getValue().setScale(scale, mode));
        }
        return number(irContext, round(NumericConversions.toDouble(x), digits, mode));
    }

    @Nonnull
    public static FormulaValue sqrt(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return number(irContext, Math.sqrt(NumericConversions.toDouble(args.get(0))));
    }

    @Nonnull
    public static FormulaValue ln(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return number(irContext, Math.log(NumericConversions.toDouble(args.get(0))));
    }

    /**
     * {@code Log(x[, base])}: the logarithm in a base, 10 unless given.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the number and the base
     * @return the logarithm
     */
    @Nonnull
    public static FormulaValue log(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final double x = NumericConversions.toDouble(args.get(0));
        final double base = args.size() > 1 ? NumericConversions.toDouble(args.get(1)) : 10;
        if (base == 1) {
            return CommonErrors.divByZero(irContext);
        }
        return number(irContext, Math.log(x) / Math.log(base));
    }

    @Nonnull
    public static FormulaValue exp(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return number(irContext, Math.exp(NumericConversions.toDouble(args.get(0))));
    }

    @Nonnull
    public static FormulaValue power(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final double x = NumericConversions.toDouble(args.get(0));
        final double y = NumericConversions.toDouble(args.get(1));
        if (x == 0 && y < 0) {
            return CommonErrors.divByZero(irContext);
        }
        return number(irContext, Math.pow(x, y));
    }

    /**
     * {@code Rand()}: a number in [0, 1) from the context's random service.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args no arguments
     * @return the random number
     */
    @Nonnull
    public static FormulaValue rand(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return new NumberValue(irContext, context.nextRandom());
    }

    /**
     * {@code RandBetween(lower, upper)}: an integer drawn uniformly from {@code [ceil(lower), floor(upper)]}. If
     * that range is empty the result is a numeric error.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the bounds
     * @return the random integer or an error
     */
    @Nonnull
    public static FormulaValue randBetween(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final double lower = Math.ceil(NumericConversions.toDouble(args.get(0)));
        final double upper = Math.floor(NumericConversions.toDouble(args.get(1)));
        if (lower > upper) {
            return CommonErrors.numeric(irContext, "Lower value cannot be greater than Upper value");
        }
        final double drawn = lower + Math.floor(context.nextRandom() * (upper - lower + 1));
        return number(irContext, Math.min(drawn, upper));
    }

    /**
     * {@code Sequence(records[, start[, step]])}: a single-column table of {@code records} numbers starting at
     * {@code start} and increasing by {@code step}. Start and step default to 1.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the count, start and step
     * @return the table
     */
    @Nonnull
    public static FormulaValue sequence(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final double records = NumericConversions.toDouble(args.get(0));
        final double start = args.size() > 1 ? NumericConversions.toDouble(args.get(1)) : 1;
        final double step = args.size() > 2 ? NumericConversions.toDouble(args.get(2)) : 1;
        final List<FormulaValue> values = new ArrayList<>();
        double x = start;
        for (int i = 1; i <= records; i++) {
            context.checkCancel();
            values.add(NumberValue.of(x));
            x += step;
        }
        return TableValue.singleColumn(irContext, values);
    }

    /**
     * Wrap a computed double. NaN is an invalid operation and infinities are an overflow.
     * @param irContext the context of the result
     * @param value the computed number
     * @return the number or an error
     */
    @Nonnull
    static FormulaValue number(@Nonnull IRContext irContext, double value) {
        if (Double.isNaN(value)) {
            return CommonErrors.numeric(irContext, "Invalid operation: the result is not a number.");
        }
        if (Double.isInfinite(value)) {
            return CommonErrors.overflow(irContext);
        }
        return new NumberValue(irContext, value);
    }
}
