/*
 * VarianceAggregator.java
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

package com.apple.foundationdb.formula.aggregate;

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumericConversions;

import javax.annotation.Nonnull;
import java.math.BigDecimal;

/**
 * Population variance and standard deviation by Welford's single-pass method: a running count, mean and sum
 * of squared deviations from the mean. A decimal result is accumulated in decimal arithmetic.
 */
@API(API.Status.INTERNAL)
class VarianceAggregator extends AbstractAggregator {
    private final boolean decimal;
    private long n;
    private double mean;
    private double m2;
    @Nonnull
    private BigDecimal decimalMean = BigDecimal.ZERO;
    @Nonnull
    private BigDecimal decimalM2 = BigDecimal.ZERO;
    private boolean overflowed;

    VarianceAggregator(@Nonnull AggregateFunction function, boolean decimal) {
        super(function);
        this.decimal = decimal;
    }

    @Override
    protected boolean accumulate(@Nonnull FormulaValue value) {
        if (!NumericConversions.isNumeric(value)) {
            return false;
        }
        n++;
        if (decimal) {
            accumulateDecimal(value);
            return true;
        }
        final double x = NumericConversions.toDouble(value);
        final double delta = x - mean;
        mean += delta / n;
        m2 += delta * (x - mean);
        return true;
    }

    private void accumulateDecimal(@Nonnull FormulaValue value) {
        if (overflowed) {
            return;
        }
        final BigDecimal x = NumericConversions.toBigDecimal(value);
        if (x == null) {
            overflowed = true;
            return;
        }
        final BigDecimal delta = x.subtract(decimalMean, DecimalValue.MATH_CONTEXT);
        decimalMean = decimalMean.add(delta.divide(BigDecimal.valueOf(n), DecimalValue.MATH_CONTEXT), DecimalValue.MATH_CONTEXT);
        decimalM2 = decimalM2.add(delta.multiply(x.subtract(decimalMean, DecimalValue.MATH_CONTEXT), DecimalValue.MATH_CONTEXT),
                DecimalValue.MATH_CONTEXT);
        if (!DecimalValue.isInRange(decimalM2)) {
            overflowed = true;
        }
    }

    @Nonnull
    @Override
    protected FormulaValue finish(@Nonnull IRContext irContext, long count) {
        if (decimal) {
            return finishDecimal(irContext, count);
        }
        final double variance = m2 / count;
        if (Double.isNaN(variance)) {
            return CommonErrors.overflow(irContext);
        }
        final double result = getFunction() == AggregateFunction.STDEV_P ? Math.sqrt(variance) : variance;
        return NumericConversions.numberOrDecimal(irContext, result);
    }

    @Nonnull
    private FormulaValue finishDecimal(@Nonnull IRContext irContext, long count) {
        if (overflowed) {
            return CommonErrors.overflow(irContext);
        }
        // Welford's M2 is a sum of non-negative terms; rounding can leave it a hair below zero
        final BigDecimal variance = decimalM2.max(BigDecimal.ZERO).divide(BigDecimal.valueOf(count), DecimalValue.MATH_CONTEXT);
        final BigDecimal result = getFunction() == AggregateFunction.STDEV_P ? variance.sqrt(DecimalValue.MATH_CONTEXT) : variance;
        return NumericConversions.decimal(irContext, result);
    }
}
