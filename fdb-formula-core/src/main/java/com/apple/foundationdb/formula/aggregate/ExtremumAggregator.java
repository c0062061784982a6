/*
 * ExtremumAggregator.java
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
import com.apple.foundationdb.formula.datetime.DateTimeNormalizer;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Minimum or maximum. Numbers and decimals are compared numerically and converted to the result type; dates and
 * date-times are compared as instants in the evaluation's zone and the winning value is returned as it was
 * given; times are compared as spans. On ties the first value wins.
 */
@API(API.Status.INTERNAL)
class ExtremumAggregator extends AbstractAggregator {
    @Nonnull
    private final FormulaType.TypeCode resultCode;
    @Nonnull
    private final ZoneId zone;
    @Nullable
    private FormulaValue best;
    private boolean overflowed;

    ExtremumAggregator(@Nonnull AggregateFunction function, @Nonnull FormulaType.TypeCode resultCode, @Nonnull ZoneId zone) {
        super(function);
        this.resultCode = resultCode;
        this.zone = zone;
    }

    @Override
    protected boolean accumulate(@Nonnull FormulaValue value) {
        if (!accepts(value.getKind())) {
            return false;
        }
        if (overflowed) {
            return true;
        }
        if (resultCode == FormulaType.TypeCode.DECIMAL && NumericConversions.toBigDecimal(value) == null) {
            overflowed = true;
            return true;
        }
        if (best == null) {
            best = value;
        } else {
            final int comparison = compare(value, best);
            if (getFunction() == AggregateFunction.MIN ? comparison < 0 : comparison > 0) {
                best = value;
            }
        }
        return true;
    }

    private boolean accepts(@Nonnull ValueKind kind) {
        switch (resultCode) {
            case NUMBER:
            case DECIMAL:
                return kind == ValueKind.NUMBER || kind == ValueKind.DECIMAL;
            case DATE:
            case DATE_TIME:
                return kind == ValueKind.DATE || kind == ValueKind.DATE_TIME;
            case TIME:
                return kind == ValueKind.TIME;
            default:
                return false;
        }
    }

    private int compare(@Nonnull FormulaValue left, @Nonnull FormulaValue right) {
        switch (resultCode) {
            case NUMBER:
                return Double.compare(NumericConversions.toDouble(left), NumericConversions.toDouble(right));
            case DECIMAL:
                return Objects.requireNonNull(NumericConversions.toBigDecimal(left))
                        .compareTo(NumericConversions.toBigDecimal(right));
            case DATE:
            case DATE_TIME:
                return DateTimeNormalizer.toInstant(left, zone).compareTo(DateTimeNormalizer.toInstant(right, zone));
            default:
                return ((TimeValue)left).getValue().compareTo(((TimeValue)right).getValue());
        }
    }

    @Nonnull
    @Override
    protected FormulaValue finish(@Nonnull IRContext irContext, long count) {
        if (overflowed || best == null) {
            return CommonErrors.overflow(irContext);
        }
        switch (resultCode) {
            case NUMBER:
                return new NumberValue(irContext, NumericConversions.toDouble(best));
            case DECIMAL:
                return NumericConversions.decimal(irContext, Objects.requireNonNull(NumericConversions.toBigDecimal(best)));
            default:
                return best;
        }
    }
}
