/*
 * Aggregators.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.FormulaType;

import javax.annotation.Nonnull;

/**
 * Selects the {@link Aggregator} for an aggregate call from the call's declared result type.
 *
 * <table>
 *     <caption>Supported result types</caption>
 *     <tr><th>Function</th><th>Result types</th></tr>
 *     <tr><td>Sum, Average</td><td>Number, Decimal, Time</td></tr>
 *     <tr><td>Min, Max</td><td>Number, Decimal, Date, DateTime, Time</td></tr>
 *     <tr><td>VarP, StdevP</td><td>Number, Decimal</td></tr>
 * </table>
 *
 * Any other combination gets an aggregator whose result is a not-supported error.
 */
@API(API.Status.UNSTABLE)
public final class Aggregators {
    private Aggregators() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static Aggregator create(@Nonnull AggregateFunction function, @Nonnull FormulaType resultType,
                                    @Nonnull EvaluationContext context) {
        final FormulaType.TypeCode code = resultType.getCode();
        switch (function) {
            case SUM:
            case AVERAGE:
                if (code == FormulaType.TypeCode.NUMBER) {
                    return new NumberSumAggregator(function);
                } else if (code == FormulaType.TypeCode.DECIMAL) {
                    return new DecimalSumAggregator(function);
                } else if (code == FormulaType.TypeCode.TIME) {
                    return new TimeSumAggregator(function);
                }
                break;
            case MIN:
            case MAX:
                switch (code) {
                    case NUMBER:
                    case DECIMAL:
                    case DATE:
                    case DATE_TIME:
                    case TIME:
                        return new ExtremumAggregator(function, code, context.getTimeZone());
                    default:
                        break;
                }
                break;
            case VAR_P:
            case STDEV_P:
                if (code == FormulaType.TypeCode.NUMBER || code == FormulaType.TypeCode.DECIMAL) {
                    return new VarianceAggregator(function, code == FormulaType.TypeCode.DECIMAL);
                }
                break;
            default:
                break;
        }
        return new UnsupportedAggregator(function);
    }
}
