/*
 * TimeSumAggregator.java
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
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Sum or average of times of day, as spans.
 */
@API(API.Status.INTERNAL)
class TimeSumAggregator extends AbstractAggregator {
    @Nonnull
    private Duration sum = Duration.ZERO;
    private boolean overflowed;

    TimeSumAggregator(@Nonnull AggregateFunction function) {
        super(function);
    }

    @Override
    protected boolean accumulate(@Nonnull FormulaValue value) {
        if (value.getKind() != ValueKind.TIME) {
            return false;
        }
        if (!overflowed) {
            try {
                sum = sum.plus(((TimeValue)value).getValue());
            } catch (ArithmeticException e) {
                overflowed = true;
            }
        }
        return true;
    }

    @Nonnull
    @Override
    protected FormulaValue finish(@Nonnull IRContext irContext, long count) {
        if (overflowed) {
            return CommonErrors.overflow(irContext);
        }
        final Duration result = getFunction() == AggregateFunction.AVERAGE ? sum.dividedBy(count) : sum;
        return new TimeValue(irContext, result);
    }
}
