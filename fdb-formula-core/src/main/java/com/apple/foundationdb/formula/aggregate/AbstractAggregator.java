/*
 * AbstractAggregator.java
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
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.ErrorValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Handling shared by the aggregators: skipping blanks, counting elements, remembering the first error or
 * unexpected value, and the empty-input result.
 */
@API(API.Status.INTERNAL)
abstract class AbstractAggregator implements Aggregator {
    @Nonnull
    private final AggregateFunction function;
    private long count;
    @Nullable
    private ErrorValue error;
    private boolean typeMismatch;

    protected AbstractAggregator(@Nonnull AggregateFunction function) {
        this.function = function;
    }

    @Override
    public final void apply(@Nonnull FormulaValue value) {
        if (error != null || typeMismatch || value.getKind() == ValueKind.BLANK) {
            return;
        }
        if (value.getKind() == ValueKind.ERROR) {
            error = (ErrorValue)value;
            return;
        }
        if (!accumulate(value)) {
            typeMismatch = true;
            return;
        }
        count++;
    }

    @Nonnull
    @Override
    public final FormulaValue getResult(@Nonnull IRContext irContext) {
        if (error != null) {
            return error;
        }
        if (typeMismatch) {
            return CommonErrors.runtimeTypeMismatch(irContext);
        }
        if (count == 0) {
            return function.isEmptyDivideByZero() ? CommonErrors.divByZero(irContext) : BlankValue.of(irContext);
        }
        return finish(irContext, count);
    }

    @Nonnull
    protected AggregateFunction getFunction() {
        return function;
    }

    /**
     * Fold a non-blank, non-error value into the state.
     * @param value the value
     * @return {@code false} if the value has a kind this aggregator does not accept
     */
    protected abstract boolean accumulate(@Nonnull FormulaValue value);

    /**
     * Produce the result for a non-empty input.
     * @param irContext the context of the call
     * @param count the number of elements accumulated
     * @return the result
     */
    @Nonnull
    protected abstract FormulaValue finish(@Nonnull IRContext irContext, long count);
}
