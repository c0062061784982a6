/*
 * UnsupportedAggregator.java
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

import javax.annotation.Nonnull;

/**
 * Stands in for an aggregate over a result type that has no aggregator. Its result is always a not-supported
 * error.
 */
@API(API.Status.INTERNAL)
class UnsupportedAggregator implements Aggregator {
    @Nonnull
    private final AggregateFunction function;

    UnsupportedAggregator(@Nonnull AggregateFunction function) {
        this.function = function;
    }

    @Override
    public void apply(@Nonnull FormulaValue value) {
        // nothing to accumulate
    }

    @Nonnull
    @Override
    public FormulaValue getResult(@Nonnull IRContext irContext) {
        return CommonErrors.notSupported(irContext,
                function.getFunctionName() + " is not supported for values of type " + irContext.getResultType());
    }
}
