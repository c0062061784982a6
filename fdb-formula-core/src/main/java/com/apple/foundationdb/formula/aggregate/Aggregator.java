/*
 * Aggregator.java
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
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;

import javax.annotation.Nonnull;

/**
 * Incremental state of one aggregate function call. A fresh aggregator is created for every call and is
 * discarded after {@link #getResult(IRContext)}; aggregators are not thread safe and are never shared.
 *
 * <p>
 * Blank values are skipped and do not count as elements. A value of an unexpected kind poisons the aggregator:
 * its result becomes a type-mismatch error.
 * </p>
 */
@API(API.Status.STABLE)
public interface Aggregator {
    /**
     * Fold one value into the running state.
     * @param value the next value
     */
    void apply(@Nonnull FormulaValue value);

    /**
     * Produce the aggregate.
     * @param irContext the context of the call, whose result type the result takes
     * @return the aggregate, a blank, or an error
     */
    @Nonnull
    FormulaValue getResult(@Nonnull IRContext irContext);
}
