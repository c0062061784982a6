/*
 * AggregateFunctions.java
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

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.aggregate.AggregateFunction;
import com.apple.foundationdb.formula.aggregate.AggregationRunner;
import com.apple.foundationdb.formula.pipeline.AsyncTargetFunction;
import com.apple.foundationdb.formula.pipeline.TargetFunction;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.LambdaValue;
import com.apple.foundationdb.formula.values.TableValue;

import javax.annotation.Nonnull;

/**
 * Adapts the aggregate functions to the two call shapes: a list of values, {@code Sum(1, 2, 3)}, and a table with
 * a per-row expression, {@code Sum(table, Price * Quantity)}.
 */
@API(API.Status.UNSTABLE)
public final class AggregateFunctions {
    private AggregateFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static TargetFunction<FormulaValue> scalar(@Nonnull AggregateFunction function) {
        return (context, irContext, args) -> AggregationRunner.runScalar(function, context, irContext, args);
    }

    @Nonnull
    public static AsyncTargetFunction<FormulaValue> table(@Nonnull AggregateFunction function) {
        return (context, irContext, args) ->
                AggregationRunner.runTable(function, context, irContext, (TableValue)args.get(0), (LambdaValue)args.get(1));
    }
}
