/*
 * AggregationRunner.java
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
import com.apple.foundationdb.formula.async.MoreAsyncUtil;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.LambdaValue;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.TableRow;
import com.apple.foundationdb.formula.values.TableValue;
import com.apple.foundationdb.formula.values.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives an {@link Aggregator} over a flat argument list or over a lambda evaluated for each row of a table.
 */
@API(API.Status.UNSTABLE)
public final class AggregationRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationRunner.class);

    private AggregationRunner() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Aggregate a list of argument values. Blanks are skipped.
     * @param function the aggregate function
     * @param context the evaluation context
     * @param irContext the context of the call, whose result type selects the aggregator
     * @param values the values
     * @return the aggregate
     */
    @Nonnull
    public static FormulaValue runScalar(@Nonnull AggregateFunction function, @Nonnull EvaluationContext context,
                                         @Nonnull IRContext irContext, @Nonnull List<? extends FormulaValue> values) {
        final Aggregator aggregator = Aggregators.create(function, irContext.getResultType(), context);
        for (FormulaValue value : values) {
            aggregator.apply(value);
        }
        return aggregator.getResult(irContext);
    }

    /**
     * Aggregate a lambda over the rows of a table. Rows are visited in order, one lambda at a time. A blank or
     * error row is evaluated with its columns in scope as blanks. The first error the lambda produces ends the scan and is the
     * result, as it was produced. A number result that is not finite is a numeric error.
     *
     * @param function the aggregate function
     * @param context the evaluation context
     * @param irContext the context of the call, whose result type selects the aggregator
     * @param table the table
     * @param lambda the per-row value
     * @return a future with the aggregate
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> runTable(@Nonnull AggregateFunction function,
                                                           @Nonnull EvaluationContext context,
                                                           @Nonnull IRContext irContext,
                                                           @Nonnull TableValue table,
                                                           @Nonnull LambdaValue lambda) {
        final Aggregator aggregator = Aggregators.create(function, irContext.getResultType(), context);
        final List<TableRow> rows = table.getRows();
        final AtomicInteger index = new AtomicInteger();
        final AtomicReference<FormulaValue> failure = new AtomicReference<>();
        return MoreAsyncUtil.whileTrue(() -> {
            final int rowIndex = index.getAndIncrement();
            if (rowIndex >= rows.size()) {
                return CompletableFuture.completedFuture(false);
            }
            context.checkCancel();
            return lambda.evaluateInRow(context, rows.get(rowIndex)).thenApply(value -> {
                if (value.getKind() == ValueKind.NUMBER && !Double.isFinite(((NumberValue)value).getValue())) {
                    failure.set(CommonErrors.numeric(irContext, "Arguments must be finite."));
                    return false;
                }
                if (value.getKind() == ValueKind.ERROR) {
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug(KeyValueLogMessage.of("row error ends aggregate",
                                LogMessageKeys.AGGREGATE, function.getFunctionName(),
                                LogMessageKeys.ROW_INDEX, rowIndex));
                    }
                    failure.set(value);
                    return false;
                }
                aggregator.apply(value);
                return true;
            });
        }).thenApply(vignore -> {
            final FormulaValue error = failure.get();
            return error != null ? error : aggregator.getResult(irContext);
        });
    }
}
