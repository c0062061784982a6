/*
 * RowScopedEvaluator.java
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

package com.apple.foundationdb.formula.table;

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.async.MoreAsyncUtil;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.LambdaValue;
import com.apple.foundationdb.formula.values.TableRow;
import com.apple.foundationdb.formula.values.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates row-scoped lambdas over the rows of a table. Rows are evaluated concurrently, with at most
 * {@link com.apple.foundationdb.formula.EvaluationProperties#getRowPipelineSize()} rows in flight; results are
 * always returned in row order. Cancellation is checked before each row starts.
 */
@API(API.Status.INTERNAL)
public final class RowScopedEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RowScopedEvaluator.class);

    private RowScopedEvaluator() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Evaluate one lambda per row, with the row's fields in scope.
     * @param context the evaluation context
     * @param rows the rows
     * @param lambda the lambda
     * @return a future with one result per row, in row order
     */
    @Nonnull
    public static CompletableFuture<List<FormulaValue>> evaluate(@Nonnull EvaluationContext context,
                                                                 @Nonnull List<TableRow> rows,
                                                                 @Nonnull LambdaValue lambda) {
        logFanOut(context, rows.size());
        return MoreAsyncUtil.mapPipelined(rows, row -> {
            context.checkCancel();
            return lambda.evaluateInRow(context, row);
        }, context.getProperties().getRowPipelineSize());
    }

    /**
     * Evaluate several lambdas per row, with the row's fields in scope. The lambdas of a row run one after
     * another; rows run concurrently.
     * @param context the evaluation context
     * @param rows the rows
     * @param lambdas the lambdas
     * @return a future with the results of every lambda for each row, in row order
     */
    @Nonnull
    public static CompletableFuture<List<List<FormulaValue>>> evaluateAll(@Nonnull EvaluationContext context,
                                                                          @Nonnull List<TableRow> rows,
                                                                          @Nonnull List<LambdaValue> lambdas) {
        logFanOut(context, rows.size());
        return MoreAsyncUtil.mapPipelined(rows, row -> {
            context.checkCancel();
            return evaluateInSequence(context, row, lambdas, 0, new ArrayList<>(lambdas.size()));
        }, context.getProperties().getRowPipelineSize());
    }

    /**
     * Evaluate predicates for each row. A row's predicates run one after another and stop at the first one that is
     * not {@code true}; the result for the row is then that value, otherwise {@code true}.
     * @param context the evaluation context
     * @param rows the rows
     * @param predicates the predicates, all of which must hold
     * @return a future with the deciding value for each row, in row order
     */
    @Nonnull
    public static CompletableFuture<List<FormulaValue>> evaluatePredicates(@Nonnull EvaluationContext context,
                                                                           @Nonnull List<TableRow> rows,
                                                                           @Nonnull List<LambdaValue> predicates) {
        logFanOut(context, rows.size());
        return MoreAsyncUtil.mapPipelined(rows, row -> {
            context.checkCancel();
            return evaluatePredicates(context, row, predicates);
        }, context.getProperties().getRowPipelineSize());
    }

    /**
     * Evaluate predicates for a single row, stopping at the first one that is not {@code true}.
     * @param context the evaluation context
     * @param row the row
     * @param predicates the predicates
     * @return a future with the deciding value
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> evaluatePredicates(@Nonnull EvaluationContext context,
                                                                    @Nonnull TableRow row,
                                                                    @Nonnull List<LambdaValue> predicates) {
        return evaluatePredicate(context, row, predicates, 0);
    }

    /**
     * Whether a predicate result selects its row.
     * @param result a predicate result
     * @return {@code true} only for a boolean {@code true}
     */
    public static boolean isTrue(@Nonnull FormulaValue result) {
        return result.getKind() == ValueKind.BOOLEAN && ((BooleanValue)result).getValue();
    }

    @Nonnull
    private static CompletableFuture<FormulaValue> evaluatePredicate(@Nonnull EvaluationContext context,
                                                                    @Nonnull TableRow row,
                                                                    @Nonnull List<LambdaValue> predicates,
                                                                    int index) {
        return predicates.get(index).evaluateInRow(context, row).thenCompose(result -> {
            if (!isTrue(result) || index + 1 == predicates.size()) {
                return CompletableFuture.completedFuture(result);
            }
            context.checkCancel();
            return evaluatePredicate(context, row, predicates, index + 1);
        });
    }

    @Nonnull
    private static CompletableFuture<List<FormulaValue>> evaluateInSequence(@Nonnull EvaluationContext context,
                                                                           @Nonnull TableRow row,
                                                                           @Nonnull List<LambdaValue> lambdas,
                                                                           int index,
                                                                           @Nonnull List<FormulaValue> results) {
        if (index == lambdas.size()) {
            return CompletableFuture.completedFuture(results);
        }
        return lambdas.get(index).evaluateInRow(context, row).thenCompose(result -> {
            results.add(result);
            return evaluateInSequence(context, row, lambdas, index + 1, results);
        });
    }

    private static void logFanOut(@Nonnull EvaluationContext context, int rowCount) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("evaluating row lambdas",
                    LogMessageKeys.ROW_COUNT, rowCount,
                    LogMessageKeys.PIPELINE_SIZE, context.getProperties().getRowPipelineSize()));
        }
    }
}
