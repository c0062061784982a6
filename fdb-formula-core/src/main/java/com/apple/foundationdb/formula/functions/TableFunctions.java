/*
 * TableFunctions.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.async.MoreAsyncUtil;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.table.RowScopedEvaluator;
import com.apple.foundationdb.formula.table.SortKeys;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.ErrorValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.LambdaValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import com.apple.foundationdb.formula.values.RecordValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.TableRow;
import com.apple.foundationdb.formula.values.TableValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.apple.foundationdb.formula.values.VoidValue;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Table operators. The lambda-taking operators evaluate their lambdas with each row's fields in scope and are
 * asynchronous; the rest are plain functions. Every operator expects its arguments to have passed the error
 * handling pipeline, so the first argument is a table and lambda arguments are lambdas.
 */
@API(API.Status.UNSTABLE)
public final class TableFunctions {
    private static final Logger LOGGER = LoggerFactory.getLogger(TableFunctions.class);

    static final String DESCENDING = "descending";

    private TableFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * {@code Filter(table, predicate, ...)}: keep the rows for which every predicate is {@code true}, in their
     * original order. Rows whose predicate is blank or not a boolean are dropped. If any predicate produces an
     * error, the result is all such errors combined.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by one or more predicates
     * @return a future with the filtered table or the combined error
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> filter(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                         @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final List<LambdaValue> predicates = lambdas(args, 1);
        final List<TableRow> rows = table.getRows();
        return RowScopedEvaluator.evaluatePredicates(context, rows, predicates).thenApply(results -> {
            final List<TableRow> kept = new ArrayList<>();
            final List<ErrorValue> errors = new ArrayList<>();
            for (int i = 0; i < rows.size(); i++) {
                final FormulaValue result = results.get(i);
                if (result.getKind() == ValueKind.ERROR) {
                    errors.add((ErrorValue)result);
                } else if (RowScopedEvaluator.isTrue(result)) {
                    kept.add(rows.get(i));
                }
            }
            if (!errors.isEmpty()) {
                logRowErrors("Filter", errors.size());
                return ErrorValue.combine(irContext, errors);
            }
            return new TableValue(irContext, kept);
        });
    }

    /**
     * {@code ForAll(table, lambda)}: evaluate the lambda for every row. Record results become the rows of the
     * result; other results become the {@link TableValue#VALUE_COLUMN} of single-column rows. Errors from any
     * rows are combined. When the call is typed void the result is the void marker.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table and the lambda
     * @return a future with the result table, the combined error, or void
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> forAll(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                         @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final LambdaValue lambda = (LambdaValue)args.get(1);
        return RowScopedEvaluator.evaluate(context, table.getRows(), lambda).thenApply(results -> {
            if (irContext.getResultType().getCode() == FormulaType.TypeCode.VOID) {
                return new VoidValue(irContext);
            }
            final IRContext rowContext = rowContext(irContext);
            final List<TableRow> rows = new ArrayList<>(results.size());
            final List<ErrorValue> errors = new ArrayList<>();
            for (FormulaValue result : results) {
                switch (result.getKind()) {
                    case ERROR:
                        errors.add((ErrorValue)result);
                        break;
                    case RECORD:
                        rows.add(TableRow.of((RecordValue)result));
                        break;
                    case VOID:
                        break;
                    default:
                        rows.add(TableRow.of(new RecordValue(rowContext, Map.of(TableValue.VALUE_COLUMN, result))));
                        break;
                }
            }
            if (!errors.isEmpty()) {
                logRowErrors("ForAll", errors.size());
                return ErrorValue.combine(irContext, errors);
            }
            return new TableValue(irContext, rows);
        });
    }

    /**
     * {@code LookUp(table, predicate[, projection])}: find the first row for which the predicate is
     * {@code true}. Rows are examined in order and the scan stops at the first match or the first predicate
     * error, which is the result. Without a projection the matching row is the result; with one, the projection
     * evaluated for that row. No match is blank.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table, the predicate and an optional projection
     * @return a future with the found value, blank or an error
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> lookUp(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                         @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        final List<LambdaValue> predicate = ImmutableList.of((LambdaValue)args.get(1));
        final AtomicInteger index = new AtomicInteger();
        final AtomicReference<TableRow> match = new AtomicReference<>();
        final AtomicReference<FormulaValue> failure = new AtomicReference<>();
        return MoreAsyncUtil.whileTrue(() -> {
            final int rowIndex = index.getAndIncrement();
            if (rowIndex >= rows.size()) {
                return CompletableFuture.completedFuture(false);
            }
            context.checkCancel();
            final TableRow row = rows.get(rowIndex);
            return RowScopedEvaluator.evaluatePredicates(context, row, predicate).thenApply(result -> {
                if (result.getKind() == ValueKind.ERROR) {
                    failure.set(result);
                    return false;
                }
                if (RowScopedEvaluator.isTrue(result)) {
                    match.set(row);
                    return false;
                }
                return true;
            });
        }).thenCompose(vignore -> {
            if (failure.get() != null) {
                return CompletableFuture.completedFuture(failure.get());
            }
            final TableRow found = match.get();
            if (found == null) {
                return CompletableFuture.completedFuture(BlankValue.of(irContext));
            }
            if (args.size() > 2) {
                return ((LambdaValue)args.get(2)).evaluateInRow(context, found);
            }
            return CompletableFuture.completedFuture(found.toFormulaValue());
        });
    }

    /**
     * {@code AddColumns(table, name, lambda, ...)}: append named columns computed by row-scoped lambdas. Blank and
     * error rows keep their shape but their lambdas are still evaluated; an error from any lambda turns the row
     * into an error, combined with the row's own error if it had one.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by pairs of column name and lambda
     * @return a future with the extended table
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> addColumns(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                             @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final List<String> names = new ArrayList<>();
        final List<LambdaValue> lambdas = new ArrayList<>();
        for (int i = 1; i + 1 < args.size(); i += 2) {
            names.add(((StringValue)args.get(i)).getValue());
            lambdas.add((LambdaValue)args.get(i + 1));
        }
        final List<TableRow> rows = table.getRows();
        final IRContext rowContext = rowContext(irContext);
        return RowScopedEvaluator.evaluateAll(context, rows, lambdas).thenApply(results -> {
            final List<TableRow> extended = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                final TableRow row = rows.get(i);
                final List<FormulaValue> columns = results.get(i);
                final List<ErrorValue> errors = new ArrayList<>();
                if (row.isError()) {
                    errors.add(row.getError());
                }
                for (FormulaValue column : columns) {
                    if (column.getKind() == ValueKind.ERROR) {
                        errors.add((ErrorValue)column);
                    }
                }
                if (errors.size() > (row.isError() ? 1 : 0)) {
                    extended.add(TableRow.of(ErrorValue.combine(rowContext, errors)));
                } else if (row.isValue()) {
                    final Map<String, FormulaValue> fields = new LinkedHashMap<>(row.getRecord().getFields());
                    for (int c = 0; c < names.size(); c++) {
                        fields.put(names.get(c), columns.get(c));
                    }
                    extended.add(TableRow.of(new RecordValue(rowContext, fields)));
                } else {
                    extended.add(row);
                }
            }
            return new TableValue(irContext, extended);
        });
    }

    /**
     * {@code Sort(table, key[, order])}: stably sort rows by a row-scoped key. The order is "Ascending" or
     * "Descending", ignoring case; any other order is an invalid argument. Keys must share one sortable kind; blank keys sort last. Key errors from
     * any row are combined into the result.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table, the key lambda and an optional order
     * @return a future with the sorted table or an error
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> sort(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                       @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        final LambdaValue key = (LambdaValue)args.get(1);
        final boolean ascending;
        if (args.size() > 2) {
            if (args.get(2).getKind() != ValueKind.STRING) {
                return CompletableFuture.completedFuture(CommonErrors.runtimeTypeMismatch(irContext));
            }
            if (!isOrder(args.get(2))) {
                return CompletableFuture.completedFuture(
                        CommonErrors.invalidArgument(irContext, "The third argument to the Sort function is invalid"));
            }
            ascending = isAscending((StringValue)args.get(2));
        } else {
            ascending = true;
        }
        return RowScopedEvaluator.evaluate(context, rows, key).thenApply(keys -> {
            final List<Pair<TableRow, List<FormulaValue>>> rowsWithKeys = new ArrayList<>(rows.size());
            final List<ErrorValue> errors = new ArrayList<>();
            for (int i = 0; i < rows.size(); i++) {
                final FormulaValue sortKey = rows.get(i).isError() ? rows.get(i).toFormulaValue() : keys.get(i);
                if (sortKey.getKind() == ValueKind.ERROR) {
                    errors.add((ErrorValue)sortKey);
                }
                rowsWithKeys.add(Pair.of(rows.get(i), ImmutableList.of(sortKey)));
            }
            if (!errors.isEmpty()) {
                logRowErrors("Sort", errors.size());
                return ErrorValue.combine(irContext, errors);
            }
            final ValueKind kind = SortKeys.commonKind(keys);
            if (kind == null) {
                return CommonErrors.runtimeTypeMismatch(irContext);
            }
            context.checkCancel();
            return new TableValue(irContext, SortKeys.sortRows(rowsWithKeys, ImmutableList.of(kind), ImmutableList.of(ascending), context));
        });
    }

    /**
     * {@code SortByColumns(table, column[, order], ...)}: stably sort rows by named columns, each with its own
     * order, falling through to the next column on ties. A column the table does not have is an error. Blank rows
     * have blank keys; error rows and error cells are combined into the result.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by column names, each optionally followed by an order
     * @return the sorted table or an error
     */
    @Nonnull
    public static FormulaValue sortByColumns(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                             @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final List<String> columns = new ArrayList<>();
        final List<Boolean> ascending = new ArrayList<>();
        int i = 1;
        while (i < args.size()) {
            final String column = ((StringValue)args.get(i)).getValue();
            if (!table.getType().getFields().containsKey(column)) {
                return CommonErrors.invalidSortColumn(irContext, column);
            }
            columns.add(column);
            if (i + 1 < args.size() && isOrder(args.get(i + 1))) {
                ascending.add(isAscending((StringValue)args.get(i + 1)));
                i += 2;
            } else {
                ascending.add(true);
                i++;
            }
        }
        final List<Pair<TableRow, List<FormulaValue>>> rowsWithKeys = new ArrayList<>();
        final List<ErrorValue> errors = new ArrayList<>();
        for (TableRow row : table.getRows()) {
            context.checkCancel();
            if (row.isError()) {
                errors.add(row.getError());
                continue;
            }
            final List<FormulaValue> keys = new ArrayList<>(columns.size());
            for (String column : columns) {
                final FormulaValue key = row.isValue() ? row.getRecord().getField(column) : row.toFormulaValue();
                if (key.getKind() == ValueKind.ERROR) {
                    errors.add((ErrorValue)key);
                }
                keys.add(key);
            }
            rowsWithKeys.add(Pair.of(row, keys));
        }
        if (!errors.isEmpty()) {
            logRowErrors("SortByColumns", errors.size());
            return ErrorValue.combine(irContext, errors);
        }
        final List<ValueKind> kinds = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            final List<FormulaValue> columnKeys = new ArrayList<>(rowsWithKeys.size());
            for (Pair<TableRow, List<FormulaValue>> pair : rowsWithKeys) {
                columnKeys.add(pair.getRight().get(c));
            }
            final ValueKind kind = SortKeys.commonKind(columnKeys);
            if (kind == null) {
                return CommonErrors.invalidSortColumn(irContext, columns.get(c));
            }
            kinds.add(kind);
        }
        return new TableValue(irContext, SortKeys.sortRows(rowsWithKeys, kinds, ascending, context));
    }

    /**
     * {@code CountIf(table, predicate, ...)}: count the rows for which every predicate is {@code true}. If any
     * predicate produces an error, the result is all such errors combined. A blank table counts 0.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by one or more predicates
     * @return a future with the count or the combined error
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> countIf(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                          @Nonnull List<FormulaValue> args) {
        if (args.get(0).isBlank()) {
            return CompletableFuture.completedFuture(NumericConversions.numberOrDecimal(irContext, 0));
        }
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        return RowScopedEvaluator.evaluatePredicates(context, rows, lambdas(args, 1)).thenApply(results -> {
            int count = 0;
            final List<ErrorValue> errors = new ArrayList<>();
            for (FormulaValue result : results) {
                if (result.getKind() == ValueKind.ERROR) {
                    errors.add((ErrorValue)result);
                } else if (RowScopedEvaluator.isTrue(result)) {
                    count++;
                }
            }
            if (!errors.isEmpty()) {
                logRowErrors("CountIf", errors.size());
                return ErrorValue.combine(irContext, errors);
            }
            return NumericConversions.numberOrDecimal(irContext, count);
        });
    }

    /**
     * {@code CountRows(table)}: the number of rows, including blank and error rows. A blank table has none.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table
     * @return the row count
     */
    @Nonnull
    public static FormulaValue countRows(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                         @Nonnull List<FormulaValue> args) {
        if (args.get(0).isBlank()) {
            return NumericConversions.numberOrDecimal(irContext, 0);
        }
        return NumericConversions.numberOrDecimal(irContext, ((TableValue)args.get(0)).getRowCount());
    }

    /**
     * {@code Count(table)}: the number of numeric cells of a single-column table. The first error cell is the
     * result.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table
     * @return the count or an error
     */
    @Nonnull
    public static FormulaValue count(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                     @Nonnull List<FormulaValue> args) {
        return countCells(irContext, args.get(0), true);
    }

    /**
     * {@code CountA(table)}: the number of non-blank cells of a single-column table. The first error cell is the
     * result.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table
     * @return the count or an error
     */
    @Nonnull
    public static FormulaValue countA(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                      @Nonnull List<FormulaValue> args) {
        return countCells(irContext, args.get(0), false);
    }

    @Nonnull
    private static FormulaValue countCells(@Nonnull IRContext irContext, @Nonnull FormulaValue arg, boolean numericOnly) {
        if (arg.isBlank()) {
            return NumericConversions.numberOrDecimal(irContext, 0);
        }
        int count = 0;
        for (FormulaValue cell : ((TableValue)arg).getSingleColumnValues()) {
            if (cell.getKind() == ValueKind.ERROR) {
                return cell;
            }
            if (numericOnly ? NumericConversions.isNumeric(cell) : !isEmptyCell(cell)) {
                count++;
            }
        }
        return NumericConversions.numberOrDecimal(irContext, count);
    }

    private static boolean isEmptyCell(@Nonnull FormulaValue cell) {
        return cell.isBlank() || (cell.getKind() == ValueKind.STRING && ((StringValue)cell).getValue().isEmpty());
    }

    @Nonnull
    public static FormulaValue first(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                     @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        return rows.isEmpty() ? BlankValue.of(irContext) : rows.get(0).toFormulaValue();
    }

    @Nonnull
    public static FormulaValue last(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                    @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        return rows.isEmpty() ? BlankValue.of(irContext) : rows.get(rows.size() - 1).toFormulaValue();
    }

    /**
     * {@code FirstN(table[, n])}: the first {@code n} rows, one by default. A negative count is an error.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table and the count
     * @return the leading rows
     */
    @Nonnull
    public static FormulaValue firstN(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                      @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        final int n = rowCountArgument(args);
        if (n < 0) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
        return new TableValue(irContext, rows.subList(0, Math.min(n, rows.size())));
    }

    /**
     * {@code LastN(table[, n])}: the last {@code n} rows, one by default. A negative count is an error.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table and the count
     * @return the trailing rows
     */
    @Nonnull
    public static FormulaValue lastN(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                     @Nonnull List<FormulaValue> args) {
        final List<TableRow> rows = ((TableValue)args.get(0)).getRows();
        final int n = rowCountArgument(args);
        if (n < 0) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
        return new TableValue(irContext, rows.subList(Math.max(0, rows.size() - n), rows.size()));
    }

    private static int rowCountArgument(@Nonnull List<FormulaValue> args) {
        if (args.size() < 2 || !NumericConversions.isNumeric(args.get(1))) {
            return 1;
        }
        final double n = NumericConversions.toDouble(args.get(1));
        return n >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int)Math.floor(n);
    }

    /**
     * {@code DropColumns(table, name, ...)}: remove the named columns from every row.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by column names
     * @return the narrowed table
     */
    @Nonnull
    public static FormulaValue dropColumns(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                           @Nonnull List<FormulaValue> args) {
        final Set<String> dropped = columnNames(args);
        return mapRecords(context, irContext, (TableValue)args.get(0), record -> {
            final Map<String, FormulaValue> fields = new LinkedHashMap<>(record.getFields());
            fields.keySet().removeAll(dropped);
            return fields;
        });
    }

    /**
     * {@code ShowColumns(table, name, ...)}: keep only the named columns, in the order given. A column the table
     * does not have is an error.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by column names
     * @return the narrowed table
     */
    @Nonnull
    public static FormulaValue showColumns(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                           @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final Set<String> shown = columnNames(args);
        for (String column : shown) {
            if (!table.getType().getFields().containsKey(column)) {
                return CommonErrors.invalidArgument(irContext, "The specified column '" + column + "' does not exist.");
            }
        }
        return mapRecords(context, irContext, table, record -> {
            final Map<String, FormulaValue> fields = new LinkedHashMap<>();
            for (String column : shown) {
                fields.put(column, record.getField(column));
            }
            return fields;
        });
    }

    /**
     * {@code RenameColumns(table, old, new, ...)}: rename columns, keeping their position.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table followed by pairs of old and new names
     * @return the renamed table
     */
    @Nonnull
    public static FormulaValue renameColumns(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                             @Nonnull List<FormulaValue> args) {
        final Map<String, String> renames = new LinkedHashMap<>();
        for (int i = 1; i + 1 < args.size(); i += 2) {
            renames.put(((StringValue)args.get(i)).getValue(), ((StringValue)args.get(i + 1)).getValue());
        }
        return mapRecords(context, irContext, (TableValue)args.get(0), record -> {
            final Map<String, FormulaValue> fields = new LinkedHashMap<>();
            record.getFields().forEach((name, value) -> fields.put(renames.getOrDefault(name, name), value));
            return fields;
        });
    }

    /**
     * {@code Distinct(table, lambda)}: the distinct values of a row-scoped lambda, in order of first appearance,
     * as a single-column table. The first error is the result; non-primitive values are not allowed.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the table and the lambda
     * @return a future with the distinct values or an error
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> distinct(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                           @Nonnull List<FormulaValue> args) {
        final TableValue table = (TableValue)args.get(0);
        final LambdaValue lambda = (LambdaValue)args.get(1);
        return RowScopedEvaluator.evaluate(context, table.getRows(), lambda).thenApply(results -> {
            final Set<FormulaValue> seen = new LinkedHashSet<>();
            for (FormulaValue result : results) {
                if (result.getKind() == ValueKind.ERROR) {
                    return result;
                }
                if (result.getKind() == ValueKind.RECORD || result.getKind() == ValueKind.TABLE) {
                    return CommonErrors.invalidArgument(irContext, "Only primitive values are allowed.");
                }
                seen.add(result);
            }
            return TableValue.singleColumn(irContext, new ArrayList<>(seen));
        });
    }

    @Nonnull
    private static FormulaValue mapRecords(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                           @Nonnull TableValue table,
                                           @Nonnull Function<RecordValue, Map<String, FormulaValue>> mapper) {
        final IRContext rowContext = rowContext(irContext);
        final List<TableRow> rows = new ArrayList<>(table.getRowCount());
        for (TableRow row : table.getRows()) {
            context.checkCancel();
            rows.add(row.isValue() ? TableRow.of(new RecordValue(rowContext, mapper.apply(row.getRecord()))) : row);
        }
        return new TableValue(irContext, rows);
    }

    @Nonnull
    private static Set<String> columnNames(@Nonnull List<FormulaValue> args) {
        final Set<String> names = new LinkedHashSet<>();
        for (FormulaValue arg : args.subList(1, args.size())) {
            names.add(((StringValue)arg).getValue());
        }
        return names;
    }

    @Nonnull
    private static List<LambdaValue> lambdas(@Nonnull List<FormulaValue> args, int from) {
        final List<LambdaValue> lambdas = new ArrayList<>(args.size() - from);
        for (FormulaValue arg : args.subList(from, args.size())) {
            lambdas.add((LambdaValue)arg);
        }
        return lambdas;
    }

    /**
     * Context for the rows of a table-typed call. Calls not typed as a table get rows of the empty record type.
     * @param irContext the context of the call
     * @return the context for its rows
     */
    @Nonnull
    static IRContext rowContext(@Nonnull IRContext irContext) {
        final FormulaType type = irContext.getResultType();
        return IRContext.notInSource(type.isAggregate() ? type.toRecord() : FormulaType.EMPTY_RECORD);
    }

    private static boolean isOrder(@Nonnull FormulaValue arg) {
        if (arg.getKind() != ValueKind.STRING) {
            return false;
        }
        final String order = ((StringValue)arg).getValue().toLowerCase(Locale.ROOT);
        return order.equals(DESCENDING) || order.equals("ascending");
    }

    private static boolean isAscending(@Nonnull StringValue order) {
        return !order.getValue().equalsIgnoreCase(DESCENDING);
    }

    private static void logRowErrors(@Nonnull String function, int errorCount) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("row errors combined",
                    LogMessageKeys.FUNCTION, function,
                    LogMessageKeys.ERROR_COUNT, errorCount));
        }
    }
}
