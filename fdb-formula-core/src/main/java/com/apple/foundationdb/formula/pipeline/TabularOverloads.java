/*
 * TabularOverloads.java
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

package com.apple.foundationdb.formula.pipeline;

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.TableValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Lift scalar functions to single-column tables. The scalar function, pipeline included, runs once per cell;
 * the results form a single-column table in row order. Blank and error rows are passed to the scalar function
 * as blank and error cells, so its pipeline decides what they become.
 */
@API(API.Status.STABLE)
public final class TabularOverloads {
    private TabularOverloads() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Lift a function whose first argument may be a single-column table. Other arguments are passed unchanged
     * to every cell's call.
     * @param scalar the scalar function
     * @return the lifted function
     */
    @Nonnull
    public static FormulaFunction singleColumnTable(@Nonnull FormulaFunction scalar) {
        return (context, irContext, args) -> {
            if (args.length == 0 || args[0].getKind() != ValueKind.TABLE) {
                return scalar.apply(context, irContext, args);
            }
            final List<FormulaValue> cells = ((TableValue)args[0]).getSingleColumnValues();
            final List<List<FormulaValue>> columns = new ArrayList<>(args.length);
            columns.add(cells);
            for (int i = 1; i < args.length; i++) {
                columns.add(null);
            }
            return broadcast(scalar, context, irContext, args, columns, cells.size());
        };
    }

    /**
     * Lift a function where any number of arguments may be single-column tables. The tables are walked
     * positionally; scalar arguments are repeated for every row. Tables of different lengths are a
     * {@link com.apple.foundationdb.formula.values.ErrorKind#NOT_APPLICABLE} error.
     * @param scalar the scalar function
     * @return the lifted function
     */
    @Nonnull
    public static FormulaFunction multiSingleColumnTable(@Nonnull FormulaFunction scalar) {
        return (context, irContext, args) -> {
            final List<List<FormulaValue>> columns = new ArrayList<>(args.length);
            int rowCount = -1;
            for (FormulaValue arg : args) {
                if (arg.getKind() == ValueKind.TABLE) {
                    final List<FormulaValue> cells = ((TableValue)arg).getSingleColumnValues();
                    if (rowCount >= 0 && rowCount != cells.size()) {
                        return CommonErrors.mismatchedTableLengths(irContext);
                    }
                    rowCount = cells.size();
                    columns.add(cells);
                } else {
                    columns.add(null);
                }
            }
            if (rowCount < 0) {
                return scalar.apply(context, irContext, args);
            }
            return broadcast(scalar, context, irContext, args, columns, rowCount);
        };
    }

    @Nonnull
    private static FormulaValue broadcast(@Nonnull FormulaFunction scalar,
                                          @Nonnull EvaluationContext context,
                                          @Nonnull IRContext irContext,
                                          @Nonnull FormulaValue[] args,
                                          @Nonnull List<List<FormulaValue>> columns,
                                          int rowCount) {
        final IRContext tableContext = irContext.getResultType().getCode() == FormulaType.TypeCode.TABLE
                ? irContext
                : irContext.withResultType(FormulaType.singleColumnTableOf(irContext.getResultType()));
        final IRContext cellContext = irContext.withResultType(
                tableContext.getResultType().getFieldType(TableValue.VALUE_COLUMN));
        final List<FormulaValue> results = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            context.checkCancel();
            final FormulaValue[] cellArgs = args.clone();
            for (int i = 0; i < cellArgs.length; i++) {
                final List<FormulaValue> column = columns.get(i);
                if (column != null) {
                    cellArgs[i] = column.get(row);
                }
            }
            results.add(scalar.apply(context, cellContext, cellArgs));
        }
        return TableValue.singleColumn(tableContext, results);
    }
}
