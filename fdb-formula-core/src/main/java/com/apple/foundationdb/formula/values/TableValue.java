/*
 * TableValue.java
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

package com.apple.foundationdb.formula.values;

import com.apple.foundationdb.formula.annotation.API;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered sequence of {@link TableRow}s. Operators over tables produce new tables and never modify their
 * inputs.
 */
@API(API.Status.STABLE)
public final class TableValue extends FormulaValue {
    /**
     * Name of the column of a single-column table built from scalars.
     */
    public static final String VALUE_COLUMN = "Value";

    @Nonnull
    private final ImmutableList<TableRow> rows;

    public TableValue(@Nonnull IRContext irContext, @Nonnull List<TableRow> rows) {
        super(irContext);
        final FormulaType type = irContext.getResultType();
        if (type.getCode() == FormulaType.TypeCode.TABLE) {
            final FormulaType rowType = type.toRecord();
            this.rows = rows.stream().map(row -> row.withScopeType(rowType)).collect(ImmutableList.toImmutableList());
        } else {
            this.rows = ImmutableList.copyOf(rows);
        }
    }

    /**
     * Create a table of records. The table type is taken from the first record, or is a table without columns
     * when there are none.
     * @param records the rows
     * @return a new table
     */
    @Nonnull
    public static TableValue ofRecords(@Nonnull List<RecordValue> records) {
        final FormulaType type = records.isEmpty()
                ? FormulaType.tableOf(ImmutableMap.of())
                : records.get(0).getType().toTable();
        return new TableValue(IRContext.notInSource(type),
                records.stream().map(TableRow::of).collect(Collectors.toList()));
    }

    @Nonnull
    public static TableValue ofRecords(@Nonnull RecordValue... records) {
        return ofRecords(ImmutableList.copyOf(records));
    }

    /**
     * Create a single-column table, one row per value, with the column named {@link #VALUE_COLUMN}.
     * @param irContext the context of the table
     * @param values the cell values
     * @return a new table
     */
    @Nonnull
    public static TableValue singleColumn(@Nonnull IRContext irContext, @Nonnull List<? extends FormulaValue> values) {
        final FormulaType rowType = irContext.getResultType().getCode() == FormulaType.TypeCode.TABLE
                ? irContext.getResultType().toRecord()
                : FormulaType.EMPTY_RECORD;
        return new TableValue(irContext, values.stream()
                .map(value -> TableRow.of(new RecordValue(IRContext.notInSource(rowType), ImmutableMap.of(VALUE_COLUMN, value))))
                .collect(Collectors.toList()));
    }

    @Nonnull
    public ImmutableList<TableRow> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Whether the table's type has exactly one column.
     * @return whether this is a single-column table
     */
    public boolean isSingleColumn() {
        return getType().getFields().size() == 1;
    }

    /**
     * Read the cells of a single-column table. Blank and error rows read as themselves.
     * @return one value per row, in order
     */
    @Nonnull
    public List<FormulaValue> getSingleColumnValues() {
        final String column = getType().getFields().isEmpty() ? VALUE_COLUMN : getType().getFields().keySet().iterator().next();
        return rows.stream()
                .map(row -> row.isValue() ? row.getRecord().getField(column) : row.toFormulaValue())
                .collect(Collectors.toList());
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.TABLE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TableValue && ((TableValue)o).rows.equals(rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Table" + rows;
    }
}
