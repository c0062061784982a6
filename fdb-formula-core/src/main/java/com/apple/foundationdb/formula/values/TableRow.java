/*
 * TableRow.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One row of a {@link TableValue}: a record, a blank, or an error. Tables hold rows positionally; a row has no
 * identity beyond its position.
 */
@API(API.Status.STABLE)
public final class TableRow {
    @Nonnull
    private final FormulaValue value;
    @Nullable
    private final FormulaType scopeType;

    private TableRow(@Nonnull FormulaValue value) {
        this(value, null);
    }

    private TableRow(@Nonnull FormulaValue value, @Nullable FormulaType scopeType) {
        this.value = value;
        this.scopeType = scopeType;
    }

    @Nonnull
    public static TableRow of(@Nonnull RecordValue record) {
        return new TableRow(record);
    }

    @Nonnull
    public static TableRow of(@Nonnull BlankValue blank) {
        return new TableRow(blank);
    }

    @Nonnull
    public static TableRow of(@Nonnull ErrorValue error) {
        return new TableRow(error);
    }

    /**
     * Wrap a value that must be a record, a blank or an error.
     * @param value the row value
     * @return the row
     */
    @Nonnull
    public static TableRow fromValue(@Nonnull FormulaValue value) {
        final ValueKind kind = value.getKind();
        Preconditions.checkArgument(kind == ValueKind.RECORD || kind == ValueKind.BLANK || kind == ValueKind.ERROR,
                "a table row cannot hold a %s", kind);
        return new TableRow(value);
    }

    public boolean isValue() {
        return value.getKind() == ValueKind.RECORD;
    }

    public boolean isBlank() {
        return value.getKind() == ValueKind.BLANK;
    }

    public boolean isError() {
        return value.getKind() == ValueKind.ERROR;
    }

    @Nonnull
    public RecordValue getRecord() {
        Preconditions.checkState(isValue(), "row is not a record");
        return (RecordValue)value;
    }

    @Nonnull
    public ErrorValue getError() {
        Preconditions.checkState(isError(), "row is not an error");
        return (ErrorValue)value;
    }

    /**
     * Attach the record type of the table holding this row. A blank or error row binds a record of that type
     * with no values, so its columns read as blanks and hide same-named fields of enclosing scopes.
     * @param rowType the record type of the table's rows
     * @return a row with the scope type, or this row if it is a record
     */
    @Nonnull
    public TableRow withScopeType(@Nonnull FormulaType rowType) {
        return isValue() || rowType.equals(scopeType) ? this : new TableRow(value, rowType);
    }

    /**
     * The record to bind as the scope of a row-scoped lambda. Blank and error rows bind a record without values,
     * typed by the table's row type when the row belongs to a table, so the lambda reads blanks for every field.
     * @return the scope record
     */
    @Nonnull
    public RecordValue toScope() {
        if (isValue()) {
            return (RecordValue)value;
        }
        return scopeType == null ? RecordValue.empty() : new RecordValue(IRContext.notInSource(scopeType), ImmutableMap.of());
    }

    @Nonnull
    public FormulaValue toFormulaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TableRow && ((TableRow)o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
