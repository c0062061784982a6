/*
 * FormulaType.java
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
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compile-time type of a value, as decided by the binder and carried at runtime inside an {@link IRContext}.
 * Record and table types also carry their field types, in declaration order.
 */
@API(API.Status.STABLE)
public final class FormulaType {
    /**
     * The type code of a {@link FormulaType}.
     */
    public enum TypeCode {
        NUMBER,
        DECIMAL,
        BOOLEAN,
        STRING,
        GUID,
        DATE,
        TIME,
        DATE_TIME,
        BLANK,
        ERROR,
        RECORD,
        TABLE,
        LAMBDA,
        VOID,
        UNKNOWN;

        public boolean isPrimitive() {
            return this != RECORD && this != TABLE && this != LAMBDA && this != VOID && this != UNKNOWN;
        }
    }

    public static final FormulaType NUMBER = new FormulaType(TypeCode.NUMBER, null);
    public static final FormulaType DECIMAL = new FormulaType(TypeCode.DECIMAL, null);
    public static final FormulaType BOOLEAN = new FormulaType(TypeCode.BOOLEAN, null);
    public static final FormulaType STRING = new FormulaType(TypeCode.STRING, null);
    public static final FormulaType GUID = new FormulaType(TypeCode.GUID, null);
    public static final FormulaType DATE = new FormulaType(TypeCode.DATE, null);
    public static final FormulaType TIME = new FormulaType(TypeCode.TIME, null);
    public static final FormulaType DATE_TIME = new FormulaType(TypeCode.DATE_TIME, null);
    public static final FormulaType BLANK = new FormulaType(TypeCode.BLANK, null);
    public static final FormulaType ERROR = new FormulaType(TypeCode.ERROR, null);
    public static final FormulaType LAMBDA = new FormulaType(TypeCode.LAMBDA, null);
    public static final FormulaType VOID = new FormulaType(TypeCode.VOID, null);
    public static final FormulaType UNKNOWN = new FormulaType(TypeCode.UNKNOWN, null);
    public static final FormulaType EMPTY_RECORD = new FormulaType(TypeCode.RECORD, ImmutableMap.of());

    @Nonnull
    private final TypeCode code;
    @Nullable
    private final ImmutableMap<String, FormulaType> fields;

    private FormulaType(@Nonnull TypeCode code, @Nullable ImmutableMap<String, FormulaType> fields) {
        this.code = code;
        this.fields = fields;
    }

    @Nonnull
    public static FormulaType recordOf(@Nonnull Map<String, FormulaType> fields) {
        return new FormulaType(TypeCode.RECORD, ImmutableMap.copyOf(fields));
    }

    @Nonnull
    public static FormulaType tableOf(@Nonnull Map<String, FormulaType> fields) {
        return new FormulaType(TypeCode.TABLE, ImmutableMap.copyOf(fields));
    }

    /**
     * Type of a single-column table whose column is named {@link TableValue#VALUE_COLUMN}.
     * @param columnType the type of the cells
     * @return the table type
     */
    @Nonnull
    public static FormulaType singleColumnTableOf(@Nonnull FormulaType columnType) {
        return tableOf(ImmutableMap.of(TableValue.VALUE_COLUMN, columnType));
    }

    @Nonnull
    public TypeCode getCode() {
        return code;
    }

    public boolean isAggregate() {
        return code == TypeCode.RECORD || code == TypeCode.TABLE;
    }

    @Nonnull
    public Map<String, FormulaType> getFields() {
        return fields == null ? ImmutableMap.of() : fields;
    }

    /**
     * Get the type of a named field of a record or table type. Unknown fields are typed {@link #BLANK}.
     * @param name the field name
     * @return the field's type
     */
    @Nonnull
    public FormulaType getFieldType(@Nonnull String name) {
        final FormulaType fieldType = getFields().get(name);
        return fieldType == null ? BLANK : fieldType;
    }

    /**
     * Convert a table type to the type of its rows.
     * @return the record type of a row of this table
     */
    @Nonnull
    public FormulaType toRecord() {
        Preconditions.checkState(code == TypeCode.TABLE || code == TypeCode.RECORD, "not a table type: %s", this);
        return code == TypeCode.RECORD ? this : recordOf(getFields());
    }

    /**
     * Convert a record type to the type of a table of such records.
     * @return the table type
     */
    @Nonnull
    public FormulaType toTable() {
        Preconditions.checkState(code == TypeCode.TABLE || code == TypeCode.RECORD, "not a record type: %s", this);
        return code == TypeCode.TABLE ? this : tableOf(getFields());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FormulaType that = (FormulaType)o;
        return code == that.code && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, fields);
    }

    @Override
    public String toString() {
        if (!isAggregate()) {
            return code.name();
        }
        return code.name() + getFields().entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
