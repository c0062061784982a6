/*
 * RecordValue.java
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
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An ordered mapping of unique field names to values. Records are immutable; the {@code with} methods return
 * copies.
 */
@API(API.Status.STABLE)
public final class RecordValue extends FormulaValue {
    @Nonnull
    private static final RecordValue EMPTY = new RecordValue(IRContext.notInSource(FormulaType.EMPTY_RECORD), ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, FormulaValue> fields;

    public RecordValue(@Nonnull IRContext irContext, @Nonnull Map<String, ? extends FormulaValue> fields) {
        super(irContext);
        this.fields = ImmutableMap.copyOf(fields);
    }

    /**
     * Create a record whose type is derived from the types of its field values.
     * @param fields the fields, in order
     * @return a new record
     */
    @Nonnull
    public static RecordValue of(@Nonnull Map<String, ? extends FormulaValue> fields) {
        return new RecordValue(IRContext.notInSource(typeOf(fields)), fields);
    }

    @Nonnull
    public static RecordValue of(@Nonnull String name, @Nonnull FormulaValue value) {
        return of(ImmutableMap.of(name, value));
    }

    @Nonnull
    public static RecordValue of(@Nonnull String name1, @Nonnull FormulaValue value1,
                                 @Nonnull String name2, @Nonnull FormulaValue value2) {
        return of(ImmutableMap.of(name1, value1, name2, value2));
    }

    /**
     * The record with no fields. A blank or error row that does not belong to a table is bound as this record
     * when a row-scoped lambda runs over it.
     * @return the empty record
     */
    @Nonnull
    public static RecordValue empty() {
        return EMPTY;
    }

    @Nonnull
    private static FormulaType typeOf(@Nonnull Map<String, ? extends FormulaValue> fields) {
        final Map<String, FormulaType> types = new LinkedHashMap<>();
        fields.forEach((name, value) -> types.put(name, value.getType()));
        return FormulaType.recordOf(types);
    }

    @Nonnull
    public ImmutableMap<String, FormulaValue> getFields() {
        return fields;
    }

    public boolean hasField(@Nonnull String name) {
        return fields.containsKey(name);
    }

    /**
     * Get a field's value. A field that the record does not hold reads as a blank of the field's declared type.
     * @param name the field name
     * @return the value of the field
     */
    @Nonnull
    public FormulaValue getField(@Nonnull String name) {
        final FormulaValue value = fields.get(name);
        return value == null ? BlankValue.of(getType().getFieldType(name)) : value;
    }

    @Nullable
    public FormulaValue getFieldOrNull(@Nonnull String name) {
        return fields.get(name);
    }

    /**
     * Return a copy of this record with a field added, or replaced in place if the name already exists.
     * @param name the field name
     * @param value the field value
     * @return the new record
     */
    @Nonnull
    public RecordValue withField(@Nonnull String name, @Nonnull FormulaValue value) {
        final Map<String, FormulaValue> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        final Map<String, FormulaType> types = new LinkedHashMap<>(getType().getFields());
        types.put(name, value.getType());
        return new RecordValue(getIRContext().withResultType(FormulaType.recordOf(types)), copy);
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.RECORD;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordValue && ((RecordValue)o).fields.equals(fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Record" + fields;
    }
}
