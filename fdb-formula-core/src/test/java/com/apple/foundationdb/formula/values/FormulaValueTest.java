/*
 * FormulaValueTest.java
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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the value variants and their types.
 */
public class FormulaValueTest {

    @Test
    public void guidsCompareByValue() {
        final UUID id = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
        final GuidValue guid = GuidValue.of(id);
        assertThat(guid.getKind(), equalTo(ValueKind.GUID));
        assertThat(guid.getType(), equalTo(FormulaType.GUID));
        assertThat(guid, equalTo(GuidValue.of(UUID.fromString("3F2504E0-4F89-11D3-9A0C-0305E82C3301"))));
        assertThat(guid, not(equalTo(GuidValue.of(UUID.randomUUID()))));
    }

    @Test
    public void blankKeepsItsType() {
        final BlankValue blank = BlankValue.of(FormulaType.DATE);
        assertTrue(blank.isBlank());
        assertFalse(blank.isError());
        assertThat(blank.getType(), equalTo(FormulaType.DATE));
    }

    @Test
    public void voidValue() {
        final VoidValue value = new VoidValue(IRContext.notInSource(FormulaType.VOID));
        assertThat(value.getKind(), equalTo(ValueKind.VOID));
        assertFalse(value.isBlank());
    }

    @Test
    public void sourceSpansTravelWithContext() {
        final IRContext context = IRContext.of(FormulaType.NUMBER, new SourceSpan(3, 9));
        final IRContext retyped = context.withResultType(FormulaType.DECIMAL);
        assertThat(retyped.getSourceSpan(), equalTo(new SourceSpan(3, 9)));
        assertThat(retyped.getResultType(), equalTo(FormulaType.DECIMAL));
        assertThat(IRContext.notInSource(FormulaType.NUMBER).getSourceSpan(), nullValue());
    }

    @Test
    public void recordAndTableTypes() {
        final RecordValue record = RecordValue.of("a", NumberValue.of(1), "b", StringValue.of("x"));
        final FormulaType recordType = record.getType();
        assertThat(recordType.getFieldType("a"), equalTo(FormulaType.NUMBER));
        assertThat(recordType.getFieldType("missing"), equalTo(FormulaType.BLANK));
        assertThat(recordType.toTable().toRecord(), equalTo(recordType));
        assertThat(FormulaType.singleColumnTableOf(FormulaType.STRING),
                equalTo(FormulaType.tableOf(ImmutableMap.of(TableValue.VALUE_COLUMN, FormulaType.STRING))));
        assertThrows(IllegalStateException.class, FormulaType.NUMBER::toTable);
    }

    @Test
    public void missingRecordFieldIsTypedBlank() {
        final RecordValue record = RecordValue.of("a", NumberValue.of(1));
        assertTrue(record.getField("z").isBlank());
        assertThat(record.getFieldOrNull("z"), nullValue());
        assertThat(record.withField("z", BooleanValue.of(true)).getField("z"), equalTo(BooleanValue.of(true)));
    }
}
