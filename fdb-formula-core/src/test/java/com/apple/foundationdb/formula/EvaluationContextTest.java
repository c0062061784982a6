/*
 * EvaluationContextTest.java
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

package com.apple.foundationdb.formula;

import com.apple.foundationdb.formula.services.CancellationSignal;
import com.apple.foundationdb.formula.services.CancellationSource;
import com.apple.foundationdb.formula.services.ClockService;
import com.apple.foundationdb.formula.services.RandomService;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.RecordValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.TableRow;
import com.apple.foundationdb.formula.values.TableValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

import static com.apple.foundationdb.formula.FormulaTestHelpers.error;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EvaluationContext}, its builder and {@link SymbolContext}.
 */
public class EvaluationContextTest {

    @Test
    public void defaults() {
        final EvaluationContext context = EvaluationContext.empty();
        assertThat(context.getLocale(), equalTo(Locale.ROOT));
        assertThat(context.getTimeZone(), equalTo(ZoneId.systemDefault()));
        assertThat(context.getProperties(), sameInstance(EvaluationProperties.DEFAULT));
        assertThat(context.getProperties().getRowPipelineSize(), equalTo(EvaluationProperties.DEFAULT_ROW_PIPELINE_SIZE));
        assertThat(context.getSymbols(), sameInstance(SymbolContext.EMPTY));
        assertFalse(context.isCancellationRequested());
        final double random = context.nextRandom();
        assertTrue(random >= 0.0 && random < 1.0);
    }

    @Test
    public void childBuilderKeepsServices() {
        final Instant now = Instant.parse("2024-03-10T10:00:00Z");
        final EvaluationContext parent = EvaluationContext.newBuilder()
                .setClock(ClockService.fixed(now))
                .setTimeZone(ZoneId.of("America/Los_Angeles"))
                .setLocale(Locale.FRANCE)
                .build();
        final EvaluationContext child = parent.childBuilder().setLocale(Locale.GERMANY).build();
        assertThat(child.utcNow(), equalTo(now));
        assertThat(child.getTimeZone(), equalTo(ZoneId.of("America/Los_Angeles")));
        assertThat(child.getLocale(), equalTo(Locale.GERMANY));
        assertThat(parent.getLocale(), equalTo(Locale.FRANCE));
    }

    @Test
    public void scopesShadowOuterNames() {
        final EvaluationContext outer = EvaluationContext.empty()
                .withScopeValues(RecordValue.of("a", NumberValue.of(1), "b", NumberValue.of(2)));
        final EvaluationContext inner = outer.withScopeValues(RecordValue.of("a", StringValue.of("x")));
        assertThat(inner.getSymbols().get("a"), equalTo(StringValue.of("x")));
        assertThat(inner.getSymbols().get("b"), equalTo(NumberValue.of(2)));
        assertThat(inner.getSymbols().getDepth(), equalTo(2));
        assertThat(outer.getSymbols().get("a"), equalTo(NumberValue.of(1)));
        final FormulaValue missing = inner.getSymbols().get("c");
        assertThat(missing.getKind(), equalTo(ValueKind.BLANK));
        assertThat(inner.getSymbols().lookUp("c"), nullValue());
        assertFalse(inner.getSymbols().contains("c"));
    }

    @Test
    public void blankRowHidesOuterNamesOfItsColumns() {
        final EvaluationContext outer = EvaluationContext.empty()
                .withScopeValues(RecordValue.of("a", NumberValue.of(1), "b", NumberValue.of(2)));
        final TableValue table = new TableValue(IRContext.notInSource(FormulaType.tableOf(ImmutableMap.of("a", FormulaType.NUMBER))),
                List.of(TableRow.of(BlankValue.of(FormulaType.BLANK)), TableRow.of(error(ErrorKind.DIV0, "row"))));
        for (TableRow row : table.getRows()) {
            final SymbolContext inner = outer.withScopeValues(row.toScope()).getSymbols();
            final FormulaValue a = inner.get("a");
            assertThat(a.getKind(), equalTo(ValueKind.BLANK));
            assertThat(a.getType(), equalTo(FormulaType.NUMBER));
            assertTrue(inner.contains("a"));
            assertThat(inner.get("b"), equalTo(NumberValue.of(2)));
        }
        // a row outside any table has no columns to declare
        final SymbolContext loose = outer.withScopeValues(TableRow.of(BlankValue.of(FormulaType.BLANK)).toScope()).getSymbols();
        assertThat(loose.get("a"), equalTo(NumberValue.of(1)));
    }

    @Test
    public void cancellation() {
        final CancellationSource source = new CancellationSource();
        final EvaluationContext context = EvaluationContext.newBuilder().setCancellationSignal(source).build();
        final EvaluationContext scoped = context.withScopeValues(RecordValue.empty());
        assertDoesNotThrow(scoped::checkCancel);
        source.cancel();
        assertTrue(scoped.isCancellationRequested());
        assertThrows(EvaluationCancelledException.class, scoped::checkCancel);
        assertFalse(CancellationSignal.NEVER.isCancellationRequested());
    }

    @ParameterizedTest(name = "randomContract[value={0}]")
    @ValueSource(doubles = {-0.1, 1.0, 1.5, Double.NaN})
    public void randomContractViolation(double value) {
        final EvaluationContext checked = EvaluationContext.newBuilder().setRandom(() -> value).build();
        assertThrows(FormulaInternalException.class, checked::nextRandom);
        final EvaluationContext unchecked = EvaluationContext.newBuilder()
                .setRandom(() -> value)
                .setProperties(EvaluationProperties.newBuilder().setCheckRandomContract(false).build())
                .build();
        assertThat(Double.compare(unchecked.nextRandom(), value), equalTo(0));
    }

    @Test
    public void seededRandomIsRepeatable() {
        final RandomService first = RandomService.seeded(42);
        final RandomService second = RandomService.seeded(42);
        for (int i = 0; i < 10; i++) {
            assertThat(first.nextDouble(), equalTo(second.nextDouble()));
        }
    }

    @Test
    public void properties() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationProperties.newBuilder().setRowPipelineSize(0));
        final EvaluationProperties properties = EvaluationProperties.newBuilder().setRowPipelineSize(3).build();
        assertThat(properties.toBuilder().build().getRowPipelineSize(), equalTo(3));
        assertTrue(properties.isCheckRandomContract());
    }
}
