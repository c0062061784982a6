/*
 * PipelineStagesTest.java
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

import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static com.apple.foundationdb.formula.FormulaTestHelpers.errorKinds;
import static com.apple.foundationdb.formula.FormulaTestHelpers.ir;
import static com.apple.foundationdb.formula.FormulaTestHelpers.num;
import static com.apple.foundationdb.formula.FormulaTestHelpers.str;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the standard pipeline stages.
 */
public class PipelineStagesTest {
    private static final IRContext NUMBER = ir(FormulaType.NUMBER);

    @Test
    public void insertDefaultValues() {
        final ArgumentExpander expander = ArgumentExpanders.insertDefaultValues(3, num(10));
        assertThat(expand(expander, num(1)), equalTo(values(num(1), num(10), num(10))));
        final FormulaValue[] full = {num(1), num(2), num(3), num(4)};
        assertThat(expander.expand(NUMBER, full), sameInstance(full));
        assertThrows(IllegalArgumentException.class, () -> ArgumentExpanders.insertDefaultValues(-1, num(0)));
    }

    @Test
    public void trailingDefaults() {
        final ArgumentExpander expander = ArgumentExpanders.trailingDefaults(1, num(10), str("days"));
        assertThat(expand(expander, num(1)), equalTo(values(num(1), num(10), str("days"))));
        assertThat(expand(expander, num(1), num(2)), equalTo(values(num(1), num(2), str("days"))));
    }

    @Test
    public void computedDefault() {
        final ArgumentExpander expander = ArgumentExpanders.computedDefault(2, args -> args[0]);
        assertThat(expand(expander, num(5)), equalTo(values(num(5), num(5))));
        assertThat(expand(expander, num(5), num(6)), equalTo(values(num(5), num(6))));
    }

    @Test
    public void blankReplacers() {
        final BlankValue blankNumber = BlankValue.of(FormulaType.NUMBER);
        final BlankValue blankDecimal = BlankValue.of(FormulaType.DECIMAL);
        assertThat(BlankReplacers.doNotReplace().replace(NUMBER, 0, blankNumber), sameInstance(blankNumber));
        assertThat(BlankReplacers.zero().replace(NUMBER, 0, blankNumber), equalTo(num(0)));
        final FormulaValue decimalZero = BlankReplacers.zero().replace(NUMBER, 0, blankDecimal);
        assertThat(decimalZero.getKind(), equalTo(ValueKind.DECIMAL));
        assertThat(((DecimalValue)decimalZero).getValue().compareTo(BigDecimal.ZERO), equalTo(0));
        assertThat(BlankReplacers.emptyString().replace(NUMBER, 0, blankNumber), equalTo(str("")));
        assertThat(BlankReplacers.falseValue().replace(NUMBER, 0, blankNumber), equalTo(BooleanValue.of(false)));
        final BlankReplacer perIndex = BlankReplacers.perIndex(num(1), num(2));
        assertThat(perIndex.replace(NUMBER, 1, blankNumber), equalTo(num(2)));
        assertThat(perIndex.replace(NUMBER, 2, blankNumber), sameInstance(blankNumber));
        final BlankReplacer specific = BlankReplacers.forSpecificIndices(ImmutableMap.of(1, BlankReplacers.emptyString()));
        assertThat(specific.replace(NUMBER, 0, blankNumber), sameInstance(blankNumber));
        assertThat(specific.replace(NUMBER, 1, blankNumber), equalTo(str("")));
    }

    @Test
    public void typeCheckers() {
        final RuntimeTypeChecker numeric = RuntimeTypeCheckers.numberOrDecimal();
        assertThat(numeric.check(NUMBER, 0, num(1)), equalTo(num(1)));
        assertThat(numeric.check(NUMBER, 0, DecimalValue.of("1")).getKind(), equalTo(ValueKind.DECIMAL));
        assertThat(errorKinds(numeric.check(NUMBER, 0, str("1"))), contains(ErrorKind.VALIDATION));
        final FormulaValue date = DateValue.of(LocalDate.of(2024, 1, 1));
        assertThat(RuntimeTypeCheckers.dateTimeLike().check(NUMBER, 0, date), sameInstance(date));
        assertThat(errorKinds(RuntimeTypeCheckers.timeOrDateTime().check(NUMBER, 0, date)), contains(ErrorKind.VALIDATION));
        assertThat(RuntimeTypeCheckers.exactValueTypeOrTable(ValueKind.NUMBER).check(NUMBER, 0, num(1)), equalTo(num(1)));
        final RuntimeTypeChecker sequence = RuntimeTypeCheckers.exactSequence(
                RuntimeTypeCheckers.exactValueType(ValueKind.STRING), numeric);
        assertThat(sequence.check(NUMBER, 0, str("a")), equalTo(str("a")));
        assertThat(sequence.check(NUMBER, 5, num(1)), equalTo(num(1)));
        assertThat(errorKinds(sequence.check(NUMBER, 5, str("a"))), contains(ErrorKind.VALIDATION));
        assertThrows(IllegalArgumentException.class, RuntimeTypeCheckers::exactSequence);
    }

    @Test
    public void valueCheckers() {
        assertThat(errorKinds(RuntimeValueCheckers.finite().check(NUMBER, 0, num(Double.NaN))), contains(ErrorKind.NUMERIC));
        assertThat(RuntimeValueCheckers.finite().check(NUMBER, 0, str("x")), equalTo(str("x")));
        assertThat(RuntimeValueCheckers.positiveNumber().check(NUMBER, 0, num(0)), equalTo(num(0)));
        assertThat(errorKinds(RuntimeValueCheckers.positiveNumber().check(NUMBER, 0, num(-1))), contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(errorKinds(RuntimeValueCheckers.strictPositiveNumber().check(NUMBER, 0, num(0))), contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(errorKinds(RuntimeValueCheckers.strictPositiveNumber().check(NUMBER, 0, DecimalValue.of("-2"))),
                contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(RuntimeValueCheckers.divideByZero().check(NUMBER, 0, num(0)), equalTo(num(0)));
        assertThat(errorKinds(RuntimeValueCheckers.divideByZero().check(NUMBER, 1, num(0))), contains(ErrorKind.DIV0));
        final RuntimeValueChecker<FormulaValue> all = RuntimeValueCheckers.all(
                RuntimeValueCheckers.finite(), RuntimeValueCheckers.divideByZero());
        assertThat(errorKinds(all.check(NUMBER, 1, num(Double.POSITIVE_INFINITY))), contains(ErrorKind.NUMERIC));
        assertThat(errorKinds(all.check(NUMBER, 1, num(0))), contains(ErrorKind.DIV0));
        assertThat(all.check(NUMBER, 1, StringValue.of("0")), equalTo(str("0")));
    }

    private static List<FormulaValue> expand(ArgumentExpander expander, FormulaValue... args) {
        return Arrays.asList(expander.expand(NUMBER, args));
    }

    private static List<FormulaValue> values(FormulaValue... values) {
        return Arrays.asList(values);
    }
}
