/*
 * LogicalFunctionsTest.java
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

import com.apple.foundationdb.formula.EvaluationCancelledException;
import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.services.CancellationSource;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.ErrorValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.LambdaValue;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.apple.foundationdb.formula.FormulaTestHelpers.call;
import static com.apple.foundationdb.formula.FormulaTestHelpers.error;
import static com.apple.foundationdb.formula.FormulaTestHelpers.errorKinds;
import static com.apple.foundationdb.formula.FormulaTestHelpers.ir;
import static com.apple.foundationdb.formula.FormulaTestHelpers.num;
import static com.apple.foundationdb.formula.FormulaTestHelpers.str;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LogicalFunctions}.
 */
public class LogicalFunctionsTest {
    private static final FormulaValue TRUE = BooleanValue.of(true);
    private static final FormulaValue FALSE = BooleanValue.of(false);
    private static final FormulaValue BLANK = BlankValue.of(FormulaType.BOOLEAN);

    /**
     * A lambda that counts how often it is forced.
     */
    private static final class Counted {
        private final AtomicInteger forced = new AtomicInteger();
        private final LambdaValue lambda;

        Counted(@Nonnull FormulaValue value) {
            lambda = LambdaValue.ofSync(FormulaType.NUMBER, context -> {
                forced.incrementAndGet();
                return value;
            });
        }
    }

    @Test
    public void ifPicksFirstTrueBranch() {
        final Counted first = new Counted(num(1));
        final Counted second = new Counted(num(2));
        final Counted otherwise = new Counted(num(3));
        final FormulaValue result = call(BuiltinFunctions.IF, FormulaType.NUMBER,
                FALSE, first.lambda, TRUE, second.lambda, otherwise.lambda);
        assertThat(result, equalTo(num(2)));
        assertThat(first.forced.get(), equalTo(0));
        assertThat(second.forced.get(), equalTo(1));
        assertThat(otherwise.forced.get(), equalTo(0));
    }

    @Test
    public void ifWithoutElse() {
        assertTrue(call(BuiltinFunctions.IF, FormulaType.NUMBER, FALSE, num(1)).isBlank());
        assertThat(call(BuiltinFunctions.IF, FormulaType.NUMBER, BLANK, num(1), num(2)), equalTo(num(2)));
        assertThat(call(BuiltinFunctions.IF, FormulaType.NUMBER, num(1), num(1), num(2)), equalTo(num(2)));
    }

    @Test
    public void ifReturnsErrorCondition() {
        final ErrorValue failure = error(ErrorKind.CUSTOM, "condition");
        final Counted branch = new Counted(num(1));
        assertThat(call(BuiltinFunctions.IF, FormulaType.NUMBER, failure, branch.lambda, num(2)), sameInstance(failure));
        assertThat(branch.forced.get(), equalTo(0));
    }

    @Test
    public void switchMatchesNumerically() {
        final FormulaValue result = call(BuiltinFunctions.SWITCH, FormulaType.STRING,
                DecimalValue.of("2.0"), num(1), str("one"), num(2), str("two"), str("other"));
        assertThat(result, equalTo(str("two")));
        assertThat(call(BuiltinFunctions.SWITCH, FormulaType.STRING, str("c"), str("a"), str("x"), str("other")),
                equalTo(str("other")));
        assertTrue(call(BuiltinFunctions.SWITCH, FormulaType.STRING, str("c"), str("a"), str("x")).isBlank());
    }

    @Test
    public void andOrShortCircuit() {
        final Counted never = new Counted(TRUE);
        assertThat(call(BuiltinFunctions.AND, FormulaType.BOOLEAN, TRUE, FALSE, never.lambda), equalTo(FALSE));
        assertThat(call(BuiltinFunctions.OR, FormulaType.BOOLEAN, FALSE, TRUE, never.lambda), equalTo(TRUE));
        assertThat(never.forced.get(), equalTo(0));
        assertThat(call(BuiltinFunctions.AND, FormulaType.BOOLEAN, TRUE, TRUE), equalTo(TRUE));
        assertThat(call(BuiltinFunctions.OR, FormulaType.BOOLEAN), equalTo(FALSE));
    }

    @Test
    public void blankIsFalseInAndOr() {
        assertThat(call(BuiltinFunctions.AND, FormulaType.BOOLEAN, TRUE, BLANK), equalTo(FALSE));
        assertThat(call(BuiltinFunctions.OR, FormulaType.BOOLEAN, BLANK, BLANK), equalTo(FALSE));
    }

    @Test
    public void andOrErrors() {
        final ErrorValue failure = error(ErrorKind.CUSTOM, "operand");
        assertThat(call(BuiltinFunctions.AND, FormulaType.BOOLEAN, TRUE, failure, FALSE), sameInstance(failure));
        assertThat(errorKinds(call(BuiltinFunctions.OR, FormulaType.BOOLEAN, num(1))), contains(ErrorKind.VALIDATION));
    }

    @Test
    public void ifErrorReplacesFirstError() {
        final FormulaValue result = call(BuiltinFunctions.IF_ERROR, FormulaType.NUMBER,
                num(1), num(-1), error(ErrorKind.DIV0, "zero"), num(-2), num(3));
        assertThat(result, equalTo(num(-2)));
        assertThat(call(BuiltinFunctions.IF_ERROR, FormulaType.NUMBER, num(1), num(-1)), equalTo(num(1)));
        assertThat(call(BuiltinFunctions.IF_ERROR, FormulaType.NUMBER, num(1), num(-1), num(9)), equalTo(num(9)));
    }

    @Test
    public void coalesceSkipsBlankAndEmpty() {
        assertThat(call(BuiltinFunctions.COALESCE, FormulaType.STRING, BLANK, str(""), str("x"), str("y")), equalTo(str("x")));
        assertTrue(call(BuiltinFunctions.COALESCE, FormulaType.STRING, BLANK, str("")).isBlank());
        final ErrorValue failure = error(ErrorKind.CUSTOM, "early");
        assertThat(call(BuiltinFunctions.COALESCE, FormulaType.STRING, BLANK, failure, str("x")), sameInstance(failure));
    }

    @Test
    public void isBlankAndIsError() {
        assertThat(call(BuiltinFunctions.IS_BLANK, FormulaType.BOOLEAN, BLANK), equalTo(TRUE));
        assertThat(call(BuiltinFunctions.IS_BLANK, FormulaType.BOOLEAN, str("")), equalTo(TRUE));
        assertThat(call(BuiltinFunctions.IS_BLANK, FormulaType.BOOLEAN, num(0)), equalTo(FALSE));
        assertThat(call(BuiltinFunctions.IS_ERROR, FormulaType.BOOLEAN, error(ErrorKind.NUMERIC, "x")), equalTo(TRUE));
        assertThat(call(BuiltinFunctions.IS_ERROR, FormulaType.BOOLEAN, BLANK), equalTo(FALSE));
    }

    @Test
    public void errorRaisesCustomByDefault() {
        final FormulaValue raised = call(BuiltinFunctions.ERROR, FormulaType.NUMBER, str("boom"));
        assertThat(errorKinds(raised), contains(ErrorKind.CUSTOM));
        assertThat(((ErrorValue)raised).getErrors().get(0).getMessage(), equalTo("boom"));
        assertThat(errorKinds(call(BuiltinFunctions.ERROR, FormulaType.NUMBER, str("zero"), num(13))), contains(ErrorKind.DIV0));
        assertThat(errorKinds(call(BuiltinFunctions.ERROR, FormulaType.NUMBER, str("mine"), num(1001))), contains(ErrorKind.CUSTOM));
        assertThat(errorKinds(call(BuiltinFunctions.ERROR, FormulaType.NUMBER, str("bad"), num(999))),
                contains(ErrorKind.INVALID_ARGUMENT));
    }

    @Test
    public void cancellationStopsBranches() {
        final CancellationSource source = new CancellationSource();
        source.cancel();
        final EvaluationContext context = EvaluationContext.newBuilder().setCancellationSignal(source).build();
        final CompletionException e = assertThrows(CompletionException.class, () ->
                BuiltinFunctions.IF.apply(context, ir(FormulaType.NUMBER), new FormulaValue[] {TRUE, num(1)}).join());
        assertThat(e.getCause(), instanceOf(EvaluationCancelledException.class));
    }
}
