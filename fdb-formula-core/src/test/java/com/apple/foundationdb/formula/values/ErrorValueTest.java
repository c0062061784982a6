/*
 * ErrorValueTest.java
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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static com.apple.foundationdb.formula.FormulaTestHelpers.error;
import static com.apple.foundationdb.formula.FormulaTestHelpers.ir;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ErrorValue}.
 */
public class ErrorValueTest {

    @Test
    public void combineKeepsFirstAppearanceOrder() {
        final ErrorValue a = error(ErrorKind.DIV0, "a");
        final ErrorValue b = error(ErrorKind.NUMERIC, "b");
        final ErrorValue combined = ErrorValue.combine(ir(FormulaType.NUMBER), ImmutableList.of(b, a, b));
        assertThat(combined.getErrors(), contains(
                ExpressionError.of(ErrorKind.NUMERIC, "b"),
                ExpressionError.of(ErrorKind.DIV0, "a")));
        assertThat(combined.getFirstKind(), equalTo(ErrorKind.NUMERIC));
        assertThat(combined.getType(), equalTo(FormulaType.NUMBER));
    }

    @Test
    public void combineFlattensMultiRecordErrors() {
        final ErrorValue ab = ErrorValue.combine(ir(FormulaType.ERROR),
                ImmutableList.of(error(ErrorKind.DIV0, "a"), error(ErrorKind.NUMERIC, "b")));
        final ErrorValue combined = ErrorValue.combine(ir(FormulaType.ERROR),
                ImmutableList.of(ab, error(ErrorKind.CUSTOM, "c")));
        assertThat(combined.getErrors().size(), equalTo(3));
    }

    @Test
    public void combineNothing() {
        assertThrows(IllegalArgumentException.class, () -> ErrorValue.combine(ir(FormulaType.ERROR), ImmutableList.of()));
    }

    @Test
    public void errorKindCodes() {
        assertThat(ErrorKind.fromCode(13), equalTo(ErrorKind.DIV0));
        assertThat(ErrorKind.fromCode(1000), equalTo(ErrorKind.CUSTOM));
        assertThat(ErrorKind.fromCode(1234), equalTo(ErrorKind.CUSTOM));
        assertThrows(IllegalArgumentException.class, () -> ErrorKind.fromCode(999));
    }
}
