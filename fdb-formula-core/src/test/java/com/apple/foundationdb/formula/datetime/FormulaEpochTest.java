/*
 * FormulaEpochTest.java
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

package com.apple.foundationdb.formula.datetime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link FormulaEpoch}.
 */
public class FormulaEpochTest {

    @Test
    public void dayNumbers() {
        assertThat(FormulaEpoch.toDays(FormulaEpoch.EPOCH), equalTo(0.0));
        assertThat(FormulaEpoch.toDays(LocalDateTime.of(1900, 1, 1, 0, 0)), equalTo(2.0));
        assertThat(FormulaEpoch.toDays(LocalDateTime.of(2000, 1, 1, 12, 0)), equalTo(36526.5));
        assertThat(FormulaEpoch.fromDays(36526.5), equalTo(LocalDateTime.of(2000, 1, 1, 12, 0)));
        assertThat(FormulaEpoch.fromDays(-1), equalTo(LocalDateTime.of(1899, 12, 29, 0, 0)));
    }

    @Test
    public void nonFiniteDays() {
        assertThrows(ArithmeticException.class, () -> FormulaEpoch.fromDays(Double.POSITIVE_INFINITY));
    }

    @Test
    public void spansFromEpoch() {
        final Duration span = Duration.ofHours(36);
        assertThat(FormulaEpoch.anchor(span), equalTo(LocalDateTime.of(1899, 12, 31, 12, 0)));
        assertThat(FormulaEpoch.sinceEpoch(FormulaEpoch.anchor(span)), equalTo(span));
    }
}
