/*
 * AggregatorsTest.java
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

package com.apple.foundationdb.formula.aggregate;

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.apple.test.RandomizedTestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static com.apple.foundationdb.formula.FormulaTestHelpers.error;
import static com.apple.foundationdb.formula.FormulaTestHelpers.errorKinds;
import static com.apple.foundationdb.formula.FormulaTestHelpers.ir;
import static com.apple.foundationdb.formula.FormulaTestHelpers.num;
import static com.apple.foundationdb.formula.FormulaTestHelpers.numberOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link Aggregators} through {@link AggregationRunner#runScalar}.
 */
public class AggregatorsTest {

    @Nonnull
    private static FormulaValue aggregate(@Nonnull AggregateFunction function, @Nonnull FormulaType type,
                                          @Nonnull FormulaValue... values) {
        return AggregationRunner.runScalar(function, EvaluationContext.empty(), ir(type), List.of(values));
    }

    @Nonnull
    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0L, 42L, 0xfdbL);
    }

    @ParameterizedTest
    @EnumSource(AggregateFunction.class)
    public void emptyInput(@Nonnull AggregateFunction function) {
        final FormulaValue result = aggregate(function, FormulaType.NUMBER);
        if (function.isEmptyDivideByZero()) {
            assertThat(errorKinds(result), contains(ErrorKind.DIV0));
        } else {
            assertThat(result.getKind(), equalTo(ValueKind.BLANK));
        }
    }

    @ParameterizedTest
    @EnumSource(AggregateFunction.class)
    public void blanksAreSkipped(@Nonnull AggregateFunction function) {
        final FormulaValue blank = BlankValue.of(FormulaType.NUMBER);
        assertThat(aggregate(function, FormulaType.NUMBER, blank, num(4), blank),
                equalTo(aggregate(function, FormulaType.NUMBER, num(4))));
        assertThat(aggregate(function, FormulaType.NUMBER, blank, blank).getKind(),
                equalTo(aggregate(function, FormulaType.NUMBER).getKind()));
    }

    @Test
    public void sumAndAverage() {
        assertThat(numberOf(aggregate(AggregateFunction.SUM, FormulaType.NUMBER, num(1), num(2), num(4))), equalTo(7.0));
        assertThat(numberOf(aggregate(AggregateFunction.AVERAGE, FormulaType.NUMBER, num(1), num(2), num(6))), equalTo(3.0));
    }

    @Test
    public void firstErrorWins() {
        final FormulaValue first = error(ErrorKind.DIV0, "first");
        final FormulaValue result = aggregate(AggregateFunction.SUM, FormulaType.NUMBER,
                num(1), first, error(ErrorKind.CUSTOM, "second"));
        assertThat(result, sameInstance(first));
    }

    @Test
    public void numberSumOverflows() {
        assertThat(errorKinds(aggregate(AggregateFunction.SUM, FormulaType.NUMBER, num(Double.MAX_VALUE), num(Double.MAX_VALUE))),
                contains(ErrorKind.NUMERIC));
        assertThat(errorKinds(aggregate(AggregateFunction.AVERAGE, FormulaType.NUMBER, num(Double.MAX_VALUE), num(Double.MAX_VALUE))),
                contains(ErrorKind.NUMERIC));
    }

    @Test
    public void decimalSum() {
        final FormulaValue result = aggregate(AggregateFunction.SUM, FormulaType.DECIMAL,
                DecimalValue.of("0.1"), DecimalValue.of("0.2"), num(1));
        assertThat(result, equalTo(DecimalValue.of("1.3")));
        assertThat(aggregate(AggregateFunction.AVERAGE, FormulaType.DECIMAL, DecimalValue.of("1"), DecimalValue.of("2")),
                equalTo(DecimalValue.of("1.5")));
    }

    @Test
    public void decimalSumOverflows() {
        assertThat(errorKinds(aggregate(AggregateFunction.SUM, FormulaType.DECIMAL,
                new DecimalValue(ir(FormulaType.DECIMAL), DecimalValue.MAX_VALUE), DecimalValue.of(BigDecimal.ONE))),
                contains(ErrorKind.NUMERIC));
        assertThat(errorKinds(aggregate(AggregateFunction.SUM, FormulaType.DECIMAL, num(Double.MAX_VALUE))),
                contains(ErrorKind.NUMERIC));
    }

    @Test
    public void timeSum() {
        assertThat(aggregate(AggregateFunction.SUM, FormulaType.TIME,
                        TimeValue.of(Duration.ofHours(1)), TimeValue.of(Duration.ofMinutes(30))),
                equalTo(TimeValue.of(Duration.ofMinutes(90))));
        assertThat(aggregate(AggregateFunction.AVERAGE, FormulaType.TIME,
                        TimeValue.of(Duration.ofHours(1)), TimeValue.of(Duration.ofHours(2))),
                equalTo(TimeValue.of(Duration.ofMinutes(90))));
    }

    @Test
    public void minAndMaxOfNumbers() {
        assertThat(aggregate(AggregateFunction.MIN, FormulaType.NUMBER, num(3), num(-1), num(2)), equalTo(num(-1)));
        assertThat(aggregate(AggregateFunction.MAX, FormulaType.NUMBER, num(3), num(-1), num(2)), equalTo(num(3)));
        assertThat(aggregate(AggregateFunction.MAX, FormulaType.DECIMAL, DecimalValue.of("2.5"), num(1)),
                equalTo(DecimalValue.of("2.5")));
    }

    @Test
    public void minAndMaxOfDates() {
        final FormulaValue early = DateValue.of(LocalDate.of(2020, 1, 1));
        final FormulaValue middle = DateTimeValue.of(LocalDateTime.of(2020, 6, 1, 12, 0));
        final FormulaValue late = DateValue.of(LocalDate.of(2021, 1, 1));
        assertThat(aggregate(AggregateFunction.MIN, FormulaType.DATE_TIME, middle, late, early), sameInstance(early));
        assertThat(aggregate(AggregateFunction.MAX, FormulaType.DATE_TIME, middle, late, early), sameInstance(late));
    }

    @Test
    public void minKeepsFirstOfTies() {
        final FormulaValue first = TimeValue.of(Duration.ofMinutes(5));
        final FormulaValue second = TimeValue.of(Duration.ofMinutes(5));
        assertThat(aggregate(AggregateFunction.MIN, FormulaType.TIME, first, second), sameInstance(first));
    }

    @Test
    public void wrongValueKindIsTypeMismatch() {
        assertThat(errorKinds(aggregate(AggregateFunction.SUM, FormulaType.NUMBER, num(1), StringValue.of("x"))),
                contains(ErrorKind.VALIDATION));
    }

    @Test
    public void unsupportedResultType() {
        final FormulaValue result = aggregate(AggregateFunction.VAR_P, FormulaType.TIME, TimeValue.of(Duration.ofHours(1)));
        assertThat(errorKinds(result), contains(ErrorKind.NOT_SUPPORTED));
        assertThat(errorKinds(aggregate(AggregateFunction.SUM, FormulaType.STRING, StringValue.of("a"))),
                contains(ErrorKind.NOT_SUPPORTED));
    }

    @Test
    public void varianceOfKnownValues() {
        final FormulaValue[] values = {num(2), num(4), num(4), num(4), num(5), num(5), num(7), num(9)};
        assertThat(numberOf(aggregate(AggregateFunction.VAR_P, FormulaType.NUMBER, values)), closeTo(4.0, 1e-12));
        assertThat(numberOf(aggregate(AggregateFunction.STDEV_P, FormulaType.NUMBER, values)), closeTo(2.0, 1e-12));
        assertThat(numberOf(aggregate(AggregateFunction.VAR_P, FormulaType.NUMBER, num(3))), equalTo(0.0));
    }

    @Test
    public void decimalVarianceKeepsDecimalPrecision() {
        final FormulaValue variance = aggregate(AggregateFunction.VAR_P, FormulaType.DECIMAL,
                DecimalValue.of("1000000000000000.1"), DecimalValue.of("1000000000000000.2"), DecimalValue.of("1000000000000000.3"));
        assertThat(variance.getKind(), equalTo(ValueKind.DECIMAL));
        assertThat(((DecimalValue)variance).getValue().compareTo(new BigDecimal("0.006666666666666666666666666667")), equalTo(0));

        final FormulaValue stdev = aggregate(AggregateFunction.STDEV_P, FormulaType.DECIMAL,
                DecimalValue.of("0.1"), DecimalValue.of("0.3"));
        assertThat(((DecimalValue)stdev).getValue().compareTo(new BigDecimal("0.1")), equalTo(0));
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void streamingVarianceMatchesTwoPass(long seed) {
        final Random random = new Random(seed);
        final int count = 1 + random.nextInt(500);
        final double offset = random.nextDouble() * 1e6;
        final List<FormulaValue> values = new ArrayList<>(count);
        final double[] raw = new double[count];
        for (int i = 0; i < count; i++) {
            raw[i] = offset + random.nextGaussian() * 100;
            values.add(num(raw[i]));
        }
        double mean = 0;
        for (double x : raw) {
            mean += x;
        }
        mean /= count;
        double squares = 0;
        for (double x : raw) {
            squares += (x - mean) * (x - mean);
        }
        final double expected = squares / count;

        final double variance = numberOf(AggregationRunner.runScalar(AggregateFunction.VAR_P,
                EvaluationContext.empty(), ir(FormulaType.NUMBER), values));
        final double stdev = numberOf(AggregationRunner.runScalar(AggregateFunction.STDEV_P,
                EvaluationContext.empty(), ir(FormulaType.NUMBER), values));
        assertThat(variance, closeTo(expected, Math.max(1e-9 * Math.abs(expected), 1e-9)));
        assertThat(stdev, closeTo(Math.sqrt(variance), 1e-12 * Math.max(1.0, stdev)));
    }
}
