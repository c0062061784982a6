/*
 * DateArithmeticTest.java
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

import com.apple.foundationdb.formula.values.DateTimeKind;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.test.RandomizedTestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.stream.Stream;

import static com.apple.foundationdb.formula.FormulaTestHelpers.errorKinds;
import static com.apple.foundationdb.formula.FormulaTestHelpers.ir;
import static com.apple.foundationdb.formula.FormulaTestHelpers.numberOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Tests for {@link DateArithmetic}.
 */
public class DateArithmeticTest {
    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");

    @Nonnull
    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(11L, 2024L, 0xdA7eL);
    }

    @Nonnull
    private static FormulaValue add(@Nonnull FormulaValue start, double delta, @Nonnull DateTimeUnit unit) {
        return DateArithmetic.add(LOS_ANGELES, ir(FormulaType.DATE_TIME), start, delta, unit);
    }

    private static double diff(@Nonnull FormulaValue start, @Nonnull FormulaValue end, @Nonnull DateTimeUnit unit) {
        return numberOf(DateArithmetic.diff(LOS_ANGELES, ir(FormulaType.NUMBER), start, end, unit));
    }

    @Nonnull
    private static DateTimeValue local(int year, int month, int day, int hour, int minute) {
        return DateTimeValue.of(LocalDateTime.of(year, month, day, hour, minute), DateTimeKind.LOCAL);
    }

    @Nonnull
    private static LocalDateTime wallClock(@Nonnull FormulaValue value) {
        return ((DateTimeValue)value).getValue();
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void diffInvertsAdd(long seed) {
        final Random random = new Random(seed);
        final DateTimeUnit[] units = {DateTimeUnit.DAYS, DateTimeUnit.HOURS, DateTimeUnit.MINUTES};
        for (int i = 0; i < 200; i++) {
            // day counts shift by the offset change, so keep away from midnight
            final LocalDateTime start = LocalDate.of(2000, 1, 1).plusDays(random.nextInt(30 * 366))
                    .atTime(4 + random.nextInt(16), random.nextInt(60));
            final DateTimeValue value = DateTimeValue.of(start, DateTimeKind.LOCAL);
            final DateTimeUnit unit = units[random.nextInt(units.length)];
            final int n = random.nextInt(2001) - 1000;
            final FormulaValue shifted = add(value, n, unit);
            if (LOS_ANGELES.getRules().getValidOffsets(wallClock(shifted)).size() > 1) {
                // an hour shown twice cannot tell which of its instants it came from
                continue;
            }
            assertThat(start + " + " + n + " " + unit, diff(value, shifted, unit), equalTo((double)n));
        }
    }

    @Test
    public void addIntoSpringForwardGapSnapsForward() {
        final FormulaValue result = add(local(2024, 3, 9, 2, 30), 1, DateTimeUnit.DAYS);
        assertThat(wallClock(result), equalTo(LocalDateTime.of(2024, 3, 10, 3, 0)));
        assertThat(DateTimeNormalizer.isValid(wallClock(result), LOS_ANGELES), equalTo(true));
    }

    @Test
    public void diffAcrossFallBack() {
        // 2024-11-03 02:00 PDT becomes 01:00 PST in Los Angeles
        assertThat(diff(local(2024, 11, 2, 12, 0), local(2024, 11, 3, 12, 0), DateTimeUnit.DAYS), equalTo(1.0));
        // the offset change moves the end past midnight
        assertThat(diff(local(2024, 11, 2, 23, 30), local(2024, 11, 3, 23, 30), DateTimeUnit.DAYS), equalTo(2.0));
        assertThat(diff(local(2024, 11, 3, 0, 0), local(2024, 11, 3, 3, 0), DateTimeUnit.HOURS), equalTo(4.0));
        assertThat(diff(local(2024, 11, 3, 0, 30), local(2024, 11, 3, 2, 30), DateTimeUnit.MINUTES), equalTo(180.0));
        // 01:30 is shown twice and reads as standard time
        assertThat(diff(local(2024, 11, 3, 1, 30), local(2024, 11, 3, 3, 0), DateTimeUnit.HOURS), equalTo(2.0));
        assertThat(diff(local(2024, 11, 3, 0, 30), local(2024, 11, 3, 1, 30), DateTimeUnit.HOURS), equalTo(2.0));
    }

    @Test
    public void addAcrossFallBack() {
        assertThat(wallClock(add(local(2024, 11, 2, 12, 0), 1, DateTimeUnit.DAYS)), equalTo(LocalDateTime.of(2024, 11, 3, 12, 0)));
        assertThat(wallClock(add(local(2024, 11, 3, 0, 30), 2, DateTimeUnit.HOURS)), equalTo(LocalDateTime.of(2024, 11, 3, 1, 30)));
        assertThat(wallClock(add(local(2024, 11, 3, 1, 50), 20, DateTimeUnit.MINUTES)), equalTo(LocalDateTime.of(2024, 11, 3, 2, 10)));
        assertThat(wallClock(add(local(2024, 11, 3, 0, 0), 180, DateTimeUnit.MINUTES)), equalTo(LocalDateTime.of(2024, 11, 3, 2, 0)));
    }

    @Test
    public void calendarAddIntoSpringForwardGap() {
        // every time inside the gap moves to 03:00, where the gap ends
        assertThat(wallClock(add(local(2024, 2, 10, 2, 45), 1, DateTimeUnit.MONTHS)), equalTo(LocalDateTime.of(2024, 3, 10, 3, 0)));
        assertThat(wallClock(add(local(2023, 3, 10, 2, 15), 1, DateTimeUnit.YEARS)), equalTo(LocalDateTime.of(2024, 3, 10, 3, 0)));
        assertThat(wallClock(add(local(2024, 3, 11, 2, 59), -1, DateTimeUnit.DAYS)), equalTo(LocalDateTime.of(2024, 3, 10, 3, 0)));
        assertThat(wallClock(add(local(2024, 3, 10, 1, 30), 1, DateTimeUnit.HOURS)), equalTo(LocalDateTime.of(2024, 3, 10, 3, 30)));
        assertThat(diff(local(2024, 3, 10, 0, 0), local(2024, 3, 10, 3, 0), DateTimeUnit.HOURS), equalTo(2.0));
    }

    @ParameterizedTest
    @EnumSource(value = DateTimeUnit.class, names = {"MILLISECONDS", "SECONDS", "MINUTES", "HOURS", "DAYS"})
    public void resultsNeverFallInsideGap(@Nonnull DateTimeUnit unit) {
        final DateTimeValue start = local(2024, 3, 10, 1, 59);
        for (int i = 0; i < 5; i++) {
            final LocalDateTime result = wallClock(add(start, i, unit));
            assertThat(DateTimeNormalizer.isValid(result, LOS_ANGELES), equalTo(true));
            assertFalse(result.isBefore(start.getValue()));
        }
    }

    @Test
    public void subDayUnitsCountElapsedTime() {
        assertThat(wallClock(add(local(2024, 3, 10, 1, 30), 60, DateTimeUnit.MINUTES)),
                equalTo(LocalDateTime.of(2024, 3, 10, 3, 30)));
        assertThat(diff(local(2024, 3, 10, 1, 30), local(2024, 3, 10, 3, 30), DateTimeUnit.HOURS), equalTo(1.0));
        assertThat(diff(local(2024, 3, 10, 1, 30), local(2024, 3, 10, 3, 30), DateTimeUnit.MINUTES), equalTo(60.0));
    }

    @Test
    public void utcInputsAreShiftedIntoZone() {
        final DateTimeValue utc = DateTimeValue.of(LocalDateTime.of(2024, 6, 1, 12, 0), DateTimeKind.UTC);
        final FormulaValue result = add(utc, 1, DateTimeUnit.HOURS);
        assertThat(wallClock(result), equalTo(LocalDateTime.of(2024, 6, 1, 6, 0)));
        assertThat(((DateTimeValue)result).getDateTimeKind(), equalTo(DateTimeKind.LOCAL));

        final FormulaValue inUtc = DateArithmetic.add(ZoneOffset.UTC, ir(FormulaType.DATE_TIME), utc, 1, DateTimeUnit.HOURS);
        assertThat(wallClock(inUtc), equalTo(LocalDateTime.of(2024, 6, 1, 13, 0)));
        assertThat(((DateTimeValue)inUtc).getDateTimeKind(), equalTo(DateTimeKind.UTC));
    }

    @Test
    public void calendarUnits() {
        assertThat(wallClock(add(local(2024, 1, 31, 0, 0), 1, DateTimeUnit.MONTHS)), equalTo(LocalDateTime.of(2024, 2, 29, 0, 0)));
        assertThat(wallClock(add(local(2024, 1, 31, 0, 0), 1, DateTimeUnit.QUARTERS)), equalTo(LocalDateTime.of(2024, 4, 30, 0, 0)));
        assertThat(wallClock(add(local(2024, 2, 29, 0, 0), 1, DateTimeUnit.YEARS)), equalTo(LocalDateTime.of(2025, 2, 28, 0, 0)));
        assertThat(wallClock(add(local(2024, 1, 15, 0, 0), 1.9, DateTimeUnit.MONTHS)), equalTo(LocalDateTime.of(2024, 2, 15, 0, 0)));
    }

    @Test
    public void fractionalDays() {
        assertThat(wallClock(add(local(2024, 6, 1, 0, 0), 1.5, DateTimeUnit.DAYS)), equalTo(LocalDateTime.of(2024, 6, 2, 12, 0)));
    }

    @Test
    public void resultTypeFollowsContext() {
        final DateValue date = DateValue.of(LocalDate.of(2024, 5, 1));
        final FormulaValue asDate = DateArithmetic.add(LOS_ANGELES, ir(FormulaType.DATE), date, 3, DateTimeUnit.DAYS);
        assertThat(asDate, equalTo(DateValue.of(LocalDate.of(2024, 5, 4))));

        final TimeValue time = TimeValue.of(Duration.ofHours(10));
        final FormulaValue asTime = DateArithmetic.add(LOS_ANGELES, ir(FormulaType.TIME), time, 90, DateTimeUnit.MINUTES);
        assertThat(asTime, equalTo(TimeValue.of(Duration.ofMinutes(11 * 60 + 30))));

        final FormulaValue asDateTime = add(date, 6, DateTimeUnit.HOURS);
        assertThat(((DateTimeValue)asDateTime).getDateTimeKind(), equalTo(DateTimeKind.LOCAL));
        assertThat(wallClock(asDateTime), equalTo(LocalDateTime.of(2024, 5, 1, 6, 0)));
    }

    @Test
    public void outOfRangeResults() {
        assertThat(errorKinds(add(local(2024, 1, 1, 0, 0), 8000, DateTimeUnit.YEARS)), contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(errorKinds(add(local(2024, 1, 1, 0, 0), -2024, DateTimeUnit.YEARS)), contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(errorKinds(add(local(2024, 1, 1, 0, 0), Double.NaN, DateTimeUnit.DAYS)), contains(ErrorKind.INVALID_ARGUMENT));
        assertThat(errorKinds(add(local(2024, 1, 1, 0, 0), 1e300, DateTimeUnit.DAYS)), contains(ErrorKind.INVALID_ARGUMENT));
    }

    @Test
    public void calendarDiffsUseFieldsOnly() {
        assertThat(diff(local(2024, 1, 31, 23, 0), local(2024, 2, 1, 0, 0), DateTimeUnit.MONTHS), equalTo(1.0));
        assertThat(diff(local(2024, 3, 31, 0, 0), local(2024, 4, 1, 0, 0), DateTimeUnit.QUARTERS), equalTo(1.0));
        assertThat(diff(local(2023, 12, 31, 0, 0), local(2024, 1, 1, 0, 0), DateTimeUnit.YEARS), equalTo(1.0));
        assertThat(diff(local(2024, 2, 1, 0, 0), local(2023, 12, 31, 0, 0), DateTimeUnit.MONTHS), equalTo(-2.0));
    }

    @Test
    public void shortDiffsTruncateToUnit() {
        assertThat(diff(local(2024, 1, 1, 23, 59), local(2024, 1, 2, 0, 1), DateTimeUnit.DAYS), equalTo(1.0));
        assertThat(diff(local(2024, 1, 2, 0, 0), local(2024, 1, 1, 12, 0), DateTimeUnit.DAYS), equalTo(-1.0));
        assertThat(diff(local(2024, 1, 1, 10, 59), local(2024, 1, 1, 11, 0), DateTimeUnit.HOURS), equalTo(1.0));
        assertThat(diff(local(2024, 1, 1, 10, 0), local(2024, 1, 1, 10, 0), DateTimeUnit.SECONDS), equalTo(0.0));
    }
}
