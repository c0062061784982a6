/*
 * DateArithmetic.java
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

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DateTimeKind;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Unit-based addition and difference of Date, Time and DateTime values.
 *
 * <p>
 * Units shorter than a day are added to elapsed time: a value that is not already UTC is converted to UTC, the
 * offset is applied, and the result is converted back, so a daylight-saving change does not skew the result.
 * Days and longer are added to the wall-clock fields, so the displayed time of day is kept across such a change.
 * A result that falls inside a daylight-saving gap is moved past the gap.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class DateArithmetic {
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    private DateArithmetic() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Add a number of units to a date-like value. The result takes the kind of the context's result type:
     * a Date, a Time (span from the epoch), or otherwise a DateTime.
     *
     * @param zone the evaluation's time zone
     * @param irContext the context of the call
     * @param start a Date, Time or DateTime value
     * @param delta the number of units; calendar units use its integer part
     * @param unit the unit
     * @return the shifted value, or an argument-out-of-range error if the result is not representable
     */
    @Nonnull
    public static FormulaValue add(@Nonnull ZoneId zone, @Nonnull IRContext irContext, @Nonnull FormulaValue start,
                                   double delta, @Nonnull DateTimeUnit unit) {
        if (!Double.isFinite(delta)) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
        final NormalizedDateTime normalized = DateTimeNormalizer.normalize(start, zone);
        final boolean useUtc = !normalized.isUtc() && unit.isSubDay();
        try {
            LocalDateTime dateTime = normalized.getWallClock();
            if (useUtc) {
                dateTime = DateTimeNormalizer.toUtc(dateTime, zone);
            }
            dateTime = shift(dateTime, delta, unit);
            if (useUtc) {
                dateTime = DateTimeNormalizer.fromUtc(dateTime, zone);
            }
            dateTime = DateTimeNormalizer.makeValid(dateTime, zone);
            if (dateTime.getYear() < MIN_YEAR || dateTime.getYear() > MAX_YEAR) {
                return CommonErrors.argumentOutOfRange(irContext);
            }
            return typedResult(irContext, dateTime, resultKind(start, normalized));
        } catch (DateTimeException | ArithmeticException e) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
    }

    /**
     * Count the whole units between two date-like values.
     *
     * <p>
     * Months, quarters and years are computed from the calendar fields alone. Shorter units compare wall-clock
     * times after compensating the end for the difference between the zone offsets at the two times, then
     * truncate both times to the unit and take the floor of the difference.
     * </p>
     *
     * @param zone the evaluation's time zone
     * @param irContext the context of the call
     * @param start a Date, Time or DateTime value
     * @param end a Date, Time or DateTime value
     * @param unit the unit
     * @return the number of units, as a Number
     */
    @Nonnull
    public static FormulaValue diff(@Nonnull ZoneId zone, @Nonnull IRContext irContext, @Nonnull FormulaValue start,
                                    @Nonnull FormulaValue end, @Nonnull DateTimeUnit unit) {
        LocalDateTime from = DateTimeNormalizer.normalize(start, zone).getWallClock();
        LocalDateTime to = DateTimeNormalizer.normalize(end, zone).getWallClock();
        final long years = (long)to.getYear() - from.getYear();
        switch (unit) {
            case MONTHS:
                return new NumberValue(irContext, years * 12 + to.getMonthValue() - from.getMonthValue());
            case QUARTERS:
                return new NumberValue(irContext, years * 4
                        + Math.floorDiv(to.getMonthValue() - 1, 3) - Math.floorDiv(from.getMonthValue() - 1, 3));
            case YEARS:
                return new NumberValue(irContext, years);
            default:
                break;
        }
        final int offsetDifference = DateTimeNormalizer.offsetAt(from, zone).getTotalSeconds()
                - DateTimeNormalizer.offsetAt(to, zone).getTotalSeconds();
        to = to.plusSeconds(offsetDifference);
        from = from.truncatedTo(unit.getTruncationUnit());
        to = to.truncatedTo(unit.getTruncationUnit());
        final Duration elapsed = Duration.between(from, to);
        final long millis = Math.addExact(Math.multiplyExact(elapsed.getSeconds(), 1000L), elapsed.getNano() / 1_000_000);
        return new NumberValue(irContext, Math.floorDiv(millis, unit.getMillis()));
    }

    @Nonnull
    private static LocalDateTime shift(@Nonnull LocalDateTime dateTime, double delta, @Nonnull DateTimeUnit unit) {
        switch (unit) {
            case MONTHS:
                return dateTime.plusMonths((int)delta);
            case QUARTERS:
                return dateTime.plusMonths(Math.multiplyExact((int)delta, 3L));
            case YEARS:
                return dateTime.plusYears((int)delta);
            default:
                final double millis = delta * unit.getMillis();
                if (Math.abs(millis) >= Long.MAX_VALUE) {
                    throw new ArithmeticException("shift out of range");
                }
                return dateTime.plus(Duration.ofMillis(Math.round(millis)));
        }
    }

    @Nonnull
    private static DateTimeKind resultKind(@Nonnull FormulaValue start, @Nonnull NormalizedDateTime normalized) {
        if (start.getKind() != ValueKind.DATE_TIME && normalized.getKind() == DateTimeKind.UNSPECIFIED) {
            return DateTimeKind.LOCAL;
        }
        return normalized.getKind();
    }

    @Nonnull
    static FormulaValue typedResult(@Nonnull IRContext irContext, @Nonnull LocalDateTime dateTime, @Nonnull DateTimeKind kind) {
        final FormulaType.TypeCode code = irContext.getResultType().getCode();
        if (code == FormulaType.TypeCode.DATE) {
            return new DateValue(irContext, dateTime.toLocalDate());
        }
        if (code == FormulaType.TypeCode.TIME) {
            return new TimeValue(irContext, FormulaEpoch.sinceEpoch(dateTime));
        }
        return new DateTimeValue(irContext, dateTime, kind);
    }
}
