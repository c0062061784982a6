/*
 * DateTimeFunctions.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.datetime.DateArithmetic;
import com.apple.foundationdb.formula.datetime.DateTimeNormalizer;
import com.apple.foundationdb.formula.datetime.DateTimeUnit;
import com.apple.foundationdb.formula.datetime.FormulaEpoch;
import com.apple.foundationdb.formula.datetime.WeekCalendar;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DateTimeKind;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.TimeValue;
import com.apple.foundationdb.formula.values.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.ToIntFunction;

/**
 * Date and time builtins. Calendar fields are read from values normalized into the evaluation's time zone.
 */
@API(API.Status.UNSTABLE)
public final class DateTimeFunctions {
    private static final Logger LOGGER = LoggerFactory.getLogger(DateTimeFunctions.class);

    private static final int MAX_YEAR = 9999;

    private DateTimeFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * {@code DateAdd(value, delta[, unit])}: shift a date-like value. A Time delta is added as milliseconds,
     * whatever the unit.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the value, the delta and the unit name
     * @return the shifted value or an error
     */
    @Nonnull
    public static FormulaValue dateAdd(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final FormulaValue delta = args.get(1);
        if (delta.getKind() == ValueKind.TIME) {
            final double millis = ((TimeValue)delta).getValue().toMillis();
            return DateArithmetic.add(context.getTimeZone(), irContext, args.get(0), millis, DateTimeUnit.MILLISECONDS);
        }
        final DateTimeUnit unit = unit(args.get(2));
        if (unit == null) {
            return invalidUnit(irContext, "DateAdd", args.get(2));
        }
        return DateArithmetic.add(context.getTimeZone(), irContext, args.get(0), NumericConversions.toDouble(delta), unit);
    }

    @Nonnull
    public static FormulaValue dateDiff(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final DateTimeUnit unit = unit(args.get(2));
        if (unit == null) {
            return invalidUnit(irContext, "DateDiff", args.get(2));
        }
        try {
            return DateArithmetic.diff(context.getTimeZone(), irContext, args.get(0), args.get(1), unit);
        } catch (ArithmeticException e) {
            return CommonErrors.overflow(irContext);
        }
    }

    /**
     * {@code Date(year, month, day)}. Months and days outside their ranges roll over into the neighbouring
     * months and years.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the year, month and day
     * @return the date or an argument-out-of-range error
     */
    @Nonnull
    public static FormulaValue date(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        try {
            return new DateValue(irContext, rolledDate(args));
        } catch (DateTimeException | ArithmeticException e) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
    }

    /**
     * {@code Time(hour, minute, second[, millisecond])}. Fields are summed, so they may overflow their ranges.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the hours, minutes, seconds and milliseconds
     * @return the time span or an error
     */
    @Nonnull
    public static FormulaValue time(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        try {
            return new TimeValue(irContext, span(args, 0));
        } catch (ArithmeticException e) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
    }

    @Nonnull
    public static FormulaValue dateTime(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        try {
            final LocalDateTime value = rolledDate(args).atStartOfDay().plus(span(args, 3));
            if (value.getYear() < 1 || value.getYear() > MAX_YEAR) {
                return CommonErrors.argumentOutOfRange(irContext);
            }
            return new DateTimeValue(irContext, value, DateTimeKind.LOCAL);
        } catch (DateTimeException | ArithmeticException e) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
    }

    @Nonnull
    public static FormulaValue year(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getYear);
    }

    @Nonnull
    public static FormulaValue month(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getMonthValue);
    }

    @Nonnull
    public static FormulaValue day(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getDayOfMonth);
    }

    @Nonnull
    public static FormulaValue hour(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getHour);
    }

    @Nonnull
    public static FormulaValue minute(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getMinute);
    }

    @Nonnull
    public static FormulaValue second(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return field(context, irContext, args.get(0), LocalDateTime::getSecond);
    }

    /**
     * {@code Now()}: the clock's current instant as a local date and time.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args no arguments
     * @return the current date and time
     */
    @Nonnull
    public static FormulaValue now(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return new DateTimeValue(irContext, localNow(context), DateTimeKind.LOCAL);
    }

    @Nonnull
    public static FormulaValue today(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return new DateValue(irContext, localNow(context).toLocalDate());
    }

    @Nonnull
    public static FormulaValue isToday(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final LocalDate date = DateTimeNormalizer.normalize(args.get(0), context.getTimeZone()).getWallClock().toLocalDate();
        return new BooleanValue(irContext, date.equals(localNow(context).toLocalDate()));
    }

    /**
     * {@code TimeZoneOffset([value])}: minutes to add to a local time in the evaluation's zone to get UTC, at
     * the given date and time or now.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args an optional date-like value
     * @return the offset in minutes
     */
    @Nonnull
    public static FormulaValue timeZoneOffset(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final ZoneId zone = context.getTimeZone();
        final LocalDateTime at = args.isEmpty()
                ? localNow(context)
                : DateTimeNormalizer.normalize(args.get(0), zone).getWallClock();
        return new NumberValue(irContext, -DateTimeNormalizer.offsetAt(at, zone).getTotalSeconds() / 60.0);
    }

    @Nonnull
    public static FormulaValue weekday(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final LocalDate date = DateTimeNormalizer.normalize(args.get(0), context.getTimeZone()).getWallClock().toLocalDate();
        return weekNumber(irContext, WeekCalendar.weekday(date, code(args)), args);
    }

    @Nonnull
    public static FormulaValue weekNum(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final LocalDate date = DateTimeNormalizer.normalize(args.get(0), context.getTimeZone()).getWallClock().toLocalDate();
        return weekNumber(irContext, WeekCalendar.weekNum(date, code(args)), args);
    }

    @Nonnull
    public static FormulaValue isoWeekNum(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final LocalDate date = DateTimeNormalizer.normalize(args.get(0), context.getTimeZone()).getWallClock().toLocalDate();
        return new NumberValue(irContext, WeekCalendar.weekNum(date, WeekCalendar.ISO_WEEK_CODE).getAsInt());
    }

    /**
     * {@code DateValue(days)}: the date a serial day number falls on.
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the number of days since the epoch
     * @return the date or an argument-out-of-range error
     */
    @Nonnull
    public static FormulaValue dateValue(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        try {
            final LocalDate date = FormulaEpoch.fromDays(NumericConversions.toDouble(args.get(0))).toLocalDate();
            if (date.getYear() < 1 || date.getYear() > MAX_YEAR) {
                return CommonErrors.argumentOutOfRange(irContext);
            }
            return new DateValue(irContext, date);
        } catch (DateTimeException | ArithmeticException e) {
            return CommonErrors.argumentOutOfRange(irContext);
        }
    }

    @Nonnull
    private static LocalDateTime localNow(@Nonnull EvaluationContext context) {
        return LocalDateTime.ofInstant(context.utcNow(), context.getTimeZone());
    }

    @Nonnull
    private static FormulaValue field(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                      @Nonnull FormulaValue value, @Nonnull ToIntFunction<LocalDateTime> extractor) {
        final LocalDateTime wallClock = DateTimeNormalizer.normalize(value, context.getTimeZone()).getWallClock();
        return new NumberValue(irContext, extractor.applyAsInt(wallClock));
    }

    @Nonnull
    private static LocalDate rolledDate(@Nonnull List<FormulaValue> args) {
        final long year = (long)NumericConversions.toDouble(args.get(0));
        final long month = (long)NumericConversions.toDouble(args.get(1));
        final long day = (long)NumericConversions.toDouble(args.get(2));
        if (year < 0 || year > MAX_YEAR) {
            throw new DateTimeException("year out of range: " + year);
        }
        final LocalDate date = LocalDate.of((int)year, 1, 1).plusMonths(month - 1).plusDays(day - 1);
        if (date.getYear() < 1 || date.getYear() > MAX_YEAR) {
            throw new DateTimeException("date out of range: " + date);
        }
        return date;
    }

    @Nonnull
    private static Duration span(@Nonnull List<FormulaValue> args, int firstField) {
        final long hours = field(args, firstField);
        final long minutes = field(args, firstField + 1);
        final long seconds = field(args, firstField + 2);
        final long millis = field(args, firstField + 3);
        return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds).plusMillis(millis);
    }

    private static long field(@Nonnull List<FormulaValue> args, int index) {
        if (index >= args.size()) {
            return 0;
        }
        final double value = NumericConversions.toDouble(args.get(index));
        if (!Double.isFinite(value) || Math.abs(value) >= Long.MAX_VALUE) {
            throw new ArithmeticException("field out of range");
        }
        return (long)value;
    }

    private static int code(@Nonnull List<FormulaValue> args) {
        if (args.size() < 2) {
            return 1;
        }
        final double code = NumericConversions.toDouble(args.get(1));
        return code == Math.rint(code) && Math.abs(code) < Integer.MAX_VALUE ? (int)code : -1;
    }

    @Nonnull
    private static FormulaValue weekNumber(@Nonnull IRContext irContext, @Nonnull OptionalInt number, @Nonnull List<FormulaValue> args) {
        if (!number.isPresent()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("invalid start of week",
                        LogMessageKeys.START_OF_WEEK, args.get(1)));
            }
            return CommonErrors.invalidStartOfWeek(irContext);
        }
        return new NumberValue(irContext, number.getAsInt());
    }

    @Nullable
    private static DateTimeUnit unit(@Nonnull FormulaValue unitName) {
        return unitName.getKind() == ValueKind.STRING ? DateTimeUnit.parse(((StringValue)unitName).getValue()) : null;
    }

    @Nonnull
    private static FormulaValue invalidUnit(@Nonnull IRContext irContext, @Nonnull String functionName, @Nonnull FormulaValue unitName) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("invalid date unit",
                    LogMessageKeys.FUNCTION, functionName,
                    LogMessageKeys.UNIT, unitName));
        }
        return CommonErrors.invalidArgument(irContext, "The third argument to the " + functionName + " function is invalid");
    }
}
