/*
 * BuiltinFunctions.java
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

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.aggregate.AggregateFunction;
import com.apple.foundationdb.formula.datetime.FormulaEpoch;
import com.apple.foundationdb.formula.pipeline.ArgumentExpanders;
import com.apple.foundationdb.formula.pipeline.AsyncFormulaFunction;
import com.apple.foundationdb.formula.pipeline.AsyncTargetFunction;
import com.apple.foundationdb.formula.pipeline.BlankReplacers;
import com.apple.foundationdb.formula.pipeline.FormulaFunction;
import com.apple.foundationdb.formula.pipeline.ReturnBehavior;
import com.apple.foundationdb.formula.pipeline.RuntimeTypeChecker;
import com.apple.foundationdb.formula.pipeline.RuntimeTypeCheckers;
import com.apple.foundationdb.formula.pipeline.RuntimeValueCheckers;
import com.apple.foundationdb.formula.pipeline.StandardErrorHandling;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The builtin functions, each wrapped in its {@link StandardErrorHandling} configuration. Instances are stateless
 * and shared by all evaluations. {@link #lookup(String)} finds a builtin by its formula name.
 */
@API(API.Status.UNSTABLE)
public final class BuiltinFunctions {
    private static final RuntimeTypeChecker TABLE = RuntimeTypeCheckers.exactValueType(ValueKind.TABLE);
    private static final RuntimeTypeChecker LAMBDA = RuntimeTypeCheckers.exactValueType(ValueKind.LAMBDA);
    private static final RuntimeTypeChecker STRING = RuntimeTypeCheckers.exactValueType(ValueKind.STRING);
    private static final RuntimeTypeChecker NUMERIC = RuntimeTypeCheckers.numberOrDecimal();
    // a table followed by lambdas
    private static final RuntimeTypeChecker TABLE_AND_LAMBDAS = RuntimeTypeCheckers.exactSequence(TABLE, LAMBDA);
    // a table followed by column names
    private static final RuntimeTypeChecker TABLE_AND_COLUMNS = RuntimeTypeCheckers.exactSequence(TABLE, STRING);

    private static final FormulaValue EPOCH_DATE = DateValue.of(FormulaEpoch.EPOCH_DATE);

    // Math

    public static final FormulaFunction ABS = StandardErrorHandling.newBuilder("Abs", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapSingleColumnTable(MathFunctions::abs);

    public static final FormulaFunction INT = StandardErrorHandling.newBuilder("Int", FormulaValue.class)
            .replaceBlanks(BlankReplacers.zero())
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .wrapSingleColumnTable(MathFunctions::intFloor);

    public static final FormulaFunction TRUNC = StandardErrorHandling.newBuilder("Trunc", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(2, NumberValue.of(0)))
            .replaceBlanks(BlankReplacers.zero())
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .wrapSingleColumnTable(MathFunctions::trunc);

    public static final FormulaFunction MOD = StandardErrorHandling.newBuilder("Mod", FormulaValue.class)
            .replaceBlanks(BlankReplacers.zero())
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.all(RuntimeValueCheckers.finite(), RuntimeValueCheckers.divideByZero()))
            .wrap(MathFunctions::mod);

    public static final FormulaFunction ROUND = rounding("Round").wrapSingleColumnTable(MathFunctions::round);

    public static final FormulaFunction ROUND_UP = rounding("RoundUp").wrapSingleColumnTable(MathFunctions::roundUp);

    public static final FormulaFunction ROUND_DOWN = rounding("RoundDown").wrapSingleColumnTable(MathFunctions::roundDown);

    public static final FormulaFunction SQRT = StandardErrorHandling.newBuilder("Sqrt", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.positiveNumber())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapSingleColumnTable(MathFunctions::sqrt);

    public static final FormulaFunction LN = StandardErrorHandling.newBuilder("Ln", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.strictPositiveNumber())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(MathFunctions::ln);

    public static final FormulaFunction LOG = StandardErrorHandling.newBuilder("Log", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(2, NumberValue.of(10)))
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.strictPositiveNumber())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(MathFunctions::log);

    public static final FormulaFunction EXP = StandardErrorHandling.newBuilder("Exp", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(MathFunctions::exp);

    public static final FormulaFunction POWER = StandardErrorHandling.newBuilder("Power", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(MathFunctions::power);

    public static final FormulaFunction RAND = StandardErrorHandling.newBuilder("Rand", FormulaValue.class)
            .wrap(MathFunctions::rand);

    public static final FormulaFunction RAND_BETWEEN = StandardErrorHandling.newBuilder("RandBetween", FormulaValue.class)
            .replaceBlanks(BlankReplacers.zero())
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .wrap(MathFunctions::randBetween);

    public static final FormulaFunction SEQUENCE = StandardErrorHandling.newBuilder("Sequence", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(3, NumberValue.of(1)))
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(MathFunctions::sequence);

    // Aggregates

    public static final AsyncFormulaFunction SUM = aggregate(AggregateFunction.SUM);
    public static final AsyncFormulaFunction AVERAGE = aggregate(AggregateFunction.AVERAGE);
    public static final AsyncFormulaFunction MIN = aggregate(AggregateFunction.MIN);
    public static final AsyncFormulaFunction MAX = aggregate(AggregateFunction.MAX);
    public static final AsyncFormulaFunction VAR_P = aggregate(AggregateFunction.VAR_P);
    public static final AsyncFormulaFunction STDEV_P = aggregate(AggregateFunction.STDEV_P);

    // Tables

    public static final AsyncFormulaFunction FILTER = StandardErrorHandling.newBuilder("Filter", FormulaValue.class)
            .checkTypes(TABLE_AND_LAMBDAS)
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::filter);

    public static final AsyncFormulaFunction FOR_ALL = StandardErrorHandling.newBuilder("ForAll", FormulaValue.class)
            .checkTypes(TABLE_AND_LAMBDAS)
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::forAll);

    public static final AsyncFormulaFunction LOOK_UP = StandardErrorHandling.newBuilder("LookUp", FormulaValue.class)
            .checkTypes(TABLE_AND_LAMBDAS)
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::lookUp);

    public static final AsyncFormulaFunction ADD_COLUMNS = StandardErrorHandling.newBuilder("AddColumns", FormulaValue.class)
            .checkTypes((irContext, index, arg) -> {
                final ValueKind expected = index == 0 ? ValueKind.TABLE : (index % 2 == 1 ? ValueKind.STRING : ValueKind.LAMBDA);
                return arg.getKind() == expected ? arg : CommonErrors.runtimeTypeMismatch(irContext);
            })
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::addColumns);

    public static final AsyncFormulaFunction SORT = StandardErrorHandling.newBuilder("Sort", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(3, StringValue.of("Ascending")))
            .checkTypes(RuntimeTypeCheckers.exactSequence(TABLE, LAMBDA, RuntimeTypeCheckers.deferred()))
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::sort);

    public static final AsyncFormulaFunction COUNT_IF = StandardErrorHandling.newBuilder("CountIf", FormulaValue.class)
            .checkTypes(TABLE_AND_LAMBDAS)
            .wrapAsync(TableFunctions::countIf);

    public static final AsyncFormulaFunction DISTINCT = StandardErrorHandling.newBuilder("Distinct", FormulaValue.class)
            .checkTypes(TABLE_AND_LAMBDAS)
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrapAsync(TableFunctions::distinct);

    public static final FormulaFunction SORT_BY_COLUMNS = StandardErrorHandling.newBuilder("SortByColumns", FormulaValue.class)
            .checkTypes(TABLE_AND_COLUMNS)
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(TableFunctions::sortByColumns);

    public static final FormulaFunction COUNT_ROWS = StandardErrorHandling.newBuilder("CountRows", FormulaValue.class)
            .checkTypes(TABLE)
            .wrap(TableFunctions::countRows);

    public static final FormulaFunction COUNT = StandardErrorHandling.newBuilder("Count", FormulaValue.class)
            .checkTypes(TABLE)
            .wrap(TableFunctions::count);

    public static final FormulaFunction COUNT_A = StandardErrorHandling.newBuilder("CountA", FormulaValue.class)
            .checkTypes(TABLE)
            .wrap(TableFunctions::countA);

    public static final FormulaFunction FIRST = tableOnly("First").wrap(TableFunctions::first);

    public static final FormulaFunction LAST = tableOnly("Last").wrap(TableFunctions::last);

    public static final FormulaFunction FIRST_N = StandardErrorHandling.newBuilder("FirstN", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(2, NumberValue.of(1)))
            .replaceBlanks(BlankReplacers.forSpecificIndices(ImmutableMap.of(1, BlankReplacers.zero())))
            .checkTypes(RuntimeTypeCheckers.exactSequence(TABLE, NUMERIC))
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(TableFunctions::firstN);

    public static final FormulaFunction LAST_N = StandardErrorHandling.newBuilder("LastN", FormulaValue.class)
            .expandArguments(ArgumentExpanders.insertDefaultValues(2, NumberValue.of(1)))
            .replaceBlanks(BlankReplacers.forSpecificIndices(ImmutableMap.of(1, BlankReplacers.zero())))
            .checkTypes(RuntimeTypeCheckers.exactSequence(TABLE, NUMERIC))
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(TableFunctions::lastN);

    public static final FormulaFunction DROP_COLUMNS = tableWithColumns("DropColumns").wrap(TableFunctions::dropColumns);

    public static final FormulaFunction SHOW_COLUMNS = tableWithColumns("ShowColumns").wrap(TableFunctions::showColumns);

    public static final FormulaFunction RENAME_COLUMNS = tableWithColumns("RenameColumns").wrap(TableFunctions::renameColumns);

    // Date and time

    public static final FormulaFunction DATE_ADD = StandardErrorHandling.newBuilder("DateAdd", FormulaValue.class)
            .expandArguments(ArgumentExpanders.trailingDefaults(2, StringValue.of("days")))
            .replaceBlanks(BlankReplacers.forSpecificIndices(ImmutableMap.of(1, BlankReplacers.zero())))
            .checkTypes(RuntimeTypeCheckers.exactSequence(RuntimeTypeCheckers.dateTimeLike(),
                    RuntimeTypeCheckers.oneOf(ValueKind.NUMBER, ValueKind.DECIMAL, ValueKind.TIME), STRING))
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(DateTimeFunctions::dateAdd);

    public static final FormulaFunction DATE_DIFF = StandardErrorHandling.newBuilder("DateDiff", FormulaValue.class)
            .expandArguments(ArgumentExpanders.trailingDefaults(2, StringValue.of("days")))
            .checkTypes(RuntimeTypeCheckers.exactSequence(RuntimeTypeCheckers.dateTimeLike(),
                    RuntimeTypeCheckers.dateTimeLike(), STRING))
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(DateTimeFunctions::dateDiff);

    public static final FormulaFunction DATE = numericFields("Date").wrap(DateTimeFunctions::date);

    public static final FormulaFunction TIME = numericFields("Time").wrap(DateTimeFunctions::time);

    public static final FormulaFunction DATE_TIME = numericFields("DateTime").wrap(DateTimeFunctions::dateTime);

    public static final FormulaFunction YEAR = dateField("Year").wrap(DateTimeFunctions::year);

    public static final FormulaFunction MONTH = dateField("Month").wrap(DateTimeFunctions::month);

    public static final FormulaFunction DAY = dateField("Day").wrap(DateTimeFunctions::day);

    public static final FormulaFunction HOUR = dateField("Hour").wrap(DateTimeFunctions::hour);

    public static final FormulaFunction MINUTE = dateField("Minute").wrap(DateTimeFunctions::minute);

    public static final FormulaFunction SECOND = dateField("Second").wrap(DateTimeFunctions::second);

    public static final FormulaFunction NOW = StandardErrorHandling.newBuilder("Now", FormulaValue.class)
            .wrap(DateTimeFunctions::now);

    public static final FormulaFunction TODAY = StandardErrorHandling.newBuilder("Today", FormulaValue.class)
            .wrap(DateTimeFunctions::today);

    public static final FormulaFunction IS_TODAY = StandardErrorHandling.newBuilder("IsToday", FormulaValue.class)
            .checkTypes(RuntimeTypeCheckers.dateOrDateTime())
            .returnBehavior(ReturnBehavior.RETURN_FALSE_IF_ANY_ARG_IS_BLANK)
            .wrap(DateTimeFunctions::isToday);

    public static final FormulaFunction TIME_ZONE_OFFSET = StandardErrorHandling.newBuilder("TimeZoneOffset", FormulaValue.class)
            .checkTypes(RuntimeTypeCheckers.dateTimeLike())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(DateTimeFunctions::timeZoneOffset);

    public static final FormulaFunction WEEKDAY = weekNumbering("Weekday").wrap(DateTimeFunctions::weekday);

    public static final FormulaFunction WEEK_NUM = weekNumbering("WeekNum").wrap(DateTimeFunctions::weekNum);

    public static final FormulaFunction ISO_WEEK_NUM = dateField("ISOWeekNum").wrap(DateTimeFunctions::isoWeekNum);

    public static final FormulaFunction DATE_VALUE = StandardErrorHandling.newBuilder("DateValue", FormulaValue.class)
            .checkTypes(NUMERIC)
            .checkValues(RuntimeValueCheckers.finite())
            .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
            .wrap(DateTimeFunctions::dateValue);

    // Logical and errors. Errors and blanks reach these unchanged, so they skip the pipeline.

    public static final AsyncFormulaFunction IF = lazy(LogicalFunctions::ifThen);
    public static final AsyncFormulaFunction SWITCH = lazy(LogicalFunctions::switchOf);
    public static final AsyncFormulaFunction AND = lazy(LogicalFunctions::and);
    public static final AsyncFormulaFunction OR = lazy(LogicalFunctions::or);
    public static final AsyncFormulaFunction IF_ERROR = lazy(LogicalFunctions::ifError);
    public static final AsyncFormulaFunction COALESCE = lazy(LogicalFunctions::coalesce);

    public static final FormulaFunction IS_BLANK = (context, irContext, args) ->
            LogicalFunctions.isBlank(context, irContext, Arrays.asList(args));

    public static final FormulaFunction IS_ERROR = (context, irContext, args) ->
            LogicalFunctions.isError(context, irContext, Arrays.asList(args));

    public static final FormulaFunction ERROR = StandardErrorHandling.newBuilder("Error", FormulaValue.class)
            .replaceBlanks(BlankReplacers.perIndex(StringValue.of("")))
            .checkTypes(RuntimeTypeCheckers.exactSequence(STRING, NUMERIC))
            .wrap(LogicalFunctions::error);

    private static final Map<String, AsyncFormulaFunction> BY_NAME = ImmutableMap.<String, AsyncFormulaFunction>builder()
            .put("abs", AsyncFormulaFunction.of(ABS))
            .put("int", AsyncFormulaFunction.of(INT))
            .put("trunc", AsyncFormulaFunction.of(TRUNC))
            .put("mod", AsyncFormulaFunction.of(MOD))
            .put("round", AsyncFormulaFunction.of(ROUND))
            .put("roundup", AsyncFormulaFunction.of(ROUND_UP))
            .put("rounddown", AsyncFormulaFunction.of(ROUND_DOWN))
            .put("sqrt", AsyncFormulaFunction.of(SQRT))
            .put("ln", AsyncFormulaFunction.of(LN))
            .put("log", AsyncFormulaFunction.of(LOG))
            .put("exp", AsyncFormulaFunction.of(EXP))
            .put("power", AsyncFormulaFunction.of(POWER))
            .put("rand", AsyncFormulaFunction.of(RAND))
            .put("randbetween", AsyncFormulaFunction.of(RAND_BETWEEN))
            .put("sequence", AsyncFormulaFunction.of(SEQUENCE))
            .put("sum", SUM)
            .put("average", AVERAGE)
            .put("min", MIN)
            .put("max", MAX)
            .put("varp", VAR_P)
            .put("stdevp", STDEV_P)
            .put("filter", FILTER)
            .put("forall", FOR_ALL)
            .put("lookup", LOOK_UP)
            .put("addcolumns", ADD_COLUMNS)
            .put("sort", SORT)
            .put("countif", COUNT_IF)
            .put("distinct", DISTINCT)
            .put("sortbycolumns", AsyncFormulaFunction.of(SORT_BY_COLUMNS))
            .put("countrows", AsyncFormulaFunction.of(COUNT_ROWS))
            .put("count", AsyncFormulaFunction.of(COUNT))
            .put("counta", AsyncFormulaFunction.of(COUNT_A))
            .put("first", AsyncFormulaFunction.of(FIRST))
            .put("last", AsyncFormulaFunction.of(LAST))
            .put("firstn", AsyncFormulaFunction.of(FIRST_N))
            .put("lastn", AsyncFormulaFunction.of(LAST_N))
            .put("dropcolumns", AsyncFormulaFunction.of(DROP_COLUMNS))
            .put("showcolumns", AsyncFormulaFunction.of(SHOW_COLUMNS))
            .put("renamecolumns", AsyncFormulaFunction.of(RENAME_COLUMNS))
            .put("dateadd", AsyncFormulaFunction.of(DATE_ADD))
            .put("datediff", AsyncFormulaFunction.of(DATE_DIFF))
            .put("date", AsyncFormulaFunction.of(DATE))
            .put("time", AsyncFormulaFunction.of(TIME))
            .put("datetime", AsyncFormulaFunction.of(DATE_TIME))
            .put("year", AsyncFormulaFunction.of(YEAR))
            .put("month", AsyncFormulaFunction.of(MONTH))
            .put("day", AsyncFormulaFunction.of(DAY))
            .put("hour", AsyncFormulaFunction.of(HOUR))
            .put("minute", AsyncFormulaFunction.of(MINUTE))
            .put("second", AsyncFormulaFunction.of(SECOND))
            .put("now", AsyncFormulaFunction.of(NOW))
            .put("today", AsyncFormulaFunction.of(TODAY))
            .put("istoday", AsyncFormulaFunction.of(IS_TODAY))
            .put("timezoneoffset", AsyncFormulaFunction.of(TIME_ZONE_OFFSET))
            .put("weekday", AsyncFormulaFunction.of(WEEKDAY))
            .put("weeknum", AsyncFormulaFunction.of(WEEK_NUM))
            .put("isoweeknum", AsyncFormulaFunction.of(ISO_WEEK_NUM))
            .put("datevalue", AsyncFormulaFunction.of(DATE_VALUE))
            .put("if", IF)
            .put("switch", SWITCH)
            .put("and", AND)
            .put("or", OR)
            .put("iferror", IF_ERROR)
            .put("coalesce", COALESCE)
            .put("isblank", AsyncFormulaFunction.of(IS_BLANK))
            .put("iserror", AsyncFormulaFunction.of(IS_ERROR))
            .put("error", AsyncFormulaFunction.of(ERROR))
            .build();

    private BuiltinFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Find a builtin by name, ignoring case.
     * @param name the formula name, such as {@code "DateAdd"}
     * @return the builtin, or {@code null} if there is none with that name
     */
    @Nullable
    public static AsyncFormulaFunction lookup(@Nonnull String name) {
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * An aggregate accepting either a list of values or a table and a per-row lambda. Blank values are skipped
     * in the first form; a blank table is blank in the second.
     * @param function the aggregate function
     * @return the builtin
     */
    @Nonnull
    private static AsyncFormulaFunction aggregate(@Nonnull AggregateFunction function) {
        final AsyncFormulaFunction overValues = AsyncFormulaFunction.of(
                StandardErrorHandling.newBuilder(function.getFunctionName(), FormulaValue.class)
                        .checkValues(RuntimeValueCheckers.finite())
                        .wrap(AggregateFunctions.scalar(function)));
        final AsyncFormulaFunction overTable = StandardErrorHandling.newBuilder(function.getFunctionName(), FormulaValue.class)
                .checkTypes(TABLE_AND_LAMBDAS)
                .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK)
                .wrapAsync(AggregateFunctions.table(function));
        return (context, irContext, args) -> {
            if (args.length == 2 && args[1].getKind() == ValueKind.LAMBDA) {
                return overTable.apply(context, irContext, args);
            }
            return overValues.apply(context, irContext, args);
        };
    }

    @Nonnull
    private static AsyncFormulaFunction lazy(@Nonnull AsyncTargetFunction<FormulaValue> target) {
        return (context, irContext, args) -> {
            try {
                return target.apply(context, irContext, Arrays.asList(args));
            } catch (RuntimeException e) {
                final CompletableFuture<FormulaValue> failed = new CompletableFuture<>();
                failed.completeExceptionally(e);
                return failed;
            }
        };
    }

    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> rounding(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .replaceBlanks(BlankReplacers.zero())
                .checkTypes(NUMERIC)
                .checkValues(RuntimeValueCheckers.finite());
    }

    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> tableOnly(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .checkTypes(TABLE)
                .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK);
    }

    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> tableWithColumns(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .checkTypes(TABLE_AND_COLUMNS)
                .returnBehavior(ReturnBehavior.RETURN_BLANK_IF_ANY_ARG_IS_BLANK);
    }

    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> numericFields(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .replaceBlanks(BlankReplacers.zero())
                .checkTypes(NUMERIC)
                .checkValues(RuntimeValueCheckers.finite());
    }

    // a blank date is the epoch
    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> dateField(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .replaceBlanks(BlankReplacers.with(EPOCH_DATE))
                .checkTypes(RuntimeTypeCheckers.dateTimeLike());
    }

    @Nonnull
    private static StandardErrorHandling.Builder<FormulaValue> weekNumbering(@Nonnull String name) {
        return StandardErrorHandling.newBuilder(name, FormulaValue.class)
                .expandArguments(ArgumentExpanders.insertDefaultValues(2, NumberValue.of(1)))
                .replaceBlanks(BlankReplacers.perIndex(EPOCH_DATE, NumberValue.of(1)))
                .checkTypes(RuntimeTypeCheckers.exactSequence(RuntimeTypeCheckers.dateTimeLike(), NUMERIC))
                .checkValues(RuntimeValueCheckers.finite());
    }
}
