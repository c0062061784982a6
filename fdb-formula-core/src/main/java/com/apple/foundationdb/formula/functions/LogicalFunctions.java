/*
 * LogicalFunctions.java
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
import com.apple.foundationdb.formula.async.MoreAsyncUtil;
import com.apple.foundationdb.formula.table.RowScopedEvaluator;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.LambdaValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.ValueKind;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logical and error-handling builtins. Arguments that are only evaluated on some paths are passed as
 * {@link LambdaValue}s and forced here; any argument may also be passed already evaluated. Cancellation is
 * checked before each argument is forced.
 */
@API(API.Status.UNSTABLE)
public final class LogicalFunctions {
    private LogicalFunctions() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * {@code If(condition, result, [condition, result, ...] [, else])}: the result of the first condition that is
     * {@code true}, the else branch if none is, or blank without an else branch. An error condition is the result.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args alternating conditions and results, optionally followed by the else branch
     * @return a future with the chosen result
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> ifThen(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                         @Nonnull List<FormulaValue> args) {
        return ifFrom(context, irContext, args, 0);
    }

    @Nonnull
    private static CompletableFuture<FormulaValue> ifFrom(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                          @Nonnull List<FormulaValue> args, int index) {
        if (index >= args.size()) {
            return CompletableFuture.completedFuture(BlankValue.of(irContext));
        }
        if (index == args.size() - 1) {
            return force(context, args.get(index));
        }
        return force(context, args.get(index)).thenCompose(condition -> {
            if (condition.getKind() == ValueKind.ERROR) {
                return CompletableFuture.completedFuture(condition);
            }
            if (RowScopedEvaluator.isTrue(condition)) {
                return force(context, args.get(index + 1));
            }
            return ifFrom(context, irContext, args, index + 2);
        });
    }

    /**
     * {@code Switch(value, match, result, [match, result, ...] [, default])}: the result paired with the first
     * match equal to the value. Numbers and decimals compare by numeric value.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the value, alternating matches and results, and an optional default
     * @return a future with the chosen result, or blank if nothing matches and there is no default
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> switchOf(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                           @Nonnull List<FormulaValue> args) {
        return force(context, args.get(0)).thenCompose(value -> {
            if (value.getKind() == ValueKind.ERROR) {
                return CompletableFuture.completedFuture(value);
            }
            return switchFrom(context, irContext, args, value, 1);
        });
    }

    @Nonnull
    private static CompletableFuture<FormulaValue> switchFrom(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                              @Nonnull List<FormulaValue> args, @Nonnull FormulaValue value,
                                                              int index) {
        if (index >= args.size()) {
            return CompletableFuture.completedFuture(BlankValue.of(irContext));
        }
        if (index == args.size() - 1) {
            return force(context, args.get(index));
        }
        return force(context, args.get(index)).thenCompose(match -> {
            if (match.getKind() == ValueKind.ERROR) {
                return CompletableFuture.completedFuture(match);
            }
            if (matches(value, match)) {
                return force(context, args.get(index + 1));
            }
            return switchFrom(context, irContext, args, value, index + 2);
        });
    }

    @Nonnull
    public static CompletableFuture<FormulaValue> and(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                      @Nonnull List<FormulaValue> args) {
        return shortCircuit(context, irContext, args, false);
    }

    @Nonnull
    public static CompletableFuture<FormulaValue> or(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                     @Nonnull List<FormulaValue> args) {
        return shortCircuit(context, irContext, args, true);
    }

    // Stops at the first argument equal to stopOn, or at the first error. Blank counts as false.
    @Nonnull
    private static CompletableFuture<FormulaValue> shortCircuit(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                                @Nonnull List<FormulaValue> args, boolean stopOn) {
        final AtomicInteger index = new AtomicInteger();
        final AtomicReference<FormulaValue> result = new AtomicReference<>(new BooleanValue(irContext, !stopOn));
        return MoreAsyncUtil.whileTrue(() -> {
            final int i = index.getAndIncrement();
            if (i >= args.size()) {
                return CompletableFuture.completedFuture(false);
            }
            return force(context, args.get(i)).thenApply(value -> {
                if (value.getKind() == ValueKind.ERROR) {
                    result.set(value);
                    return false;
                }
                if (value.getKind() != ValueKind.BLANK && value.getKind() != ValueKind.BOOLEAN) {
                    result.set(CommonErrors.runtimeTypeMismatch(irContext));
                    return false;
                }
                if (RowScopedEvaluator.isTrue(value) == stopOn) {
                    result.set(new BooleanValue(irContext, stopOn));
                    return false;
                }
                return true;
            });
        }).thenApply(vignore -> result.get());
    }

    @Nonnull
    public static FormulaValue isBlank(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return new BooleanValue(irContext, isBlankOrEmpty(args.get(0)));
    }

    @Nonnull
    public static FormulaValue isError(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        return new BooleanValue(irContext, args.get(0).getKind() == ValueKind.ERROR);
    }

    /**
     * {@code IfError(value, fallback, [value, fallback, ...] [, default])}: evaluate the values in order. The first
     * one that is an error is replaced by its fallback, which is the result. If none is an error the result is
     * the default, or the last value when there is no default.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args alternating values and fallbacks, optionally followed by a default
     * @return a future with the result
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> ifError(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                          @Nonnull List<FormulaValue> args) {
        return ifErrorFrom(context, irContext, args, 0, BlankValue.of(irContext));
    }

    @Nonnull
    private static CompletableFuture<FormulaValue> ifErrorFrom(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                               @Nonnull List<FormulaValue> args, int index,
                                                               @Nonnull FormulaValue last) {
        if (index >= args.size()) {
            return CompletableFuture.completedFuture(last);
        }
        if (index == args.size() - 1) {
            return force(context, args.get(index));
        }
        return force(context, args.get(index)).thenCompose(value -> {
            if (value.getKind() == ValueKind.ERROR) {
                return force(context, args.get(index + 1));
            }
            return ifErrorFrom(context, irContext, args, index + 2, value);
        });
    }

    /**
     * {@code Coalesce(value, ...)}: the first argument that is neither blank nor an empty string. Errors are
     * returned as soon as they are reached.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the candidates
     * @return a future with the first non-blank value, or blank
     */
    @Nonnull
    public static CompletableFuture<FormulaValue> coalesce(@Nonnull EvaluationContext context, @Nonnull IRContext irContext,
                                                           @Nonnull List<FormulaValue> args) {
        final AtomicInteger index = new AtomicInteger();
        final AtomicReference<FormulaValue> result = new AtomicReference<>(BlankValue.of(irContext));
        return MoreAsyncUtil.whileTrue(() -> {
            final int i = index.getAndIncrement();
            if (i >= args.size()) {
                return CompletableFuture.completedFuture(false);
            }
            return force(context, args.get(i)).thenApply(value -> {
                if (isBlankOrEmpty(value)) {
                    return true;
                }
                result.set(value);
                return false;
            });
        }).thenApply(vignore -> result.get());
    }

    /**
     * {@code Error(message[, kind])}: raise an error. The kind is an error kind code and defaults to
     * {@link ErrorKind#CUSTOM}.
     *
     * @param context the evaluation context
     * @param irContext the context of the call
     * @param args the message and optional kind code
     * @return the error
     */
    @Nonnull
    public static FormulaValue error(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull List<FormulaValue> args) {
        final String message = args.get(0).getKind() == ValueKind.STRING ? ((StringValue)args.get(0)).getValue() : "";
        ErrorKind kind = ErrorKind.CUSTOM;
        if (args.size() > 1 && NumericConversions.isNumeric(args.get(1))) {
            try {
                kind = ErrorKind.fromCode((int)NumericConversions.toDouble(args.get(1)));
            } catch (IllegalArgumentException e) {
                return CommonErrors.invalidArgument(irContext, e.getMessage());
            }
        }
        return CommonErrors.custom(irContext, kind, message);
    }

    @Nonnull
    private static CompletableFuture<FormulaValue> force(@Nonnull EvaluationContext context, @Nonnull FormulaValue arg) {
        context.checkCancel();
        if (arg.getKind() == ValueKind.LAMBDA) {
            return ((LambdaValue)arg).evaluate(context);
        }
        return CompletableFuture.completedFuture(arg);
    }

    private static boolean isBlankOrEmpty(@Nonnull FormulaValue value) {
        return value.getKind() == ValueKind.BLANK
                || (value.getKind() == ValueKind.STRING && ((StringValue)value).getValue().isEmpty());
    }

    private static boolean matches(@Nonnull FormulaValue value, @Nonnull FormulaValue match) {
        if (NumericConversions.isNumeric(value) && NumericConversions.isNumeric(match)) {
            final BigDecimal left = NumericConversions.toBigDecimal(value);
            final BigDecimal right = NumericConversions.toBigDecimal(match);
            if (left == null || right == null) {
                return NumericConversions.toDouble(value) == NumericConversions.toDouble(match);
            }
            return left.compareTo(right) == 0;
        }
        return value.equals(match);
    }
}
