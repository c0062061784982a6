/*
 * StandardErrorHandling.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.ErrorValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.StringValue;
import com.apple.foundationdb.formula.values.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The standard error-handling wrapper that builtins go through before their implementation runs. The stages
 * run strictly in order over the whole argument list:
 *
 * <ol>
 *     <li>{@link ArgumentExpander}: fill in optional arguments;</li>
 *     <li>{@link BlankReplacer}: substitute defaults for blank arguments;</li>
 *     <li>{@link RuntimeTypeChecker}: check the runtime kind of each non-blank, non-error argument;</li>
 *     <li>{@link RuntimeValueChecker}: validate the value of each argument narrowed to {@code T}.</li>
 * </ol>
 *
 * <p>
 * If any argument is an error after the last stage, the errors of all positions are combined into one error
 * typed to the call and the target is not invoked. Otherwise the {@link ReturnBehavior} decides whether a
 * remaining blank short-circuits the call. A configured instance is immutable and can be shared by all
 * evaluations.
 * </p>
 *
 * @param <T> the type every argument is narrowed to before the target is invoked
 */
@API(API.Status.STABLE)
public final class StandardErrorHandling<T extends FormulaValue> {
    private static final Logger LOGGER = LoggerFactory.getLogger(StandardErrorHandling.class);

    @Nonnull
    private final String functionName;
    @Nonnull
    private final Class<T> argumentClass;
    @Nonnull
    private final ArgumentExpander argumentExpander;
    @Nonnull
    private final BlankReplacer blankReplacer;
    @Nonnull
    private final RuntimeTypeChecker typeChecker;
    @Nonnull
    private final RuntimeValueChecker<? super T> valueChecker;
    @Nonnull
    private final ReturnBehavior returnBehavior;

    private StandardErrorHandling(@Nonnull Builder<T> builder) {
        this.functionName = builder.functionName;
        this.argumentClass = builder.argumentClass;
        this.argumentExpander = builder.argumentExpander;
        this.blankReplacer = builder.blankReplacer;
        this.typeChecker = builder.typeChecker;
        this.valueChecker = builder.valueChecker;
        this.returnBehavior = builder.returnBehavior;
    }

    /**
     * Start configuring a pipeline. Unless overridden, the pipeline does not expand arguments, does not replace
     * blanks, defers type and value checking to the target, and always evaluates.
     *
     * @param functionName name of the builtin, used in log messages
     * @param argumentClass the class every argument is narrowed to
     * @param <T> the argument type
     * @return a new builder
     */
    @Nonnull
    public static <T extends FormulaValue> Builder<T> newBuilder(@Nonnull String functionName, @Nonnull Class<T> argumentClass) {
        return new Builder<>(functionName, argumentClass);
    }

    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    @Nonnull
    public ReturnBehavior getReturnBehavior() {
        return returnBehavior;
    }

    /**
     * Wrap a synchronous target.
     * @param target the implementation
     * @return the wrapped function
     */
    @Nonnull
    public FormulaFunction wrap(@Nonnull TargetFunction<T> target) {
        return (context, irContext, args) -> {
            final Prepared<T> prepared = prepare(context, irContext, args);
            if (prepared.shortCircuit != null) {
                return prepared.shortCircuit;
            }
            context.checkCancel();
            return target.apply(context, irContext, prepared.arguments);
        };
    }

    /**
     * Wrap an asynchronous target. Staging is identical to {@link #wrap(TargetFunction)}; only the final
     * invocation may suspend.
     * @param target the implementation
     * @return the wrapped function
     */
    @Nonnull
    public AsyncFormulaFunction wrapAsync(@Nonnull AsyncTargetFunction<T> target) {
        return (context, irContext, args) -> {
            final Prepared<T> prepared;
            try {
                prepared = prepare(context, irContext, args);
                if (prepared.shortCircuit != null) {
                    return CompletableFuture.completedFuture(prepared.shortCircuit);
                }
                context.checkCancel();
                return target.apply(context, irContext, prepared.arguments);
            } catch (RuntimeException e) {
                final CompletableFuture<FormulaValue> failed = new CompletableFuture<>();
                failed.completeExceptionally(e);
                return failed;
            }
        };
    }

    /**
     * Wrap a target so that it also accepts a single-column table as its first argument, applying this pipeline
     * to each cell.
     * @param target the implementation for scalar arguments
     * @return the wrapped tabular function
     * @see TabularOverloads#singleColumnTable(FormulaFunction)
     */
    @Nonnull
    public FormulaFunction wrapSingleColumnTable(@Nonnull TargetFunction<T> target) {
        return TabularOverloads.singleColumnTable(wrap(target));
    }

    @Nonnull
    private Prepared<T> prepare(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull FormulaValue[] rawArgs) {
        context.checkCancel();
        final FormulaValue[] args = argumentExpander.expand(irContext, rawArgs).clone();

        boolean anyBlank = false;
        final List<ErrorValue> errors = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            FormulaValue arg = args[i];
            if (arg.getKind() == ValueKind.BLANK) {
                arg = blankReplacer.replace(irContext, i, (BlankValue)arg);
            }
            if (arg.getKind() != ValueKind.BLANK && arg.getKind() != ValueKind.ERROR) {
                arg = typeChecker.check(irContext, i, arg);
            }
            if (argumentClass.isInstance(arg)) {
                arg = valueChecker.check(irContext, i, argumentClass.cast(arg));
            }
            if (arg.getKind() == ValueKind.ERROR) {
                errors.add((ErrorValue)arg);
            } else if (arg.getKind() == ValueKind.BLANK) {
                anyBlank = true;
            }
            args[i] = arg;
        }

        if (!errors.isEmpty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("argument errors short-circuit call",
                        LogMessageKeys.FUNCTION, functionName,
                        LogMessageKeys.ARGUMENT_COUNT, args.length,
                        LogMessageKeys.ERROR_COUNT, errors.size()));
            }
            return Prepared.shortCircuit(ErrorValue.combine(irContext, errors));
        }

        if (anyBlank) {
            switch (returnBehavior) {
                case RETURN_BLANK_IF_ANY_ARG_IS_BLANK:
                    return Prepared.shortCircuit(BlankValue.of(irContext));
                case RETURN_EMPTY_STRING_IF_ANY_ARG_IS_BLANK:
                    return Prepared.shortCircuit(new StringValue(irContext, ""));
                case RETURN_FALSE_IF_ANY_ARG_IS_BLANK:
                    return Prepared.shortCircuit(new BooleanValue(irContext, false));
                case ALWAYS_EVALUATE_AND_RETURN_RESULT:
                default:
                    break;
            }
        }

        final List<T> narrowed = new ArrayList<>(args.length);
        for (FormulaValue arg : args) {
            if (!argumentClass.isInstance(arg)) {
                LOGGER.error(KeyValueLogMessage.of("argument cannot be narrowed for target",
                        LogMessageKeys.FUNCTION, functionName,
                        LogMessageKeys.EXPECTED, argumentClass.getSimpleName(),
                        LogMessageKeys.ACTUAL, arg.getKind()));
                return Prepared.shortCircuit(CommonErrors.unreachableCode(irContext));
            }
            narrowed.add(argumentClass.cast(arg));
        }
        return Prepared.invoke(narrowed);
    }

    @Override
    public String toString() {
        return "StandardErrorHandling(" + functionName + ", " + argumentClass.getSimpleName() + ", " + returnBehavior + ")";
    }

    private static final class Prepared<T> {
        @Nullable
        private final FormulaValue shortCircuit;
        @Nonnull
        private final List<T> arguments;

        private Prepared(@Nullable FormulaValue shortCircuit, @Nonnull List<T> arguments) {
            this.shortCircuit = shortCircuit;
            this.arguments = arguments;
        }

        @Nonnull
        static <T> Prepared<T> shortCircuit(@Nonnull FormulaValue result) {
            return new Prepared<>(result, List.of());
        }

        @Nonnull
        static <T> Prepared<T> invoke(@Nonnull List<T> arguments) {
            return new Prepared<>(null, arguments);
        }
    }

    /**
     * A builder for {@link StandardErrorHandling}.
     *
     * @param <T> the argument type
     */
    public static final class Builder<T extends FormulaValue> {
        @Nonnull
        private final String functionName;
        @Nonnull
        private final Class<T> argumentClass;
        @Nonnull
        private ArgumentExpander argumentExpander = ArgumentExpanders.none();
        @Nonnull
        private BlankReplacer blankReplacer = BlankReplacers.doNotReplace();
        @Nonnull
        private RuntimeTypeChecker typeChecker = RuntimeTypeCheckers.deferred();
        @Nonnull
        private RuntimeValueChecker<? super T> valueChecker = RuntimeValueCheckers.deferred();
        @Nonnull
        private ReturnBehavior returnBehavior = ReturnBehavior.ALWAYS_EVALUATE_AND_RETURN_RESULT;

        private Builder(@Nonnull String functionName, @Nonnull Class<T> argumentClass) {
            this.functionName = functionName;
            this.argumentClass = argumentClass;
        }

        @Nonnull
        public Builder<T> expandArguments(@Nonnull ArgumentExpander argumentExpander) {
            this.argumentExpander = argumentExpander;
            return this;
        }

        @Nonnull
        public Builder<T> replaceBlanks(@Nonnull BlankReplacer blankReplacer) {
            this.blankReplacer = blankReplacer;
            return this;
        }

        @Nonnull
        public Builder<T> checkTypes(@Nonnull RuntimeTypeChecker typeChecker) {
            this.typeChecker = typeChecker;
            return this;
        }

        @Nonnull
        public Builder<T> checkValues(@Nonnull RuntimeValueChecker<? super T> valueChecker) {
            this.valueChecker = valueChecker;
            return this;
        }

        @Nonnull
        public Builder<T> returnBehavior(@Nonnull ReturnBehavior returnBehavior) {
            this.returnBehavior = returnBehavior;
            return this;
        }

        @Nonnull
        public StandardErrorHandling<T> build() {
            return new StandardErrorHandling<>(this);
        }

        @Nonnull
        public FormulaFunction wrap(@Nonnull TargetFunction<T> target) {
            return build().wrap(target);
        }

        @Nonnull
        public AsyncFormulaFunction wrapAsync(@Nonnull AsyncTargetFunction<T> target) {
            return build().wrapAsync(target);
        }

        @Nonnull
        public FormulaFunction wrapSingleColumnTable(@Nonnull TargetFunction<T> target) {
            return build().wrapSingleColumnTable(target);
        }
    }
}
