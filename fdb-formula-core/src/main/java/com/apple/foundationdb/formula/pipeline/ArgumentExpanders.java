/*
 * ArgumentExpanders.java
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

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.function.Function;

/**
 * Standard {@link ArgumentExpander}s.
 */
@API(API.Status.STABLE)
public final class ArgumentExpanders {
    private static final ArgumentExpander NONE = (irContext, args) -> args;

    private ArgumentExpanders() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static ArgumentExpander none() {
        return NONE;
    }

    /**
     * Pad the argument list to {@code outputCount} arguments with copies of {@code fillWith}.
     * @param outputCount the length to pad to
     * @param fillWith the value of every added argument
     * @return the expander
     */
    @Nonnull
    public static ArgumentExpander insertDefaultValues(int outputCount, @Nonnull FormulaValue fillWith) {
        Preconditions.checkArgument(outputCount >= 0, "output count must not be negative");
        return (irContext, args) -> {
            if (args.length >= outputCount) {
                return args;
            }
            final FormulaValue[] expanded = Arrays.copyOf(args, outputCount);
            Arrays.fill(expanded, args.length, outputCount, fillWith);
            return expanded;
        };
    }

    /**
     * Supply defaults for optional trailing arguments. The default at position {@code i} of {@code defaults}
     * is used for argument {@code firstOptional + i} when the call did not pass it.
     * @param firstOptional index of the first optional argument
     * @param defaults the defaults, in argument order
     * @return the expander
     */
    @Nonnull
    public static ArgumentExpander trailingDefaults(int firstOptional, @Nonnull FormulaValue... defaults) {
        Preconditions.checkArgument(firstOptional >= 0, "first optional index must not be negative");
        final FormulaValue[] copy = defaults.clone();
        final int outputCount = firstOptional + copy.length;
        return (irContext, args) -> {
            if (args.length >= outputCount) {
                return args;
            }
            final FormulaValue[] expanded = Arrays.copyOf(args, outputCount);
            for (int i = Math.max(args.length, firstOptional); i < outputCount; i++) {
                expanded[i] = copy[i - firstOptional];
            }
            return expanded;
        };
    }

    /**
     * Append one argument computed from the arguments passed, when fewer than {@code outputCount - 1} were
     * passed. For instance, an optional argument that defaults to a copy of the first one.
     * @param outputCount the length of the expanded list
     * @param computeDefault computes the missing last argument from the passed ones
     * @return the expander
     */
    @Nonnull
    public static ArgumentExpander computedDefault(int outputCount, @Nonnull Function<FormulaValue[], FormulaValue> computeDefault) {
        Preconditions.checkArgument(outputCount > 0, "output count must be positive");
        return (irContext, args) -> {
            if (args.length != outputCount - 1) {
                return args;
            }
            final FormulaValue[] expanded = Arrays.copyOf(args, outputCount);
            expanded[outputCount - 1] = computeDefault.apply(args);
            return expanded;
        };
    }
}
