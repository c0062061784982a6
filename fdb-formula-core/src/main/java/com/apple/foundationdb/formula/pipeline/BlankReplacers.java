/*
 * BlankReplacers.java
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
import com.apple.foundationdb.formula.values.BooleanValue;
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.StringValue;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Standard {@link BlankReplacer}s.
 */
@API(API.Status.STABLE)
public final class BlankReplacers {
    private static final BlankReplacer DO_NOT_REPLACE = (irContext, index, blank) -> blank;

    private BlankReplacers() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static BlankReplacer doNotReplace() {
        return DO_NOT_REPLACE;
    }

    /**
     * Replace blanks with zero: a decimal zero for a blank typed as decimal, a number zero otherwise.
     * @return the replacer
     */
    @Nonnull
    public static BlankReplacer zero() {
        return (irContext, index, blank) -> blank.getType().getCode() == FormulaType.TypeCode.DECIMAL
                ? new DecimalValue(IRContext.notInSource(FormulaType.DECIMAL), BigDecimal.ZERO)
                : new NumberValue(IRContext.notInSource(FormulaType.NUMBER), 0.0);
    }

    @Nonnull
    public static BlankReplacer emptyString() {
        return (irContext, index, blank) -> new StringValue(IRContext.notInSource(FormulaType.STRING), "");
    }

    @Nonnull
    public static BlankReplacer falseValue() {
        return (irContext, index, blank) -> new BooleanValue(IRContext.notInSource(FormulaType.BOOLEAN), false);
    }

    @Nonnull
    public static BlankReplacer with(@Nonnull FormulaValue replacement) {
        return (irContext, index, blank) -> replacement;
    }

    /**
     * Replace a blank at position {@code i} with {@code replacements[i]}. Blanks past the end of the array are
     * kept.
     * @param replacements the replacement for each position
     * @return the replacer
     */
    @Nonnull
    public static BlankReplacer perIndex(@Nonnull FormulaValue... replacements) {
        final FormulaValue[] copy = replacements.clone();
        return (irContext, index, blank) -> index < copy.length ? copy[index] : blank;
    }

    /**
     * Use a different replacer at some positions, and keep blanks at every other position.
     * @param replacers the replacer for each listed position
     * @return the replacer
     */
    @Nonnull
    public static BlankReplacer forSpecificIndices(@Nonnull Map<Integer, BlankReplacer> replacers) {
        final Map<Integer, BlankReplacer> copy = ImmutableMap.copyOf(replacers);
        return (irContext, index, blank) -> {
            final BlankReplacer replacer = copy.get(index);
            return replacer == null ? blank : replacer.replace(irContext, index, blank);
        };
    }
}
