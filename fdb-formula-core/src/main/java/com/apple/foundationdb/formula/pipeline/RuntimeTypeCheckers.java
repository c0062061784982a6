/*
 * RuntimeTypeCheckers.java
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
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.ValueKind;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import javax.annotation.Nonnull;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Standard {@link RuntimeTypeChecker}s. Blank and error arguments never reach a type checker.
 */
@API(API.Status.STABLE)
public final class RuntimeTypeCheckers {
    private static final RuntimeTypeChecker DEFERRED = (irContext, index, arg) -> arg;

    private RuntimeTypeCheckers() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Accept every argument, leaving type checks to the target.
     * @return the checker
     */
    @Nonnull
    public static RuntimeTypeChecker deferred() {
        return DEFERRED;
    }

    @Nonnull
    public static RuntimeTypeChecker exactValueType(@Nonnull ValueKind kind) {
        return oneOf(kind);
    }

    /**
     * Accept arguments of any of the given kinds.
     * @param first an accepted kind
     * @param rest more accepted kinds
     * @return the checker
     */
    @Nonnull
    public static RuntimeTypeChecker oneOf(@Nonnull ValueKind first, @Nonnull ValueKind... rest) {
        final Set<ValueKind> accepted = Sets.immutableEnumSet(EnumSet.of(first, rest));
        return (irContext, index, arg) -> accepted.contains(arg.getKind()) ? arg : CommonErrors.runtimeTypeMismatch(irContext);
    }

    /**
     * Accept arguments of the given kind, or tables (for tabular overloads).
     * @param kind the scalar kind
     * @return the checker
     */
    @Nonnull
    public static RuntimeTypeChecker exactValueTypeOrTable(@Nonnull ValueKind kind) {
        return oneOf(kind, ValueKind.TABLE);
    }

    @Nonnull
    public static RuntimeTypeChecker numberOrDecimal() {
        return oneOf(ValueKind.NUMBER, ValueKind.DECIMAL);
    }

    @Nonnull
    public static RuntimeTypeChecker dateOrDateTime() {
        return oneOf(ValueKind.DATE, ValueKind.DATE_TIME);
    }

    @Nonnull
    public static RuntimeTypeChecker timeOrDateTime() {
        return oneOf(ValueKind.TIME, ValueKind.DATE_TIME);
    }

    /**
     * Any of the date and time kinds.
     * @return the checker
     */
    @Nonnull
    public static RuntimeTypeChecker dateTimeLike() {
        return oneOf(ValueKind.DATE, ValueKind.DATE_TIME, ValueKind.TIME);
    }

    /**
     * Use a different checker for each position. Positions past the end of the list use the last checker.
     * @param checkers the checker for each position
     * @return the checker
     */
    @Nonnull
    public static RuntimeTypeChecker exactSequence(@Nonnull RuntimeTypeChecker... checkers) {
        Preconditions.checkArgument(checkers.length > 0, "at least one checker is required");
        final List<RuntimeTypeChecker> copy = ImmutableList.copyOf(checkers);
        return (irContext, index, arg) -> copy.get(Math.min(index, copy.size() - 1)).check(irContext, index, arg);
    }
}
