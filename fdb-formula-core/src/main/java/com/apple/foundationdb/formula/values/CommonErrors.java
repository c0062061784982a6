/*
 * CommonErrors.java
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

package com.apple.foundationdb.formula.values;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;

/**
 * Factory for the errors raised by the standard functions. Each error takes its span from the
 * {@link IRContext} of the failing call and is typed to that call's result.
 */
@API(API.Status.UNSTABLE)
public final class CommonErrors {
    private CommonErrors() {
        // private constructor - static methods only in this class. No instances.
    }

    @Nonnull
    public static ErrorValue of(@Nonnull IRContext irContext, @Nonnull ErrorKind kind, @Nonnull String message) {
        return new ErrorValue(irContext, new ExpressionError(kind, message, irContext.getSourceSpan()));
    }

    @Nonnull
    public static ErrorValue runtimeTypeMismatch(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.VALIDATION, "Runtime type mismatch");
    }

    @Nonnull
    public static ErrorValue divByZero(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.DIV0, "Invalid operation: division by zero.");
    }

    @Nonnull
    public static ErrorValue overflow(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.NUMERIC, "Overflow");
    }

    @Nonnull
    public static ErrorValue numeric(@Nonnull IRContext irContext, @Nonnull String message) {
        return of(irContext, ErrorKind.NUMERIC, message);
    }

    @Nonnull
    public static ErrorValue argumentOutOfRange(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.INVALID_ARGUMENT, "Argument out of range");
    }

    @Nonnull
    public static ErrorValue invalidArgument(@Nonnull IRContext irContext, @Nonnull String message) {
        return of(irContext, ErrorKind.INVALID_ARGUMENT, message);
    }

    @Nonnull
    public static ErrorValue invalidStartOfWeek(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.INVALID_ARGUMENT, "Invalid start of week value");
    }

    @Nonnull
    public static ErrorValue mismatchedTableLengths(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.NOT_APPLICABLE, "Table arguments must all have the same number of rows");
    }

    @Nonnull
    public static ErrorValue invalidSortColumn(@Nonnull IRContext irContext, @Nonnull String column) {
        return of(irContext, ErrorKind.INVALID_ARGUMENT,
                "The specified column '" + column + "' does not exist or is an invalid sort column type.");
    }

    @Nonnull
    public static ErrorValue notSupported(@Nonnull IRContext irContext, @Nonnull String message) {
        return of(irContext, ErrorKind.NOT_SUPPORTED, message);
    }

    @Nonnull
    public static ErrorValue unreachableCode(@Nonnull IRContext irContext) {
        return of(irContext, ErrorKind.INTERNAL, "Unexpected error");
    }

    @Nonnull
    public static ErrorValue notFound(@Nonnull IRContext irContext, @Nonnull String message) {
        return of(irContext, ErrorKind.NOT_FOUND, message);
    }

    @Nonnull
    public static ErrorValue custom(@Nonnull IRContext irContext, @Nonnull ErrorKind kind, @Nonnull String message) {
        return of(irContext, kind, message);
    }
}
