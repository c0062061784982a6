/*
 * ExpressionError.java
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
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One error record of an {@link ErrorValue}.
 */
@API(API.Status.STABLE)
public final class ExpressionError {
    @Nonnull
    private final ErrorKind kind;
    @Nonnull
    private final String message;
    @Nullable
    private final SourceSpan span;

    public ExpressionError(@Nonnull ErrorKind kind, @Nonnull String message, @Nullable SourceSpan span) {
        this.kind = kind;
        this.message = message;
        this.span = span;
    }

    @Nonnull
    public static ExpressionError of(@Nonnull ErrorKind kind, @Nonnull String message) {
        return new ExpressionError(kind, message, null);
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nullable
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExpressionError that = (ExpressionError)o;
        return kind == that.kind && message.equals(that.message) && Objects.equals(span, that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, span);
    }

    @Override
    public String toString() {
        return kind + ": " + message + (span == null ? "" : " " + span);
    }
}
