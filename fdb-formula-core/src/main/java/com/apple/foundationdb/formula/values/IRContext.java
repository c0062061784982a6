/*
 * IRContext.java
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
 * The result type and optional source span of an IR node. Every runtime value carries one, so that results
 * derived from a value (a coerced blank, a combined error) can be re-typed to the node that produced them.
 */
@API(API.Status.STABLE)
public final class IRContext {
    @Nonnull
    private final FormulaType resultType;
    @Nullable
    private final SourceSpan sourceSpan;

    private IRContext(@Nonnull FormulaType resultType, @Nullable SourceSpan sourceSpan) {
        this.resultType = resultType;
        this.sourceSpan = sourceSpan;
    }

    @Nonnull
    public static IRContext of(@Nonnull FormulaType resultType, @Nullable SourceSpan sourceSpan) {
        return new IRContext(resultType, sourceSpan);
    }

    /**
     * Context for values synthesized by the runtime rather than read from the formula text.
     * @param resultType the type of the value
     * @return a context without a source span
     */
    @Nonnull
    public static IRContext notInSource(@Nonnull FormulaType resultType) {
        return new IRContext(resultType, null);
    }

    @Nonnull
    public FormulaType getResultType() {
        return resultType;
    }

    @Nullable
    public SourceSpan getSourceSpan() {
        return sourceSpan;
    }

    @Nonnull
    public IRContext withResultType(@Nonnull FormulaType newResultType) {
        return new IRContext(newResultType, sourceSpan);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IRContext irContext = (IRContext)o;
        return resultType.equals(irContext.resultType) && Objects.equals(sourceSpan, irContext.sourceSpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultType, sourceSpan);
    }

    @Override
    public String toString() {
        return sourceSpan == null ? resultType.toString() : resultType + "@" + sourceSpan;
    }
}
