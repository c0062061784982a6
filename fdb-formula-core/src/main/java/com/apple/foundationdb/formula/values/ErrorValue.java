/*
 * ErrorValue.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A first-class error result holding one or more {@link ExpressionError} records. Errors flow through
 * expressions like other values until a construct such as {@code IfError} observes them.
 */
@API(API.Status.STABLE)
public final class ErrorValue extends FormulaValue {
    @Nonnull
    private final ImmutableList<ExpressionError> errors;

    public ErrorValue(@Nonnull IRContext irContext, @Nonnull Collection<ExpressionError> errors) {
        super(irContext);
        Preconditions.checkArgument(!errors.isEmpty(), "an error value needs at least one error");
        this.errors = ImmutableList.copyOf(errors);
    }

    public ErrorValue(@Nonnull IRContext irContext, @Nonnull ExpressionError error) {
        this(irContext, ImmutableList.of(error));
    }

    /**
     * Combine several errors into one that holds the union of their records, in order of first appearance.
     * Records that appear more than once are kept once.
     *
     * @param irContext the context of the combined error, normally the context of the failing call
     * @param errors the errors to combine, not empty
     * @return the combined error
     */
    @Nonnull
    public static ErrorValue combine(@Nonnull IRContext irContext, @Nonnull Collection<ErrorValue> errors) {
        Preconditions.checkArgument(!errors.isEmpty(), "nothing to combine");
        final Set<ExpressionError> union = new LinkedHashSet<>();
        for (ErrorValue error : errors) {
            union.addAll(error.errors);
        }
        return new ErrorValue(irContext, union);
    }

    @Nonnull
    public ImmutableList<ExpressionError> getErrors() {
        return errors;
    }

    /**
     * Get the kind of the first record. Most errors carry a single record.
     * @return the first record's kind
     */
    @Nonnull
    public ErrorKind getFirstKind() {
        return errors.get(0).getKind();
    }

    @Nonnull
    public ErrorValue withIRContext(@Nonnull IRContext irContext) {
        return new ErrorValue(irContext, errors);
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorValue && ((ErrorValue)o).errors.equals(errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return "Error" + errors;
    }
}
