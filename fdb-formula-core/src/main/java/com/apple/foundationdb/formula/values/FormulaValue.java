/*
 * FormulaValue.java
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
 * A runtime value of the formula language. The set of variants is closed and is enumerated by {@link ValueKind};
 * all variants are immutable, so values can be shared freely between concurrent row evaluations.
 *
 * <p>
 * Equality of values compares their payload only. The {@link IRContext} a value carries is not part of its
 * identity.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class FormulaValue {
    @Nonnull
    private final IRContext irContext;

    protected FormulaValue(@Nonnull IRContext irContext) {
        this.irContext = irContext;
    }

    @Nonnull
    public IRContext getIRContext() {
        return irContext;
    }

    @Nonnull
    public FormulaType getType() {
        return irContext.getResultType();
    }

    @Nonnull
    public abstract ValueKind getKind();

    public boolean isBlank() {
        return getKind() == ValueKind.BLANK;
    }

    public boolean isError() {
        return getKind() == ValueKind.ERROR;
    }
}
