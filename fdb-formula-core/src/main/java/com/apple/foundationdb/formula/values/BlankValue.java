/*
 * BlankValue.java
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
 * The absent value. A blank carries the type the binder inferred for it, so that later coercions know what it
 * stands for. All blanks are equal to each other.
 */
@API(API.Status.STABLE)
public final class BlankValue extends FormulaValue {
    public BlankValue(@Nonnull IRContext irContext) {
        super(irContext);
    }

    @Nonnull
    public static BlankValue of(@Nonnull FormulaType type) {
        return new BlankValue(IRContext.notInSource(type));
    }

    @Nonnull
    public static BlankValue of(@Nonnull IRContext irContext) {
        return new BlankValue(irContext);
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.BLANK;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlankValue;
    }

    @Override
    public int hashCode() {
        return BlankValue.class.hashCode();
    }

    @Override
    public String toString() {
        return "Blank()";
    }
}
