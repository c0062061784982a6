/*
 * SymbolContext.java
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

package com.apple.foundationdb.formula;

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.BlankValue;
import com.apple.foundationdb.formula.values.FormulaType;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.RecordValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The names in scope for a lambda body: a chain of row-scope frames, innermost first. Entering a lambda creates
 * a new frame on top of the current chain instead of changing it, so evaluations of different rows can share
 * the enclosing frames without locking.
 */
@API(API.Status.STABLE)
public final class SymbolContext {
    @Nonnull
    public static final SymbolContext EMPTY = new SymbolContext(null, RecordValue.empty(), 0);

    @Nullable
    private final SymbolContext parent;
    @Nonnull
    private final RecordValue scope;
    private final int depth;

    private SymbolContext(@Nullable SymbolContext parent, @Nonnull RecordValue scope, int depth) {
        this.parent = parent;
        this.scope = scope;
        this.depth = depth;
    }

    /**
     * Create a context with one more frame on top.
     * @param rowScope the fields to bring into scope
     * @return the extended context; this one is unchanged
     */
    @Nonnull
    public SymbolContext withScopeValues(@Nonnull RecordValue rowScope) {
        return new SymbolContext(this, rowScope, depth + 1);
    }

    /**
     * Look a name up, starting with the innermost frame. A frame whose record type declares the name binds it
     * even without a value, as a blank of the declared type, so a blank row hides enclosing fields of the same
     * name.
     * @param name the name
     * @return the value, or {@code null} if no frame declares the name
     */
    @Nullable
    public FormulaValue lookUp(@Nonnull String name) {
        for (SymbolContext current = this; current != null; current = current.parent) {
            final FormulaValue value = current.scope.getFieldOrNull(name);
            if (value != null) {
                return value;
            }
            if (current.scope.getType().getFields().containsKey(name)) {
                return current.scope.getField(name);
            }
        }
        return null;
    }

    /**
     * Get a value by name. A name that no frame holds reads as blank, which is what a lambda sees for the fields
     * of a blank or error row.
     * @param name the name
     * @return the value
     */
    @Nonnull
    public FormulaValue get(@Nonnull String name) {
        final FormulaValue value = lookUp(name);
        return value == null ? BlankValue.of(FormulaType.BLANK) : value;
    }

    public boolean contains(@Nonnull String name) {
        return lookUp(name) != null;
    }

    @Nonnull
    public RecordValue getScope() {
        return scope;
    }

    @Nullable
    public SymbolContext getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return parent == null ? scope.toString() : scope + " -> " + parent;
    }
}
