/*
 * NumberValue.java
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
 * A double-precision floating point number.
 */
@API(API.Status.STABLE)
public final class NumberValue extends FormulaValue {
    private final double value;

    public NumberValue(@Nonnull IRContext irContext, double value) {
        super(irContext);
        this.value = value;
    }

    @Nonnull
    public static NumberValue of(double value) {
        return new NumberValue(IRContext.notInSource(FormulaType.NUMBER), value);
    }

    public double getValue() {
        return value;
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.NUMBER;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberValue && Double.compare(((NumberValue)o).value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Number(" + value + ")";
    }
}
