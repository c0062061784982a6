/*
 * TimeValue.java
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
import java.time.Duration;

/**
 * A time of day, held as the span since midnight. Arithmetic may leave the span negative or longer than a day;
 * the span is kept as is.
 */
@API(API.Status.STABLE)
public final class TimeValue extends FormulaValue {
    @Nonnull
    private final Duration value;

    public TimeValue(@Nonnull IRContext irContext, @Nonnull Duration value) {
        super(irContext);
        this.value = value;
    }

    @Nonnull
    public static TimeValue of(@Nonnull Duration value) {
        return new TimeValue(IRContext.notInSource(FormulaType.TIME), value);
    }

    @Nonnull
    public Duration getValue() {
        return value;
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.TIME;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TimeValue && ((TimeValue)o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Time(" + value + ")";
    }
}
