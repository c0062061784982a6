/*
 * DateTimeValue.java
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
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A date and wall-clock time, tagged with the {@link DateTimeKind} that says which zone the fields are in.
 */
@API(API.Status.STABLE)
public final class DateTimeValue extends FormulaValue {
    @Nonnull
    private final LocalDateTime value;
    @Nonnull
    private final DateTimeKind dateTimeKind;

    public DateTimeValue(@Nonnull IRContext irContext, @Nonnull LocalDateTime value, @Nonnull DateTimeKind dateTimeKind) {
        super(irContext);
        this.value = value;
        this.dateTimeKind = dateTimeKind;
    }

    @Nonnull
    public static DateTimeValue of(@Nonnull LocalDateTime value) {
        return of(value, DateTimeKind.LOCAL);
    }

    @Nonnull
    public static DateTimeValue of(@Nonnull LocalDateTime value, @Nonnull DateTimeKind dateTimeKind) {
        return new DateTimeValue(IRContext.notInSource(FormulaType.DATE_TIME), value, dateTimeKind);
    }

    @Nonnull
    public LocalDateTime getValue() {
        return value;
    }

    @Nonnull
    public DateTimeKind getDateTimeKind() {
        return dateTimeKind;
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.DATE_TIME;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DateTimeValue)) {
            return false;
        }
        DateTimeValue that = (DateTimeValue)o;
        return value.equals(that.value) && dateTimeKind == that.dateTimeKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dateTimeKind);
    }

    @Override
    public String toString() {
        return "DateTime(" + value + " " + dateTimeKind + ")";
    }
}
