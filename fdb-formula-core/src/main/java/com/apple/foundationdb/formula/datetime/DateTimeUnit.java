/*
 * DateTimeUnit.java
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

package com.apple.foundationdb.formula.datetime;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * The units accepted by {@code DateAdd} and {@code DateDiff}.
 */
@API(API.Status.STABLE)
public enum DateTimeUnit {
    MILLISECONDS("milliseconds", 1L),
    SECONDS("seconds", 1_000L),
    MINUTES("minutes", 60_000L),
    HOURS("hours", 3_600_000L),
    DAYS("days", 86_400_000L),
    MONTHS("months", 0L),
    QUARTERS("quarters", 0L),
    YEARS("years", 0L);

    @Nonnull
    private final String unitName;
    private final long millis;

    DateTimeUnit(@Nonnull String unitName, long millis) {
        this.unitName = unitName;
        this.millis = millis;
    }

    @Nonnull
    public String getUnitName() {
        return unitName;
    }

    /**
     * Whether the unit is shorter than a day. Such units are applied to elapsed time rather than to
     * wall-clock fields.
     * @return {@code true} for milliseconds through hours
     */
    public boolean isSubDay() {
        return this == MILLISECONDS || this == SECONDS || this == MINUTES || this == HOURS;
    }

    /**
     * Whether the unit is measured in calendar months.
     * @return {@code true} for months, quarters and years
     */
    public boolean isCalendar() {
        return millis == 0L;
    }

    /**
     * Length of a fixed-length unit.
     * @return the number of milliseconds in the unit, or 0 for the calendar units
     */
    public long getMillis() {
        return millis;
    }

    @Nonnull
    ChronoUnit getTruncationUnit() {
        switch (this) {
            case MILLISECONDS:
                return ChronoUnit.MILLIS;
            case SECONDS:
                return ChronoUnit.SECONDS;
            case MINUTES:
                return ChronoUnit.MINUTES;
            case HOURS:
                return ChronoUnit.HOURS;
            default:
                return ChronoUnit.DAYS;
        }
    }

    /**
     * Parse a unit name, ignoring case.
     * @param name the name as given to the function
     * @return the unit, or {@code null} if the name is not a unit
     */
    @Nullable
    public static DateTimeUnit parse(@Nonnull String name) {
        final String lower = name.toLowerCase(Locale.ROOT);
        for (DateTimeUnit unit : values()) {
            if (unit.unitName.equals(lower)) {
                return unit;
            }
        }
        return null;
    }
}
