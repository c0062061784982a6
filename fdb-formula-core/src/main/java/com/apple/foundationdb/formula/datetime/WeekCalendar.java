/*
 * WeekCalendar.java
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
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.OptionalInt;

/**
 * Day-of-week and week-of-year numbering under the start-of-week codes.
 */
@API(API.Status.UNSTABLE)
public final class WeekCalendar {
    public static final int ISO_WEEK_CODE = 21;

    private WeekCalendar() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Number the day of the week of a date.
     *
     * <ul>
     *     <li>1: Sunday is 1 through Saturday 7;</li>
     *     <li>2: Monday is 1 through Sunday 7;</li>
     *     <li>3: Monday is 0 through Sunday 6;</li>
     *     <li>11 to 17: the week starts Monday through Sunday respectively, and its first day is 1.</li>
     * </ul>
     *
     * @param date the date
     * @param code the start-of-week code
     * @return the day number, or empty if the code is not valid
     */
    @Nonnull
    public static OptionalInt weekday(@Nonnull LocalDate date, int code) {
        final int dayOfWeek = date.getDayOfWeek().getValue();
        switch (code) {
            case 1:
                return OptionalInt.of(dayOfWeek % 7 + 1);
            case 2:
                return OptionalInt.of(dayOfWeek);
            case 3:
                return OptionalInt.of(dayOfWeek - 1);
            default:
                if (code >= 11 && code <= 17) {
                    return OptionalInt.of(Math.floorMod(dayOfWeek - (code - 10), 7) + 1);
                }
                return OptionalInt.empty();
        }
    }

    /**
     * Number the week of the year of a date. Week 1 is the week holding January 1, and weeks start on the day
     * the code names: 1 or 17 Sunday, 2 or 11 Monday, 12 to 16 Tuesday through Saturday. Code 21 numbers
     * weeks as ISO 8601 does.
     *
     * @param date the date
     * @param code the start-of-week code
     * @return the week number, or empty if the code is not valid
     */
    @Nonnull
    public static OptionalInt weekNum(@Nonnull LocalDate date, int code) {
        if (code == ISO_WEEK_CODE) {
            return OptionalInt.of(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
        final DayOfWeek firstDay;
        if (code == 1 || code == 17) {
            firstDay = DayOfWeek.SUNDAY;
        } else if (code == 2 || code == 11) {
            firstDay = DayOfWeek.MONDAY;
        } else if (code >= 12 && code <= 16) {
            firstDay = DayOfWeek.of(code - 10);
        } else {
            return OptionalInt.empty();
        }
        final LocalDate januaryFirst = date.withDayOfYear(1);
        final int leadingDays = Math.floorMod(januaryFirst.getDayOfWeek().getValue() - firstDay.getValue(), 7);
        return OptionalInt.of((date.getDayOfYear() - 1 + leadingDays) / 7 + 1);
    }
}
