/*
 * FormulaEpoch.java
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
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * The serial-date epoch. Day 0 is 1899-12-30, so that day 1 is 1899-12-31 and day 2 is 1900-01-01, and a time
 * of day is a span anchored at the epoch's midnight.
 */
@API(API.Status.STABLE)
public final class FormulaEpoch {
    public static final LocalDate EPOCH_DATE = LocalDate.of(1899, 12, 30);
    public static final LocalDateTime EPOCH = EPOCH_DATE.atStartOfDay();

    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private FormulaEpoch() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Convert a wall-clock date and time to fractional days since the epoch.
     * @param dateTime the date and time
     * @return days since the epoch
     */
    public static double toDays(@Nonnull LocalDateTime dateTime) {
        return Duration.between(EPOCH, dateTime).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * Convert fractional days since the epoch to a wall-clock date and time, to the millisecond.
     * @param days days since the epoch
     * @return the date and time
     * @throws java.time.DateTimeException if the result is out of range
     * @throws ArithmeticException if the result is out of range
     */
    @Nonnull
    public static LocalDateTime fromDays(double days) {
        if (!Double.isFinite(days)) {
            throw new ArithmeticException("days must be finite");
        }
        return EPOCH.plus(Duration.ofMillis(Math.round(days * MILLIS_PER_DAY)));
    }

    /**
     * Anchor a time-of-day span at the epoch.
     * @param timeOfDay the span since midnight
     * @return the epoch plus the span
     */
    @Nonnull
    public static LocalDateTime anchor(@Nonnull Duration timeOfDay) {
        return EPOCH.plus(timeOfDay);
    }

    /**
     * Get the span of a date and time from the epoch, the inverse of {@link #anchor(Duration)}.
     * @param dateTime the date and time
     * @return the span since the epoch
     */
    @Nonnull
    public static Duration sinceEpoch(@Nonnull LocalDateTime dateTime) {
        return Duration.between(EPOCH, dateTime);
    }
}
