/*
 * DateTimeNormalizer.java
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
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.DateTimeKind;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.TimeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;

/**
 * Conversions of Date, Time and DateTime operands to a common representation in the evaluation's time zone,
 * and repair of wall-clock times that a daylight-saving gap makes invalid.
 */
@API(API.Status.UNSTABLE)
public final class DateTimeNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DateTimeNormalizer.class);

    private DateTimeNormalizer() {
        // private constructor - static methods only in this class. No instances.
    }

    /**
     * Reduce a Date, Time or DateTime to wall-clock fields. A Date is its midnight and a Time is anchored at the
     * epoch, both unspecified. A UTC DateTime is shifted into the zone unless the zone itself is UTC.
     *
     * @param value a Date, Time or DateTime value
     * @param zone the evaluation's time zone
     * @return the normalized date and time
     * @throws IllegalArgumentException for any other kind of value
     */
    @Nonnull
    public static NormalizedDateTime normalize(@Nonnull FormulaValue value, @Nonnull ZoneId zone) {
        switch (value.getKind()) {
            case DATE:
                return new NormalizedDateTime(((DateValue)value).getValue().atStartOfDay(), DateTimeKind.UNSPECIFIED);
            case TIME:
                return new NormalizedDateTime(FormulaEpoch.anchor(((TimeValue)value).getValue()), DateTimeKind.UNSPECIFIED);
            case DATE_TIME:
                final DateTimeValue dateTime = (DateTimeValue)value;
                if (dateTime.getDateTimeKind() == DateTimeKind.UTC && !isUtc(zone)) {
                    return new NormalizedDateTime(fromUtc(dateTime.getValue(), zone), DateTimeKind.LOCAL);
                }
                return new NormalizedDateTime(dateTime.getValue(), dateTime.getDateTimeKind());
            default:
                throw new IllegalArgumentException("not a date or time value: " + value.getKind());
        }
    }

    /**
     * Get the instant a Date or DateTime denotes. A Date is its midnight in the zone; a local or unspecified
     * DateTime is resolved in the zone; a UTC DateTime is read as UTC.
     *
     * @param value a Date or DateTime value
     * @param zone the evaluation's time zone
     * @return the instant
     * @throws IllegalArgumentException for any other kind of value
     */
    @Nonnull
    public static Instant toInstant(@Nonnull FormulaValue value, @Nonnull ZoneId zone) {
        switch (value.getKind()) {
            case DATE:
                return ((DateValue)value).getValue().atStartOfDay(zone).toInstant();
            case DATE_TIME:
                final DateTimeValue dateTime = (DateTimeValue)value;
                if (dateTime.getDateTimeKind() == DateTimeKind.UTC) {
                    return dateTime.getValue().toInstant(ZoneOffset.UTC);
                }
                return ZonedDateTime.ofLocal(dateTime.getValue(), zone, offsetAt(dateTime.getValue(), zone)).toInstant();
            default:
                throw new IllegalArgumentException("not a date value: " + value.getKind());
        }
    }

    /**
     * Resolve wall-clock fields in a zone to UTC wall-clock fields. A time repeated by a daylight-saving overlap
     * is read as standard time.
     * @param wallClock the local date and time
     * @param zone the zone the fields are in
     * @return the same instant as UTC fields
     */
    @Nonnull
    public static LocalDateTime toUtc(@Nonnull LocalDateTime wallClock, @Nonnull ZoneId zone) {
        return ZonedDateTime.ofLocal(wallClock, zone, offsetAt(wallClock, zone))
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
    }

    /**
     * Convert UTC wall-clock fields to the fields shown in a zone.
     * @param utc the UTC date and time
     * @param zone the target zone
     * @return the same instant as fields of the zone
     */
    @Nonnull
    public static LocalDateTime fromUtc(@Nonnull LocalDateTime utc, @Nonnull ZoneId zone) {
        return ZonedDateTime.of(utc, ZoneOffset.UTC).withZoneSameInstant(zone).toLocalDateTime();
    }

    /**
     * Get the zone's offset from UTC at a wall-clock time. A time in a gap takes the offset before the gap. A time
     * in an overlap, which the zone shows twice, takes the standard offset.
     * @param wallClock the local date and time
     * @param zone the zone
     * @return the offset
     */
    @Nonnull
    public static ZoneOffset offsetAt(@Nonnull LocalDateTime wallClock, @Nonnull ZoneId zone) {
        final ZoneRules rules = zone.getRules();
        final List<ZoneOffset> offsets = rules.getValidOffsets(wallClock);
        if (offsets.size() == 1) {
            return offsets.get(0);
        }
        final ZoneOffsetTransition transition = rules.getTransition(wallClock);
        if (offsets.isEmpty()) {
            return transition.getOffsetBefore();
        }
        final ZoneOffset standard = rules.getStandardOffset(transition.getInstant());
        return offsets.contains(standard) ? standard : transition.getOffsetAfter();
    }

    /**
     * Whether a wall-clock time exists in a zone.
     * @param wallClock the local date and time
     * @param zone the zone
     * @return {@code false} if the time falls inside a daylight-saving gap
     */
    public static boolean isValid(@Nonnull LocalDateTime wallClock, @Nonnull ZoneId zone) {
        return !zone.getRules().getValidOffsets(wallClock).isEmpty();
    }

    /**
     * Move a wall-clock time that falls inside a daylight-saving gap to the first valid time after the gap.
     * Valid times are returned unchanged. The repaired time is rounded up to a whole second.
     *
     * @param wallClock the local date and time
     * @param zone the zone
     * @return a time that exists in the zone
     */
    @Nonnull
    public static LocalDateTime makeValid(@Nonnull LocalDateTime wallClock, @Nonnull ZoneId zone) {
        final ZoneRules rules = zone.getRules();
        if (!rules.getValidOffsets(wallClock).isEmpty()) {
            return wallClock;
        }
        final ZoneOffsetTransition transition = rules.getTransition(wallClock);
        if (transition == null) {
            return wallClock;
        }
        LocalDateTime adjusted = transition.getDateTimeAfter();
        if (adjusted.getNano() != 0) {
            adjusted = adjusted.withNano(0).plusSeconds(1);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("moved time out of daylight saving gap",
                    LogMessageKeys.TIME_ZONE, zone,
                    LogMessageKeys.LOCAL_TIME, wallClock,
                    LogMessageKeys.ADJUSTED_TIME, adjusted));
        }
        return adjusted;
    }

    private static boolean isUtc(@Nonnull ZoneId zone) {
        return zone.normalized().equals(ZoneOffset.UTC);
    }
}
