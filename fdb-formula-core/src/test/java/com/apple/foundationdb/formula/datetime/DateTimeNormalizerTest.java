/*
 * DateTimeNormalizerTest.java
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

import com.apple.foundationdb.formula.values.DateTimeKind;
import com.apple.foundationdb.formula.values.DateTimeValue;
import com.apple.foundationdb.formula.values.DateValue;
import com.apple.foundationdb.formula.values.TimeValue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static com.apple.foundationdb.formula.FormulaTestHelpers.num;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DateTimeNormalizer}.
 */
public class DateTimeNormalizerTest {
    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");
    private static final LocalDateTime IN_GAP = LocalDateTime.of(2024, 3, 10, 2, 30);

    @Test
    public void normalizeDate() {
        final NormalizedDateTime normalized = DateTimeNormalizer.normalize(DateValue.of(LocalDate.of(2024, 2, 3)), LOS_ANGELES);
        assertThat(normalized.getWallClock(), equalTo(LocalDateTime.of(2024, 2, 3, 0, 0)));
        assertThat(normalized.getKind(), equalTo(DateTimeKind.UNSPECIFIED));
    }

    @Test
    public void normalizeTimeAnchorsAtEpoch() {
        final NormalizedDateTime normalized = DateTimeNormalizer.normalize(TimeValue.of(Duration.ofHours(30)), LOS_ANGELES);
        assertThat(normalized.getWallClock(), equalTo(LocalDateTime.of(1899, 12, 31, 6, 0)));
    }

    @Test
    public void normalizeUtcDateTime() {
        final DateTimeValue utc = DateTimeValue.of(LocalDateTime.of(2024, 1, 15, 20, 0), DateTimeKind.UTC);
        final NormalizedDateTime local = DateTimeNormalizer.normalize(utc, LOS_ANGELES);
        assertThat(local.getWallClock(), equalTo(LocalDateTime.of(2024, 1, 15, 12, 0)));
        assertThat(local.getKind(), equalTo(DateTimeKind.LOCAL));

        final NormalizedDateTime unchanged = DateTimeNormalizer.normalize(utc, ZoneOffset.UTC);
        assertThat(unchanged.getWallClock(), equalTo(utc.getValue()));
        assertTrue(unchanged.isUtc());
    }

    @Test
    public void normalizeRejectsOtherKinds() {
        assertThrows(IllegalArgumentException.class, () -> DateTimeNormalizer.normalize(num(1), LOS_ANGELES));
        assertThrows(IllegalArgumentException.class, () -> DateTimeNormalizer.toInstant(TimeValue.of(Duration.ZERO), LOS_ANGELES));
    }

    @Test
    public void toInstant() {
        assertThat(DateTimeNormalizer.toInstant(DateValue.of(LocalDate.of(2024, 1, 1)), LOS_ANGELES),
                equalTo(Instant.parse("2024-01-01T08:00:00Z")));
        assertThat(DateTimeNormalizer.toInstant(DateTimeValue.of(LocalDateTime.of(2024, 7, 1, 0, 0), DateTimeKind.UTC), LOS_ANGELES),
                equalTo(Instant.parse("2024-07-01T00:00:00Z")));
        assertThat(DateTimeNormalizer.toInstant(DateTimeValue.of(LocalDateTime.of(2024, 7, 1, 0, 0), DateTimeKind.LOCAL), LOS_ANGELES),
                equalTo(Instant.parse("2024-07-01T07:00:00Z")));
    }

    @Test
    public void utcRoundTrip() {
        final LocalDateTime wallClock = LocalDateTime.of(2024, 7, 4, 9, 15);
        final LocalDateTime utc = DateTimeNormalizer.toUtc(wallClock, LOS_ANGELES);
        assertThat(utc, equalTo(LocalDateTime.of(2024, 7, 4, 16, 15)));
        assertThat(DateTimeNormalizer.fromUtc(utc, LOS_ANGELES), equalTo(wallClock));
    }

    @Test
    public void gapHandling() {
        assertFalse(DateTimeNormalizer.isValid(IN_GAP, LOS_ANGELES));
        assertTrue(DateTimeNormalizer.isValid(IN_GAP.plusHours(1), LOS_ANGELES));
        assertThat(DateTimeNormalizer.offsetAt(IN_GAP, LOS_ANGELES), equalTo(ZoneOffset.ofHours(-8)));
        assertThat(DateTimeNormalizer.makeValid(IN_GAP, LOS_ANGELES), equalTo(LocalDateTime.of(2024, 3, 10, 3, 0)));
        assertThat(DateTimeNormalizer.makeValid(IN_GAP.minusHours(1), LOS_ANGELES), equalTo(IN_GAP.minusHours(1)));
    }

    @Test
    public void overlapIsReadAsStandardTime() {
        final LocalDateTime ambiguous = LocalDateTime.of(2024, 11, 3, 1, 30);
        assertTrue(DateTimeNormalizer.isValid(ambiguous, LOS_ANGELES));
        assertThat(DateTimeNormalizer.offsetAt(ambiguous, LOS_ANGELES), equalTo(ZoneOffset.ofHours(-8)));
        assertThat(DateTimeNormalizer.toUtc(ambiguous, LOS_ANGELES), equalTo(LocalDateTime.of(2024, 11, 3, 9, 30)));
        assertThat(DateTimeNormalizer.offsetAt(ambiguous.minusHours(1), LOS_ANGELES), equalTo(ZoneOffset.ofHours(-7)));
    }
}
