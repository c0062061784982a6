/*
 * NormalizedDateTime.java
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
import com.apple.foundationdb.formula.values.DateTimeKind;

import javax.annotation.Nonnull;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A date-like operand reduced to wall-clock fields in the evaluation's zone, tagged with the kind it came from.
 */
@API(API.Status.UNSTABLE)
public final class NormalizedDateTime {
    @Nonnull
    private final LocalDateTime wallClock;
    @Nonnull
    private final DateTimeKind kind;

    NormalizedDateTime(@Nonnull LocalDateTime wallClock, @Nonnull DateTimeKind kind) {
        this.wallClock = wallClock;
        this.kind = kind;
    }

    @Nonnull
    public LocalDateTime getWallClock() {
        return wallClock;
    }

    @Nonnull
    public DateTimeKind getKind() {
        return kind;
    }

    public boolean isUtc() {
        return kind == DateTimeKind.UTC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NormalizedDateTime that = (NormalizedDateTime)o;
        return wallClock.equals(that.wallClock) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(wallClock, kind);
    }

    @Override
    public String toString() {
        return wallClock + " " + kind;
    }
}
