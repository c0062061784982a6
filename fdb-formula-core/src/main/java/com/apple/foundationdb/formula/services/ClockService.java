/*
 * ClockService.java
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

package com.apple.foundationdb.formula.services;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Source of the current time for {@code Now}, {@code Today} and related functions.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface ClockService {
    /**
     * Get the current instant. Implementations must be safe to call from several threads.
     * @return the current time, in UTC
     */
    @Nonnull
    Instant utcNow();

    @Nonnull
    static ClockService system() {
        return Instant::now;
    }

    @Nonnull
    static ClockService fixed(@Nonnull Instant instant) {
        return () -> instant;
    }
}
