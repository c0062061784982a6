/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.formula.logging;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the formula evaluator.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    DESCRIPTION,
    // function dispatch
    FUNCTION("fn"),
    ARGUMENT_COUNT("arg_count"),
    ERROR_COUNT,
    RESULT_TYPE,
    // table operators
    ROW_INDEX,
    ROW_COUNT,
    PIPELINE_SIZE,
    // aggregation
    AGGREGATE,
    VALUE_COUNT,
    // date and time
    TIME_ZONE("tz"),
    LOCAL_TIME,
    ADJUSTED_TIME,
    UNIT,
    START_OF_WEEK,
    // host services
    SERVICE,
    ACTUAL,
    EXPECTED;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
