/*
 * LoggableException.java
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

package com.apple.foundationdb.formula.util;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception type with support for adding keys and values to its log info. Hosts can log the info as
 * {@code key=value} pairs so that failures of a formula evaluation are searchable later.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nonnull
    private final Map<String, Object> logInfo = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Create an exception with the given message and a flattened sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        addLogInfo(keyValues);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    /**
     * Get the log information associated with this exception as an unmodifiable map, in insertion order.
     *
     * @return a single map with all log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        synchronized (logInfo) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(logInfo));
        }
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description key of the log info pair
     * @param object value of the log info pair
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add alternating keys and values to the log information. Keys are converted with {@link Object#toString()},
     * so {@code enum} keys log under their string form.
     *
     * @param keyValues flattened map of key-value pairs
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has odd length
     */
    @Nonnull
    public LoggableException addLogInfo(@Nullable Object... keyValues) {
        if (keyValues == null) {
            return this;
        }
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Log info must contain an even number of keys and values");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            logInfo.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information to a flattened array in the format accepted by {@link #addLogInfo(Object...)}.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> snapshot = getLogInfo();
        final Object[] flattened = new Object[snapshot.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : snapshot.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}
