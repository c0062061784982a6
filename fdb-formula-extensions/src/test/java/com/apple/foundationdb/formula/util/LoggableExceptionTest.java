/*
 * LoggableExceptionTest.java
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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {

    @Test
    void keyValuesFromConstructor() {
        LoggableException ex = new LoggableException("row failed", "row", 3, "function", "Filter");
        assertThat(ex.getMessage(), equalTo("row failed"));
        Map<String, Object> info = ex.getLogInfo();
        assertThat(info, hasEntry("row", 3));
        assertThat(info, hasEntry("function", "Filter"));
    }

    @Test
    void exportKeepsInsertionOrder() {
        LoggableException ex = new LoggableException("msg")
                .addLogInfo("b", 2)
                .addLogInfo("a", 1);
        assertThat(ex.exportLogInfo(), arrayContaining("b", 2, "a", 1));
    }

    @Test
    void oddKeyValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("msg", "lonely"));
    }

    @Test
    void nullValueIsKept() {
        LoggableException ex = new LoggableException("msg").addLogInfo("missing", null);
        assertThat(ex.getLogInfo().containsKey("missing"), equalTo(true));
    }
}
