/*
 * KeyValueLogMessageTest.java
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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysAreSorted() {
        assertThat(KeyValueLogMessage.of("call failed", LogMessageKeys.FUNCTION, "Mod", LogMessageKeys.ARGUMENT_COUNT, 2),
                equalTo("call failed arg_count=\"2\" fn=\"Mod\""));
    }

    @Test
    public void quotesAndEqualsAreEscaped() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("odd")
                .addKeyAndValue("a=b", "say \"hi\"");
        assertThat(message.toString(), equalTo("odd ab=\"say 'hi'\""));
        assertThat(message.getKeyValueMap(), equalTo(ImmutableMap.of("ab", "say 'hi'")));
    }

    @Test
    public void nullValuesAndMaps() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("static", "missing", null)
                .addKeysAndValues(ImmutableMap.of("k", 1));
        assertThat(message.getStaticMessage(), equalTo("static"));
        assertThat(message.toString(), equalTo("static k=\"1\" missing=\"null\""));
    }

    @Test
    public void unmatchedKeysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("bad", "key"));
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.build("bad").addKeyAndValue(null, 1));
    }
}
