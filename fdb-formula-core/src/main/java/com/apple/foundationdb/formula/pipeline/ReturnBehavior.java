/*
 * ReturnBehavior.java
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

package com.apple.foundationdb.formula.pipeline;

import com.apple.foundationdb.formula.annotation.API;

/**
 * What a pipeline does when an argument is still blank after blank replacement.
 */
@API(API.Status.STABLE)
public enum ReturnBehavior {
    /** Invoke the target anyway. */
    ALWAYS_EVALUATE_AND_RETURN_RESULT,
    /** Return a blank of the call's type without invoking the target. */
    RETURN_BLANK_IF_ANY_ARG_IS_BLANK,
    /** Return the empty string without invoking the target. */
    RETURN_EMPTY_STRING_IF_ANY_ARG_IS_BLANK,
    /** Return {@code false} without invoking the target. */
    RETURN_FALSE_IF_ANY_ARG_IS_BLANK
}
