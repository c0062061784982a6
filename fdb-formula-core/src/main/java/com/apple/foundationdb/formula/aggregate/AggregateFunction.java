/*
 * AggregateFunction.java
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

package com.apple.foundationdb.formula.aggregate;

import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;

/**
 * The aggregate functions, with the result each produces for an empty input.
 */
@API(API.Status.STABLE)
public enum AggregateFunction {
    SUM("Sum", false),
    AVERAGE("Average", true),
    MIN("Min", false),
    MAX("Max", false),
    VAR_P("VarP", true),
    STDEV_P("StdevP", true);

    @Nonnull
    private final String functionName;
    private final boolean emptyIsDivideByZero;

    AggregateFunction(@Nonnull String functionName, boolean emptyIsDivideByZero) {
        this.functionName = functionName;
        this.emptyIsDivideByZero = emptyIsDivideByZero;
    }

    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    /**
     * Whether aggregating no elements is a division by zero rather than a blank.
     * @return {@code true} for the averaging functions
     */
    public boolean isEmptyDivideByZero() {
        return emptyIsDivideByZero;
    }
}
