/*
 * SourceSpan.java
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

package com.apple.foundationdb.formula.values;

import com.apple.foundationdb.formula.annotation.API;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A half-open character range {@code [min, lim)} of the formula text that produced a value.
 */
@API(API.Status.STABLE)
public final class SourceSpan {
    private final int min;
    private final int lim;

    public SourceSpan(int min, int lim) {
        Preconditions.checkArgument(min >= 0 && lim >= min, "invalid span [%s, %s)", min, lim);
        this.min = min;
        this.lim = lim;
    }

    public int getMin() {
        return min;
    }

    public int getLim() {
        return lim;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SourceSpan that = (SourceSpan)o;
        return min == that.min && lim == that.lim;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, lim);
    }

    @Override
    public String toString() {
        return "[" + min + "," + lim + ")";
    }
}
