/*
 * MutableTableConnector.java
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
import com.apple.foundationdb.formula.values.ErrorKind;
import com.apple.foundationdb.formula.values.ErrorValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.RecordValue;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * A host table that mutation functions write to. Failures are returned as
 * {@link ErrorValue}s rather than thrown: a missing row is reported with
 * {@link ErrorKind#NOT_FOUND}, so that callers can tell it apart from every other kind of failure.
 */
@API(API.Status.EXPERIMENTAL)
public interface MutableTableConnector {
    /**
     * Update the row matching {@code baseRecord} with the fields of {@code changes}.
     * @param baseRecord the row to update
     * @param changes the fields to change
     * @return the updated record, or an error
     */
    @Nonnull
    CompletableFuture<FormulaValue> patch(@Nonnull RecordValue baseRecord, @Nonnull RecordValue changes);

    /**
     * Add a row.
     * @param record the row to add
     * @return the record as stored, or an error
     */
    @Nonnull
    CompletableFuture<FormulaValue> append(@Nonnull RecordValue record);

    /**
     * Remove every row.
     * @return a boolean value, or an error
     */
    @Nonnull
    CompletableFuture<FormulaValue> clear();

    /**
     * Whether a value returned by a connector reports a missing row.
     * @param result a connector result
     * @return whether any error record of the result has kind {@link ErrorKind#NOT_FOUND}
     */
    static boolean isNotFound(@Nonnull FormulaValue result) {
        return result instanceof ErrorValue
                && ((ErrorValue)result).getErrors().stream().anyMatch(error -> error.getKind() == ErrorKind.NOT_FOUND);
    }
}
