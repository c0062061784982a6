/*
 * AsyncFormulaFunction.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of a builtin that may suspend, typically to evaluate lambdas over table rows. Hard failures,
 * including cancellation, complete the returned future exceptionally.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface AsyncFormulaFunction {
    @Nonnull
    CompletableFuture<FormulaValue> apply(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull FormulaValue[] args);

    /**
     * Adapt a synchronous function.
     * @param function the function
     * @return an asynchronous function completing with the same result
     */
    @Nonnull
    static AsyncFormulaFunction of(@Nonnull FormulaFunction function) {
        return (context, irContext, args) -> {
            try {
                return CompletableFuture.completedFuture(function.apply(context, irContext, args));
            } catch (RuntimeException e) {
                final CompletableFuture<FormulaValue> failed = new CompletableFuture<>();
                failed.completeExceptionally(e);
                return failed;
            }
        };
    }
}
