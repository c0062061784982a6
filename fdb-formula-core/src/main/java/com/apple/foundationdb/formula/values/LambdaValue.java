/*
 * LambdaValue.java
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

import com.apple.foundationdb.formula.EvaluationContext;
import com.apple.foundationdb.formula.annotation.API;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A deferred expression passed to a function that decides when, and in which row scope, to evaluate it.
 * Evaluating a lambda is a suspension point: the returned future may complete on another thread.
 */
@API(API.Status.STABLE)
public final class LambdaValue extends FormulaValue {
    @Nonnull
    private final FormulaLambda body;

    public LambdaValue(@Nonnull IRContext irContext, @Nonnull FormulaLambda body) {
        super(irContext);
        this.body = body;
    }

    @Nonnull
    public static LambdaValue of(@Nonnull FormulaType resultType, @Nonnull FormulaLambda body) {
        return new LambdaValue(IRContext.notInSource(resultType), body);
    }

    /**
     * Create a lambda whose body completes synchronously.
     * @param resultType the type the body produces
     * @param body the body
     * @return a new lambda value
     */
    @Nonnull
    public static LambdaValue ofSync(@Nonnull FormulaType resultType, @Nonnull Function<EvaluationContext, FormulaValue> body) {
        return of(resultType, context -> CompletableFuture.completedFuture(body.apply(context)));
    }

    /**
     * Evaluate the body in the given context. A body that throws is reported as a failed future rather than
     * thrown to the caller.
     * @param context the context, normally extended with a row scope
     * @return the future result
     */
    @Nonnull
    public CompletableFuture<FormulaValue> evaluate(@Nonnull EvaluationContext context) {
        try {
            return body.evaluate(context);
        } catch (RuntimeException e) {
            final CompletableFuture<FormulaValue> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    /**
     * Evaluate the body with a row's fields bound into scope.
     * @param context the enclosing context
     * @param row the row
     * @return the future result
     */
    @Nonnull
    public CompletableFuture<FormulaValue> evaluateInRow(@Nonnull EvaluationContext context, @Nonnull TableRow row) {
        return evaluate(context.withScopeValues(row.toScope()));
    }

    @Nonnull
    @Override
    public ValueKind getKind() {
        return ValueKind.LAMBDA;
    }

    @Override
    public String toString() {
        return "Lambda(" + getType() + ")";
    }
}
