/*
 * FormulaLambda.java
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

/**
 * A deferred sub-expression. The IR evaluator supplies implementations; the functions of this library only call
 * them, passing a context whose symbols hold the current row scope.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface FormulaLambda {
    @Nonnull
    CompletableFuture<FormulaValue> evaluate(@Nonnull EvaluationContext context);
}
