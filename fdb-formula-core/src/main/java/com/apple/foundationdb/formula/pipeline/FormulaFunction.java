/*
 * FormulaFunction.java
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

/**
 * Entry point of a builtin whose result does not depend on evaluating lambdas. The row scope is reached
 * through {@link EvaluationContext#getSymbols()}.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface FormulaFunction {
    @Nonnull
    FormulaValue apply(@Nonnull EvaluationContext context, @Nonnull IRContext irContext, @Nonnull FormulaValue[] args);
}
