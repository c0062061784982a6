/*
 * CancellationSignal.java
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

import javax.annotation.Nonnull;

/**
 * Polled by long-running operations at row boundaries and loop iterations. Cancellation is cooperative: nothing
 * is interrupted, the evaluation notices the request the next time it polls.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface CancellationSignal {
    @Nonnull
    CancellationSignal NEVER = () -> false;

    boolean isCancellationRequested();
}
