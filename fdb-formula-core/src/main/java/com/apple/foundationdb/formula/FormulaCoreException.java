/*
 * FormulaCoreException.java
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

package com.apple.foundationdb.formula;

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base for hard failures of the formula evaluator. Problems with the data being evaluated are never reported
 * this way; they are {@link com.apple.foundationdb.formula.values.ErrorValue}s. Exceptions are reserved for
 * broken contracts between the evaluator and its host or callers.
 */
@API(API.Status.STABLE)
public class FormulaCoreException extends LoggableException {
    private static final long serialVersionUID = 1;

    public FormulaCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public FormulaCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public FormulaCoreException(@Nonnull String msg) {
        super(msg);
    }
}
