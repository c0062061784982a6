/*
 * ErrorKind.java
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

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of {@link ExpressionError}. The numeric codes are part of the contract with hosts and must not change.
 */
@API(API.Status.STABLE)
public enum ErrorKind {
    NONE(0),
    SYNC(1),
    MISSING_REQUIRED(2),
    CREATE_PERMISSION(3),
    EDIT_PERMISSION(4),
    DELETE_PERMISSION(5),
    CONFLICT(6),
    NOT_FOUND(7),
    CONSTRAINT_VIOLATED(8),
    GENERATED_VALUE(9),
    READ_ONLY_VALUE(10),
    VALIDATION(11),
    UNKNOWN(12),
    DIV0(13),
    BAD_LANGUAGE_CODE(14),
    BAD_REGEX(15),
    INVALID_FUNCTION_USAGE(16),
    FILE_NOT_FOUND(17),
    ANALYSIS_ERROR(18),
    READ_PERMISSION(19),
    NOT_SUPPORTED(20),
    INSUFFICIENT_MEMORY(21),
    QUOTA_EXCEEDED(22),
    NETWORK(23),
    NUMERIC(24),
    INVALID_ARGUMENT(25),
    INTERNAL(26),
    NOT_APPLICABLE(27),
    TIMEOUT(28),
    SERVICE_UNAVAILABLE(29),
    INVALID_JSON(30),
    CUSTOM(1000);

    private static final Map<Integer, ErrorKind> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(ErrorKind::getCode, Function.identity()));

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Find the kind with the given code. Codes at or above {@link #CUSTOM} that are not otherwise assigned are
     * user-raised errors and map to {@link #CUSTOM}.
     *
     * @param code the numeric code
     * @return the matching kind
     * @throws IllegalArgumentException if no kind has that code
     */
    @Nonnull
    public static ErrorKind fromCode(int code) {
        final ErrorKind kind = BY_CODE.get(code);
        if (kind != null) {
            return kind;
        }
        if (code > CUSTOM.code) {
            return CUSTOM;
        }
        throw new IllegalArgumentException("unknown error kind code " + code);
    }
}
