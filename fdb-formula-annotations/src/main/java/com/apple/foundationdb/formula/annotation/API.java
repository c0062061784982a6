/*
 * API.java
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

package com.apple.foundationdb.formula.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability of a public type, field or method of the formula evaluator for embedding hosts.
 *
 * <p>
 * Members inherit the status of their enclosing type unless annotated explicitly. A status may be raised
 * (made more stable) at any time, but must not be lowered before the release named by the current status.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Possible stability statuses, in increasing order of stability.
     */
    enum Status {
        /**
         * Public only so that other packages of the evaluator can reach it. Hosts should not call it; it may change
         * in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May disappear in the next minor release.
         */
        DEPRECATED,

        /**
         * A feature under development. May change or be removed without notice.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Hosts may rely on it; incompatible changes are announced one minor release in advance.
         */
        MAINTAINED,

        /**
         * Shall not change incompatibly or be removed until the next major release.
         */
        STABLE
    }
}
