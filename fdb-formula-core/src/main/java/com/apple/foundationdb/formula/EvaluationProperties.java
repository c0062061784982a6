/*
 * EvaluationProperties.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;

/**
 * Tunables of an evaluation.
 */
@API(API.Status.UNSTABLE)
public final class EvaluationProperties {
    public static final int DEFAULT_ROW_PIPELINE_SIZE = 10;

    @Nonnull
    public static final EvaluationProperties DEFAULT = newBuilder().build();

    private final int rowPipelineSize;
    private final boolean checkRandomContract;

    private EvaluationProperties(int rowPipelineSize, boolean checkRandomContract) {
        this.rowPipelineSize = rowPipelineSize;
        this.checkRandomContract = checkRandomContract;
    }

    /**
     * Maximum number of row lambdas one table operator keeps in flight at once.
     * @return the pipeline size
     */
    public int getRowPipelineSize() {
        return rowPipelineSize;
    }

    /**
     * Whether values from the random service are checked to lie in {@code [0, 1)}.
     * @return whether the random contract is checked
     */
    public boolean isCheckRandomContract() {
        return checkRandomContract;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder().setRowPipelineSize(rowPipelineSize).setCheckRandomContract(checkRandomContract);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EvaluationProperties{rowPipelineSize=" + rowPipelineSize + ", checkRandomContract=" + checkRandomContract + "}";
    }

    /**
     * A builder for {@link EvaluationProperties}.
     */
    public static class Builder {
        private int rowPipelineSize = DEFAULT_ROW_PIPELINE_SIZE;
        private boolean checkRandomContract = true;

        private Builder() {
        }

        @Nonnull
        public Builder setRowPipelineSize(int rowPipelineSize) {
            Preconditions.checkArgument(rowPipelineSize > 0, "row pipeline size must be positive");
            this.rowPipelineSize = rowPipelineSize;
            return this;
        }

        @Nonnull
        public Builder setCheckRandomContract(boolean checkRandomContract) {
            this.checkRandomContract = checkRandomContract;
            return this;
        }

        @Nonnull
        public EvaluationProperties build() {
            return new EvaluationProperties(rowPipelineSize, checkRandomContract);
        }
    }
}
