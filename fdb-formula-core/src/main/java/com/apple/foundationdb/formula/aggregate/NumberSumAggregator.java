/*
 * NumberSumAggregator.java
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

package com.apple.foundationdb.formula.aggregate;

import com.apple.foundationdb.formula.annotation.API;
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.values.CommonErrors;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumberValue;
import com.apple.foundationdb.formula.values.NumericConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Sum or average of floating point numbers. A sum that becomes infinite is an overflow.
 */
@API(API.Status.INTERNAL)
class NumberSumAggregator extends AbstractAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(NumberSumAggregator.class);

    private double sum;

    NumberSumAggregator(@Nonnull AggregateFunction function) {
        super(function);
    }

    @Override
    protected boolean accumulate(@Nonnull FormulaValue value) {
        if (!NumericConversions.isNumeric(value)) {
            return false;
        }
        sum += NumericConversions.toDouble(value);
        return true;
    }

    @Nonnull
    @Override
    protected FormulaValue finish(@Nonnull IRContext irContext, long count) {
        if (!Double.isFinite(sum)) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("aggregate overflowed",
                        LogMessageKeys.AGGREGATE, getFunction().getFunctionName(),
                        LogMessageKeys.VALUE_COUNT, count));
            }
            return CommonErrors.overflow(irContext);
        }
        final double result = getFunction() == AggregateFunction.AVERAGE ? sum / count : sum;
        return new NumberValue(irContext, result);
    }
}
