/*
 * DecimalSumAggregator.java
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
import com.apple.foundationdb.formula.values.DecimalValue;
import com.apple.foundationdb.formula.values.FormulaValue;
import com.apple.foundationdb.formula.values.IRContext;
import com.apple.foundationdb.formula.values.NumericConversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.math.BigDecimal;

/**
 * Sum or average of decimals. The running sum must stay within the decimal range; once it leaves it the
 * aggregate is an overflow, even if later values would bring it back.
 */
@API(API.Status.INTERNAL)
class DecimalSumAggregator extends AbstractAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DecimalSumAggregator.class);

    @Nonnull
    private BigDecimal sum = BigDecimal.ZERO;
    private boolean overflowed;

    DecimalSumAggregator(@Nonnull AggregateFunction function) {
        super(function);
    }

    @Override
    protected boolean accumulate(@Nonnull FormulaValue value) {
        if (!NumericConversions.isNumeric(value)) {
            return false;
        }
        if (overflowed) {
            return true;
        }
        final BigDecimal next = NumericConversions.toBigDecimal(value);
        if (next == null) {
            overflowed = true;
            return true;
        }
        sum = sum.add(next, DecimalValue.MATH_CONTEXT);
        if (!DecimalValue.isInRange(sum)) {
            overflowed = true;
        }
        return true;
    }

    @Nonnull
    @Override
    protected FormulaValue finish(@Nonnull IRContext irContext, long count) {
        if (overflowed) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("aggregate overflowed",
                        LogMessageKeys.AGGREGATE, getFunction().getFunctionName(),
                        LogMessageKeys.RESULT_TYPE, irContext.getResultType()));
            }
            return CommonErrors.overflow(irContext);
        }
        if (getFunction() == AggregateFunction.AVERAGE) {
            return NumericConversions.decimal(irContext, sum.divide(BigDecimal.valueOf(count), DecimalValue.MATH_CONTEXT));
        }
        return NumericConversions.decimal(irContext, sum);
    }
}
