/*
 * EvaluationContext.java
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
import com.apple.foundationdb.formula.logging.KeyValueLogMessage;
import com.apple.foundationdb.formula.logging.LogMessageKeys;
import com.apple.foundationdb.formula.services.CancellationSignal;
import com.apple.foundationdb.formula.services.ClockService;
import com.apple.foundationdb.formula.services.RandomService;
import com.apple.foundationdb.formula.values.RecordValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;

/**
 * A context for formula evaluation. It pairs the services a host supplies for one top-level evaluation (clock,
 * random source, time zone, culture, cancellation signal, {@link EvaluationProperties}) with the
 * {@link SymbolContext} of the current row scope.
 *
 * <p>
 * Contexts are immutable. {@link #withScopeValues(RecordValue)} returns a new context for a lambda body and
 * leaves this one untouched, so concurrent row evaluations never share mutable state.
 * </p>
 */
@API(API.Status.STABLE)
public class EvaluationContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationContext.class);

    @Nonnull
    private final ClockService clock;
    @Nonnull
    private final RandomService random;
    @Nonnull
    private final ZoneId timeZone;
    @Nonnull
    private final Locale locale;
    @Nonnull
    private final CancellationSignal cancellationSignal;
    @Nonnull
    private final EvaluationProperties properties;
    @Nonnull
    private final SymbolContext symbols;

    EvaluationContext(@Nonnull ClockService clock,
                      @Nonnull RandomService random,
                      @Nonnull ZoneId timeZone,
                      @Nonnull Locale locale,
                      @Nonnull CancellationSignal cancellationSignal,
                      @Nonnull EvaluationProperties properties,
                      @Nonnull SymbolContext symbols) {
        this.clock = clock;
        this.random = random;
        this.timeZone = timeZone;
        this.locale = locale;
        this.cancellationSignal = cancellationSignal;
        this.properties = properties;
        this.symbols = symbols;
    }

    /**
     * Create a context with default services and no symbols.
     * @return a new context
     */
    @Nonnull
    public static EvaluationContext empty() {
        return newBuilder().build();
    }

    @Nonnull
    public static EvaluationContextBuilder newBuilder() {
        return new EvaluationContextBuilder();
    }

    /**
     * Construct a builder from this context. This allows the caller to create a new context that differs from
     * this one in a few services while sharing the rest.
     *
     * @return a builder starting from this context
     */
    @Nonnull
    public EvaluationContextBuilder childBuilder() {
        return new EvaluationContextBuilder(this);
    }

    /**
     * Create a context for a lambda body, with the fields of {@code rowScope} in scope.
     * @param rowScope the row whose fields are brought into scope
     * @return a new context sharing this context's services
     */
    @Nonnull
    public EvaluationContext withScopeValues(@Nonnull RecordValue rowScope) {
        return new EvaluationContext(clock, random, timeZone, locale, cancellationSignal, properties,
                symbols.withScopeValues(rowScope));
    }

    @Nonnull
    public SymbolContext getSymbols() {
        return symbols;
    }

    @Nonnull
    public ZoneId getTimeZone() {
        return timeZone;
    }

    @Nonnull
    public Locale getLocale() {
        return locale;
    }

    @Nonnull
    public EvaluationProperties getProperties() {
        return properties;
    }

    @Nonnull
    public ClockService getClock() {
        return clock;
    }

    @Nonnull
    public RandomService getRandom() {
        return random;
    }

    @Nonnull
    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    @Nonnull
    public Instant utcNow() {
        return clock.utcNow();
    }

    /**
     * Draw from the random service, checking that the value lies in {@code [0, 1)}.
     * @return a random value in {@code [0, 1)}
     * @throws FormulaInternalException if the random service returned a value outside the range
     */
    public double nextRandom() {
        final double value = random.nextDouble();
        if (properties.isCheckRandomContract() && !(value >= 0.0 && value < 1.0)) {
            LOGGER.error(KeyValueLogMessage.of("random service returned value out of range",
                    LogMessageKeys.SERVICE, random.getClass().getName(),
                    LogMessageKeys.ACTUAL, value,
                    LogMessageKeys.EXPECTED, "[0, 1)"));
            throw new FormulaInternalException("random service returned value out of range",
                    LogMessageKeys.ACTUAL, value);
        }
        return value;
    }

    public boolean isCancellationRequested() {
        return cancellationSignal.isCancellationRequested();
    }

    /**
     * Poll the cancellation signal.
     * @throws EvaluationCancelledException if the host requested cancellation
     */
    public void checkCancel() {
        if (cancellationSignal.isCancellationRequested()) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("formula evaluation cancelled",
                        LogMessageKeys.DESCRIPTION, "scope depth " + symbols.getDepth()));
            }
            throw new EvaluationCancelledException("formula evaluation cancelled");
        }
    }
}
