/*
 * EvaluationContextBuilder.java
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
import com.apple.foundationdb.formula.services.CancellationSignal;
import com.apple.foundationdb.formula.services.ClockService;
import com.apple.foundationdb.formula.services.RandomService;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.ZoneId;
import java.util.Locale;

/**
 * A builder for {@link EvaluationContext}. Services left unset get defaults when {@link #build()} is called:
 * the system clock, a thread-local random source, the system default time zone, {@link Locale#ROOT},
 * a signal that is never cancelled, {@link EvaluationProperties#DEFAULT} and no symbols.
 *
 * <pre><code>
 * EvaluationContext context = EvaluationContext.newBuilder()
 *         .setTimeZone(ZoneId.of("America/Los_Angeles"))
 *         .setCancellationSignal(source)
 *         .build();
 * </code></pre>
 */
@API(API.Status.STABLE)
public class EvaluationContextBuilder {
    @Nullable
    private ClockService clock;
    @Nullable
    private RandomService random;
    @Nullable
    private ZoneId timeZone;
    @Nullable
    private Locale locale;
    @Nullable
    private CancellationSignal cancellationSignal;
    @Nullable
    private EvaluationProperties properties;
    @Nullable
    private SymbolContext symbols;

    protected EvaluationContextBuilder() {
    }

    protected EvaluationContextBuilder(@Nonnull EvaluationContext original) {
        this.clock = original.getClock();
        this.random = original.getRandom();
        this.timeZone = original.getTimeZone();
        this.locale = original.getLocale();
        this.cancellationSignal = original.getCancellationSignal();
        this.properties = original.getProperties();
        this.symbols = original.getSymbols();
    }

    @Nonnull
    public EvaluationContextBuilder setClock(@Nonnull ClockService clock) {
        this.clock = clock;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setRandom(@Nonnull RandomService random) {
        this.random = random;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setTimeZone(@Nonnull ZoneId timeZone) {
        this.timeZone = timeZone;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setLocale(@Nonnull Locale locale) {
        this.locale = locale;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setCancellationSignal(@Nonnull CancellationSignal cancellationSignal) {
        this.cancellationSignal = cancellationSignal;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setProperties(@Nonnull EvaluationProperties properties) {
        this.properties = properties;
        return this;
    }

    @Nonnull
    public EvaluationContextBuilder setSymbols(@Nonnull SymbolContext symbols) {
        this.symbols = symbols;
        return this;
    }

    /**
     * Construct an {@link EvaluationContext} from the services set on this builder.
     * @return a new context
     */
    @Nonnull
    public EvaluationContext build() {
        return new EvaluationContext(
                clock == null ? ClockService.system() : clock,
                random == null ? RandomService.threadLocal() : random,
                timeZone == null ? ZoneId.systemDefault() : timeZone,
                locale == null ? Locale.ROOT : locale,
                cancellationSignal == null ? CancellationSignal.NEVER : cancellationSignal,
                properties == null ? EvaluationProperties.DEFAULT : properties,
                symbols == null ? SymbolContext.EMPTY : symbols);
    }
}
