/*
 * RandomService.java
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
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of random numbers for {@code Rand} and {@code RandBetween}. Implementations must return values in
 * {@code [0, 1)} and be safe to call from several threads; a value outside that range is a contract
 * violation that fails the evaluation.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface RandomService {
    double nextDouble();

    @Nonnull
    static RandomService threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /**
     * A reproducible source, for tests and replays. {@link Random} is thread safe.
     * @param seed the seed
     * @return a seeded random service
     */
    @Nonnull
    static RandomService seeded(long seed) {
        final Random random = new Random(seed);
        return random::nextDouble;
    }
}
