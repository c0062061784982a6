/*
 * RandomizedTestUtils.java
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

package com.apple.test;

import javax.annotation.Nonnull;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Seeds for randomized tests. The fixed seeds always run; setting {@code tests.includeRandom=true} adds
 * {@code tests.iterations} fresh seeds, which show up in the test display name so a failure can be replayed.
 */
public final class RandomizedTestUtils {
    private static final long FIXED_SEED = 0xf17ed5eedL;

    private RandomizedTestUtils() {
    }

    /**
     * Seeds for a {@link org.junit.jupiter.params.ParameterizedTest} method source.
     * @param staticSeeds seeds that always run; {@value FIXED_SEED} if none are given
     * @return a stream of seeds
     */
    @Nonnull
    public static Stream<Long> randomSeeds(long... staticSeeds) {
        LongStream seeds = staticSeeds.length == 0 ? LongStream.of(FIXED_SEED) : LongStream.of(staticSeeds);
        if (includeRandomTests()) {
            final Random random = ThreadLocalRandom.current();
            seeds = LongStream.concat(seeds, LongStream.generate(random::nextLong).limit(getIterations()));
        }
        return seeds.boxed();
    }

    private static int getIterations() {
        return Integer.parseInt(System.getProperty("tests.iterations", "0"));
    }

    private static boolean includeRandomTests() {
        return Boolean.parseBoolean(System.getProperty("tests.includeRandom", "false"));
    }
}
