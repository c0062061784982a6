/*
 * MoreAsyncUtilTest.java
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

package com.apple.foundationdb.formula.async;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MoreAsyncUtil}.
 */
public class MoreAsyncUtilTest {

    @Test
    public void completedNormally() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        assertFalse(MoreAsyncUtil.isCompletedNormally(future));
        future.complete(null);
        assertTrue(MoreAsyncUtil.isCompletedNormally(future));
        future = new CompletableFuture<>();
        future.completeExceptionally(new RuntimeException("FATAL ERROR"));
        assertFalse(MoreAsyncUtil.isCompletedNormally(future));
    }

    @Test
    public void delaySimple() {
        long start = System.currentTimeMillis();
        MoreAsyncUtil.delayedFuture(30, TimeUnit.MILLISECONDS).join();
        long end = System.currentTimeMillis();
        assertTrue(end - start >= 30, "Delay was not long enough");
    }

    @ParameterizedTest(name = "mapPipelinedKeepsOrder[pipelineSize={0}]")
    @ValueSource(ints = {1, 3, 50})
    public void mapPipelinedKeepsOrder(int pipelineSize) {
        final Random random = new Random(0x5eed + pipelineSize);
        final List<Integer> items = IntStream.range(0, 40).boxed().collect(Collectors.toList());
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final List<Integer> squares = MoreAsyncUtil.mapPipelined(items, i -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return MoreAsyncUtil.delayedFuture(random.nextInt(5), TimeUnit.MILLISECONDS)
                    .thenApply(vignore -> {
                        inFlight.decrementAndGet();
                        return i * i;
                    });
        }, pipelineSize).join();
        assertThat(squares, equalTo(items.stream().map(i -> i * i).collect(Collectors.toList())));
        assertThat(maxInFlight.get(), lessThanOrEqualTo(pipelineSize));
    }

    @Test
    public void mapPipelinedSynchronousResults() {
        final List<Integer> items = IntStream.range(0, 10_000).boxed().collect(Collectors.toList());
        final List<Integer> same = MoreAsyncUtil.mapPipelined(items, CompletableFuture::completedFuture, 2).join();
        assertEquals(items, same);
    }

    @Test
    public void mapPipelinedEmpty() {
        assertEquals(Collections.emptyList(),
                MoreAsyncUtil.mapPipelined(Collections.<Integer>emptyList(), CompletableFuture::completedFuture, 4).join());
    }

    @Test
    public void mapPipelinedFailsFast() {
        final List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        final CompletableFuture<List<Integer>> result = MoreAsyncUtil.mapPipelined(List.of(0, 1, 2, 3, 4, 5), i -> {
            started.add(i);
            if (i == 1) {
                CompletableFuture<Integer> failed = new CompletableFuture<>();
                failed.completeExceptionally(new IllegalStateException("row " + i));
                return failed;
            }
            return CompletableFuture.completedFuture(i);
        }, 1);
        CompletionException err = assertThrows(CompletionException.class, result::join);
        assertThat(err.getCause(), instanceOf(IllegalStateException.class));
        assertEquals(List.of(0, 1), started);
    }

    @Test
    public void whileTrueCountsDown() {
        final AtomicInteger count = new AtomicInteger(100_000);
        MoreAsyncUtil.whileTrue(() -> CompletableFuture.completedFuture(count.decrementAndGet() > 0)).join();
        assertEquals(0, count.get());
    }

    @Test
    public void whileTrueAsynchronousBody() {
        final AtomicInteger count = new AtomicInteger(20);
        MoreAsyncUtil.whileTrue(() -> MoreAsyncUtil.delayedFuture(1, TimeUnit.MILLISECONDS)
                .thenApply(vignore -> count.decrementAndGet() > 0)).join();
        assertEquals(0, count.get());
    }

    @Test
    public void whileTrueFailure() {
        final CompletableFuture<Void> loop = MoreAsyncUtil.whileTrue(() -> {
            throw new IllegalArgumentException("bad body");
        });
        CompletionException err = assertThrows(CompletionException.class, loop::join);
        assertThat(err.getCause(), instanceOf(IllegalArgumentException.class));
    }

    @Test
    public void unwrap() {
        final IllegalStateException root = new IllegalStateException("root");
        assertThat(MoreAsyncUtil.unwrapCompletionException(new CompletionException(new CompletionException(root))),
                equalTo(root));
        assertThat(MoreAsyncUtil.unwrapCompletionException(root), equalTo(root));
    }
}
