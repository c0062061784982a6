/*
 * MoreAsyncUtil.java
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

import com.apple.foundationdb.formula.annotation.API;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * More helpers for {@link CompletableFuture}s used when fanning out row evaluations.
 */
@API(API.Status.UNSTABLE)
public class MoreAsyncUtil {
    @Nonnull
    private static final ScheduledThreadPoolExecutor scheduledThreadPoolExecutor = new ScheduledThreadPoolExecutor(1,
            new ThreadFactoryBuilder().setNameFormat("fdb-formula-delay-%d").setDaemon(true).build());

    static {
        scheduledThreadPoolExecutor.setRemoveOnCancelPolicy(true);
    }

    private MoreAsyncUtil() {
    }

    /**
     * Returns whether the given {@link CompletableFuture} has completed normally, i.e., not exceptionally.
     * If the future is yet to complete or if the future completed with an error, then this
     * will return <code>false</code>.
     * @param future the future to check for normal completion
     * @return whether the future has completed without exception
     */
    @API(API.Status.MAINTAINED)
    public static boolean isCompletedNormally(@Nonnull CompletableFuture<?> future) {
        return future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Creates a future that will be ready after the given delay. A single daemon thread fires all delayed
     * futures, so it is safe to create many of them at once. The future is never ready sooner than the delay,
     * but it may fire later.
     *
     * @param delay the time from now to delay execution
     * @param unit the time unit of the delay parameter
     * @return a {@link CompletableFuture} that will fire after the given delay
     */
    @Nonnull
    public static CompletableFuture<Void> delayedFuture(long delay, @Nonnull TimeUnit unit) {
        if (delay <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduledThreadPoolExecutor.schedule(() -> future.complete(null), delay, unit);
        return future;
    }

    /**
     * Apply an asynchronous function to every item of a list, keeping at most {@code pipelineSize} applications
     * in flight at once. Items may complete in any order; the returned list is always in the order of
     * {@code items}. If any application fails, the returned future fails with that exception as soon as it
     * is observed and no further applications are started.
     *
     * @param items the inputs
     * @param func the asynchronous function to apply
     * @param pipelineSize the maximum number of outstanding applications
     * @param <T> the input type
     * @param <R> the result type
     * @return a future with one result per input, in input order
     */
    @Nonnull
    public static <T, R> CompletableFuture<List<R>> mapPipelined(@Nonnull List<T> items,
                                                                @Nonnull Function<? super T, ? extends CompletableFuture<R>> func,
                                                                int pipelineSize) {
        Preconditions.checkArgument(pipelineSize > 0, "pipeline size must be positive");
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        final PipelinedMapper<T, R> mapper = new PipelinedMapper<>(items, func);
        final int initial = Math.min(pipelineSize, items.size());
        for (int i = 0; i < initial; i++) {
            mapper.startNext();
        }
        return mapper.result;
    }

    /**
     * Run an asynchronous loop body until it returns {@code false}. Bodies that complete synchronously are
     * iterated without growing the stack.
     *
     * @param body the loop body, returning whether to continue
     * @return a future that completes when the loop ends, or exceptionally if the body fails
     */
    @Nonnull
    public static CompletableFuture<Void> whileTrue(@Nonnull Supplier<? extends CompletableFuture<Boolean>> body) {
        final LoopRunner runner = new LoopRunner(body);
        runner.run();
        return runner.done;
    }

    /**
     * Strip the {@link CompletionException} and {@link ExecutionException} wrappers that asynchronous
     * composition adds around the exception actually thrown.
     *
     * @param throwable the exception observed by a completion handler
     * @return the underlying exception
     */
    @Nonnull
    public static Throwable unwrapCompletionException(@Nonnull Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class PipelinedMapper<T, R> {
        @Nonnull
        private final List<T> items;
        @Nonnull
        private final Function<? super T, ? extends CompletableFuture<R>> func;
        @Nonnull
        private final AtomicReferenceArray<R> results;
        @Nonnull
        private final AtomicInteger nextIndex = new AtomicInteger();
        @Nonnull
        private final AtomicInteger remaining;
        @Nonnull
        private final CompletableFuture<List<R>> result = new CompletableFuture<>();

        private PipelinedMapper(@Nonnull List<T> items, @Nonnull Function<? super T, ? extends CompletableFuture<R>> func) {
            this.items = items;
            this.func = func;
            this.results = new AtomicReferenceArray<>(items.size());
            this.remaining = new AtomicInteger(items.size());
        }

        private void startNext() {
            while (!result.isDone()) {
                final int index = nextIndex.getAndIncrement();
                if (index >= items.size()) {
                    return;
                }
                final CompletableFuture<R> future;
                try {
                    future = func.apply(items.get(index));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                    return;
                }
                if (isCompletedNormally(future)) {
                    record(index, future.join());
                    continue;
                }
                future.whenComplete((value, err) -> {
                    if (err != null) {
                        result.completeExceptionally(unwrapCompletionException(err));
                    } else {
                        record(index, value);
                        startNext();
                    }
                });
                return;
            }
        }

        private void record(int index, @Nullable R value) {
            results.set(index, value);
            if (remaining.decrementAndGet() == 0) {
                final List<R> ordered = new ArrayList<>(results.length());
                for (int i = 0; i < results.length(); i++) {
                    ordered.add(results.get(i));
                }
                result.complete(ordered);
            }
        }
    }

    private static final class LoopRunner implements BiConsumer<Boolean, Throwable> {
        @Nonnull
        private final Supplier<? extends CompletableFuture<Boolean>> body;
        @Nonnull
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        private LoopRunner(@Nonnull Supplier<? extends CompletableFuture<Boolean>> body) {
            this.body = body;
        }

        private void run() {
            while (true) {
                final CompletableFuture<Boolean> next;
                try {
                    next = body.get();
                } catch (RuntimeException e) {
                    done.completeExceptionally(e);
                    return;
                }
                if (!isCompletedNormally(next)) {
                    next.whenComplete(this);
                    return;
                }
                if (!Boolean.TRUE.equals(next.join())) {
                    done.complete(null);
                    return;
                }
            }
        }

        @Override
        public void accept(@Nullable Boolean again, @Nullable Throwable err) {
            if (err != null) {
                done.completeExceptionally(unwrapCompletionException(err));
            } else if (Boolean.TRUE.equals(again)) {
                run();
            } else {
                done.complete(null);
            }
        }
    }
}
