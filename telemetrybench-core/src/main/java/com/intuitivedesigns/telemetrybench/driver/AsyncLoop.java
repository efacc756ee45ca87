/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.driver;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Repeats an asynchronous step on an executor until the step answers {@code false} or fails.
 *
 * <p>Each iteration is a fresh task on the executor, so neither the stack nor the chain of
 * completed stages grows with the number of iterations. An unbounded consumer relies on this.</p>
 */
public final class AsyncLoop {

    private final Executor executor;
    private final Supplier<? extends CompletionStage<Boolean>> step;
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private AsyncLoop(Executor executor, Supplier<? extends CompletionStage<Boolean>> step) {
        this.executor = executor;
        this.step = step;
    }

    /**
     * @param step returns {@code true} to run another iteration
     * @return completes when the step answers {@code false}; fails with the first step failure
     */
    public static CompletableFuture<Void> whileTrue(Executor executor, Supplier<? extends CompletionStage<Boolean>> step) {
        final AsyncLoop loop = new AsyncLoop(Objects.requireNonNull(executor, "executor"), Objects.requireNonNull(step, "step"));
        executor.execute(loop::iterate);
        return loop.done;
    }

    private void iterate() {
        final CompletionStage<Boolean> stage;
        try {
            stage = step.get();
        } catch (RuntimeException | Error e) {
            done.completeExceptionally(e);
            return;
        }
        stage.whenCompleteAsync((again, error) -> {
            if (error != null) {
                done.completeExceptionally(Futures.unwrap(error));
            } else if (Boolean.TRUE.equals(again)) {
                iterate();
            } else {
                done.complete(null);
            }
        }, executor);
    }
}
