/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.driver;

import com.intuitivedesigns.telemetrybench.errors.BenchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-threaded cooperative driver.
 *
 * <p>All pipeline logic runs on one named thread. Anything that blocks (Kafka client calls) is
 * dispatched elsewhere and awaited with {@link #await(CompletionStage)}, which resumes the
 * continuation back on the driver thread. The driver thread itself never blocks.</p>
 */
public final class CooperativeDriver implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CooperativeDriver.class);

    private final String name;
    private final ExecutorService loop;
    private volatile Thread thread;

    public CooperativeDriver(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.loop = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        loop.execute(task);
    }

    public boolean inDriverThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Runs {@code body} on the driver and blocks the calling (non-driver) thread until the stage it
     * returns completes.
     *
     * @throws BenchException or any other runtime failure of the body, unwrapped
     */
    public <T> T run(Supplier<? extends CompletionStage<T>> body) {
        if (inDriverThread()) {
            throw new IllegalStateException("run() must not be called from the driver thread");
        }
        final CompletableFuture<T> result = CompletableFuture.<CompletionStage<T>>supplyAsync(body::get, loop).thenCompose(s -> s);
        try {
            return result.join();
        } catch (RuntimeException e) {
            final Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new BenchException("Driver task failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * @return a stage that completes on the driver thread with the outcome of {@code stage}
     */
    public <T> CompletableFuture<T> await(CompletionStage<T> stage) {
        final CompletableFuture<T> out = new CompletableFuture<>();
        stage.whenCompleteAsync((value, error) -> {
            if (error != null) {
                out.completeExceptionally(Futures.unwrap(error));
            } else {
                out.complete(value);
            }
        }, this);
        return out;
    }

    /**
     * Non-blocking delay that resumes on the driver thread.
     */
    public CompletableFuture<Void> sleep(Duration delay) {
        final long ms = Math.max(0L, delay.toMillis());
        return CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(ms, TimeUnit.MILLISECONDS, this));
    }

    @Override
    public void close() {
        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Driver {} did not stop within 5s; forcing shutdown", name);
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
    }
}
