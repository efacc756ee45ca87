/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.driver;

import com.intuitivedesigns.telemetrybench.errors.MessageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncLoopTest {

    private final CooperativeDriver driver = new CooperativeDriver("loop-driver");

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void testManyIterationsDoNotGrowTheStack() {
        AtomicInteger n = new AtomicInteger();

        // Completed stages on every step: a naive recursive chain would overflow here
        AsyncLoop.whileTrue(driver, () -> CompletableFuture.completedFuture(n.incrementAndGet() < 200_000))
                .orTimeout(30, TimeUnit.SECONDS)
                .join();

        assertEquals(200_000, n.get());
    }

    @Test
    void testStepsRunOnTheExecutor() {
        AtomicInteger offThread = new AtomicInteger();
        AtomicInteger n = new AtomicInteger();

        AsyncLoop.whileTrue(driver, () -> {
            if (!driver.inDriverThread()) offThread.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> n.incrementAndGet() < 10);
        }).join();

        assertEquals(10, n.get());
        assertEquals(0, offThread.get());
    }

    @Test
    void testFirstFailureStopsTheLoop() {
        AtomicInteger n = new AtomicInteger();

        CompletionException e = assertThrows(CompletionException.class, () -> AsyncLoop.whileTrue(driver, () -> {
            if (n.incrementAndGet() == 3) {
                return Futures.failed(new MessageException("bad message"));
            }
            return CompletableFuture.completedFuture(true);
        }).join());

        assertInstanceOf(MessageException.class, e.getCause());
        assertEquals(3, n.get());
    }

    @Test
    void testSynchronousThrowIsReported() {
        CompletableFuture<Void> done = AsyncLoop.whileTrue(driver, () -> {
            throw new IllegalStateException("read already pending");
        });

        CompletionException e = assertThrows(CompletionException.class, done::join);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
