/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.driver;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CooperativeDriverTest {

    private final CooperativeDriver driver = new CooperativeDriver("test-driver");
    private final ExecutorService worker = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        driver.close();
        worker.shutdownNow();
    }

    @Test
    void testRunReturnsBodyResult() {
        String name = driver.run(() -> CompletableFuture.completedFuture(Thread.currentThread().getName()));

        assertEquals("test-driver", name);
    }

    @Test
    void testAwaitResumesOnDriverThread() {
        AtomicReference<String> resumedOn = new AtomicReference<>();

        int value = driver.run(() -> driver.await(CompletableFuture.supplyAsync(() -> 21, worker))
                .thenApply(v -> {
                    resumedOn.set(Thread.currentThread().getName());
                    return v * 2;
                }));

        assertEquals(42, value);
        assertEquals("test-driver", resumedOn.get());
    }

    @Test
    void testFailuresAreRethrownUnwrapped() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> driver.run(() ->
                driver.await(CompletableFuture.supplyAsync(() -> {
                    throw new ConfigurationException("boom");
                }, worker))));

        assertEquals("boom", e.getMessage());
    }

    @Test
    void testBodyThrowingSynchronouslyIsRethrown() {
        assertThrows(IllegalArgumentException.class, () -> driver.<Void>run(() -> {
            throw new IllegalArgumentException("sync");
        }));
    }

    @Test
    void testSleepDoesNotBlockDriver() {
        AtomicInteger ranDuringSleep = new AtomicInteger();

        driver.run(() -> {
            CompletableFuture<Void> sleeping = driver.sleep(Duration.ofMillis(100));
            driver.execute(ranDuringSleep::incrementAndGet);
            return sleeping.thenRun(() -> assertTrue(driver.inDriverThread()));
        });

        assertEquals(1, ranDuringSleep.get());
    }

    @Test
    void testRunFromDriverThreadIsRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> driver.run(() ->
                CompletableFuture.completedFuture(driver.run(() -> CompletableFuture.completedFuture(1)))));

        assertTrue(e.getMessage().contains("driver thread"));
    }
}
