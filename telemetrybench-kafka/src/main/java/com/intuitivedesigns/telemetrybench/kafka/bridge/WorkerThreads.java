/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

final class WorkerThreads {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreads.class);

    private WorkerThreads() {}

    /** Pool of exactly one daemon thread; the client it serves is only ever touched from it. */
    static ExecutorService single(String name) {
        return Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    static void closeClient(Runnable close, String name) {
        try {
            close.run();
        } catch (RuntimeException e) {
            log.warn("Error closing Kafka client of {}: {}", name, e.toString());
        }
    }

    static void stop(ExecutorService worker, String name) {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker {} did not stop within 10s; forcing shutdown", name);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
