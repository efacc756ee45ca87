/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

import java.time.Duration;

/**
 * What the benchmark records about itself: message counts, ack and registry latencies, and the
 * distribution of end-to-end delays.
 *
 * <p>Every method has a no-op default, so a run without a metrics backend behaves identically.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /** The backing registry (a Micrometer {@code MeterRegistry} for the Micrometer runtime). */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void timer(String name, Duration elapsed) {}

    /** One observation of a value distribution, e.g. a delay in seconds. */
    default void summary(String name, double value) {}

    /** Last-value gauge, e.g. the final write or read rate. */
    default void gauge(String name, double value) {}

    @Override
    default void close() {}
}
