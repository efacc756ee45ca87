/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

/**
 * A metrics backend discovered through {@link java.util.ServiceLoader}.
 */
public interface MetricsProvider {

    /** Matched case-insensitively against {@code metrics.provider}. */
    String id();

    MetricsRuntime create(MetricsSettings settings);
}
