/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

public final class MicrometerMetricsProvider implements MetricsProvider {

    public static final String ID = "MICROMETER";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        return MicrometerMetricsRuntime.fromSettings(settings);
    }
}
