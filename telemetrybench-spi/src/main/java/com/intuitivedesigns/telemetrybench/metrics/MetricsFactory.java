/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Picks the {@link MetricsProvider} named by {@code metrics.provider}, or the NOOP runtime.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final MetricsRuntime NOOP = () -> "noop";

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        if (settings.disabled()) {
            log.debug("Metrics disabled (metrics.provider=NONE)");
            return NOOP;
        }

        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = MetricsFactory.class.getClassLoader();

        final List<String> available = new ArrayList<>();
        for (MetricsProvider provider : ServiceLoader.load(MetricsProvider.class, cl)) {
            available.add(provider.id());
            if (provider.id().equalsIgnoreCase(settings.providerId())) {
                final MetricsRuntime runtime = provider.create(settings);
                log.info("Metrics runtime {} active (tags={})", runtime.type(), settings.commonTags());
                return runtime;
            }
        }

        log.warn("Unknown metrics.provider '{}' (available: {}); metrics disabled", settings.providerId(), available);
        return NOOP;
    }

    public static MetricsRuntime noop() {
        return NOOP;
    }
}
