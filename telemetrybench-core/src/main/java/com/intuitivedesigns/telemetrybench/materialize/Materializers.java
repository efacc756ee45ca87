/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.core.Materializer;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.spi.MaterializerPlugin;
import com.intuitivedesigns.telemetrybench.spi.PluginIds;
import com.intuitivedesigns.telemetrybench.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@link Materializer}s by plugin id, creating each at most once.
 */
public final class Materializers {

    private static final Logger log = LoggerFactory.getLogger(Materializers.class);

    private final ServicePluginRegistry<MaterializerPlugin> registry;
    private final BenchConfig config;
    private final MetricsRuntime metrics;
    private final Map<String, Materializer> created = new ConcurrentHashMap<>();

    public Materializers(ServicePluginRegistry<MaterializerPlugin> registry, BenchConfig config, MetricsRuntime metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static Materializers load(BenchConfig config, MetricsRuntime metrics) {
        return new Materializers(new ServicePluginRegistry<>(MaterializerPlugin.class), config, metrics);
    }

    public Materializer require(String id) {
        return created.computeIfAbsent(PluginIds.normalize(id), key -> {
            final MaterializerPlugin plugin = registry.require(key, "materializer");
            final Materializer m = plugin.create(config, metrics);
            if (m == null) {
                throw new ConfigurationException("Materializer plugin " + key + " returned null");
            }
            log.debug("Materializer {} ready ({})", key, plugin.getClass().getName());
            return m;
        });
    }
}
