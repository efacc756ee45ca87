/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer runtime over an in-process {@link SimpleMeterRegistry}. Meters are readable at the end
 * of a run and are summarised in the log on {@link #close()}.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;

    // Gauge values are stored as raw double bits
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    MicrometerMetricsRuntime(MeterRegistry registry) {
        this.registry = registry;
    }

    public static MicrometerMetricsRuntime fromSettings(MetricsSettings settings) {
        final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> e : settings.commonTags().entrySet()) {
            tags = tags.and(e.getKey(), e.getValue());
        }
        registry.config().commonTags(tags);
        return new MicrometerMetricsRuntime(registry);
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return MicrometerMetricsProvider.ID;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void timer(String name, Duration elapsed) {
        registry.timer(name).record(elapsed);
    }

    @Override
    public void summary(String name, double value) {
        DistributionSummary.builder(name).register(registry).record(value);
    }

    @Override
    public void gauge(String name, double value) {
        gauges.computeIfAbsent(name, key -> {
            final AtomicLong bits = new AtomicLong();
            Gauge.builder(key, bits, b -> Double.longBitsToDouble(b.get())).register(registry);
            return bits;
        }).set(Double.doubleToLongBits(value));
    }

    @Override
    public void close() {
        registry.getMeters().forEach(m -> log.info("{} {}", m.getId().getName(), m.measure()));
        registry.close();
    }
}
