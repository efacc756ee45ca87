/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testCountersTimersSummariesAndGauges() {
        MetricsSettings settings = MetricsSettings.from(BenchConfig.of(Map.of(
                "metrics.provider", "micrometer",
                "metrics.tag.run", "unit")));

        try (MicrometerMetricsRuntime runtime = MicrometerMetricsRuntime.fromSettings(settings)) {
            runtime.counter("bench.messages.published");
            runtime.counter("bench.messages.published");
            runtime.timer("bench.publish.ack.latency", Duration.ofMillis(12));
            runtime.summary("bench.delay.seconds", 0.25);
            runtime.summary("bench.delay.seconds", 0.75);
            runtime.gauge("bench.rate", 10.0);
            runtime.gauge("bench.rate", 42.5);

            MeterRegistry registry = (MeterRegistry) runtime.registry();
            assertEquals(2.0, registry.get("bench.messages.published").tag("run", "unit").counter().count());
            assertEquals(1L, registry.get("bench.publish.ack.latency").timer().count());
            DistributionSummary delays = registry.get("bench.delay.seconds").summary();
            assertEquals(2L, delays.count());
            assertEquals(0.5, delays.mean(), 1e-9);
            assertEquals(42.5, registry.get("bench.rate").gauge().value());
            assertTrue(runtime.enabled());
            assertEquals("MICROMETER", runtime.type());
        }
    }

    @Test
    void testSettingsNormalizeProviderAndCollectTags() {
        MetricsSettings settings = MetricsSettings.from(BenchConfig.of(Map.of(
                "metrics.provider", " micrometer ",
                "metrics.tag.component", "Test",
                "metrics.tag.", "ignored")));

        assertEquals("MICROMETER", settings.providerId());
        assertEquals(Map.of("component", "Test"), settings.commonTags());
        assertTrue(MetricsSettings.from(BenchConfig.of(Map.of())).disabled());
    }

    @Test
    void testFactorySelectsConfiguredProvider() {
        MetricsRuntime selected = MetricsFactory.init(MetricsSettings.from(
                BenchConfig.of(Map.of("metrics.provider", "MICROMETER"))));
        try {
            assertEquals("MICROMETER", selected.type());
        } finally {
            selected.close();
        }
    }

    @Test
    void testFactoryFallsBackToNoop() {
        MetricsRuntime none = MetricsFactory.init(MetricsSettings.from(BenchConfig.of(Map.of())));
        MetricsRuntime unknown = MetricsFactory.init(MetricsSettings.from(
                BenchConfig.of(Map.of("metrics.provider", "statsd"))));

        assertSame(MetricsFactory.noop(), none);
        assertSame(MetricsFactory.noop(), unknown);
        assertFalse(none.enabled());
        assertDoesNotThrow(() -> none.summary("anything", 1.0));
    }
}
