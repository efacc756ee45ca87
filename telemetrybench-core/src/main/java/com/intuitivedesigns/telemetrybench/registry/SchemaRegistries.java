/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public final class SchemaRegistries {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistries.class);

    public static final String CFG_URL = "schema.registry.url";
    public static final String CFG_TIMEOUT_MS = "registry.timeout.ms";

    public static final String DEFAULT_URL = "http://schema-registry:8081";
    private static final long DEFAULT_TIMEOUT_MS = 10_000L;

    private SchemaRegistries() {}

    /**
     * {@code mock://<scope>} selects a shared in-memory registry; anything else is treated as the
     * base URL of a Confluent-compatible REST registry.
     */
    public static SchemaRegistry fromConfig(BenchConfig config, MetricsRuntime metrics) {
        final String url = config.getString(CFG_URL, DEFAULT_URL);
        if (url.startsWith(InMemorySchemaRegistry.URL_SCHEME)) {
            log.info("Using in-memory schema registry (scope={})", url);
            return InMemorySchemaRegistry.forScope(url.substring(InMemorySchemaRegistry.URL_SCHEME.length()));
        }
        final long timeoutMs = config.getLong(CFG_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
        log.info("Using schema registry at {}", url);
        return new HttpSchemaRegistry(url, Duration.ofMillis(timeoutMs), metrics);
    }
}
