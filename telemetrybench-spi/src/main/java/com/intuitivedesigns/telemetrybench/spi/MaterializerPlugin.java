/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.spi;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.core.Materializer;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;

/**
 * SPI for structured-record technologies used by validation and post-processing.
 *
 * <p>Ids shipped with the core module: {@code RECORD} (Avro generic records),
 * {@code MODEL} (schema-checked Jackson trees) and {@code ATTRIBUTES} (attribute bags).</p>
 */
public interface MaterializerPlugin extends PipelinePlugin<Materializer> {

    @Override
    default PluginKind kind() {
        return PluginKind.MATERIALIZER;
    }

    @Override
    Materializer create(BenchConfig config, MetricsRuntime metrics);
}
