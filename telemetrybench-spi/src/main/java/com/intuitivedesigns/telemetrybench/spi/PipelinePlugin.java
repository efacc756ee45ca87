/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.spi;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;

/**
 * Base contract for ServiceLoader-discovered plugins.
 *
 * @param <T> the component type the plugin builds
 */
public interface PipelinePlugin<T> {

    String id();

    PluginKind kind();

    T create(BenchConfig config, MetricsRuntime metrics) throws Exception;
}
