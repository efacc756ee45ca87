/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.spi;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Registry for SPI discovery.
 *
 * <p>The ServiceLoader scan runs once at construction; lookups afterwards are map reads.</p>
 *
 * @param <T> the SPI interface type (e.g. {@code MaterializerPlugin.class})
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this.spiType = spiType;
        final Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName()
                        + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    /**
     * @throws ConfigurationException when no plugin is registered under {@code id}
     */
    public T require(String id, String configKeyName) {
        final T plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            throw new ConfigurationException("No " + spiType.getSimpleName() + " found for '" + configKeyName + "=" + id
                    + "'. Available options: " + byId.keySet());
        }
        return plugin;
    }
}
