/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed configuration for the benchmark tools.
 *
 * Resolution order for the process-wide instance:
 * <ol>
 *   <li>file named by {@code -Dbench.config.path} or env {@code BENCH_CONFIG_PATH}</li>
 *   <li>classpath resource {@code bench.properties}</li>
 * </ol>
 * System properties with the same key override file values.
 */
public final class BenchConfig {

    private static final Logger log = LoggerFactory.getLogger(BenchConfig.class);

    private static final String P_CONFIG_PATH = "bench.config.path";
    private static final String ENV_CONFIG_PATH = "BENCH_CONFIG_PATH";
    private static final String DEFAULT_RESOURCE = "bench.properties";

    private static volatile BenchConfig instance;

    private final Properties props;

    private BenchConfig(Properties props) {
        this.props = props;
    }

    public static BenchConfig get() {
        BenchConfig local = instance;
        if (local == null) {
            synchronized (BenchConfig.class) {
                local = instance;
                if (local == null) {
                    local = load();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static BenchConfig of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        final Properties p = new Properties();
        p.putAll(values);
        return new BenchConfig(p);
    }

    private static BenchConfig load() {
        final Properties props = new Properties();

        String path = System.getProperty(P_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from: {}", path);
            try (InputStream is = new FileInputStream(path.trim())) {
                props.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config file: " + path, e);
            }
        } else {
            ClassLoader cl = Thread.currentThread().getContextClassLoader();
            if (cl == null) cl = BenchConfig.class.getClassLoader();
            try (InputStream is = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    log.warn("No configuration file found ('{}' not on classpath, -D{} unset). Using defaults.",
                            DEFAULT_RESOURCE, P_CONFIG_PATH);
                } else {
                    props.load(is);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config resource: " + DEFAULT_RESOURCE, e);
            }
        }

        // -D overrides win over file values
        for (String key : System.getProperties().stringPropertyNames()) {
            if (props.containsKey(key)) {
                props.setProperty(key, System.getProperty(key));
            }
        }

        log.info("Loaded {} configuration properties.", props.size());
        return new BenchConfig(props);
    }

    public String getString(String key, String defaultValue) {
        final String v = props.getProperty(key);
        if (v == null) return defaultValue;
        final String t = v.trim();
        return t.isEmpty() ? defaultValue : t;
    }

    public int getInt(String key, int defaultValue) {
        final String val = getString(key, null);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': {}", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = getString(key, null);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for '{}': {}", key, val);
            return defaultValue;
        }
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(props.stringPropertyNames());
    }
}
