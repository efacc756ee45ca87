/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.metrics;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@code metrics.provider} (NONE | MICROMETER) plus {@code metrics.tag.<name>=<value>} common tags.
 */
public record MetricsSettings(String providerId, Map<String, String> commonTags) {

    static final String KEY_PROVIDER = "metrics.provider";
    static final String KEY_TAG_PREFIX = "metrics.tag.";
    static final String NONE = "NONE";

    public MetricsSettings {
        providerId = (providerId == null || providerId.isBlank()) ? NONE : providerId.trim().toUpperCase(Locale.ROOT);
        commonTags = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(commonTags, "commonTags")));
    }

    public static MetricsSettings from(BenchConfig config) {
        final Map<String, String> tags = new TreeMap<>();
        for (String key : config.keys()) {
            if (!key.startsWith(KEY_TAG_PREFIX)) continue;
            final String tag = key.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = config.getString(key, null);
            if (!tag.isEmpty() && value != null) {
                tags.put(tag, value);
            }
        }
        return new MetricsSettings(config.getString(KEY_PROVIDER, NONE), tags);
    }

    public boolean disabled() {
        return NONE.equals(providerId);
    }
}
