/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.core;

import java.util.Map;

/**
 * Converts between the internal field mapping and a structured representation for one topic.
 */
public interface TopicMaterializer {

    /**
     * Builds the structured representation of {@code fields}.
     *
     * @throws com.intuitivedesigns.telemetrybench.errors.ValidationException if a field does not fit the topic
     */
    Object materialize(Map<String, Object> fields);

    /**
     * Re-derives a field mapping from a value returned by {@link #materialize(Map)}.
     * The result is a fresh mutable map in schema field order.
     */
    Map<String, Object> toFields(Object materialized);
}
