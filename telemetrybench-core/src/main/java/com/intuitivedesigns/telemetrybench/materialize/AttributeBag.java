/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Dynamically-typed, read-only bag of named attributes. No schema checks.
 */
public final class AttributeBag {

    private final Map<String, Object> attributes;

    AttributeBag(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object get(String name) {
        if (!attributes.containsKey(name)) {
            throw new IllegalArgumentException("No attribute '" + name + "'");
        }
        return attributes.get(name);
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Set<String> names() {
        return attributes.keySet();
    }

    Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public String toString() {
        final StringJoiner sj = new StringJoiner(", ", "namespace(", ")");
        attributes.forEach((k, v) -> sj.add(k + "=" + v));
        return sj.toString();
    }
}
