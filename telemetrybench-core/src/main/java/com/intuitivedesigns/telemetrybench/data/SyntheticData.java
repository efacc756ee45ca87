/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.data;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.model.FieldDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the base record the producer publishes: every field set to a canonical
 * non-default value for its type.
 *
 * <p>Runs before any network call, so an unsupported field type fails the run up front.</p>
 */
public final class SyntheticData {

    public static final String STRING_VALUE = "a short string";

    private SyntheticData() {}

    /**
     * @return a fresh mutable mapping in schema field order
     * @throws ConfigurationException for field types with no canonical value (maps, records, unions, ...)
     */
    public static Map<String, Object> derive(TopicDescriptor topic) {
        final Map<String, Object> out = new LinkedHashMap<>();
        for (FieldDescriptor f : topic.fields()) {
            out.put(f.name(), f.array() ? arrayValue(topic, f) : scalarValue(topic, f));
        }
        return out;
    }

    private static List<Object> arrayValue(TopicDescriptor topic, FieldDescriptor f) {
        if (f.length() == 0) {
            throw new ConfigurationException("Array field " + topic.wireName() + "." + f.name()
                    + " has no default to take its length from");
        }
        final Object element = switch (f.type()) {
            case BOOLEAN -> Boolean.TRUE;
            case INT -> 1;
            case LONG -> 1L;
            case FLOAT -> 1.1f;
            case DOUBLE -> 1.1;
            default -> throw unsupported(topic, f, "array element");
        };
        return new ArrayList<>(Collections.nCopies(f.length(), element));
    }

    private static Object scalarValue(TopicDescriptor topic, FieldDescriptor f) {
        return switch (f.type()) {
            case BOOLEAN -> Boolean.TRUE;
            case INT -> 1;
            case LONG -> 1L;
            case FLOAT -> 1.1f;
            case DOUBLE -> 1.1;
            case STRING -> STRING_VALUE;
            default -> throw unsupported(topic, f, "scalar");
        };
    }

    private static ConfigurationException unsupported(TopicDescriptor topic, FieldDescriptor f, String what) {
        return new ConfigurationException("Unexpected " + what + " type " + f.type().getName()
                + " for field " + topic.wireName() + "." + f.name());
    }
}
