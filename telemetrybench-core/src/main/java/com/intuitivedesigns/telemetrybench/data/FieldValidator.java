/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.data;

import com.intuitivedesigns.telemetrybench.errors.ValidationException;
import com.intuitivedesigns.telemetrybench.model.FieldDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.apache.avro.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level validation against a topic's descriptors.
 *
 * <p>Types are checked strictly (an {@code Integer} is not accepted for a {@code long} field) and
 * arrays must have exactly the declared length. Validation never mutates the data.</p>
 */
public final class FieldValidator {

    private final TopicDescriptor topic;
    private final Map<String, FieldDescriptor> byName;

    private FieldValidator(TopicDescriptor topic) {
        this.topic = topic;
        this.byName = new LinkedHashMap<>();
        for (FieldDescriptor f : topic.fields()) byName.put(f.name(), f);
    }

    public static FieldValidator forTopic(TopicDescriptor topic) {
        return new FieldValidator(Objects.requireNonNull(topic, "topic"));
    }

    public TopicDescriptor topic() {
        return topic;
    }

    /**
     * Checks every entry of {@code data} in iteration order.
     *
     * @throws ValidationException for the first unknown or invalid field
     */
    public void validate(Map<String, Object> data) {
        for (Map.Entry<String, Object> e : data.entrySet()) {
            final FieldDescriptor f = byName.get(e.getKey());
            if (f == null) {
                throw new ValidationException(topic.wireName(), e.getKey(), "unknown field");
            }
            final String problem = check(f, e.getValue());
            if (problem != null) {
                throw new ValidationException(topic.wireName(), f.name(), problem);
            }
        }
    }

    /**
     * @return a description of what is wrong with {@code value}, or {@code null} if it is valid
     */
    public static String check(FieldDescriptor f, Object value) {
        if (value == null) {
            return "value is null";
        }
        if (!f.array()) {
            return matches(f.type(), value) ? null : mismatch(f.type(), value);
        }
        if (!(value instanceof List<?> list)) {
            return "expected an array of " + f.type().getName() + ", got " + value.getClass().getSimpleName();
        }
        if (list.size() != f.length()) {
            return "expected " + f.length() + " elements, got " + list.size();
        }
        for (int i = 0; i < list.size(); i++) {
            final Object element = list.get(i);
            if (element == null || !matches(f.type(), element)) {
                return "element [" + i + "]: " + mismatch(f.type(), element);
            }
        }
        return null;
    }

    static boolean matches(Schema.Type type, Object value) {
        return switch (type) {
            case BOOLEAN -> value instanceof Boolean;
            case INT -> value instanceof Integer;
            case LONG -> value instanceof Long;
            case FLOAT -> value instanceof Float;
            case DOUBLE -> value instanceof Double;
            case STRING -> value instanceof CharSequence;
            default -> false;
        };
    }

    private static String mismatch(Schema.Type type, Object value) {
        return "expected " + type.getName() + ", got "
                + (value == null ? "null" : value.getClass().getSimpleName() + " " + value);
    }
}
