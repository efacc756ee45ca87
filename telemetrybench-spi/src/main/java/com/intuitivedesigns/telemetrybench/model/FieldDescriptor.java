/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.model;

import org.apache.avro.Schema;

import java.util.Objects;

/**
 * Typed description of one topic field.
 *
 * @param name field name as it appears in the wire schema
 * @param type Avro type of the value; for arrays, the element type
 * @param array whether the field is a fixed-length array
 * @param length array length (0 for scalars)
 * @param defaultValue schema default, normalized to plain Java values ({@code String}, {@code List}, boxed primitives)
 */
public record FieldDescriptor(
        String name,
        Schema.Type type,
        boolean array,
        int length,
        Object defaultValue
) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0 for field " + name);
        }
    }

    public static FieldDescriptor scalar(String name, Schema.Type type, Object defaultValue) {
        return new FieldDescriptor(name, type, false, 0, defaultValue);
    }

    public static FieldDescriptor array(String name, Schema.Type elementType, int length, Object defaultValue) {
        return new FieldDescriptor(name, elementType, true, length, defaultValue);
    }
}
