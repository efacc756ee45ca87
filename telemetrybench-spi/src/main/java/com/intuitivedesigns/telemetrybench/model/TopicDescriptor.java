/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.model;

import org.apache.avro.Schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one topic: its names, wire schema and typed fields.
 */
public record TopicDescriptor(
        String componentName,
        String logicalName,
        String wireName,
        Schema schema,
        boolean indexed,
        List<FieldDescriptor> fields
) {

    public static final String WIRE_PREFIX = "lsst.sal.";
    public static final String SUBJECT_SUFFIX = "-value";

    public TopicDescriptor {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(logicalName, "logicalName");
        Objects.requireNonNull(wireName, "wireName");
        Objects.requireNonNull(schema, "schema");
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }

    public static String wireName(String componentName, String logicalName) {
        return WIRE_PREFIX + componentName + "." + logicalName;
    }

    /**
     * Registry subject for the value schema of this topic.
     */
    public String subject() {
        return wireName + SUBJECT_SUFFIX;
    }

    public Optional<FieldDescriptor> field(String name) {
        for (FieldDescriptor f : fields) {
            if (f.name().equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
