/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.data;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Avro runtime values and the plain Java values used in field mappings.
 *
 * <p>Field mappings only ever hold {@code String}, {@code ArrayList}, {@code LinkedHashMap} and boxed
 * primitives, so two mappings with the same content compare equal regardless of where they came from.</p>
 */
public final class FieldValues {

    private FieldValues() {}

    public static Object normalize(Object value) {
        if (value instanceof CharSequence cs) {
            return cs.toString();
        }
        if (value instanceof Collection<?> c) {
            final List<Object> out = new ArrayList<>(c.size());
            for (Object o : c) out.add(normalize(o));
            return out;
        }
        if (value instanceof Map<?, ?> m) {
            final Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return out;
        }
        return value;
    }

    /**
     * Copies a record into a mutable field mapping in schema field order.
     */
    public static Map<String, Object> toFieldMap(GenericRecord record) {
        final List<Schema.Field> fields = record.getSchema().getFields();
        final Map<String, Object> out = new LinkedHashMap<>(fields.size() * 2);
        for (Schema.Field f : fields) {
            out.put(f.name(), normalize(record.get(f.pos())));
        }
        return out;
    }

    /**
     * Deep copy of a field mapping; array values are copied so the result can be mutated freely.
     */
    public static Map<String, Object> copy(Map<String, Object> fields) {
        final Map<String, Object> out = new LinkedHashMap<>(fields.size() * 2);
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            final Object v = e.getValue();
            out.put(e.getKey(), (v instanceof List<?> l) ? new ArrayList<>(l) : v);
        }
        return out;
    }
}
