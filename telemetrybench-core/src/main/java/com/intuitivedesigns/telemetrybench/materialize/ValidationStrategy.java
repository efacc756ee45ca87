/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.intuitivedesigns.telemetrybench.core.TopicMaterializer;
import com.intuitivedesigns.telemetrybench.data.FieldValidator;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * How the producer gates each outgoing field mapping.
 *
 * <p>The strategy is chosen once and bound to a topic with {@link #bind}; the bound step only
 * validates or transforms the payload, it never drops or reorders messages.</p>
 */
public enum ValidationStrategy {

    NONE(null, false),
    /** Field validator; raises on the first invalid field. */
    CUSTOM(null, false),
    /** Build an Avro record and discard it. */
    RECORD(RecordMaterializerPlugin.ID, false),
    /** Build an Avro record and send the fields read back from it. */
    RECORD_AND_DECODE(RecordMaterializerPlugin.ID, true),
    MODEL(ModelMaterializerPlugin.ID, false),
    MODEL_AND_DECODE(ModelMaterializerPlugin.ID, true);

    private final String materializerId;
    private final boolean decode;

    ValidationStrategy(String materializerId, boolean decode) {
        this.materializerId = materializerId;
        this.decode = decode;
    }

    public String materializerId() {
        return materializerId;
    }

    public boolean decode() {
        return decode;
    }

    /**
     * Accepts the enum names in any case plus the legacy aliases {@code dataclass},
     * {@code dataclass_and_decode}, {@code pydantic} and {@code pydantic_and_decode}.
     *
     * @throws ConfigurationException for unknown names
     */
    public static ValidationStrategy parse(String name) {
        final String key = (name == null) ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (key) {
            case "dataclass":
                return RECORD;
            case "dataclass_and_decode":
                return RECORD_AND_DECODE;
            case "pydantic":
                return MODEL;
            case "pydantic_and_decode":
                return MODEL_AND_DECODE;
            default:
                for (ValidationStrategy s : values()) {
                    if (s.name().equalsIgnoreCase(key)) return s;
                }
                throw new ConfigurationException("Unsupported validation strategy '" + name + "'. Available: " + names());
        }
    }

    public static List<String> names() {
        final List<String> out = new ArrayList<>();
        for (ValidationStrategy s : values()) out.add(s.name().toLowerCase(Locale.ROOT));
        out.addAll(List.of("dataclass", "dataclass_and_decode", "pydantic", "pydantic_and_decode"));
        return out;
    }

    /**
     * Binds this strategy to one topic.
     *
     * @return the per-message step; its result is the mapping to serialize
     */
    public UnaryOperator<Map<String, Object>> bind(TopicDescriptor topic, Materializers materializers) {
        switch (this) {
            case NONE:
                return UnaryOperator.identity();
            case CUSTOM: {
                final FieldValidator validator = FieldValidator.forTopic(topic);
                return data -> {
                    validator.validate(data);
                    return data;
                };
            }
            default: {
                final TopicMaterializer m = materializers.require(materializerId).forTopic(topic);
                if (decode) {
                    return data -> m.toFields(m.materialize(data));
                }
                return data -> {
                    m.materialize(data);
                    return data;
                };
            }
        }
    }
}
