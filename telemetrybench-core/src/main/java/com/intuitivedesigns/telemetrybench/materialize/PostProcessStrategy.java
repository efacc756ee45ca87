/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.intuitivedesigns.telemetrybench.core.TopicMaterializer;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * What the consumer builds from each decoded field mapping. Affects CPU cost only; the decoded
 * mapping itself is passed through untouched.
 */
public enum PostProcessStrategy {

    NONE(null),
    RECORD(RecordMaterializerPlugin.ID),
    MODEL(ModelMaterializerPlugin.ID),
    ATTRIBUTES(AttributesMaterializerPlugin.ID);

    private final String materializerId;

    PostProcessStrategy(String materializerId) {
        this.materializerId = materializerId;
    }

    public String materializerId() {
        return materializerId;
    }

    /**
     * Accepts the enum names in any case plus the legacy aliases {@code dataclass},
     * {@code pydantic} and {@code simple_namespace}.
     *
     * @throws ConfigurationException for unknown names
     */
    public static PostProcessStrategy parse(String name) {
        final String key = (name == null) ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (key) {
            case "dataclass":
                return RECORD;
            case "pydantic":
                return MODEL;
            case "simple_namespace":
                return ATTRIBUTES;
            default:
                for (PostProcessStrategy s : values()) {
                    if (s.name().equalsIgnoreCase(key)) return s;
                }
                throw new ConfigurationException("Unsupported post-process strategy '" + name + "'. Available: " + names());
        }
    }

    public static List<String> names() {
        final List<String> out = new ArrayList<>();
        for (PostProcessStrategy s : values()) out.add(s.name().toLowerCase(Locale.ROOT));
        out.addAll(List.of("dataclass", "pydantic", "simple_namespace"));
        return out;
    }

    /**
     * @return the per-message step; {@code NONE} returns the mapping itself
     */
    public Function<Map<String, Object>, Object> bind(TopicDescriptor topic, Materializers materializers) {
        if (this == NONE) {
            return data -> data;
        }
        final TopicMaterializer m = materializers.require(materializerId).forTopic(topic);
        return m::materialize;
    }
}
