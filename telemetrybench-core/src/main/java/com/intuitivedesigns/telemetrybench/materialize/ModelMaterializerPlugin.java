/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.core.Materializer;
import com.intuitivedesigns.telemetrybench.core.TopicMaterializer;
import com.intuitivedesigns.telemetrybench.data.FieldValidator;
import com.intuitivedesigns.telemetrybench.errors.ValidationException;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.model.FieldDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.spi.MaterializerPlugin;
import org.apache.avro.Schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes field mappings as schema-checked Jackson {@link ObjectNode} models.
 *
 * <p>Every field is type and length checked against the topic descriptors before the tree is built,
 * and missing fields are filled from their defaults.</p>
 */
public final class ModelMaterializerPlugin implements MaterializerPlugin {

    public static final String ID = "MODEL";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Materializer create(BenchConfig config, MetricsRuntime metrics) {
        final ObjectMapper json = new ObjectMapper();
        return new Materializer() {
            @Override
            public String id() {
                return ID;
            }

            @Override
            public TopicMaterializer forTopic(TopicDescriptor topic) {
                return new ModelTopicMaterializer(topic, json.getNodeFactory());
            }
        };
    }

    private static final class ModelTopicMaterializer implements TopicMaterializer {

        private final TopicDescriptor topic;
        private final JsonNodeFactory nodes;
        private final Set<String> known;

        ModelTopicMaterializer(TopicDescriptor topic, JsonNodeFactory nodes) {
            this.topic = topic;
            this.nodes = nodes;
            this.known = new HashSet<>();
            for (FieldDescriptor f : topic.fields()) known.add(f.name());
        }

        @Override
        public Object materialize(Map<String, Object> fields) {
            for (String name : fields.keySet()) {
                if (!known.contains(name)) {
                    throw new ValidationException(topic.wireName(), name, "unknown field");
                }
            }

            final ObjectNode model = nodes.objectNode();
            for (FieldDescriptor f : topic.fields()) {
                final Object value = fields.containsKey(f.name()) ? fields.get(f.name()) : f.defaultValue();
                final String problem = FieldValidator.check(f, value);
                if (problem != null) {
                    throw new ValidationException(topic.wireName(), f.name(), problem);
                }
                if (f.array()) {
                    final ArrayNode arr = model.putArray(f.name());
                    for (Object element : (List<?>) value) arr.add(toNode(f.type(), element));
                } else {
                    model.set(f.name(), toNode(f.type(), value));
                }
            }
            return model;
        }

        @Override
        public Map<String, Object> toFields(Object materialized) {
            final ObjectNode model = (ObjectNode) materialized;
            final Map<String, Object> out = new LinkedHashMap<>();
            for (FieldDescriptor f : topic.fields()) {
                final JsonNode node = model.get(f.name());
                if (f.array()) {
                    final List<Object> values = new ArrayList<>(node.size());
                    for (JsonNode element : node) values.add(fromNode(f.type(), element));
                    out.put(f.name(), values);
                } else {
                    out.put(f.name(), fromNode(f.type(), node));
                }
            }
            return out;
        }

        private JsonNode toNode(Schema.Type type, Object value) {
            return switch (type) {
                case BOOLEAN -> nodes.booleanNode((Boolean) value);
                case INT -> nodes.numberNode((Integer) value);
                case LONG -> nodes.numberNode((Long) value);
                case FLOAT -> nodes.numberNode((Float) value);
                case DOUBLE -> nodes.numberNode((Double) value);
                case STRING -> nodes.textNode(value.toString());
                default -> throw new ValidationException(topic.wireName(), null, "unsupported type " + type.getName());
            };
        }

        private static Object fromNode(Schema.Type type, JsonNode node) {
            return switch (type) {
                case BOOLEAN -> node.booleanValue();
                case INT -> node.intValue();
                case LONG -> node.longValue();
                case FLOAT -> node.floatValue();
                case DOUBLE -> node.doubleValue();
                case STRING -> node.textValue();
                default -> throw new IllegalStateException("Unsupported model field type " + type.getName());
            };
        }
    }
}
