/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.core.Materializer;
import com.intuitivedesigns.telemetrybench.core.TopicMaterializer;
import com.intuitivedesigns.telemetrybench.data.FieldValues;
import com.intuitivedesigns.telemetrybench.errors.ValidationException;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.spi.MaterializerPlugin;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.GenericRecordBuilder;

import java.util.Map;

/**
 * Materializes field mappings as Avro {@link GenericRecord}s built against the topic's wire schema.
 *
 * <p>Each value is checked with {@link GenericData#validate(Schema, Object)}; fields missing from the
 * mapping take their schema default.</p>
 */
public final class RecordMaterializerPlugin implements MaterializerPlugin {

    public static final String ID = "RECORD";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Materializer create(BenchConfig config, MetricsRuntime metrics) {
        return new Materializer() {
            @Override
            public String id() {
                return ID;
            }

            @Override
            public TopicMaterializer forTopic(TopicDescriptor topic) {
                return new RecordTopicMaterializer(topic);
            }
        };
    }

    private static final class RecordTopicMaterializer implements TopicMaterializer {

        private final TopicDescriptor topic;
        private final Schema schema;

        RecordTopicMaterializer(TopicDescriptor topic) {
            this.topic = topic;
            this.schema = topic.schema();
        }

        @Override
        public Object materialize(Map<String, Object> fields) {
            final GenericRecordBuilder builder = new GenericRecordBuilder(schema);
            for (Map.Entry<String, Object> e : fields.entrySet()) {
                final Schema.Field f = schema.getField(e.getKey());
                if (f == null) {
                    throw new ValidationException(topic.wireName(), e.getKey(), "unknown field");
                }
                if (!GenericData.get().validate(f.schema(), e.getValue())) {
                    throw new ValidationException(topic.wireName(), f.name(),
                            "value " + e.getValue() + " does not match " + f.schema());
                }
                builder.set(f, e.getValue());
            }
            try {
                return builder.build();
            } catch (AvroRuntimeException e) {
                throw new ValidationException(topic.wireName(), null, e.getMessage(), e);
            }
        }

        @Override
        public Map<String, Object> toFields(Object materialized) {
            return FieldValues.toFieldMap((GenericRecord) materialized);
        }
    }
}
