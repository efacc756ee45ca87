/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.materialize;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.core.Materializer;
import com.intuitivedesigns.telemetrybench.core.TopicMaterializer;
import com.intuitivedesigns.telemetrybench.data.FieldValues;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.spi.MaterializerPlugin;

import java.util.Map;

public final class AttributesMaterializerPlugin implements MaterializerPlugin {

    public static final String ID = "ATTRIBUTES";

    private static final TopicMaterializer BAGS = new TopicMaterializer() {
        @Override
        public Object materialize(Map<String, Object> fields) {
            return new AttributeBag(fields);
        }

        @Override
        public Map<String, Object> toFields(Object materialized) {
            return FieldValues.copy(((AttributeBag) materialized).asMap());
        }
    };

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
                return BAGS;
            }
        };
    }
}
