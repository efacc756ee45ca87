/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistration;

import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One producer run: {@code count} copies of {@code baseData} on {@code topic}, each passed through
 * {@code validation} before it is serialized.
 */
public record ProducerJob(TopicDescriptor topic,
                          SchemaRegistration registration,
                          Map<String, Object> baseData,
                          int count,
                          int index,
                          UnaryOperator<Map<String, Object>> validation) {

    public ProducerJob {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(registration, "registration");
        Objects.requireNonNull(baseData, "baseData");
        Objects.requireNonNull(validation, "validation");
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
    }
}
