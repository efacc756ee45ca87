/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

import java.util.Map;

/**
 * Receives every consumed message after post-processing, on the driver thread.
 */
@FunctionalInterface
public interface MessageListener {

    MessageListener NONE = (index, topic, fields, processed) -> { };

    /**
     * @param index     1-based position of the message in this run
     * @param fields    decoded fields including {@code private_rcvStamp}
     * @param processed the post-processing result ({@code fields} itself when post-processing is off)
     */
    void onMessage(long index, TopicDescriptor topic, Map<String, Object> fields, Object processed);
}
