/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.materialize.Materializers;
import com.intuitivedesigns.telemetrybench.materialize.PostProcessStrategy;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * One consumer run over one or more topics.
 *
 * @param topics         descriptors keyed by wire name
 * @param postProcessors per wire name, the bound post-process step
 * @param count          messages to read; 0 reads until the process is stopped
 */
public record ConsumerJob(Map<String, TopicDescriptor> topics,
                          Map<String, Function<Map<String, Object>, Object>> postProcessors,
                          long count,
                          long maxHistoryRead,
                          MessageListener listener) {

    public ConsumerJob {
        Objects.requireNonNull(topics, "topics");
        Objects.requireNonNull(postProcessors, "postProcessors");
        Objects.requireNonNull(listener, "listener");
        if (topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        if (!postProcessors.keySet().containsAll(topics.keySet())) {
            throw new IllegalArgumentException("Missing post-processor for some of " + topics.keySet());
        }
    }

    public static ConsumerJob of(List<TopicDescriptor> topics,
                                 PostProcessStrategy strategy,
                                 Materializers materializers,
                                 long count,
                                 long maxHistoryRead,
                                 MessageListener listener) {
        final Map<String, TopicDescriptor> byName = new LinkedHashMap<>();
        final Map<String, Function<Map<String, Object>, Object>> steps = new LinkedHashMap<>();
        for (TopicDescriptor t : topics) {
            byName.put(t.wireName(), t);
            steps.put(t.wireName(), strategy.bind(t, materializers));
        }
        return new ConsumerJob(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(steps),
                count, maxHistoryRead, listener);
    }
}
