/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rewinds each newly assigned partition to at most {@code maxHistoryRead} records before its end,
 * so a reader started after the writer still sees the latest samples.
 *
 * <p>Runs inside {@code poll} on the consumer's own thread.</p>
 */
public final class HistoryPositioner implements ConsumerRebalanceListener {

    private static final Logger log = LoggerFactory.getLogger(HistoryPositioner.class);

    private final Consumer<?, ?> consumer;
    private final long maxHistoryRead;

    public HistoryPositioner(Consumer<?, ?> consumer, long maxHistoryRead) {
        if (maxHistoryRead < 0) {
            throw new IllegalArgumentException("maxHistoryRead must be >= 0, got " + maxHistoryRead);
        }
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.maxHistoryRead = maxHistoryRead;
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        position(partitions);
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        log.debug("Partitions revoked: {}", partitions);
    }

    /**
     * Seeks every partition to {@code max(beginning, end - maxHistoryRead)}.
     *
     * @return the offset chosen for each partition
     */
    public Map<TopicPartition, Long> position(Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) return Collections.emptyMap();

        final Map<TopicPartition, Long> begin = consumer.beginningOffsets(partitions);
        final Map<TopicPartition, Long> end = consumer.endOffsets(partitions);
        final Map<TopicPartition, Long> chosen = new LinkedHashMap<>();
        for (TopicPartition tp : partitions) {
            final long first = begin.getOrDefault(tp, 0L);
            final long last = end.getOrDefault(tp, first);
            final long target = Math.max(first, last - maxHistoryRead);
            consumer.seek(tp, target);
            chosen.put(tp, target);
            log.debug("Positioned {} at offset {} (begin={}, end={})", tp, target, first, last);
        }
        return chosen;
    }
}
