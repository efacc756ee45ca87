/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka;

import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kafka mock clients wired the way the bridges expect them.
 */
public final class MockClients {

    public static final Partitioner NO_OP_PARTITIONER = new Partitioner() {
        @Override
        public int partition(String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
            return 0;
        }

        @Override
        public void close() {
        }

        @Override
        public void configure(Map<String, ?> configs) {
        }
    };

    private MockClients() {}

    public static MockProducer<String, byte[]> producer() {
        return new MockProducer<>(true, NO_OP_PARTITIONER, new StringSerializer(), new ByteArraySerializer());
    }

    /** Fails every record when the bridge flushes. */
    public static MockProducer<String, byte[]> failingProducer(String reason) {
        return new MockProducer<>(false, NO_OP_PARTITIONER, new StringSerializer(), new ByteArraySerializer()) {
            @Override
            public synchronized void flush() {
                while (errorNext(new RuntimeException(reason))) {
                    // drain pending sends
                }
            }
        };
    }

    public static MockConsumer<String, byte[]> consumer() {
        return new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    }

    /**
     * A consumer whose {@code rebalance} also reaches the listener given to {@code subscribe}, as a
     * broker-driven assignment would.
     */
    public static MockConsumer<String, byte[]> rebalancingConsumer() {
        return new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            private ConsumerRebalanceListener listener;

            @Override
            public synchronized void subscribe(Collection<String> topics, ConsumerRebalanceListener callback) {
                super.subscribe(topics, callback);
                listener = callback;
            }

            @Override
            public synchronized void rebalance(Collection<TopicPartition> newAssignment) {
                super.rebalance(newAssignment);
                if (listener != null) {
                    listener.onPartitionsAssigned(newAssignment);
                }
            }
        };
    }

    /**
     * On the next poll: assigns partition 0 of {@code topic} and makes {@code values} readable from offset 0.
     */
    public static void deliver(MockConsumer<String, byte[]> consumer, String topic, List<byte[]> values) {
        deliver(consumer, Map.of(topic, values));
    }

    /** Same as the single-topic variant, for every topic of {@code valuesByTopic} in one rebalance. */
    public static void deliver(MockConsumer<String, byte[]> consumer, Map<String, List<byte[]>> valuesByTopic) {
        final List<TopicPartition> partitions = new ArrayList<>();
        final Map<TopicPartition, Long> begin = new HashMap<>();
        final Map<TopicPartition, Long> end = new HashMap<>();
        valuesByTopic.forEach((topic, values) -> {
            final TopicPartition tp = new TopicPartition(topic, 0);
            partitions.add(tp);
            begin.put(tp, 0L);
            end.put(tp, (long) values.size());
        });
        consumer.schedulePollTask(() -> {
            consumer.updateBeginningOffsets(begin);
            consumer.updateEndOffsets(end);
            consumer.rebalance(partitions);
            valuesByTopic.forEach((topic, values) -> {
                for (int i = 0; i < values.size(); i++) {
                    consumer.addRecord(new ConsumerRecord<>(topic, 0, i, null, values.get(i)));
                }
            });
        });
    }
}
