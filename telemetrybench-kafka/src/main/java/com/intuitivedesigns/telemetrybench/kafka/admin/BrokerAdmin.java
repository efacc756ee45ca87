/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.admin;

import org.apache.kafka.clients.admin.NewTopic;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The slice of the Kafka admin API the provisioner needs. Every call returns without blocking.
 */
public interface BrokerAdmin extends AutoCloseable {

    /**
     * @return one future per requested topic; a missing topic fails with
     *         {@link org.apache.kafka.common.errors.UnknownTopicOrPartitionException}
     */
    Map<String, CompletableFuture<Void>> describeTopicConfigs(Collection<String> topics);

    CompletableFuture<Set<String>> listTopics();

    Map<String, CompletableFuture<Void>> createTopics(Collection<NewTopic> topics);

    @Override
    default void close() {}
}
