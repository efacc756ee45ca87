/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.admin;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.DescribeConfigsOptions;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.config.ConfigResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * {@link BrokerAdmin} over the Kafka {@link Admin} client. Futures complete on Kafka's admin thread.
 */
public final class KafkaBrokerAdmin implements BrokerAdmin {

    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerAdmin.class);

    private final Admin admin;
    private final int timeoutMs;

    public KafkaBrokerAdmin(Admin admin, Duration timeout) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, Objects.requireNonNull(timeout, "timeout").toMillis());
    }

    @Override
    public Map<String, CompletableFuture<Void>> describeTopicConfigs(Collection<String> topics) {
        final List<ConfigResource> resources = new ArrayList<>(topics.size());
        for (String t : topics) {
            resources.add(new ConfigResource(ConfigResource.Type.TOPIC, t));
        }
        final Map<ConfigResource, KafkaFuture<Config>> values =
                admin.describeConfigs(resources, new DescribeConfigsOptions().timeoutMs(timeoutMs)).values();

        final Map<String, CompletableFuture<Void>> out = new LinkedHashMap<>();
        values.forEach((resource, future) -> out.put(resource.name(), toVoid(future)));
        return out;
    }

    @Override
    public CompletableFuture<Set<String>> listTopics() {
        return admin.listTopics(new ListTopicsOptions().timeoutMs(timeoutMs))
                .names()
                .toCompletionStage()
                .toCompletableFuture();
    }

    @Override
    public Map<String, CompletableFuture<Void>> createTopics(Collection<NewTopic> topics) {
        final Map<String, CompletableFuture<Void>> out = new LinkedHashMap<>();
        admin.createTopics(topics, new CreateTopicsOptions().timeoutMs(timeoutMs))
                .values()
                .forEach((name, future) -> out.put(name, future.toCompletionStage().toCompletableFuture()));
        return out;
    }

    private static <T> CompletableFuture<Void> toVoid(KafkaFuture<T> future) {
        return future.toCompletionStage().toCompletableFuture().thenApply(ignored -> null);
    }

    @Override
    public void close() {
        log.info("Closing admin client...");
        admin.close(Duration.ofSeconds(5));
    }
}
