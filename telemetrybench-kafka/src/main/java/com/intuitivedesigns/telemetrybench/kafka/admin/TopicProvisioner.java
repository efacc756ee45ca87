/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.admin;

import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.ProvisioningException;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * Makes sure every topic a run needs exists before any traffic flows.
 *
 * <p>Existing topics are left alone. A topic created concurrently by another process between the
 * listing and the create request counts as provisioned.</p>
 */
public final class TopicProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TopicProvisioner.class);

    /** Described alongside the real names; its absence proves the describe probe reached the broker. */
    public static final String SENTINEL_TOPIC = "not_a_topic_name";

    private final BrokerAdmin admin;
    private final short replicationFactor;

    public TopicProvisioner(BrokerAdmin admin, short replicationFactor) {
        this.admin = Objects.requireNonNull(admin, "admin");
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be >= 1, got " + replicationFactor);
        }
        this.replicationFactor = replicationFactor;
    }

    /**
     * @return the topics that were created by this call (sorted); empty when all existed
     * @throws ProvisioningException (through the future) naming the first topic that failed
     */
    public CompletableFuture<SortedSet<String>> provision(Collection<String> needed, int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be >= 1, got " + partitions);
        }
        final Set<String> wanted = new LinkedHashSet<>(needed);
        return probe(wanted)
                .thenCompose(ignored -> admin.listTopics())
                .thenCompose(existing -> {
                    final SortedSet<String> missing = new TreeSet<>(wanted);
                    missing.removeAll(existing);
                    if (missing.isEmpty()) {
                        log.info("All {} topics already exist", wanted.size());
                        return CompletableFuture.completedFuture(Collections.unmodifiableSortedSet(missing));
                    }
                    return create(missing, partitions);
                });
    }

    // Describe results are informational only; failures here never block provisioning.
    private CompletableFuture<Void> probe(Set<String> wanted) {
        final List<String> names = new ArrayList<>(wanted);
        names.add(SENTINEL_TOPIC);
        final Map<String, CompletableFuture<Void>> results = admin.describeTopicConfigs(names);

        final List<CompletableFuture<Void>> observed = new ArrayList<>(results.size());
        results.forEach((topic, future) -> observed.add(future.handle((ok, error) -> {
            if (error == null) {
                log.debug("Topic {} exists", topic);
                return null;
            }
            final Throwable cause = Futures.unwrap(error);
            if (cause instanceof UnknownTopicOrPartitionException) {
                log.debug("Topic {} does not exist", topic);
            } else {
                log.warn("Failed to describe topic {}: {}", topic, cause.toString());
            }
            return null;
        })));
        return CompletableFuture.allOf(observed.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<SortedSet<String>> create(SortedSet<String> missing, int partitions) {
        log.info("Creating topics {} (partitions={}, replication={})", missing, partitions, replicationFactor);
        final List<NewTopic> requests = new ArrayList<>(missing.size());
        for (String name : missing) {
            requests.add(new NewTopic(name, partitions, replicationFactor));
        }
        final Map<String, CompletableFuture<Void>> results = admin.createTopics(requests);

        CompletableFuture<Void> all = CompletableFuture.completedFuture(null);
        for (String name : missing) {
            final CompletableFuture<Void> f = results.get(name);
            if (f == null) {
                return Futures.failed(new ProvisioningException(name, "Broker returned no result for topic " + name, null));
            }
            all = all.thenCombine(f.handle((ok, error) -> {
                if (error == null) {
                    log.info("Created topic {}", name);
                    return null;
                }
                final Throwable cause = Futures.unwrap(error);
                if (cause instanceof TopicExistsException) {
                    log.info("Topic {} was created concurrently", name);
                    return null;
                }
                throw new ProvisioningException(name, "Failed to create topic " + name + ": " + cause.getMessage(), cause);
            }), (a, b) -> null);
        }
        return all.thenApply(ignored -> Collections.unmodifiableSortedSet(missing));
    }
}
