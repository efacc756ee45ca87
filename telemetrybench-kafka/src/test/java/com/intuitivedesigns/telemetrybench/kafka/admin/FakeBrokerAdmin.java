/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.admin;

import com.intuitivedesigns.telemetrybench.driver.Futures;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory broker: topics exist once created, failures can be injected per topic.
 */
final class FakeBrokerAdmin implements BrokerAdmin {

    final Set<String> existing = new TreeSet<>();
    final List<String> described = new ArrayList<>();
    final List<NewTopic> createRequests = new ArrayList<>();
    final Map<String, RuntimeException> describeFailures = new HashMap<>();
    final Map<String, RuntimeException> createFailures = new HashMap<>();

    @Override
    public synchronized Map<String, CompletableFuture<Void>> describeTopicConfigs(Collection<String> topics) {
        final Map<String, CompletableFuture<Void>> out = new LinkedHashMap<>();
        for (String t : topics) {
            described.add(t);
            if (describeFailures.containsKey(t)) {
                out.put(t, Futures.failed(describeFailures.get(t)));
            } else if (existing.contains(t)) {
                out.put(t, CompletableFuture.completedFuture(null));
            } else {
                out.put(t, Futures.failed(new UnknownTopicOrPartitionException("Unknown topic " + t)));
            }
        }
        return out;
    }

    @Override
    public synchronized CompletableFuture<Set<String>> listTopics() {
        return CompletableFuture.completedFuture(new TreeSet<>(existing));
    }

    @Override
    public synchronized Map<String, CompletableFuture<Void>> createTopics(Collection<NewTopic> topics) {
        final Map<String, CompletableFuture<Void>> out = new LinkedHashMap<>();
        for (NewTopic t : topics) {
            createRequests.add(t);
            final RuntimeException failure = createFailures.get(t.name());
            if (failure != null) {
                out.put(t.name(), Futures.failed(failure));
            } else {
                existing.add(t.name());
                out.put(t.name(), CompletableFuture.completedFuture(null));
            }
        }
        return out;
    }
}
