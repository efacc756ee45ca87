/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Registers each topic's wire schema under its subject, one topic at a time, before any traffic.
 */
public final class SchemaRegistrar {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistrar.class);

    private final SchemaRegistry registry;

    public SchemaRegistrar(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public CompletableFuture<SchemaRegistration> register(TopicDescriptor topic) {
        final String subject = topic.subject();
        return registry.register(subject, topic.schema()).thenApply(id -> {
            log.info("Registered schema with subject={} with ID {}", subject, id);
            return new SchemaRegistration(subject, id);
        });
    }

    /**
     * Registers sequentially: the next registration starts only after the previous one succeeded.
     *
     * @return registrations keyed by wire topic name, in request order
     */
    public CompletableFuture<Map<String, SchemaRegistration>> registerAll(List<TopicDescriptor> topics) {
        final Map<String, SchemaRegistration> out = new LinkedHashMap<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (TopicDescriptor t : topics) {
            chain = chain.thenCompose(ignored -> register(t)).thenAccept(reg -> out.put(t.wireName(), reg));
        }
        return chain.thenApply(ignored -> Collections.unmodifiableMap(out));
    }
}
