/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import com.intuitivedesigns.telemetrybench.catalog.ResourceComponentCatalog;
import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.SchemaRegistryException;
import com.intuitivedesigns.telemetrybench.model.ComponentDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.apache.avro.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchemaRegistrarTest {

    private static final String SCOPE = "registrar-test";

    private final ComponentDescriptor test = new ResourceComponentCatalog(BenchConfig.of(Map.of())).load("Test");

    @AfterEach
    void tearDown() {
        InMemorySchemaRegistry.dropScope(SCOPE);
    }

    @Test
    void testRegistersEveryTopicUnderItsSubject() {
        InMemorySchemaRegistry registry = InMemorySchemaRegistry.forScope(SCOPE);
        List<TopicDescriptor> topics = test.topics(List.of("evt_scalars", "evt_arrays"));

        Map<String, SchemaRegistration> regs = new SchemaRegistrar(registry).registerAll(topics).join();

        assertEquals(List.of("lsst.sal.Test.evt_scalars", "lsst.sal.Test.evt_arrays"), new ArrayList<>(regs.keySet()));
        SchemaRegistration scalars = regs.get("lsst.sal.Test.evt_scalars");
        assertEquals("lsst.sal.Test.evt_scalars-value", scalars.subject());
        assertEquals(test.topic("evt_scalars").schema(), registry.schemaById(scalars.schemaId()).join());
    }

    @Test
    void testRegistrationIsIdempotent() {
        SchemaRegistrar registrar = new SchemaRegistrar(InMemorySchemaRegistry.forScope(SCOPE));
        TopicDescriptor t = test.topic("tel_scalars");

        assertEquals(registrar.register(t).join(), registrar.register(t).join());
    }

    @Test
    void testRegistrationsAreSequential() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        SchemaRegistry slow = new SchemaRegistry() {
            @Override
            public CompletableFuture<Integer> register(String subject, Schema schema) {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    sleepQuietly(20);
                    inFlight.decrementAndGet();
                    return subject.length();
                });
            }

            @Override
            public CompletableFuture<Schema> schemaById(int id) {
                return Futures.failed(new SchemaRegistryException("unused"));
            }
        };

        Map<String, SchemaRegistration> regs = new SchemaRegistrar(slow)
                .registerAll(new ArrayList<>(test.topics().values())).join();

        assertEquals(test.topics().size(), regs.size());
        assertEquals(1, maxInFlight.get());
    }

    @Test
    void testFailureAbortsRemainingRegistrations() {
        AtomicInteger calls = new AtomicInteger();
        SchemaRegistry failing = new SchemaRegistry() {
            @Override
            public CompletableFuture<Integer> register(String subject, Schema schema) {
                calls.incrementAndGet();
                return Futures.failed(new SchemaRegistryException("registry down"));
            }

            @Override
            public CompletableFuture<Schema> schemaById(int id) {
                return Futures.failed(new SchemaRegistryException("registry down"));
            }
        };

        CompletionException e = assertThrows(CompletionException.class, () -> new SchemaRegistrar(failing)
                .registerAll(test.topics(List.of("evt_scalars", "evt_arrays"))).join());

        assertInstanceOf(SchemaRegistryException.class, e.getCause());
        assertEquals(1, calls.get());
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
