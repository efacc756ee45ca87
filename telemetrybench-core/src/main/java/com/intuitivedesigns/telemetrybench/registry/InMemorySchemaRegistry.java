/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.SchemaRegistryException;
import org.apache.avro.Schema;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry selected with a {@code mock://<scope>} URL.
 *
 * <p>Registries are shared per scope so a producer and a consumer in the same JVM resolve the same
 * ids. Ids are assigned from 1 and keyed by schema, independent of subject.</p>
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {

    public static final String URL_SCHEME = "mock://";

    private static final Map<String, InMemorySchemaRegistry> SCOPES = new ConcurrentHashMap<>();

    private final Map<Schema, Integer> idsBySchema = new HashMap<>();
    private final Map<Integer, Schema> schemasById = new HashMap<>();

    public static InMemorySchemaRegistry forScope(String scope) {
        return SCOPES.computeIfAbsent(Objects.requireNonNull(scope, "scope"), s -> new InMemorySchemaRegistry());
    }

    public static void dropScope(String scope) {
        SCOPES.remove(scope);
    }

    @Override
    public synchronized CompletableFuture<Integer> register(String subject, Schema schema) {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(schema, "schema");
        Integer id = idsBySchema.get(schema);
        if (id == null) {
            id = schemasById.size() + 1;
            idsBySchema.put(schema, id);
            schemasById.put(id, schema);
        }
        return CompletableFuture.completedFuture(id);
    }

    @Override
    public synchronized CompletableFuture<Schema> schemaById(int id) {
        final Schema schema = schemasById.get(id);
        if (schema == null) {
            return Futures.failed(new SchemaRegistryException("Schema " + id + " not found"));
        }
        return CompletableFuture.completedFuture(schema);
    }
}
