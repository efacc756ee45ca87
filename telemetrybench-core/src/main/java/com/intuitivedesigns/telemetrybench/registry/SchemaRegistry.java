/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import org.apache.avro.Schema;

import java.util.concurrent.CompletableFuture;

/**
 * Schema registry client. All calls are asynchronous; failures complete the future with a
 * {@link com.intuitivedesigns.telemetrybench.errors.SchemaRegistryException}.
 */
public interface SchemaRegistry extends AutoCloseable {

    /**
     * Registers {@code schema} under {@code subject}. Registering the same schema again returns the same id.
     */
    CompletableFuture<Integer> register(String subject, Schema schema);

    /**
     * Resolves a schema id embedded in a wire message. Results are cached.
     */
    CompletableFuture<Schema> schemaById(int id);

    @Override
    default void close() {
        // no-op by default
    }
}
