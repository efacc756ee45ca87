/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.registry;

import java.util.Objects;

/**
 * A schema id bound to its subject. Created once per topic at startup and reused for every encode.
 */
public record SchemaRegistration(String subject, int schemaId) {

    public SchemaRegistration {
        Objects.requireNonNull(subject, "subject");
    }
}
