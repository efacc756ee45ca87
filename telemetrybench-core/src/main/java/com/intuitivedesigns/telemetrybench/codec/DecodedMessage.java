/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.codec;

import java.util.Map;

/**
 * @param schemaId id embedded in the message header
 * @param fields mutable field mapping in writer-schema order
 */
public record DecodedMessage(int schemaId, Map<String, Object> fields) {
}
