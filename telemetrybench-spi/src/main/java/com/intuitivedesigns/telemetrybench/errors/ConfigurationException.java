/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.errors;

/**
 * Invalid setup detected before any I/O: unknown component/topic/strategy names,
 * unsupported field types in synthetic data derivation, bad CLI input.
 */
public class ConfigurationException extends BenchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
