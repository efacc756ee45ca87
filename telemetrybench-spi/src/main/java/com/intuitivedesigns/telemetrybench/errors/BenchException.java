/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.errors;

/**
 * Root of the benchmark's unchecked error hierarchy.
 *
 * <p>Every subtype is fatal for the run: the pipelines never catch these, they propagate to the
 * entry point which logs and exits. Messages carry enough context (topic, field, sequence number)
 * to identify the offending item.</p>
 */
public class BenchException extends RuntimeException {

    public BenchException(String message) {
        super(message);
    }

    public BenchException(String message, Throwable cause) {
        super(message, cause);
    }
}
