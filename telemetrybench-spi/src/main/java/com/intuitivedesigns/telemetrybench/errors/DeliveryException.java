/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.errors;

/**
 * The broker (or its client) reported a publish failure.
 */
public class DeliveryException extends BenchException {

    private final String topic;

    public DeliveryException(String topic, Throwable cause) {
        super("Delivery to " + topic + " failed: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
