/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

/**
 * One record handed from the consumer worker to the driver. {@code value} is the raw wire payload.
 */
public record BrokerMessage(String topic, int partition, long offset, byte[] value, long timestamp) {
}
