/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

/**
 * @param elapsedSeconds from just before the first dispatch to the last acknowledgement
 */
public record ProducerReport(String topic, int messages, double elapsedSeconds) {

    /** Messages per second; 0 when nothing was sent. */
    public double rate() {
        return (messages == 0 || elapsedSeconds <= 0) ? 0.0 : messages / elapsedSeconds;
    }

    public String summary() {
        return String.format("Wrote %.1f messages/second", rate());
    }
}
