/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.stats.DelayStatistics;

/**
 * @param elapsedSeconds measured from the end of the first message to the end of the last
 */
public record ConsumerReport(long messages, double elapsedSeconds, DelayStatistics delays) {

    /** {@code (messages - 1) / elapsed}: the first message only starts the clock. */
    public double rate() {
        return (messages < 2 || elapsedSeconds <= 0) ? 0.0 : (messages - 1) / elapsedSeconds;
    }

    public String rateLine() {
        return String.format("Read %.1f messages/second", rate());
    }

    public String delayLine() {
        return delays.toString();
    }
}
