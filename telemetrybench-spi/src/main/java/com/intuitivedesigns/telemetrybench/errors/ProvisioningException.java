/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.errors;

/**
 * A topic could not be listed or created. Partially provisioned topic sets are not rolled back.
 */
public class ProvisioningException extends BenchException {

    private final String topic;

    public ProvisioningException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    /**
     * @return the wire topic name that failed, or {@code null} for failures not tied to one topic.
     */
    public String topic() {
        return topic;
    }
}
