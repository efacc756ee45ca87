/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.errors;

/**
 * A field failed custom or structured-record validation.
 */
public class ValidationException extends BenchException {

    private final String topic;
    private final String field;

    public ValidationException(String topic, String field, String reason) {
        super(format(topic, field, reason));
        this.topic = topic;
        this.field = field;
    }

    public ValidationException(String topic, String field, String reason, Throwable cause) {
        super(format(topic, field, reason), cause);
        this.topic = topic;
        this.field = field;
    }

    public String topic() {
        return topic;
    }

    /**
     * @return offending field name, or {@code null} when the failure is not field-specific.
     */
    public String field() {
        return field;
    }

    private static String format(String topic, String field, String reason) {
        return (field == null)
                ? "Invalid data for topic " + topic + ": " + reason
                : "Invalid field " + topic + "." + field + ": " + reason;
    }
}
