/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;

/**
 * Minimal command-line walker shared by the writer and reader options.
 */
final class ArgCursor {

    private final String[] args;
    private int pos;

    ArgCursor(String[] args) {
        this.args = (args == null) ? new String[0] : args;
    }

    boolean hasNext() {
        return pos < args.length;
    }

    String next() {
        return args[pos++];
    }

    /** Value of the option just consumed, from {@code --opt value} or {@code --opt=value}. */
    String value(String option, String inline) {
        if (inline != null) return inline;
        if (!hasNext()) {
            throw new ConfigurationException("Option " + option + " requires a value");
        }
        return next();
    }

    static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + option + " expects an integer, got '" + value + "'", e);
        }
    }

    static int nonNegative(String option, int value) {
        if (value < 0) {
            throw new ConfigurationException("Option " + option + " must be >= 0, got " + value);
        }
        return value;
    }
}
