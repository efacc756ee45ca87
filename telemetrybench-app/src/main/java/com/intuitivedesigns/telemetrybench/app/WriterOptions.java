/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.materialize.ValidationStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <component> <topic> [-n N] [--index I] [--nowait_ack] [--validation NAME]}
 */
public record WriterOptions(String component,
                            String topic,
                            int count,
                            int index,
                            boolean nowaitAck,
                            ValidationStrategy validation) {

    public static final String USAGE = "usage: telemetry-writer <component> <topic> [-n N] [--index I] [--nowait_ack] "
            + "[--validation " + String.join("|", ValidationStrategy.names()) + "]";

    /**
     * @throws ConfigurationException for malformed or missing arguments
     */
    public static WriterOptions parse(String[] args) {
        final List<String> positional = new ArrayList<>();
        int count = 1;
        int index = 0;
        boolean nowaitAck = false;
        ValidationStrategy validation = ValidationStrategy.RECORD;

        final ArgCursor cursor = new ArgCursor(args);
        while (cursor.hasNext()) {
            final String arg = cursor.next();
            if (!arg.startsWith("-") || arg.equals("-")) {
                positional.add(arg);
                continue;
            }
            final int eq = arg.indexOf('=');
            final String option = (eq > 0) ? arg.substring(0, eq) : arg;
            final String inline = (eq > 0) ? arg.substring(eq + 1) : null;
            switch (option) {
                case "-n", "--number" -> count = ArgCursor.nonNegative(option,
                        ArgCursor.parseInt(option, cursor.value(option, inline)));
                case "--index" -> index = ArgCursor.parseInt(option, cursor.value(option, inline));
                case "--nowait_ack" -> nowaitAck = true;
                case "--validation" -> validation = ValidationStrategy.parse(cursor.value(option, inline));
                default -> throw new ConfigurationException("Unknown option " + arg);
            }
        }
        if (positional.size() != 2) {
            throw new ConfigurationException("Expected <component> <topic>, got " + positional);
        }
        return new WriterOptions(positional.get(0), positional.get(1), count, index, nowaitAck, validation);
    }
}
