/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.materialize.PostProcessStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <component> <topic>... [-n N] [-t|--time] [--max_history_read M] [--partitions P] [--postprocess NAME]}
 *
 * @param count 0 reads until the process is stopped
 */
public record ReaderOptions(String component,
                            List<String> topics,
                            int count,
                            boolean time,
                            int maxHistoryRead,
                            int partitions,
                            PostProcessStrategy postProcess) {

    public static final String USAGE = "usage: telemetry-reader <component> <topic>... [-n N] [-t|--time] "
            + "[--max_history_read M] [--partitions P] [--postprocess " + String.join("|", PostProcessStrategy.names()) + "]";

    public ReaderOptions {
        topics = List.copyOf(topics);
    }

    /**
     * @throws ConfigurationException for malformed or missing arguments, or {@code --time} with N == 1
     */
    public static ReaderOptions parse(String[] args) {
        final List<String> positional = new ArrayList<>();
        int count = 10;
        boolean time = false;
        int maxHistoryRead = 1000;
        int partitions = 1;
        PostProcessStrategy postProcess = PostProcessStrategy.RECORD;

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
                case "-t", "--time" -> time = true;
                case "--max_history_read" -> maxHistoryRead = ArgCursor.nonNegative(option,
                        ArgCursor.parseInt(option, cursor.value(option, inline)));
                case "--partitions" -> partitions = ArgCursor.parseInt(option, cursor.value(option, inline));
                case "--postprocess" -> postProcess = PostProcessStrategy.parse(cursor.value(option, inline));
                default -> throw new ConfigurationException("Unknown option " + arg);
            }
        }
        if (positional.size() < 2) {
            throw new ConfigurationException("Expected <component> <topic>..., got " + positional);
        }
        if (partitions < 1) {
            throw new ConfigurationException("Option --partitions must be >= 1, got " + partitions);
        }
        if (time && count == 1) {
            throw new ConfigurationException("You must specify --number > 1 with --time");
        }
        return new ReaderOptions(positional.get(0), positional.subList(1, positional.size()),
                count, time, maxHistoryRead, partitions, postProcess);
    }
}
