/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.stats;

/**
 * Streaming count/mean/stddev/min/max of delay samples (Welford's algorithm).
 *
 * <p>Constant memory however long the consumer runs. Not thread-safe: owned by the driver thread.</p>
 */
public final class DelayStatistics {

    private long count;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public void add(double sample) {
        count++;
        final double delta = sample - mean;
        mean += delta / count;
        m2 += delta * (sample - mean);
        if (sample < min) min = sample;
        if (sample > max) max = sample;
    }

    public long count() {
        return count;
    }

    /** @return the mean, or NaN when empty */
    public double mean() {
        return count == 0 ? Double.NaN : mean;
    }

    /** Population standard deviation; NaN when empty. */
    public double stddev() {
        return count == 0 ? Double.NaN : Math.sqrt(m2 / count);
    }

    public double min() {
        return count == 0 ? Double.NaN : min;
    }

    public double max() {
        return count == 0 ? Double.NaN : max;
    }

    @Override
    public String toString() {
        return String.format("Delay mean = %.3f, stdev = %.3f, min = %.3f, max = %.3f seconds",
                mean(), stddev(), min(), max());
    }
}
