/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.MessageListener;
import com.intuitivedesigns.telemetrybench.materialize.PostProcessStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReaderOptionsTest {

    @Test
    void testDefaults() {
        ReaderOptions o = ReaderOptions.parse(new String[]{"Test", "evt_scalars"});

        assertEquals("Test", o.component());
        assertEquals(List.of("evt_scalars"), o.topics());
        assertEquals(10, o.count());
        assertFalse(o.time());
        assertEquals(1000, o.maxHistoryRead());
        assertEquals(1, o.partitions());
        assertEquals(PostProcessStrategy.RECORD, o.postProcess());
    }

    @Test
    void testSeveralTopicsAndOptions() {
        ReaderOptions o = ReaderOptions.parse(new String[]{
                "Test", "evt_scalars", "tel_arrays", "-t", "-n", "0", "--max_history_read", "5",
                "--partitions=4", "--postprocess", "simple_namespace"});

        assertEquals(List.of("evt_scalars", "tel_arrays"), o.topics());
        assertTrue(o.time());
        assertEquals(0, o.count());
        assertEquals(5, o.maxHistoryRead());
        assertEquals(4, o.partitions());
        assertEquals(PostProcessStrategy.ATTRIBUTES, o.postProcess());
    }

    @Test
    void testTimingNeedsMoreThanOneMessage() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ReaderOptions.parse(new String[]{"Test", "evt_scalars", "--time", "-n", "1"}));
        assertTrue(ex.getMessage().contains("--number > 1"));

        assertEquals(2, ReaderOptions.parse(new String[]{"Test", "evt_scalars", "--time", "-n", "2"}).count());
    }

    @Test
    void testRejectsBadInput() {
        assertThrows(ConfigurationException.class, () -> ReaderOptions.parse(new String[]{"Test"}));
        assertThrows(ConfigurationException.class, () -> ReaderOptions.parse(new String[]{"Test", "a", "--partitions", "0"}));
        assertThrows(ConfigurationException.class, () -> ReaderOptions.parse(new String[]{"Test", "a", "--postprocess", "json"}));
        assertThrows(ConfigurationException.class, () -> ReaderOptions.parse(new String[]{"Test", "a", "--max_history_read", "-1"}));
    }

    @Test
    void testTimedRunsDoNotPrintMessages() {
        assertSame(MessageListener.NONE, TelemetryReader.printer(ReaderOptions.parse(new String[]{"Test", "a", "-t"})));
        assertNotSame(MessageListener.NONE, TelemetryReader.printer(ReaderOptions.parse(new String[]{"Test", "a"})));
    }
}
