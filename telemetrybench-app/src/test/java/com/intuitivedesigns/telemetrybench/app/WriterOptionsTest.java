/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.materialize.ValidationStrategy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WriterOptionsTest {

    @Test
    void testDefaults() {
        WriterOptions o = WriterOptions.parse(new String[]{"Test", "evt_scalars"});

        assertEquals("Test", o.component());
        assertEquals("evt_scalars", o.topic());
        assertEquals(1, o.count());
        assertEquals(0, o.index());
        assertFalse(o.nowaitAck());
        assertEquals(ValidationStrategy.RECORD, o.validation());
    }

    @Test
    void testAllOptions() {
        WriterOptions o = WriterOptions.parse(new String[]{
                "-n", "500", "Test", "--index=3", "tel_arrays", "--nowait_ack", "--validation", "pydantic_and_decode"});

        assertEquals("tel_arrays", o.topic());
        assertEquals(500, o.count());
        assertEquals(3, o.index());
        assertTrue(o.nowaitAck());
        assertEquals(ValidationStrategy.MODEL_AND_DECODE, o.validation());
    }

    @Test
    void testRejectsBadInput() {
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "b"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "-n", "x"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "-n"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "-n", "-2"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "--validation", "json"}));
        assertThrows(ConfigurationException.class, () -> WriterOptions.parse(new String[]{"Test", "a", "--fast"}));
    }

    @Test
    void testUsageListsValidationNames() {
        assertTrue(WriterOptions.USAGE.contains("dataclass_and_decode"));
    }
}
