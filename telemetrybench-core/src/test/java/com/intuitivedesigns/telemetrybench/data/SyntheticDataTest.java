/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.data;

import com.intuitivedesigns.telemetrybench.catalog.ComponentCatalog;
import com.intuitivedesigns.telemetrybench.catalog.ResourceComponentCatalog;
import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticDataTest {

    private final ComponentCatalog catalog = new ResourceComponentCatalog(BenchConfig.of(Map.of()));

    @Test
    void testScalarsGetCanonicalValues() {
        Map<String, Object> data = SyntheticData.derive(catalog.load("Test").topic("evt_scalars"));

        assertEquals(Boolean.TRUE, data.get("boolean0"));
        assertEquals(1, data.get("int0"));
        assertEquals(1L, data.get("longLong0"));
        assertEquals(1L, data.get("unsignedInt0"));
        assertEquals(1.1f, data.get("float0"));
        assertEquals(1.1, data.get("double0"));
        assertEquals("a short string", data.get("string0"));
        assertEquals(1, data.get("private_seqNum"));
        assertEquals(1.1, data.get("private_sndStamp"));
    }

    @Test
    void testArraysKeepDefaultLength() {
        Map<String, Object> data = SyntheticData.derive(catalog.load("Test").topic("evt_arrays"));

        assertEquals(Collections.nCopies(5, 1), data.get("int0"));
        assertEquals(Collections.nCopies(5, 1L), data.get("longLong0"));
        assertEquals(Collections.nCopies(5, 1.1f), data.get("float0"));
        assertEquals(Collections.nCopies(5, 1.1), data.get("double0"));
        assertEquals(Collections.nCopies(5, Boolean.TRUE), data.get("boolean0"));
    }

    @Test
    void testFieldOrderFollowsSchema() {
        TopicDescriptor t = catalog.load("Test").topic("tel_scalars");
        Map<String, Object> data = SyntheticData.derive(t);

        assertEquals(t.schema().getFields().size(), data.size());
        assertEquals(List.copyOf(data.keySet()).get(0), t.schema().getFields().get(0).name());
    }

    @Test
    void testNestedMappingIsRejected() {
        TopicDescriptor t = catalog.load("Nested").topic("evt_settings");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> SyntheticData.derive(t));
        assertTrue(e.getMessage().contains("settings"), e.getMessage());
    }

    @Test
    void testResultIsMutableAndIndependent() {
        TopicDescriptor t = catalog.load("Nested").topic("evt_plain");
        Map<String, Object> first = SyntheticData.derive(t);
        first.put("level", 99);

        assertEquals(1, SyntheticData.derive(t).get("level"));
    }
}
