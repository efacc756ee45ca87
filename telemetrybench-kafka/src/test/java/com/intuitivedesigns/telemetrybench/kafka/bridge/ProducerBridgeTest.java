/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

import com.intuitivedesigns.telemetrybench.errors.DeliveryException;
import com.intuitivedesigns.telemetrybench.kafka.MockClients;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProducerBridgeTest {

    @Test
    void testPublishCompletesWithBrokerMetadata() throws Exception {
        MockProducer<String, byte[]> producer = MockClients.producer();
        try (ProducerBridge bridge = new ProducerBridge(producer, "producer-test")) {
            RecordMetadata md = bridge.publish("lsst.sal.Test.evt_scalars", new byte[]{0, 1, 2}).get(5, TimeUnit.SECONDS);

            assertEquals("lsst.sal.Test.evt_scalars", md.topic());
            assertEquals(1, producer.history().size());
            assertArrayEquals(new byte[]{0, 1, 2}, producer.history().get(0).value());
            assertNull(producer.history().get(0).key());
        }
        assertTrue(producer.closed());
    }

    @Test
    void testDeliveryFailureSurfacesAsDeliveryException() {
        MockProducer<String, byte[]> producer = MockClients.failingProducer("broker unavailable");
        try (ProducerBridge bridge = new ProducerBridge(producer, "producer-fail")) {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> bridge.publish("lsst.sal.Test.evt_scalars", new byte[]{0}).get(5, TimeUnit.SECONDS));

            DeliveryException de = assertInstanceOf(DeliveryException.class, ex.getCause());
            assertEquals("lsst.sal.Test.evt_scalars", de.topic());
            assertTrue(de.getMessage().contains("broker unavailable"));
        }
    }

    @Test
    void testPublishAfterCloseFails() {
        ProducerBridge bridge = new ProducerBridge(MockClients.producer(), "producer-closed");
        bridge.close();

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> bridge.publish("t", new byte[]{0}).get(5, TimeUnit.SECONDS));
        assertInstanceOf(DeliveryException.class, ex.getCause());
    }
}
