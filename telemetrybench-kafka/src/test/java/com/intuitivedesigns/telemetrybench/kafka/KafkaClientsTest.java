/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KafkaClientsTest {

    @Test
    void testProducerAcksFollowWaitFlag() {
        BenchConfig config = BenchConfig.of(Map.of());

        assertEquals("1", KafkaClients.producerProperties(config, true).get(ProducerConfig.ACKS_CONFIG));
        assertEquals("0", KafkaClients.producerProperties(config, false).get(ProducerConfig.ACKS_CONFIG));
        assertEquals(KafkaClients.DEFAULT_BOOTSTRAP,
                KafkaClients.producerProperties(config, true).get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
    }

    @Test
    void testConsumerReadsFromEarliestUnderGivenGroup() {
        Properties props = KafkaClients.consumerProperties(
                BenchConfig.of(Map.of("kafka.bootstrap.servers", "localhost:9092")), "group-1");

        assertEquals("localhost:9092", props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("group-1", props.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("earliest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    }

    @Test
    void testSecuritySettingsArePassedThroughWithoutPrefix() {
        BenchConfig config = BenchConfig.of(Map.of(
                "kafka.security.protocol", "SASL_SSL",
                "kafka.sasl.mechanism", "SCRAM-SHA-512",
                "kafka.unrelated", "x"));

        Properties props = KafkaClients.adminProperties(config);

        assertEquals("SASL_SSL", props.get("security.protocol"));
        assertEquals("SCRAM-SHA-512", props.get("sasl.mechanism"));
        assertFalse(props.containsKey("unrelated"));
    }

    @Test
    void testRandomGroupIdsAreUrlSafeAndDistinct() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String id = KafkaClients.randomGroupId();
            assertEquals(16, id.length());
            assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
            seen.add(id);
        }
        assertEquals(100, seen.size());
    }

    @Test
    void testTimeoutsComeFromConfig() {
        BenchConfig config = BenchConfig.of(Map.of("consumer.poll.ms", "250", "topic.replication.factor", "3"));

        assertEquals(Duration.ofMillis(250), KafkaClients.pollTimeout(config));
        assertEquals(Duration.ofSeconds(10), KafkaClients.adminTimeout(config));
        assertEquals((short) 3, KafkaClients.replicationFactor(config));
    }
}
