/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka;

import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.kafka.admin.BrokerAdmin;
import com.intuitivedesigns.telemetrybench.kafka.admin.KafkaBrokerAdmin;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Properties;

/**
 * Builds the Kafka clients from {@link BenchConfig}.
 */
public final class KafkaClients {

    private static final Logger log = LoggerFactory.getLogger(KafkaClients.class);

    public static final String CFG_BOOTSTRAP = "kafka.bootstrap.servers";
    public static final String CFG_CLIENT_ID = "kafka.client.id";
    public static final String CFG_ADMIN_TIMEOUT_MS = "admin.timeout.ms";
    public static final String CFG_POLL_MS = "consumer.poll.ms";
    public static final String CFG_REPLICATION = "topic.replication.factor";

    public static final String DEFAULT_BOOTSTRAP = "broker:29092";
    private static final String DEFAULT_CLIENT_ID = "telemetrybench";
    private static final long DEFAULT_ADMIN_TIMEOUT_MS = 10_000L;
    private static final long DEFAULT_POLL_MS = 100L;

    private static final SecureRandom RANDOM = new SecureRandom();

    private KafkaClients() {}

    /**
     * @param waitForAck {@code true} for {@code acks=1}, {@code false} for fire-and-forget {@code acks=0}
     */
    public static Properties producerProperties(BenchConfig config, boolean waitForAck) {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString(CFG_BOOTSTRAP, DEFAULT_BOOTSTRAP));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString(CFG_CLIENT_ID, DEFAULT_CLIENT_ID) + "-producer");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());

        // Latency-oriented: one record per flush, no idempotence bookkeeping
        props.put(ProducerConfig.ACKS_CONFIG, waitForAck ? "1" : "0");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "false");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "0");

        copySecurityProps(config, props);
        return props;
    }

    public static Properties consumerProperties(BenchConfig config, String groupId) {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString(CFG_BOOTSTRAP, DEFAULT_BOOTSTRAP));
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, config.getString(CFG_CLIENT_ID, DEFAULT_CLIENT_ID) + "-consumer");
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        copySecurityProps(config, props);
        return props;
    }

    public static Properties adminProperties(BenchConfig config) {
        final Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString(CFG_BOOTSTRAP, DEFAULT_BOOTSTRAP));
        props.put(AdminClientConfig.CLIENT_ID_CONFIG, config.getString(CFG_CLIENT_ID, DEFAULT_CLIENT_ID) + "-admin");
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) adminTimeout(config).toMillis());
        copySecurityProps(config, props);
        return props;
    }

    public static Producer<String, byte[]> newProducer(BenchConfig config, boolean waitForAck) {
        final Properties props = producerProperties(config, waitForAck);
        log.info("Creating producer (bootstrap={}, acks={})",
                props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG), props.get(ProducerConfig.ACKS_CONFIG));
        return new KafkaProducer<>(props);
    }

    public static Consumer<String, byte[]> newConsumer(BenchConfig config, String groupId) {
        final Properties props = consumerProperties(config, groupId);
        log.info("Creating consumer (bootstrap={}, group={})", props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG), groupId);
        return new KafkaConsumer<>(props);
    }

    public static BrokerAdmin newAdmin(BenchConfig config) {
        return new KafkaBrokerAdmin(Admin.create(adminProperties(config)), adminTimeout(config));
    }

    public static Duration adminTimeout(BenchConfig config) {
        return Duration.ofMillis(config.getLong(CFG_ADMIN_TIMEOUT_MS, DEFAULT_ADMIN_TIMEOUT_MS));
    }

    public static Duration pollTimeout(BenchConfig config) {
        return Duration.ofMillis(config.getLong(CFG_POLL_MS, DEFAULT_POLL_MS));
    }

    public static short replicationFactor(BenchConfig config) {
        return (short) config.getInt(CFG_REPLICATION, 1);
    }

    /**
     * A fresh consumer group per run: 12 random bytes, URL-safe base64, with {@code '='} mapped to {@code '_'}.
     */
    public static String randomGroupId() {
        final byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().encodeToString(bytes).replace('=', '_');
    }

    // kafka.ssl.*, kafka.sasl.*, kafka.security.* -> strip "kafka."
    private static void copySecurityProps(BenchConfig src, Properties dst) {
        for (String key : src.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.sasl.") || key.startsWith("kafka.security.")) {
                final String value = src.getString(key, null);
                if (value != null) {
                    dst.put(key.substring("kafka.".length()), value);
                }
            }
        }
    }
}
