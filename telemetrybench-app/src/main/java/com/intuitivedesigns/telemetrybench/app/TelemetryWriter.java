/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.data.SyntheticData;
import com.intuitivedesigns.telemetrybench.errors.BenchException;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.kafka.KafkaClients;
import com.intuitivedesigns.telemetrybench.kafka.bridge.ProducerBridge;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ProducerJob;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ProducerPipeline;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ProducerReport;
import com.intuitivedesigns.telemetrybench.model.ComponentDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Writes {@code N} synthetic messages to one topic of one component and prints the write rate.
 */
public final class TelemetryWriter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryWriter.class);

    private static final String CFG_PARTITIONS = "topic.partitions";

    private TelemetryWriter() {}

    public static void main(String[] args) {
        final WriterOptions options;
        try {
            options = WriterOptions.parse(args);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.err.println(WriterOptions.USAGE);
            System.exit(1);
            return;
        }
        System.exit(run(options));
    }

    static int run(WriterOptions options) {
        try (BenchRuntime runtime = BenchRuntime.start("writer-driver")) {
            write(runtime, options);
            return 0;
        } catch (BenchException e) {
            log.error("Writer failed: {}", e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Writer failed unexpectedly", e);
            return 1;
        }
    }

    private static void write(BenchRuntime runtime, WriterOptions options) {
        log.info("Parsing info for component {}", options.component());
        final ComponentDescriptor component = runtime.catalog.load(options.component());
        log.info("Topics = {}", component.topics().keySet());
        final TopicDescriptor topic = component.topic(options.topic());
        log.debug("avro_schema={}", topic.schema());
        log.info("acks={}", options.nowaitAck() ? 0 : 1);

        // Everything that can reject the topic happens before the first broker or registry call
        final Map<String, Object> baseData = SyntheticData.derive(topic);
        final UnaryOperator<Map<String, Object>> validation = options.validation().bind(topic, runtime.materializers);

        runtime.provision(List.of(topic), runtime.config.getInt(CFG_PARTITIONS, 1));
        final SchemaRegistration registration = runtime.register(List.of(topic)).get(topic.wireName());
        log.info("schema_id={}", registration.schemaId());

        try (ProducerBridge bridge = new ProducerBridge(
                KafkaClients.newProducer(runtime.config, !options.nowaitAck()), "producer-worker")) {
            final ProducerPipeline pipeline = new ProducerPipeline(runtime.driver, bridge, runtime.codec, runtime.metrics);
            final ProducerJob job = new ProducerJob(topic, registration, baseData,
                    options.count(), options.index(), validation);

            final ProducerReport report = runtime.driver.run(() -> pipeline.run(job));
            System.out.println(report.summary() + ": " + options);
            runtime.exitDelay();
        }
    }
}
