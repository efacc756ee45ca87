/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.errors.BenchException;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.kafka.KafkaClients;
import com.intuitivedesigns.telemetrybench.kafka.bridge.ConsumerBridge;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ConsumerJob;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ConsumerPipeline;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.ConsumerReport;
import com.intuitivedesigns.telemetrybench.kafka.pipeline.MessageListener;
import com.intuitivedesigns.telemetrybench.model.ComponentDescriptor;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads messages from one or more topics of one component. Prints each message, or with
 * {@code --time} the read rate and delay statistics.
 */
public final class TelemetryReader {

    private static final Logger log = LoggerFactory.getLogger(TelemetryReader.class);

    private TelemetryReader() {}

    public static void main(String[] args) {
        final ReaderOptions options;
        try {
            options = ReaderOptions.parse(args);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.err.println(ReaderOptions.USAGE);
            System.exit(1);
            return;
        }
        System.exit(run(options));
    }

    static int run(ReaderOptions options) {
        try (BenchRuntime runtime = BenchRuntime.start("reader-driver")) {
            read(runtime, options);
            return 0;
        } catch (BenchException e) {
            log.error("Reader failed: {}", e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            log.error("Reader failed unexpectedly", e);
            return 1;
        }
    }

    static MessageListener printer(ReaderOptions options) {
        if (options.time()) {
            return MessageListener.NONE;
        }
        return (index, topic, fields, processed) -> System.out.println("read [" + index + "]: " + processed);
    }

    private static void read(BenchRuntime runtime, ReaderOptions options) {
        log.info("Parsing info for component {}", options.component());
        final ComponentDescriptor component = runtime.catalog.load(options.component());
        log.info("Obtaining info for topics {}", options.topics());
        final List<TopicDescriptor> topics = component.topics(options.topics());

        final ConsumerJob job = ConsumerJob.of(topics, options.postProcess(), runtime.materializers,
                options.count(), options.maxHistoryRead(), printer(options));

        runtime.register(topics);
        runtime.provision(topics, options.partitions());

        final String groupId = KafkaClients.randomGroupId();
        try (ConsumerBridge bridge = new ConsumerBridge(KafkaClients.newConsumer(runtime.config, groupId),
                KafkaClients.pollTimeout(runtime.config), "consumer-worker")) {
            final ConsumerPipeline pipeline = new ConsumerPipeline(runtime.driver, bridge, runtime.codec, runtime.metrics);
            final ConsumerReport report = runtime.driver.run(() -> pipeline.run(job));
            if (options.time()) {
                System.out.println(report.rateLine() + ": " + options);
                System.out.println(report.delayLine());
            }
        }
    }
}
