/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.codec.AvroWireCodec;
import com.intuitivedesigns.telemetrybench.driver.AsyncLoop;
import com.intuitivedesigns.telemetrybench.driver.CooperativeDriver;
import com.intuitivedesigns.telemetrybench.errors.MessageException;
import com.intuitivedesigns.telemetrybench.kafka.bridge.BrokerMessage;
import com.intuitivedesigns.telemetrybench.kafka.bridge.ConsumerBridge;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.model.ReservedFields;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.stats.DelayStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reads messages, stamps their receive time and folds the send-to-receive delay into
 * {@link DelayStatistics}.
 *
 * <p>The throughput clock starts once the first message is fully processed, so producer start-up
 * does not count against the read rate.</p>
 */
public final class ConsumerPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConsumerPipeline.class);

    public static final String METRIC_READ = "bench.messages.read";
    public static final String METRIC_DELAY = "bench.delay.seconds";
    public static final String METRIC_READ_RATE = "bench.read.rate";

    private final CooperativeDriver driver;
    private final ConsumerBridge bridge;
    private final AvroWireCodec codec;
    private final MetricsRuntime metrics;

    public ConsumerPipeline(CooperativeDriver driver, ConsumerBridge bridge, AvroWireCodec codec, MetricsRuntime metrics) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Subscribes and reads. Must be called on the driver thread.
     *
     * @return the report once {@code job.count()} messages were read; never completes normally
     *         for an unbounded job
     */
    public CompletableFuture<ConsumerReport> run(ConsumerJob job) {
        final Run run = new Run(job);
        return driver.await(bridge.subscribe(job.topics().keySet(), job.maxHistoryRead()))
                .thenCompose(ignored -> AsyncLoop.whileTrue(driver, run::readNext))
                .thenApply(ignored -> run.report());
    }

    /** Per-run state, confined to the driver thread. */
    private final class Run {
        private final ConsumerJob job;
        private final DelayStatistics delays = new DelayStatistics();
        private long read;
        private long startNs;

        Run(ConsumerJob job) {
            this.job = job;
        }

        CompletionStage<Boolean> readNext() {
            return driver.await(bridge.read())
                    .thenCompose(message -> driver.await(codec.decode(message.value()))
                            .thenApply(decoded -> process(message, decoded.fields())));
        }

        private boolean process(BrokerMessage message, Map<String, Object> fields) {
            final TopicDescriptor topic = job.topics().get(message.topic());
            if (topic == null) {
                throw new MessageException("Received message for unexpected topic " + message.topic());
            }
            final double now = ReservedFields.now();
            fields.put(ReservedFields.RCV_STAMP, now);
            final Object sent = fields.get(ReservedFields.SND_STAMP);
            if (!(sent instanceof Number sndStamp)) {
                throw new MessageException("Message on " + message.topic() + "@" + message.offset()
                        + " has no " + ReservedFields.SND_STAMP);
            }
            final double delay = now - sndStamp.doubleValue();
            delays.add(delay);
            metrics.summary(METRIC_DELAY, delay);

            final Object processed = job.postProcessors().get(message.topic()).apply(fields);
            read++;
            metrics.counter(METRIC_READ);
            job.listener().onMessage(read, topic, fields, processed);

            if (job.count() > 0 && read >= job.count()) {
                return false;
            }
            if (read == 1) {
                startNs = System.nanoTime();
            }
            return true;
        }

        ConsumerReport report() {
            final double elapsed = (read < 2) ? 0.0 : (System.nanoTime() - startNs) / 1e9;
            log.info("Read {} messages from {}", read, job.topics().keySet());
            final ConsumerReport report = new ConsumerReport(read, elapsed, delays);
            metrics.gauge(METRIC_READ_RATE, report.rate());
            return report;
        }
    }
}
