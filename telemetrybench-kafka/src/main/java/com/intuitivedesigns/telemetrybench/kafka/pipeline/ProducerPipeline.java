/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.pipeline;

import com.intuitivedesigns.telemetrybench.codec.AvroWireCodec;
import com.intuitivedesigns.telemetrybench.driver.AsyncLoop;
import com.intuitivedesigns.telemetrybench.driver.CooperativeDriver;
import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.kafka.bridge.ProducerBridge;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.model.ReservedFields;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Publishes a fixed number of synthetic messages to one topic and measures the write rate.
 *
 * <p>Strictly one message in flight: each message is stamped, validated, encoded, published and
 * acknowledged before the next one is built. All steps run on the driver thread; only the
 * Kafka send happens on the bridge's worker.</p>
 */
public final class ProducerPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProducerPipeline.class);

    public static final String METRIC_PUBLISHED = "bench.messages.published";
    public static final String METRIC_ACK_LATENCY = "bench.publish.ack.latency";
    public static final String METRIC_WRITE_RATE = "bench.write.rate";

    private final CooperativeDriver driver;
    private final ProducerBridge bridge;
    private final AvroWireCodec codec;
    private final MetricsRuntime metrics;

    public ProducerPipeline(CooperativeDriver driver, ProducerBridge bridge, AvroWireCodec codec, MetricsRuntime metrics) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Must be called on the driver thread.
     *
     * @return the report; fails with the first validation, encoding or delivery error
     */
    public CompletableFuture<ProducerReport> run(ProducerJob job) {
        final Run run = new Run(job);
        final long startNs = System.nanoTime();
        log.info("Publishing {} messages to {}", job.count(), job.topic().wireName());
        return AsyncLoop.whileTrue(driver, run::publishNext)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("Producer on {} stopped at message {} of {}: {}",
                                job.topic().wireName(), run.seqNum + 1, job.count(), Futures.unwrap(error).getMessage());
                    }
                })
                .thenApply(ignored -> {
                    final ProducerReport report = new ProducerReport(job.topic().wireName(), run.seqNum,
                            (System.nanoTime() - startNs) / 1e9);
                    metrics.gauge(METRIC_WRITE_RATE, report.rate());
                    return report;
                });
    }

    /** Per-run state, confined to the driver thread. */
    private final class Run {
        private final ProducerJob job;
        private final TopicDescriptor topic;
        private final Map<String, Object> data;
        private int seqNum;

        Run(ProducerJob job) {
            this.job = job;
            this.topic = job.topic();
            this.data = new LinkedHashMap<>(job.baseData());
        }

        CompletionStage<Boolean> publishNext() {
            if (seqNum >= job.count()) {
                return CompletableFuture.completedFuture(false);
            }
            final int next = seqNum + 1;
            data.put(ReservedFields.SEQ_NUM, next);
            if (topic.indexed()) {
                data.put(ReservedFields.INDEX, job.index());
            }
            // Stamped last so validation and encoding are inside the measured delay
            data.put(ReservedFields.SND_STAMP, ReservedFields.now());

            final byte[] payload = codec.encode(job.registration(), topic, job.validation().apply(data));
            final long sentNs = System.nanoTime();
            return driver.await(bridge.publish(topic.wireName(), payload)).thenApply(md -> {
                seqNum = next;
                metrics.counter(METRIC_PUBLISHED);
                metrics.timer(METRIC_ACK_LATENCY, Duration.ofNanos(System.nanoTime() - sentNs));
                if (log.isTraceEnabled()) {
                    log.trace("Acked seq={} topic={} off={}", next, md.topic(), md.offset());
                }
                return seqNum < job.count();
            });
        }
    }
}
