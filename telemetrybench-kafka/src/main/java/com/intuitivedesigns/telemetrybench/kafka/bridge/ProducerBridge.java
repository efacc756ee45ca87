/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

import com.intuitivedesigns.telemetrybench.errors.DeliveryException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static com.intuitivedesigns.telemetrybench.kafka.bridge.WorkerThreads.closeClient;

/**
 * Gives the driver a non-blocking view of a Kafka producer.
 *
 * <p>{@link #publish} returns a future that the delivery callback resolves directly; the
 * {@code send} and the {@code flush} that forces the delivery both run on the bridge's own worker
 * thread, which is the only thread that ever touches the producer.</p>
 */
public final class ProducerBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProducerBridge.class);

    private final Producer<String, byte[]> producer;
    private final ExecutorService worker;
    private final String name;

    public ProducerBridge(Producer<String, byte[]> producer, String name) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.name = Objects.requireNonNull(name, "name");
        this.worker = WorkerThreads.single(name);
    }

    /**
     * @return completes with the broker's metadata once the record is acknowledged; fails with
     *         {@link DeliveryException}
     */
    public CompletableFuture<RecordMetadata> publish(String topic, byte[] value) {
        Objects.requireNonNull(topic, "topic");
        final CompletableFuture<RecordMetadata> delivered = new CompletableFuture<>();
        final ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, value);
        try {
            worker.execute(() -> {
                try {
                    producer.send(record, (md, ex) -> {
                        if (ex != null) {
                            delivered.completeExceptionally(new DeliveryException(topic, ex));
                        } else {
                            delivered.complete(md);
                        }
                    });
                    producer.flush();
                } catch (RuntimeException e) {
                    delivered.completeExceptionally(new DeliveryException(topic, e));
                }
            });
        } catch (RejectedExecutionException e) {
            delivered.completeExceptionally(new DeliveryException(topic, e));
        }
        return delivered;
    }

    @Override
    public void close() {
        log.info("Closing producer bridge {}...", name);
        try {
            worker.execute(() -> closeClient(() -> producer.close(Duration.ofSeconds(5)), name));
        } catch (RejectedExecutionException e) {
            log.debug("Producer bridge {} already closed", name);
        }
        WorkerThreads.stop(worker, name);
    }
}
