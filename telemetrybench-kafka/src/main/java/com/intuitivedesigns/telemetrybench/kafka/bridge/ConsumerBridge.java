/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.bridge;

import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.MessageException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.intuitivedesigns.telemetrybench.kafka.bridge.WorkerThreads.closeClient;

/**
 * Gives the driver a non-blocking view of a Kafka consumer.
 *
 * <p>{@link #read} hands a "poll until the next record" loop to the bridge's single worker thread.
 * Only one read may be outstanding. Records from one poll batch are buffered (on the worker) and
 * served by subsequent reads in order.</p>
 */
public final class ConsumerBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerBridge.class);

    private final Consumer<String, byte[]> consumer;
    private final Duration pollTimeout;
    private final ExecutorService worker;
    private final String name;

    private final AtomicBoolean reading = new AtomicBoolean(false);
    private volatile boolean closed;

    // Worker-confined
    private final Deque<ConsumerRecord<String, byte[]>> buffered = new ArrayDeque<>();

    public ConsumerBridge(Consumer<String, byte[]> consumer, Duration pollTimeout, String name) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.name = Objects.requireNonNull(name, "name");
        this.worker = WorkerThreads.single(name);
    }

    /**
     * Subscribes on the worker thread. On assignment each partition is positioned by a
     * {@link HistoryPositioner}.
     */
    public CompletableFuture<Void> subscribe(Collection<String> topics, long maxHistoryRead) {
        final List<String> names = new ArrayList<>(topics);
        final HistoryPositioner positioner = new HistoryPositioner(consumer, maxHistoryRead);
        try {
            return CompletableFuture.runAsync(() -> {
                consumer.subscribe(names, positioner);
                log.info("Subscribed to {} (maxHistoryRead={})", names, maxHistoryRead);
            }, worker);
        } catch (RejectedExecutionException e) {
            return Futures.failed(new MessageException("Consumer bridge " + name + " is closed", e));
        }
    }

    /**
     * @return the next record; fails with {@link MessageException} when polling fails, the record
     *         carries no value or the bridge is closed
     * @throws IllegalStateException if a previous read has not completed yet
     */
    public CompletableFuture<BrokerMessage> read() {
        if (!reading.compareAndSet(false, true)) {
            throw new IllegalStateException("A read is already outstanding on " + name);
        }
        final CompletableFuture<BrokerMessage> next = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                final BrokerMessage message;
                try {
                    message = nextRecord();
                } catch (RuntimeException e) {
                    reading.set(false);
                    next.completeExceptionally(e);
                    return;
                }
                reading.set(false);
                next.complete(message);
            });
        } catch (RejectedExecutionException e) {
            reading.set(false);
            next.completeExceptionally(new MessageException("Consumer bridge " + name + " is closed", e));
        }
        return next;
    }

    private BrokerMessage nextRecord() {
        while (true) {
            final ConsumerRecord<String, byte[]> r = buffered.pollFirst();
            if (r != null) {
                if (r.value() == null) {
                    throw new MessageException("Record without value at " + r.topic() + "-" + r.partition() + "@" + r.offset());
                }
                return new BrokerMessage(r.topic(), r.partition(), r.offset(), r.value(), r.timestamp());
            }
            if (closed) {
                throw new MessageException("Consumer bridge " + name + " is closed");
            }
            final ConsumerRecords<String, byte[]> batch;
            try {
                batch = consumer.poll(pollTimeout);
            } catch (WakeupException e) {
                throw new MessageException("Read interrupted: consumer bridge " + name + " is closing", e);
            } catch (RuntimeException e) {
                throw new MessageException("Poll failed on " + name + ": " + e.getMessage(), e);
            }
            for (ConsumerRecord<String, byte[]> rec : batch) {
                buffered.addLast(rec);
            }
        }
    }

    @Override
    public void close() {
        log.info("Closing consumer bridge {}...", name);
        closed = true;
        consumer.wakeup();
        try {
            worker.execute(() -> closeClient(() -> consumer.close(Duration.ofSeconds(5)), name));
        } catch (RejectedExecutionException e) {
            log.debug("Consumer bridge {} already closed", name);
        }
        WorkerThreads.stop(worker, name);
    }
}
