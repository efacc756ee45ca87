/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.app;

import com.intuitivedesigns.telemetrybench.catalog.ComponentCatalog;
import com.intuitivedesigns.telemetrybench.catalog.ResourceComponentCatalog;
import com.intuitivedesigns.telemetrybench.codec.AvroWireCodec;
import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.driver.CooperativeDriver;
import com.intuitivedesigns.telemetrybench.kafka.KafkaClients;
import com.intuitivedesigns.telemetrybench.kafka.admin.BrokerAdmin;
import com.intuitivedesigns.telemetrybench.kafka.admin.TopicProvisioner;
import com.intuitivedesigns.telemetrybench.materialize.Materializers;
import com.intuitivedesigns.telemetrybench.metrics.MetricsFactory;
import com.intuitivedesigns.telemetrybench.metrics.MetricsRuntime;
import com.intuitivedesigns.telemetrybench.metrics.MetricsSettings;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistrar;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistration;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistries;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Process-wide services shared by the writer and the reader: configuration, metrics, metadata,
 * schema registry, codec and the cooperative driver.
 */
final class BenchRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BenchRuntime.class);

    static final String CFG_EXIT_DELAY_MS = "driver.exit.delay.ms";
    private static final long DEFAULT_EXIT_DELAY_MS = 1000L;

    final BenchConfig config;
    final MetricsRuntime metrics;
    final ComponentCatalog catalog;
    final SchemaRegistry registry;
    final AvroWireCodec codec;
    final Materializers materializers;
    final CooperativeDriver driver;

    private BenchRuntime(BenchConfig config, String driverName) {
        this.config = config;
        this.metrics = MetricsFactory.init(MetricsSettings.from(config));
        this.catalog = new ResourceComponentCatalog(config);
        this.registry = SchemaRegistries.fromConfig(config, metrics);
        this.codec = new AvroWireCodec(registry);
        this.materializers = Materializers.load(config, metrics);
        this.driver = new CooperativeDriver(driverName);
    }

    static BenchRuntime start(String driverName) {
        return new BenchRuntime(BenchConfig.get(), driverName);
    }

    Map<String, SchemaRegistration> register(List<TopicDescriptor> topics) {
        final SchemaRegistrar registrar = new SchemaRegistrar(registry);
        return driver.run(() -> driver.await(registrar.registerAll(topics)));
    }

    SortedSet<String> provision(List<TopicDescriptor> topics, int partitions) {
        final List<String> names = new ArrayList<>(topics.size());
        for (TopicDescriptor t : topics) names.add(t.wireName());

        try (BrokerAdmin admin = KafkaClients.newAdmin(config)) {
            final TopicProvisioner provisioner = new TopicProvisioner(admin, KafkaClients.replicationFactor(config));
            final SortedSet<String> created = driver.run(() -> driver.await(provisioner.provision(names, partitions)));
            if (!created.isEmpty()) {
                log.info("Created topics: {}", created);
            }
            return created;
        }
    }

    /** Lets a concurrently running reader drain before the process exits. */
    void exitDelay() {
        final Duration delay = Duration.ofMillis(config.getLong(CFG_EXIT_DELAY_MS, DEFAULT_EXIT_DELAY_MS));
        driver.run(() -> driver.sleep(delay));
    }

    @Override
    public void close() {
        driver.close();
        registry.close();
        metrics.close();
    }
}
