/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.kafka.admin;

import com.intuitivedesigns.telemetrybench.errors.ProvisioningException;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class TopicProvisionerTest {

    private static final String SCALARS = "lsst.sal.Test.evt_scalars";
    private static final String ARRAYS = "lsst.sal.Test.evt_arrays";
    private static final String TELEMETRY = "lsst.sal.Test.tel_scalars";

    private final FakeBrokerAdmin admin = new FakeBrokerAdmin();
    private final TopicProvisioner provisioner = new TopicProvisioner(admin, (short) 1);

    @Test
    void testCreatesOnlyMissingTopicsInSortedOrder() {
        admin.existing.add(ARRAYS);

        SortedSet<String> created = provisioner.provision(List.of(TELEMETRY, SCALARS, ARRAYS), 3).join();

        assertEquals(List.of(SCALARS, TELEMETRY), List.copyOf(created));
        assertEquals(List.of(SCALARS, TELEMETRY), admin.createRequests.stream().map(NewTopic::name).toList());
        for (NewTopic t : admin.createRequests) {
            assertEquals(3, t.numPartitions());
            assertEquals(Optional.of((short) 1), t.replicationFactor());
        }
        assertTrue(admin.described.contains(TopicProvisioner.SENTINEL_TOPIC));
    }

    @Test
    void testSecondRunCreatesNothing() {
        provisioner.provision(List.of(SCALARS, ARRAYS), 1).join();
        int requests = admin.createRequests.size();

        SortedSet<String> created = provisioner.provision(List.of(SCALARS, ARRAYS), 1).join();

        assertTrue(created.isEmpty());
        assertEquals(requests, admin.createRequests.size());
        assertEquals(Set.of(SCALARS, ARRAYS), admin.existing);
    }

    @Test
    void testTopicCreatedConcurrentlyCountsAsProvisioned() {
        admin.createFailures.put(SCALARS, new TopicExistsException("Topic '" + SCALARS + "' already exists."));

        SortedSet<String> created = provisioner.provision(List.of(SCALARS), 1).join();

        assertEquals(Set.of(SCALARS), created);
    }

    @Test
    void testCreationFailureNamesTheTopic() {
        admin.createFailures.put(TELEMETRY, new TopicAuthorizationException(Set.of(TELEMETRY)));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> provisioner.provision(List.of(SCALARS, TELEMETRY), 1).join());

        ProvisioningException pe = assertInstanceOf(ProvisioningException.class, ex.getCause());
        assertEquals(TELEMETRY, pe.topic());
    }

    @Test
    void testDescribeFailuresDoNotBlockProvisioning() {
        admin.describeFailures.put(SCALARS, new TopicAuthorizationException(Set.of(SCALARS)));

        SortedSet<String> created = provisioner.provision(List.of(SCALARS), 1).join();

        assertEquals(Set.of(SCALARS), created);
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TopicProvisioner(admin, (short) 0));
        assertThrows(IllegalArgumentException.class, () -> provisioner.provision(List.of(SCALARS), 0));
    }
}
