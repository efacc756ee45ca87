/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.model;

import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A component and its topics, keyed by logical name. Read-only after construction.
 */
public record ComponentDescriptor(
        String name,
        boolean indexed,
        Map<String, TopicDescriptor> topics
) {

    public ComponentDescriptor {
        Objects.requireNonNull(name, "name");
        topics = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(topics, "topics")));
    }

    /**
     * @throws ConfigurationException if the component has no topic named {@code logicalName}
     */
    public TopicDescriptor topic(String logicalName) {
        final TopicDescriptor t = topics.get(logicalName);
        if (t == null) {
            throw new ConfigurationException("Unknown topic '" + logicalName + "' for component " + name
                    + ". Available topics: " + topics.keySet());
        }
        return t;
    }

    public List<TopicDescriptor> topics(List<String> logicalNames) {
        final List<TopicDescriptor> out = new ArrayList<>(logicalNames.size());
        for (String n : logicalNames) out.add(topic(n));
        return out;
    }
}
