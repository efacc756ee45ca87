/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.core;

import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;

/**
 * One structured-record technology. Resolved once at startup, then bound to a topic.
 */
public interface Materializer {

    String id();

    TopicMaterializer forTopic(TopicDescriptor topic);
}
