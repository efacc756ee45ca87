/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.catalog;

import com.intuitivedesigns.telemetrybench.model.ComponentDescriptor;

/**
 * Source of component and topic metadata.
 */
public interface ComponentCatalog {

    /**
     * @throws com.intuitivedesigns.telemetrybench.errors.ConfigurationException if the component is unknown
     *         or its definition cannot be parsed
     */
    ComponentDescriptor load(String componentName);
}
