/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import com.intuitivedesigns.logship.config.ConfigurationException;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;

/**
 * SPI definition for delivery adapters (remote destinations).
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and
 * registered in {@code META-INF/services/com.intuitivedesigns.logship.spi.DeliveryPlugin}.</p>
 */
public interface DeliveryPlugin extends ServicePlugin {

    /**
     * Builds the adapter for one validated output instance.
     *
     * @throws ConfigurationException if the settings cannot be honored by this adapter
     */
    DeliveryAdapter<?> create(OutputSettings settings, MetricsRuntime metrics) throws ConfigurationException;
}
