/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.intuitivedesigns.logship.config.ConfigurationException;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One configured output plugin instance: validated settings plus the delivery
 * adapter built for them. Never mutated after construction.
 */
public final class OutputInstance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OutputInstance.class);

    private final int id;
    private final OutputSettings settings;
    private final DeliveryAdapter<?> adapter;

    public OutputInstance(int id, OutputSettings settings, DeliveryAdapter<?> adapter) {
        if (id < 0) throw new IllegalArgumentException("id must be >= 0");
        this.id = id;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    /**
     * Validates the context's options and builds the adapter of the selected delivery plugin.
     *
     * @throws ConfigurationException if validation fails or no such delivery plugin exists
     */
    public static OutputInstance create(int id,
                                        PluginContext context,
                                        ServicePluginRegistry<DeliveryPlugin> deliveries,
                                        MetricsRuntime metrics) throws ConfigurationException {
        Objects.requireNonNull(deliveries, "deliveries");
        final OutputSettings settings = OutputSettings.from(context, id);

        final DeliveryPlugin plugin = deliveries.get(settings.delivery())
                .orElseThrow(() -> new ConfigurationException("[kinesis " + id + "] no delivery plugin '"
                        + settings.delivery() + "'. Available options: " + deliveries.availableIds()));

        final DeliveryAdapter<?> adapter;
        try {
            adapter = plugin.create(settings, metrics == null ? MetricsRuntime.noop() : metrics);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("[kinesis " + id + "] failed creating delivery adapter [" + plugin.id() + "]", e);
        }
        if (adapter == null) {
            throw new ConfigurationException("[kinesis " + id + "] delivery plugin [" + plugin.id() + "] returned no adapter");
        }

        log.info("[kinesis {}] instance ready: stream='{}' region='{}' delivery={}",
                id, settings.stream(), settings.region(), adapter.id());
        return new OutputInstance(id, settings, adapter);
    }

    public int id() {
        return id;
    }

    public OutputSettings settings() {
        return settings;
    }

    public DeliveryAdapter<?> adapter() {
        return adapter;
    }

    @Override
    public void close() {
        try {
            adapter.close();
        } catch (Exception e) {
            log.warn("[kinesis {}] error closing delivery adapter", id, e);
        }
    }
}
