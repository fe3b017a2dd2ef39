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

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Shared fixtures for core tests.
 */
final class OutputFixtures {

    private OutputFixtures() {}

    static PluginContext context(String name) {
        return PluginContext.of(name, Map.of("stream", "logs", "region", "us-east-1", "delivery", "TEST"));
    }

    static OutputInstance instance(int id, DeliveryAdapter<?> adapter) throws ConfigurationException {
        return new OutputInstance(id, OutputSettings.from(context("out-" + id), id), adapter);
    }

    static NormalizedBatch batch(String... messages) {
        final List<LogRecord> records = new ArrayList<>();
        boolean allValid = true;
        for (String m : messages) {
            if (m == null) {
                allValid = false;
                records.add(new LogRecord(null, Instant.EPOCH, false));
            } else {
                final Map<String, Object> fields = new HashMap<>();
                fields.put("msg", m);
                records.add(new LogRecord(fields, Instant.EPOCH, true));
            }
        }
        return new NormalizedBatch(records, allValid);
    }

    /** A plugin with id TEST that hands out adapters from {@code adapters}. */
    static DeliveryPlugin plugin(Supplier<DeliveryAdapter<?>> adapters) {
        return new DeliveryPlugin() {
            @Override
            public String id() {
                return "TEST";
            }

            @Override
            public DeliveryAdapter<?> create(OutputSettings settings, MetricsRuntime metrics) {
                return adapters.get();
            }
        };
    }
}
