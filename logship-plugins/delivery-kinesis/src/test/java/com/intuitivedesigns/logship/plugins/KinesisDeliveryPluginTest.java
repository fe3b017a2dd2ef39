/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.plugins;

import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.output.KinesisDelivery;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KinesisDeliveryPluginTest {

    @Test
    void testDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<DeliveryPlugin> registry = new ServicePluginRegistry<>(DeliveryPlugin.class);

        DeliveryPlugin plugin = registry.require(OutputSettings.DEFAULT_DELIVERY, "delivery");
        assertInstanceOf(KinesisDeliveryPlugin.class, plugin);
    }

    @Test
    void testBuildsAdapterWithEndpointOverride() throws Exception {
        OutputSettings settings = OutputSettings.from(PluginContext.of("local", Map.of(
                "stream", "app-logs",
                "region", "us-east-1",
                "endpoint", "http://localhost:4566")), 0);

        DeliveryAdapter<?> adapter = new KinesisDeliveryPlugin().create(settings, null);
        try {
            assertInstanceOf(KinesisDelivery.class, adapter);
            assertEquals(KinesisDelivery.MAX_RECORDS_PER_REQUEST, adapter.maxRecordsPerRequest());
            assertEquals("KINESIS:app-logs", adapter.id());
        } finally {
            adapter.close();
        }
    }

    @Test
    void testBuildsAdapterWithAssumedRole() throws Exception {
        OutputSettings settings = OutputSettings.from(PluginContext.of("role", Map.of(
                "stream", "app-logs",
                "region", "eu-central-1",
                "role_arn", "arn:aws:iam::123456789012:role/log-writer")), 1);

        DeliveryAdapter<?> adapter = new KinesisDeliveryPlugin().create(settings, null);
        try {
            assertInstanceOf(KinesisDelivery.class, adapter);
        } finally {
            adapter.close();
        }
    }
}
