/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.plugins;

import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.RequestBuffer;
import com.intuitivedesigns.logship.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogDeliveryPluginTest {

    private static OutputSettings settings(Map<String, String> options) throws Exception {
        return OutputSettings.from(PluginContext.of("dev", options), 0);
    }

    @Test
    void testDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<DeliveryPlugin> registry = new ServicePluginRegistry<>(DeliveryPlugin.class);

        assertInstanceOf(LogDeliveryPlugin.class, registry.require("log", "delivery"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFlushLogsCountsAndClears() throws Exception {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        DeliveryAdapter<String> adapter = (DeliveryAdapter<String>) new LogDeliveryPlugin().create(
                settings(Map.of("stream", "s", "region", "r", "delivery", "LOG", "log_max_chars", "10")), metrics);
        RequestBuffer<String> buffer = new RequestBuffer<>(adapter.maxRecordsPerRequest());

        assertEquals(FlushOutcome.OK, adapter.addRecord(buffer, Map.of("log", "a fairly long message"), Instant.EPOCH));
        assertEquals(FlushOutcome.OK, adapter.addRecord(buffer, Map.of("log", "b"), Instant.EPOCH));
        assertTrue(buffer.entries().get(0).endsWith("... [TRUNCATED]"));

        assertEquals(FlushOutcome.OK, adapter.flush(buffer));

        assertTrue(buffer.isEmpty());
        assertEquals(2.0, metrics.registry().get(LogDeliveryPlugin.METRIC_DELIVERED).counter().count());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUnserializableRecordIsError() throws Exception {
        DeliveryAdapter<String> adapter = (DeliveryAdapter<String>) new LogDeliveryPlugin().create(
                settings(Map.of("stream", "s", "region", "r", "log_level", "off")), null);

        assertEquals(FlushOutcome.ERROR,
                adapter.addRecord(new RequestBuffer<>(1), Map.of("bad", new Object()), Instant.EPOCH));
    }
}
