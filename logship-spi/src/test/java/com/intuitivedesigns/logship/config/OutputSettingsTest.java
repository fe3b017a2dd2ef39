/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.config;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputSettingsTest {

    private static Map<String, String> base() {
        Map<String, String> m = new HashMap<>();
        m.put("stream", "app-logs");
        m.put("region", "eu-west-1");
        return m;
    }

    private static OutputSettings settings(Map<String, String> options) throws ConfigurationException {
        return OutputSettings.from(PluginContext.of("out", options), 3);
    }

    @Test
    void testDefaults() throws Exception {
        OutputSettings s = settings(base());

        assertEquals(3, s.instanceId());
        assertEquals("app-logs", s.stream());
        assertEquals("eu-west-1", s.region());
        assertEquals(List.of(), s.dataKeys());
        assertFalse(s.hasPartitionKey());
        assertFalse(s.appendNewline());
        assertNull(s.endpoint());
        assertEquals("", s.timeKey());
        assertEquals(OutputSettings.DEFAULT_TIME_KEY_FORMAT, s.timeKeyFormat());
        assertEquals(OutputSettings.DEFAULT_DELIVERY, s.delivery());
    }

    @Test
    void testStreamAndRegionAreRequired() {
        Map<String, String> noStream = base();
        noStream.remove("stream");
        Map<String, String> noRegion = base();
        noRegion.put("region", "   ");

        assertThrows(ConfigurationException.class, () -> settings(noStream));
        assertThrows(ConfigurationException.class, () -> settings(noRegion));
    }

    @Test
    void testLogIsRejectedAsPartitionKey() throws Exception {
        Map<String, String> m = base();
        m.put("partition_key", "log");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> settings(m));
        assertTrue(e.getMessage().contains("partition key"));

        m.put("partition_key", "kubernetes->pod_name");
        assertEquals("kubernetes->pod_name", settings(m).partitionKey());
    }

    @Test
    void testAppendNewlineIsCaseInsensitiveTrue() throws Exception {
        Map<String, String> m = base();

        m.put("append_newline", "TrUe");
        assertTrue(settings(m).appendNewline());

        m.put("append_newline", "yes");
        assertFalse(settings(m).appendNewline());

        m.put("append_newline", "1");
        assertFalse(settings(m).appendNewline());
    }

    @Test
    void testDataKeysAreSplitAndTrimmed() throws Exception {
        Map<String, String> m = base();
        m.put("data_keys", "log, level,,host ");

        assertEquals(List.of("log", "level", "host"), settings(m).dataKeys());
    }

    @Test
    void testEndpointMustBeAbsolute() throws Exception {
        Map<String, String> m = base();
        m.put("endpoint", "http://localhost:4566");
        assertEquals(URI.create("http://localhost:4566"), settings(m).endpoint());

        m.put("endpoint", "localhost");
        assertThrows(ConfigurationException.class, () -> settings(m));

        m.put("endpoint", "http://bad host");
        assertThrows(ConfigurationException.class, () -> settings(m));
    }

    @Test
    void testAdapterOptionsPassThrough() throws Exception {
        Map<String, String> m = base();
        m.put("log_level", "debug");
        m.put("delivery", "LOG");

        OutputSettings s = settings(m);
        assertEquals("debug", s.option("log_level"));
        assertEquals("", s.option("missing"));
        assertEquals("LOG", s.delivery());
    }

    @Test
    void testOptionsFromPrefixedConfig() throws Exception {
        ShipperConfig config = ShipperConfig.fromMap(Map.of(
                "output.main.stream", "s",
                "output.main.region", "us-east-1",
                "output.other.stream", "ignored"));

        OutputSettings s = OutputSettings.from(PluginContext.forOutput("main", config), 0);

        assertEquals("s", s.stream());
        assertEquals("us-east-1", s.region());
    }
}
