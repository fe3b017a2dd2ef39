/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import com.intuitivedesigns.logship.config.ShipperConfig;
import io.micrometer.core.instrument.Tags;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable configuration of the metrics runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    public static final String KEY_PROVIDER = "metrics.provider";
    public static final String KEY_TAG_PREFIX = "metrics.tag.";
    public static final String KEY_PROM_PORT = "metrics.prometheus.port";

    // ---- Defaults ----
    public static final String DEFAULT_PROVIDER = "NONE";
    public static final int DEFAULT_PROM_PORT = 9090;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(ShipperConfig config) {
        Objects.requireNonNull(config, "config");

        final String raw = config.getString(KEY_PROVIDER, DEFAULT_PROVIDER);
        final String provider = (raw == null || raw.isBlank())
                ? DEFAULT_PROVIDER
                : raw.trim().toUpperCase(Locale.ROOT);

        // metrics.tag.<name>=<value>
        final Map<String, String> tags = new TreeMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;
            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = config.getString(k, "").trim();
            if (tagKey.isEmpty() || value.isEmpty()) continue;
            tags.put(tagKey, value);
        }

        final int port = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 1, 65_535);

        return new MetricsSettings(provider, Collections.unmodifiableMap(tags), port);
    }

    /**
     * The {@code metrics.tag.*} entries as Micrometer common tags.
     */
    public Tags tags() {
        Tags out = Tags.empty();
        for (Map.Entry<String, String> e : commonTags.entrySet()) {
            out = out.and(e.getKey(), e.getValue());
        }
        return out;
    }

    public boolean disabled() {
        return "NONE".equals(providerId) || "NOOP".equals(providerId);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                '}';
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
