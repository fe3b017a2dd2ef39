/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable, validated configuration of one output plugin instance.
 */
public final class OutputSettings {

    private static final Logger log = LoggerFactory.getLogger(OutputSettings.class);

    // ---- Option names ----
    public static final String OPT_STREAM = "stream";
    public static final String OPT_REGION = "region";
    public static final String OPT_DATA_KEYS = "data_keys";
    public static final String OPT_PARTITION_KEY = "partition_key";
    public static final String OPT_ROLE_ARN = "role_arn";
    public static final String OPT_ENDPOINT = "endpoint";
    public static final String OPT_APPEND_NEWLINE = "append_newline";
    public static final String OPT_TIME_KEY = "time_key";
    public static final String OPT_TIME_KEY_FORMAT = "time_key_format";
    public static final String OPT_DELIVERY = "delivery";

    // ---- Defaults ----
    public static final String DEFAULT_TIME_KEY_FORMAT = "%Y-%m-%dT%H:%M:%S";
    public static final String DEFAULT_DELIVERY = "KINESIS";

    /** The record's own payload field; routing on it would spread every record randomly. */
    private static final String RESERVED_PARTITION_KEY = "log";

    private final int instanceId;
    private final String stream;
    private final String region;
    private final List<String> dataKeys;
    private final String partitionKey;
    private final String roleArn;
    private final URI endpoint;
    private final boolean appendNewline;
    private final String timeKey;
    private final String timeKeyFormat;
    private final String delivery;
    private final PluginContext context;

    private OutputSettings(Builder b) {
        this.instanceId = b.instanceId;
        this.stream = b.stream;
        this.region = b.region;
        this.dataKeys = b.dataKeys;
        this.partitionKey = b.partitionKey;
        this.roleArn = b.roleArn;
        this.endpoint = b.endpoint;
        this.appendNewline = b.appendNewline;
        this.timeKey = b.timeKey;
        this.timeKeyFormat = b.timeKeyFormat;
        this.delivery = b.delivery;
        this.context = b.context;
    }

    /**
     * Reads and validates every recognized option from the instance context.
     *
     * @throws ConfigurationException if stream or region is missing, the partition
     *                                key is reserved, or the endpoint is not a URI
     */
    public static OutputSettings from(PluginContext context, int instanceId) throws ConfigurationException {
        Objects.requireNonNull(context, "context");

        final String stream = param(context, instanceId, OPT_STREAM);
        final String region = param(context, instanceId, OPT_REGION);
        final String dataKeys = param(context, instanceId, OPT_DATA_KEYS);
        final String partitionKey = param(context, instanceId, OPT_PARTITION_KEY);
        final String roleArn = param(context, instanceId, OPT_ROLE_ARN);
        final String endpoint = param(context, instanceId, OPT_ENDPOINT);
        final String appendNewline = param(context, instanceId, OPT_APPEND_NEWLINE);
        final String timeKey = param(context, instanceId, OPT_TIME_KEY);
        final String timeKeyFormat = param(context, instanceId, OPT_TIME_KEY_FORMAT);
        final String delivery = context.configValue(OPT_DELIVERY);

        if (stream.isEmpty() || region.isEmpty()) {
            throw new ConfigurationException(
                    "[kinesis " + instanceId + "] stream and region are required configuration parameters");
        }

        if (RESERVED_PARTITION_KEY.equals(partitionKey)) {
            throw new ConfigurationException(
                    "[kinesis " + instanceId + "] '" + RESERVED_PARTITION_KEY + "' cannot be set as the partition key");
        }

        if (partitionKey.isEmpty()) {
            log.info("[kinesis {}] no partition key provided. A random one will be generated.", instanceId);
        }

        if (timeKey.isEmpty() && !timeKeyFormat.isEmpty()) {
            log.warn("[kinesis {}] time_key_format is set without time_key; it will be ignored", instanceId);
        }

        final Builder b = new Builder();
        b.instanceId = instanceId;
        b.stream = stream;
        b.region = region;
        b.dataKeys = splitKeys(dataKeys);
        b.partitionKey = partitionKey;
        b.roleArn = roleArn;
        b.endpoint = parseEndpoint(endpoint, instanceId);
        b.appendNewline = "true".equals(appendNewline.toLowerCase(Locale.ROOT));
        b.timeKey = timeKey;
        b.timeKeyFormat = timeKeyFormat.isEmpty() ? DEFAULT_TIME_KEY_FORMAT : timeKeyFormat;
        b.delivery = delivery.isEmpty() ? DEFAULT_DELIVERY : delivery;
        b.context = context;
        return new OutputSettings(b);
    }

    // --- Accessors ---

    public int instanceId() { return instanceId; }

    public String stream() { return stream; }

    public String region() { return region; }

    /** Top-level keys to forward; empty means forward everything. */
    public List<String> dataKeys() { return dataKeys; }

    /** Empty means a random key per record. */
    public String partitionKey() { return partitionKey; }

    public boolean hasPartitionKey() { return !partitionKey.isEmpty(); }

    /** Empty means the default credential chain. */
    public String roleArn() { return roleArn; }

    /** Null unless an endpoint override was configured. */
    public URI endpoint() { return endpoint; }

    public boolean appendNewline() { return appendNewline; }

    /** Empty means no time field is injected. */
    public String timeKey() { return timeKey; }

    public String timeKeyFormat() { return timeKeyFormat; }

    /** Id of the {@code DeliveryPlugin} that serves this instance. */
    public String delivery() { return delivery; }

    /**
     * Adapter-specific option of this instance, empty when unset.
     */
    public String option(String key) {
        return context.configValue(key);
    }

    @Override
    public String toString() {
        return "OutputSettings{" +
                "instanceId=" + instanceId +
                ", stream='" + stream + '\'' +
                ", region='" + region + '\'' +
                ", dataKeys=" + dataKeys +
                ", partitionKey='" + partitionKey + '\'' +
                ", roleArn='" + roleArn + '\'' +
                ", endpoint=" + endpoint +
                ", appendNewline=" + appendNewline +
                ", timeKey='" + timeKey + '\'' +
                ", timeKeyFormat='" + timeKeyFormat + '\'' +
                ", delivery='" + delivery + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String param(PluginContext context, int instanceId, String key) {
        final String v = context.configValue(key);
        log.info("[kinesis {}] plugin parameter {} = '{}'", instanceId, key, v);
        return v;
    }

    private static List<String> splitKeys(String raw) {
        if (raw.isEmpty()) return List.of();
        final List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            final String k = part.trim();
            if (!k.isEmpty()) out.add(k);
        }
        return Collections.unmodifiableList(out);
    }

    private static URI parseEndpoint(String raw, int instanceId) throws ConfigurationException {
        if (raw.isEmpty()) return null;
        try {
            final URI uri = new URI(raw);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException(
                        "[kinesis " + instanceId + "] endpoint must be an absolute URI with a host: '" + raw + "'");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("[kinesis " + instanceId + "] invalid endpoint '" + raw + "'", e);
        }
    }

    private static final class Builder {
        int instanceId;
        String stream;
        String region;
        List<String> dataKeys;
        String partitionKey;
        String roleArn;
        URI endpoint;
        boolean appendNewline;
        String timeKey;
        String timeKeyFormat;
        String delivery;
        PluginContext context;
    }
}
