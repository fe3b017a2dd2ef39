/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Process-wide configuration.
 * Loads from -Dlogship.config.path or ENV 'LOGSHIP_CONFIG_PATH'.
 */
public final class ShipperConfig {

    private static final Logger log = LoggerFactory.getLogger(ShipperConfig.class);

    public static final String PROP_CONFIG_PATH = "logship.config.path";
    public static final String ENV_CONFIG_PATH = "LOGSHIP_CONFIG_PATH";

    private final Properties props;

    private ShipperConfig(Properties props) {
        this.props = props;
    }

    public static ShipperConfig load() {
        // 1. System property first (-Dlogship.config.path)
        String path = System.getProperty(PROP_CONFIG_PATH);

        // 2. Fallback to environment variable
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/logship.properties", PROP_CONFIG_PATH);
            return new ShipperConfig(new Properties());
        }
        return load(Path.of(path));
    }

    public static ShipperConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        final Properties props = new Properties();
        log.info("Loading configuration from: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            props.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties.", props.size());
        return new ShipperConfig(props);
    }

    public static ShipperConfig fromMap(Map<String, String> source) {
        final Properties props = new Properties();
        if (source != null) {
            source.forEach((k, v) -> {
                if (k != null && v != null) props.setProperty(k, v);
            });
        }
        return new ShipperConfig(props);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
