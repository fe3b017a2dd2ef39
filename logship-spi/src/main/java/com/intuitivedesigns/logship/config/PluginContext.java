/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.config;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The host-allocated context of one output plugin instance.
 *
 * <p>Gives the instance its own configuration options and carries the
 * registry identifier assigned at init time, so later flush calls on the same
 * context resolve to the same instance.</p>
 */
public final class PluginContext {

    private final String name;
    private final ShipperConfig config;
    private final String prefix;

    // Written once by init, read by every flush on any thread
    private volatile int instanceId = -1;

    private PluginContext(String name, ShipperConfig config, String prefix) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.prefix = prefix;
    }

    /**
     * Options for the output named {@code name} live under {@code output.<name>.}.
     */
    public static PluginContext forOutput(String name, ShipperConfig config) {
        return new PluginContext(name, config, "output." + name + ".");
    }

    /**
     * Options are the bare keys of the map, e.g. {@code stream=my-stream}.
     */
    public static PluginContext of(String name, Map<String, String> options) {
        return new PluginContext(name, ShipperConfig.fromMap(options), "");
    }

    public String name() {
        return name;
    }

    /**
     * Returns the option value, or the empty string when the option is not set.
     */
    public String configValue(String key) {
        final String v = config.getString(prefix + key, null);
        return v == null ? "" : v.trim();
    }

    public void attachInstance(int id) {
        if (id < 0) throw new IllegalArgumentException("instance id must be >= 0");
        this.instanceId = id;
    }

    public OptionalInt instanceId() {
        final int id = instanceId;
        return id < 0 ? OptionalInt.empty() : OptionalInt.of(id);
    }

    @Override
    public String toString() {
        return "PluginContext{name='" + name + "', instanceId=" + instanceId + '}';
    }
}
