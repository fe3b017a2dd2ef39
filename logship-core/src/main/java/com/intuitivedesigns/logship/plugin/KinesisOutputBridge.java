/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.plugin;

import com.intuitivedesigns.logship.config.ConfigurationException;
import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.config.ShipperConfig;
import com.intuitivedesigns.logship.core.FlushDispatcher;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.FlushReport;
import com.intuitivedesigns.logship.core.HostRuntime;
import com.intuitivedesigns.logship.core.InstanceRegistry;
import com.intuitivedesigns.logship.core.NormalizedBatch;
import com.intuitivedesigns.logship.core.OutputInstance;
import com.intuitivedesigns.logship.core.RawBatch;
import com.intuitivedesigns.logship.core.RecordNormalizer;
import com.intuitivedesigns.logship.decode.JsonBatchDecoder;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The host-facing entry points of the output plugin: register, init, flush, exit.
 *
 * <p>Owns the instance registry and the flush dispatcher. Every call returns a
 * {@link FlushOutcome}; nothing thrown inside crosses back to the host.</p>
 */
public final class KinesisOutputBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KinesisOutputBridge.class);

    public static final String PLUGIN_NAME = "kinesis";
    public static final String PLUGIN_DESCRIPTION = "Amazon Kinesis Data Streams output plugin.";

    // Config keys
    public static final String CFG_DRAIN_TIMEOUT_MS = "flush.drain.timeout.ms";

    // Defaults
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 10_000L;

    private final InstanceRegistry registry;
    private final RecordNormalizer normalizer;
    private final FlushDispatcher dispatcher;
    private final ServicePluginRegistry<DeliveryPlugin> deliveries;
    private final MetricsRuntime metrics;
    private final Duration drainTimeout;

    private final AtomicBoolean registered = new AtomicBoolean(false);
    private final AtomicBoolean exited = new AtomicBoolean(false);

    public KinesisOutputBridge(InstanceRegistry registry,
                               RecordNormalizer normalizer,
                               FlushDispatcher dispatcher,
                               ServicePluginRegistry<DeliveryPlugin> deliveries,
                               MetricsRuntime metrics,
                               Duration drainTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.deliveries = Objects.requireNonNull(deliveries, "deliveries");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    }

    /**
     * Wires the default collaborators: delivery plugins from the classpath and the JSON Lines decoder.
     */
    public static KinesisOutputBridge fromConfig(ShipperConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final InstanceRegistry registry = new InstanceRegistry();
        final ServicePluginRegistry<DeliveryPlugin> deliveries = new ServicePluginRegistry<>(DeliveryPlugin.class);
        log.info("Delivery plugins available: {}", deliveries.availableIds());
        return new KinesisOutputBridge(
                registry,
                new RecordNormalizer(JsonBatchDecoder.factory()),
                FlushDispatcher.fromConfig(registry, config, metrics),
                deliveries,
                metrics,
                Duration.ofMillis(Math.max(0L, config.getLong(CFG_DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT_MS))));
    }

    /**
     * Announces the plugin to the host. Only the first call per bridge reaches the host.
     */
    public FlushOutcome register(HostRuntime host) {
        Objects.requireNonNull(host, "host");
        if (!registered.compareAndSet(false, true)) {
            return FlushOutcome.OK;
        }
        return host.registerPlugin(PLUGIN_NAME, PLUGIN_DESCRIPTION);
    }

    /**
     * Creates and stores the instance for {@code context}, then attaches its identifier to the context.
     *
     * @return {@code ERROR} if the configuration is rejected
     */
    public FlushOutcome init(PluginContext context) {
        Objects.requireNonNull(context, "context");
        try {
            final int id = registry.create(next -> OutputInstance.create(next, context, deliveries, metrics));
            context.attachInstance(id);
            return FlushOutcome.OK;
        } catch (ConfigurationException e) {
            log.error("[kinesis] Failed to initialize plugin '{}': {}", context.name(), e.getMessage());
            return FlushOutcome.ERROR;
        }
    }

    /**
     * Normalizes the batch, starts delivery in the background and returns without waiting for it.
     */
    public FlushOutcome flush(PluginContext context, RawBatch batch, String tag) {
        return submit(context, batch, tag) != null ? FlushOutcome.OK : FlushOutcome.ERROR;
    }

    /**
     * Same as {@link #flush}, exposing the background task.
     *
     * @return the task's future, or null if the flush was refused
     */
    public Future<FlushReport> submit(PluginContext context, RawBatch batch, String tag) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(batch, "batch");

        final OptionalInt id = context.instanceId();
        if (id.isEmpty()) {
            log.error("[kinesis] flush on uninitialized context {}", context);
            return null;
        }

        final NormalizedBatch normalized;
        try {
            normalized = normalizer.normalize(batch);
        } catch (RuntimeException e) {
            log.error("[kinesis {}] failed to unpack batch tag={}", id.getAsInt(), tag, e);
            return null;
        }

        try {
            return dispatcher.submit(id.getAsInt(), tag, normalized);
        } catch (RejectedExecutionException e) {
            log.error("[kinesis {}] flush refused, plugin is shutting down tag={}", id.getAsInt(), tag);
            return null;
        }
    }

    /**
     * Drains in-flight flushes (bounded by the drain timeout) and closes every instance.
     */
    public FlushOutcome exit() {
        if (!exited.compareAndSet(false, true)) {
            return FlushOutcome.OK;
        }
        dispatcher.shutdown(drainTimeout);
        for (OutputInstance instance : registry.snapshot()) {
            instance.close();
        }
        return FlushOutcome.OK;
    }

    public InstanceRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        exit();
    }
}
