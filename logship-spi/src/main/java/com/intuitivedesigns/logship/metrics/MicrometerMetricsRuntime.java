/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsRuntime} over a single Micrometer registry.
 *
 * <p>Gauges are push-style: each {@link #gauge} call stores the latest value,
 * which the registry reads when it publishes.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;
    private final String type;

    // Latest gauge values, stored as raw double bits
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * In-memory runtime, used by tests and local runs.
     */
    public MicrometerMetricsRuntime() {
        this(new SimpleMeterRegistry(), "MICROMETER");
    }

    public MicrometerMetricsRuntime(MeterRegistry registry, String type) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.type = (type == null || type.isBlank()) ? "MICROMETER" : type;
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        final long bits = Double.doubleToLongBits(value);
        gauges.computeIfAbsent(name, key -> {
            final AtomicLong holder = new AtomicLong(bits);
            Gauge.builder(key, holder, h -> Double.longBitsToDouble(h.get())).register(registry);
            return holder;
        }).set(bits);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed ({}).", type);
    }
}
