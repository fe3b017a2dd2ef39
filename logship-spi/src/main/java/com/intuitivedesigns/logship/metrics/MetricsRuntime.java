/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

/**
 * The vendor-agnostic contract for observability.
 *
 * <p>Decouples the delivery core from a specific metrics library, so the core
 * runs with no backend on the classpath (NOOP defaults).</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     * Typed as Object so the core does not need Micrometer at compile time.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    // --- Standard Instrumentation Methods (with NOOP defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    /**
     * A runtime that records nothing.
     */
    static MetricsRuntime noop() {
        return NoopHolder.INSTANCE;
    }

    final class NoopHolder {
        // Sentinel instead of null so "instanceof" checks downstream stay NPE-free
        private static final Object SENTINEL = new Object();
        private static final MetricsRuntime INSTANCE = () -> SENTINEL;

        private NoopHolder() {}
    }
}
