/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

/**
 * A metrics backend, listed in
 * {@code META-INF/services/com.intuitivedesigns.logship.metrics.MetricsProvider}.
 *
 * <p>{@link MetricsFactory} calls {@link #create} only on the provider whose
 * {@link #id()} equals {@code metrics.provider}, ignoring case.</p>
 */
public interface MetricsProvider {

    String id();

    MetricsRuntime create(MetricsSettings settings);
}
