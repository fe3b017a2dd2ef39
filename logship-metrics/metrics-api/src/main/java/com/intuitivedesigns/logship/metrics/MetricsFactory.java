/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import com.intuitivedesigns.logship.spi.PluginIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Picks the metrics backend named by {@code metrics.provider} from the providers on the classpath.
 * Falls back to {@link MetricsRuntime#noop()} when none matches.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        return init(settings, ServiceLoader.load(MetricsProvider.class, resolveClassLoader()));
    }

    static MetricsRuntime init(MetricsSettings settings, Iterable<MetricsProvider> providers) {
        Objects.requireNonNull(settings, "settings");

        if (settings.disabled()) {
            log.info("Metrics disabled (metrics.provider={}). NOOP active.", settings.providerId);
            return MetricsRuntime.noop();
        }

        for (MetricsProvider p : providers) {
            try {
                if (!PluginIds.normalize(p.id()).equals(settings.providerId)) {
                    continue;
                }
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable, so a provider with missing dependencies (NoClassDefFoundError) is skipped too
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.warn("No metrics provider matched '{}'. NOOP active.", settings.providerId);
        return MetricsRuntime.noop();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
