/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.plugins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.RequestBuffer;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.spi.DeliveryPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A delivery adapter that writes records to the application log instead of a remote stream.
 * Useful for development, replay dry-runs and smoke tests.
 */
public final class LogDeliveryPlugin implements DeliveryPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogDeliveryPlugin.class);

    public static final String ID = "LOG";

    // Option keys (per output instance)
    private static final String OPT_MAX_LOG_CHARS = "log_max_chars";
    private static final String OPT_LOG_LEVEL = "log_level";

    // Defaults
    private static final int DEFAULT_MAX_LOG_CHARS = 1024;
    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int MAX_RECORDS_PER_REQUEST = 500;

    static final String METRIC_DELIVERED = "logship_log_delivered_total";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DeliveryAdapter<?> create(OutputSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");

        final int maxChars = clampInt(parseInt(settings.option(OPT_MAX_LOG_CHARS), DEFAULT_MAX_LOG_CHARS), 0, 1_048_576);
        final String level = normalizeUpper(settings.option(OPT_LOG_LEVEL), DEFAULT_LOG_LEVEL);
        final MetricsRuntime safeMetrics = (metrics != null) ? metrics : MetricsRuntime.noop();

        log.info("[kinesis {}] LOG delivery active (stream='{}', level={}, maxChars={})",
                settings.instanceId(), settings.stream(), level, maxChars);

        return new LogDelivery(settings, level, maxChars, safeMetrics);
    }

    static final class LogDelivery implements DeliveryAdapter<String> {

        private final OutputSettings settings;
        private final String level;
        private final int maxChars;
        private final MetricsRuntime metrics;
        private final ObjectMapper json = new ObjectMapper();

        LogDelivery(OutputSettings settings, String level, int maxChars, MetricsRuntime metrics) {
            this.settings = settings;
            this.level = level;
            this.maxChars = maxChars;
            this.metrics = metrics;
        }

        @Override
        public int maxRecordsPerRequest() {
            return MAX_RECORDS_PER_REQUEST;
        }

        @Override
        public FlushOutcome addRecord(RequestBuffer<String> buffer, Map<String, Object> record, Instant timestamp) {
            final String raw;
            try {
                raw = json.writeValueAsString(record);
            } catch (JsonProcessingException e) {
                log.error("[kinesis {}] cannot serialize record: {}", settings.instanceId(), e.getOriginalMessage());
                return FlushOutcome.ERROR;
            }
            final String content = (raw.length() > maxChars)
                    ? raw.substring(0, maxChars) + "... [TRUNCATED]"
                    : raw;
            buffer.add(timestamp + " " + content, raw.length());
            return FlushOutcome.OK;
        }

        @Override
        public FlushOutcome flush(RequestBuffer<String> buffer) {
            if (buffer.isEmpty()) {
                return FlushOutcome.OK;
            }
            if (shouldLog(level)) {
                for (String entry : buffer.entries()) {
                    logAtLevel(level, "[kinesis {}] {} | {}", settings.instanceId(), settings.stream(), entry);
                }
            }
            metrics.counter(METRIC_DELIVERED, buffer.size());
            buffer.clear();
            return FlushOutcome.OK;
        }

        @Override
        public String id() {
            return ID;
        }
    }

    // --- Helpers ---

    private static boolean shouldLog(String level) {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "WARN"  -> log.isWarnEnabled();
            case "INFO"  -> log.isInfoEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF"   -> false;
            default      -> log.isInfoEnabled();
        };
    }

    private static void logAtLevel(String level, String fmt, Object a, Object b, Object c) {
        switch (level) {
            case "ERROR" -> log.error(fmt, a, b, c);
            case "WARN"  -> log.warn(fmt, a, b, c);
            case "DEBUG" -> log.debug(fmt, a, b, c);
            case "TRACE" -> log.trace(fmt, a, b, c);
            case "OFF"   -> { /* no-op */ }
            default      -> log.info(fmt, a, b, c);
        }
    }

    private static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try { return Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return def; }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String normalizeUpper(String s, String def) {
        if (s == null || s.isBlank()) return def;
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
