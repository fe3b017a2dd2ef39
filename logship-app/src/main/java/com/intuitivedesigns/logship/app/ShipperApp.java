/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.config.ShipperConfig;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.RawBatch;
import com.intuitivedesigns.logship.metrics.MetricsFactory;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.metrics.MetricsSettings;
import com.intuitivedesigns.logship.plugin.KinesisOutputBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Plays the host role: registers the plugin, initializes the configured outputs,
 * replays batch files through them and shuts down.
 */
public final class ShipperApp {

    private static final Logger log = LoggerFactory.getLogger(ShipperApp.class);

    // --- Config Keys ---
    static final String CFG_OUTPUTS = "outputs";
    static final String CFG_REPLAY_FILES = "replay.files";
    static final String CFG_REPLAY_TAG = "replay.tag";

    // --- Defaults ---
    static final String DEFAULT_REPLAY_TAG = "replay";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private ShipperApp() {}

    public static void main(String[] args) {
        log.info("=== Booting logship ===");
        final int code;
        try {
            code = run(ShipperConfig.load(), new LoggingHostRuntime(), true);
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            System.exit(EXIT_FAILED);
            return;
        }
        System.exit(code);
    }

    /**
     * Runs one register, init, replay, exit cycle.
     *
     * @return the process exit code
     */
    static int run(ShipperConfig config, LoggingHostRuntime host, boolean installShutdownHook) {
        final MetricsRuntime metrics = MetricsFactory.init(MetricsSettings.from(config));
        final KinesisOutputBridge bridge = KinesisOutputBridge.fromConfig(config, metrics);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        final Runnable shutdown = () -> {
            if (!shutdownStarted.compareAndSet(false, true)) {
                return;
            }
            try {
                bridge.exit();
            } finally {
                metrics.close();
            }
        };
        if (installShutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown, "logship-shutdown"));
        }

        try {
            if (bridge.register(host) != FlushOutcome.OK) {
                log.error("Host refused plugin registration.");
                return EXIT_FAILED;
            }

            final List<String> names = splitList(config.getString(CFG_OUTPUTS, ""));
            if (names.isEmpty()) {
                log.warn("No outputs configured. Set '{}' to a comma separated list of output names.", CFG_OUTPUTS);
            }

            final List<PluginContext> contexts = new ArrayList<>(names.size());
            for (String name : names) {
                final PluginContext context = PluginContext.forOutput(name, config);
                if (bridge.init(context) != FlushOutcome.OK) {
                    log.error("Output '{}' failed to initialize, aborting.", name);
                    return EXIT_FAILED;
                }
                contexts.add(context);
            }

            final String tag = config.getString(CFG_REPLAY_TAG, DEFAULT_REPLAY_TAG);
            boolean replayFailed = false;
            for (String file : splitList(config.getString(CFG_REPLAY_FILES, ""))) {
                if (!replay(bridge, contexts, Path.of(file), tag)) {
                    replayFailed = true;
                }
            }
            return replayFailed ? EXIT_FAILED : EXIT_OK;
        } finally {
            shutdown.run();
        }
    }

    private static boolean replay(KinesisOutputBridge bridge, List<PluginContext> contexts, Path file, String tag) {
        final byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("Cannot read replay file {}: {}", file, e.getMessage());
            return false;
        }

        log.info("Replaying {} ({} bytes) to {} output(s), tag={}", file, data.length, contexts.size(), tag);
        boolean ok = true;
        for (PluginContext context : contexts) {
            if (bridge.flush(context, RawBatch.of(data), tag) != FlushOutcome.OK) {
                log.error("Flush of {} to '{}' was refused.", file, context.name());
                ok = false;
            }
        }
        return ok;
    }

    static List<String> splitList(String value) {
        final List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split(",")) {
            final String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
