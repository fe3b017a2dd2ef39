/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.HostRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stand-in host for running the plugin outside a log collector. Registrations are logged and remembered.
 */
final class LoggingHostRuntime implements HostRuntime {

    private static final Logger log = LoggerFactory.getLogger(LoggingHostRuntime.class);

    private final List<String> registered = Collections.synchronizedList(new ArrayList<>());

    @Override
    public FlushOutcome registerPlugin(String name, String description) {
        log.info("Registered output plugin '{}': {}", name, description);
        registered.add(name);
        return FlushOutcome.OK;
    }

    List<String> registered() {
        return List.copyOf(registered);
    }
}
