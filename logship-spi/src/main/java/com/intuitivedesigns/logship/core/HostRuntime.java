/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

/**
 * The parts of the log-collection host that the output plugin calls back into.
 */
@FunctionalInterface
public interface HostRuntime {

    /**
     * Announces the plugin to the host.
     *
     * @return a {@link FlushOutcome} style status
     */
    FlushOutcome registerPlugin(String name, String description);
}
