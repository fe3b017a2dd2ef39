/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

/**
 * The three flow-control signals the host understands.
 * Every internal failure is reduced to one of these before it reaches the host.
 */
public enum FlushOutcome {
    OK(1),
    RETRY(2),
    ERROR(0);

    private final int hostCode;

    FlushOutcome(int hostCode) {
        this.hostCode = hostCode;
    }

    /**
     * Numeric status as the host runtime encodes it.
     */
    public int hostCode() {
        return hostCode;
    }

    public boolean isOk() {
        return this == OK;
    }
}
