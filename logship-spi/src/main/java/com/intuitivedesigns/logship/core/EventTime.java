/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.time.Instant;

/**
 * Structured event time as supplied by the host decoder (seconds + nanoseconds).
 */
public record EventTime(long seconds, long nanos) {

    public EventTime {
        if (nanos < 0 || nanos > 999_999_999L) {
            throw new IllegalArgumentException("nanos out of range: " + nanos);
        }
    }

    public static EventTime of(Instant instant) {
        return new EventTime(instant.getEpochSecond(), instant.getNano());
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
