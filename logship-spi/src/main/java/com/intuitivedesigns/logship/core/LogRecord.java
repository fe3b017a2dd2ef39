/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A normalized log event: the decoded mapping plus its resolved timestamp.
 *
 * <p>{@code fields} may be null. Invalid records are kept in the batch so the
 * bad input stays visible; consumers must check {@link #isPresent()} before use.</p>
 *
 * @param fields    the decoded key/value mapping, arbitrary depth, or null
 * @param timestamp the resolved event time, never null
 * @param valid     false when the record was absent or failed the serialization probe
 */
public record LogRecord(Map<String, Object> fields, Instant timestamp, boolean valid) {

    public LogRecord {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isPresent() {
        return fields != null;
    }
}
