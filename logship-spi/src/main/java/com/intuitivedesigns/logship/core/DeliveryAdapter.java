/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.time.Instant;
import java.util.Map;

/**
 * A pluggable destination for normalized log records.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #addRecord} converts one record into a request entry and appends it
 * to the caller's buffer. It may perform a network round trip itself when the
 * buffer reaches a request limit.</li>
 * <li>{@link #flush} sends whatever the buffer holds.</li>
 * <li>Failures are reported as {@link FlushOutcome} values, not exceptions.
 * {@code RETRY} means the same records may succeed later.</li>
 * <li>Implementations must be thread-safe: concurrent flush tasks call into the
 * same adapter with their own buffers.</li>
 * </ul>
 *
 * @param <E> the request entry type accumulated in {@link RequestBuffer}
 */
public interface DeliveryAdapter<E> extends AutoCloseable {

    /**
     * Maximum entries one remote request may carry. Used as the buffer capacity hint.
     */
    int maxRecordsPerRequest();

    FlushOutcome addRecord(RequestBuffer<E> buffer, Map<String, Object> record, Instant timestamp);

    FlushOutcome flush(RequestBuffer<E> buffer);

    /**
     * Returns an identifier for this adapter instance, for logging and metrics.
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    /**
     * Release clients and thread pools.
     */
    @Override
    default void close() {
        // no-op by default
    }
}
