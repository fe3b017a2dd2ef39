/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-flush accumulator of delivery request entries.
 *
 * <p>Each flush attempt allocates its own buffer, so instances are never shared
 * between threads and need no synchronization.</p>
 *
 * @param <E> the adapter-specific request entry type
 */
public final class RequestBuffer<E> {

    private final List<E> entries;
    private final int capacityHint;
    private long payloadBytes;

    public RequestBuffer(int capacityHint) {
        if (capacityHint < 0) throw new IllegalArgumentException("capacityHint must be >= 0");
        this.capacityHint = capacityHint;
        this.entries = new ArrayList<>(capacityHint);
    }

    public void add(E entry, long bytes) {
        entries.add(Objects.requireNonNull(entry, "entry"));
        payloadBytes += Math.max(0L, bytes);
    }

    /**
     * Replaces the content, e.g. with the entries a partial failure left unsent.
     */
    public void reset(List<E> remaining, long bytes) {
        entries.clear();
        entries.addAll(remaining);
        payloadBytes = Math.max(0L, bytes);
    }

    public void clear() {
        entries.clear();
        payloadBytes = 0L;
    }

    public List<E> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long payloadBytes() {
        return payloadBytes;
    }

    public int capacityHint() {
        return capacityHint;
    }
}
