/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A host-encoded sequence of (timestamp, record) pairs.
 *
 * <p>Owned by the host and only valid for the duration of one flush call,
 * so nothing downstream of normalization may keep a reference to it.</p>
 */
public final class RawBatch {

    private final byte[] data;
    private final int length;

    public RawBatch(byte[] data, int length) {
        this.data = Objects.requireNonNull(data, "data");
        if (length < 0 || length > data.length) {
            throw new IllegalArgumentException("length " + length + " outside [0, " + data.length + "]");
        }
        this.length = length;
    }

    public static RawBatch of(byte[] data) {
        return new RawBatch(data, data.length);
    }

    public static RawBatch ofUtf8(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] data() {
        return data;
    }

    public int length() {
        return length;
    }
}
