/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.util.Map;
import java.util.Objects;

/**
 * One step of the decoder.
 *
 * @param status    what this step produced
 * @param timestamp the host time value as decoded: an {@link EventTime}, a
 *                  {@link Long} of epoch seconds, or anything else (including null)
 * @param record    the decoded mapping; null when the host sent no record
 * @param detail    diagnostic text for {@link DecodeStatus#ERROR}
 */
public record DecodedRecord(DecodeStatus status, Object timestamp, Map<String, Object> record, String detail) {

    private static final DecodedRecord END = new DecodedRecord(DecodeStatus.END_OF_BATCH, null, null, null);

    public DecodedRecord {
        Objects.requireNonNull(status, "status");
    }

    public static DecodedRecord of(Object timestamp, Map<String, Object> record) {
        return new DecodedRecord(DecodeStatus.RECORD, timestamp, record, null);
    }

    public static DecodedRecord end() {
        return END;
    }

    public static DecodedRecord error(String detail) {
        return new DecodedRecord(DecodeStatus.ERROR, null, null, detail);
    }
}
