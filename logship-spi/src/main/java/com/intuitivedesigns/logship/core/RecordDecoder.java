/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

/**
 * Decodes one host batch, one (timestamp, record) pair per call.
 *
 * <p>End of batch and malformed input are reported with distinct statuses.
 * After {@link DecodeStatus#END_OF_BATCH} or {@link DecodeStatus#ERROR} the
 * decoder must not be called again.</p>
 */
@FunctionalInterface
public interface RecordDecoder {

    DecodedRecord next();

    /**
     * Opens a decoder over a raw batch.
     */
    @FunctionalInterface
    interface Factory {
        RecordDecoder open(RawBatch batch);
    }
}
