/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

public enum DecodeStatus {
    /** A (timestamp, record) pair was decoded. */
    RECORD,
    /** No more pairs in the batch. */
    END_OF_BATCH,
    /** The batch is malformed at the current position. */
    ERROR
}
