/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.util.List;

/**
 * Output of normalization, in host submission order.
 *
 * @param records  normalized records, including invalid ones
 * @param allValid true iff every record is valid and the batch decoded cleanly
 */
public record NormalizedBatch(List<LogRecord> records, boolean allValid) {

    public NormalizedBatch {
        records = List.copyOf(records == null ? List.of() : records);
    }

    public int count() {
        return records.size();
    }
}
