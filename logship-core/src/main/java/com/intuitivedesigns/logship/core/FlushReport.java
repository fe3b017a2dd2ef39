/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

/**
 * Terminal state of one detached flush task.
 *
 * @param instanceId output instance the batch was flushed to
 * @param tag        host tag of the batch
 * @param records    records in the batch, including invalid ones
 * @param attempts   delivery attempts started
 * @param outcome    outcome of the last attempt ({@code ERROR} when timed out)
 * @param timedOut   true when the task was cancelled for overrunning its time budget
 * @param durationMs wall time from submission to completion
 */
public record FlushReport(int instanceId,
                          String tag,
                          int records,
                          int attempts,
                          FlushOutcome outcome,
                          boolean timedOut,
                          long durationMs) {

    /**
     * True when the attempt budget ran out while delivery was still asking for a retry.
     */
    public boolean retriesExhausted() {
        return !timedOut && outcome == FlushOutcome.RETRY;
    }
}
