/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static RecordNormalizer scripted(DecodedRecord... steps) {
        return new RecordNormalizer(batch -> {
            Deque<DecodedRecord> queue = new ArrayDeque<>(List.of(steps));
            return () -> queue.isEmpty() ? DecodedRecord.end() : queue.poll();
        }, new ObjectMapper(), CLOCK);
    }

    private static final RawBatch ANY = RawBatch.ofUtf8("");

    @Test
    void testRecordsKeepSubmissionOrder() {
        RecordNormalizer normalizer = scripted(
                DecodedRecord.of(1L, Map.of("msg", "a")),
                DecodedRecord.of(2L, Map.of("msg", "b")),
                DecodedRecord.of(3L, Map.of("msg", "c")));

        NormalizedBatch batch = normalizer.normalize(ANY);

        assertEquals(3, batch.count());
        assertTrue(batch.allValid());
        assertEquals("a", batch.records().get(0).fields().get("msg"));
        assertEquals("b", batch.records().get(1).fields().get("msg"));
        assertEquals("c", batch.records().get(2).fields().get("msg"));
    }

    @Test
    void testNullRecordIsKeptAndFlagged() {
        RecordNormalizer normalizer = scripted(
                DecodedRecord.of(1L, Map.of("msg", "a")),
                DecodedRecord.of(2L, null),
                DecodedRecord.of(3L, Map.of("msg", "c")));

        NormalizedBatch batch = normalizer.normalize(ANY);

        assertEquals(3, batch.count());
        assertFalse(batch.allValid());
        LogRecord missing = batch.records().get(1);
        assertFalse(missing.isPresent());
        assertFalse(missing.valid());
        assertTrue(batch.records().get(2).valid());
    }

    @Test
    void testUnserializableRecordIsFlagged() {
        RecordNormalizer normalizer = scripted(DecodedRecord.of(1L, Map.of("bad", new Object())));

        NormalizedBatch batch = normalizer.normalize(ANY);

        assertEquals(1, batch.count());
        assertTrue(batch.records().get(0).isPresent());
        assertFalse(batch.records().get(0).valid());
        assertFalse(batch.allValid());
    }

    @Test
    void testDecodeErrorStopsAndKeepsPriorRecords() {
        RecordNormalizer normalizer = scripted(
                DecodedRecord.of(1L, Map.of("msg", "a")),
                DecodedRecord.error("truncated"),
                DecodedRecord.of(3L, Map.of("msg", "never")));

        NormalizedBatch batch = normalizer.normalize(ANY);

        assertEquals(1, batch.count());
        assertFalse(batch.allValid());
    }

    @Test
    void testEmptyBatch() {
        NormalizedBatch batch = scripted().normalize(ANY);

        assertEquals(0, batch.count());
        assertTrue(batch.allValid());
    }

    @Test
    void testTimestampResolution() {
        // Structured host time wins
        assertEquals(Instant.ofEpochSecond(10, 500),
                RecordNormalizer.resolveTimestamp(new EventTime(10, 500), CLOCK));

        // Plain epoch seconds
        assertEquals(Instant.parse("2001-09-09T01:46:40Z"),
                RecordNormalizer.resolveTimestamp(1_000_000_000L, CLOCK));
        assertEquals(Instant.ofEpochSecond(42), RecordNormalizer.resolveTimestamp(42, CLOCK));

        // Anything else falls back to the clock
        assertEquals(NOW, RecordNormalizer.resolveTimestamp(null, CLOCK));
        assertEquals(NOW, RecordNormalizer.resolveTimestamp("yesterday", CLOCK));
        assertEquals(NOW, RecordNormalizer.resolveTimestamp(-5L, CLOCK));
    }

    @Test
    void testTimestampsFlowIntoRecords() {
        RecordNormalizer normalizer = scripted(
                DecodedRecord.of(new EventTime(5, 0), Map.of("k", 1)),
                DecodedRecord.of(1_000_000_000L, Map.of("k", 2)),
                DecodedRecord.of(null, Map.of("k", 3)));

        List<LogRecord> records = normalizer.normalize(ANY).records();

        assertEquals(Instant.ofEpochSecond(5), records.get(0).timestamp());
        assertEquals(Instant.ofEpochSecond(1_000_000_000L), records.get(1).timestamp());
        assertEquals(NOW, records.get(2).timestamp());
    }
}
