/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a raw host batch into an ordered list of {@link LogRecord}s.
 *
 * <p>Invalid records (absent, or failing the serialization probe) are kept in
 * place and flagged. Dropping them would hide bad input from the operator.</p>
 */
public final class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private final RecordDecoder.Factory decoders;
    private final ObjectMapper json;
    private final Clock clock;

    public RecordNormalizer(RecordDecoder.Factory decoders) {
        this(decoders, new ObjectMapper(), Clock.systemUTC());
    }

    public RecordNormalizer(RecordDecoder.Factory decoders, ObjectMapper json, Clock clock) {
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public NormalizedBatch normalize(RawBatch batch) {
        Objects.requireNonNull(batch, "batch");
        final RecordDecoder decoder = decoders.open(batch);

        final List<LogRecord> records = new ArrayList<>();
        boolean allGood = true;

        while (true) {
            final DecodedRecord step = decoder.next();
            if (step == null || step.status() == DecodeStatus.END_OF_BATCH) {
                break;
            }
            if (step.status() == DecodeStatus.ERROR) {
                log.error("unpack: malformed batch after {} records, remaining input skipped: {}",
                        records.size(), step.detail());
                allGood = false;
                break;
            }

            final Instant timestamp = resolveTimestamp(step.timestamp(), clock);
            final Map<String, Object> fields = step.record();
            final int index = records.size();

            final boolean valid = probe(fields, index);
            allGood &= valid;
            records.add(new LogRecord(fields, timestamp, valid));
        }

        if (allGood) {
            log.debug("unpack: processed {} records, all valid", records.size());
        } else {
            log.warn("unpack: processed {} records, not all valid", records.size());
        }
        return new NormalizedBatch(records, allGood);
    }

    /**
     * Resolves the event time of one record. Exactly one source applies:
     * a structured host time, else non-negative integer epoch seconds, else the clock.
     */
    public static Instant resolveTimestamp(Object hostTime, Clock clock) {
        if (hostTime instanceof EventTime et) {
            return et.toInstant();
        }
        if (hostTime instanceof Long seconds && seconds >= 0) {
            return Instant.ofEpochSecond(seconds);
        }
        if (hostTime instanceof Integer seconds && seconds >= 0) {
            return Instant.ofEpochSecond(seconds.longValue());
        }
        return clock.instant();
    }

    /**
     * Serializes the record purely as a validity check; the bytes are discarded.
     */
    private boolean probe(Map<String, Object> fields, int index) {
        if (fields == null) {
            log.warn("unpack: record {} is null", index);
            return false;
        }
        try {
            final byte[] data = json.writeValueAsBytes(fields);
            if (data.length == 0) {
                log.warn("unpack: record {} has zero length", index);
                return false;
            }
            return true;
        } catch (JsonProcessingException e) {
            log.warn("unpack: record {} cannot be serialized: {}", index, e.getOriginalMessage());
            return false;
        }
    }
}
