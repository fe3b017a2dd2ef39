/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.core.DecodeStatus;
import com.intuitivedesigns.logship.core.DecodedRecord;
import com.intuitivedesigns.logship.core.EventTime;
import com.intuitivedesigns.logship.core.RawBatch;
import com.intuitivedesigns.logship.core.RecordDecoder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes a batch encoded as JSON Lines, one {@code [timestamp, record]} pair per line.
 *
 * <p>Timestamp encodings:</p>
 * <ul>
 * <li>integer: epoch seconds, passed on as a {@link Long}</li>
 * <li>float, {@code {"sec":s,"nsec":n}} or {@code [s, n]}: structured {@link EventTime}</li>
 * <li>anything else: no host time (null)</li>
 * </ul>
 */
public final class JsonBatchDecoder implements RecordDecoder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;
    private final String[] lines;
    private int pos;
    private boolean done;

    public JsonBatchDecoder(ObjectMapper json, RawBatch batch) {
        this.json = Objects.requireNonNull(json, "json");
        Objects.requireNonNull(batch, "batch");
        final String text = new String(batch.data(), 0, batch.length(), StandardCharsets.UTF_8);
        this.lines = text.split("\\r?\\n", -1);
    }

    /**
     * A factory that shares one {@link ObjectMapper} across batches.
     */
    public static RecordDecoder.Factory factory(ObjectMapper json) {
        Objects.requireNonNull(json, "json");
        return batch -> new JsonBatchDecoder(json, batch);
    }

    public static RecordDecoder.Factory factory() {
        return factory(new ObjectMapper());
    }

    @Override
    public DecodedRecord next() {
        if (done) {
            throw new IllegalStateException("decoder already finished");
        }
        while (pos < lines.length) {
            final int lineNo = pos + 1;
            final String line = lines[pos++].trim();
            if (line.isEmpty()) {
                continue;
            }
            final DecodedRecord r = decodeLine(line, lineNo);
            if (r.status() != DecodeStatus.RECORD) {
                done = true;
            }
            return r;
        }
        done = true;
        return DecodedRecord.end();
    }

    private DecodedRecord decodeLine(String line, int lineNo) {
        final JsonNode pair;
        try {
            pair = json.readTree(line);
        } catch (JsonProcessingException e) {
            return DecodedRecord.error("line " + lineNo + ": not JSON (" + e.getOriginalMessage() + ")");
        }
        if (pair == null || !pair.isArray() || pair.size() != 2) {
            return DecodedRecord.error("line " + lineNo + ": expected a [timestamp, record] pair");
        }

        final JsonNode body = pair.get(1);
        final Map<String, Object> record;
        if (body.isNull()) {
            record = null;
        } else if (body.isObject()) {
            record = json.convertValue(body, MAP_TYPE);
        } else {
            return DecodedRecord.error("line " + lineNo + ": record must be an object or null");
        }

        return DecodedRecord.of(decodeTime(pair.get(0)), record);
    }

    static Object decodeTime(JsonNode ts) {
        if (ts.isIntegralNumber()) {
            return ts.canConvertToLong() ? ts.asLong() : null;
        }
        if (ts.isFloatingPointNumber()) {
            return fromDecimal(ts.decimalValue());
        }
        if (ts.isObject() && ts.has("sec")) {
            return eventTime(ts.get("sec"), ts.get("nsec"));
        }
        if (ts.isArray() && ts.size() == 2) {
            return eventTime(ts.get(0), ts.get(1));
        }
        return null;
    }

    private static Object eventTime(JsonNode sec, JsonNode nsec) {
        if (sec == null || !sec.isIntegralNumber()) return null;
        final long nanos = (nsec != null && nsec.isIntegralNumber()) ? nsec.asLong() : 0L;
        if (nanos < 0 || nanos > 999_999_999L) return null;
        return new EventTime(sec.asLong(), nanos);
    }

    private static Object fromDecimal(BigDecimal value) {
        final BigDecimal seconds = value.setScale(0, RoundingMode.FLOOR);
        final long nanos = value.subtract(seconds).movePointRight(9).longValue();
        try {
            return new EventTime(seconds.longValueExact(), nanos);
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
