/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.core.DeliveryAdapter;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.RequestBuffer;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.KmsThrottlingException;
import software.amazon.awssdk.services.kinesis.model.LimitExceededException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Delivers records to one Kinesis data stream with {@code PutRecords}.
 *
 * Features:
 * - Request limits enforced while buffering (500 entries, 5 MiB)
 * - Oversized records dropped, never sent
 * - Partial failures keep only the failed entries for the next send
 * - Rate-limited error logging
 * - Optional Micrometer counters/timer
 *
 * <p>Thread-safe: all per-flush state lives in the caller's {@link RequestBuffer}.</p>
 */
public final class KinesisDelivery implements DeliveryAdapter<PutRecordsRequestEntry> {

    private static final Logger log = LoggerFactory.getLogger(KinesisDelivery.class);

    // ---- Service limits ----
    public static final int MAX_RECORDS_PER_REQUEST = 500;
    public static final long MAX_RECORD_BYTES = 1_024L * 1_024L;
    public static final long MAX_REQUEST_BYTES = 5L * 1_024L * 1_024L;

    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final KinesisClient client;
    private final OutputSettings settings;
    private final PartitionKeyStrategy partitionKeys;
    private final StrftimeFormatter timeFormatter;
    private final ObjectMapper json;
    private final List<AutoCloseable> resources;

    // Fast counters (always on)
    private final LongAdder recordsSent = new LongAdder();
    private final LongAdder recordsFailed = new LongAdder();
    private final LongAdder recordsDropped = new LongAdder();

    // Micrometer (optional)
    private final Counter sentCounter;
    private final Counter failedCounter;
    private final Counter requestCounter;
    private final Timer latencyTimer;

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrors = new LongAdder();

    public KinesisDelivery(KinesisClient client,
                           OutputSettings settings,
                           ObjectMapper json,
                           MetricsRuntime metrics,
                           List<? extends AutoCloseable> resources) {
        this.client = Objects.requireNonNull(client, "client");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.json = Objects.requireNonNull(json, "json");
        this.resources = List.copyOf(resources == null ? List.of() : resources);

        this.partitionKeys = settings.hasPartitionKey()
                ? PartitionKeyStrategy.fromField(settings.partitionKey())
                : PartitionKeyStrategy.random();
        this.timeFormatter = settings.timeKey().isEmpty()
                ? null
                : StrftimeFormatter.compile(settings.timeKeyFormat());

        final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.sentCounter = registry.counter("logship_kinesis_records_sent_total", "stream", settings.stream());
            this.failedCounter = registry.counter("logship_kinesis_records_failed_total", "stream", settings.stream());
            this.requestCounter = registry.counter("logship_kinesis_requests_total", "stream", settings.stream());
            this.latencyTimer = registry.timer("logship_kinesis_request_latency", "stream", settings.stream());
        } else {
            this.sentCounter = null;
            this.failedCounter = null;
            this.requestCounter = null;
            this.latencyTimer = null;
        }

        log.info("[kinesis {}] KinesisDelivery active. stream='{}' region='{}' partitionKey={} timeKey='{}'",
                settings.instanceId(), settings.stream(), settings.region(),
                settings.hasPartitionKey() ? "'" + settings.partitionKey() + "'" : "random", settings.timeKey());
    }

    @Override
    public int maxRecordsPerRequest() {
        return MAX_RECORDS_PER_REQUEST;
    }

    @Override
    public FlushOutcome addRecord(RequestBuffer<PutRecordsRequestEntry> buffer,
                                  Map<String, Object> record,
                                  Instant timestamp) {
        final Map<String, Object> body = shape(record, timestamp);

        byte[] data;
        try {
            data = json.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            logRateLimited("[kinesis " + settings.instanceId() + "] failed to marshal record", e);
            return FlushOutcome.ERROR;
        }
        if (settings.appendNewline()) {
            final byte[] withNewline = new byte[data.length + 1];
            System.arraycopy(data, 0, withNewline, 0, data.length);
            withNewline[data.length] = '\n';
            data = withNewline;
        }

        final String partitionKey = partitionKeys.partitionKey(record);
        final long size = data.length + (long) partitionKey.getBytes(StandardCharsets.UTF_8).length;

        if (size > MAX_RECORD_BYTES) {
            recordsDropped.increment();
            log.warn("[kinesis {}] dropping record larger than {} bytes ({} bytes) stream='{}'",
                    settings.instanceId(), MAX_RECORD_BYTES, size, settings.stream());
            return FlushOutcome.OK;
        }

        // Send what we have before this record would push the request over a service limit
        if (buffer.size() >= MAX_RECORDS_PER_REQUEST || buffer.payloadBytes() + size > MAX_REQUEST_BYTES) {
            final FlushOutcome rc = flush(buffer);
            if (rc != FlushOutcome.OK) {
                return rc;
            }
        }

        buffer.add(PutRecordsRequestEntry.builder()
                .data(SdkBytes.fromByteArray(data))
                .partitionKey(partitionKey)
                .build(), size);
        return FlushOutcome.OK;
    }

    @Override
    public FlushOutcome flush(RequestBuffer<PutRecordsRequestEntry> buffer) {
        if (buffer.isEmpty()) {
            return FlushOutcome.OK;
        }

        final List<PutRecordsRequestEntry> entries = buffer.entries();
        final PutRecordsRequest request = PutRecordsRequest.builder()
                .streamName(settings.stream())
                .records(entries)
                .build();

        final long start = System.nanoTime();
        final PutRecordsResponse response;
        try {
            response = client.putRecords(request);
        } catch (SdkException e) {
            final FlushOutcome outcome = classify(e);
            recordsFailed.add(entries.size());
            if (failedCounter != null) failedCounter.increment(entries.size());
            logRateLimited("[kinesis " + settings.instanceId() + "] PutRecords failed stream='" + settings.stream()
                    + "' records=" + entries.size() + " outcome=" + outcome, e);
            return outcome;
        } finally {
            if (requestCounter != null) requestCounter.increment();
            if (latencyTimer != null) latencyTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }

        final Integer failed = response.failedRecordCount();
        if (failed == null || failed == 0) {
            recordsSent.add(entries.size());
            if (sentCounter != null) sentCounter.increment(entries.size());
            log.debug("[kinesis {}] sent {} records to stream '{}'", settings.instanceId(), entries.size(), settings.stream());
            buffer.clear();
            return FlushOutcome.OK;
        }

        // Keep only the rejected entries; results are positional
        final List<PutRecordsResultEntry> results = response.records();
        final List<PutRecordsRequestEntry> retry = new ArrayList<>(failed);
        long retryBytes = 0;
        String sampleError = null;
        for (int i = 0; i < entries.size(); i++) {
            final PutRecordsResultEntry result = (i < results.size()) ? results.get(i) : null;
            if (result == null || result.errorCode() != null) {
                final PutRecordsRequestEntry entry = entries.get(i);
                retry.add(entry);
                retryBytes += entry.data().asByteArrayUnsafe().length
                        + entry.partitionKey().getBytes(StandardCharsets.UTF_8).length;
                if (sampleError == null && result != null) {
                    sampleError = result.errorCode() + ": " + result.errorMessage();
                }
            }
        }
        final int delivered = entries.size() - retry.size();
        recordsSent.add(delivered);
        recordsFailed.add(retry.size());
        if (sentCounter != null) sentCounter.increment(delivered);
        if (failedCounter != null) failedCounter.increment(retry.size());

        log.warn("[kinesis {}] {}/{} records failed to be delivered to stream '{}' ({})",
                settings.instanceId(), retry.size(), entries.size(), settings.stream(), sampleError);

        buffer.reset(retry, retryBytes);
        return FlushOutcome.RETRY;
    }

    /**
     * Maps a failed call to an outcome: transient conditions may succeed on a later attempt.
     */
    static FlushOutcome classify(SdkException e) {
        if (e instanceof ProvisionedThroughputExceededException
                || e instanceof KmsThrottlingException
                || e instanceof LimitExceededException) {
            return FlushOutcome.RETRY;
        }
        if (e instanceof AwsServiceException ase) {
            if (ase.isThrottlingException() || ase.statusCode() >= 500) {
                return FlushOutcome.RETRY;
            }
            return FlushOutcome.ERROR;
        }
        if (e instanceof SdkClientException) {
            return FlushOutcome.RETRY;
        }
        return e.retryable() ? FlushOutcome.RETRY : FlushOutcome.ERROR;
    }

    @Override
    public String id() {
        return "KINESIS:" + settings.stream();
    }

    public long recordsSent() {
        return recordsSent.sum();
    }

    public long recordsFailed() {
        return recordsFailed.sum();
    }

    public long recordsDropped() {
        return recordsDropped.sum();
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("[kinesis {}] Kinesis client close failed", settings.instanceId(), e);
        }
        for (AutoCloseable r : resources) {
            try {
                r.close();
            } catch (Exception e) {
                log.warn("[kinesis {}] resource close failed: {}", settings.instanceId(), r, e);
            }
        }
        log.info("[kinesis {}] KinesisDelivery closed. sent={} failed={} dropped={}",
                settings.instanceId(), recordsSent.sum(), recordsFailed.sum(), recordsDropped.sum());
    }

    // ---- Helpers ----

    /**
     * Applies data_keys and time_key to a copy; the caller's map is reused by later attempts.
     */
    private Map<String, Object> shape(Map<String, Object> record, Instant timestamp) {
        final Map<String, Object> body;
        if (settings.dataKeys().isEmpty()) {
            body = new LinkedHashMap<>(record);
        } else {
            body = new LinkedHashMap<>();
            for (String key : settings.dataKeys()) {
                if (record.containsKey(key)) {
                    body.put(key, record.get(key));
                }
            }
        }
        if (timeFormatter != null) {
            body.put(settings.timeKey(), timeFormatter.format(timestamp));
        }
        return body;
    }

    private void logRateLimited(String context, Throwable ex) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            final long sup = suppressedErrors.sumThenReset();
            if (sup > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, sup, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrors.increment();
        }
    }
}
