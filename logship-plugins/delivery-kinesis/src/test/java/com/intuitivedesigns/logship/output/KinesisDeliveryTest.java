/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.config.OutputSettings;
import com.intuitivedesigns.logship.config.PluginContext;
import com.intuitivedesigns.logship.core.FlushOutcome;
import com.intuitivedesigns.logship.core.RequestBuffer;
import com.intuitivedesigns.logship.metrics.MicrometerMetricsRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.KinesisException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KinesisDeliveryTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Instant TS = Instant.parse("2024-03-05T07:08:09Z");

    private KinesisClient client;

    @BeforeEach
    void setUp() {
        client = mock(KinesisClient.class);
        when(client.putRecords(any(PutRecordsRequest.class)))
                .thenReturn(PutRecordsResponse.builder().failedRecordCount(0).build());
    }

    private KinesisDelivery delivery(Map<String, String> extra) throws Exception {
        Map<String, String> options = new HashMap<>();
        options.put("stream", "app-logs");
        options.put("region", "us-east-1");
        options.putAll(extra);
        OutputSettings settings = OutputSettings.from(PluginContext.of("out", options), 0);
        return new KinesisDelivery(client, settings, JSON, null, List.of());
    }

    private static Map<String, Object> record(String msg) {
        Map<String, Object> r = new HashMap<>();
        r.put("log", msg);
        r.put("level", "info");
        r.put("host", "web-1");
        return r;
    }

    private static String text(PutRecordsRequestEntry e) {
        return e.data().asString(StandardCharsets.UTF_8);
    }

    @Test
    void testShapesRecordWithDataKeysTimeKeyAndNewline() throws Exception {
        KinesisDelivery d = delivery(Map.of(
                "data_keys", "log,level",
                "time_key", "@ts",
                "append_newline", "true"));
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(d.maxRecordsPerRequest());

        assertEquals(FlushOutcome.OK, d.addRecord(buffer, record("hello"), TS));

        String data = text(buffer.entries().get(0));
        assertTrue(data.endsWith("}\n"));
        Map<?, ?> parsed = JSON.readValue(data.trim(), Map.class);
        assertEquals(Map.of("log", "hello", "level", "info", "@ts", "2024-03-05T07:08:09"), parsed);
    }

    @Test
    void testCallerRecordIsNotModified() throws Exception {
        KinesisDelivery d = delivery(Map.of("time_key", "time", "data_keys", "log"));
        Map<String, Object> r = record("x");

        d.addRecord(new RequestBuffer<>(1), r, TS);

        assertEquals(record("x"), r);
    }

    @Test
    void testPartitionKeyFromNestedField() throws Exception {
        KinesisDelivery d = delivery(Map.of("partition_key", "kubernetes->pod_name"));
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(2);

        Map<String, Object> withPod = record("a");
        withPod.put("kubernetes", Map.of("pod_name", "api-7f9c"));
        d.addRecord(buffer, withPod, TS);
        d.addRecord(buffer, record("b"), TS);

        assertEquals("api-7f9c", buffer.entries().get(0).partitionKey());
        String fallback = buffer.entries().get(1).partitionKey();
        assertTrue(fallback.matches("[A-Za-z0-9]{8}"), fallback);
    }

    @Test
    void testRandomPartitionKeyWhenUnset() throws Exception {
        KinesisDelivery d = delivery(Map.of());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(1);

        d.addRecord(buffer, record("a"), TS);

        assertTrue(buffer.entries().get(0).partitionKey().matches("[A-Za-z0-9]{8}"));
    }

    @Test
    void testLongPartitionKeyIsTruncated() throws Exception {
        KinesisDelivery d = delivery(Map.of("partition_key", "id"));
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(1);
        Map<String, Object> r = record("a");
        r.put("id", "k".repeat(300));

        d.addRecord(buffer, r, TS);

        assertEquals(256, buffer.entries().get(0).partitionKey().length());
    }

    @Test
    void testOversizedRecordIsDropped() throws Exception {
        KinesisDelivery d = delivery(Map.of());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(1);

        assertEquals(FlushOutcome.OK, d.addRecord(buffer, record("x".repeat(1_100_000)), TS));

        assertTrue(buffer.isEmpty());
        assertEquals(1, d.recordsDropped());
        verifyNoInteractions(client);
    }

    @Test
    void testFullBufferIsSentBeforeAdding() throws Exception {
        KinesisDelivery d = delivery(Map.of());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(d.maxRecordsPerRequest());

        for (int i = 0; i < 501; i++) {
            assertEquals(FlushOutcome.OK, d.addRecord(buffer, record("m" + i), TS));
        }

        ArgumentCaptor<PutRecordsRequest> captor = ArgumentCaptor.forClass(PutRecordsRequest.class);
        verify(client, times(1)).putRecords(captor.capture());
        assertEquals(500, captor.getValue().records().size());
        assertEquals("app-logs", captor.getValue().streamName());
        assertEquals(1, buffer.size());
    }

    @Test
    void testRequestByteLimitTriggersSend() throws Exception {
        KinesisDelivery d = delivery(Map.of());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(d.maxRecordsPerRequest());
        String big = "x".repeat(900_000);

        for (int i = 0; i < 6; i++) {
            d.addRecord(buffer, record(big), TS);
        }

        verify(client, times(1)).putRecords(any(PutRecordsRequest.class));
        assertEquals(1, buffer.size());
    }

    @Test
    void testSuccessfulFlushClearsBuffer() throws Exception {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        OutputSettings settings = OutputSettings.from(
                PluginContext.of("out", Map.of("stream", "app-logs", "region", "us-east-1")), 0);
        KinesisDelivery d = new KinesisDelivery(client, settings, JSON, metrics, List.of());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(10);
        d.addRecord(buffer, record("a"), TS);
        d.addRecord(buffer, record("b"), TS);

        assertEquals(FlushOutcome.OK, d.flush(buffer));

        assertTrue(buffer.isEmpty());
        assertEquals(0, buffer.payloadBytes());
        assertEquals(2, d.recordsSent());
        assertEquals(2.0, metrics.registry().get("logship_kinesis_records_sent_total").counter().count());
    }

    @Test
    void testEmptyFlushSkipsTheCall() throws Exception {
        KinesisDelivery d = delivery(Map.of());

        assertEquals(FlushOutcome.OK, d.flush(new RequestBuffer<>(1)));
        verifyNoInteractions(client);
    }

    @Test
    void testPartialFailureKeepsOnlyFailedEntries() throws Exception {
        when(client.putRecords(any(PutRecordsRequest.class))).thenReturn(PutRecordsResponse.builder()
                .failedRecordCount(1)
                .records(
                        PutRecordsResultEntry.builder().shardId("shardId-0").sequenceNumber("1").build(),
                        PutRecordsResultEntry.builder()
                                .errorCode("ProvisionedThroughputExceededException")
                                .errorMessage("Rate exceeded")
                                .build(),
                        PutRecordsResultEntry.builder().shardId("shardId-0").sequenceNumber("2").build())
                .build());
        KinesisDelivery d = delivery(Map.of("data_keys", "log"));
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(10);
        d.addRecord(buffer, record("a"), TS);
        d.addRecord(buffer, record("b"), TS);
        d.addRecord(buffer, record("c"), TS);

        assertEquals(FlushOutcome.RETRY, d.flush(buffer));

        assertEquals(1, buffer.size());
        assertEquals("{\"log\":\"b\"}", text(buffer.entries().get(0)));
        assertEquals(2, d.recordsSent());
        assertEquals(1, d.recordsFailed());
        assertTrue(buffer.payloadBytes() > 0);
    }

    @Test
    void testTransientFailuresAreRetryable() throws Exception {
        KinesisDelivery d = delivery(Map.of());

        when(client.putRecords(any(PutRecordsRequest.class)))
                .thenThrow(ProvisionedThroughputExceededException.builder().message("slow down").build())
                .thenThrow(SdkClientException.create("connection reset"))
                .thenThrow(KinesisException.builder().statusCode(503).message("unavailable").build());

        for (int i = 0; i < 3; i++) {
            RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(1);
            d.addRecord(buffer, record("a"), TS);
            assertEquals(FlushOutcome.RETRY, d.flush(buffer));
            assertEquals(1, buffer.size());
        }
    }

    @Test
    void testPermanentFailureIsError() throws Exception {
        KinesisDelivery d = delivery(Map.of());
        when(client.putRecords(any(PutRecordsRequest.class)))
                .thenThrow(ResourceNotFoundException.builder().statusCode(400).message("no such stream").build());
        RequestBuffer<PutRecordsRequestEntry> buffer = new RequestBuffer<>(1);
        d.addRecord(buffer, record("a"), TS);

        assertEquals(FlushOutcome.ERROR, d.flush(buffer));
    }

    @Test
    void testClassification() {
        assertEquals(FlushOutcome.RETRY, KinesisDelivery.classify(
                KinesisException.builder().statusCode(429).message("throttled").build()));
        assertEquals(FlushOutcome.ERROR, KinesisDelivery.classify(
                KinesisException.builder().statusCode(403).message("denied").build()));
    }

    @Test
    void testCloseReleasesClientAndResources() throws Exception {
        AutoCloseable extra = mock(AutoCloseable.class);
        OutputSettings settings = OutputSettings.from(
                PluginContext.of("out", Map.of("stream", "app-logs", "region", "us-east-1")), 0);
        KinesisDelivery d = new KinesisDelivery(client, settings, JSON, null, List.of(extra));

        d.close();

        verify(client).close();
        verify(extra).close();
    }
}
