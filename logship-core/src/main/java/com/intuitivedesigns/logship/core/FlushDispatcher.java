/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.intuitivedesigns.logship.config.ShipperConfig;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each host flush as an independent, retry-bounded delivery task.
 *
 * <p>{@link #submit} never blocks on the network: it hands the batch to a worker
 * pool and returns. Each attempt allocates its own {@link RequestBuffer}, so
 * overlapping flushes never share mutable state. A watchdog cancels tasks that
 * overrun their time budget. The terminal state of every task is logged and
 * counted.</p>
 */
public final class FlushDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlushDispatcher.class);

    // ---- Config keys ----
    public static final String CFG_ATTEMPTS = "flush.attempts";
    public static final String CFG_WORKERS = "flush.workers";
    public static final String CFG_TIMEOUT_MS = "flush.timeout.ms";

    // ---- Defaults ----
    public static final int DEFAULT_ATTEMPTS = 2;
    public static final int DEFAULT_WORKERS = 8;
    public static final long DEFAULT_TIMEOUT_MS = 60_000L;

    // ---- Metric names ----
    static final String M_SUBMITTED = "logship_flush_submitted_total";
    static final String M_ATTEMPTS = "logship_flush_attempts_total";
    static final String M_OK = "logship_flush_ok_total";
    static final String M_ERROR = "logship_flush_error_total";
    static final String M_EXHAUSTED = "logship_flush_retries_exhausted_total";
    static final String M_TIMEOUT = "logship_flush_timeout_total";
    static final String M_FAILED = "logship_flush_task_failed_total";
    static final String M_DURATION = "logship_flush_duration";
    static final String M_INFLIGHT = "logship_flush_inflight";

    private final InstanceRegistry registry;
    private final int maxAttempts;
    private final long timeoutMs;
    private final MetricsRuntime metrics;

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final Set<CompletableFuture<FlushReport>> pending = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object lifecycle = new Object();

    public FlushDispatcher(InstanceRegistry registry,
                           int maxAttempts,
                           int workerThreads,
                           Duration taskTimeout,
                           MetricsRuntime metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");
        Objects.requireNonNull(taskTimeout, "taskTimeout");
        if (taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new IllegalArgumentException("taskTimeout must be > 0");
        }
        this.maxAttempts = maxAttempts;
        this.timeoutMs = taskTimeout.toMillis();
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();

        this.workers = Executors.newFixedThreadPool(workerThreads, new NamedDaemonThreadFactory("logship-flush"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("logship-flush-watchdog"));

        log.info("FlushDispatcher active. attempts={} workers={} timeoutMs={}", maxAttempts, workerThreads, timeoutMs);
    }

    public static FlushDispatcher fromConfig(InstanceRegistry registry, ShipperConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final int attempts = clampInt(config.getInt(CFG_ATTEMPTS, DEFAULT_ATTEMPTS), 1, 100);
        final int workers = clampInt(config.getInt(CFG_WORKERS, DEFAULT_WORKERS), 1, 1_024);
        final long timeoutMs = Math.max(1L, config.getLong(CFG_TIMEOUT_MS, DEFAULT_TIMEOUT_MS));
        return new FlushDispatcher(registry, attempts, workers, Duration.ofMillis(timeoutMs), metrics);
    }

    /**
     * Starts the detached delivery task for one host flush and returns at once.
     *
     * <p>The task's time budget starts when a worker picks it up, not while it waits in the queue.</p>
     *
     * @return completes with the task's terminal state; the host never waits on it
     * @throws RejectedExecutionException after {@link #shutdown}
     */
    public Future<FlushReport> submit(int instanceId, String tag, NormalizedBatch batch) {
        Objects.requireNonNull(batch, "batch");
        final String safeTag = (tag == null) ? "" : tag;
        final CompletableFuture<FlushReport> result = new CompletableFuture<>();
        final FlushTask task = new FlushTask(instanceId, safeTag, batch, result);
        final FutureTask<Void> future = new FutureTask<>(task, null);
        task.future = future;

        synchronized (lifecycle) {
            if (closed.get()) {
                throw new RejectedExecutionException("flush dispatcher is shut down");
            }
            inFlight.incrementAndGet();
            pending.add(result);
            result.whenComplete((r, t) -> {
                pending.remove(result);
                metrics.gauge(M_INFLIGHT, inFlight.decrementAndGet());
            });
            try {
                workers.execute(future);
            } catch (RejectedExecutionException e) {
                result.cancel(false);
                throw e;
            }
        }

        metrics.counter(M_SUBMITTED);
        metrics.gauge(M_INFLIGHT, inFlight.get());
        return result;
    }

    /**
     * One host flush: arms the watchdog, runs the attempt loop and completes the result.
     */
    private final class FlushTask implements Runnable {
        private final int instanceId;
        private final String tag;
        private final NormalizedBatch batch;
        private final CompletableFuture<FlushReport> result;
        private final AtomicInteger attempts = new AtomicInteger(0);

        // Set before the task is handed to the pool
        private Future<?> future;

        private FlushTask(int instanceId, String tag, NormalizedBatch batch, CompletableFuture<FlushReport> result) {
            this.instanceId = instanceId;
            this.tag = tag;
            this.batch = batch;
            this.result = result;
        }

        @Override
        public void run() {
            if (result.isDone()) {
                // Cancelled while queued
                return;
            }
            final long startNs = System.nanoTime();
            final ScheduledFuture<?> guard = armWatchdog(startNs);
            try {
                final FlushOutcome outcome = runWithRetries(instanceId, tag, batch, attempts);
                final FlushReport report = new FlushReport(instanceId, tag, batch.count(), attempts.get(),
                        outcome, false, elapsedMs(startNs));
                if (result.complete(report)) {
                    record(report);
                }
            } catch (Throwable t) {
                if (result.completeExceptionally(t)) {
                    metrics.counter(M_FAILED);
                    log.error("[kinesis {}] flush task failed tag={}", instanceId, tag, t);
                }
            } finally {
                if (guard != null) {
                    guard.cancel(false);
                }
            }
        }

        private ScheduledFuture<?> armWatchdog(long startNs) {
            try {
                return watchdog.schedule(() -> {
                    final FlushReport report = new FlushReport(instanceId, tag, batch.count(), attempts.get(),
                            FlushOutcome.ERROR, true, elapsedMs(startNs));
                    if (result.complete(report)) {
                        future.cancel(true);
                        record(report);
                    }
                }, timeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // Watchdog already stopped by shutdown; the drain deadline bounds this task instead
                log.debug("[kinesis {}] running without watchdog, dispatcher is stopping tag={}", instanceId, tag);
                return null;
            }
        }
    }

    /**
     * The attempt loop: stops on the first outcome other than {@code RETRY}
     * or when the attempt budget is used up.
     */
    FlushOutcome runWithRetries(int instanceId, String tag, NormalizedBatch batch, AtomicInteger attempts) {
        FlushOutcome outcome = FlushOutcome.RETRY;
        for (int i = 0; i < maxAttempts; i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[kinesis {}] flush interrupted before attempt {} tag={}", instanceId, i + 1, tag);
                break;
            }
            attempts.incrementAndGet();
            metrics.counter(M_ATTEMPTS);
            outcome = attempt(registry.get(instanceId), tag, batch.records());
            if (outcome != FlushOutcome.RETRY) {
                break;
            }
            log.debug("[kinesis {}] attempt {}/{} asked for retry tag={}", instanceId, i + 1, maxAttempts, tag);
        }
        return outcome;
    }

    private FlushOutcome attempt(OutputInstance instance, String tag, List<LogRecord> records) {
        return attempt(instance.id(), instance.adapter(), tag, records);
    }

    private <E> FlushOutcome attempt(int instanceId, DeliveryAdapter<E> adapter, String tag, List<LogRecord> records) {
        log.debug("[kinesis {}] found logs with tag: {}", instanceId, tag);

        // Each attempt gets its own buffer, since flushes run concurrently
        final RequestBuffer<E> buffer = new RequestBuffer<>(adapter.maxRecordsPerRequest());

        if (log.isDebugEnabled()) {
            for (int i = 0; i < records.size(); i++) {
                final LogRecord r = records.get(i);
                if (r.isPresent()) {
                    log.debug("[kinesis {}] flush: {} tag={} {}", instanceId, i, tag, r.fields());
                } else {
                    log.debug("[kinesis {}] flush: {} tag={} is null", instanceId, i, tag);
                }
            }
        }

        try {
            int added = 0;
            for (LogRecord r : records) {
                if (!r.isPresent()) {
                    continue;
                }
                final Map<String, Object> fields = r.fields();
                final Instant ts = r.timestamp();
                final FlushOutcome rc = adapter.addRecord(buffer, fields, ts);
                if (rc != FlushOutcome.OK) {
                    return rc;
                }
                added++;
            }

            final FlushOutcome rc = adapter.flush(buffer);
            if (rc == FlushOutcome.OK) {
                log.debug("[kinesis {}] processed {} events with tag {}", instanceId, added, tag);
            }
            return rc;
        } catch (RuntimeException e) {
            log.error("[kinesis {}] delivery adapter {} threw; treating attempt as ERROR tag={}",
                    instanceId, adapter.id(), tag, e);
            return FlushOutcome.ERROR;
        }
    }

    private void record(FlushReport report) {
        metrics.timer(M_DURATION, report.durationMs());
        if (report.timedOut()) {
            metrics.counter(M_TIMEOUT);
            log.error("[kinesis {}] flush timed out after {}ms tag={} records={} attempts={}",
                    report.instanceId(), report.durationMs(), report.tag(), report.records(), report.attempts());
        } else if (report.outcome() == FlushOutcome.OK) {
            metrics.counter(M_OK);
            log.debug("[kinesis {}] flush complete tag={} records={} attempts={}",
                    report.instanceId(), report.tag(), report.records(), report.attempts());
        } else if (report.retriesExhausted()) {
            metrics.counter(M_EXHAUSTED);
            log.warn("[kinesis {}] giving up after {} attempts, records not delivered tag={} records={}",
                    report.instanceId(), report.attempts(), report.tag(), report.records());
        } else {
            metrics.counter(M_ERROR);
            log.error("[kinesis {}] flush failed with a non-retryable error tag={} records={} attempts={}",
                    report.instanceId(), report.tag(), report.records(), report.attempts());
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Stops accepting work and waits for in-flight tasks.
     *
     * @return true if every task finished within {@code drainTimeout}
     */
    public boolean shutdown(Duration drainTimeout) {
        synchronized (lifecycle) {
            if (!closed.compareAndSet(false, true)) {
                return inFlight.get() == 0;
            }
            workers.shutdown();
        }
        log.info("Stop requested. Draining {} in-flight flushes...", inFlight.get());
        boolean drained;
        try {
            drained = workers.awaitTermination(Math.max(0L, drainTimeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Drain timed out; cancelling {} in-flight flushes", inFlight.get());
            workers.shutdownNow();
            for (CompletableFuture<FlushReport> f : List.copyOf(pending)) {
                f.cancel(true);
            }
        }
        watchdog.shutdownNow();
        log.info("FlushDispatcher stopped. drained={}", drained);
        return drained;
    }

    @Override
    public void close() {
        shutdown(Duration.ZERO);
    }

    // --- Helpers ---

    private static long elapsedMs(long startNs) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(0);

        private NamedDaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
