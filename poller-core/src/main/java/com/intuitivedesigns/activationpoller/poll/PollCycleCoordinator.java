/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.poll;

import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.event.EventMaterializer;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.request.ActivationRequest;
import com.intuitivedesigns.activationpoller.request.ActivationRequests;
import com.intuitivedesigns.activationpoller.settings.ConnectionSettings;
import com.intuitivedesigns.activationpoller.transport.ActivationTransport;
import com.intuitivedesigns.activationpoller.transport.TransportResponse;
import com.intuitivedesigns.activationpoller.watermark.WatermarkTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * One poll cycle: build the request from the current watermark, dispatch it, then either scan the
 * decoded records (dedup, watermark, emit) or emit a failure event.
 */
public final class PollCycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PollCycleCoordinator.class);

    public static final String ACTIVATION_ID = "activationId";
    public static final String END = "end";

    public static final String M_CYCLES = "poller.cycles";
    public static final String M_EMITTED = "poller.events.emitted";
    public static final String M_DUPLICATE = "poller.events.duplicate";
    public static final String M_DROPPED = "poller.events.dropped";
    public static final String M_REQUEST_FAILURES = "poller.request.failures";
    public static final String M_DECODE_ERRORS = "poller.decode.errors";
    public static final String M_EMIT_ERRORS = "poller.emit.errors";
    public static final String M_LATENCY = "poller.request.latency";
    public static final String M_WATERMARK = "poller.watermark";

    private final ConnectionSettings connection;
    private final WatermarkTracker tracker;
    private final ActivationTransport transport;
    private final RecordCodec codec;
    private final EventMaterializer materializer;
    private final OutputSink<Event> sink;
    private final MetricsRuntime metrics;

    public PollCycleCoordinator(ConnectionSettings connection,
                                WatermarkTracker tracker,
                                ActivationTransport transport,
                                RecordCodec codec,
                                EventMaterializer materializer,
                                OutputSink<Event> sink,
                                MetricsRuntime metrics) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.materializer = Objects.requireNonNull(materializer, "materializer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
    }

    /**
     * Dispatches one fetch and returns without waiting for it. The returned future completes after
     * the outcome has been fully processed.
     */
    public CompletableFuture<FetchOutcome> runOnce() {
        metrics.counter(M_CYCLES);

        final ActivationRequest request = ActivationRequests.build(connection, tracker.watermark());
        log.debug("Fetching activations: {}", request);

        final long started = System.nanoTime();
        CompletableFuture<TransportResponse> call;
        try {
            call = transport.execute(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((response, err) -> {
            long elapsedNanos = System.nanoTime() - started;
            metrics.timer(M_LATENCY, elapsedNanos / 1_000_000L);
            double runtimeSeconds = elapsedNanos / 1_000_000_000.0;

            FetchOutcome outcome = (err == null)
                    ? FetchOutcome.success(response, runtimeSeconds)
                    : FetchOutcome.failure(unwrap(err), runtimeSeconds);
            process(request, outcome);
            return outcome;
        });
    }

    void process(ActivationRequest request, FetchOutcome outcome) {
        if (tracker.isClosed()) {
            log.debug("Poller stopped; discarding {}", outcome);
            return;
        }
        try {
            if (outcome.isSuccess()) {
                onSuccess(request, outcome.response(), outcome.runtimeSeconds());
            } else {
                onFailure(request, outcome.error(), outcome.runtimeSeconds());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing {}", outcome, e);
        }
    }

    private void onSuccess(ActivationRequest request, TransportResponse response, double runtimeSeconds) {
        if (!response.isSuccess()) {
            log.warn("Activation request returned {} {} (url={})", response.code(), response.message(), request.url());
        }

        final Iterator<Map<String, Object>> records;
        try {
            records = codec.decode(response.body());
        } catch (IOException | RuntimeException e) {
            metrics.counter(M_DECODE_ERRORS);
            log.error("Cannot decode activation response (code={}, {} bytes)", response.code(), response.body().length, e);
            return;
        }

        tracker.scan(scan -> {
            int decoded = 0;
            while (true) {
                final Map<String, Object> record;
                try {
                    if (!records.hasNext()) break;
                    record = records.next();
                } catch (RuntimeException e) {
                    metrics.counter(M_DECODE_ERRORS);
                    log.error("Decoding stopped after {} records", decoded, e);
                    break;
                }
                decoded++;

                String id = activationId(record);
                if (id == null) {
                    metrics.counter(M_DROPPED);
                    log.warn("Dropping record without {}: keys={}", ACTIVATION_ID, record.keySet());
                    continue;
                }

                if (!scan.isNovel(id)) {
                    metrics.counter(M_DUPLICATE);
                    log.trace("Skipping activation {} seen in previous cycle", id);
                    continue;
                }

                Object end = record.get(END);
                if (end instanceof Number n) {
                    scan.offerEnd(n.longValue());
                } else {
                    log.debug("Activation {} has no numeric '{}'; watermark unchanged", id, END);
                }

                emit(id, () -> materializer.success(record, request, response, runtimeSeconds));
            }
        });

        metrics.gauge(M_WATERMARK, tracker.watermark());
    }

    private void onFailure(ActivationRequest request, Throwable error, double runtimeSeconds) {
        metrics.counter(M_REQUEST_FAILURES);
        log.error("Activation request failed: {} {}", request.method(), request.url(), error);
        emit(null, () -> materializer.failure(request, error, runtimeSeconds));
    }

    private void emit(String activationId, Supplier<Event> build) {
        try {
            sink.write(materializer.payload(activationId, build.get()));
            metrics.counter(M_EMITTED);
        } catch (Exception e) {
            metrics.counter(M_EMIT_ERRORS);
            log.error("Failed to emit event (activationId={}) to {}", activationId, sink.id(), e);
        }
    }

    private static String activationId(Map<String, Object> record) {
        Object v = record.get(ACTIVATION_ID);
        if (v == null) return null;
        String s = String.valueOf(v);
        return s.isBlank() ? null : s;
    }

    private static Throwable unwrap(Throwable t) {
        return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
    }
}
