/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller;

import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.event.EventMaterializer;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.poll.FetchOutcome;
import com.intuitivedesigns.activationpoller.poll.PollCycleCoordinator;
import com.intuitivedesigns.activationpoller.schedule.PollScheduler;
import com.intuitivedesigns.activationpoller.settings.PollerSettings;
import com.intuitivedesigns.activationpoller.transport.ActivationTransport;
import com.intuitivedesigns.activationpoller.transport.HttpTransport;
import com.intuitivedesigns.activationpoller.watermark.WatermarkTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires settings, transport, codec and sink into a scheduled poller.
 *
 * <p>Watermark and dedup state live only as long as this instance.</p>
 */
public final class ActivationPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActivationPoller.class);

    private final PollerSettings settings;
    private final WatermarkTracker tracker;
    private final ActivationTransport transport;
    private final OutputSink<Event> sink;
    private final PollCycleCoordinator coordinator;
    private final PollScheduler scheduler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ActivationPoller(PollerSettings settings,
                            ActivationTransport transport,
                            RecordCodec codec,
                            OutputSink<Event> sink,
                            MetricsRuntime metrics) {
        this(settings, new WatermarkTracker(), transport, codec, sink, metrics);
    }

    ActivationPoller(PollerSettings settings,
                     WatermarkTracker tracker,
                     ActivationTransport transport,
                     RecordCodec codec,
                     OutputSink<Event> sink,
                     MetricsRuntime metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sink = Objects.requireNonNull(sink, "sink");

        EventMaterializer materializer = new EventMaterializer(settings.connection(), settings.events());
        this.coordinator = new PollCycleCoordinator(
                settings.connection(), tracker, transport, codec, materializer, sink, metrics);
        this.scheduler = new PollScheduler(settings.schedule(), this::tick);
    }

    /**
     * Validates {@code config} and builds a poller on the default HTTP transport.
     *
     * @throws com.intuitivedesigns.activationpoller.settings.ConfigurationException on invalid configuration
     */
    public static ActivationPoller create(PollerConfig config,
                                          RecordCodec codec,
                                          OutputSink<Event> sink,
                                          MetricsRuntime metrics) {
        PollerSettings settings = PollerSettings.from(config);
        return new ActivationPoller(settings, new HttpTransport(settings.http()), codec, sink, metrics);
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Poller has been stopped and cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) return;

        log.info("Starting activation poller: {} namespace={} {}",
                settings.connection().host(), settings.connection().namespace(), settings.schedule());
        scheduler.start();
    }

    /** Runs a single cycle outside the schedule. */
    public CompletableFuture<FetchOutcome> runOnce() {
        return coordinator.runOnce();
    }

    /** Stops scheduling and releases the transport and sink. Cycles still in flight commit nothing. */
    public void stop() {
        boolean wasRunning = running.getAndSet(false);
        if (!closed.compareAndSet(false, true)) return;

        log.info("Stopping activation poller...");
        if (wasRunning) scheduler.stop();
        tracker.close();
        safeClose(transport, "transport");
        safeClose(sink, "sink");
        log.info("Activation poller stopped. Last watermark={}", tracker.watermark());
    }

    public boolean isRunning() {
        return running.get();
    }

    public long watermark() {
        return tracker.watermark();
    }

    public PollerSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        stop();
    }

    private void tick() {
        coordinator.runOnce();
    }

    private static void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
