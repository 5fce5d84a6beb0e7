/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a task according to one {@link ScheduleSpec} on a single daemon worker thread.
 *
 * <p>Ticks never overlap. The task is expected to return quickly (it only dispatches I/O);
 * an exception thrown by a tick is logged and does not cancel later ticks.</p>
 */
public final class PollScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    static final Duration EVERY_FIRST_DELAY = Duration.ofMillis(10);
    private static final String THREAD_NAME = "activation-poller-scheduler";

    private final ScheduleSpec spec;
    private final Runnable task;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();
    private volatile ScheduledExecutorService executor;

    // Last cron fire time handed to the executor; guards against double fires when a tick runs early.
    private volatile Instant lastCronFire;

    public PollScheduler(ScheduleSpec spec, Runnable task) {
        this(spec, task, Clock.systemDefaultZone());
    }

    public PollScheduler(ScheduleSpec spec, Runnable task, Clock clock) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.task = Objects.requireNonNull(task, "task");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;

        ScheduledExecutorService ex = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory(THREAD_NAME));
        this.executor = ex;

        switch (spec.kind()) {
            case INTERVAL -> pending.set(ex.scheduleWithFixedDelay(this::safeTick,
                    0L, spec.duration().toMillis(), TimeUnit.MILLISECONDS));
            case EVERY -> pending.set(ex.scheduleAtFixedRate(this::safeTick,
                    EVERY_FIRST_DELAY.toMillis(), spec.duration().toMillis(), TimeUnit.MILLISECONDS));
            case IN -> pending.set(ex.schedule(this::safeTick, spec.duration().toMillis(), TimeUnit.MILLISECONDS));
            case AT -> scheduleAt(ex);
            case CRON -> scheduleNextCron();
        }

        log.info("Scheduler started: {}", spec);
    }

    /**
     * Cancels pending and future ticks and releases the worker thread. A tick already running is
     * interrupted but in-flight HTTP calls it dispatched are left to complete on their own.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        ScheduledFuture<?> f = pending.getAndSet(null);
        if (f != null) f.cancel(false);

        ScheduledExecutorService ex = executor;
        if (ex != null) ex.shutdownNow();

        log.info("Scheduler stopped: {}", spec);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }

    private void scheduleAt(ScheduledExecutorService ex) {
        long delayMs = Duration.between(clock.instant(), spec.instant()).toMillis();
        if (delayMs < 0) {
            log.warn("'at' time {} is in the past; polling once now", spec.instant());
            delayMs = 0;
        }
        pending.set(ex.schedule(this::safeTick, delayMs, TimeUnit.MILLISECONDS));
    }

    private void scheduleNextCron() {
        if (!running.get()) return;

        Instant now = clock.instant();
        Instant base = (lastCronFire != null && lastCronFire.isAfter(now)) ? lastCronFire : now;
        Optional<Instant> next = spec.cron().nextAfter(base);
        if (next.isEmpty()) {
            log.warn("Cron '{}' has no future fire time; scheduler idle", spec.cron());
            return;
        }

        lastCronFire = next.get();
        long delayMs = Math.max(0L, Duration.between(now, next.get()).toMillis());
        log.debug("Next cron poll at {} (in {}ms)", next.get(), delayMs);

        try {
            pending.set(executor.schedule(() -> {
                safeTick();
                scheduleNextCron();
            }, delayMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            // stop() raced with rescheduling
            log.debug("Cron reschedule rejected; scheduler is stopping");
        }
    }

    private void safeTick() {
        if (!running.get()) return;
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled poll failed", e);
        }
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
