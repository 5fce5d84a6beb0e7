/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.watermark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Watermark and dedup state shared by overlapping poll cycles.
 *
 * <p>The watermark is the {@code since} value of the next request. It starts at construction
 * time and only moves forward. The Seen-ID Set holds the ids returned by the most recent
 * committed cycle and is replaced wholesale by each commit.</p>
 *
 * <p>All reads and commits go through one lock, so a scan never interleaves with another.</p>
 */
public final class WatermarkTracker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WatermarkTracker.class);

    /** Upper bound on an activation's duration; the window is rewound by this much. */
    public static final long MAX_ACTIVATION_MILLIS = 300_000L;

    private final ReentrantLock lock = new ReentrantLock();

    private long watermark;
    private Set<String> seenIds = Set.of();
    private boolean closed;

    public WatermarkTracker() {
        this(System.currentTimeMillis());
    }

    public WatermarkTracker(long initialWatermark) {
        this.watermark = initialWatermark;
    }

    public long watermark() {
        lock.lock();
        try {
            return watermark;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> seenIds() {
        lock.lock();
        try {
            return seenIds;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one decode-and-commit step under the lock. When {@code body} returns, normally or by
     * exception, the ids it saw replace the Seen-ID Set and the highest offered candidate is
     * committed if it is above the current watermark. After {@link #close()} nothing is committed.
     */
    public void scan(Consumer<CycleScan> body) {
        Objects.requireNonNull(body, "body");
        lock.lock();
        try {
            CycleScan scan = new CycleScan(seenIds, watermark);
            try {
                body.accept(scan);
            } finally {
                commit(scan);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    private void commit(CycleScan scan) {
        if (closed) {
            log.debug("Tracker closed; discarding scan of {} ids", scan.collected.size());
            return;
        }
        seenIds = Set.copyOf(scan.collected);
        if (scan.candidate > watermark) {
            log.debug("Watermark advanced {} -> {}", watermark, scan.candidate);
            watermark = scan.candidate;
        }
    }

    /** Per-cycle view handed to {@link #scan(Consumer)}. Valid only inside the scan. */
    public static final class CycleScan {

        private final Set<String> previous;
        private final Set<String> collected = new HashSet<>();
        private long candidate;

        private CycleScan(Set<String> previous, long watermark) {
            this.previous = previous;
            this.candidate = watermark;
        }

        /** Records {@code id} for this cycle and reports whether the previous cycle missed it. */
        public boolean isNovel(String id) {
            collected.add(id);
            return !previous.contains(id);
        }

        /** Offers a record's end time; the watermark candidate is {@code end - MAX_ACTIVATION_MILLIS}. */
        public void offerEnd(long end) {
            long c = end - MAX_ACTIVATION_MILLIS;
            if (c > candidate) candidate = c;
        }

        public long candidate() {
            return candidate;
        }

        public int collectedCount() {
            return collected.size();
        }
    }
}
