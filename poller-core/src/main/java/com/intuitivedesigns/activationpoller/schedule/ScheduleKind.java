/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import java.util.Optional;

/**
 * Triggering policies. {@link #INTERVAL} comes from the deprecated {@code poller.interval} key,
 * the rest from {@code poller.schedule.<key>}.
 */
public enum ScheduleKind {
    INTERVAL(null, true),
    CRON("cron", true),
    EVERY("every", true),
    AT("at", false),
    IN("in", false);

    private final String key;
    private final boolean recurring;

    ScheduleKind(String key, boolean recurring) {
        this.key = key;
        this.recurring = recurring;
    }

    /** Config key below {@code poller.schedule.}, or null for {@link #INTERVAL}. */
    public String key() {
        return key;
    }

    public boolean recurring() {
        return recurring;
    }

    /** Exact, case-sensitive match on {@code cron}, {@code every}, {@code at} or {@code in}. */
    public static Optional<ScheduleKind> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (ScheduleKind kind : values()) {
            if (kind.key != null && kind.key.equals(key)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
