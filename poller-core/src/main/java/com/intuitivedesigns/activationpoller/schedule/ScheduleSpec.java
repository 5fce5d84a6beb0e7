/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import com.intuitivedesigns.activationpoller.settings.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * The single validated triggering policy of a poller.
 *
 * <p>Built either from the deprecated interval or from exactly one schedule key; the parsed
 * form is computed once here so the scheduler never sees an invalid expression.</p>
 */
public final class ScheduleSpec {

    private static final String INVALID_SCHEDULE =
            "Invalid config. schedule must contain exactly one of the following keys - cron, at, every or in";

    private final ScheduleKind kind;
    private final String expression;
    private final Duration duration;
    private final Instant instant;
    private final CronSchedule cron;

    private ScheduleSpec(ScheduleKind kind, String expression, Duration duration, Instant instant, CronSchedule cron) {
        this.kind = kind;
        this.expression = expression;
        this.duration = duration;
        this.instant = instant;
        this.cron = cron;
    }

    public static ScheduleSpec interval(long seconds) {
        return interval(BigDecimal.valueOf(seconds));
    }

    /** Fractional seconds are kept to millisecond precision. */
    public static ScheduleSpec interval(BigDecimal seconds) {
        Objects.requireNonNull(seconds, "seconds");
        final long millis;
        try {
            millis = seconds.movePointRight(3).setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Invalid config. interval is too large: " + seconds.toPlainString() + "s", e);
        }
        if (millis <= 0) {
            throw new ConfigurationException("Invalid config. interval must be a positive number of seconds, got " + seconds.toPlainString());
        }
        return new ScheduleSpec(ScheduleKind.INTERVAL, seconds.stripTrailingZeros().toPlainString(), Duration.ofMillis(millis), null, null);
    }

    public static ScheduleSpec of(ScheduleKind kind, String expression) {
        return of(kind, expression, ZoneId.systemDefault());
    }

    public static ScheduleSpec of(ScheduleKind kind, String expression, ZoneId zone) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case INTERVAL -> interval(parseSeconds(expression));
            case CRON -> new ScheduleSpec(kind, expression, null, null, CronSchedule.parse(expression, zone));
            case EVERY, IN -> new ScheduleSpec(kind, expression, DurationExpression.parse(expression), null, null);
            case AT -> new ScheduleSpec(kind, expression, null, AtExpression.parse(expression, zone), null);
        };
    }

    /**
     * Applies the interval/schedule exclusivity rules.
     *
     * @param interval raw {@code interval} value, or null when absent
     * @param schedule {@code schedule} entries keyed by kind, empty when absent
     */
    public static ScheduleSpec resolve(String interval, Map<String, String> schedule, ZoneId zone) {
        boolean hasInterval = interval != null && !interval.isBlank();
        boolean hasSchedule = schedule != null && !schedule.isEmpty();

        if (!hasInterval && !hasSchedule) {
            throw new ConfigurationException("Invalid config. Neither interval nor schedule was specified.");
        }
        if (hasInterval && hasSchedule) {
            throw new ConfigurationException("Invalid config. Specify only interval or schedule. Not both.");
        }
        if (hasInterval) {
            return interval(parseSeconds(interval));
        }

        if (schedule.size() != 1) {
            throw new ConfigurationException(INVALID_SCHEDULE + ", got " + schedule.keySet());
        }
        Map.Entry<String, String> entry = schedule.entrySet().iterator().next();
        ScheduleKind kind = ScheduleKind.fromKey(entry.getKey())
                .orElseThrow(() -> new ConfigurationException(INVALID_SCHEDULE + ", got '" + entry.getKey() + "'"));
        return of(kind, entry.getValue(), zone);
    }

    public ScheduleKind kind() {
        return kind;
    }

    public String expression() {
        return expression;
    }

    /** Period for INTERVAL and EVERY, delay for IN. */
    public Duration duration() {
        return duration;
    }

    /** Fire time for AT. */
    public Instant instant() {
        return instant;
    }

    /** Parsed expression for CRON. */
    public CronSchedule cron() {
        return cron;
    }

    @Override
    public String toString() {
        return kind == ScheduleKind.INTERVAL
                ? "interval=" + expression + "s"
                : "schedule{" + kind.key() + "=" + expression + "}";
    }

    private static BigDecimal parseSeconds(String raw) {
        if (raw == null) {
            throw new ConfigurationException("Invalid config. interval must not be empty");
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid config. interval must be a number of seconds, got '" + raw + "'", e);
        }
    }
}
