/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import com.intuitivedesigns.activationpoller.settings.ConfigurationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Optional;

/**
 * A cron expression bound to a time zone.
 *
 * <p>Accepts five fields (minute precision, fires at second 0) or six fields (leading seconds),
 * optionally followed by a zone id: {@code * * * * * UTC}, {@code 0 0/15 * * * * Europe/Rome}.
 * Without a zone the system default applies.</p>
 */
public final class CronSchedule {

    private final String source;
    private final CronExpression expression;
    private final ZoneId zone;

    private CronSchedule(String source, CronExpression expression, ZoneId zone) {
        this.source = source;
        this.expression = expression;
        this.zone = zone;
    }

    public static CronSchedule parse(String source) {
        return parse(source, ZoneId.systemDefault());
    }

    public static CronSchedule parse(String source, ZoneId defaultZone) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("'cron' schedule must not be blank");
        }
        String[] tokens = source.trim().split("\\s+");

        ZoneId zone = defaultZone;
        if (tokens.length > 5) {
            Optional<ZoneId> trailing = zoneOf(tokens[tokens.length - 1]);
            if (trailing.isPresent()) {
                zone = trailing.get();
                tokens = Arrays.copyOf(tokens, tokens.length - 1);
            }
        }

        String fields = switch (tokens.length) {
            case 5 -> "0 " + String.join(" ", tokens);
            case 6 -> String.join(" ", tokens);
            default -> throw new ConfigurationException(
                    "Invalid cron '" + source + "': expected 5 or 6 fields plus an optional time zone");
        };

        try {
            return new CronSchedule(source, CronExpression.parse(fields), zone);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron '" + source + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return the first fire time strictly after {@code after}, or empty if the expression never fires again
     */
    public Optional<Instant> nextAfter(Instant after) {
        ZonedDateTime next = expression.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return source;
    }

    private static Optional<ZoneId> zoneOf(String token) {
        // Only a token with letters can name a zone
        if (token.chars().noneMatch(Character::isLetter)) return Optional.empty();
        try {
            return Optional.of(ZoneId.of(token));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
