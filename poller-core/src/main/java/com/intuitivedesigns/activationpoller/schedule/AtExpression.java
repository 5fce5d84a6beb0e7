/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import com.intuitivedesigns.activationpoller.settings.ConfigurationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the absolute time of an {@code at} schedule.
 *
 * <p>Accepted forms: {@code 2000-01-01 00:05:00 +0000}, ISO-8601 offset date-time,
 * ISO-8601 instant, and zone-less {@code 2000-01-01 00:05:00} (interpreted in {@code zone}).</p>
 */
public final class AtExpression {

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss XXX"),
            DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private AtExpression() {}

    public static Instant parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("'at' schedule must not be blank");
        }
        String s = expression.trim();

        for (DateTimeFormatter f : OFFSET_FORMATS) {
            try {
                return OffsetDateTime.parse(s, f).toInstant();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // fall through to zone-less forms
        }
        for (DateTimeFormatter f : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(s, f).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new ConfigurationException("Invalid 'at' time '" + expression + "'. Expected e.g. 2000-01-01 00:05:00 +0000");
    }
}
