/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.schedule;

import com.intuitivedesigns.activationpoller.settings.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronScheduleTest {

    @Test
    void fiveFieldExpressionFiresAtSecondZero() {
        CronSchedule cron = CronSchedule.parse("* * * * *", ZoneOffset.UTC);

        Instant next = cron.nextAfter(Instant.parse("2020-03-01T10:15:42Z")).orElseThrow();

        assertEquals(Instant.parse("2020-03-01T10:16:00Z"), next);
    }

    @Test
    void sixFieldExpressionKeepsSeconds() {
        CronSchedule cron = CronSchedule.parse("*/10 * * * * *", ZoneOffset.UTC);

        Instant next = cron.nextAfter(Instant.parse("2020-03-01T10:15:42Z")).orElseThrow();

        assertEquals(Instant.parse("2020-03-01T10:15:50Z"), next);
    }

    @Test
    void trailingZoneOverridesDefault() {
        CronSchedule cron = CronSchedule.parse("0 9 * * * Asia/Tokyo", ZoneOffset.UTC);

        assertEquals(ZoneId.of("Asia/Tokyo"), cron.zone());
        // 09:00 in Tokyo is 00:00 UTC
        Instant next = cron.nextAfter(Instant.parse("2020-03-01T12:00:00Z")).orElseThrow();
        assertEquals(Instant.parse("2020-03-02T00:00:00Z"), next);
    }

    @Test
    void utcSuffixIsAZone() {
        CronSchedule cron = CronSchedule.parse("* * * * * UTC", ZoneId.of("Europe/Rome"));

        assertEquals(ZoneId.of("UTC"), cron.zone());
    }

    @Test
    void dayNamesAreNotMistakenForZones() {
        CronSchedule cron = CronSchedule.parse("0 0 9 * * MON", ZoneOffset.UTC);

        assertEquals(ZoneOffset.UTC, cron.zone());
        // 2020-03-01 is a Sunday
        assertEquals(Instant.parse("2020-03-02T09:00:00Z"),
                cron.nextAfter(Instant.parse("2020-03-01T00:00:00Z")).orElseThrow());
    }

    @Test
    void rejectsInvalidExpressions() {
        assertThrows(ConfigurationException.class, () -> CronSchedule.parse("* * *", ZoneOffset.UTC));
        assertThrows(ConfigurationException.class, () -> CronSchedule.parse("61 * * * *", ZoneOffset.UTC));
        assertThrows(ConfigurationException.class, () -> CronSchedule.parse("  ", ZoneOffset.UTC));
    }
}
