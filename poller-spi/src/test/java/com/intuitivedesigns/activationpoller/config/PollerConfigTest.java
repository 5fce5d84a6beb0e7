/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.config;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PollerConfigTest {

    @Test
    void typedGettersFallBackOnBadValues() {
        PollerConfig config = PollerConfig.of(Map.of(
                "poller.http.retries", "3",
                "poller.interval", "abc",
                "poller.flag", " true "
        ));

        assertEquals(3, config.getInt("poller.http.retries", 1));
        assertEquals(60L, config.getLong("poller.interval", 60L));
        assertTrue(config.getBoolean("poller.flag", false));
        assertEquals("fallback", config.getString("missing", "fallback"));
    }

    @Test
    void withPrefixStripsAndSortsKeys() {
        PollerConfig config = PollerConfig.of(Map.of(
                "poller.schedule.every", "5s",
                "poller.schedule.cron", "* * * * *",
                "poller.schedule.", "ignored",
                "poller.host", "example.com"
        ));

        Map<String, String> schedule = config.withPrefix("poller.schedule.");

        assertEquals(2, schedule.size());
        assertEquals(java.util.List.of("cron", "every"), java.util.List.copyOf(schedule.keySet()));
    }

    @Test
    void fromPropertiesCopiesSource() {
        Properties p = new Properties();
        p.setProperty("poller.host", "a");
        PollerConfig config = PollerConfig.fromProperties(p);
        p.setProperty("poller.host", "b");

        assertEquals("a", config.getString("poller.host", null));
        assertTrue(config.hasPath("poller.host"));
    }
}
