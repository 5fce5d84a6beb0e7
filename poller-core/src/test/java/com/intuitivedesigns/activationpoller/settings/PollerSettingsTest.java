/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.settings;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.schedule.ScheduleKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PollerSettingsTest {

    private static Map<String, String> base() {
        Map<String, String> m = new HashMap<>();
        m.put("poller.host", "openwhisk.ng.bluemix.net");
        m.put("poller.principal", "some_user");
        m.put("poller.secret", "some_secret");
        m.put("poller.interval", "60");
        return m;
    }

    private static PollerSettings parse(Map<String, String> m) {
        return PollerSettings.from(PollerConfig.of(m), ZoneOffset.UTC);
    }

    @Test
    void appliesDefaults() {
        PollerSettings s = parse(base());

        assertEquals("_", s.connection().namespace());
        assertEquals(ScheduleKind.INTERVAL, s.schedule().kind());
        assertEquals("openwhisk", s.events().name());
        assertEquals("@metadata", s.events().metadataTarget());
        assertNull(s.events().target());
        assertTrue(s.events().tags().isEmpty());
        assertEquals(HttpSettings.defaults(), s.http());
    }

    @Test
    void readsEventAndHttpOptions() {
        Map<String, String> m = base();
        m.put("poller.namespace", "team_dev");
        m.put("poller.target", "activation");
        m.put("poller.name", "prod-poller");
        m.put("poller.tags", "openwhisk, prod ,,");
        m.put("poller.addField.env", "prod");
        m.put("poller.http.request.timeout.ms", "5000");
        m.put("poller.http.retries", "3");

        PollerSettings s = parse(m);

        assertEquals("team_dev", s.connection().namespace());
        assertEquals("activation", s.events().target());
        assertEquals("prod-poller", s.events().name());
        assertEquals(List.of("openwhisk", "prod"), s.events().tags());
        assertEquals(Map.of("env", "prod"), s.events().addFields());
        assertEquals(Duration.ofSeconds(5), s.http().requestTimeout());
        assertEquals(3, s.http().retries());
    }

    @Test
    void blankMetadataTargetDisablesMetadata() {
        Map<String, String> m = base();
        m.put("poller.metadataTarget", "");

        assertNull(parse(m).events().metadataTarget());
    }

    @Test
    void scheduleReplacesInterval() {
        Map<String, String> m = base();
        m.remove("poller.interval");
        m.put("poller.schedule.cron", "*/5 * * * * UTC");

        assertEquals(ScheduleKind.CRON, parse(m).schedule().kind());
    }

    @Test
    void missingCredentialsFail() {
        for (String key : List.of("poller.host", "poller.principal", "poller.secret")) {
            Map<String, String> m = base();
            m.put(key, "   ");
            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse(m));
            assertTrue(ex.getMessage().contains(key), ex.getMessage());
        }
    }

    @Test
    void invalidHostFails() {
        Map<String, String> m = base();
        m.put("poller.host", "not a host");

        assertThrows(ConfigurationException.class, () -> parse(m));
    }

    @Test
    void malformedNamespaceFailsAtConfigTime() {
        for (String namespace : List.of("my ns", "a/b", "team^dev")) {
            Map<String, String> m = base();
            m.put("poller.namespace", namespace);

            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse(m), namespace);
            assertTrue(ex.getMessage().contains("poller.namespace"), ex.getMessage());
        }
    }

    @Test
    void intervalAndScheduleTogetherFail() {
        Map<String, String> m = base();
        m.put("poller.schedule.every", "5s");

        assertThrows(ConfigurationException.class, () -> parse(m));
    }

    @Test
    void neitherIntervalNorScheduleFails() {
        Map<String, String> m = base();
        m.remove("poller.interval");

        assertThrows(ConfigurationException.class, () -> parse(m));
    }

    @Test
    void secretIsMaskedInToString() {
        assertFalse(parse(base()).connection().toString().contains("some_secret"));
    }
}
