/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.app;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PollerAppTest {

    @Test
    void invalidConfigurationExitsWithOne() {
        PollerConfig bothForms = PollerConfig.of(Map.of(
                "poller.host", "whisk.example",
                "poller.principal", "u",
                "poller.secret", "p",
                "poller.interval", "60",
                "poller.schedule.every", "5s"));

        assertEquals(1, PollerApp.run(bothForms, true));
    }

    @Test
    void singleCycleAgainstUnreachableHostEmitsFailureAndExitsCleanly() {
        PollerConfig unreachable = PollerConfig.of(Map.of(
                "poller.host", "http://127.0.0.1:1",
                "poller.principal", "u",
                "poller.secret", "p",
                "poller.interval", "60",
                "poller.http.connect.timeout.ms", "500",
                "poller.http.retries", "0",
                "sink.type", "LOG"));

        assertEquals(0, PollerApp.run(unreachable, true));
    }

    @Test
    void unknownPluginExitsWithOne() {
        PollerConfig badSink = PollerConfig.of(Map.of(
                "poller.host", "whisk.example",
                "poller.principal", "u",
                "poller.secret", "p",
                "poller.interval", "60",
                "sink.type", "NOPE"));

        assertEquals(1, PollerApp.run(badSink, true));
    }
}
