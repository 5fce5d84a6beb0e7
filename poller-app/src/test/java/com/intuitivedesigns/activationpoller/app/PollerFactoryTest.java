/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.app;

import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PollerFactoryTest {

    private final PollerFactory factory = PollerFactory.fromContextClassLoader();

    @Test
    void defaultsToJsonCodecAndLogSink() throws Exception {
        PollerConfig empty = PollerConfig.of(Map.of());

        RecordCodec codec = factory.createCodec(empty, MetricsRuntime.NOOP);
        OutputSink<Event> sink = factory.createSink(empty, MetricsRuntime.NOOP);

        assertEquals("JSON", codec.id());
        assertEquals("LogEventSink", sink.id());
        sink.close();
    }

    @Test
    void codecIdIsCaseInsensitive() {
        RecordCodec codec = factory.createCodec(PollerConfig.of(Map.of("codec.type", "json_lines")), MetricsRuntime.NOOP);

        assertEquals("JSON_LINES", codec.id());
    }

    @Test
    void unknownSinkListsAvailableOptions() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> factory.createSink(PollerConfig.of(Map.of("sink.type", "ELASTIC")), MetricsRuntime.NOOP));

        assertTrue(ex.getMessage().contains("sink.type=ELASTIC"), ex.getMessage());
        assertTrue(ex.getMessage().contains("LOG"), ex.getMessage());
        assertTrue(ex.getMessage().contains("KAFKA"), ex.getMessage());
    }
}
