/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFactoryTest {

    @Test
    void defaultsToNoop() {
        MetricsRuntime runtime = MetricsFactory.init(MetricsSettings.from(PollerConfig.of(Map.of())));

        assertSame(MetricsRuntime.NOOP, runtime);
        assertFalse(runtime.enabled());
        runtime.counter("poller.cycles");
    }

    @Test
    void micrometerRecordsCountersGaugesAndTags() {
        MetricsSettings settings = MetricsSettings.from(PollerConfig.of(Map.of(
                "metrics.provider", "micrometer",
                "metrics.tag.env", "test",
                "metrics.tag.blank", " "
        )));
        assertEquals(Map.of("env", "test"), settings.commonTags);

        try (MetricsRuntime runtime = MetricsFactory.init(settings)) {
            assertTrue(runtime.enabled());
            assertEquals("MICROMETER", runtime.type());

            runtime.counter("poller.events.emitted", 2.0);
            runtime.counter("poller.events.emitted");
            runtime.counter("poller.events.emitted", 0.0);
            runtime.gauge("poller.watermark", 5.0);
            runtime.gauge("poller.watermark", 7.0);
            runtime.timer("poller.request.latency", 12L);

            MeterRegistry registry = (MeterRegistry) runtime.registry();
            assertEquals(3.0, registry.get("poller.events.emitted").tag("env", "test").counter().count());
            assertEquals(7.0, registry.get("poller.watermark").gauge().value());
            assertEquals(1L, registry.get("poller.request.latency").timer().count());
        }
    }

    @Test
    void unknownProviderIsRejected() {
        MetricsSettings settings = MetricsSettings.from(PollerConfig.of(Map.of("metrics.provider", "statsd")));
        assertThrows(IllegalArgumentException.class, () -> MetricsFactory.init(settings));
    }
}
