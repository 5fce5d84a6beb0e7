/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link MetricsRuntime} selected by {@code metrics.provider}.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        switch (settings.providerId) {
            case "NONE", "NOOP" -> {
                log.info("Metrics disabled (NOOP active).");
                return MetricsRuntime.NOOP;
            }
            case "MICROMETER" -> {
                CompositeMeterRegistry registry = new CompositeMeterRegistry();
                registry.add(new SimpleMeterRegistry());
                log.info("Metrics Runtime initialized (Type: MICROMETER, tags={})", settings.commonTags);
                return new MicrometerMetricsRuntime(registry, "MICROMETER", settings.commonTags, null);
            }
            case "PROMETHEUS" -> {
                PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
                PrometheusScrapeEndpoint endpoint = PrometheusScrapeEndpoint.start(registry, settings.prometheusPort);
                return new MicrometerMetricsRuntime(registry, "PROMETHEUS", settings.commonTags, endpoint);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown metrics.provider '" + settings.providerId + "'. Available options: [NONE, MICROMETER, PROMETHEUS]");
        }
    }
}
