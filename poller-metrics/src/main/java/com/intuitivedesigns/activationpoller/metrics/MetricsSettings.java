/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

import com.intuitivedesigns.activationpoller.config.PollerConfig;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(PollerConfig config) {
        Objects.requireNonNull(config, "config");

        String provider = config.getString(KEY_PROVIDER, DEFAULT_PROVIDER);
        provider = (provider == null || provider.isBlank())
                ? DEFAULT_PROVIDER
                : provider.trim().toUpperCase(Locale.ROOT);

        // Blank tag keys/values are skipped; Micrometer rejects them.
        Map<String, String> tags = new LinkedHashMap<>();
        config.withPrefix(KEY_TAG_PREFIX).forEach((k, v) -> {
            if (!k.isBlank() && v != null && !v.isBlank()) {
                tags.put(k.trim(), v.trim());
            }
        });

        int port = config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT);
        port = Math.max(1, Math.min(65_535, port));

        return new MetricsSettings(provider, Map.copyOf(tags), port);
    }

    @Override
    public String toString() {
        return "MetricsSettings{providerId='" + providerId + "', commonTags=" + commonTags
                + ", prometheusPort=" + prometheusPort + '}';
    }
}
