/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

/**
 * The vendor-agnostic contract for observability.
 *
 * Decouples the poller from Micrometer so the SPI compiles without it on the classpath.
 * Every method has a no-op default.
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = () -> null;

    /**
     * Returns the underlying registry (e.g., MeterRegistry) or null.
     * Returns Object to avoid forcing a compile-time dependency on Micrometer.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
