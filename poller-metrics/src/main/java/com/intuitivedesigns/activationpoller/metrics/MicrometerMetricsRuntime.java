/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bridges {@link MetricsRuntime} calls onto a Micrometer registry.
 *
 * Push-style {@link #gauge(String, double)} calls are mapped onto a per-name state holder
 * that Micrometer polls.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private final MeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime(MeterRegistry registry, String type, Map<String, String> commonTags, AutoCloseable onClose) {
        this.registry = registry;
        this.type = type;
        this.onClose = onClose;
        registry.config().commonTags(toTags(commonTags));
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        // computeIfAbsent registers the gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get).register(registry);
            return newState;
        });
        state.set(value);
    }

    @Override
    public void close() {
        try {
            if (onClose != null) onClose.close();
        } catch (Exception ignored) {
            // registry close below still runs
        }
        registry.close();
    }

    static Tags toTags(Map<String, String> input) {
        if (input == null || input.isEmpty()) return Tags.empty();
        List<Tag> out = new ArrayList<>(input.size());
        input.forEach((k, v) -> out.add(Tag.of(k, v)));
        return Tags.of(out);
    }

    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
