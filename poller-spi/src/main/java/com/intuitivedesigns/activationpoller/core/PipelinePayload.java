/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The envelope handed to sinks.
 *
 * @param id Correlation ID (the activation id for decoded records, a random UUID for failure events).
 * @param data The payload content.
 * @param timestamp Time the poller produced the envelope.
 * @param metadata Routing context (source name, namespace).
 */
public record PipelinePayload<T>(
        String id,
        T data,
        Instant timestamp,
        Map<String, String> metadata
) {

    public PipelinePayload {
        Objects.requireNonNull(id, "PipelinePayload id cannot be null");
        if (timestamp == null) timestamp = Instant.now();

        // Ensure metadata is immutable and never null
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public PipelinePayload(String id, T data, Map<String, String> metadata) {
        this(id, data, Instant.now(), metadata);
    }

    public static <T> PipelinePayload<T> of(T data) {
        return new PipelinePayload<>(UUID.randomUUID().toString(), data, Instant.now(), Map.of());
    }

    public <R> PipelinePayload<R> withData(R newData) {
        return new PipelinePayload<>(id, newData, timestamp, metadata);
    }

    public PipelinePayload<T> withHeader(String key, String value) {
        Map<String, String> newMeta = new HashMap<>(this.metadata);
        newMeta.put(key, value);
        return new PipelinePayload<>(id, data, timestamp, newMeta);
    }
}
