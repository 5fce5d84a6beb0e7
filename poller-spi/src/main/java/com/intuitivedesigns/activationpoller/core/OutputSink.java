/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.core;

/**
 * A pluggable destination for emitted events.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #write(PipelinePayload)} should persist or transmit the event.</li>
 * <li>Implementations may throw to signal failure. The poller logs and counts the failure
 * and carries on with the next event; it never retries.</li>
 * <li>Calls arrive from HTTP completion threads, so implementations must be thread-safe.</li>
 * </ul>
 *
 * @param <T> The type of the event payload.
 */
public interface OutputSink<T> extends AutoCloseable {

    /**
     * Persist or send the payload to the target system.
     *
     * @param payload the envelope
     * @throws Exception if the target system rejects the event
     */
    void write(PipelinePayload<T> payload) throws Exception;

    /**
     * Forces any buffered events to be written to the target system.
     *
     * @throws Exception if the flush fails
     */
    default void flush() throws Exception {
        // no-op by default for non-batching sinks
    }

    /**
     * Returns a unique identifier for this sink instance, used in logs.
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
