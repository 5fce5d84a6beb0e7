/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePayloadTest {

    @Test
    void testImmutability() {
        Map<String, String> meta = new HashMap<>();
        meta.put("source", "openwhisk");

        PipelinePayload<String> payload = new PipelinePayload<>("activation-1", "body", meta);
        meta.put("mutated", "true");

        assertEquals("activation-1", payload.id());
        assertEquals("body", payload.data());
        assertEquals(Map.of("source", "openwhisk"), payload.metadata());
        assertThrows(UnsupportedOperationException.class, () -> payload.metadata().put("x", "y"));
    }

    @Test
    void testWithHeader() {
        PipelinePayload<String> original = new PipelinePayload<>("id", "data", Map.of());

        PipelinePayload<String> updated = original.withHeader("namespace", "guest");

        assertNotSame(original, updated);
        assertTrue(original.metadata().isEmpty());
        assertEquals("guest", updated.metadata().get("namespace"));
        assertEquals(original.timestamp(), updated.timestamp());
    }

    @Test
    void testNullIdRejected() {
        assertThrows(NullPointerException.class, () -> new PipelinePayload<>(null, "data", Map.of()));
    }
}
