/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.PipelinePayload;
import com.intuitivedesigns.activationpoller.request.ActivationRequest;
import com.intuitivedesigns.activationpoller.request.ActivationRequests;
import com.intuitivedesigns.activationpoller.settings.ConnectionSettings;
import com.intuitivedesigns.activationpoller.settings.EventSettings;
import com.intuitivedesigns.activationpoller.transport.TransportResponse;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventMaterializerTest {

    private static final ConnectionSettings CONN = new ConnectionSettings("whisk.example", "_", "some_user", "some_secret");
    private static final ActivationRequest REQUEST = ActivationRequests.build(CONN, 0L);
    private static final TransportResponse RESPONSE =
            new TransportResponse(new byte[0], 202, Map.of("Content-Type", List.of("application/json")), "Accepted", 0);

    private static EventMaterializer materializer(EventSettings settings) {
        return new EventMaterializer(CONN, settings, new ObjectMapper(), "poller-host-1");
    }

    private static Map<String, Object> record() {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put("activationId", "some_id");
        r.put("start", 1476818509288L);
        r.put("end", 1476818509888L);
        r.put("annotations", List.of());
        return r;
    }

    @Test
    @SuppressWarnings("unchecked")
    void successEventCarriesRecordAndMetadata() {
        Event event = materializer(EventSettings.defaults()).success(record(), REQUEST, RESPONSE, 0.25);

        assertEquals("some_id", event.get("activationId"));
        assertEquals(1476818509888L, event.get("end"));

        Map<String, Object> meta = (Map<String, Object>) event.get("@metadata");
        assertEquals("openwhisk", meta.get("name"));
        assertEquals("whisk.example", meta.get("hostname"));
        assertEquals("poller-host-1", meta.get("host"));
        assertEquals(REQUEST.structured(), meta.get("request"));
        assertEquals(0.25, meta.get("runtime_seconds"));
        assertEquals(202, meta.get("code"));
        assertEquals("Accepted", meta.get("response_message"));
        assertEquals(0, meta.get("times_retried"));
        assertEquals(Map.of("Content-Type", "application/json"), meta.get("response_headers"));
    }

    @Test
    void targetNestsTheRecord() {
        EventSettings settings = new EventSettings("openwhisk", "activation", "@metadata", List.of(), Map.of());

        Event event = materializer(settings).success(record(), REQUEST, RESPONSE, 0.1);

        assertFalse(event.has("activationId"));
        assertEquals("some_id", ((Map<?, ?>) event.get("activation")).get("activationId"));
    }

    @Test
    void disabledMetadataTargetOmitsMetadata() {
        EventSettings settings = new EventSettings("openwhisk", null, null, List.of(), Map.of());

        Event event = materializer(settings).success(record(), REQUEST, RESPONSE, 0.1);

        assertFalse(event.has("@metadata"));
    }

    @Test
    void annotationValuesBecomeJsonStrings() {
        Map<String, Object> r = record();
        r.put("annotations", List.of(
                Map.of("key", "a", "value", Map.of("child", "val")),
                Map.of("key", "b", "value", "some_string")));

        Event event = materializer(EventSettings.defaults()).success(r, REQUEST, RESPONSE, 0.1);

        List<?> annotations = (List<?>) event.get("annotations");
        assertEquals(Map.of("key", "a", "value", "{\"child\":\"val\"}"), annotations.get(0));
        assertEquals(Map.of("key", "b", "value", "\"some_string\""), annotations.get(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void failureEventShape() {
        ConnectException error = new ConnectException("Connection refused");

        Event event = materializer(EventSettings.defaults()).failure(REQUEST, error, 1.5);

        assertEquals(List.of(EventMaterializer.FAILURE_TAG), event.tags());
        Map<String, Object> failure = (Map<String, Object>) event.get(EventMaterializer.FAILURE_FIELD);
        assertEquals(REQUEST.structured(), failure.get("request"));
        assertEquals("openwhisk", failure.get("name"));
        assertEquals("java.net.ConnectException: Connection refused", failure.get("error"));
        assertFalse(((List<?>) failure.get("backtrace")).isEmpty());
        assertEquals(1.5, failure.get("runtime_seconds"));

        Map<String, Object> meta = (Map<String, Object>) event.get("@metadata");
        assertEquals("openwhisk", meta.get("name"));
        assertFalse(meta.containsKey("code"));
        assertFalse(meta.containsKey("response_headers"));
    }

    @Test
    void decorationAddsTagsAndMissingFields() {
        EventSettings settings = new EventSettings("openwhisk", null, "@metadata",
                List.of("openwhisk", "prod"), Map.of("env", "prod", "activationId", "ignored"));

        Event event = materializer(settings).success(record(), REQUEST, RESPONSE, 0.1);

        assertEquals(List.of("openwhisk", "prod"), event.tags());
        assertEquals("prod", event.get("env"));
        assertEquals("some_id", event.get("activationId"));
    }

    @Test
    void payloadUsesActivationIdOrRandomId() {
        EventMaterializer m = materializer(EventSettings.defaults());

        PipelinePayload<Event> ok = m.payload("some_id", new Event());
        assertEquals("some_id", ok.id());
        assertEquals("some_id", ok.metadata().get(EventMaterializer.HEADER_ACTIVATION_ID));

        PipelinePayload<Event> failed = m.payload(null, new Event());
        assertNotNull(failed.id());
        assertFalse(failed.metadata().containsKey(EventMaterializer.HEADER_ACTIVATION_ID));
    }
}
