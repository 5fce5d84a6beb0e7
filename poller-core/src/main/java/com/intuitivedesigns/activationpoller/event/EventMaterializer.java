/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.PipelinePayload;
import com.intuitivedesigns.activationpoller.request.ActivationRequest;
import com.intuitivedesigns.activationpoller.settings.ConnectionSettings;
import com.intuitivedesigns.activationpoller.settings.EventSettings;
import com.intuitivedesigns.activationpoller.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns decoded activation records and failed requests into {@link Event}s.
 *
 * <p>Success events carry the record (top level or under the configured target). Failure events
 * carry a {@value #FAILURE_FIELD} field and the {@value #FAILURE_TAG} tag. Both get request
 * metadata unless the metadata target is disabled, then the configured tags and fields.</p>
 */
public final class EventMaterializer {

    private static final Logger log = LoggerFactory.getLogger(EventMaterializer.class);

    public static final String FAILURE_TAG = "_request_failure";
    public static final String FAILURE_FIELD = "request_failure";

    public static final String HEADER_ACTIVATION_ID = "activationId";
    public static final String HEADER_SOURCE = "source";

    private final ConnectionSettings connection;
    private final EventSettings settings;
    private final AnnotationValues annotations;
    private final String localHost;

    public EventMaterializer(ConnectionSettings connection, EventSettings settings) {
        this(connection, settings, new ObjectMapper(), resolveLocalHost());
    }

    EventMaterializer(ConnectionSettings connection, EventSettings settings, ObjectMapper mapper, String localHost) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.annotations = new AnnotationValues(mapper);
        this.localHost = localHost;
    }

    public Event success(Map<String, Object> record, ActivationRequest request, TransportResponse response, double runtimeSeconds) {
        Map<String, Object> body = annotations.normalize(record);

        Event event;
        if (settings.target() != null && !settings.target().isBlank()) {
            event = new Event().set(settings.target(), body);
        } else {
            event = new Event(body);
        }

        applyMetadata(event, request, response, runtimeSeconds);
        decorate(event);
        return event;
    }

    public Event failure(ActivationRequest request, Throwable error, double runtimeSeconds) {
        Event event = new Event();
        applyMetadata(event, request, null, runtimeSeconds);
        event.tag(FAILURE_TAG);

        // Also kept outside metadata so the error survives sinks that drop metadata.
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("request", request.structured());
        failure.put("name", settings.name());
        failure.put("error", String.valueOf(error));
        failure.put("backtrace", backtrace(error));
        failure.put("runtime_seconds", runtimeSeconds);
        event.set(FAILURE_FIELD, failure);

        decorate(event);
        return event;
    }

    /** Wraps an event for the sink; failures get a random id. */
    public PipelinePayload<Event> payload(String activationId, Event event) {
        String id = (activationId == null) ? UUID.randomUUID().toString() : activationId;
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_SOURCE, settings.name());
        if (activationId != null) headers.put(HEADER_ACTIVATION_ID, activationId);
        return new PipelinePayload<>(id, event, headers);
    }

    private void applyMetadata(Event event, ActivationRequest request, TransportResponse response, double runtimeSeconds) {
        String target = settings.metadataTarget();
        if (target == null || target.isBlank()) return;

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", settings.name());
        m.put("hostname", connection.host());
        m.put("host", localHost);
        m.put("request", request.structured());
        m.put("runtime_seconds", runtimeSeconds);

        if (response != null) {
            m.put("code", response.code());
            m.put("response_headers", flattenHeaders(response.headers()));
            m.put("response_message", response.message());
            m.put("times_retried", response.timesRetried());
        }

        event.set(target, m);
    }

    private void decorate(Event event) {
        settings.tags().forEach(event::tag);
        settings.addFields().forEach((field, value) -> {
            if (!event.has(field)) event.set(field, value);
        });
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> out.put(k, String.join(", ", v)));
        return out;
    }

    private static List<String> backtrace(Throwable error) {
        List<String> frames = new ArrayList<>();
        for (StackTraceElement e : error.getStackTrace()) {
            frames.add(e.toString());
        }
        return frames;
    }

    private static String resolveLocalHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name: {}", e.getMessage());
            return "unknown";
        }
    }
}
