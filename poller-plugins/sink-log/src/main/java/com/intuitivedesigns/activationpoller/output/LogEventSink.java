/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.core.PipelinePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Writes each event as a single JSON line through SLF4J, so the logging backend decides where
 * events end up (console, file, shipper).
 */
public final class LogEventSink implements OutputSink<Event> {

    private static final Logger log = LoggerFactory.getLogger(LogEventSink.class);

    public static final String DEFAULT_LOGGER = "activation.events";

    private final Logger events;
    private final ObjectMapper mapper;
    private final LongAdder written = new LongAdder();

    public LogEventSink(String loggerName, ObjectMapper mapper) {
        String name = (loggerName == null || loggerName.isBlank()) ? DEFAULT_LOGGER : loggerName.trim();
        this.events = LoggerFactory.getLogger(name);
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        log.info("LogEventSink active. logger='{}'", name);
    }

    @Override
    public void write(PipelinePayload<Event> payload) throws JsonProcessingException {
        if (payload == null || payload.data() == null) return;
        events.info(render(payload.data()));
        written.increment();
    }

    String render(Event event) throws JsonProcessingException {
        return mapper.writeValueAsString(event.toMap());
    }

    public long writtenTotal() {
        return written.sum();
    }

    @Override
    public void close() {
        log.info("LogEventSink closed after {} events.", written.sum());
    }
}
