/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.plugins;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.output.LogEventSink;
import com.intuitivedesigns.activationpoller.spi.SinkPlugin;

import java.util.Objects;

/**
 * Logs every event as JSON.
 * <p>
 * ID: LOG (default sink)
 */
public final class LogSinkPlugin implements SinkPlugin {

    public static final String ID = "LOG";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<Event> create(PollerConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new LogEventSink(config.getString("sink.log.logger", LogEventSink.DEFAULT_LOGGER), new ObjectMapper());
    }
}
