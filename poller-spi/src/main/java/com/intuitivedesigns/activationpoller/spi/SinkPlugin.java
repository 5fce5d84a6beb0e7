/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;

/**
 * SPI Definition for event destinations.
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink<Event>> {

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink<Event> create(PollerConfig config, MetricsRuntime metrics) throws Exception;
}
