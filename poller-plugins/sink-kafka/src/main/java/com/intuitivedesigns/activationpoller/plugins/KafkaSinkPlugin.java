/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.plugins;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.output.KafkaEventSink;
import com.intuitivedesigns.activationpoller.spi.SinkPlugin;

/**
 * ID: KAFKA
 */
public final class KafkaSinkPlugin implements SinkPlugin {

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<Event> create(PollerConfig config, MetricsRuntime metrics) {
        return KafkaEventSink.fromConfig(config, metrics);
    }
}
