/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.plugins;

import com.intuitivedesigns.activationpoller.codec.JsonRecordCodec;
import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.spi.CodecPlugin;

/**
 * ID: JSON (default codec)
 */
public final class JsonCodecPlugin implements CodecPlugin {

    public static final String ID = "JSON";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RecordCodec create(PollerConfig config, MetricsRuntime metrics) {
        return new JsonRecordCodec();
    }
}
