/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;

/**
 * SPI Definition for response body codecs.
 */
public interface CodecPlugin extends PipelinePlugin<RecordCodec> {

    @Override
    default PluginKind kind() {
        return PluginKind.CODEC;
    }

    @Override
    RecordCodec create(PollerConfig config, MetricsRuntime metrics) throws Exception;
}
