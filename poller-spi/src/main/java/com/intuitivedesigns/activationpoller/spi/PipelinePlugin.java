/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;

/**
 * Common factory contract for everything discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component type the plugin builds
 */
public interface PipelinePlugin<T> {

    String id();          // e.g. "LOG", "KAFKA", "JSON"

    PluginKind kind();

    T create(PollerConfig config, MetricsRuntime metrics) throws Exception;
}
