/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.app;

import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.spi.CodecPlugin;
import com.intuitivedesigns.activationpoller.spi.PipelinePlugin;
import com.intuitivedesigns.activationpoller.spi.PluginCatalog;
import com.intuitivedesigns.activationpoller.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves the codec and sink named in configuration through the plugin catalog.
 */
public final class PollerFactory {

    private static final Logger log = LoggerFactory.getLogger(PollerFactory.class);

    public static final String KEY_CODEC_TYPE = "codec.type";
    public static final String KEY_SINK_TYPE = "sink.type";

    public static final String DEFAULT_CODEC = "JSON";
    public static final String DEFAULT_SINK = "LOG";

    private final PluginCatalog catalog;

    public PollerFactory(PluginCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public static PollerFactory fromContextClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return new PollerFactory(new PluginCatalog(ctx != null ? ctx : PollerFactory.class.getClassLoader()));
    }

    public RecordCodec createCodec(PollerConfig config, MetricsRuntime metrics) {
        final String id = normalizeId(config.getString(KEY_CODEC_TYPE, DEFAULT_CODEC), DEFAULT_CODEC);
        final CodecPlugin plugin = catalog.codecs().require(id, KEY_CODEC_TYPE);
        return createSafe(plugin, config, metrics, "Codec");
    }

    public OutputSink<Event> createSink(PollerConfig config, MetricsRuntime metrics) {
        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = catalog.sinks().require(id, KEY_SINK_TYPE);
        return createSafe(plugin, config, metrics, "Sink");
    }

    public void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Codecs: {}", catalog.codecs().availableIds());
        log.info("  Sinks:  {}", catalog.sinks().availableIds());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin,
                                    PollerConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
