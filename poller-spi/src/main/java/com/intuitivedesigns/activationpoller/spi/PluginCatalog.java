/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

/**
 * Holds the typed registries for every plugin kind.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SinkPlugin> sinks;
    private final ServicePluginRegistry<CodecPlugin> codecs;

    public PluginCatalog(ClassLoader cl) {
        this.sinks = new ServicePluginRegistry<>(SinkPlugin.class, cl);
        this.codecs = new ServicePluginRegistry<>(CodecPlugin.class, cl);
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    public ServicePluginRegistry<CodecPlugin> codecs() {
        return codecs;
    }
}
