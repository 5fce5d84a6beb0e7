/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry for SPI discovery.
 *
 * <p>The ServiceLoader classpath scan runs <b>once</b> in the constructor; lookups are map reads.</p>
 *
 * @param <T> The SPI interface type (e.g., SinkPlugin.class)
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this(spiType, ServiceLoader.load(spiType, cl));
    }

    ServicePluginRegistry(Class<T> spiType, Iterable<T> plugins) {
        this.spiType = spiType;
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName()
                        + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    public T require(String id, String configKeyName) {
        T plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            throw new IllegalArgumentException("No " + spiType.getSimpleName() + " found for '" + configKeyName + "=" + id + "'. "
                    + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }
}
