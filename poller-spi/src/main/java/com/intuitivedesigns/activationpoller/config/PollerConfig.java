/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flat key/value configuration for the poller.
 * Loads from -Dpoller.config.path or ENV 'POLLER_CONFIG_PATH'.
 */
public final class PollerConfig {

    private static final Logger log = LoggerFactory.getLogger(PollerConfig.class);

    public static final String PATH_PROPERTY = "poller.config.path";
    public static final String PATH_ENV = "POLLER_CONFIG_PATH";

    private final Properties props;

    private PollerConfig(Properties props) {
        this.props = props;
    }

    /**
     * Loads the file named by the system property, falling back to the environment variable.
     * A missing path yields an empty config (validation reports the missing keys later).
     */
    public static PollerConfig load() {
        String path = System.getProperty(PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/poller.properties", PATH_PROPERTY);
            return new PollerConfig(new Properties());
        }

        log.info("Loading configuration from: {}", path);
        Properties loaded = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            loaded.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties.", loaded.size());
        return new PollerConfig(loaded);
    }

    public static PollerConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new PollerConfig(copy);
    }

    public static PollerConfig of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Properties p = new Properties();
        values.forEach((k, v) -> {
            if (k != null && v != null) p.setProperty(k, String.valueOf(v));
        });
        return new PollerConfig(p);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Returns every entry below {@code prefix} with the prefix stripped, in key order.
     * {@code withPrefix("poller.schedule.")} on {@code poller.schedule.cron=...} yields {@code cron -> ...}.
     */
    public Map<String, String> withPrefix(String prefix) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String name : new TreeSet<>(props.stringPropertyNames())) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.put(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return out;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
