/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.settings;

import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.request.ActivationRequests;
import com.intuitivedesigns.activationpoller.schedule.ScheduleSpec;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated poller configuration. {@link #from(PollerConfig)} is the only place raw keys are read;
 * everything downstream receives typed, checked values.
 */
public record PollerSettings(ConnectionSettings connection,
                             ScheduleSpec schedule,
                             EventSettings events,
                             HttpSettings http) {

    public static final String PREFIX = "poller.";
    public static final String HOST = PREFIX + "host";
    public static final String PRINCIPAL = PREFIX + "principal";
    public static final String SECRET = PREFIX + "secret";
    public static final String NAMESPACE = PREFIX + "namespace";
    public static final String INTERVAL = PREFIX + "interval";
    public static final String SCHEDULE_PREFIX = PREFIX + "schedule.";
    public static final String TARGET = PREFIX + "target";
    public static final String METADATA_TARGET = PREFIX + "metadataTarget";
    public static final String NAME = PREFIX + "name";
    public static final String TAGS = PREFIX + "tags";
    public static final String ADD_FIELD_PREFIX = PREFIX + "addField.";
    public static final String CONNECT_TIMEOUT_MS = PREFIX + "http.connect.timeout.ms";
    public static final String REQUEST_TIMEOUT_MS = PREFIX + "http.request.timeout.ms";
    public static final String RETRIES = PREFIX + "http.retries";

    public PollerSettings {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(http, "http");
    }

    public static PollerSettings from(PollerConfig config) {
        return from(config, ZoneId.systemDefault());
    }

    /**
     * @throws ConfigurationException on any missing or invalid value
     */
    public static PollerSettings from(PollerConfig config, ZoneId zone) {
        Objects.requireNonNull(config, "config");

        String host = required(config, HOST);
        validateHost(host);

        ConnectionSettings connection = new ConnectionSettings(
                host,
                trimToNull(config.getString(NAMESPACE, null)),
                required(config, PRINCIPAL),
                required(config, SECRET));
        validateNamespace(connection);

        ScheduleSpec schedule = ScheduleSpec.resolve(
                trimToNull(config.getString(INTERVAL, null)),
                config.withPrefix(SCHEDULE_PREFIX),
                zone);

        // A present but blank metadataTarget disables metadata.
        String metadataTarget = config.hasPath(METADATA_TARGET)
                ? trimToNull(config.getString(METADATA_TARGET, null))
                : EventSettings.DEFAULT_METADATA_TARGET;

        EventSettings events = new EventSettings(
                trimToNull(config.getString(NAME, null)),
                trimToNull(config.getString(TARGET, null)),
                metadataTarget,
                splitTags(config.getString(TAGS, "")),
                config.withPrefix(ADD_FIELD_PREFIX));

        HttpSettings http = new HttpSettings(
                Duration.ofMillis(config.getLong(CONNECT_TIMEOUT_MS, HttpSettings.DEFAULT_CONNECT_TIMEOUT.toMillis())),
                Duration.ofMillis(config.getLong(REQUEST_TIMEOUT_MS, HttpSettings.DEFAULT_REQUEST_TIMEOUT.toMillis())),
                config.getInt(RETRIES, HttpSettings.DEFAULT_RETRIES));

        return new PollerSettings(connection, schedule, events, http);
    }

    private static String required(PollerConfig config, String key) {
        String v = trimToNull(config.getString(key, null));
        if (v == null) {
            throw new ConfigurationException("Invalid config. '" + key + "' is required");
        }
        return v;
    }

    private static void validateHost(String host) {
        String base = ActivationRequests.baseUrl(host);
        try {
            URI uri = new URI(base + ActivationRequests.API_PATH);
            if (uri.getHost() == null) {
                throw new ConfigurationException("Invalid URL " + base);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid URL " + base, e);
        }
    }

    // The namespace is one path segment of the activations URL.
    private static void validateNamespace(ConnectionSettings connection) {
        String namespace = connection.namespace();
        if (namespace.contains("/")) {
            throw new ConfigurationException("Invalid config. '" + NAMESPACE + "' must be a single path segment, got '" + namespace + "'");
        }
        try {
            ActivationRequests.build(connection, 0L).toUri();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid config. '" + NAMESPACE + "' is not a valid URL path segment: '" + namespace + "'", e);
        }
    }

    private static List<String> splitTags(String raw) {
        List<String> tags = new ArrayList<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(tags::add);
        return tags;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
