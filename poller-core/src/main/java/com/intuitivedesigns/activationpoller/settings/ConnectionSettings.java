/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.settings;

import java.util.Objects;

/**
 * Where and as whom to poll. Immutable after startup.
 *
 * @param host platform API host, optionally with a scheme (defaults to https)
 * @param namespace platform namespace; {@value #DEFAULT_NAMESPACE} selects the principal's default namespace
 * @param principal API user
 * @param secret API key
 */
public record ConnectionSettings(String host, String namespace, String principal, String secret) {

    public static final String DEFAULT_NAMESPACE = "_";

    public ConnectionSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(secret, "secret");
        if (namespace == null || namespace.isBlank()) namespace = DEFAULT_NAMESPACE;
    }

    @Override
    public String toString() {
        return "ConnectionSettings{host='" + host + "', namespace='" + namespace + "', principal='" + principal + "', secret=****}";
    }
}
