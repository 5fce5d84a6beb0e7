/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.request;

import com.intuitivedesigns.activationpoller.settings.ConnectionSettings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the activation list request for a namespace and watermark.
 */
public final class ActivationRequests {

    public static final String METHOD = "get";
    public static final String API_PATH = "/api/v1/namespaces/";

    private ActivationRequests() {}

    /**
     * {@code GET https://<host>/api/v1/namespaces/<namespace>/activations?docs=true&limit=0&skip=0&since=<watermark>}
     * with basic auth. {@code limit=0} asks the platform for every matching record.
     */
    public static ActivationRequest build(ConnectionSettings connection, long watermark) {
        Objects.requireNonNull(connection, "connection");

        String url = baseUrl(connection.host()) + API_PATH + connection.namespace() + "/activations";

        Map<String, Object> auth = new LinkedHashMap<>();
        auth.put(ActivationRequest.AUTH_USER, connection.principal());
        auth.put(ActivationRequest.AUTH_PASS, connection.secret());

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("docs", true);
        query.put("limit", 0);
        query.put("skip", 0);
        query.put("since", watermark);

        Map<String, Object> options = new LinkedHashMap<>();
        options.put(ActivationRequest.AUTH, auth);
        options.put(ActivationRequest.QUERY, query);

        return new ActivationRequest(METHOD, url, options);
    }

    /** {@code host} with trailing slashes removed and {@code https://} added when it has no scheme. */
    public static String baseUrl(String host) {
        String h = host.trim();
        while (h.endsWith("/")) h = h.substring(0, h.length() - 1);
        return (h.startsWith("http://") || h.startsWith("https://")) ? h : "https://" + h;
    }
}
