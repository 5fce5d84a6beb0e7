/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.request;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Transport-neutral request descriptor: method, url and option map ({@code auth}, {@code query}, ...).
 */
public record ActivationRequest(String method, String url, Map<String, Object> options) {

    public static final String AUTH = "auth";
    public static final String QUERY = "query";
    public static final String AUTH_USER = "user";
    public static final String AUTH_PASS = "pass";

    private static final String MASK = "****";

    public ActivationRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        options = (options == null) ? Map.of() : copyOptions(options);
    }

    public ActivationRequest(String method, String url) {
        this(method, url, Map.of());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> query() {
        Object q = options.get(QUERY);
        return (q instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> auth() {
        Object a = options.get(AUTH);
        return (a instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    }

    /** The url with the query parameters appended, form-encoded, in insertion order. */
    public URI toUri() {
        Map<String, Object> query = query();
        if (query.isEmpty()) return URI.create(url);

        StringJoiner qs = new StringJoiner("&");
        query.forEach((k, v) -> qs.add(encode(k) + "=" + encode(String.valueOf(v))));
        return URI.create(url + (url.contains("?") ? "&" : "?") + qs);
    }

    /**
     * Flattens method, url and every option into one map with string keys, for logging and
     * indexing. The auth password is masked.
     */
    public Map<String, Object> structured() {
        Map<String, Object> out = new LinkedHashMap<>();
        options.forEach((k, v) -> out.put(String.valueOf(k), AUTH.equals(k) ? maskAuth(v) : v));
        out.put("method", method);
        out.put("url", url);
        return out;
    }

    @Override
    public String toString() {
        return method.toUpperCase(Locale.ROOT) + " " + url + " " + structured();
    }

    private static Object maskAuth(Object auth) {
        if (!(auth instanceof Map<?, ?> m)) return auth;
        Map<String, Object> masked = new LinkedHashMap<>();
        m.forEach((k, v) -> masked.put(String.valueOf(k), AUTH_PASS.equals(k) && v != null ? MASK : v));
        return masked;
    }

    private static Map<String, Object> copyOptions(Map<String, Object> src) {
        Map<String, Object> copy = new LinkedHashMap<>();
        src.forEach((k, v) -> {
            if (k != null) {
                copy.put(k, (v instanceof Map<?, ?> m) ? Collections.unmodifiableMap(new LinkedHashMap<>(m)) : v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
