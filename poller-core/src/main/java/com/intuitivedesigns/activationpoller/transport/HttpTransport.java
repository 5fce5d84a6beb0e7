/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.transport;

import com.intuitivedesigns.activationpoller.request.ActivationRequest;
import com.intuitivedesigns.activationpoller.settings.HttpSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ActivationTransport} on the JDK {@link HttpClient}. Requests are sent with
 * {@code sendAsync}; I/O failures are retried up to {@link HttpSettings#retries()} times.
 */
public final class HttpTransport implements ActivationTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    static final String USER_AGENT = "activation-poller/1.0";
    private static final String ACCEPT = "Accept";
    private static final String JSON_CT = "application/json";

    private final HttpClient client;
    private final Duration requestTimeout;
    private final int retries;

    public HttpTransport(HttpSettings settings) {
        this(HttpClient.newBuilder()
                        .connectTimeout(settings.connectTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                settings);
    }

    public HttpTransport(HttpClient client, HttpSettings settings) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(settings, "settings");
        this.requestTimeout = settings.requestTimeout();
        this.retries = settings.retries();
    }

    @Override
    public CompletableFuture<TransportResponse> execute(ActivationRequest request) {
        final HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return attempt(httpRequest, 0);
    }

    private CompletableFuture<TransportResponse> attempt(HttpRequest httpRequest, int retried) {
        return client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(r -> new TransportResponse(r.body(), r.statusCode(), r.headers().map(),
                        reasonPhrase(r.statusCode()), retried))
                .exceptionallyCompose(err -> {
                    Throwable cause = unwrap(err);
                    if (cause instanceof IOException && retried < retries) {
                        log.debug("Retrying {} after I/O failure ({}/{}): {}",
                                httpRequest.uri(), retried + 1, retries, cause.toString());
                        return attempt(httpRequest, retried + 1);
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }

    HttpRequest toHttpRequest(ActivationRequest request) {
        HttpRequest.Builder b = HttpRequest.newBuilder(request.toUri())
                .timeout(requestTimeout)
                .header(ACCEPT, JSON_CT)
                .header("User-Agent", USER_AGENT)
                .method(request.method().toUpperCase(Locale.ROOT), HttpRequest.BodyPublishers.noBody());

        Map<String, Object> auth = request.auth();
        Object user = auth.get(ActivationRequest.AUTH_USER);
        if (user != null) {
            Object pass = auth.get(ActivationRequest.AUTH_PASS);
            String token = user + ":" + (pass == null ? "" : pass);
            b.header("Authorization", "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
        }
        return b.build();
    }

    private static Throwable unwrap(Throwable t) {
        return (t instanceof CompletionException && t.getCause() != null) ? t.getCause() : t;
    }

    // HttpClient exposes no reason phrase.
    static String reasonPhrase(int code) {
        return switch (code) {
            case 200 -> "OK";
            case 201 -> "Created";
            case 202 -> "Accepted";
            case 204 -> "No Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 304 -> "Not Modified";
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 408 -> "Request Timeout";
            case 409 -> "Conflict";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
    }
}
