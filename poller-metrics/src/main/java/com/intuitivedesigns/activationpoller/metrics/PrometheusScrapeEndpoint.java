/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves {@code GET /metrics} in the Prometheus text format from the JDK HTTP server.
 */
final class PrometheusScrapeEndpoint implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PrometheusScrapeEndpoint.class);

    static final String PATH = "/metrics";

    private final HttpServer server;
    private final ExecutorService executor;

    private PrometheusScrapeEndpoint(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    static PrometheusScrapeEndpoint start(PrometheusMeterRegistry registry, int port) {
        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start Prometheus metrics server on port " + port, e);
        }

        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "poller-metrics-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(PATH, exchange -> {
            try {
                byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (IOException e) {
                log.warn("Prometheus scrape failed: {}", e.getMessage());
            } finally {
                exchange.close();
            }
        });

        server.start();
        log.info("Prometheus metrics active (port={}, path={})", port, PATH);
        return new PrometheusScrapeEndpoint(server, executor);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
