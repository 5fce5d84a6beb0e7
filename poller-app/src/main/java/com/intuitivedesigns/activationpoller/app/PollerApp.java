/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.app;

import com.intuitivedesigns.activationpoller.ActivationPoller;
import com.intuitivedesigns.activationpoller.codec.RecordCodec;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.metrics.MetricsFactory;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import com.intuitivedesigns.activationpoller.metrics.MetricsSettings;
import com.intuitivedesigns.activationpoller.poll.FetchOutcome;
import com.intuitivedesigns.activationpoller.settings.ConfigurationException;
import com.intuitivedesigns.activationpoller.settings.PollerSettings;
import com.intuitivedesigns.activationpoller.transport.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point. Usage: {@code java -Dpoller.config.path=poller.properties -jar poller-app.jar [--once]}
 *
 * <p>{@code --once} runs a single poll cycle, waits for it and exits.</p>
 */
public final class PollerApp {

    private static final Logger log = LoggerFactory.getLogger(PollerApp.class);

    static final String ONCE_FLAG = "--once";

    private PollerApp() {}

    public static void main(String[] args) {
        boolean once = Arrays.asList(args).contains(ONCE_FLAG);
        int code = run(PollerConfig.load(), once);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return process exit code: 0 on clean shutdown, 1 on configuration or startup failure
     */
    static int run(PollerConfig config, boolean once) {
        log.info("=== Booting Activation Poller{} ===", once ? " (single cycle)" : "");

        final PollerSettings settings;
        try {
            settings = PollerSettings.from(config);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        final PollerFactory factory = PollerFactory.fromContextClassLoader();
        factory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        OutputSink<Event> sink = null;
        ActivationPoller poller = null;

        try {
            metrics = MetricsFactory.init(MetricsSettings.from(config));
            RecordCodec codec = factory.createCodec(config, metrics);
            sink = factory.createSink(config, metrics);

            poller = new ActivationPoller(settings, new HttpTransport(settings.http()), codec, sink, metrics);

            if (once) {
                FetchOutcome outcome = poller.runOnce().join();
                log.info("Single cycle finished: {} watermark={}", outcome, poller.watermark());
                poller.stop();
                closeQuietly(metrics);
                return 0;
            }

            awaitShutdown(poller, metrics);
            return 0;
        } catch (Exception e) {
            log.error("Fatal application error", e);
            if (poller != null) {
                poller.stop();
            } else {
                closeQuietly(sink);
            }
            closeQuietly(metrics);
            return 1;
        }
    }

    private static void awaitShutdown(ActivationPoller poller, MetricsRuntime metrics) throws InterruptedException {
        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!shutdownStarted.compareAndSet(false, true)) {
                return;
            }
            log.info("Shutdown signal received.");
            try {
                poller.stop();
            } finally {
                closeQuietly(metrics);
                shutdownLatch.countDown();
            }
        }, "poller-shutdown"));

        poller.start();
        shutdownLatch.await();
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }
}
