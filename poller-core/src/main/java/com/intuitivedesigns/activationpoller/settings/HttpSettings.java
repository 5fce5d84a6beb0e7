/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.settings;

import java.time.Duration;

public record HttpSettings(Duration connectTimeout, Duration requestTimeout, int retries) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_RETRIES = 1;

    public HttpSettings {
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        retries = Math.max(0, retries);
    }

    public static HttpSettings defaults() {
        return new HttpSettings(DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, DEFAULT_RETRIES);
    }
}
