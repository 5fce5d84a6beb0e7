/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.transport;

import java.util.List;
import java.util.Map;

/**
 * @param body raw response body
 * @param code HTTP status code
 * @param headers response headers, names as received
 * @param message reason phrase for {@code code}
 * @param timesRetried automatic retries spent before this response arrived
 */
public record TransportResponse(byte[] body,
                                int code,
                                Map<String, List<String>> headers,
                                String message,
                                int timesRetried) {

    public TransportResponse {
        body = (body == null) ? new byte[0] : body;
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
        message = (message == null) ? "" : message;
    }

    public boolean isSuccess() {
        return code >= 200 && code < 300;
    }
}
