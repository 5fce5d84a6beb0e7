/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.poll;

import com.intuitivedesigns.activationpoller.transport.TransportResponse;

import java.util.Objects;

/**
 * Result of one fetch: exactly one of {@link #response()} or {@link #error()} is set.
 */
public final class FetchOutcome {

    private final TransportResponse response;
    private final Throwable error;
    private final double runtimeSeconds;

    private FetchOutcome(TransportResponse response, Throwable error, double runtimeSeconds) {
        this.response = response;
        this.error = error;
        this.runtimeSeconds = runtimeSeconds;
    }

    public static FetchOutcome success(TransportResponse response, double runtimeSeconds) {
        return new FetchOutcome(Objects.requireNonNull(response, "response"), null, runtimeSeconds);
    }

    public static FetchOutcome failure(Throwable error, double runtimeSeconds) {
        return new FetchOutcome(null, Objects.requireNonNull(error, "error"), runtimeSeconds);
    }

    public boolean isSuccess() {
        return response != null;
    }

    public TransportResponse response() {
        return response;
    }

    public Throwable error() {
        return error;
    }

    public double runtimeSeconds() {
        return runtimeSeconds;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchOutcome{success code=" + response.code() + ", runtime=" + runtimeSeconds + "s}"
                : "FetchOutcome{failure " + error + ", runtime=" + runtimeSeconds + "s}";
    }
}
