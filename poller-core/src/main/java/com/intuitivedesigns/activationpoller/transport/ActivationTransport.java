/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.transport;

import com.intuitivedesigns.activationpoller.request.ActivationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Executes an {@link ActivationRequest} asynchronously. The returned future completes with the
 * response, or exceptionally with the transport error once retries are exhausted.
 */
@FunctionalInterface
public interface ActivationTransport extends AutoCloseable {

    CompletableFuture<TransportResponse> execute(ActivationRequest request);

    @Override
    default void close() {}
}
