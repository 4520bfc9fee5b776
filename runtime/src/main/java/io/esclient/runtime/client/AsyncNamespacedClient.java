/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.client;

import io.esclient.runtime.errors.TransportException;
import io.esclient.runtime.transport.AsyncTransport;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Base class of generated asynchronous clients.
 */
public abstract class AsyncNamespacedClient {

    private static final Logger LOGGER = Logger.getLogger(AsyncNamespacedClient.class.getName());

    protected final AsyncTransport transport;

    protected AsyncNamespacedClient(AsyncTransport transport) {
        this.transport = Objects.requireNonNull(transport);
    }

    public AsyncTransport transport() {
        return transport;
    }

    /**
     * Runs a call, completing with false instead of failing when the transport fails.
     *
     * @param call Call to run.
     * @return Returns a future with the result of the call, or false if it failed.
     */
    protected static CompletableFuture<Boolean> falseOnTransportError(Supplier<CompletableFuture<Boolean>> call) {
        CompletableFuture<Boolean> future;
        try {
            future = call.get();
        } catch (TransportException e) {
            LOGGER.fine(() -> "Call failed, returning false: " + e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        return future.exceptionallyCompose(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TransportException) {
                LOGGER.fine(() -> "Call failed, returning false: " + cause.getMessage());
                return CompletableFuture.completedFuture(false);
            }
            return CompletableFuture.failedFuture(cause);
        });
    }
}
