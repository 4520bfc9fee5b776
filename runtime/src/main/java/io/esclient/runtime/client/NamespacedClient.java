/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.client;

import io.esclient.runtime.errors.TransportException;
import io.esclient.runtime.transport.Transport;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Base class of generated blocking clients.
 */
public abstract class NamespacedClient {

    private static final Logger LOGGER = Logger.getLogger(NamespacedClient.class.getName());

    protected final Transport transport;

    protected NamespacedClient(Transport transport) {
        this.transport = Objects.requireNonNull(transport);
    }

    public Transport transport() {
        return transport;
    }

    /**
     * Runs a call, returning false instead of throwing when the transport fails.
     *
     * @param call Call to run.
     * @return Returns the result of the call, or false if it failed.
     */
    protected static boolean falseOnTransportError(Supplier<Boolean> call) {
        try {
            return call.get();
        } catch (TransportException e) {
            LOGGER.fine(() -> "Call failed, returning false: " + e.getMessage());
            return false;
        }
    }
}
