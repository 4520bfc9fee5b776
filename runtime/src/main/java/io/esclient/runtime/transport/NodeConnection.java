/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.concurrent.CompletableFuture;

/**
 * A connection to a single node.
 *
 * <p>Connections only report network failures, as
 * {@link io.esclient.runtime.errors.ConnectionException} and
 * {@link io.esclient.runtime.errors.ConnectionTimeoutException}. Any HTTP
 * status, including error statuses, is returned as a {@link NodeResponse}.
 */
public interface NodeConnection extends AutoCloseable {

    NodeConfig config();

    NodeResponse perform(NodeRequest request);

    CompletableFuture<NodeResponse> performAsync(NodeRequest request);

    @Override
    default void close() {}

    /**
     * Creates connections for nodes.
     */
    @FunctionalInterface
    interface Factory {
        NodeConnection create(NodeConfig config, TransportSettings settings);
    }
}
