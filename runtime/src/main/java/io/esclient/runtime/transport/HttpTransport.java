/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.errors.ConnectionException;
import io.esclient.runtime.errors.NotFoundException;
import io.esclient.runtime.errors.SerializationException;
import io.esclient.runtime.errors.TransportException;
import java.time.Instant;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import software.amazon.smithy.model.node.Node;

/**
 * Blocking transport that spreads requests over a pool of nodes.
 */
public final class HttpTransport extends BaseTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(HttpTransport.class.getName());

    private final Object productLock = new Object();
    private volatile ProductCheck.State productState;

    public HttpTransport(TransportSettings settings) {
        super(settings, false);
        if (settings.sniffOnStart()) {
            sniff(true);
        }
    }

    @Override
    public ApiResponse performRequest(
            String method,
            String path,
            Map<String, String> query,
            Map<String, String> headers,
            Object body
    ) {
        PreparedRequest prepared = prepare(method, path, query, headers, body);
        if (settings.verifyProduct()) {
            verifyProduct(prepared);
        }

        for (int attempt = 0;; attempt++) {
            NodeConnection connection = nextConnection();
            try {
                NodeResponse response = connection.perform(prepared.request());
                ApiResponse result = toResponse(response, connection, prepared.ignore());
                markLive(connection);
                return result;
            } catch (TransportException e) {
                if (!shouldRetry(e)) {
                    throw e;
                }
                markDead(connection);
                if (attempt >= settings.maxRetries()) {
                    throw e;
                }
                logRetry(prepared.request(), connection, attempt, e);
            }
        }
    }

    @Override
    public boolean performHeadRequest(String path, Map<String, String> query, Map<String, String> headers) {
        try {
            return performRequest("HEAD", path, query, headers, null).isSuccess();
        } catch (NotFoundException e) {
            return false;
        }
    }

    /**
     * Replaces the pool's nodes with the nodes the cluster reports.
     *
     * @param initial Whether this is the sniff on start, which uses the request timeout.
     * @throws TransportException if no node could be sniffed.
     */
    public void sniff(boolean initial) {
        Instant previous = startSniff();
        try {
            applySniff(fetchNodeInfo(initial));
        } catch (TransportException e) {
            restoreSniffTime(previous);
            throw e;
        }
    }

    private Node fetchNodeInfo(boolean initial) {
        NodeRequest request = sniffRequest(initial);
        for (NodeConnection connection : sniffCandidates()) {
            try {
                return sniffResponse(connection.perform(request));
            } catch (ConnectionException | SerializationException e) {
                LOGGER.fine(() -> "Unable to sniff from " + connection.config() + ": " + e.getMessage());
            }
        }
        throw new TransportException("Unable to sniff hosts.");
    }

    private NodeConnection nextConnection() {
        if (sniffDue()) {
            sniff(false);
        }
        return getNode();
    }

    private void markDead(NodeConnection connection) {
        markDeadInPool(connection);
        if (settings.sniffOnNodeFailure()) {
            try {
                sniff(false);
            } catch (TransportException e) {
                // The original failure is what the caller sees.
                LOGGER.log(Level.WARNING, "Sniffing after a node failure failed", e);
            }
        }
    }

    private void verifyProduct(PreparedRequest prepared) {
        ProductCheck.State state = productState;
        if (state == null) {
            synchronized (productLock) {
                if (productState == null) {
                    productState = checkProduct(prepared);
                }
                state = productState;
            }
        }
        ProductCheck.raiseIfUnsupported(state);
    }

    private ProductCheck.State checkProduct(PreparedRequest prepared) {
        NodeRequest request = infoRequest(prepared);
        TransportException firstError = null;
        for (NodeConnection connection : sniffCandidates()) {
            try {
                return productState(connection.perform(request));
            } catch (TransportException e) {
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        throw firstError;
    }
}
