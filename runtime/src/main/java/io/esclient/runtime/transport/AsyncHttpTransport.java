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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import software.amazon.smithy.model.node.Node;

/**
 * Non-blocking transport that spreads requests over a pool of nodes.
 *
 * <p>Sniffing on start happens lazily, before the first request completes.
 * Interval and node failure sniffs run in the background while requests
 * continue on the current pool.
 */
public final class AsyncHttpTransport extends BaseTransport implements AsyncTransport {

    private static final Logger LOGGER = Logger.getLogger(AsyncHttpTransport.class.getName());

    private final AtomicReference<CompletableFuture<Void>> started = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<ProductCheck.State>> productCheck = new AtomicReference<>();
    private final AtomicBoolean sniffing = new AtomicBoolean();

    public AsyncHttpTransport(TransportSettings settings) {
        super(settings, true);
    }

    @Override
    public CompletableFuture<ApiResponse> performRequestAsync(
            String method,
            String path,
            Map<String, String> query,
            Map<String, String> headers,
            Object body
    ) {
        PreparedRequest prepared;
        try {
            prepared = prepare(method, path, query, headers, body);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return start()
                .thenCompose(ignored -> verifyProduct(prepared))
                .thenCompose(ignored -> attempt(prepared, 0));
    }

    @Override
    public CompletableFuture<Boolean> performHeadRequestAsync(
            String path,
            Map<String, String> query,
            Map<String, String> headers
    ) {
        return performRequestAsync("HEAD", path, query, headers, null)
                .thenApply(ApiResponse::isSuccess)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    return cause instanceof NotFoundException
                            ? CompletableFuture.completedFuture(false)
                            : CompletableFuture.failedFuture(cause);
                });
    }

    /**
     * Replaces the pool's nodes with the nodes the cluster reports.
     *
     * @param initial Whether this is the sniff on start, which uses the request timeout.
     * @return Returns a future completed once the pool is updated.
     */
    public CompletableFuture<Void> sniff(boolean initial) {
        Instant previous = startSniff();
        List<NodeConnection> candidates = sniffCandidates();
        return fetchNodeInfo(candidates, 0, sniffRequest(initial))
                .thenAccept(this::applySniff)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        restoreSniffTime(previous);
                    }
                });
    }

    private CompletableFuture<Void> start() {
        if (!settings.sniffOnStart()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> current = started.get();
        if (current != null) {
            return current;
        }
        CompletableFuture<Void> created = new CompletableFuture<>();
        current = started.compareAndExchange(null, created);
        if (current != null) {
            return current;
        }
        sniff(true).whenComplete((ignored, error) -> {
            if (error != null) {
                // Let the next request try again.
                started.compareAndSet(created, null);
                created.completeExceptionally(unwrap(error));
            } else {
                created.complete(null);
            }
        });
        return created;
    }

    private CompletableFuture<ApiResponse> attempt(PreparedRequest prepared, int attempt) {
        NodeConnection connection = nextConnection();
        return connection.performAsync(prepared.request())
                .thenApply(response -> toResponse(response, connection, prepared.ignore()))
                .thenApply(response -> {
                    markLive(connection);
                    return response;
                })
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (!(cause instanceof TransportException e) || !shouldRetry(e)) {
                        return CompletableFuture.failedFuture(cause);
                    }
                    markDead(connection);
                    if (attempt >= settings.maxRetries()) {
                        return CompletableFuture.failedFuture(e);
                    }
                    logRetry(prepared.request(), connection, attempt, e);
                    return attempt(prepared, attempt + 1);
                });
    }

    private CompletableFuture<Node> fetchNodeInfo(List<NodeConnection> candidates, int index, NodeRequest request) {
        if (index >= candidates.size()) {
            return CompletableFuture.failedFuture(new TransportException("Unable to sniff hosts."));
        }
        NodeConnection connection = candidates.get(index);
        return connection.performAsync(request)
                .thenApply(this::sniffResponse)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof ConnectionException || cause instanceof SerializationException) {
                        LOGGER.fine(() -> "Unable to sniff from " + connection.config() + ": " + cause.getMessage());
                        return fetchNodeInfo(candidates, index + 1, request);
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }

    private NodeConnection nextConnection() {
        if (sniffDue()) {
            sniffInBackground();
        }
        return getNode();
    }

    private void markDead(NodeConnection connection) {
        markDeadInPool(connection);
        if (settings.sniffOnNodeFailure()) {
            sniffInBackground();
        }
    }

    private void sniffInBackground() {
        if (!sniffing.compareAndSet(false, true)) {
            return;
        }
        sniff(false).whenComplete((ignored, error) -> {
            sniffing.set(false);
            if (error != null) {
                LOGGER.log(Level.WARNING, "Background sniff failed", unwrap(error));
            }
        });
    }

    private CompletableFuture<Void> verifyProduct(PreparedRequest prepared) {
        if (!settings.verifyProduct()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<ProductCheck.State> check = productCheck.get();
        if (check == null) {
            CompletableFuture<ProductCheck.State> created = new CompletableFuture<>();
            check = productCheck.compareAndExchange(null, created);
            if (check == null) {
                check = created;
                checkProduct(sniffCandidates(), 0, infoRequest(prepared), null).whenComplete((state, error) -> {
                    if (error != null) {
                        productCheck.compareAndSet(created, null);
                        created.completeExceptionally(unwrap(error));
                    } else {
                        created.complete(state);
                    }
                });
            }
        }
        return check.thenAccept(ProductCheck::raiseIfUnsupported);
    }

    private CompletableFuture<ProductCheck.State> checkProduct(
            List<NodeConnection> candidates,
            int index,
            NodeRequest request,
            TransportException firstError
    ) {
        if (index >= candidates.size()) {
            return CompletableFuture.failedFuture(firstError);
        }
        return candidates.get(index).performAsync(request)
                .thenApply(this::productState)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof TransportException e) {
                        return checkProduct(candidates, index + 1, request, firstError == null ? e : firstError);
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }
}
