/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous counterpart of {@link Transport}.
 */
public interface AsyncTransport extends AutoCloseable {

    CompletableFuture<ApiResponse> performRequestAsync(
            String method,
            String path,
            Map<String, String> query,
            Map<String, String> headers,
            Object body);

    /**
     * Performs a {@code HEAD} request.
     *
     * @param path Request path, already escaped.
     * @param query Query parameters.
     * @param headers Request headers.
     * @return Returns a future completed with true for a 2xx response and false for a 404.
     */
    CompletableFuture<Boolean> performHeadRequestAsync(
            String path,
            Map<String, String> query,
            Map<String, String> headers);

    @Override
    void close();
}
