/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.Map;

/**
 * Sends API requests to a cluster and waits for their responses.
 */
public interface Transport extends AutoCloseable {

    /**
     * Performs a request, retrying on other nodes when allowed.
     *
     * <p>The {@code request_timeout} and {@code ignore} query parameters are
     * consumed by the transport and never sent to the server.
     *
     * @param method HTTP method.
     * @param path Request path, already escaped.
     * @param query Query parameters.
     * @param headers Request headers.
     * @param body Body to serialize, or {@code null}.
     * @return Returns the response.
     * @throws io.esclient.runtime.errors.TransportException if the request fails.
     */
    ApiResponse performRequest(
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
     * @return Returns true for a 2xx response and false for a 404.
     */
    boolean performHeadRequest(String path, Map<String, String> query, Map<String, String> headers);

    @Override
    void close();
}
