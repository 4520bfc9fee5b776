/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request ready to be sent to a single node.
 *
 * @param method HTTP method.
 * @param path Path of the request, relative to the node's prefix.
 * @param query Query string parameters.
 * @param headers Request headers.
 * @param body Serialized body, or {@code null} when there is none.
 * @param timeout Timeout of the request, or {@code null} for the connection default.
 */
public record NodeRequest(
        String method,
        String path,
        Map<String, String> query,
        Map<String, String> headers,
        String body,
        Duration timeout) {

    public NodeRequest {
        query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public NodeRequest withTimeout(Duration newTimeout) {
        return new NodeRequest(method, path, query, headers, body, newTimeout);
    }
}
