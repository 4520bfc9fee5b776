/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.errors.SerializationException;
import java.util.Map;
import software.amazon.smithy.model.node.Node;

/**
 * Response of an API call.
 *
 * @param status HTTP status code.
 * @param headers Response headers, with lower-cased names.
 * @param body Deserialized body: a {@link Node} for JSON, a list for NDJSON,
 *             a string for text, or {@code null} when the response had no body.
 * @param node Node that served the request.
 */
public record ApiResponse(int status, Map<String, String> headers, Object body, NodeConfig node) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * @return Returns the body as a JSON node.
     * @throws SerializationException if the body isn't JSON.
     */
    public Node bodyAsNode() {
        if (body instanceof Node json) {
            return json;
        }
        if (body == null) {
            return Node.nullNode();
        }
        throw new SerializationException("Response body from " + node + " is not JSON: " + body);
    }
}
