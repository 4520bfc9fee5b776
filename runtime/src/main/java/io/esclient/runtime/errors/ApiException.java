/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * Error returned by the server with a non-successful status code.
 *
 * <p>The message summarizes the status, the error type and the root cause
 * found in the response body, when the body is an Elasticsearch error document.
 */
public class ApiException extends TransportException {

    private final int status;
    private final transient Object body;

    public ApiException(int status, Object body) {
        super(null);
        this.status = status;
        this.body = body;
    }

    /**
     * Creates the exception matching a status code.
     *
     * @param status HTTP status code returned by the server.
     * @param body Deserialized response body, may be {@code null}.
     * @return Returns the most specific exception for the status.
     */
    public static ApiException of(int status, Object body) {
        return switch (status) {
            case 400 -> new BadRequestException(body);
            case 401 -> new AuthenticationException(body);
            case 403 -> new AuthorizationException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            default -> new ApiException(status, body);
        };
    }

    public int status() {
        return status;
    }

    public Object body() {
        return body;
    }

    /**
     * Gets the error type reported by the server, such as {@code index_not_found_exception}.
     *
     * @return Returns the error type, or the raw body when it isn't an error document.
     */
    public String error() {
        Optional<Node> error = bodyObject().flatMap(node -> node.getMember("error"));
        if (error.isPresent()) {
            Node value = error.get();
            if (value.isObjectNode()) {
                return value.expectObjectNode().getStringMember("type").map(StringNode::getValue).orElse("");
            }
            if (value.isStringNode()) {
                return value.expectStringNode().getValue();
            }
            return Node.printJson(value);
        }
        return body == null ? "" : String.valueOf(body instanceof Node node ? Node.printJson(node) : body);
    }

    @Override
    public String getMessage() {
        List<String> parts = new ArrayList<>();
        parts.add(String.valueOf(status));
        String error = error();
        if (!error.isEmpty()) {
            parts.add("'" + error + "'");
        }
        parts.addAll(causes());
        return getClass().getSimpleName() + "(" + String.join(", ", parts) + ")";
    }

    private List<String> causes() {
        List<String> causes = new ArrayList<>();
        Optional<ObjectNode> error = bodyObject()
                .flatMap(node -> node.getObjectMember("error"));
        if (error.isEmpty()) {
            return causes;
        }
        error.get().getArrayMember("root_cause")
                .flatMap(rootCauses -> rootCauses.get(0))
                .flatMap(Node::asObjectNode)
                .ifPresent(rootCause -> {
                    rootCause.getStringMember("reason").ifPresent(r -> causes.add("'" + r.getValue() + "'"));
                    rootCause.getStringMember("resource.id").ifPresent(r -> causes.add(r.getValue()));
                    rootCause.getStringMember("resource.type").ifPresent(r -> causes.add(r.getValue()));
                });
        error.get().getObjectMember("caused_by")
                .flatMap(causedBy -> causedBy.getStringMember("reason"))
                .ifPresent(r -> causes.add(r.getValue()));
        return causes;
    }

    private Optional<ObjectNode> bodyObject() {
        if (body instanceof Node node) {
            return node.asObjectNode();
        }
        return Optional.empty();
    }
}
