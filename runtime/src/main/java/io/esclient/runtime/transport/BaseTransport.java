/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.errors.ApiException;
import io.esclient.runtime.errors.ConnectionException;
import io.esclient.runtime.errors.ConnectionTimeoutException;
import io.esclient.runtime.errors.SerializationException;
import io.esclient.runtime.errors.TransportException;
import io.esclient.runtime.serde.JsonSerializer;
import io.esclient.runtime.serde.Serializers;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * Behavior shared by the synchronous and asynchronous transports: request
 * preparation, response handling, retry decisions, sniffing and product checks.
 */
public abstract class BaseTransport implements AutoCloseable {

    static final String REQUEST_TIMEOUT = "request_timeout";
    static final String IGNORE = "ignore";
    static final String SNIFF_PATH = "/_nodes/_all/http";

    private static final Logger LOGGER = Logger.getLogger(BaseTransport.class.getName());

    protected final TransportSettings settings;
    protected final Serializers serializers;

    private final List<NodeConnection> seedConnections;
    private final String metaHeader;
    private volatile NodePool pool;
    private volatile Instant lastSniff;

    protected BaseTransport(TransportSettings settings, boolean async) {
        this.settings = settings;
        this.serializers = settings.serializers();
        this.seedConnections = settings.nodes().stream()
                .map(node -> settings.connectionFactory().create(node, settings))
                .collect(Collectors.toUnmodifiableList());
        this.pool = new NodePool(seedConnections, settings);
        this.metaHeader = ClientMeta.header(async);
        this.lastSniff = settings.clock().instant();
    }

    /**
     * A request with the transport-only parameters extracted.
     *
     * @param request Request to send to a node.
     * @param ignore Error statuses returned as responses instead of thrown.
     */
    protected record PreparedRequest(NodeRequest request, Set<Integer> ignore) {}

    public TransportSettings settings() {
        return settings;
    }

    public NodePool pool() {
        return pool;
    }

    /**
     * Resolves the arguments of a request.
     *
     * <p>Removes {@code request_timeout} and {@code ignore} from the query,
     * merges default, authentication and client meta headers, and serializes
     * the body with the serializer matching its content type.
     */
    protected PreparedRequest prepare(
            String method,
            String path,
            Map<String, String> query,
            Map<String, String> headers,
            Object body
    ) {
        Map<String, String> params = query == null ? new LinkedHashMap<>() : new LinkedHashMap<>(query);
        Duration timeout = Optional.ofNullable(params.remove(REQUEST_TIMEOUT))
                .map(BaseTransport::parseTimeout)
                .orElse(null);
        Set<Integer> ignore = parseIgnore(params.remove(IGNORE));

        Map<String, String> allHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        allHeaders.putAll(settings.headers());
        settings.authorization().ifPresent(value -> allHeaders.put("authorization", value));
        if (headers != null) {
            allHeaders.putAll(headers);
        }
        if (settings.metaHeader()) {
            allHeaders.put(ClientMeta.HEADER, metaHeader);
        }

        String serialized = null;
        if (body != null) {
            String contentType = allHeaders.get("content-type");
            if (contentType == null) {
                contentType = serializers.defaultSerializer().mimetype();
                allHeaders.put("content-type", contentType);
            }
            serialized = serializers.dumps(body, contentType);
        }
        return new PreparedRequest(new NodeRequest(method, path, params, allHeaders, serialized, timeout), ignore);
    }

    /**
     * Turns a node response into an {@link ApiResponse}.
     *
     * @throws ApiException if the status is an error status that isn't ignored.
     * @throws SerializationException if a successful response can't be deserialized.
     */
    protected ApiResponse toResponse(NodeResponse response, NodeConnection connection, Set<Integer> ignore) {
        boolean success = response.status() >= 200 && response.status() < 300;
        Object body = null;
        if (!response.body().isEmpty()) {
            try {
                body = serializers.loads(response.body(), response.header("content-type"));
            } catch (SerializationException e) {
                if (success) {
                    throw e;
                }
                // Error responses from proxies are often not JSON.
                body = response.body();
            }
        }
        if (!success && !ignore.contains(response.status())) {
            throw ApiException.of(response.status(), body);
        }
        return new ApiResponse(response.status(), response.headers(), body, connection.config());
    }

    /**
     * Decides whether a failed attempt is retried on another node.
     *
     * @param e Failure of the attempt.
     * @return Returns true when the request may be retried.
     */
    protected boolean shouldRetry(TransportException e) {
        if (e instanceof ConnectionTimeoutException) {
            return settings.retryOnTimeout();
        } else if (e instanceof ConnectionException) {
            return true;
        } else if (e instanceof ApiException api) {
            return settings.retryOnStatus().contains(api.status());
        }
        return false;
    }

    protected void logRetry(NodeRequest request, NodeConnection connection, int attempt, TransportException e) {
        LOGGER.warning(() -> String.format("Retrying %s %s (attempt %d of %d) after failure on %s: %s",
                request.method(), request.path(), attempt + 2, settings.maxRetries() + 1, connection.config(),
                e.getMessage()));
    }

    protected void markLive(NodeConnection connection) {
        pool.markLive(connection);
    }

    protected void markDeadInPool(NodeConnection connection) {
        pool.markDead(connection);
    }

    protected NodeConnection getNode() {
        return pool.getNode();
    }

    /**
     * @return Returns true when interval sniffing is enabled and the interval has elapsed.
     */
    protected boolean sniffDue() {
        return settings.sniffInterval()
                .map(interval -> !settings.clock().instant().isBefore(lastSniff.plus(interval)))
                .orElse(false);
    }

    /**
     * Records the start of a sniff, returning the previous sniff time to restore on failure.
     */
    protected Instant startSniff() {
        Instant previous = lastSniff;
        lastSniff = settings.clock().instant();
        return previous;
    }

    protected void restoreSniffTime(Instant previous) {
        lastSniff = previous;
    }

    /**
     * @return Returns the connections asked for node information: current ones first, then the seeds.
     */
    protected List<NodeConnection> sniffCandidates() {
        Set<NodeConnection> candidates = new LinkedHashSet<>(pool.connections());
        candidates.addAll(seedConnections);
        return new ArrayList<>(candidates);
    }

    protected NodeRequest sniffRequest(boolean initial) {
        Map<String, String> headers = new HashMap<>();
        headers.put("accept", JsonSerializer.MIMETYPE);
        settings.authorization().ifPresent(value -> headers.put("authorization", value));
        return new NodeRequest("GET", SNIFF_PATH, Map.of(), headers, null,
                initial ? settings.requestTimeout() : settings.sniffTimeout());
    }

    /**
     * Deserializes the node information returned by a sniff request.
     *
     * @throws ApiException if the node answered with an error status.
     */
    protected Node sniffResponse(NodeResponse response) {
        if (response.status() < 200 || response.status() >= 300) {
            throw ApiException.of(response.status(), response.body());
        }
        Object body = serializers.loads(response.body(), response.header("content-type"));
        if (!(body instanceof Node node)) {
            throw new SerializationException("Unexpected sniff response from " + SNIFF_PATH);
        }
        return node;
    }

    /**
     * Replaces the pool's nodes with the ones found in a sniff response.
     *
     * @param nodeInfo Body of {@code GET /_nodes/_all/http}.
     * @throws TransportException if no viable node was found.
     */
    protected void applySniff(Node nodeInfo) {
        List<NodeConfig> nodes = parseSniffedNodes(nodeInfo);
        if (nodes.isEmpty()) {
            throw new TransportException("Unable to sniff hosts - no viable hosts found.");
        }
        LOGGER.info(() -> "Sniffed nodes: " + nodes);
        setConnections(nodes);
    }

    List<NodeConfig> parseSniffedNodes(Node nodeInfo) {
        NodeConfig template = settings.nodes().get(0);
        List<NodeConfig> result = new ArrayList<>();
        ObjectNode nodes = nodeInfo.expectObjectNode().getObjectMember("nodes").orElse(Node.objectNode());
        for (Node value : nodes.getMembers().values()) {
            Optional<ObjectNode> info = value.asObjectNode();
            if (info.isEmpty()) {
                continue;
            }
            Optional<String> address = info.get().getObjectMember("http")
                    .flatMap(http -> http.getStringMember("publish_address"))
                    .map(StringNode::getValue);
            Optional<NodeConfig> node = address.flatMap(a -> parsePublishAddress(template, a));
            if (node.isPresent() && settings.nodeFilter().test(info.get(), node.get())) {
                result.add(node.get());
            }
        }
        return result;
    }

    /**
     * Parses a publish address, either {@code ip:port} or {@code host/ip:port}.
     */
    static Optional<NodeConfig> parsePublishAddress(NodeConfig template, String address) {
        if (address.isEmpty() || !address.contains(":")) {
            return Optional.empty();
        }
        String host;
        String portPart;
        int slash = address.indexOf('/');
        if (slash >= 0) {
            host = address.substring(0, slash);
            portPart = address.substring(address.lastIndexOf(':') + 1);
        } else {
            int colon = address.lastIndexOf(':');
            host = address.substring(0, colon);
            portPart = address.substring(colon + 1);
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        try {
            return Optional.of(template.withHost(host, Integer.parseInt(portPart)));
        } catch (NumberFormatException e) {
            LOGGER.warning(() -> "Ignoring malformed publish address: " + address);
            return Optional.empty();
        }
    }

    /**
     * Builds a new pool for the given nodes, reusing the connections of unchanged nodes.
     *
     * @param nodes Nodes of the new pool.
     */
    protected synchronized void setConnections(List<NodeConfig> nodes) {
        Map<NodeConfig, NodeConnection> existing = new HashMap<>();
        for (NodeConnection connection : sniffCandidates()) {
            existing.putIfAbsent(connection.config(), connection);
        }
        List<NodeConnection> connections = new ArrayList<>();
        for (NodeConfig node : nodes) {
            NodeConnection connection = existing.get(node);
            connections.add(connection != null ? connection : settings.connectionFactory().create(node, settings));
        }
        pool = new NodePool(connections, settings);
    }

    /**
     * Builds the {@code GET /} request used for the product check.
     */
    protected NodeRequest infoRequest(PreparedRequest prepared) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(prepared.request().headers());
        headers.remove("content-type");
        headers.put("accept", JsonSerializer.MIMETYPE);
        return new NodeRequest("GET", "/", Map.of(), headers, null, prepared.request().timeout());
    }

    /**
     * Evaluates the response of the product check request.
     *
     * <p>A 401 or 403 means the client isn't allowed to call the info API; the
     * check passes with a warning.
     *
     * @throws ApiException for any other error status.
     */
    protected ProductCheck.State productState(NodeResponse response) {
        if (response.status() == 401 || response.status() == 403) {
            LOGGER.warning("The client is unable to verify that the server is Elasticsearch "
                    + "due security privileges on the server side");
            return ProductCheck.State.SUCCESS;
        }
        if (response.status() < 200 || response.status() >= 300) {
            throw ApiException.of(response.status(), response.body());
        }
        Object body = serializers.loads(response.body(), JsonSerializer.MIMETYPE);
        ProductCheck.State state = ProductCheck.check(response.headers(), body);
        LOGGER.fine(() -> "Product check result: " + state);
        return state;
    }

    protected static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        Set<NodeConnection> all = new LinkedHashSet<>(pool.connections());
        all.addAll(seedConnections);
        all.forEach(NodeConnection::close);
    }

    private static Duration parseTimeout(String value) {
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid request_timeout, expected seconds: " + value, e);
        }
    }

    private static Set<Integer> parseIgnore(String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptySet();
        }
        Set<Integer> result = new LinkedHashSet<>();
        for (String status : value.split(",")) {
            try {
                result.add(Integer.parseInt(status.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid ignore status: " + status, e);
            }
        }
        return result;
    }
}
