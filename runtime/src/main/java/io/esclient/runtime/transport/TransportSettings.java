/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.serde.Serializers;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.BooleanNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.NumberNode;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.SmithyBuilder;
import software.amazon.smithy.utils.ToSmithyBuilder;

/**
 * Immutable configuration of a transport.
 */
public final class TransportSettings implements ToSmithyBuilder<TransportSettings> {

    /**
     * Drops master-only nodes found while sniffing.
     */
    public static final BiPredicate<ObjectNode, NodeConfig> SKIP_MASTER_ONLY_NODES = (info, node) -> {
        List<String> roles = info.getArrayMember("roles")
                .map(array -> array.getElements().stream()
                        .map(role -> role.asStringNode().map(StringNode::getValue).orElse(""))
                        .collect(Collectors.toList()))
                .orElse(List.of());
        return !roles.equals(List.of("master"));
    };

    private static final String HOSTS = "hosts";
    private static final String MAX_RETRIES = "maxRetries";
    private static final String RETRY_ON_STATUS = "retryOnStatus";
    private static final String RETRY_ON_TIMEOUT = "retryOnTimeout";
    private static final String REQUEST_TIMEOUT = "requestTimeout";
    private static final String DEAD_TIMEOUT = "deadTimeout";
    private static final String SNIFF_ON_START = "sniffOnStart";
    private static final String SNIFF_ON_NODE_FAILURE = "sniffOnNodeFailure";
    private static final String SNIFF_INTERVAL = "sniffInterval";
    private static final String SNIFF_TIMEOUT = "sniffTimeout";
    private static final String RANDOMIZE_NODES = "randomizeNodes";
    private static final String VERIFY_PRODUCT = "verifyProduct";
    private static final String META_HEADER = "metaHeader";
    private static final String HEADERS = "headers";
    private static final String BASIC_AUTH = "basicAuth";
    private static final String API_KEY = "apiKey";
    private static final String BEARER_AUTH = "bearerAuth";

    private final List<NodeConfig> nodes;
    private final int maxRetries;
    private final Set<Integer> retryOnStatus;
    private final boolean retryOnTimeout;
    private final Duration requestTimeout;
    private final Duration deadTimeout;
    private final boolean sniffOnStart;
    private final boolean sniffOnNodeFailure;
    private final Duration sniffInterval;
    private final Duration sniffTimeout;
    private final boolean randomizeNodes;
    private final boolean verifyProduct;
    private final boolean metaHeader;
    private final Map<String, String> headers;
    private final String authorization;
    private final NodeSelector selector;
    private final Serializers serializers;
    private final Clock clock;
    private final BiPredicate<ObjectNode, NodeConfig> nodeFilter;
    private final NodeConnection.Factory connectionFactory;

    private TransportSettings(Builder builder) {
        this.nodes = List.copyOf(builder.nodes.isEmpty()
                ? List.of(new NodeConfig("http", "localhost", NodeConfig.DEFAULT_PORT))
                : builder.nodes);
        this.maxRetries = builder.maxRetries;
        this.retryOnStatus = Set.copyOf(builder.retryOnStatus);
        this.retryOnTimeout = builder.retryOnTimeout;
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout);
        this.deadTimeout = Objects.requireNonNull(builder.deadTimeout);
        this.sniffOnStart = builder.sniffOnStart;
        this.sniffOnNodeFailure = builder.sniffOnNodeFailure;
        this.sniffInterval = builder.sniffInterval;
        this.sniffTimeout = Objects.requireNonNull(builder.sniffTimeout);
        this.randomizeNodes = builder.randomizeNodes;
        this.verifyProduct = builder.verifyProduct;
        this.metaHeader = builder.metaHeader;
        this.headers = Map.copyOf(builder.headers);
        this.authorization = builder.authorization;
        this.selector = builder.selector == null ? new RoundRobinSelector() : builder.selector;
        this.serializers = builder.serializers == null ? new Serializers() : builder.serializers;
        this.clock = Objects.requireNonNull(builder.clock);
        this.nodeFilter = Objects.requireNonNull(builder.nodeFilter);
        this.connectionFactory = Objects.requireNonNull(builder.connectionFactory);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    /**
     * Creates settings from a configuration object node.
     *
     * <p>Durations are expressed in seconds. Unknown keys are logged and ignored.
     *
     * @param config Config object to load.
     * @return Returns the extracted settings.
     */
    public static TransportSettings fromNode(ObjectNode config) {
        config.warnIfAdditionalProperties(Arrays.asList(HOSTS, MAX_RETRIES, RETRY_ON_STATUS, RETRY_ON_TIMEOUT,
                REQUEST_TIMEOUT, DEAD_TIMEOUT, SNIFF_ON_START, SNIFF_ON_NODE_FAILURE, SNIFF_INTERVAL,
                SNIFF_TIMEOUT, RANDOMIZE_NODES, VERIFY_PRODUCT, META_HEADER, HEADERS, BASIC_AUTH, API_KEY,
                BEARER_AUTH));
        Builder builder = builder();
        config.getArrayMember(HOSTS).ifPresent(hosts -> {
            for (Node host : hosts) {
                builder.addNode(NodeConfig.fromUrl(host.expectStringNode().getValue()));
            }
        });
        config.getNumberMember(MAX_RETRIES).map(n -> n.getValue().intValue()).ifPresent(builder::maxRetries);
        config.getArrayMember(RETRY_ON_STATUS).map(TransportSettings::statuses).ifPresent(builder::retryOnStatus);
        config.getBooleanMember(RETRY_ON_TIMEOUT).map(BooleanNode::getValue).ifPresent(builder::retryOnTimeout);
        seconds(config, REQUEST_TIMEOUT).ifPresent(builder::requestTimeout);
        seconds(config, DEAD_TIMEOUT).ifPresent(builder::deadTimeout);
        config.getBooleanMember(SNIFF_ON_START).map(BooleanNode::getValue).ifPresent(builder::sniffOnStart);
        config.getBooleanMember(SNIFF_ON_NODE_FAILURE).map(BooleanNode::getValue)
                .ifPresent(builder::sniffOnNodeFailure);
        seconds(config, SNIFF_INTERVAL).ifPresent(builder::sniffInterval);
        seconds(config, SNIFF_TIMEOUT).ifPresent(builder::sniffTimeout);
        config.getBooleanMember(RANDOMIZE_NODES).map(BooleanNode::getValue).ifPresent(builder::randomizeNodes);
        config.getBooleanMember(VERIFY_PRODUCT).map(BooleanNode::getValue).ifPresent(builder::verifyProduct);
        config.getBooleanMember(META_HEADER).map(BooleanNode::getValue).ifPresent(builder::metaHeader);
        config.getObjectMember(HEADERS).ifPresent(headers -> headers.getStringMap()
                .forEach((name, value) -> builder.putHeader(name, value.expectStringNode().getValue())));
        config.getObjectMember(BASIC_AUTH).ifPresent(auth -> builder.basicAuth(
                auth.expectStringMember("username").getValue(),
                auth.expectStringMember("password").getValue()));
        config.getStringMember(API_KEY).map(StringNode::getValue).ifPresent(builder::apiKey);
        config.getStringMember(BEARER_AUTH).map(StringNode::getValue).ifPresent(builder::bearerAuth);
        return builder.build();
    }

    private static Set<Integer> statuses(ArrayNode array) {
        Set<Integer> result = new LinkedHashSet<>();
        for (Node element : array) {
            result.add(element.expectNumberNode().getValue().intValue());
        }
        return result;
    }

    private static Optional<Duration> seconds(ObjectNode config, String key) {
        return config.getNumberMember(key)
                .map(NumberNode::getValue)
                .map(value -> Duration.ofMillis(Math.round(value.doubleValue() * 1000)));
    }

    public List<NodeConfig> nodes() {
        return nodes;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Set<Integer> retryOnStatus() {
        return retryOnStatus;
    }

    public boolean retryOnTimeout() {
        return retryOnTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration deadTimeout() {
        return deadTimeout;
    }

    public boolean sniffOnStart() {
        return sniffOnStart;
    }

    public boolean sniffOnNodeFailure() {
        return sniffOnNodeFailure;
    }

    /**
     * @return Returns the interval between background sniffs, if interval sniffing is enabled.
     */
    public Optional<Duration> sniffInterval() {
        return Optional.ofNullable(sniffInterval);
    }

    public Duration sniffTimeout() {
        return sniffTimeout;
    }

    public boolean randomizeNodes() {
        return randomizeNodes;
    }

    public boolean verifyProduct() {
        return verifyProduct;
    }

    public boolean metaHeader() {
        return metaHeader;
    }

    /**
     * @return Returns the headers sent with every request.
     */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * @return Returns the value of the {@code Authorization} header, if credentials were configured.
     */
    public Optional<String> authorization() {
        return Optional.ofNullable(authorization);
    }

    public NodeSelector selector() {
        return selector;
    }

    public Serializers serializers() {
        return serializers;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * @return Returns the filter deciding which sniffed nodes are used. It receives the node's info and address.
     */
    public BiPredicate<ObjectNode, NodeConfig> nodeFilter() {
        return nodeFilter;
    }

    public NodeConnection.Factory connectionFactory() {
        return connectionFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Builder toBuilder() {
        Builder builder = builder()
                .nodes(nodes)
                .maxRetries(maxRetries)
                .retryOnStatus(retryOnStatus)
                .retryOnTimeout(retryOnTimeout)
                .requestTimeout(requestTimeout)
                .deadTimeout(deadTimeout)
                .sniffOnStart(sniffOnStart)
                .sniffOnNodeFailure(sniffOnNodeFailure)
                .sniffInterval(sniffInterval)
                .sniffTimeout(sniffTimeout)
                .randomizeNodes(randomizeNodes)
                .verifyProduct(verifyProduct)
                .metaHeader(metaHeader)
                .headers(headers)
                .selector(selector)
                .serializers(serializers)
                .clock(clock)
                .nodeFilter(nodeFilter)
                .connectionFactory(connectionFactory);
        builder.authorization = authorization;
        return builder;
    }

    /**
     * Builds {@link TransportSettings}.
     */
    public static final class Builder implements SmithyBuilder<TransportSettings> {
        private final List<NodeConfig> nodes = new ArrayList<>();
        private int maxRetries = 3;
        private Set<Integer> retryOnStatus = Set.of(502, 503, 504);
        private boolean retryOnTimeout = false;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration deadTimeout = Duration.ofSeconds(60);
        private boolean sniffOnStart = false;
        private boolean sniffOnNodeFailure = false;
        private Duration sniffInterval;
        private Duration sniffTimeout = Duration.ofMillis(100);
        private boolean randomizeNodes = true;
        private boolean verifyProduct = true;
        private boolean metaHeader = true;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String authorization;
        private NodeSelector selector;
        private Serializers serializers;
        private Clock clock = Clock.systemUTC();
        private BiPredicate<ObjectNode, NodeConfig> nodeFilter = SKIP_MASTER_ONLY_NODES;
        private NodeConnection.Factory connectionFactory = JdkHttpNodeConnection::new;

        private Builder() {}

        @Override
        public TransportSettings build() {
            return new TransportSettings(this);
        }

        /**
         * Replaces the seed nodes. Defaults to {@code http://localhost:9200}.
         *
         * @param nodes Nodes to connect to.
         * @return Returns the builder.
         */
        public Builder nodes(List<NodeConfig> nodes) {
            this.nodes.clear();
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder addNode(NodeConfig node) {
            this.nodes.add(Objects.requireNonNull(node));
            return this;
        }

        public Builder hosts(String... urls) {
            for (String url : urls) {
                addNode(NodeConfig.fromUrl(url));
            }
            return this;
        }

        /**
         * Sets how many times a failed request is retried on another node.
         *
         * <p>Defaults to 3.
         *
         * @param maxRetries Number of retries.
         * @return Returns the builder.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the HTTP statuses that cause a retry. Defaults to 502, 503 and 504.
         *
         * @param retryOnStatus Statuses to retry.
         * @return Returns the builder.
         */
        public Builder retryOnStatus(Set<Integer> retryOnStatus) {
            this.retryOnStatus = Objects.requireNonNull(retryOnStatus);
            return this;
        }

        public Builder retryOnTimeout(boolean retryOnTimeout) {
            this.retryOnTimeout = retryOnTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Sets the base time a failed node is kept out of rotation. Defaults to 60 seconds.
         *
         * @param deadTimeout Base timeout, doubled for each consecutive failure.
         * @return Returns the builder.
         */
        public Builder deadTimeout(Duration deadTimeout) {
            this.deadTimeout = deadTimeout;
            return this;
        }

        public Builder sniffOnStart(boolean sniffOnStart) {
            this.sniffOnStart = sniffOnStart;
            return this;
        }

        public Builder sniffOnNodeFailure(boolean sniffOnNodeFailure) {
            this.sniffOnNodeFailure = sniffOnNodeFailure;
            return this;
        }

        /**
         * Enables sniffing at a fixed interval.
         *
         * @param sniffInterval Interval between sniffs, or {@code null} to disable.
         * @return Returns the builder.
         */
        public Builder sniffInterval(Duration sniffInterval) {
            this.sniffInterval = sniffInterval;
            return this;
        }

        public Builder sniffTimeout(Duration sniffTimeout) {
            this.sniffTimeout = sniffTimeout;
            return this;
        }

        public Builder randomizeNodes(boolean randomizeNodes) {
            this.randomizeNodes = randomizeNodes;
            return this;
        }

        /**
         * Sets whether the server is checked to be Elasticsearch before the first request.
         *
         * <p>Defaults to true.
         *
         * @param verifyProduct Whether to verify the product.
         * @return Returns the builder.
         */
        public Builder verifyProduct(boolean verifyProduct) {
            this.verifyProduct = verifyProduct;
            return this;
        }

        /**
         * Sets whether the {@code x-elastic-client-meta} header is sent. Defaults to true.
         *
         * @param metaHeader Whether to send the header.
         * @return Returns the builder.
         */
        public Builder metaHeader(boolean metaHeader) {
            this.metaHeader = metaHeader;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            this.headers.putAll(headers);
            return this;
        }

        public Builder putHeader(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder basicAuth(String username, String password) {
            String credentials = username + ":" + password;
            return authorization("Basic " + encode(credentials));
        }

        /**
         * Authenticates with an API key.
         *
         * @param id Id of the API key.
         * @param key Secret of the API key.
         * @return Returns the builder.
         */
        public Builder apiKey(String id, String key) {
            return apiKey(encode(id + ":" + key));
        }

        /**
         * Authenticates with an already encoded API key.
         *
         * @param encoded Base64 encoded {@code id:key}.
         * @return Returns the builder.
         */
        public Builder apiKey(String encoded) {
            return authorization("ApiKey " + encoded);
        }

        public Builder bearerAuth(String token) {
            return authorization("Bearer " + token);
        }

        private Builder authorization(String value) {
            if (authorization != null) {
                throw new IllegalStateException("Only one of basicAuth, apiKey and bearerAuth may be set");
            }
            this.authorization = value;
            return this;
        }

        public Builder selector(NodeSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder serializers(Serializers serializers) {
            this.serializers = serializers;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder nodeFilter(BiPredicate<ObjectNode, NodeConfig> nodeFilter) {
            this.nodeFilter = nodeFilter;
            return this;
        }

        public Builder connectionFactory(NodeConnection.Factory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        private static String encode(String value) {
            return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
        }
    }
}
