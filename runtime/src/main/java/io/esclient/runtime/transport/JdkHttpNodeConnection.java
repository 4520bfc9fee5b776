/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.errors.ConnectionException;
import io.esclient.runtime.errors.ConnectionTimeoutException;
import io.esclient.runtime.errors.TransportException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Node connection backed by the JDK's {@link HttpClient}.
 */
public final class JdkHttpNodeConnection implements NodeConnection {

    private static final Logger LOGGER = Logger.getLogger(JdkHttpNodeConnection.class.getName());

    // Headers the JDK client refuses to set explicitly.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final NodeConfig config;
    private final HttpClient client;
    private final Duration defaultTimeout;

    public JdkHttpNodeConnection(NodeConfig config, TransportSettings settings) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), settings.requestTimeout());
    }

    JdkHttpNodeConnection(NodeConfig config, HttpClient client, Duration defaultTimeout) {
        this.config = config;
        this.client = client;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public NodeConfig config() {
        return config;
    }

    @Override
    public NodeResponse perform(NodeRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        LOGGER.fine(() -> String.format("%s %s", request.method(), httpRequest.uri()));
        try {
            return toNodeResponse(client.send(httpRequest, HttpResponse.BodyHandlers.ofString()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while calling " + config, e);
        } catch (IOException e) {
            throw translate(e);
        }
    }

    @Override
    public CompletableFuture<NodeResponse> performAsync(NodeRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        LOGGER.fine(() -> String.format("%s %s (async)", request.method(), httpRequest.uri()));
        return client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error == null) {
                        return toNodeResponse(response);
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof IOException io) {
                        throw translate(io);
                    }
                    throw new ConnectionException("Request to " + config + " failed", cause);
                });
    }

    private HttpRequest toHttpRequest(NodeRequest request) {
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(request))
                .timeout(request.timeout() == null ? defaultTimeout : request.timeout())
                .method(request.method(), publisher);
        config.basicAuthHeader().ifPresent(value -> builder.header("Authorization", value));
        request.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.setHeader(name, value);
            }
        });
        return builder.build();
    }

    private URI uri(NodeRequest request) {
        StringBuilder builder = new StringBuilder(config.url());
        if (!request.path().startsWith("/")) {
            builder.append('/');
        }
        builder.append(request.path());
        if (!request.query().isEmpty()) {
            builder.append('?').append(request.query().entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                    .collect(Collectors.joining("&")));
        }
        return URI.create(builder.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static NodeResponse toNodeResponse(HttpResponse<String> response) {
        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            headers.put(entry.getKey(), String.join(",", entry.getValue()));
        }
        return new NodeResponse(response.statusCode(), headers, response.body());
    }

    private TransportException translate(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return new ConnectionTimeoutException("Connection to " + config + " timed out", e);
        }
        return new ConnectionException("Connection to " + config + " failed: " + e.getMessage(), e);
    }
}
