/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.esclient.runtime.client.ApiSupport;
import io.esclient.runtime.errors.ApiException;
import io.esclient.runtime.errors.ConnectionException;
import io.esclient.runtime.errors.ConnectionTimeoutException;
import io.esclient.runtime.errors.NotFoundException;
import io.esclient.runtime.errors.TransportException;
import io.esclient.runtime.errors.UnsupportedProductException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.smithy.model.node.Node;

public class HttpTransportTest {

    private static final NodeConfig NODE1 = new NodeConfig("http", "es1", 9200);
    private static final NodeConfig NODE2 = new NodeConfig("http", "es2", 9200);
    private static final Map<String, String> JSON = Map.of("content-type", "application/json");

    private final Map<NodeConfig, NodeConnection> connections = new LinkedHashMap<>();

    private NodeConnection connection(NodeConfig config) {
        return connections.computeIfAbsent(config, c -> {
            NodeConnection connection = mock(NodeConnection.class);
            when(connection.config()).thenReturn(c);
            return connection;
        });
    }

    private TransportSettings.Builder settings(NodeConfig... nodes) {
        for (NodeConfig node : nodes) {
            connection(node);
        }
        return TransportSettings.builder()
                .nodes(List.of(nodes))
                .randomizeNodes(false)
                .verifyProduct(false)
                .selector(live -> live.get(0))
                .connectionFactory((node, settings) -> connection(node));
    }

    private static NodeResponse ok(String body) {
        return new NodeResponse(200, JSON, body);
    }

    @Test
    public void testReturnsDeserializedBody() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any())).thenReturn(ok("{\"count\":3}"));

        ApiResponse response = transport.performRequest("GET", "/_count", Map.of(), Map.of(), null);

        assertEquals(200, response.status());
        assertEquals(Node.from(3), response.bodyAsNode().expectObjectNode().expectMember("count"));
        assertEquals(NODE1, response.node());
    }

    @Test
    public void testSerializesBodyAndSetsHeaders() {
        HttpTransport transport = new HttpTransport(settings(NODE1).basicAuth("elastic", "changeme").build());
        when(connection(NODE1).perform(any())).thenReturn(ok("{}"));

        transport.performRequest("POST", "/_search", Map.of(), Map.of(), Map.of("size", 0));

        ArgumentCaptor<NodeRequest> captor = ArgumentCaptor.forClass(NodeRequest.class);
        verify(connection(NODE1)).perform(captor.capture());
        NodeRequest request = captor.getValue();
        assertEquals("{\"size\":0}", request.body());
        assertEquals("application/json", request.headers().get("content-type"));
        assertEquals("Basic ZWxhc3RpYzpjaGFuZ2VtZQ==", request.headers().get("authorization"));
        assertTrue(request.headers().get(ClientMeta.HEADER).startsWith("es="));
    }

    @Test
    public void testRequestOptionsOverrideConfiguredAuth() {
        HttpTransport transport = new HttpTransport(settings(NODE1).basicAuth("elastic", "changeme").build());
        when(connection(NODE1).perform(any())).thenReturn(ok("{}"));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("routing", "a");
        params.put("opaque_id", "trace-1");
        params.put("api_key", List.of("id", "key"));

        transport.performRequest("GET", "/idx/_doc/1", ApiSupport.queryParams(params, "routing"),
                ApiSupport.headers(params, "application/json", null), null);

        ArgumentCaptor<NodeRequest> captor = ArgumentCaptor.forClass(NodeRequest.class);
        verify(connection(NODE1)).perform(captor.capture());
        NodeRequest request = captor.getValue();
        assertEquals(Map.of("routing", "a"), request.query());
        assertEquals("trace-1", request.headers().get("x-opaque-id"));
        assertEquals("ApiKey aWQ6a2V5", request.headers().get("authorization"));
    }

    @Test
    public void testTransportParamsAreNotSent() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any())).thenReturn(new NodeResponse(404, JSON, "{\"found\":false}"));
        Map<String, String> query = new LinkedHashMap<>();
        query.put("routing", "a");
        query.put("request_timeout", "2.5");
        query.put("ignore", "404,409");

        ApiResponse response = transport.performRequest("GET", "/idx/_doc/1", query, Map.of(), null);

        assertEquals(404, response.status());
        verify(connection(NODE1)).perform(argThat(request -> request.query().equals(Map.of("routing", "a"))
                && request.timeout().equals(Duration.ofMillis(2500))));
    }

    @Test
    public void testRetriesConnectionErrorsOnAnotherNode() {
        HttpTransport transport = new HttpTransport(settings(NODE1, NODE2).build());
        when(connection(NODE1).perform(any())).thenThrow(new ConnectionException("refused"));
        when(connection(NODE2).perform(any())).thenReturn(ok("{}"));

        ApiResponse response = transport.performRequest("GET", "/", Map.of(), Map.of(), null);

        assertEquals(NODE2, response.node());
        assertEquals(1, transport.pool().deadCount());
    }

    @Test
    public void testGivesUpAfterMaxRetries() {
        HttpTransport transport = new HttpTransport(settings(NODE1).maxRetries(2).build());
        when(connection(NODE1).perform(any())).thenThrow(new ConnectionException("refused"));

        assertThrows(ConnectionException.class,
                () -> transport.performRequest("GET", "/", Map.of(), Map.of(), null));
        verify(connection(NODE1), times(3)).perform(any());
    }

    @Test
    public void testRetryLogCountsTheNextAttempt() {
        HttpTransport transport = new HttpTransport(settings(NODE1).maxRetries(2).build());
        when(connection(NODE1).perform(any())).thenThrow(new ConnectionException("refused"));
        List<String> messages = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };
        Logger logger = Logger.getLogger(BaseTransport.class.getName());
        logger.addHandler(handler);
        try {
            assertThrows(ConnectionException.class,
                    () -> transport.performRequest("GET", "/", Map.of(), Map.of(), null));
        } finally {
            logger.removeHandler(handler);
        }

        List<String> retries = messages.stream()
                .filter(message -> message.startsWith("Retrying"))
                .collect(Collectors.toList());
        assertEquals(2, retries.size());
        assertTrue(retries.get(0).contains("(attempt 2 of 3)"), retries.get(0));
        assertTrue(retries.get(1).contains("(attempt 3 of 3)"), retries.get(1));
    }

    @Test
    public void testTimeoutsAreOnlyRetriedWhenEnabled() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any())).thenThrow(new ConnectionTimeoutException("timed out"));

        assertThrows(ConnectionTimeoutException.class,
                () -> transport.performRequest("GET", "/", Map.of(), Map.of(), null));
        verify(connection(NODE1), times(1)).perform(any());

        HttpTransport retrying = new HttpTransport(settings(NODE1).retryOnTimeout(true).maxRetries(1).build());
        assertThrows(ConnectionTimeoutException.class,
                () -> retrying.performRequest("GET", "/", Map.of(), Map.of(), null));
        verify(connection(NODE1), times(3)).perform(any());
    }

    @Test
    public void testRetriesConfiguredStatuses() {
        HttpTransport transport = new HttpTransport(settings(NODE1, NODE2).build());
        when(connection(NODE1).perform(any())).thenReturn(new NodeResponse(503, Map.of(), ""));
        when(connection(NODE2).perform(any())).thenReturn(ok("{}"));

        assertEquals(200, transport.performRequest("GET", "/", Map.of(), Map.of(), null).status());
    }

    @Test
    public void testErrorStatusesAreRaised() {
        HttpTransport transport = new HttpTransport(settings(NODE1, NODE2).build());
        when(connection(NODE1).perform(any())).thenReturn(new NodeResponse(404, JSON, "{\"found\":false}"));

        NotFoundException e = assertThrows(NotFoundException.class,
                () -> transport.performRequest("GET", "/idx/_doc/1", Map.of(), Map.of(), null));
        assertEquals(404, e.status());
        verify(connection(NODE2), never()).perform(any());
    }

    @Test
    public void testNonJsonErrorBodyIsKeptAsText() {
        HttpTransport transport = new HttpTransport(settings(NODE1).maxRetries(0).build());
        when(connection(NODE1).perform(any())).thenReturn(new NodeResponse(502, JSON, "<html>Bad Gateway</html>"));

        ApiException e = assertThrows(ApiException.class,
                () -> transport.performRequest("GET", "/", Map.of(), Map.of(), null));
        assertEquals("<html>Bad Gateway</html>", e.body());
    }

    @Test
    public void testHeadRequests() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any()))
                .thenReturn(new NodeResponse(200, Map.of(), ""))
                .thenReturn(new NodeResponse(404, Map.of(), ""));

        assertTrue(transport.performHeadRequest("/idx", Map.of(), Map.of()));
        assertFalse(transport.performHeadRequest("/missing", Map.of(), Map.of()));
    }

    @Test
    public void testEmptyBodyIsNull() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any())).thenReturn(new NodeResponse(200, Map.of(), ""));

        assertNull(transport.performRequest("DELETE", "/_scroll", Map.of(), Map.of(), null).body());
    }

    @Test
    public void testProductCheckRunsOnce() {
        HttpTransport transport = new HttpTransport(settings(NODE1).verifyProduct(true).build());
        when(connection(NODE1).perform(any())).thenAnswer(invocation -> {
            NodeRequest request = invocation.getArgument(0);
            if (request.path().equals("/")) {
                return new NodeResponse(200, Map.of("Content-Type", "application/json",
                        "X-Elastic-Product", "Elasticsearch"), "{\"version\":{\"number\":\"8.12.0\"}}");
            }
            return ok("{}");
        });

        transport.performRequest("GET", "/_count", Map.of(), Map.of(), null);
        transport.performRequest("GET", "/_count", Map.of(), Map.of(), null);

        verify(connection(NODE1), times(1)).perform(argThat(request -> request.path().equals("/")));
        verify(connection(NODE1), times(2)).perform(argThat(request -> request.path().equals("/_count")));
    }

    @Test
    public void testUnsupportedProductFailsEveryRequest() {
        HttpTransport transport = new HttpTransport(settings(NODE1).verifyProduct(true).build());
        when(connection(NODE1).perform(any())).thenReturn(ok("{\"version\":{\"number\":\"8.12.0\"}}"));

        assertThrows(UnsupportedProductException.class,
                () -> transport.performRequest("GET", "/_count", Map.of(), Map.of(), null));
        assertThrows(UnsupportedProductException.class,
                () -> transport.performRequest("GET", "/_count", Map.of(), Map.of(), null));
        verify(connection(NODE1), times(1)).perform(any());
    }

    @Test
    public void testProductCheckAcceptsForbidden() {
        HttpTransport transport = new HttpTransport(settings(NODE1).verifyProduct(true).build());
        when(connection(NODE1).perform(any()))
                .thenReturn(new NodeResponse(403, JSON, "{}"))
                .thenReturn(ok("{}"));

        assertEquals(200, transport.performRequest("GET", "/_count", Map.of(), Map.of(), null).status());
    }

    @Test
    public void testSniffOnStartReplacesNodes() {
        NodeConfig seed = new NodeConfig("http", "seed", 9200);
        connection(seed);
        when(connection(seed).perform(any())).thenReturn(ok("""
                {"nodes": {
                  "a": {"roles": ["data", "ingest"], "http": {"publish_address": "10.0.0.1:9200"}},
                  "b": {"roles": ["data"], "http": {"publish_address": "es2.local/10.0.0.2:9201"}},
                  "c": {"roles": ["master"], "http": {"publish_address": "10.0.0.3:9200"}},
                  "d": {"roles": ["data"]}
                }}"""));

        HttpTransport transport = new HttpTransport(settings(seed).sniffOnStart(true).build());

        List<NodeConfig> nodes = transport.pool().connections().stream()
                .map(NodeConnection::config)
                .collect(Collectors.toList());
        assertEquals(List.of(new NodeConfig("http", "10.0.0.1", 9200), new NodeConfig("http", "es2.local", 9201)),
                nodes);
        verify(connection(seed)).perform(argThat(request -> request.path().equals(BaseTransport.SNIFF_PATH)));
    }

    @Test
    public void testSniffKeepsConnectionsOfUnchangedNodes() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        NodeConnection original = connection(NODE1);
        when(original.perform(any())).thenReturn(ok(
                "{\"nodes\":{\"a\":{\"http\":{\"publish_address\":\"es1:9200\"}},"
                + "\"b\":{\"http\":{\"publish_address\":\"es2:9200\"}}}}"));

        transport.sniff(false);

        assertEquals(List.of(original, connection(NODE2)), transport.pool().connections());
    }

    @Test
    public void testSniffWithoutViableNodesFails() {
        HttpTransport transport = new HttpTransport(settings(NODE1).build());
        when(connection(NODE1).perform(any())).thenReturn(ok("{\"nodes\":{}}"));

        assertThrows(TransportException.class, () -> transport.sniff(false));
    }

    @Test
    public void testIntervalSniffing() {
        MutableClock clock = new MutableClock();
        HttpTransport transport = new HttpTransport(settings(NODE1)
                .clock(clock)
                .sniffInterval(Duration.ofMinutes(5))
                .build());
        when(connection(NODE1).perform(any())).thenAnswer(invocation -> {
            NodeRequest request = invocation.getArgument(0);
            return request.path().equals(BaseTransport.SNIFF_PATH)
                    ? ok("{\"nodes\":{\"a\":{\"http\":{\"publish_address\":\"es1:9200\"}}}}")
                    : ok("{}");
        });

        transport.performRequest("GET", "/", Map.of(), Map.of(), null);
        clock.advance(Duration.ofMinutes(5));
        transport.performRequest("GET", "/", Map.of(), Map.of(), null);
        transport.performRequest("GET", "/", Map.of(), Map.of(), null);

        verify(connection(NODE1), times(1)).perform(argThat(r -> r.path().equals(BaseTransport.SNIFF_PATH)));
    }
}
