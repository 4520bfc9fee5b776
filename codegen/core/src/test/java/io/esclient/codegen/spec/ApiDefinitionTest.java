/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.esclient.codegen.ApiFixtures;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

public class ApiDefinitionTest {

    private static ApiDefinition parse(String name, String json) {
        return ApiDefinition.fromNode(name, Node.parse(json).expectObjectNode(), null);
    }

    @Test
    public void testSplitsNamespaceAndName() {
        ApiDefinition create = ApiFixtures.api("indices.create");
        assertEquals("indices", create.namespace());
        assertEquals("create", create.name());

        ApiDefinition ping = ApiFixtures.api("ping");
        assertEquals(ApiDefinition.ROOT_NAMESPACE, ping.namespace());
        assertEquals("ping", ping.name());
    }

    @Test
    public void testUpgradesDocumentationUrlToHttps() {
        assertEquals("https://www.elastic.co/guide/en/elasticsearch/reference/master/search-count.html",
                ApiFixtures.api("count").docUrl());
    }

    @Test
    public void testPointsDocumentationUrlAtBranch() {
        ObjectNode node = Node.parse("""
                {
                  "documentation": {"url": "https://www.elastic.co/guide/en/elasticsearch/reference/master/x.html"},
                  "url": {"paths": [{"path": "/_x", "methods": ["GET"]}]}
                }
                """).expectObjectNode();

        ApiDefinition api = ApiDefinition.fromNode("x", node, "8.15");

        assertEquals("https://www.elastic.co/guide/en/elasticsearch/reference/8.15/x.html", api.docUrl());
    }

    @Test
    public void testDropsDocumentationThatIsNotALink() {
        ApiDefinition api = parse("x", """
                {
                  "documentation": "TODO",
                  "url": {"paths": [{"path": "/_x", "methods": ["GET"]}]}
                }
                """);

        assertEquals("", api.docUrl());
        assertEquals("", api.description());
    }

    @Test
    public void testSelectsPathWithMostParts() {
        assertEquals("/{index}/_count", ApiFixtures.api("count").path().path());
        assertEquals("/", ApiFixtures.api("ping").path().path());
        assertFalse(ApiFixtures.api("ping").path().isDynamic());
    }

    @Test
    public void testPrefersPostForGetWithBody() {
        assertEquals("POST", ApiFixtures.api("search").method());
        assertEquals("GET", ApiFixtures.api("get").method());
        assertEquals("HEAD", ApiFixtures.api("indices.exists").method());
        assertEquals("DELETE", ApiFixtures.api("clear_scroll").method());
    }

    @Test
    public void testPartIsRequiredOnlyWhenEveryPathHasIt() {
        assertFalse(ApiFixtures.api("count").allParts().get("index").required());
        assertTrue(ApiFixtures.api("get").allParts().get("id").required());
        assertTrue(ApiFixtures.api("indices.create").allParts().get("index").required());
    }

    @Test
    public void testOrdersPartsByPathPosition() {
        // get.json declares id before index.
        assertEquals(List.of("index", "id"), List.copyOf(ApiFixtures.api("get").allParts().keySet()));
    }

    @Test
    public void testRequiredArguments() {
        assertEquals(List.of("index", "id"), ApiFixtures.api("get").requiredArguments());
        assertEquals(List.of("body"), ApiFixtures.api("bulk").requiredArguments());
        assertEquals(List.of("index"), ApiFixtures.api("indices.create").requiredArguments());
        assertEquals(List.of(), ApiFixtures.api("search").requiredArguments());
    }

    @Test
    public void testArguments() {
        assertEquals(List.of("index", "id"), ApiFixtures.api("get").arguments());
        assertEquals(List.of("body", "index"), ApiFixtures.api("count").arguments());
        assertEquals(List.of("index", "body"), ApiFixtures.api("indices.create").arguments());
        assertEquals(List.of("body", "scroll_id"), ApiFixtures.api("scroll").arguments());
        assertEquals(List.of(), ApiFixtures.api("ping").arguments());
    }

    @Test
    public void testQueryParamsAreSortedAndExcludeParts() {
        assertEquals(List.of("expand_wildcards", "ignore_unavailable", "min_score", "q"),
                ApiFixtures.api("count").queryParams());
        assertEquals(List.of("rest_total_hits_as_int", "scroll"), ApiFixtures.api("scroll").queryParams());
    }

    @Test
    public void testReadsHeaders() {
        ApiDefinition catIndices = ApiFixtures.api("cat.indices");
        assertEquals(List.of("text/plain", "application/json"), catIndices.accept());
        assertEquals(List.of(), catIndices.contentType());
        assertEquals(List.of("application/x-ndjson"), ApiFixtures.api("bulk").contentType());
    }

    @Test
    public void testReadsBody() {
        ApiBody body = ApiFixtures.api("bulk").body().orElseThrow();
        assertTrue(body.required());
        assertTrue(body.isBulk());
        assertEquals(Optional.empty(), ApiFixtures.api("get").body());
    }

    @Test
    public void testReadsParameterDetails() {
        ApiParameter expandWildcards = ApiFixtures.api("count").params().get("expand_wildcards");

        assertEquals("enum", expandWildcards.type());
        assertEquals(List.of("open", "closed", "hidden", "none", "all"), expandWildcards.options());
        assertEquals(Optional.of(Node.from("open")), expandWildcards.defaultValue());
        assertTrue(ApiFixtures.api("scroll").allParts().get("scroll_id").deprecated());
    }

    @Test
    public void testReadsStabilityAndDeprecation() {
        assertEquals("experimental", ApiFixtures.api("async_search.submit").stability());
        assertEquals("stable", ApiFixtures.api("search").stability());

        ApiDefinition api = parse("old", """
                {
                  "deprecated": {"version": "7.0.0", "description": "Use `new` instead."},
                  "url": {"paths": [{"path": "/_old", "methods": ["GET"]}]}
                }
                """);

        assertEquals(Optional.of("Use `new` instead."), api.deprecation());
        assertEquals(Optional.empty(), ApiFixtures.api("search").deprecation());
    }

    @Test
    public void testSplitsPathIntoComponents() {
        UrlPath path = ApiFixtures.api("get").path();

        assertEquals(List.of(
                new UrlPath.PathComponent("index", true),
                new UrlPath.PathComponent("_doc", false),
                new UrlPath.PathComponent("id", true)), path.components());
        assertEquals(List.of("index", "id"), path.partNames());
    }

    @Test
    public void testMissingUrlFails() {
        CodegenException e = assertThrows(CodegenException.class, () -> parse("broken", "{}"));

        assertTrue(e.getMessage().contains("broken"));
    }

    @Test
    public void testPathWithoutMethodsFails() {
        assertThrows(CodegenException.class, () -> parse("broken", """
                {"url": {"paths": [{"path": "/_x", "methods": []}]}}
                """));
    }
}
