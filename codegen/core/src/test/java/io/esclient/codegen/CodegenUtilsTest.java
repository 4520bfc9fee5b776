/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.esclient.codegen.spec.ApiDefinition;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.Node;

public class CodegenUtilsTest {

    private static ApiDefinition api(String name) {
        return ApiDefinition.fromNode(name, Node.parse("""
                {"url": {"paths": [{"path": "/_x", "methods": ["GET"]}]}}
                """).expectObjectNode(), null);
    }

    @Test
    public void testMethodNames() {
        assertEquals("putMapping", CodegenUtils.methodName(api("indices.put_mapping")));
        assertEquals("search", CodegenUtils.methodName(api("search")));
        assertEquals("newApi", CodegenUtils.methodName(api("ml.new")));
    }

    @Test
    public void testArgumentNames() {
        assertEquals("nodeId", CodegenUtils.argumentName("node_id"));
        assertEquals("body", CodegenUtils.argumentName("body"));
        assertEquals("classValue", CodegenUtils.argumentName("class"));
        assertEquals("paramsValue", CodegenUtils.argumentName("params"));
        assertEquals("transportValue", CodegenUtils.argumentName("transport"));
    }

    @Test
    public void testClassAndAccessorNames() {
        assertEquals("AsyncElasticsearchClient", CodegenUtils.className(ApiDefinition.ROOT_NAMESPACE,
                "ElasticsearchClient"));
        assertEquals("AsyncSearchApplicationClient", CodegenUtils.className("search_application",
                "ElasticsearchClient"));
        assertEquals("searchApplication", CodegenUtils.accessorName("search_application"));
        assertEquals("cat", CodegenUtils.accessorName("cat"));
    }

    @Test
    public void testLiterals() {
        assertEquals("null", CodegenUtils.literal(null));
        assertEquals("\"/_cat/indices\"", CodegenUtils.literal("/_cat/indices"));
        assertEquals("\"a\\\"b\\\\c\\n\"", CodegenUtils.literal("a\"b\\c\n"));
    }

    @Test
    public void testRunsCommand(@TempDir Path tempDir) {
        assertEquals("hello", CodegenUtils.runCommand("echo hello", tempDir));
        assertThrows(CodegenException.class, () -> CodegenUtils.runCommand("exit 1", tempDir));
    }
}
