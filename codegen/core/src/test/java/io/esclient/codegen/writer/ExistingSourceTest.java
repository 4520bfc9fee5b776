/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.smithy.codegen.core.CodegenException;

public class ExistingSourceTest {

    private static final String SOURCE = """
            /*
             * Licensed under the Apache License 2.0
             */
            package com.example.async;

            import io.esclient.runtime.client.AsyncNamespacedClient;
            import java.util.Map;

            /**
             * Maintained by hand.
             */
            public class AsyncIndicesClient extends AsyncNamespacedClient {

                public AsyncIndicesClient(AsyncTransport transport) {
                    super(transport);
                }

                // AUTO-GENERATED-API-DEFINITIONS //

                /**
                 * Checks an index.
                 */
                public CompletableFuture<Boolean> exists(Object index, Map<String, ?> params) {
                    return null;
                }

                public CompletableFuture<ApiResponse> create(String index, Object body, Map<String, ?> params) {
                    return null;
                }
            }
            """;

    @Test
    public void testParsesPrefixImportsAndHeader() {
        ExistingSource source = ExistingSource.parse(SOURCE);

        assertEquals("/*\n * Licensed under the Apache License 2.0\n */\n", source.prefix());
        assertEquals(List.of(
                "import io.esclient.runtime.client.AsyncNamespacedClient;",
                "import java.util.Map;"), source.imports());
        assertTrue(source.header().startsWith("/**\n * Maintained by hand.\n */\npublic class AsyncIndicesClient"));
        assertTrue(source.header().endsWith(ExistingSource.SEPARATOR));
    }

    @Test
    public void testReadsMethodOrder() {
        ExistingSource source = ExistingSource.parse(SOURCE);

        assertEquals(List.of("exists", "create"), source.methodOrder());
        assertEquals(0, source.position("exists"));
        assertEquals(1, source.position("create"));
        assertEquals(2, source.position("delete"));
    }

    @Test
    public void testHeaderEndsAtClassDeclarationWithoutSeparator() {
        ExistingSource source = ExistingSource.parse("""
                package com.example.async;

                public final class AsyncCatClient extends AsyncNamespacedClient {
                    public AsyncCatClient(AsyncTransport transport) {
                        super(transport);
                    }

                    public CompletableFuture<ApiResponse> indices(Object index, Map<String, ?> params) {
                        return null;
                    }
                }
                """);

        assertEquals("", source.prefix());
        assertEquals(List.of(), source.imports());
        assertEquals("public final class AsyncCatClient extends AsyncNamespacedClient {", source.header());
        assertEquals(List.of("indices"), source.methodOrder());
    }

    @Test
    public void testRequiresPackageDeclaration() {
        assertThrows(CodegenException.class, () -> ExistingSource.parse("public class A {}\n"));
    }

    @Test
    public void testRequiresClassDeclaration() {
        assertThrows(CodegenException.class, () -> ExistingSource.parse("package com.example;\n\ninterface A {}\n"));
    }

    @Test
    public void testReadsFileIfPresent(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("AsyncIndicesClient.java");

        assertEquals(Optional.empty(), ExistingSource.read(file));

        Files.writeString(file, SOURCE);
        assertEquals(List.of("exists", "create"), ExistingSource.read(file).orElseThrow().methodOrder());
    }
}
