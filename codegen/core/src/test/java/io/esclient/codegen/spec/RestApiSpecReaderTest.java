/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.esclient.codegen.ApiFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.smithy.codegen.core.CodegenException;

public class RestApiSpecReaderTest {

    private static final String PING = """
            {"ping": {"url": {"paths": [{"path": "/", "methods": ["HEAD"]}]}}}
            """;

    @TempDir
    Path tempDir;

    private static List<String> names(List<ApiDefinition> apis) {
        return apis.stream().map(ApiDefinition::fullName).toList();
    }

    @Test
    public void testReadsFilesInNameOrderSkippingCommon() {
        List<ApiDefinition> apis = new RestApiSpecReader(null, Set.of()).read(List.of(ApiFixtures.directory()));

        assertEquals(List.of(
                "async_search.submit",
                "bulk",
                "cat.indices",
                "clear_scroll",
                "count",
                "get",
                "indices.create",
                "indices.exists",
                "ping",
                "scroll",
                "search"), names(apis));
    }

    @Test
    public void testSkipsExcludedNamespaces() {
        List<ApiDefinition> apis = new RestApiSpecReader(null, Set.of("cat", "indices"))
                .read(List.of(ApiFixtures.directory()));

        assertTrue(apis.stream().noneMatch(api -> api.namespace().equals("cat")));
        assertTrue(apis.stream().noneMatch(api -> api.namespace().equals("indices")));
        assertEquals(8, apis.size());
    }

    @Test
    public void testAppliesDocsBranch() {
        List<ApiDefinition> apis = new RestApiSpecReader("8.15", Set.of()).read(List.of(ApiFixtures.directory()));

        assertTrue(apis.stream()
                .filter(api -> !api.docUrl().isEmpty())
                .allMatch(api -> api.docUrl().contains("/elasticsearch/reference/8.15/")));
    }

    @Test
    public void testReadsDirectoriesInOrder() throws IOException {
        Path first = Files.createDirectory(tempDir.resolve("first"));
        Path second = Files.createDirectory(tempDir.resolve("second"));
        Files.writeString(first.resolve("ping.json"), PING);
        Files.writeString(second.resolve("info.json"), """
                {"info": {"url": {"paths": [{"path": "/", "methods": ["GET"]}]}}}
                """);

        List<ApiDefinition> apis = new RestApiSpecReader(null, Set.of()).read(List.of(first, second));

        assertEquals(List.of("ping", "info"), names(apis));
    }

    @Test
    public void testSkipsFilesThatAreNotJson() throws IOException {
        Files.writeString(tempDir.resolve("ping.json"), PING);
        Files.writeString(tempDir.resolve("README.md"), "# API definitions");

        assertEquals(List.of("ping"), names(new RestApiSpecReader(null, Set.of()).read(List.of(tempDir))));
    }

    @Test
    public void testDuplicateApiFails() throws IOException {
        Path first = Files.createDirectory(tempDir.resolve("first"));
        Path second = Files.createDirectory(tempDir.resolve("second"));
        Files.writeString(first.resolve("ping.json"), PING);
        Files.writeString(second.resolve("ping.json"), PING);

        CodegenException e = assertThrows(CodegenException.class,
                () -> new RestApiSpecReader(null, Set.of()).read(List.of(first, second)));

        assertTrue(e.getMessage().contains("defined more than once"));
    }

    @Test
    public void testInvalidJsonNamesFile() throws IOException {
        Path file = tempDir.resolve("ping.json");
        Files.writeString(file, "{\"ping\": ");

        CodegenException e = assertThrows(CodegenException.class,
                () -> new RestApiSpecReader(null, Set.of()).read(List.of(tempDir)));

        assertTrue(e.getMessage().contains(file.toString()));
    }

    @Test
    public void testFileWithoutItsApiFails() throws IOException {
        Files.writeString(tempDir.resolve("ping.json"), """
                {"info": {"url": {"paths": [{"path": "/", "methods": ["GET"]}]}}}
                """);

        CodegenException e = assertThrows(CodegenException.class,
                () -> new RestApiSpecReader(null, Set.of()).read(List.of(tempDir)));

        assertTrue(e.getMessage().contains("no member named `ping`"));
    }

    @Test
    public void testMissingDirectoryFails() {
        assertThrows(CodegenException.class,
                () -> new RestApiSpecReader(null, Set.of()).read(List.of(tempDir.resolve("missing"))));
    }
}
