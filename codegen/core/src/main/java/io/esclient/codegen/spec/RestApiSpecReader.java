/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.spec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.SourceException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Reads REST API definitions from directories of JSON files.
 *
 * <p>Each file holds a single API, in a member named after the file:
 * {@code indices.create.json} holds {@code {"indices.create": {...}}}.
 */
@SmithyUnstableApi
public final class RestApiSpecReader {

    private static final Logger LOGGER = Logger.getLogger(RestApiSpecReader.class.getName());
    private static final String COMMON_FILE = "_common.json";

    private final String docsBranch;
    private final Set<String> excludedNamespaces;

    /**
     * @param docsBranch The branch to point reference documentation links at, or null.
     * @param excludedNamespaces Namespaces whose APIs are skipped.
     */
    public RestApiSpecReader(String docsBranch, Set<String> excludedNamespaces) {
        this.docsBranch = docsBranch;
        this.excludedNamespaces = Set.copyOf(excludedNamespaces);
    }

    /**
     * Reads every API of the given directories.
     *
     * <p>Directories are read in order, and the files of a directory sorted by name.
     *
     * @param directories Directories holding the definitions.
     * @return Returns the APIs in reading order.
     * @throws CodegenException if a file can't be read or parsed, or an API is defined twice.
     */
    public List<ApiDefinition> read(List<Path> directories) {
        Map<String, ApiDefinition> apis = new LinkedHashMap<>();
        for (Path directory : directories) {
            for (Path file : listFiles(directory)) {
                String fileName = file.getFileName().toString();
                if (!fileName.endsWith(".json") || fileName.equals(COMMON_FILE)) {
                    LOGGER.fine(() -> "Skipping " + file);
                    continue;
                }
                String name = fileName.substring(0, fileName.length() - ".json".length());
                ApiDefinition api = readFile(file, name);
                if (excludedNamespaces.contains(api.namespace())) {
                    LOGGER.info(() -> "Skipping " + name + " from excluded namespace " + api.namespace());
                    continue;
                }
                if (apis.put(name, api) != null) {
                    throw new CodegenException("API `" + name + "` is defined more than once, last in " + file);
                }
            }
        }
        LOGGER.info(() -> "Read " + apis.size() + " API definitions from " + directories);
        return new ArrayList<>(apis.values());
    }

    private ApiDefinition readFile(Path file, String name) {
        ObjectNode root;
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            root = Node.parse(content, file.toString()).expectObjectNode();
        } catch (IOException e) {
            throw new CodegenException("Unable to read API definition " + file, e);
        } catch (SourceException e) {
            throw new CodegenException("Invalid JSON in API definition " + file + ": " + e.getMessage(), e);
        }
        try {
            ObjectNode definition = root.getObjectMember(name)
                    .orElseThrow(() -> new CodegenException("no member named `" + name + "`"));
            return ApiDefinition.fromNode(name, definition, docsBranch);
        } catch (CodegenException | SourceException e) {
            throw new CodegenException("Invalid API definition " + file + ": " + e.getMessage(), e);
        }
    }

    private static List<Path> listFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new CodegenException("API definition directory does not exist: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException | UncheckedIOException e) {
            throw new CodegenException("Unable to list API definitions in " + directory, e);
        }
    }
}
