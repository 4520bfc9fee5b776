/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.generators;

import io.esclient.codegen.CodegenUtils;
import io.esclient.codegen.spec.ApiDefinition;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.utils.SimpleCodeWriter;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Renders the console examples of the reference documentation as calls to
 * the generated client.
 *
 * <p>The input is a parsed report of the documentation's examples. Each
 * console example of an allowed page becomes {@code <digest>.asciidoc} in the
 * output directory, holding a {@code [source, java]} block.
 */
@SmithyUnstableApi
public final class ExampleGenerator {

    private static final Logger LOGGER = Logger.getLogger(ExampleGenerator.class.getName());
    private static final String DEFAULT_FILES_RESOURCE = "example-files.txt";
    private static final int MAX_LINE_LENGTH = 80;
    private static final int MAX_MAP_OF_ENTRIES = 10;

    private final Map<String, ApiDefinition> apis;
    private final Set<String> allowedFiles;

    /**
     * @param apis The APIs of the generated client.
     * @param allowedFiles The documentation pages whose examples are rendered.
     */
    public ExampleGenerator(List<ApiDefinition> apis, Set<String> allowedFiles) {
        this.apis = apis.stream().collect(Collectors.toMap(ApiDefinition::fullName, Function.identity(),
                (left, right) -> left, LinkedHashMap::new));
        this.allowedFiles = Set.copyOf(allowedFiles);
    }

    /**
     * Loads the default list of documentation pages whose examples are rendered.
     *
     * @return Returns the page paths.
     */
    public static Set<String> defaultAllowedFiles() {
        InputStream stream = ExampleGenerator.class.getResourceAsStream("/io/esclient/codegen/"
                + DEFAULT_FILES_RESOURCE);
        if (stream == null) {
            throw new CodegenException("Missing resource " + DEFAULT_FILES_RESOURCE);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (IOException e) {
            throw new CodegenException("Unable to read " + DEFAULT_FILES_RESOURCE, e);
        }
    }

    /**
     * Replaces the examples in a directory with those of a report.
     *
     * @param report The parsed examples report, a JSON array.
     * @param outputDir The directory of the {@code .asciidoc} files.
     * @return Returns the written files.
     */
    public List<Path> generate(Path report, Path outputDir) {
        ArrayNode examples;
        try {
            examples = Node.parse(Files.readString(report, StandardCharsets.UTF_8), report.toString())
                    .expectArrayNode();
            Files.createDirectories(outputDir);
            deleteExisting(outputDir);
        } catch (IOException e) {
            throw new CodegenException("Unable to generate examples from " + report, e);
        }

        List<Path> written = new ArrayList<>();
        for (Node element : examples.getElements()) {
            ObjectNode example = element.expectObjectNode();
            if (!example.getStringMemberOrDefault("lang", "").equals("console")) {
                continue;
            }
            ObjectNode location = example.expectObjectMember("source_location");
            String file = location.expectStringMember("file").getValue();
            if (!allowedFiles.contains(file)) {
                continue;
            }
            String origin = file + ":" + Node.printJson(location.expectMember("line"));
            String calls = renderCalls(example.expectArrayMember("parsed_source"), origin);
            if (calls == null) {
                continue;
            }
            Path target = outputDir.resolve(example.expectStringMember("digest").getValue() + ".asciidoc");
            try {
                Files.writeString(target, renderExample(origin, calls), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new CodegenException("Unable to write " + target, e);
            }
            written.add(target);
        }
        LOGGER.info(String.format("Wrote %d examples to %s", written.size(), outputDir));
        return written;
    }

    private static void deleteExisting(Path outputDir) throws IOException {
        List<Path> existing;
        try (Stream<Path> files = Files.list(outputDir)) {
            existing = files.filter(path -> path.getFileName().toString().endsWith(".asciidoc")).toList();
        }
        for (Path path : existing) {
            Files.delete(path);
        }
    }

    static String renderExample(String origin, String calls) {
        SimpleCodeWriter writer = new SimpleCodeWriter();
        writer.writeWithNoFormatting("// " + origin);
        writer.writeWithNoFormatting("");
        writer.writeWithNoFormatting("[source, java]");
        writer.writeWithNoFormatting("----");
        writer.writeWithNoFormatting(calls);
        writer.writeWithNoFormatting("----");
        return writer.toString();
    }

    /**
     * Renders the client calls of one example.
     *
     * @param sources The parsed requests of the example.
     * @param origin The page and line of the example, used in logs.
     * @return Returns the calls, or null if an API is unknown.
     */
    String renderCalls(ArrayNode sources, String origin) {
        SimpleCodeWriter writer = new SimpleCodeWriter().trimTrailingSpaces();
        int index = 0;
        for (Node element : sources.getElements()) {
            ObjectNode source = element.expectObjectNode();
            String apiName = source.expectStringMember("api").getValue();
            ApiDefinition api = apis.get(apiName);
            if (api == null) {
                LOGGER.warning(String.format("Unknown API %s in the example at %s, skipping it", apiName, origin));
                return null;
            }
            String variable = index == 0 ? "resp" : "resp" + index;
            writeCall(writer, variable, api, source);
            writer.writeWithNoFormatting("System.out.println(" + variable + ");");
            writer.writeWithNoFormatting("");
            index++;
        }
        return writer.toString().stripTrailing();
    }

    private void writeCall(SimpleCodeWriter writer, String variable, ApiDefinition api, ObjectNode source) {
        Map<String, Node> params = new LinkedHashMap<>();
        source.getObjectMember("params").ifPresent(node -> node.getStringMap().forEach(params::put));
        source.getObjectMember("query").ifPresent(node -> node.getStringMap().forEach(params::put));

        List<String> arguments = new ArrayList<>();
        boolean multiline = false;
        for (String argument : api.arguments()) {
            if (argument.equals("body")) {
                String body = source.getMember("body").filter(node -> !isEmpty(node)).map(this::textBlock).orElse(null);
                multiline |= body != null;
                arguments.add(Objects.requireNonNullElse(body, "null"));
            } else {
                Node value = params.remove(argument);
                arguments.add(value == null ? "null" : literal(value));
            }
        }
        arguments.add(paramsMap(params));

        String target = api.namespace().equals(ApiDefinition.ROOT_NAMESPACE)
                ? "client"
                : "client." + CodegenUtils.accessorName(api.namespace()) + "()";
        String start = "var " + variable + " = " + target + "." + CodegenUtils.methodName(api) + "(";
        String line = start + String.join(", ", arguments) + ");";
        if (!multiline && line.length() <= MAX_LINE_LENGTH) {
            writer.writeWithNoFormatting(line);
            return;
        }
        writer.writeWithNoFormatting(start);
        writer.indent();
        for (int i = 0; i < arguments.size(); i++) {
            writer.writeWithNoFormatting(arguments.get(i) + (i < arguments.size() - 1 ? "," : ""));
        }
        writer.dedent();
        writer.writeWithNoFormatting(");");
    }

    private static boolean isEmpty(Node node) {
        return node.isNullNode()
                || node.asObjectNode().map(ObjectNode::isEmpty).orElse(false)
                || node.asArrayNode().map(ArrayNode::isEmpty).orElse(false);
    }

    private String textBlock(Node body) {
        String content;
        if (body.isArrayNode()) {
            // Bulk bodies are sent as one JSON document per line.
            content = body.expectArrayNode().getElements().stream()
                    .map(Node::printJson)
                    .collect(Collectors.joining("\n", "", "\n"));
        } else if (body.isStringNode()) {
            content = body.expectStringNode().getValue().strip() + "\n";
        } else {
            content = Node.prettyPrintJson(body) + "\n";
        }
        content = content.replace("\\", "\\\\").replace("\"\"\"", "\\\"\"\"");
        return "\"\"\"\n" + content + "\"\"\"";
    }

    private static String paramsMap(Map<String, Node> params) {
        if (params.isEmpty()) {
            return "null";
        }
        List<String> entries = new ArrayList<>();
        if (params.size() > MAX_MAP_OF_ENTRIES) {
            params.forEach((key, value) -> entries.add("Map.entry(" + CodegenUtils.literal(key) + ", "
                    + literal(value) + ")"));
            return "Map.ofEntries(" + String.join(", ", entries) + ")";
        }
        params.forEach((key, value) -> entries.add(CodegenUtils.literal(key) + ", " + literal(value)));
        return "Map.of(" + String.join(", ", entries) + ")";
    }

    static String literal(Node value) {
        if (value.isStringNode()) {
            String text = value.expectStringNode().getValue();
            if (text.contains(",")) {
                return "List.of(" + Stream.of(text.split(","))
                        .map(CodegenUtils::literal)
                        .collect(Collectors.joining(", ")) + ")";
            }
            return CodegenUtils.literal(text);
        } else if (value.isArrayNode()) {
            return "List.of(" + value.expectArrayNode().getElements().stream()
                    .map(ExampleGenerator::literal)
                    .collect(Collectors.joining(", ")) + ")";
        } else if (value.isNumberNode() || value.isBooleanNode()) {
            return Node.printJson(value);
        } else if (value.isNullNode()) {
            return "null";
        }
        return CodegenUtils.literal(Node.printJson(value));
    }
}
