/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.writer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * The hand-maintained parts of a previously generated source file.
 *
 * <p>Everything up to the {@link #SEPARATOR} line is kept when the file is
 * regenerated. Files without the separator keep everything up to their class
 * declaration. The order of the methods after it is kept as well.
 */
@SmithyInternalApi
public final class ExistingSource {

    /**
     * Line separating the header of a file from its generated methods.
     */
    public static final String SEPARATOR = "    // AUTO-GENERATED-API-DEFINITIONS //";

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
            "^(?:public\\s+)?(?:(?:final|abstract)\\s+)*class\\s.*");
    private static final Pattern METHOD_DECLARATION = Pattern.compile(
            "^    public (?:static )?[\\w<>\\[\\], ?.]+ (\\w+)\\(", Pattern.MULTILINE);

    private final String prefix;
    private final List<String> imports;
    private final String header;
    private final List<String> methodOrder;

    private ExistingSource(String prefix, List<String> imports, String header, List<String> methodOrder) {
        this.prefix = prefix;
        this.imports = List.copyOf(imports);
        this.header = header;
        this.methodOrder = List.copyOf(methodOrder);
    }

    /**
     * Reads a file if it exists.
     *
     * @param file The file to read.
     * @return Returns the parsed file, or empty if it doesn't exist.
     * @throws CodegenException if the file can't be read or has no package or class declaration.
     */
    public static Optional<ExistingSource> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new CodegenException("Unable to read existing source " + file, e);
        } catch (CodegenException e) {
            throw new CodegenException("Unable to parse existing source " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses the contents of a source file.
     *
     * @param content The source text.
     * @return Returns the parsed file.
     * @throws CodegenException if the text has no package or class declaration.
     */
    public static ExistingSource parse(String content) {
        List<String> lines = content.lines().toList();
        int packageLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith("package ")) {
                packageLine = i;
                break;
            }
        }
        if (packageLine < 0) {
            throw new CodegenException("no package declaration found");
        }
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < packageLine; i++) {
            prefix.append(lines.get(i)).append('\n');
        }

        List<String> imports = new ArrayList<>();
        int headerStart = packageLine + 1;
        while (headerStart < lines.size()) {
            String line = lines.get(headerStart).strip();
            if (line.startsWith("import ")) {
                imports.add(line);
            } else if (!line.isEmpty()) {
                break;
            }
            headerStart++;
        }

        int headerEnd = indexOf(lines, headerStart, SEPARATOR::equals);
        if (headerEnd < 0) {
            headerEnd = indexOf(lines, headerStart, line -> CLASS_DECLARATION.matcher(line).matches());
        }
        if (headerEnd < 0) {
            throw new CodegenException("no class declaration found");
        }
        String header = String.join("\n", lines.subList(headerStart, headerEnd + 1));

        List<String> methodOrder = new ArrayList<>();
        String body = String.join("\n", lines.subList(headerEnd + 1, lines.size()));
        Matcher matcher = METHOD_DECLARATION.matcher(body);
        while (matcher.find()) {
            methodOrder.add(matcher.group(1));
        }
        return new ExistingSource(prefix.toString(), imports, header, methodOrder);
    }

    private static int indexOf(List<String> lines, int start, Predicate<String> predicate) {
        for (int i = start; i < lines.size(); i++) {
            if (predicate.test(lines.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return Returns the text before the package declaration, such as a license comment.
     */
    public String prefix() {
        return prefix;
    }

    /**
     * @return Returns the import statements of the file.
     */
    public List<String> imports() {
        return imports;
    }

    /**
     * @return Returns the header, without a trailing newline.
     */
    public String header() {
        return header;
    }

    /**
     * @return Returns the names of the generated methods in file order.
     */
    public List<String> methodOrder() {
        return methodOrder;
    }

    /**
     * Gets the position of a method in the file.
     *
     * @param methodName The name of the method.
     * @return Returns the position, or the number of known methods for new ones.
     */
    public int position(String methodName) {
        int index = methodOrder.indexOf(methodName);
        return index < 0 ? methodOrder.size() : index;
    }
}
