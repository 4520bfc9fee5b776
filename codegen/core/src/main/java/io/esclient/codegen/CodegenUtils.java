/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import static java.lang.String.format;

import io.esclient.codegen.spec.ApiDefinition;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.CaseUtils;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Utility methods likely to be needed across packages.
 */
@SmithyUnstableApi
public final class CodegenUtils {

    /**
     * The preferred line length of generated code.
     */
    public static final int MAX_PREFERRED_LINE_LENGTH = 120;

    private static final Logger LOGGER = Logger.getLogger(CodegenUtils.class.getName());

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "yield", "record", "sealed", "permits");

    // Locals and fields of generated methods.
    private static final Set<String> GENERATED_NAMES = Set.of("query", "headers", "params", "transport");

    private CodegenUtils() {}

    /**
     * Gets the name of the method generated for an API.
     *
     * @param api The API.
     * @return Returns the lower camel case name, suffixed with {@code Api} if it is a Java keyword.
     */
    public static String methodName(ApiDefinition api) {
        String name = CaseUtils.snakeToCamelCase(api.name());
        return JAVA_KEYWORDS.contains(name) ? name + "Api" : name;
    }

    /**
     * Gets the name of the method argument for a URL part or the body.
     *
     * @param name The name in the API definition, such as {@code node_id}.
     * @return Returns the lower camel case name, suffixed with {@code Value} if it would clash.
     */
    public static String argumentName(String name) {
        String converted = CaseUtils.snakeToCamelCase(name);
        if (JAVA_KEYWORDS.contains(converted) || GENERATED_NAMES.contains(converted)) {
            return converted + "Value";
        }
        return converted;
    }

    /**
     * Gets the name of the asynchronous class holding the APIs of a namespace.
     *
     * @param namespace The namespace, or {@link ApiDefinition#ROOT_NAMESPACE}.
     * @param clientName The name of the root client.
     * @return Returns the class name, such as {@code AsyncIndicesClient}.
     */
    public static String className(String namespace, String clientName) {
        if (namespace.equals(ApiDefinition.ROOT_NAMESPACE)) {
            return "Async" + clientName;
        }
        return "Async" + CaseUtils.snakeToPascalCase(namespace) + "Client";
    }

    /**
     * Gets the name of the root client accessor returning a namespace client.
     *
     * @param namespace The namespace, such as {@code async_search}.
     * @return Returns the accessor name, such as {@code asyncSearch}.
     */
    public static String accessorName(String namespace) {
        String name = CaseUtils.snakeToCamelCase(namespace);
        return JAVA_KEYWORDS.contains(name) ? name + "Client" : name;
    }

    /**
     * Quotes a string as a Java string literal.
     *
     * @param value The value to quote, or null.
     * @return Returns the literal, or {@code null}.
     */
    public static String literal(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder builder = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }

    /**
     * Executes a given shell command in a given directory.
     *
     * @param command The string command to execute, e.g. "google-java-format -i File.java".
     * @param directory The directory to run the command in.
     * @return Returns the console output of the command.
     */
    public static String runCommand(String command, Path directory) {
        String[] finalizedCommand;
        if (System.getProperty("os.name").toLowerCase().startsWith("windows")) {
            finalizedCommand = new String[]{"cmd.exe", "/c", command};
        } else {
            finalizedCommand = new String[]{"sh", "-c", command};
        }

        ProcessBuilder processBuilder = new ProcessBuilder(finalizedCommand)
                .redirectErrorStream(true)
                .directory(directory.toFile());

        try {
            Process process = processBuilder.start();
            List<String> output = new ArrayList<>();

            // Capture output for reporting.
            try (BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(
                    process.getInputStream(), Charset.defaultCharset()))) {
                String line;
                while ((line = bufferedReader.readLine()) != null) {
                    LOGGER.finest(line);
                    output.add(line);
                }
            }

            process.waitFor();
            process.destroy();

            String joinedOutput = String.join(System.lineSeparator(), output);
            if (process.exitValue() != 0) {
                throw new CodegenException(format(
                        "Command `%s` failed with output:%n%n%s", command, joinedOutput));
            }
            return joinedOutput;
        } catch (InterruptedException | IOException e) {
            throw new CodegenException(e);
        }
    }
}
