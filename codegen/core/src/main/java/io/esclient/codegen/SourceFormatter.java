/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import software.amazon.smithy.build.FileManifest;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Normalizes the whitespace of every generated Java file, then runs the
 * configured external formatter on it, if any.
 */
@SmithyInternalApi
public final class SourceFormatter implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(SourceFormatter.class.getName());

    private final GenerationContext context;

    public SourceFormatter(GenerationContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        FileManifest fileManifest = context.fileManifest();
        String formatCommand = context.settings().formatCommand();
        LOGGER.info("Formatting generated code");
        for (Path file : fileManifest.getFiles()) {
            var fileName = file.getFileName();
            if (fileName == null || !fileName.toString().endsWith(".java")) {
                continue;
            }
            formatFile(file);
            if (formatCommand != null) {
                CodegenUtils.runCommand(formatCommand + " " + file, fileManifest.getBaseDir());
            }
        }
    }

    private static void formatFile(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String formatted = format(content);
            if (!formatted.equals(content)) {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new CodegenException("Unable to format " + file, e);
        }
    }

    /**
     * Strips trailing whitespace, collapses runs of blank lines and ends the
     * text with a single newline.
     *
     * @param content The text to format.
     * @return Returns the formatted text.
     */
    public static String format(String content) {
        StringBuilder result = new StringBuilder(content.length());
        boolean previousBlank = true;
        for (String line : content.lines().toList()) {
            String stripped = line.stripTrailing();
            if (stripped.isEmpty()) {
                if (!previousBlank) {
                    result.append('\n');
                }
                previousBlank = true;
            } else {
                result.append(stripped).append('\n');
                previousBlank = false;
            }
        }
        while (result.length() > 1 && result.charAt(result.length() - 2) == '\n') {
            result.setLength(result.length() - 1);
        }
        return result.toString();
    }
}
