/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import io.esclient.codegen.generators.ExampleGenerator;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.spec.RestApiSpecReader;
import io.esclient.codegen.spec.RestSpecArchive;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import software.amazon.smithy.build.FileManifest;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.SourceException;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Command line entry point of the generator.
 */
@SmithyUnstableApi
@Command(
        name = "esclient-codegen",
        description = "Generates the Elasticsearch client from REST API definitions",
        mixinStandardHelpOptions = true,
        subcommands = {ClientCodegenCli.GenerateCommand.class, ClientCodegenCli.ExamplesCommand.class}
)
public final class ClientCodegenCli implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ClientCodegenCli())
                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                .execute(args);
        System.exit(exitCode);
    }

    /**
     * Reads settings from a JSON file. Relative spec directories are resolved
     * against the directory of the file.
     *
     * @param file The settings file.
     * @return Returns the settings.
     */
    static CodegenSettings readSettings(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CodegenException("Unable to read settings " + file, e);
        }
        CodegenSettings settings = CodegenSettings.fromNode(Node.parse(content, file.toString()).expectObjectNode());
        Path base = file.toAbsolutePath().getParent();
        return settings.toBuilder()
                .specDirectories(settings.specDirectories().stream().map(base::resolve).toList())
                .build();
    }

    @Command(name = "generate", description = "Generates the client classes into a source root")
    static final class GenerateCommand implements Callable<Integer> {

        @Option(names = {"-s", "--settings"}, description = "Settings JSON file", required = true)
        private Path settingsFile;

        @Option(names = {"-o", "--output"}, description = "Java source root to write to", required = true)
        private Path output;

        @Option(
                names = {"--stack-version"},
                description = "Downloads the REST API definitions of this Elasticsearch version, such as 8.15.0"
        )
        private String stackVersion;

        @Override
        public Integer call() {
            try {
                CodegenSettings settings = readSettings(settingsFile);
                if (stackVersion != null) {
                    Path specs = Files.createTempDirectory("rest-api-spec");
                    new RestSpecArchive().download(stackVersion, specs);
                    settings = settings.toBuilder().addSpecDirectory(specs).build();
                }
                new ClientCodegen(settings, FileManifest.create(output)).run();
                return 0;
            } catch (CodegenException | SourceException e) {
                System.err.println("Generation failed: " + e.getMessage());
                return 1;
            } catch (IOException e) {
                System.err.println("Unable to create a directory for the downloaded definitions: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "examples", description = "Renders documentation examples as client calls")
    static final class ExamplesCommand implements Callable<Integer> {

        @Option(names = {"-s", "--settings"}, description = "Settings JSON file", required = true)
        private Path settingsFile;

        @Option(names = {"-r", "--report"}, description = "Parsed examples report JSON file", required = true)
        private Path report;

        @Option(names = {"-o", "--output"}, description = "Directory of the asciidoc files", required = true)
        private Path output;

        @Override
        public Integer call() {
            try {
                CodegenSettings settings = readSettings(settingsFile);
                List<ApiDefinition> apis = new RestApiSpecReader(settings.docsBranch(), settings.excludedNamespaces())
                        .read(settings.specDirectories());
                new ExampleGenerator(apis, ExampleGenerator.defaultAllowedFiles()).generate(report, output);
                return 0;
            } catch (CodegenException | SourceException e) {
                System.err.println("Example generation failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
