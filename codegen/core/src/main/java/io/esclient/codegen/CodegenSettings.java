/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.BooleanNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.SmithyBuilder;
import software.amazon.smithy.utils.SmithyUnstableApi;
import software.amazon.smithy.utils.StringUtils;
import software.amazon.smithy.utils.ToSmithyBuilder;

/**
 * Settings used by {@link ClientCodegen}.
 *
 * @param packageName The package of the generated synchronous client; the asynchronous one goes in {@code async}.
 * @param specDirectories The directories holding the API definitions, read in order. Must not be empty
 *                        when generating.
 * @param clientName The name of the root client class.
 * @param docsBranch The branch reference documentation links point at, or null to keep them as declared.
 * @param excludedNamespaces The namespaces that aren't generated.
 * @param licenseHeader The license written at the top of new files, possibly empty.
 * @param generateSync Whether to derive the synchronous client from the asynchronous one.
 * @param formatCommand An external formatter run on each generated file, or null.
 */
@SmithyUnstableApi
public record CodegenSettings(
        String packageName,
        List<Path> specDirectories,
        String clientName,
        String docsBranch,
        Set<String> excludedNamespaces,
        String licenseHeader,
        boolean generateSync,
        String formatCommand) implements ToSmithyBuilder<CodegenSettings> {

    public static final String DEFAULT_CLIENT_NAME = "ElasticsearchClient";
    public static final Set<String> DEFAULT_EXCLUDED_NAMESPACES = Set.of("data_frame_transform_deprecated");

    private static final String PACKAGE = "package";
    private static final String SPEC_DIRECTORIES = "specDirectories";
    private static final String CLIENT_NAME = "clientName";
    private static final String DOCS_BRANCH = "docsBranch";
    private static final String EXCLUDED_NAMESPACES = "excludedNamespaces";
    private static final String LICENSE_HEADER = "licenseHeader";
    private static final String GENERATE_SYNC = "generateSync";
    private static final String FORMAT_COMMAND = "formatCommand";

    public CodegenSettings {
        Objects.requireNonNull(packageName);
        Objects.requireNonNull(clientName);
        Objects.requireNonNull(licenseHeader);
        specDirectories = List.copyOf(specDirectories);
        excludedNamespaces = Set.copyOf(excludedNamespaces);
        if (!packageName.matches("[a-z_][a-z0-9_]*(\\.[a-z_][a-z0-9_]*)*")) {
            throw new CodegenException(
                    "Java package names may only consist of dot-separated lowercase letters, numbers, "
                            + "and underscores: " + packageName);
        }
        if (!clientName.matches("[A-Z][A-Za-z0-9]*")) {
            throw new CodegenException("The client name must be a Java class name: " + clientName);
        }
    }

    public CodegenSettings(Builder builder) {
        this(
                builder.packageName,
                builder.specDirectories,
                builder.clientName,
                StringUtils.isBlank(builder.docsBranch) ? null : builder.docsBranch,
                builder.excludedNamespaces,
                builder.licenseHeader,
                builder.generateSync,
                StringUtils.isBlank(builder.formatCommand) ? null : builder.formatCommand);
    }

    /**
     * @return Returns the package of the generated asynchronous client.
     */
    public String asyncPackageName() {
        return packageName + ".async";
    }

    /**
     * Create a settings object from a configuration object node.
     *
     * @param config Config object to load.
     * @return Returns the extracted settings.
     */
    public static CodegenSettings fromNode(ObjectNode config) {
        config.warnIfAdditionalProperties(Arrays.asList(PACKAGE, SPEC_DIRECTORIES, CLIENT_NAME, DOCS_BRANCH,
                EXCLUDED_NAMESPACES, LICENSE_HEADER, GENERATE_SYNC, FORMAT_COMMAND));

        Builder builder = builder().packageName(config.expectStringMember(PACKAGE).getValue());
        config.getArrayMember(SPEC_DIRECTORIES)
                .map(CodegenSettings::strings)
                .map(directories -> directories.stream().map(Path::of).toList())
                .ifPresent(builder::specDirectories);
        config.getStringMember(CLIENT_NAME).map(StringNode::getValue).ifPresent(builder::clientName);
        config.getStringMember(DOCS_BRANCH).map(StringNode::getValue).ifPresent(builder::docsBranch);
        config.getArrayMember(EXCLUDED_NAMESPACES)
                .map(CodegenSettings::strings)
                .ifPresent(builder::excludedNamespaces);
        config.getStringMember(LICENSE_HEADER).map(StringNode::getValue).ifPresent(builder::licenseHeader);
        config.getBooleanMember(GENERATE_SYNC).map(BooleanNode::getValue).ifPresent(builder::generateSync);
        config.getStringMember(FORMAT_COMMAND).map(StringNode::getValue).ifPresent(builder::formatCommand);
        return builder.build();
    }

    private static List<String> strings(ArrayNode array) {
        return array.getElements().stream().map(Node::expectStringNode).map(StringNode::getValue).toList();
    }

    /**
     * Renders the license header as a block comment.
     *
     * @return Returns the comment followed by a newline, or an empty string if there is no license.
     */
    public String licenseComment() {
        if (licenseHeader.isBlank()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("/*\n");
        licenseHeader.strip().lines().forEach(line -> builder.append((" * " + line).stripTrailing()).append('\n'));
        return builder.append(" */\n").toString();
    }

    @Override
    public Builder toBuilder() {
        return builder()
                .packageName(packageName)
                .specDirectories(specDirectories)
                .clientName(clientName)
                .docsBranch(docsBranch)
                .excludedNamespaces(excludedNamespaces)
                .licenseHeader(licenseHeader)
                .generateSync(generateSync)
                .formatCommand(formatCommand);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder implements SmithyBuilder<CodegenSettings> {

        private String packageName;
        private List<Path> specDirectories = new ArrayList<>();
        private String clientName = DEFAULT_CLIENT_NAME;
        private String docsBranch;
        private Set<String> excludedNamespaces = new LinkedHashSet<>(DEFAULT_EXCLUDED_NAMESPACES);
        private String licenseHeader = "";
        private boolean generateSync = true;
        private String formatCommand;

        @Override
        public CodegenSettings build() {
            SmithyBuilder.requiredState("packageName", packageName);
            return new CodegenSettings(this);
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder specDirectories(List<Path> specDirectories) {
            this.specDirectories = new ArrayList<>(specDirectories);
            return this;
        }

        public Builder addSpecDirectory(Path specDirectory) {
            this.specDirectories.add(specDirectory);
            return this;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder docsBranch(String docsBranch) {
            this.docsBranch = docsBranch;
            return this;
        }

        public Builder excludedNamespaces(Iterable<String> excludedNamespaces) {
            this.excludedNamespaces = new LinkedHashSet<>();
            excludedNamespaces.forEach(this.excludedNamespaces::add);
            return this;
        }

        public Builder licenseHeader(String licenseHeader) {
            this.licenseHeader = licenseHeader == null ? "" : licenseHeader;
            return this;
        }

        public Builder generateSync(boolean generateSync) {
            this.generateSync = generateSync;
            return this;
        }

        public Builder formatCommand(String formatCommand) {
            this.formatCommand = formatCommand;
            return this;
        }
    }
}
