/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import io.esclient.codegen.integrations.ClientIntegration;
import io.esclient.codegen.spec.ApiDefinition;
import java.util.List;
import software.amazon.smithy.build.FileManifest;
import software.amazon.smithy.utils.SmithyBuilder;
import software.amazon.smithy.utils.SmithyUnstableApi;
import software.amazon.smithy.utils.ToSmithyBuilder;

/**
 * Holds context related to code generation.
 */
@SmithyUnstableApi
public final class GenerationContext implements ToSmithyBuilder<GenerationContext> {

    private final CodegenSettings settings;
    private final FileManifest fileManifest;
    private final List<ApiDefinition> apis;
    private final List<ClientIntegration> integrations;

    private GenerationContext(Builder builder) {
        settings = SmithyBuilder.requiredState("settings", builder.settings);
        fileManifest = SmithyBuilder.requiredState("fileManifest", builder.fileManifest);
        apis = List.copyOf(builder.apis);
        integrations = List.copyOf(builder.integrations);
    }

    public CodegenSettings settings() {
        return settings;
    }

    /**
     * @return Returns the manifest generated files are written to, relative to the output directory.
     */
    public FileManifest fileManifest() {
        return fileManifest;
    }

    /**
     * @return Returns every API being generated, in reading order.
     */
    public List<ApiDefinition> apis() {
        return apis;
    }

    /**
     * @return Returns the integrations, highest priority first.
     */
    public List<ClientIntegration> integrations() {
        return integrations;
    }

    /**
     * @return Returns a builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Builder toBuilder() {
        return builder()
                .settings(settings)
                .fileManifest(fileManifest)
                .apis(apis)
                .integrations(integrations);
    }

    /**
     * Builds {@link GenerationContext}s.
     */
    public static final class Builder implements SmithyBuilder<GenerationContext> {
        private CodegenSettings settings;
        private FileManifest fileManifest;
        private List<ApiDefinition> apis = List.of();
        private List<ClientIntegration> integrations = List.of();

        @Override
        public GenerationContext build() {
            return new GenerationContext(this);
        }

        /**
         * @param settings The resolved settings for the generator.
         * @return Returns the builder.
         */
        public Builder settings(CodegenSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * @param fileManifest The file manifest being used in the generator.
         * @return Returns the builder.
         */
        public Builder fileManifest(FileManifest fileManifest) {
            this.fileManifest = fileManifest;
            return this;
        }

        /**
         * @param apis The APIs to generate.
         * @return Returns the builder.
         */
        public Builder apis(List<ApiDefinition> apis) {
            this.apis = apis;
            return this;
        }

        /**
         * @param integrations The integrations to use in the generator.
         * @return Returns the builder.
         */
        public Builder integrations(List<ClientIntegration> integrations) {
            this.integrations = integrations;
            return this;
        }
    }
}
