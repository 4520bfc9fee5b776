/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import software.amazon.smithy.build.PluginContext;
import software.amazon.smithy.build.SmithyBuildPlugin;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Plugin to trigger client code generation from a smithy-build projection.
 *
 * <p>The plugin settings are read with {@link CodegenSettings#fromNode}. The
 * Smithy model of the projection isn't used.
 */
@SmithyUnstableApi
public final class ElasticsearchClientCodegenPlugin implements SmithyBuildPlugin {
    @Override
    public String getName() {
        return "elasticsearch-client-codegen";
    }

    @Override
    public boolean requiresValidModel() {
        return false;
    }

    @Override
    public void execute(PluginContext context) {
        CodegenSettings settings = CodegenSettings.fromNode(context.getSettings());
        new ClientCodegen(settings, context.getFileManifest()).run();
    }
}
