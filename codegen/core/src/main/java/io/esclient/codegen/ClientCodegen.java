/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import io.esclient.codegen.generators.NamespaceModule;
import io.esclient.codegen.integrations.ClientIntegration;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.spec.RestApiSpecReader;
import io.esclient.codegen.unasync.Unasync;
import io.esclient.codegen.writer.ExistingSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import software.amazon.smithy.build.FileManifest;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Generates the asynchronous and blocking client classes from REST API
 * definitions.
 *
 * <p>Files are written under the manifest's base directory, which is a Java
 * source root. Classes that already exist keep their hand-maintained header.
 */
@SmithyUnstableApi
public final class ClientCodegen implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ClientCodegen.class.getName());

    private final CodegenSettings settings;
    private final FileManifest fileManifest;
    private final List<ClientIntegration> integrations;

    public ClientCodegen(CodegenSettings settings, FileManifest fileManifest) {
        this(settings, fileManifest, loadIntegrations(ClientCodegen.class.getClassLoader()));
    }

    public ClientCodegen(CodegenSettings settings, FileManifest fileManifest, List<ClientIntegration> integrations) {
        this.settings = settings;
        this.fileManifest = fileManifest;
        this.integrations = integrations.stream()
                .sorted(Comparator.comparingInt(ClientIntegration::priority).reversed())
                .toList();
    }

    /**
     * Finds integrations with {@link ServiceLoader}.
     *
     * @param classLoader The class loader to search.
     * @return Returns the integrations.
     */
    public static List<ClientIntegration> loadIntegrations(ClassLoader classLoader) {
        List<ClientIntegration> found = new ArrayList<>();
        for (ClientIntegration integration : ServiceLoader.load(ClientIntegration.class, classLoader)) {
            LOGGER.finest(() -> "Found client integration " + integration.name());
            found.add(integration);
        }
        return found;
    }

    @Override
    public void run() {
        if (settings.specDirectories().isEmpty()) {
            throw new CodegenException("No directories of API definitions are configured");
        }
        LOGGER.info("Reading API definitions from " + settings.specDirectories());
        List<ApiDefinition> apis = new RestApiSpecReader(settings.docsBranch(), settings.excludedNamespaces())
                .read(settings.specDirectories());
        GenerationContext context = GenerationContext.builder()
                .settings(settings)
                .fileManifest(fileManifest)
                .apis(apis)
                .integrations(integrations)
                .build();

        List<NamespaceModule> modules = new ArrayList<>(NamespaceModule.group(apis));
        if (modules.stream().noneMatch(module -> module.namespace().equals(ApiDefinition.ROOT_NAMESPACE))) {
            modules.add(0, new NamespaceModule(ApiDefinition.ROOT_NAMESPACE, List.of()));
        }
        List<String> namespaces = modules.stream().map(NamespaceModule::namespace).sorted().toList();

        List<Path> asyncFiles = new ArrayList<>();
        for (NamespaceModule module : modules) {
            Path relative = module.relativePath(settings);
            Path file = fileManifest.getBaseDir().resolve(relative);
            Optional<ExistingSource> existing = ExistingSource.read(file);
            LOGGER.info(String.format("Generating %s with %d APIs", module.className(settings), module.apis().size()));
            fileManifest.writeFile(relative, module.render(context, namespaces, existing));
            asyncFiles.add(file);
        }

        if (settings.generateSync()) {
            LOGGER.info("Deriving the blocking client");
            Unasync unasync = new Unasync(new Unasync.Rule(settings.asyncPackageName(), settings.packageName()));
            Path asyncDir = fileManifest.getBaseDir().resolve(NamespaceModule.packagePath(settings.asyncPackageName()));
            Path syncDir = fileManifest.getBaseDir().resolve(NamespaceModule.packagePath(settings.packageName()));
            for (Path written : unasync.unasyncFiles(asyncFiles, asyncDir, syncDir)) {
                fileManifest.addFile(written);
            }
        }

        new SourceFormatter(context).run();
    }
}
