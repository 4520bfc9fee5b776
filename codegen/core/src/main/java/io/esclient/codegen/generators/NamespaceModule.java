/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.generators;

import io.esclient.codegen.CodegenSettings;
import io.esclient.codegen.CodegenUtils;
import io.esclient.codegen.GenerationContext;
import io.esclient.codegen.integrations.ClientIntegration;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.writer.ExistingSource;
import io.esclient.codegen.writer.JavaWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import software.amazon.smithy.utils.CodeInterceptor;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * The generated asynchronous client class of one namespace.
 *
 * <p>When the class already exists, its license prefix, imports and header
 * are kept and the methods are written in their previous order. APIs new to
 * the class follow, in reading order.
 */
@SmithyInternalApi
public final class NamespaceModule {

    private static final Logger LOGGER = Logger.getLogger(NamespaceModule.class.getName());

    private final String namespace;
    private final List<ApiDefinition> apis;

    public NamespaceModule(String namespace, List<ApiDefinition> apis) {
        this.namespace = namespace;
        this.apis = List.copyOf(apis);
    }

    /**
     * Groups APIs by namespace.
     *
     * @param apis The APIs, in reading order.
     * @return Returns the modules in order of their first API.
     */
    public static List<NamespaceModule> group(List<ApiDefinition> apis) {
        Map<String, List<ApiDefinition>> grouped = new LinkedHashMap<>();
        for (ApiDefinition api : apis) {
            grouped.computeIfAbsent(api.namespace(), ns -> new ArrayList<>()).add(api);
        }
        List<NamespaceModule> modules = new ArrayList<>();
        grouped.forEach((ns, members) -> modules.add(new NamespaceModule(ns, members)));
        return modules;
    }

    public String namespace() {
        return namespace;
    }

    public List<ApiDefinition> apis() {
        return apis;
    }

    /**
     * @param settings The codegen settings.
     * @return Returns the name of the generated class.
     */
    public String className(CodegenSettings settings) {
        return CodegenUtils.className(namespace, settings.clientName());
    }

    /**
     * @param settings The codegen settings.
     * @return Returns the path of the generated file, relative to the source root.
     */
    public Path relativePath(CodegenSettings settings) {
        return packagePath(settings.asyncPackageName()).resolve(className(settings) + ".java");
    }

    /**
     * Gets the directory of a package relative to a source root.
     *
     * @param packageName The package name.
     * @return Returns the relative directory.
     */
    public static Path packagePath(String packageName) {
        String[] segments = packageName.split("\\.");
        return Path.of(segments[0], Arrays.copyOfRange(segments, 1, segments.length));
    }

    /**
     * Renders the class.
     *
     * @param context The generation context.
     * @param namespaces Every namespace of the client, used for the root header.
     * @param existing The previously generated class, if any.
     * @return Returns the source of the class.
     */
    public String render(GenerationContext context, List<String> namespaces, Optional<ExistingSource> existing) {
        CodegenSettings settings = context.settings();
        JavaWriter writer = new JavaWriter(settings.asyncPackageName());
        for (ClientIntegration integration : context.integrations()) {
            for (CodeInterceptor<? extends CodeSection, JavaWriter> interceptor : integration.interceptors(context)) {
                writer.onSection(interceptor);
            }
        }

        if (existing.isPresent()) {
            ExistingSource source = existing.get();
            writer.filePrefix(source.prefix());
            source.imports().forEach(writer.getImportContainer()::addStatement);
            writer.writeWithNoFormatting(source.header());
            if (namespace.equals(ApiDefinition.ROOT_NAMESPACE)) {
                warnOnMissingAccessors(settings, source, namespaces);
            }
        } else {
            writer.filePrefix(settings.licenseComment());
            new ClientHeaderGenerator(writer, settings.clientName(), namespace, namespaces).run();
        }

        List<ApiDefinition> ordered = new ArrayList<>(apis);
        existing.ifPresent(source -> ordered.sort(
                Comparator.comparingInt(api -> source.position(CodegenUtils.methodName(api)))));

        writer.indent();
        for (ApiDefinition api : ordered) {
            new ApiMethodGenerator(writer, api).run();
        }
        writer.dedent();
        writer.write("}");
        return writer.toString();
    }

    private void warnOnMissingAccessors(CodegenSettings settings, ExistingSource source, List<String> namespaces) {
        for (String child : namespaces) {
            if (child.equals(ApiDefinition.ROOT_NAMESPACE)) {
                continue;
            }
            String childClass = CodegenUtils.className(child, settings.clientName());
            if (!source.header().contains(childClass + "(")) {
                LOGGER.warning(String.format("The header of %s doesn't create %s. Add its field and accessor "
                        + "by hand, or delete the file to regenerate the header.", className(settings), childClass));
            }
        }
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? "<root>" : namespace;
    }
}
