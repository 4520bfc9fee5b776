/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.generators;

import io.esclient.codegen.CodegenUtils;
import io.esclient.codegen.RuntimeSymbols;
import io.esclient.codegen.sections.ClientHeaderSection;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.writer.ExistingSource;
import io.esclient.codegen.writer.JavaWriter;
import java.util.List;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Writes the header of a new client class: its declaration, fields and
 * constructor, ending with the {@link ExistingSource#SEPARATOR} line.
 *
 * <p>The root class gets a field and an accessor per namespace and closes its
 * transport on {@code close()}.
 */
@SmithyInternalApi
public final class ClientHeaderGenerator implements Runnable {

    private final JavaWriter writer;
    private final String clientName;
    private final String namespace;
    private final List<String> namespaces;

    /**
     * @param writer The writer to write to.
     * @param clientName The name of the root client.
     * @param namespace The namespace of the class.
     * @param namespaces Every namespace of the client, in the order of their fields.
     */
    public ClientHeaderGenerator(JavaWriter writer, String clientName, String namespace, List<String> namespaces) {
        this.writer = writer;
        this.clientName = clientName;
        this.namespace = namespace;
        this.namespaces = List.copyOf(namespaces);
    }

    @Override
    public void run() {
        boolean root = namespace.equals(ApiDefinition.ROOT_NAMESPACE);
        String className = CodegenUtils.className(namespace, clientName);
        writer.pushState(new ClientHeaderSection(namespace, className, root ? namespaces : List.of()));
        writer.putContext("namespace", namespace);
        writer.putContext("className", className);
        writer.putContext("base", RuntimeSymbols.ASYNC_NAMESPACED_CLIENT);
        writer.putContext("transport", RuntimeSymbols.ASYNC_TRANSPORT);
        if (root) {
            writeRoot();
        } else {
            writer.write("""
                    /**
                     * Client for the {@code ${namespace:L}} APIs.
                     */
                    public class ${className:L} extends ${base:T} {

                        public ${className:L}(${transport:T} transport) {
                            super(transport);
                        }
                    """);
        }
        writer.writeWithNoFormatting("");
        writer.writeWithNoFormatting(ExistingSource.SEPARATOR);
        writer.popState();
    }

    private void writeRoot() {
        writer.write("""
                /**
                 * Client for the Elasticsearch REST APIs.
                 *
                 * <p>APIs outside the root namespace are reached through accessors,
                 * such as {@code indices()}.
                 */
                public class ${className:L} extends ${base:T} implements AutoCloseable {""");
        writer.indent();
        for (String child : children()) {
            writer.write("private final $L $L;", CodegenUtils.className(child, clientName),
                    CodegenUtils.accessorName(child));
        }
        writer.write("");
        writer.openBlock("public ${className:L}(${transport:T} transport) {", "}", () -> {
            writer.write("super(transport);");
            for (String child : children()) {
                writer.write("this.$L = new $L(transport);", CodegenUtils.accessorName(child),
                        CodegenUtils.className(child, clientName));
            }
        });
        for (String child : children()) {
            writer.write("");
            writer.openBlock("public $L $L() {", "}",
                    CodegenUtils.className(child, clientName), CodegenUtils.accessorName(child), () -> {
                        writer.write("return $L;", CodegenUtils.accessorName(child));
                    });
        }
        writer.write("");
        writer.write("@Override");
        writer.openBlock("public void close() {", "}", () -> writer.write("transport.close();"));
        writer.dedent();
    }

    private List<String> children() {
        return namespaces.stream()
                .filter(child -> !child.equals(ApiDefinition.ROOT_NAMESPACE))
                .toList();
    }
}
