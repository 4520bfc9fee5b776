/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.writer;

import java.util.Set;
import java.util.TreeSet;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.codegen.core.ImportContainer;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Internal class used for aggregating imports of a file.
 */
@SmithyInternalApi
public final class JavaImportDeclarations implements ImportContainer {
    private static final String IMPORT_TEMPLATE = "import %s;\n";
    private static final String STATIC_IMPORT_TEMPLATE = "import static %s;\n";

    private final Set<String> imports = new TreeSet<>();
    private final Set<String> staticImports = new TreeSet<>();
    private final String localPackage;

    JavaImportDeclarations(String localPackage) {
        this.localPackage = localPackage;
    }

    @Override
    public void importSymbol(Symbol symbol, String alias) {
        if (!alias.equals(symbol.getName())) {
            throw new CodegenException("Java imports can't be aliased: " + symbol.getFullName() + " as " + alias);
        }
        String namespace = symbol.getNamespace();
        if (namespace.isEmpty() || namespace.equals("java.lang") || namespace.equals(localPackage)) {
            return;
        }
        addImport(namespace + "." + symbol.getName());
    }

    /**
     * Imports a type by its fully qualified name.
     *
     * @param name The name to import, such as {@code java.util.Map}.
     * @return Returns the declarations.
     */
    public JavaImportDeclarations addImport(String name) {
        if (name.endsWith("*")) {
            throw new CodegenException("Wildcard imports are forbidden.");
        }
        imports.add(name);
        return this;
    }

    /**
     * Imports a static member by its fully qualified name.
     *
     * @param name The member to import, such as {@code java.util.Objects.requireNonNull}.
     * @return Returns the declarations.
     */
    public JavaImportDeclarations addStaticImport(String name) {
        if (name.endsWith("*")) {
            throw new CodegenException("Wildcard imports are forbidden.");
        }
        staticImports.add(name);
        return this;
    }

    /**
     * Adds an import statement as written in a source file.
     *
     * @param statement The statement, such as {@code import java.util.Map;}.
     * @return Returns the declarations.
     */
    public JavaImportDeclarations addStatement(String statement) {
        String body = statement.strip();
        if (!body.startsWith("import ") || !body.endsWith(";")) {
            throw new CodegenException("Not an import statement: " + statement);
        }
        body = body.substring("import ".length(), body.length() - 1).strip();
        if (body.startsWith("static ")) {
            return addStaticImport(body.substring("static ".length()).strip());
        }
        return addImport(body);
    }

    @Override
    public String toString() {
        if (imports.isEmpty() && staticImports.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (String name : staticImports) {
            builder.append(String.format(STATIC_IMPORT_TEMPLATE, name));
        }
        if (!staticImports.isEmpty() && !imports.isEmpty()) {
            builder.append("\n");
        }
        for (String name : imports) {
            builder.append(String.format(IMPORT_TEMPLATE, name));
        }
        builder.append("\n");
        return builder.toString();
    }
}
