/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.writer;

import java.util.function.BiFunction;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.codegen.core.SymbolReference;
import software.amazon.smithy.codegen.core.SymbolWriter;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Specialized code writer for Java sources.
 *
 * <p>Use the {@code $T} formatter to refer to {@link Symbol}s; the symbol is
 * imported unless it lives in {@code java.lang} or the writer's package.
 */
@SmithyUnstableApi
public final class JavaWriter extends SymbolWriter<JavaWriter, JavaImportDeclarations> {

    private final String packageName;
    private String filePrefix = "";

    /**
     * Constructs a JavaWriter.
     *
     * @param packageName The package of the written file.
     */
    public JavaWriter(String packageName) {
        super(new JavaImportDeclarations(packageName));
        this.packageName = packageName;
        trimBlankLines();
        trimTrailingSpaces();
        putFormatter('T', new JavaSymbolFormatter());
    }

    /**
     * @return Returns the package of the written file.
     */
    public String packageName() {
        return packageName;
    }

    /**
     * Sets the text written before the package declaration, usually a license comment.
     *
     * @param prefix The text, ending with a newline, or an empty string.
     * @return Returns the writer.
     */
    public JavaWriter filePrefix(String prefix) {
        this.filePrefix = prefix;
        return this;
    }

    /**
     * Imports a type by its fully qualified name.
     *
     * @param name The name to import.
     * @return Returns the writer.
     */
    public JavaWriter addImport(String name) {
        getImportContainer().addImport(name);
        return this;
    }

    /**
     * Imports a static member by its fully qualified name.
     *
     * @param name The member to import.
     * @return Returns the writer.
     */
    public JavaWriter addStaticImport(String name) {
        getImportContainer().addStaticImport(name);
        return this;
    }

    /**
     * Writes a Javadoc comment from a runnable.
     *
     * @param runnable A runnable that writes the lines of the comment.
     * @return Returns the writer.
     */
    public JavaWriter writeJavadoc(Runnable runnable) {
        pushState();
        write("/**");
        setNewlinePrefix(" * ");
        runnable.run();
        setNewlinePrefix("");
        write(" */");
        popState();
        return this;
    }

    /**
     * Writes Markdown documentation as the lines of a Javadoc comment.
     *
     * <p>Must be called from inside {@link #writeJavadoc(Runnable)}.
     *
     * @param markdown Documentation to write.
     * @return Returns the writer.
     */
    public JavaWriter writeDocs(String markdown) {
        String html = JavadocFormatter.toHtml(markdown);
        if (!html.isEmpty()) {
            writeWithNoFormatting(html);
        }
        return this;
    }

    /**
     * Writes a single-line comment.
     *
     * @param comment The comment to write.
     * @return Returns the writer.
     */
    public JavaWriter writeComment(String comment) {
        writeWithNoFormatting("// " + comment.replace("\n", " "));
        return this;
    }

    /**
     * Conditionally write text.
     *
     * @param shouldWrite Whether to write the text or not.
     * @param content Content to write.
     * @param args String arguments to use for formatting.
     * @return Returns self.
     */
    public JavaWriter maybeWrite(boolean shouldWrite, Object content, Object... args) {
        if (shouldWrite) {
            write(content, args);
        }
        return this;
    }

    @Override
    public String toString() {
        String packageDeclaration = "package " + packageName + ";\n\n";
        String imports = getImportContainer().toString();
        String mainContent = super.toString();
        return filePrefix + packageDeclaration + imports + mainContent;
    }

    /**
     * Implements Java symbol formatting for the {@code $T} formatter.
     */
    private final class JavaSymbolFormatter implements BiFunction<Object, String, String> {
        @Override
        public String apply(Object type, String indent) {
            if (type instanceof Symbol typeSymbol) {
                addUseImports(typeSymbol);
                return typeSymbol.getName();
            } else if (type instanceof SymbolReference typeSymbol) {
                addImport(typeSymbol.getSymbol(), typeSymbol.getAlias(), SymbolReference.ContextOption.USE);
                return typeSymbol.getAlias();
            } else {
                throw new CodegenException(
                        "Invalid type provided to $T. Expected a Symbol, but found `" + type + "`");
            }
        }
    }
}
