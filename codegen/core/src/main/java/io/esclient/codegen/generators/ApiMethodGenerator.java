/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.generators;

import static io.esclient.codegen.CodegenUtils.literal;

import io.esclient.codegen.CodegenUtils;
import io.esclient.codegen.RuntimeSymbols;
import io.esclient.codegen.sections.ApiMethodSection;
import io.esclient.codegen.sections.RequestSection;
import io.esclient.codegen.sections.ValidationSection;
import io.esclient.codegen.spec.ApiBody;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.spec.ApiParameter;
import io.esclient.codegen.spec.UrlPath;
import io.esclient.codegen.writer.JavaWriter;
import io.esclient.codegen.writer.JavadocFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Writes the client method of a single API.
 */
@SmithyInternalApi
public final class ApiMethodGenerator implements Runnable {

    static final String BULK_CONTENT_TYPE = "application/x-ndjson";

    private static final int METHOD_INDENT = 4;
    private static final int BODY_INDENT = 8;

    private final JavaWriter writer;
    private final ApiDefinition api;

    public ApiMethodGenerator(JavaWriter writer, ApiDefinition api) {
        this.writer = writer;
        this.api = api;
    }

    @Override
    public void run() {
        writer.pushState(new ApiMethodSection(api));
        writer.write("");
        writeJavadoc();
        if (api.deprecation().isPresent()) {
            writer.write("@Deprecated");
        }
        writeSignature();
        writer.indent();

        writer.pushState(new ValidationSection(api));
        writeRequiredChecks();
        writer.popState();

        writeQuery();
        writeHeaders();

        String path = pathExpression();
        writer.pushState(new RequestSection(api, path));
        writeRequest(path);
        writer.popState();

        writer.dedent();
        writer.write("}");
        writer.popState();
    }

    private void writeJavadoc() {
        writer.writeJavadoc(() -> {
            if (api.description().isEmpty()) {
                writer.write("Calls the {@code $L} API.", api.fullName());
            } else {
                writer.writeDocs(api.description());
            }
            if (!api.docUrl().isEmpty()) {
                writer.write("");
                writer.writeWithNoFormatting("<p>Documentation: <a href=\"" + api.docUrl() + "\">"
                        + api.docUrl() + "</a>");
            }
            if (!api.stability().equals("stable")) {
                writer.write("");
                writer.writeWithNoFormatting("<p>This API is <b>" + api.stability()
                        + "</b> so may include breaking changes or be removed in a future version.");
            }
            writer.write("");
            for (String argument : api.arguments()) {
                writer.writeWithNoFormatting(paramDoc(argument));
            }
            writeQueryParamsDoc();
            if (isHead()) {
                writer.write("@return Returns whether the resource exists.");
            } else {
                writer.write("@return Returns the response.");
            }
            api.deprecation().ifPresent(message -> writer.writeWithNoFormatting("@deprecated "
                    + (message.isBlank() ? "This API is deprecated." : JavadocFormatter.toHtml(message))));
        });
    }

    private String paramDoc(String argument) {
        StringBuilder doc = new StringBuilder("@param ").append(CodegenUtils.argumentName(argument));
        if (argument.equals("body")) {
            ApiBody body = api.body().orElseThrow();
            String description = JavadocFormatter.toHtml(body.description());
            doc.append(' ').append(description.isEmpty() ? "The request body." : description);
            if (body.isBulk()) {
                doc.append(" Sent as newline-delimited JSON.");
            }
            return doc.toString();
        }
        ApiParameter part = api.allParts().get(argument);
        if (api.params().containsKey(argument)) {
            part = api.params().get(argument);
        }
        String description = JavadocFormatter.toHtml(part.description());
        doc.append(' ').append(description.isEmpty() ? "The {@code " + argument + "} URL part." : description);
        appendChoices(doc, part);
        return doc.toString();
    }

    private void writeQueryParamsDoc() {
        List<String> queryParams = api.queryParams();
        if (queryParams.isEmpty()) {
            writer.write("@param params Global and transport query parameters and request options, may be {@code null}.");
            return;
        }
        writer.write("@param params Query parameters and request options, may be {@code null}:");
        writer.write("    <ul>");
        for (String name : queryParams) {
            ApiParameter param = api.params().get(name);
            StringBuilder item = new StringBuilder("    <li>{@code ").append(name).append('}');
            String description = JavadocFormatter.toHtml(param.description());
            if (!description.isEmpty()) {
                item.append(": ").append(description);
            }
            appendChoices(item, param);
            if (param.deprecated()) {
                item.append(" Deprecated.");
            }
            writer.writeWithNoFormatting(item.append("</li>").toString());
        }
        writer.write("    </ul>");
    }

    private static void appendChoices(StringBuilder doc, ApiParameter parameter) {
        if (!parameter.options().isEmpty()) {
            doc.append(" Valid choices: ")
                    .append(JavadocFormatter.escape(String.join(", ", parameter.options())))
                    .append('.');
        }
        parameter.defaultValue().ifPresent(value -> doc.append(" Default: {@code ")
                .append(JavadocFormatter.escape(value.asStringNode()
                        .map(StringNode::getValue)
                        .orElseGet(() -> Node.printJson(value))))
                .append("}."));
    }

    private void writeSignature() {
        String returnType = use(RuntimeSymbols.COMPLETABLE_FUTURE) + "<"
                + (isHead() ? "Boolean" : use(RuntimeSymbols.API_RESPONSE)) + ">";
        List<String> arguments = new ArrayList<>();
        for (String argument : api.arguments()) {
            arguments.add(argumentType(argument) + " " + CodegenUtils.argumentName(argument));
        }
        arguments.add(use(RuntimeSymbols.MAP) + "<String, ?> params");

        String start = "public " + returnType + " " + CodegenUtils.methodName(api) + "(";
        String line = start + String.join(", ", arguments) + ") {";
        if (METHOD_INDENT + line.length() <= CodegenUtils.MAX_PREFERRED_LINE_LENGTH) {
            writer.writeWithNoFormatting(line);
            return;
        }
        writer.writeWithNoFormatting(start);
        writer.indent(2);
        for (int i = 0; i < arguments.size(); i++) {
            writer.writeWithNoFormatting(arguments.get(i) + (i < arguments.size() - 1 ? "," : ""));
        }
        writer.dedent(2);
        writer.write(") {");
    }

    private String argumentType(String argument) {
        if (argument.equals("body")) {
            return "Object";
        }
        ApiParameter part = api.allParts().get(argument);
        return part.type().equals("list") ? "Object" : "String";
    }

    private void writeRequiredChecks() {
        List<String> required = api.requiredArguments().stream().map(CodegenUtils::argumentName).toList();
        if (required.size() == 1) {
            writer.writeWithNoFormatting(use(RuntimeSymbols.API_SUPPORT) + ".requireNonEmpty("
                    + required.get(0) + ", " + literal(required.get(0)) + ");");
        } else if (required.size() > 1) {
            writeCall(use(RuntimeSymbols.API_SUPPORT) + ".requireAllNonEmpty(", required, ");");
        }
    }

    private void writeQuery() {
        List<String> arguments = new ArrayList<>();
        arguments.add("params");
        api.queryParams().forEach(name -> arguments.add(literal(name)));
        writeCall("Map<String, String> query = " + use(RuntimeSymbols.API_SUPPORT) + ".queryParams(",
                arguments, ");");
    }

    private void writeHeaders() {
        String accept = api.accept().isEmpty() ? null : String.join(", ", api.accept());
        writer.writeWithNoFormatting("Map<String, String> headers = " + use(RuntimeSymbols.API_SUPPORT)
                + ".headers(params, " + literal(accept) + ", " + literal(contentType().orElse(null)) + ");");
    }

    private Optional<String> contentType() {
        Optional<ApiBody> body = api.body();
        if (body.isEmpty()) {
            return Optional.empty();
        }
        if (!api.contentType().isEmpty()) {
            return Optional.of(api.contentType().get(0));
        }
        return body.get().isBulk() ? Optional.of(BULK_CONTENT_TYPE) : Optional.empty();
    }

    private String pathExpression() {
        UrlPath path = api.path();
        if (!path.isDynamic()) {
            return literal(path.path());
        }
        List<String> components = path.components().stream()
                .map(component -> component.dynamic()
                        ? CodegenUtils.argumentName(component.value())
                        : literal(component.value()))
                .toList();
        return use(RuntimeSymbols.API_SUPPORT) + ".makePath(" + String.join(", ", components) + ")";
    }

    private void writeRequest(String path) {
        if (isHead()) {
            writer.writeWithNoFormatting("return transport.performHeadRequestAsync(" + path + ", query, headers);");
            return;
        }
        String body = api.body().isPresent() ? "body" : "null";
        writeCall("return transport.performRequestAsync(",
                List.of(literal(api.method()), path, "query", "headers", body), ");");
    }

    // Writes a call on one line, or with one argument per line when it's too long.
    private void writeCall(String start, List<String> arguments, String end) {
        String line = start + String.join(", ", arguments) + end;
        if (BODY_INDENT + line.length() <= CodegenUtils.MAX_PREFERRED_LINE_LENGTH) {
            writer.writeWithNoFormatting(line);
            return;
        }
        writer.writeWithNoFormatting(start);
        writer.indent(2);
        for (int i = 0; i < arguments.size(); i++) {
            writer.writeWithNoFormatting(arguments.get(i) + (i < arguments.size() - 1 ? "," : end));
        }
        writer.dedent(2);
    }

    private boolean isHead() {
        return api.method().equals("HEAD");
    }

    private String use(Symbol symbol) {
        writer.addUseImports(symbol);
        return symbol.getName();
    }
}
