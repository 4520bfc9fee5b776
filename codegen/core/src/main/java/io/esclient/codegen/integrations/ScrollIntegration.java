/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.integrations;

import io.esclient.codegen.CodegenUtils;
import io.esclient.codegen.GenerationContext;
import io.esclient.codegen.RuntimeSymbols;
import io.esclient.codegen.sections.RequestSection;
import io.esclient.codegen.sections.ValidationSection;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.writer.JavaWriter;
import java.util.List;
import java.util.Set;
import software.amazon.smithy.utils.CodeInterceptor;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Lets {@code scroll} and {@code clear_scroll} take the scroll id either as an
 * argument or in the body.
 *
 * <p>The request always goes to {@code /_search/scroll}, never to the
 * deprecated path holding the id. A scroll id given without a body is sent in
 * the body, a list of ids for {@code clear_scroll}. A scroll id given along
 * with a body is sent as the {@code scroll_id} query parameter.
 */
@SmithyInternalApi
public final class ScrollIntegration implements ClientIntegration {

    private static final Set<String> SCROLL_APIS = Set.of("scroll", "clear_scroll");
    private static final String SCROLL_ID = "scroll_id";
    private static final String SCROLL_PATH = "/_search/scroll";

    @Override
    public List<? extends CodeInterceptor<? extends CodeSection, JavaWriter>> interceptors(
            GenerationContext context
    ) {
        return List.of(new ScrollValidationInterceptor(), new ScrollRequestInterceptor());
    }

    private static boolean isScrollApi(ApiDefinition api) {
        return api.namespace().equals(ApiDefinition.ROOT_NAMESPACE)
                && SCROLL_APIS.contains(api.name())
                && api.allParts().containsKey(SCROLL_ID)
                && api.body().isPresent();
    }

    private static final class ScrollValidationInterceptor implements CodeInterceptor<ValidationSection, JavaWriter> {
        @Override
        public Class<ValidationSection> sectionType() {
            return ValidationSection.class;
        }

        @Override
        public boolean isIntercepted(ValidationSection section) {
            return isScrollApi(section.api());
        }

        @Override
        public void write(JavaWriter writer, String previousText, ValidationSection section) {
            String scrollId = CodegenUtils.argumentName(SCROLL_ID);
            writer.openBlock("if ($1T.isEmpty($2L) && $1T.isEmpty(body)) {", "}",
                    RuntimeSymbols.API_SUPPORT, scrollId, () -> {
                        writer.write("throw new IllegalArgumentException(\"You need to supply $L or body.\");",
                                scrollId);
                    });
            writer.openBlock("if (!$1T.isEmpty($2L) && $1T.isEmpty(body)) {", "}",
                    RuntimeSymbols.API_SUPPORT, scrollId, () -> {
                        if (section.api().name().equals("clear_scroll")) {
                            writer.write("body = $T.of($S, $T.toList($L));",
                                    RuntimeSymbols.MAP, SCROLL_ID, RuntimeSymbols.API_SUPPORT, scrollId);
                        } else {
                            writer.write("body = $T.of($S, $L);", RuntimeSymbols.MAP, SCROLL_ID, scrollId);
                        }
                        writer.write("$L = null;", scrollId);
                    });
        }
    }

    private static final class ScrollRequestInterceptor implements CodeInterceptor<RequestSection, JavaWriter> {
        @Override
        public Class<RequestSection> sectionType() {
            return RequestSection.class;
        }

        @Override
        public boolean isIntercepted(RequestSection section) {
            return isScrollApi(section.api());
        }

        @Override
        public void write(JavaWriter writer, String previousText, RequestSection section) {
            String scrollId = CodegenUtils.argumentName(SCROLL_ID);
            writer.openBlock("if (!$T.isEmpty($L)) {", "}", RuntimeSymbols.API_SUPPORT, scrollId, () -> {
                writer.write("query.put($S, $T.escape($L));", SCROLL_ID, RuntimeSymbols.API_SUPPORT, scrollId);
            });
            writer.write("return transport.performRequestAsync($S, $S, query, headers, body);",
                    section.api().method(), SCROLL_PATH);
        }
    }
}
