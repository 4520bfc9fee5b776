/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.integrations;

import io.esclient.codegen.GenerationContext;
import io.esclient.codegen.sections.RequestSection;
import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.writer.JavaWriter;
import java.util.List;
import software.amazon.smithy.utils.CodeInterceptor;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Makes {@code ping} return false instead of failing when the transport fails.
 */
@SmithyInternalApi
public final class PingIntegration implements ClientIntegration {

    @Override
    public List<? extends CodeInterceptor<? extends CodeSection, JavaWriter>> interceptors(
            GenerationContext context
    ) {
        return List.of(new PingRequestInterceptor());
    }

    private static final class PingRequestInterceptor implements CodeInterceptor<RequestSection, JavaWriter> {
        @Override
        public Class<RequestSection> sectionType() {
            return RequestSection.class;
        }

        @Override
        public boolean isIntercepted(RequestSection section) {
            ApiDefinition api = section.api();
            return api.namespace().equals(ApiDefinition.ROOT_NAMESPACE)
                    && api.name().equals("ping")
                    && api.method().equals("HEAD");
        }

        @Override
        public void write(JavaWriter writer, String previousText, RequestSection section) {
            writer.write("return falseOnTransportError(() -> transport.performHeadRequestAsync($L, query, headers));",
                    section.path());
        }
    }
}
