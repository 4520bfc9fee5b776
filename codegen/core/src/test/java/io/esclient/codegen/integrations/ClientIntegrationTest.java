/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.integrations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import io.esclient.codegen.ApiFixtures;
import io.esclient.codegen.GenerationContext;
import io.esclient.codegen.sections.RequestSection;
import io.esclient.codegen.sections.ValidationSection;
import io.esclient.codegen.writer.JavaWriter;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.utils.CodeInterceptor;
import software.amazon.smithy.utils.CodeSection;

public class ClientIntegrationTest {

    @SuppressWarnings("unchecked")
    private static <S extends CodeSection> CodeInterceptor<S, JavaWriter> only(
            List<? extends CodeInterceptor<? extends CodeSection, JavaWriter>> interceptors
    ) {
        assertEquals(1, interceptors.size());
        return (CodeInterceptor<S, JavaWriter>) interceptors.get(0);
    }

    @Test
    public void testPingInterceptsOnlyRootPing() {
        GenerationContext context = mock(GenerationContext.class);
        CodeInterceptor<RequestSection, JavaWriter> interceptor = only(new PingIntegration().interceptors(context));

        assertEquals(RequestSection.class, interceptor.sectionType());
        assertTrue(interceptor.isIntercepted(new RequestSection(ApiFixtures.api("ping"), "\"/\"")));
        assertFalse(interceptor.isIntercepted(new RequestSection(ApiFixtures.api("indices.exists"), "path")));
        assertFalse(interceptor.isIntercepted(new RequestSection(ApiFixtures.api("get"), "path")));
        verifyNoInteractions(context);
    }

    @Test
    public void testPingWritesBooleanFallback() {
        JavaWriter writer = new JavaWriter("org.example");
        CodeInterceptor<RequestSection, JavaWriter> interceptor = only(
                new PingIntegration().interceptors(mock(GenerationContext.class)));

        interceptor.write(writer, "", new RequestSection(ApiFixtures.api("ping"), "\"/\""));

        assertTrue(writer.toString().contains(
                "return falseOnTransportError(() -> transport.performHeadRequestAsync(\"/\", query, headers));"));
    }

    @Test
    public void testScrollInterceptsScrollApis() {
        GenerationContext context = mock(GenerationContext.class);
        List<? extends CodeInterceptor<? extends CodeSection, JavaWriter>> interceptors =
                new ScrollIntegration().interceptors(context);
        assertEquals(2, interceptors.size());

        @SuppressWarnings("unchecked")
        CodeInterceptor<ValidationSection, JavaWriter> validation =
                (CodeInterceptor<ValidationSection, JavaWriter>) interceptors.get(0);
        assertEquals(ValidationSection.class, validation.sectionType());
        assertTrue(validation.isIntercepted(new ValidationSection(ApiFixtures.api("scroll"))));
        assertTrue(validation.isIntercepted(new ValidationSection(ApiFixtures.api("clear_scroll"))));
        assertFalse(validation.isIntercepted(new ValidationSection(ApiFixtures.api("search"))));

        @SuppressWarnings("unchecked")
        CodeInterceptor<RequestSection, JavaWriter> request =
                (CodeInterceptor<RequestSection, JavaWriter>) interceptors.get(1);
        assertEquals(RequestSection.class, request.sectionType());
        assertTrue(request.isIntercepted(new RequestSection(ApiFixtures.api("scroll"), "path")));
        assertFalse(request.isIntercepted(new RequestSection(ApiFixtures.api("search"), "path")));
        verifyNoInteractions(context);
    }

    @Test
    public void testDefaults() {
        assertEquals("io.esclient.codegen.integrations.PingIntegration", new PingIntegration().name());
        assertEquals(0, new ScrollIntegration().priority());
    }
}
