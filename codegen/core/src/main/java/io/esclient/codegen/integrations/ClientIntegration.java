/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.integrations;

import io.esclient.codegen.GenerationContext;
import io.esclient.codegen.writer.JavaWriter;
import java.util.Collections;
import java.util.List;
import software.amazon.smithy.utils.CodeInterceptor;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Java SPI for customizing client generation, such as overriding how a
 * specific API is written.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}.
 */
@SmithyUnstableApi
public interface ClientIntegration {

    /**
     * Gets the name of the integration, used in logs.
     *
     * @return Returns the name.
     */
    default String name() {
        return getClass().getCanonicalName();
    }

    /**
     * Gets the priority of the integration.
     *
     * <p>Interceptors of integrations with a higher priority are registered first.
     *
     * @return Returns the priority.
     */
    default byte priority() {
        return 0;
    }

    /**
     * Gets the interceptors registered on every client writer.
     *
     * @param context The generation context.
     * @return Returns the interceptors.
     */
    default List<? extends CodeInterceptor<? extends CodeSection, JavaWriter>> interceptors(
            GenerationContext context
    ) {
        return Collections.emptyList();
    }
}
