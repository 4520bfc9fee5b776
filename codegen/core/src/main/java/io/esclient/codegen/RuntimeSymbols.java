/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import software.amazon.smithy.codegen.core.Symbol;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Types referenced by generated clients.
 */
@SmithyInternalApi
public final class RuntimeSymbols {

    private static final String RUNTIME_PACKAGE = "io.esclient.runtime";

    public static final Symbol API_SUPPORT = runtime("client", "ApiSupport");
    public static final Symbol ASYNC_NAMESPACED_CLIENT = runtime("client", "AsyncNamespacedClient");
    public static final Symbol API_RESPONSE = runtime("transport", "ApiResponse");
    public static final Symbol ASYNC_TRANSPORT = runtime("transport", "AsyncTransport");

    public static final Symbol MAP = jdk("java.util", "Map");
    public static final Symbol COMPLETABLE_FUTURE = jdk("java.util.concurrent", "CompletableFuture");

    private RuntimeSymbols() {}

    private static Symbol runtime(String subPackage, String name) {
        return Symbol.builder()
                .name(name)
                .namespace(RUNTIME_PACKAGE + "." + subPackage, ".")
                .build();
    }

    private static Symbol jdk(String namespace, String name) {
        return Symbol.builder()
                .name(name)
                .namespace(namespace, ".")
                .build();
    }
}
