/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.sections;

import io.esclient.codegen.spec.ApiDefinition;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * A section that controls writing the statement sending the request of an API method.
 *
 * <p>The {@code query} and {@code headers} locals are in scope.
 *
 * @param api The API being written.
 * @param path The Java expression of the request path.
 */
@SmithyInternalApi
public record RequestSection(ApiDefinition api, String path) implements CodeSection {}
