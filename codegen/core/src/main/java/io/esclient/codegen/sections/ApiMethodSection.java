/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.sections;

import io.esclient.codegen.spec.ApiDefinition;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * A section that controls writing the whole method of an API, Javadoc included.
 */
@SmithyInternalApi
public record ApiMethodSection(ApiDefinition api) implements CodeSection {}
