/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.sections;

import java.util.List;
import software.amazon.smithy.utils.CodeSection;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * A section that controls writing the header of a new client class, up to the
 * line separating it from the generated methods.
 *
 * @param namespace The namespace of the class.
 * @param className The name of the class.
 * @param namespaces The namespaces of the client, for the root class, or an empty list.
 */
@SmithyInternalApi
public record ClientHeaderSection(String namespace, String className, List<String> namespaces)
        implements CodeSection {}
