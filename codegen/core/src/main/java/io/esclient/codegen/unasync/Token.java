/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.unasync;

import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * A lexical token of Java source.
 *
 * @param kind The kind of token.
 * @param text The exact source text of the token.
 */
@SmithyInternalApi
public record Token(Kind kind, String text) {

    public enum Kind {
        WHITESPACE,
        COMMENT,
        /** String, character and text block literals. */
        STRING,
        /** An identifier, or a qualified name such as {@code java.util.Map}. */
        NAME,
        OTHER
    }

    public boolean is(Kind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }
}
