/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.unasync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.codegen.core.CodegenException;

public class JavaTokenizerTest {

    private static List<Token> significant(String source) {
        return JavaTokenizer.tokenize(source).stream()
                .filter(token -> token.kind() != Token.Kind.WHITESPACE)
                .toList();
    }

    @Test
    public void testTokensConcatenateToSource() {
        String source = """
                package com.example;

                /** Docs. */
                class A {
                    String text = \"""
                        a "quoted" block
                        \""";
                    char c = '\\'';
                    Runnable r = () -> System.out.println("x\\"y" + 1_000L); // done
                }
                """;

        String joined = JavaTokenizer.tokenize(source).stream().map(Token::text).collect(Collectors.joining());

        assertEquals(source, joined);
    }

    @Test
    public void testMergesQualifiedNames() {
        assertEquals(List.of(
                new Token(Token.Kind.NAME, "return"),
                new Token(Token.Kind.NAME, "transport.performRequestAsync"),
                new Token(Token.Kind.OTHER, "("),
                new Token(Token.Kind.STRING, "\"GET\""),
                new Token(Token.Kind.OTHER, ")"),
                new Token(Token.Kind.OTHER, ";")), significant("return transport.performRequestAsync(\"GET\");"));
    }

    @Test
    public void testReadsComments() {
        assertEquals(List.of(
                new Token(Token.Kind.COMMENT, "// AsyncTransport"),
                new Token(Token.Kind.COMMENT, "/* a */"),
                new Token(Token.Kind.OTHER, "->")), significant("// AsyncTransport\n/* a */ ->"));
    }

    @Test
    public void testUnterminatedCommentFails() {
        assertThrows(CodegenException.class, () -> JavaTokenizer.tokenize("/* never closed"));
    }

    @Test
    public void testUnterminatedStringFails() {
        assertThrows(CodegenException.class, () -> JavaTokenizer.tokenize("String s = \"open\n;"));
    }
}
