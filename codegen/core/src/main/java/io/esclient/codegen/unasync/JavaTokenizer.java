/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.unasync;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Splits Java source into tokens whose texts concatenate back to the source.
 *
 * <p>Only the distinctions needed to rewrite names are made: numbers and
 * operators are returned as {@link Token.Kind#OTHER} tokens, mostly one
 * character long.
 */
@SmithyInternalApi
public final class JavaTokenizer {

    private final String source;
    private int position;

    private JavaTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes source text.
     *
     * @param source The source to tokenize.
     * @return Returns the tokens.
     * @throws CodegenException if a comment or literal isn't terminated.
     */
    public static List<Token> tokenize(String source) {
        return new JavaTokenizer(source).tokens();
    }

    private List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        while (position < source.length()) {
            int start = position;
            Token.Kind kind = next();
            tokens.add(new Token(kind, source.substring(start, position)));
        }
        return tokens;
    }

    private Token.Kind next() {
        char c = source.charAt(position);
        if (Character.isWhitespace(c)) {
            while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
                position++;
            }
            return Token.Kind.WHITESPACE;
        } else if (source.startsWith("//", position)) {
            int end = source.indexOf('\n', position);
            position = end < 0 ? source.length() : end;
            return Token.Kind.COMMENT;
        } else if (source.startsWith("/*", position)) {
            position = expectEnd("*/", position + 2);
            return Token.Kind.COMMENT;
        } else if (source.startsWith("\"\"\"", position)) {
            position = literalEnd("\"\"\"", position + 3);
            return Token.Kind.STRING;
        } else if (c == '"' || c == '\'') {
            position = literalEnd(String.valueOf(c), position + 1);
            return Token.Kind.STRING;
        } else if (Character.isJavaIdentifierStart(c)) {
            readIdentifier();
            while (position + 1 < source.length()
                    && source.charAt(position) == '.'
                    && Character.isJavaIdentifierStart(source.charAt(position + 1))) {
                position++;
                readIdentifier();
            }
            return Token.Kind.NAME;
        } else if (Character.isDigit(c)) {
            while (position < source.length()
                    && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
                position++;
            }
            return Token.Kind.OTHER;
        } else if (source.startsWith("->", position)) {
            position += 2;
            return Token.Kind.OTHER;
        }
        position++;
        return Token.Kind.OTHER;
    }

    private void readIdentifier() {
        position++;
        while (position < source.length() && Character.isJavaIdentifierPart(source.charAt(position))) {
            position++;
        }
    }

    private int expectEnd(String terminator, int from) {
        int end = source.indexOf(terminator, from);
        if (end < 0) {
            throw new CodegenException("Unterminated comment at offset " + (from - 2));
        }
        return end + terminator.length();
    }

    private int literalEnd(String quote, int from) {
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (source.startsWith(quote, i)) {
                return i + quote.length();
            } else if (c == '\n' && quote.length() == 1) {
                break;
            } else {
                i++;
            }
        }
        throw new CodegenException("Unterminated literal at offset " + (from - quote.length()));
    }
}
