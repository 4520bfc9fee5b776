/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.unasync;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import software.amazon.smithy.codegen.core.CodegenException;
import software.amazon.smithy.utils.SmithyUnstableApi;

/**
 * Derives blocking sources from asynchronous ones by rewriting names.
 *
 * <p>Names are rewritten as follows, comments and literals are left alone:
 * <ul>
 *     <li>{@code CompletableFuture<T>} becomes {@code T}, and its import is removed.</li>
 *     <li>{@code CompletableFuture.completedFuture} is removed, leaving its argument.</li>
 *     <li>An {@code Async} prefix is stripped from type names once, so
 *     {@code AsyncAsyncSearchClient} becomes {@code AsyncSearchClient}.</li>
 *     <li>Names in the asynchronous package move to the blocking package.</li>
 * </ul>
 *
 * <p>Additional replacements of whole names or name segments take precedence.
 * Method names are only renamed through them, so API methods such as
 * {@code getAsync} keep their names. By default the asynchronous transport
 * calls are mapped to their blocking counterparts.
 */
@SmithyUnstableApi
public final class Unasync {

    private static final Logger LOGGER = Logger.getLogger(Unasync.class.getName());

    private static final String ASYNC = "Async";
    private static final String FUTURE = "CompletableFuture";
    private static final String FUTURE_IMPORT = "java.util.concurrent.CompletableFuture";

    /**
     * Renames the calls of the asynchronous transport.
     */
    public static final Map<String, String> TRANSPORT_REPLACEMENTS = Map.of(
            "performRequestAsync", "performRequest",
            "performHeadRequestAsync", "performHeadRequest");

    private final Rule rule;

    public Unasync(Rule rule) {
        this.rule = Objects.requireNonNull(rule);
    }

    /**
     * How to rewrite a source tree.
     *
     * @param fromPackage The asynchronous package.
     * @param toPackage The blocking package.
     * @param additionalReplacements Replacements of names or name segments.
     */
    public record Rule(String fromPackage, String toPackage, Map<String, String> additionalReplacements) {
        public Rule {
            Objects.requireNonNull(fromPackage);
            Objects.requireNonNull(toPackage);
            additionalReplacements = Map.copyOf(additionalReplacements);
        }

        public Rule(String fromPackage, String toPackage) {
            this(fromPackage, toPackage, TRANSPORT_REPLACEMENTS);
        }
    }

    /**
     * Rewrites source files into another directory.
     *
     * @param files The files to rewrite.
     * @param fromDir The directory of the asynchronous package.
     * @param toDir The directory of the blocking package.
     * @return Returns the written files.
     */
    public List<Path> unasyncFiles(List<Path> files, Path fromDir, Path toDir) {
        List<Path> written = new ArrayList<>();
        for (Path file : files) {
            Path relative = fromDir.relativize(file);
            Path target = toDir.resolve(relative).resolveSibling(fileName(file.getFileName().toString()));
            LOGGER.fine(() -> "Unasyncing " + file + " into " + target);
            try {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                Files.createDirectories(target.getParent());
                Files.writeString(target, unasync(source), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new CodegenException("Unable to unasync " + file, e);
            }
            written.add(target);
        }
        return written;
    }

    /**
     * Maps the name of an asynchronous source file to its blocking counterpart.
     *
     * @param fileName The file name, such as {@code AsyncCatClient.java}.
     * @return Returns the new name, such as {@code CatClient.java}.
     */
    public String fileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return segment(fileName);
        }
        return segment(fileName.substring(0, dot)) + fileName.substring(dot);
    }

    /**
     * Rewrites source text.
     *
     * @param source The asynchronous source.
     * @return Returns the blocking source.
     */
    public String unasync(String source) {
        List<Token> tokens = JavaTokenizer.tokenize(source);
        StringBuilder result = new StringBuilder(source.length());
        // Angle bracket depths at which a dropped CompletableFuture< is closed.
        Deque<Integer> pendingCloses = new ArrayDeque<>();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(Token.Kind.NAME, "import") && isFutureImport(tokens, i)) {
                i = skipImport(tokens, i);
                continue;
            }
            if (token.kind() == Token.Kind.NAME && isFuture(token.text())) {
                int next = nextSignificant(tokens, i + 1);
                if (next < tokens.size() && tokens.get(next).is(Token.Kind.OTHER, "<")) {
                    depth++;
                    pendingCloses.push(depth);
                    i = next;
                    continue;
                }
            }
            if (!pendingCloses.isEmpty() && token.kind() == Token.Kind.OTHER) {
                if (token.text().equals("<")) {
                    depth++;
                } else if (token.text().equals(">")) {
                    boolean dropped = pendingCloses.peek() == depth;
                    depth--;
                    if (dropped) {
                        pendingCloses.pop();
                        continue;
                    }
                }
            }
            result.append(token.kind() == Token.Kind.NAME ? name(token.text()) : token.text());
        }
        return result.toString();
    }

    private static boolean isFuture(String name) {
        return name.equals(FUTURE) || name.equals(FUTURE_IMPORT);
    }

    private static boolean isFutureImport(List<Token> tokens, int importIndex) {
        int next = nextSignificant(tokens, importIndex + 1);
        return next < tokens.size() && tokens.get(next).is(Token.Kind.NAME, FUTURE_IMPORT);
    }

    // Returns the index of the last token of the import, including the newline after it.
    private static int skipImport(List<Token> tokens, int importIndex) {
        int i = importIndex;
        while (i < tokens.size() && !tokens.get(i).is(Token.Kind.OTHER, ";")) {
            i++;
        }
        if (i + 1 < tokens.size() && tokens.get(i + 1).kind() == Token.Kind.WHITESPACE) {
            String whitespace = tokens.get(i + 1).text();
            int newline = whitespace.indexOf('\n');
            if (newline >= 0) {
                tokens.set(i + 1, new Token(Token.Kind.WHITESPACE, whitespace.substring(newline + 1)));
            }
        }
        return i;
    }

    private static int nextSignificant(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size()
                && (tokens.get(i).kind() == Token.Kind.WHITESPACE || tokens.get(i).kind() == Token.Kind.COMMENT)) {
            i++;
        }
        return i;
    }

    private String name(String name) {
        String replacement = rule.additionalReplacements().get(name);
        if (replacement != null) {
            return replacement;
        }
        if (name.equals(FUTURE + ".completedFuture") || name.equals(FUTURE_IMPORT + ".completedFuture")) {
            return "";
        }
        String prefix = "";
        String rest = name;
        if (name.equals(rule.fromPackage())) {
            return rule.toPackage();
        } else if (name.startsWith(rule.fromPackage() + ".")) {
            prefix = rule.toPackage() + ".";
            rest = name.substring(rule.fromPackage().length() + 1);
        }
        String[] segments = rest.split("\\.");
        for (int i = 0; i < segments.length; i++) {
            segments[i] = segment(segments[i]);
        }
        return prefix + String.join(".", segments);
    }

    private String segment(String segment) {
        String replacement = rule.additionalReplacements().get(segment);
        if (replacement != null) {
            return replacement;
        }
        if (segment.length() > ASYNC.length()
                && segment.startsWith(ASYNC)
                && Character.isUpperCase(segment.charAt(ASYNC.length()))) {
            return segment.substring(ASYNC.length());
        }
        return segment;
    }
}
