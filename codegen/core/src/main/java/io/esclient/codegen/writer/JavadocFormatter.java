/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen.writer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import software.amazon.smithy.utils.SetUtils;
import software.amazon.smithy.utils.SmithyInternalApi;

/**
 * Converts CommonMark documentation to HTML that is safe inside a Javadoc comment.
 */
@SmithyInternalApi
public final class JavadocFormatter {
    private static final Parser MARKDOWN_PARSER = Parser.builder()
            .enabledBlockTypes(SetUtils.of(
                    Heading.class,
                    HtmlBlock.class,
                    ThematicBreak.class,
                    FencedCodeBlock.class,
                    BlockQuote.class,
                    ListBlock.class))
            .build();
    private static final HtmlRenderer HTML_RENDERER = HtmlRenderer.builder().escapeHtml(false).build();
    private static final Pattern SINGLE_PARAGRAPH = Pattern.compile("^<p>((?:(?!<p>).)*)</p>$", Pattern.DOTALL);

    private JavadocFormatter() {}

    /**
     * Renders Markdown to HTML for a Javadoc comment.
     *
     * <p>Raw HTML in the input is balanced, a single paragraph is unwrapped,
     * and sequences that would end the comment or start a block tag are escaped.
     *
     * @param markdown The documentation, possibly empty.
     * @return Returns the HTML, without trailing whitespace.
     */
    public static String toHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        String html = HTML_RENDERER.render(MARKDOWN_PARSER.parse(markdown.strip()));
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings()
                .prettyPrint(false)
                .escapeMode(Entities.EscapeMode.xhtml);
        html = document.body().html().strip();
        Matcher matcher = SINGLE_PARAGRAPH.matcher(html);
        if (matcher.matches()) {
            html = matcher.group(1).strip();
        }
        return escapeComment(html)
                .lines()
                .map(String::stripTrailing)
                .reduce((left, right) -> left + "\n" + right)
                .orElse("");
    }

    /**
     * Escapes plain text, such as a default value, for a Javadoc comment.
     *
     * @param text The text to escape.
     * @return Returns the escaped text.
     */
    public static String escape(String text) {
        return escapeComment(text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("{", "&#123;")
                .replace("}", "&#125;"));
    }

    private static String escapeComment(String text) {
        return text.replace("*/", "*&#47;").replace("@", "&#64;");
    }
}
