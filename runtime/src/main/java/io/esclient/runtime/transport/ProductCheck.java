/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import io.esclient.runtime.errors.UnsupportedProductException;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * Verifies that the server answering {@code GET /} is Elasticsearch.
 */
public final class ProductCheck {

    static final String TAGLINE = "You Know, for Search";
    static final String PRODUCT_HEADER = "x-elastic-product";
    static final String PRODUCT = "Elasticsearch";

    private static final Pattern VERSION = Pattern.compile("^([0-9]+)\\.([0-9]+)(?:\\.([0-9]+))?");

    /**
     * Outcome of a product check.
     */
    public enum State {
        SUCCESS,
        UNSUPPORTED_PRODUCT,
        UNSUPPORTED_DISTRIBUTION
    }

    private ProductCheck() {}

    /**
     * Checks the headers and body of an info response.
     *
     * <ul>
     *     <li>7.0 to 7.13 requires the tagline and the {@code default} build flavor.</li>
     *     <li>6.x requires the tagline.</li>
     *     <li>7.14 and later require the {@code X-Elastic-Product: Elasticsearch} header.</li>
     *     <li>Anything without a version or older than 6.0 is unsupported.</li>
     * </ul>
     *
     * @param headers Response headers, with lower-cased names.
     * @param body Deserialized response body.
     * @return Returns the check outcome.
     */
    public static State check(Map<String, String> headers, Object body) {
        Optional<ObjectNode> info = body instanceof Node node ? node.asObjectNode() : Optional.empty();
        Optional<ObjectNode> version = info.flatMap(i -> i.getObjectMember("version"));
        int[] number = version.flatMap(v -> v.getStringMember("number"))
                .map(StringNode::getValue)
                .map(ProductCheck::parseVersion)
                .orElse(new int[] {0, 0, 0});

        boolean badTagline = !info.flatMap(i -> i.getStringMember("tagline"))
                .map(StringNode::getValue)
                .filter(TAGLINE::equals)
                .isPresent();
        boolean badBuildFlavor = !version.flatMap(v -> v.getStringMember("build_flavor"))
                .map(StringNode::getValue)
                .filter("default"::equals)
                .isPresent();
        boolean badProductHeader = !PRODUCT.equals(headers.get(PRODUCT_HEADER));

        if (compare(number, 7, 0, 0) >= 0 && compare(number, 7, 14, 0) < 0) {
            if (badTagline) {
                return State.UNSUPPORTED_PRODUCT;
            } else if (badBuildFlavor) {
                return State.UNSUPPORTED_DISTRIBUTION;
            }
        } else if (compare(number, 6, 0, 0) < 0
                || (compare(number, 7, 0, 0) < 0 && badTagline)
                || (compare(number, 7, 14, 0) >= 0 && badProductHeader)) {
            return State.UNSUPPORTED_PRODUCT;
        }
        return State.SUCCESS;
    }

    /**
     * Throws when a check failed.
     *
     * @param state State to verify.
     * @throws UnsupportedProductException if the state isn't {@link State#SUCCESS}.
     */
    public static void raiseIfUnsupported(State state) {
        switch (state) {
            case SUCCESS:
                return;
            case UNSUPPORTED_DISTRIBUTION:
                throw new UnsupportedProductException(
                        "The client noticed that the server is not a supported distribution of Elasticsearch");
            default:
                throw new UnsupportedProductException("The client noticed that the server is not Elasticsearch "
                        + "and we do not support this unknown product");
        }
    }

    private static int[] parseVersion(String value) {
        Matcher matcher = VERSION.matcher(value);
        if (!matcher.find()) {
            return new int[] {0, 0, 0};
        }
        // A missing patch version sorts after every release of the minor.
        int patch = matcher.group(3) == null ? 999 : Integer.parseInt(matcher.group(3));
        return new int[] {Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), patch};
    }

    private static int compare(int[] version, int major, int minor, int patch) {
        if (version[0] != major) {
            return Integer.compare(version[0], major);
        }
        if (version[1] != minor) {
            return Integer.compare(version[1], minor);
        }
        return Integer.compare(version[2], patch);
    }
}
