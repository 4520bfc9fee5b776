/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.esclient.runtime.errors.UnsupportedProductException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.model.node.Node;

public class ProductCheckTest {

    private static final Map<String, String> PRODUCT_HEADER = Map.of("x-elastic-product", "Elasticsearch");

    private static Node info(String number, String tagline, String flavor) {
        return Node.objectNodeBuilder()
                .withMember("tagline", tagline)
                .withMember("version", Node.objectNodeBuilder()
                        .withMember("number", number)
                        .withMember("build_flavor", flavor)
                        .build())
                .build();
    }

    @Test
    public void testModernVersionsRequireProductHeader() {
        assertEquals(ProductCheck.State.SUCCESS,
                ProductCheck.check(PRODUCT_HEADER, info("8.12.0", ProductCheck.TAGLINE, "default")));
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT,
                ProductCheck.check(Map.of(), info("7.14.0", ProductCheck.TAGLINE, "default")));
    }

    @Test
    public void testSevenBeforeFourteenChecksTaglineAndFlavor() {
        assertEquals(ProductCheck.State.SUCCESS,
                ProductCheck.check(Map.of(), info("7.10.2", ProductCheck.TAGLINE, "default")));
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT,
                ProductCheck.check(Map.of(), info("7.10.2", "other", "default")));
        assertEquals(ProductCheck.State.UNSUPPORTED_DISTRIBUTION,
                ProductCheck.check(Map.of(), info("7.10.2", ProductCheck.TAGLINE, "oss")));
    }

    @Test
    public void testSixRequiresTagline() {
        assertEquals(ProductCheck.State.SUCCESS,
                ProductCheck.check(Map.of(), info("6.8.0", ProductCheck.TAGLINE, "oss")));
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT,
                ProductCheck.check(Map.of(), info("6.8.0", "other", "default")));
    }

    @Test
    public void testMissingOrOldVersionIsUnsupported() {
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT, ProductCheck.check(PRODUCT_HEADER, Node.objectNode()));
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT,
                ProductCheck.check(PRODUCT_HEADER, info("5.6.0", ProductCheck.TAGLINE, "default")));
        assertEquals(ProductCheck.State.UNSUPPORTED_PRODUCT, ProductCheck.check(PRODUCT_HEADER, "text"));
    }

    @Test
    public void testRaiseIfUnsupported() {
        ProductCheck.raiseIfUnsupported(ProductCheck.State.SUCCESS);
        UnsupportedProductException e = assertThrows(UnsupportedProductException.class,
                () -> ProductCheck.raiseIfUnsupported(ProductCheck.State.UNSUPPORTED_DISTRIBUTION));

        assertEquals("The client noticed that the server is not a supported distribution of Elasticsearch",
                e.getMessage());
    }
}
