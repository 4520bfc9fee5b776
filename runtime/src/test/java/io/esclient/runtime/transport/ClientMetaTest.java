/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ClientMetaTest {

    @Test
    public void testFormatVersion() {
        assertEquals("8.1.0", ClientMeta.formatVersion("8.1.0"));
        assertEquals("8.1.0p", ClientMeta.formatVersion("8.1.0-SNAPSHOT"));
        assertEquals("7.14p", ClientMeta.formatVersion("7.14rc1"));
    }

    @Test
    public void testHeader() {
        String header = ClientMeta.header(true);

        assertTrue(header.matches("es=[0-9.]+p?,jv=[0-9.]+p?,t=[0-9.]+p?,hc=[0-9.]+p?,a=1"), header);
        assertTrue(ClientMeta.header(false).endsWith(",hc=" + ClientMeta.javaVersion()));
    }
}
