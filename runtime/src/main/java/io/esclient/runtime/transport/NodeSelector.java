/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.List;

/**
 * Picks the node that serves the next request among the live ones.
 */
@FunctionalInterface
public interface NodeSelector {

    /**
     * @param live Live connections, never empty.
     * @return Returns the selected connection.
     */
    NodeConnection select(List<NodeConnection> live);
}
