/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through live nodes in order.
 */
public final class RoundRobinSelector implements NodeSelector {

    private final AtomicInteger next = new AtomicInteger();

    @Override
    public NodeConnection select(List<NodeConnection> live) {
        return live.get(Math.floorMod(next.getAndIncrement(), live.size()));
    }
}
