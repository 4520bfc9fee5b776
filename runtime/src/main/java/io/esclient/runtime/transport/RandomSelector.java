/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.List;
import java.util.Random;

/**
 * Picks a live node at random.
 */
public final class RandomSelector implements NodeSelector {

    private final Random random;

    public RandomSelector() {
        this(new Random());
    }

    public RandomSelector(Random random) {
        this.random = random;
    }

    @Override
    public NodeConnection select(List<NodeConnection> live) {
        synchronized (random) {
            return live.get(random.nextInt(live.size()));
        }
    }
}
