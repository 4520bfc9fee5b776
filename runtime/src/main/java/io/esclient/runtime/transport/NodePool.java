/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Holds the connections of a transport, tracking which nodes are live and
 * which are dead.
 *
 * <p>A node that fails is removed from the live list and may be resurrected
 * once its timeout elapses. The timeout doubles with each consecutive failure,
 * up to {@code deadTimeout * 32}. When no node is live, the dead node with
 * the earliest timeout is resurrected regardless.
 *
 * <p>A pool with a single node never marks it dead.
 */
public final class NodePool implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(NodePool.class.getName());
    private static final int MAX_BACKOFF_EXPONENT = 5;

    private final List<NodeConnection> all;
    private final List<NodeConnection> live;
    private final PriorityQueue<DeadNode> dead = new PriorityQueue<>(
            Comparator.comparing(DeadNode::resurrectAt).thenComparingLong(DeadNode::sequence));
    private final Map<NodeConnection, Integer> failures = new HashMap<>();
    private final NodeSelector selector;
    private final Duration deadTimeout;
    private final Clock clock;
    private long sequence;

    public NodePool(List<NodeConnection> connections, TransportSettings settings) {
        this(connections, settings.selector(), settings.deadTimeout(), settings.randomizeNodes(),
                settings.clock(), new Random());
    }

    NodePool(
            List<NodeConnection> connections,
            NodeSelector selector,
            Duration deadTimeout,
            boolean randomize,
            Clock clock,
            Random random
    ) {
        if (connections.isEmpty()) {
            throw new IllegalArgumentException("A node pool requires at least one connection");
        }
        this.all = List.copyOf(connections);
        this.live = new ArrayList<>(connections);
        if (randomize && live.size() > 1) {
            Collections.shuffle(live, random);
        }
        this.selector = selector;
        this.deadTimeout = deadTimeout;
        this.clock = clock;
    }

    /**
     * @return Returns every connection of the pool, live or dead, in configuration order.
     */
    public List<NodeConnection> connections() {
        return all;
    }

    public synchronized List<NodeConnection> liveConnections() {
        return List.copyOf(live);
    }

    public synchronized int deadCount() {
        return dead.size();
    }

    /**
     * Gets the connection to use for the next request.
     *
     * @return Returns a connection, resurrecting a dead one when it's due or when none is live.
     */
    public synchronized NodeConnection getNode() {
        if (all.size() == 1) {
            return all.get(0);
        }
        resurrect(false);
        if (live.isEmpty()) {
            return resurrect(true);
        }
        return selector.select(Collections.unmodifiableList(live));
    }

    /**
     * Removes a connection from the live list after a failure.
     *
     * @param connection Connection that failed.
     */
    public synchronized void markDead(NodeConnection connection) {
        if (all.size() == 1 || !live.remove(connection)) {
            return;
        }
        int count = failures.merge(connection, 1, Integer::sum);
        long multiplier = 1L << Math.min(count - 1, MAX_BACKOFF_EXPONENT);
        Duration timeout = deadTimeout.multipliedBy(multiplier);
        Instant resurrectAt = clock.instant().plus(timeout);
        dead.add(new DeadNode(connection, resurrectAt, sequence++));
        LOGGER.warning(() -> String.format("Node %s has failed %d time(s) in a row, putting on %s timeout",
                connection.config(), count, timeout));
    }

    /**
     * Resets the failure count of a connection that served a request.
     *
     * @param connection Connection that succeeded.
     */
    public synchronized void markLive(NodeConnection connection) {
        if (failures.remove(connection) != null) {
            LOGGER.info(() -> "Node " + connection.config() + " is live again");
        }
    }

    private NodeConnection resurrect(boolean force) {
        DeadNode next = dead.peek();
        if (next == null) {
            return null;
        }
        if (!force && next.resurrectAt().isAfter(clock.instant())) {
            return null;
        }
        dead.poll();
        live.add(next.connection());
        LOGGER.info(() -> "Resurrected node " + next.connection().config() + (force ? " (forced)" : ""));
        return next.connection();
    }

    @Override
    public void close() {
        for (NodeConnection connection : all) {
            connection.close();
        }
    }

    private record DeadNode(NodeConnection connection, Instant resurrectAt, long sequence) {}
}
