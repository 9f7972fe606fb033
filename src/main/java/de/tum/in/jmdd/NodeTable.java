/*
 * This file is part of JMDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JMDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JMDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JMDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmdd;

import java.util.Arrays;

/**
 * Unique table of the binary decision nodes of one {@link BddManager}. Nodes are identified by
 * positive integers, the two leaves by {@link #TRUE_NODE} and {@link #FALSE_NODE}. Each node stores
 * the <i>identifier</i> of its variable, not its level, so that the table itself is agnostic of the
 * current variable order.
 *
 * <p>There is no garbage collection: the table only grows. Rebuilding the table (which happens on
 * every reorder) drops all nodes not reachable from a live formula.</p>
 */
final class NodeTable {
    static final int TRUE_NODE = -1;
    static final int FALSE_NODE = -2;

    // Use 0 as "not a node" so that freshly allocated arrays are empty
    static final int NOT_A_NODE = 0;
    static final int FIRST_NODE = 1;

    private static final int MINIMUM_TABLE_SIZE = 64;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    private int[] variables;
    private int[] lows;
    private int[] highs;

    /* Hash buckets: hashToChainStart points to the first node of a bucket, hashChain links the
     * remaining nodes of the same bucket. NOT_A_NODE terminates a chain. */
    private int[] hashToChainStart;
    private int[] hashChain;

    /* Index of the next node to be allocated. */
    private int nextFreeNode = FIRST_NODE;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupHits = 0;
    private long growCount = 0;

    NodeTable(int initialSize, double growthFactor) {
        assert growthFactor > 1.0d;
        this.growthFactor = growthFactor;
        int tableSize = Math.max(initialSize, MINIMUM_TABLE_SIZE);
        variables = new int[tableSize];
        lows = new int[tableSize];
        highs = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
    }

    static boolean isLeaf(int node) {
        return node < 0;
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    int variableOf(int node) {
        assert isNodeValid(node);
        return variables[node];
    }

    int low(int node) {
        assert isNodeValid(node);
        return lows[node];
    }

    int high(int node) {
        assert isNodeValid(node);
        return highs[node];
    }

    /** Number of allocated (inner) nodes. */
    int size() {
        return nextFreeNode - FIRST_NODE;
    }

    /** Upper bound (exclusive) of node ids, useful to size per-node scratch arrays. */
    int bound() {
        return nextFreeNode;
    }

    /**
     * Returns the unique node testing {@code variable} with the given children. Callers are responsible
     * for the ordering invariant, i.e. both children have to be below the variable's level.
     */
    int make(int variable, int low, int high) {
        assert 0 <= variable;
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high);

        if (low == high) {
            return low;
        }

        hashChainLookups += 1;
        int bucket = bucket(variable, low, high, hashToChainStart.length);
        int current = hashToChainStart[bucket];
        while (current != NOT_A_NODE) {
            if (variables[current] == variable && lows[current] == low && highs[current] == high) {
                hashChainLookupHits += 1;
                return current;
            }
            current = hashChain[current];
        }

        if (nextFreeNode == variables.length) {
            grow();
            bucket = bucket(variable, low, high, hashToChainStart.length);
        }

        int node = nextFreeNode;
        nextFreeNode += 1;
        createdNodes += 1;

        variables[node] = variable;
        lows[node] = low;
        highs[node] = high;
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
        return node;
    }

    private void grow() {
        int size = variables.length;
        if (size >= MAXIMAL_NODE_COUNT) {
            throw new IllegalStateException("Node table exhausted with " + size + " nodes");
        }
        int newSize = (int) Math.min(MAXIMAL_NODE_COUNT, Math.ceil(size * growthFactor));
        variables = Arrays.copyOf(variables, newSize);
        lows = Arrays.copyOf(lows, newSize);
        highs = Arrays.copyOf(highs, newSize);
        hashChain = new int[newSize];
        hashToChainStart = new int[newSize];

        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int bucket = bucket(variables[node], lows[node], highs[node], newSize);
            hashChain[node] = hashToChainStart[bucket];
            hashToChainStart[bucket] = node;
        }
        growCount += 1;
    }

    private static int bucket(int variable, int low, int high, int modulus) {
        int hash = HashUtil.hash(variable, low, high) % modulus;
        return hash < 0 ? hash + modulus : hash;
    }

    String statistics() {
        return String.format("Node table: %d nodes, capacity %d, %d created, %d lookups (%d hits), grown %d times",
                size(), variables.length, createdNodes, hashChainLookups, hashChainLookupHits, growCount);
    }
}
