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

/**
 * Direct-mapped computed table for the recursive operations of {@link BddManager}. A lookup stores
 * the slot and the cached value in {@link #lookupHash()} and {@link #lookupResult()}, so that the
 * caller can store the computed result without hashing again.
 *
 * <p>Entries are keyed by node ids of a single {@link NodeTable}. Since that table never recycles
 * nodes, entries never become stale; a new cache is created together with every new table.</p>
 */
@SuppressWarnings("PMD.TooManyFields")
final class OperationCache {
    static final byte NOT_AN_OPERATION = 0;
    static final byte OPERATION_AND = 1;
    static final byte OPERATION_OR = 2;
    static final byte OPERATION_XOR = 3;

    private static final int MINIMUM_SIZE = 32;

    private final byte[] binaryOperation;
    private final int[] binaryCache;
    private final int[] ternaryCache;
    private final int[] negationCache;

    private final CacheStatistics binaryStatistics = new CacheStatistics();
    private final CacheStatistics ternaryStatistics = new CacheStatistics();
    private final CacheStatistics negationStatistics = new CacheStatistics();

    private int lookupHash = -1;
    private int lookupResult = NodeTable.NOT_A_NODE;

    OperationCache(int tableSize, ManagerConfiguration configuration) {
        int binarySize = Math.max(MINIMUM_SIZE, tableSize / configuration.cacheBinaryDivider());
        int ternarySize = Math.max(MINIMUM_SIZE, tableSize / configuration.cacheTernaryDivider());

        binaryOperation = new byte[binarySize];
        binaryCache = new int[binarySize * 3];
        ternaryCache = new int[ternarySize * 4];
        negationCache = new int[binarySize * 2];
    }

    private static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        return lookupResult;
    }

    boolean lookupBinary(byte operation, int node1, int node2) {
        assert operation != NOT_AN_OPERATION;
        int hash = mod(HashUtil.hash(operation, node1, node2), binaryOperation.length);
        lookupHash = hash;
        int offset = hash * 3;
        if (binaryOperation[hash] == operation && binaryCache[offset] == node1 && binaryCache[offset + 1] == node2) {
            lookupResult = binaryCache[offset + 2];
            binaryStatistics.hit();
            return true;
        }
        binaryStatistics.miss();
        return false;
    }

    void putBinary(int hash, byte operation, int node1, int node2, int result) {
        int offset = hash * 3;
        binaryOperation[hash] = operation;
        binaryCache[offset] = node1;
        binaryCache[offset + 1] = node2;
        binaryCache[offset + 2] = result;
        binaryStatistics.put();
    }

    boolean lookupIfThenElse(int ifNode, int thenNode, int elseNode) {
        assert !NodeTable.isLeaf(ifNode);
        int hash = mod(HashUtil.hash(ifNode, thenNode, elseNode), ternaryCache.length / 4);
        lookupHash = hash;
        int offset = hash * 4;
        if (ternaryCache[offset] == ifNode && ternaryCache[offset + 1] == thenNode
                && ternaryCache[offset + 2] == elseNode) {
            lookupResult = ternaryCache[offset + 3];
            ternaryStatistics.hit();
            return true;
        }
        ternaryStatistics.miss();
        return false;
    }

    void putIfThenElse(int hash, int ifNode, int thenNode, int elseNode, int result) {
        int offset = hash * 4;
        ternaryCache[offset] = ifNode;
        ternaryCache[offset + 1] = thenNode;
        ternaryCache[offset + 2] = elseNode;
        ternaryCache[offset + 3] = result;
        ternaryStatistics.put();
    }

    boolean lookupNot(int node) {
        int hash = mod(HashUtil.hash(node), negationCache.length / 2);
        lookupHash = hash;
        int offset = hash * 2;
        // Leaves are never cached, so 0 marks an empty slot
        if (negationCache[offset] == node) {
            lookupResult = negationCache[offset + 1];
            negationStatistics.hit();
            return true;
        }
        negationStatistics.miss();
        return false;
    }

    void putNot(int hash, int node, int result) {
        int offset = hash * 2;
        negationCache[offset] = node;
        negationCache[offset + 1] = result;
        negationStatistics.put();
    }

    String statistics() {
        return String.format("Cache: binary %s, ternary %s, negation %s",
                binaryStatistics, ternaryStatistics, negationStatistics);
    }

    private static final class CacheStatistics {
        private long hits = 0;
        private long misses = 0;
        private long puts = 0;

        void hit() {
            hits += 1;
        }

        void miss() {
            misses += 1;
        }

        void put() {
            puts += 1;
        }

        @Override
        public String toString() {
            long lookups = hits + misses;
            float hitRate = lookups == 0 ? 0.0f : (float) hits / lookups;
            return String.format("%d lookups (%.1f%% hits), %d puts", lookups, hitRate * 100.0f, puts);
        }
    }
}
