/*
 * This file is part of ROBDD.
 * Copyright (c) 2026 Tobias Meggendorfer.
 *
 * ROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import static de.tum.in.robdd.Util.checkState;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hash-consing index over a {@link NodeStore}. This is the only way decision nodes come into
 * existence: {@link #makeNode(int, int, int)} applies the reduction rule and returns the existing
 * node for a known {@code (variable, low, high)} triple, so structurally equal sub-graphs always
 * share one handle.
 *
 * <p>Implemented as open hashing: {@code hashToChainStart} holds the first node of each bucket and
 * {@code hashChain} links each node to the next one in its bucket. Entries are never removed.</p>
 */
final class UniqueTable {
    private static final Logger logger = Logger.getLogger(UniqueTable.class.getName());

    private static final int END_OF_CHAIN = -1;
    private static final int MINIMUM_TABLE_SIZE = Primes.nextPrime(1_000);

    private final NodeStore store;
    private final double growthFactor;

    private int[] hashToChainStart;
    /* Indexed by node handle, the next node in the same bucket */
    private int[] hashChain;
    private int entryCount = 0;

    // Statistics
    private long lookups = 0;
    private long lookupHits = 0;
    private long lookupChainLength = 0;
    private long reductions = 0;
    private long rehashCount = 0;

    UniqueTable(NodeStore store, int initialSize, double growthFactor) {
        this.store = store;
        this.growthFactor = growthFactor;
        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_TABLE_SIZE);

        hashToChainStart = new int[tableSize];
        Arrays.fill(hashToChainStart, END_OF_CHAIN);
        hashChain = new int[tableSize];
        Arrays.fill(hashChain, END_OF_CHAIN);
    }

    NodeStore store() {
        return store;
    }

    /**
     * Returns the canonical node testing {@code variable} with the given successors.
     *
     * @param variable Index of the tested variable, smaller than the variable of both children.
     * @param low      The successor if the variable is false.
     * @param high     The successor if the variable is true.
     * @return {@code low} if both successors coincide, otherwise the unique node for the triple.
     * @throws IllegalStateException If a child does not test a strictly later variable.
     */
    int makeNode(int variable, int low, int high) {
        checkState(store.isLeaf(low) || variable < store.variableOf(low),
                "Node on variable %d would precede its low child %d", variable, low);
        checkState(store.isLeaf(high) || variable < store.variableOf(high),
                "Node on variable %d would precede its high child %d", variable, high);

        if (low == high) {
            reductions += 1;
            return low;
        }

        int hash = HashUtil.hash(variable, low, high);
        int bucket = HashUtil.mod(hash, hashToChainStart.length);

        int chainLength = 1;
        lookups += 1;
        int current = hashToChainStart[bucket];
        while (current != END_OF_CHAIN) {
            if (store.variableOf(current) == variable && store.low(current) == low && store.high(current) == high) {
                lookupChainLength += chainLength;
                lookupHits += 1;
                return current;
            }
            current = hashChain[current];
            chainLength += 1;
        }
        lookupChainLength += chainLength;

        int node = store.allocateDecision(variable, low, high);
        if (node >= hashChain.length) {
            int oldLength = hashChain.length;
            hashChain = Arrays.copyOf(hashChain, Math.max(node + 1, (int) Math.ceil(oldLength * growthFactor)));
            Arrays.fill(hashChain, oldLength, hashChain.length, END_OF_CHAIN);
        }
        entryCount += 1;
        if (entryCount > hashToChainStart.length) {
            rehash();
        } else {
            connect(node, bucket);
        }
        return node;
    }

    private void connect(int node, int bucket) {
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
    }

    private void rehash() {
        int oldSize = hashToChainStart.length;
        int newSize = Primes.nextPrime((int) Math.ceil(oldSize * growthFactor));
        logger.log(Level.FINE, "Rehashing the unique table from {0} to {1} buckets", new Object[] {oldSize, newSize});

        hashToChainStart = new int[newSize];
        Arrays.fill(hashToChainStart, END_OF_CHAIN);
        Arrays.fill(hashChain, END_OF_CHAIN);
        for (int node = NodeStore.FIRST_NODE; node < store.nodeCount(); node++) {
            int hash = HashUtil.hash(store.variableOf(node), store.low(node), store.high(node));
            connect(node, HashUtil.mod(hash, newSize));
        }
        rehashCount += 1;
    }

    int size() {
        return entryCount;
    }

    /**
     * Checks that every decision node of the store is reachable through its own bucket.
     */
    boolean check() {
        logger.log(Level.FINER, "Checking unique table chains");
        checkState(entryCount == store.nodeCount() - NodeStore.FIRST_NODE,
                "Table holds %d entries but the store %d decision nodes",
                entryCount, store.nodeCount() - NodeStore.FIRST_NODE);
        for (int node = NodeStore.FIRST_NODE; node < store.nodeCount(); node++) {
            int hash = HashUtil.hash(store.variableOf(node), store.low(node), store.high(node));
            int current = hashToChainStart[HashUtil.mod(hash, hashToChainStart.length)];
            boolean found = false;
            while (current != END_OF_CHAIN) {
                if (current == node) {
                    found = true;
                    break;
                }
                current = hashChain[current];
            }
            checkState(found, "Node %d is not in its hash chain", node);
        }
        return true;
    }

    String statistics() {
        return String.format(
                "Unique table statistics:%n"
                        + "%1$d buckets, %2$d entries (%3$.2f load), %4$d rehashes%n"
                        + "%5$d lookups, %6$d hits, %7$.2f avg. len, %8$d reductions",
                hashToChainStart.length,
                entryCount,
                entryCount * 1.0 / hashToChainStart.length,
                rehashCount,
                lookups,
                lookupHits,
                lookups == 0 ? 0.0 : lookupChainLength * 1.0 / lookups,
                reductions);
    }
}
