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

import static de.tum.in.robdd.Util.checkArgument;
import static de.tum.in.robdd.Util.checkState;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Arena holding every node created by the builds running against it. Handles are array indices:
 * {@code 0} and {@code 1} are the false and true leaves, decision nodes are appended from
 * {@code 2} onwards and never move, change or get freed.
 */
public final class NodeStore implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeStore.class.getName());

    static final int FALSE_NODE = 0;
    static final int TRUE_NODE = 1;
    static final int FIRST_NODE = 2;

    private static final int MINIMUM_STORE_SIZE = 16;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Variable of each node, -1 for the two leaves */
    private int[] variables;
    /* Low and high successors of each node */
    private int[] tree;
    /* Next free handle, equal to the number of allocated nodes */
    private int size;

    /* Names of the variables, indexed by their position in the ordering */
    private final List<String> variableNames = new ArrayList<>();

    // Statistics
    private long growCount = 0;

    NodeStore(int initialSize, double growthFactor) {
        checkState(growthFactor > 1.0, "Growth factor %s must be larger than 1", growthFactor);
        this.growthFactor = growthFactor;
        int storeSize = Math.max(initialSize, MINIMUM_STORE_SIZE);

        variables = new int[storeSize];
        tree = new int[2 * storeSize];

        variables[FALSE_NODE] = -1;
        variables[TRUE_NODE] = -1;
        // Just to ensure a fail-fast
        Arrays.fill(tree, 0, 2 * FIRST_NODE, Integer.MIN_VALUE);
        size = FIRST_NODE;
    }

    // Nodes

    int terminal(boolean value) {
        return value ? TRUE_NODE : FALSE_NODE;
    }

    /**
     * Appends a new decision node. The caller is responsible for having checked that no equal node
     * exists; no deduplication happens here.
     *
     * @return The handle of the new node.
     */
    int allocateDecision(int variable, int low, int high) {
        assert 0 <= variable && variable < variableNames.size() : "Unknown variable " + variable;
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high);
        assert low != high : "Redundant node " + variable + " " + low;

        if (size == variables.length) {
            ensureCapacity();
        }
        int node = size;
        variables[node] = variable;
        tree[2 * node] = low;
        tree[2 * node + 1] = high;
        size += 1;
        return node;
    }

    private void ensureCapacity() {
        int oldSize = variables.length;
        checkState(oldSize < MAXIMAL_NODE_COUNT, "Node store exhausted at %d nodes", oldSize);
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = (int) Math.min(MAXIMAL_NODE_COUNT, Math.ceil(oldSize * growthFactor));
        logger.log(Level.FINE, "Growing the store of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        variables = Arrays.copyOf(variables, newSize);
        tree = Arrays.copyOf(tree, 2 * newSize);
        growCount += 1;
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < size;
    }

    boolean isNodeValidOrLeaf(int node) {
        return 0 <= node && node < size;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public boolean isLeaf(int node) {
        assert isNodeValidOrLeaf(node) : "Invalid node " + node;
        return node < FIRST_NODE;
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node) : "Invalid node " + node;
        return variables[node];
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node) : "Invalid node " + node;
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node) : "Invalid node " + node;
        return tree[2 * node + 1];
    }

    @Override
    public int nodeCount() {
        return size;
    }

    // Variables

    @Override
    public String variableName(int variable) {
        return variableNames.get(variable);
    }

    @Override
    public int numberOfVariables() {
        return variableNames.size();
    }

    /**
     * Binds the given ordering to this store. The first ordering is adopted as is; later ones have
     * to agree with the known variables position by position and may only append new ones.
     *
     * @throws IllegalArgumentException If the ordering disagrees with the known variables.
     */
    void adoptOrdering(VariableOrdering ordering) {
        int common = Math.min(ordering.size(), variableNames.size());
        for (int i = 0; i < common; i++) {
            if (!variableNames.get(i).equals(ordering.get(i))) {
                throw new IllegalArgumentException(String.format(
                        "Ordering %s is incompatible with the ordering %s of this store: position %d",
                        ordering, variableNames, i));
            }
        }
        for (int i = common; i < ordering.size(); i++) {
            variableNames.add(ordering.get(i));
        }
    }

    // Traversal

    @Override
    public void forEachNodeBelowOnce(int node, NodeVisitor visitor) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return;
        }
        forEachNodeBelowOnceRecursive(node, new BitSet(size), visitor);
    }

    private void forEachNodeBelowOnceRecursive(int node, BitSet visited, NodeVisitor visitor) {
        if (isLeaf(node) || visited.get(node)) {
            return;
        }
        visited.set(node);
        visitor.visit(node, variables[node]);
        forEachNodeBelowOnceRecursive(tree[2 * node], visited, visitor);
        forEachNodeBelowOnceRecursive(tree[2 * node + 1], visited, visitor);
    }

    @Override
    public BigInteger satisfyingAssignmentCount(int node, int variableCount) {
        assert isNodeValidOrLeaf(node);
        checkArgument(support(node).length() <= variableCount,
                "Node %d depends on more than %d variables", node, variableCount);
        if (isLeaf(node)) {
            return node == TRUE_NODE ? BigInteger.ONE.shiftLeft(variableCount) : BigInteger.ZERO;
        }
        BigInteger below = countRecursive(node, variableCount, new HashMap<>());
        return below.shiftLeft(variables[node]);
    }

    /* Number of satisfying assignments to the variables from variableOf(node) up to variableCount */
    private BigInteger countRecursive(int node, int variableCount, Map<Integer, BigInteger> counts) {
        if (node == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (node == TRUE_NODE) {
            return BigInteger.ONE;
        }
        BigInteger cached = counts.get(node);
        if (cached != null) {
            return cached;
        }
        int variable = variables[node];
        int low = tree[2 * node];
        int high = tree[2 * node + 1];
        BigInteger lowCount = countRecursive(low, variableCount, counts)
                .shiftLeft(levelOf(low, variableCount) - variable - 1);
        BigInteger highCount = countRecursive(high, variableCount, counts)
                .shiftLeft(levelOf(high, variableCount) - variable - 1);
        BigInteger count = lowCount.add(highCount);
        counts.put(node, count);
        return count;
    }

    private int levelOf(int node, int variableCount) {
        return isLeaf(node) ? variableCount : variables[node];
    }

    // Integrity checks and utility

    @Override
    public boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(size <= variables.length, "Size %d exceeds capacity %d", size, variables.length);
        checkState(variables[FALSE_NODE] == -1 && variables[TRUE_NODE] == -1, "Leaves carry a variable");

        Set<List<Integer>> seen = new HashSet<>();
        for (int node = FIRST_NODE; node < size; node++) {
            int variable = variables[node];
            int low = tree[2 * node];
            int high = tree[2 * node + 1];
            checkState(0 <= variable && variable < variableNames.size(), "Node %d has invalid variable %d", node, variable);
            checkState(isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high), "Invalid child entry of node %d", node);
            // Children are always created before their parents
            checkState(low < node && high < node, "Node %d points forward", node);
            checkState(low != high, "Node %d is redundant", node);
            checkState(isLeaf(low) || variable < variables[low], "%d -> %d does not descend tree", node, low);
            checkState(isLeaf(high) || variable < variables[high], "%d -> %d does not descend tree", node, high);
            checkState(seen.add(List.of(variable, low, high)), "Duplicate entry %d", node);
        }
        return true;
    }

    @Override
    public String statistics() {
        return String.format(
                "Node store statistics:%n"
                        + "Capacity: %1$d, %2$d decision nodes, %3$d variables, %4$d grows",
                variables.length, size - FIRST_NODE, variableNames.size(), growCount);
    }

    public String nodeToString(int node) {
        if (!isNodeValidOrLeaf(node)) {
            return String.format("%5d| == INVALID ==", node);
        }
        if (isLeaf(node)) {
            return String.format("%5d| %s", node, node == TRUE_NODE ? "TRUE" : "FALSE");
        }
        int variable = variables[node];
        return String.format("%5d|%3d|%s|%d %d", node, variable,
                variable < variableNames.size() ? variableNames.get(variable) : "?",
                tree[2 * node], tree[2 * node + 1]);
    }

    /**
     * Generates a string representation of the given {@code node}.
     *
     * @param node The node to be printed.
     * @return A string representing the given node.
     */
    public String treeToString(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return String.format("Node %d%n", node);
        }
        StringBuilder builder =
                new StringBuilder(50).append("Node ").append(node).append('\n').append("  NODE|VAR|NAME|LOW HIGH\n");
        forEachNodeBelowOnce(node, (child, var) -> builder.append(' ').append(nodeToString(child)).append('\n'));
        return builder.toString();
    }
}
