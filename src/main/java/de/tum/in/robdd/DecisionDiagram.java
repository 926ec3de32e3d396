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

import java.math.BigInteger;
import java.util.BitSet;
import java.util.Optional;

/**
 * Read access to a reduced ordered binary decision diagram. Nodes are addressed by {@code int}
 * handles which stay valid for the lifetime of the owning store.
 *
 * <p>Most required properties of the arguments are only checked through {@code assert}
 * statements. Passing a handle which was not obtained from this diagram leads to undefined
 * behaviour with disabled assertions.</p>
 */
public interface DecisionDiagram {
    int falseNode();

    int trueNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Returns the constant represented by {@code node}, or an empty optional if it is a decision
     * node.
     */
    default Optional<Boolean> terminalValue(int node) {
        if (!isLeaf(node)) {
            return Optional.empty();
        }
        return Optional.of(node == trueNode());
    }

    /**
     * Gets the variable of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    int low(int node);

    int high(int node);

    /**
     * Returns the name the variable with index {@code variable} had in the ordering used to build
     * this diagram.
     */
    String variableName(int variable);

    /**
     * Returns the number of variables known to this diagram, i.e. the length of the longest
     * ordering used so far.
     */
    int numberOfVariables();

    /**
     * Returns the number of nodes in this diagram, including both leaves.
     */
    int nodeCount();

    /**
     * Calls {@code visitor} exactly once for each decision node reachable from {@code node},
     * in depth-first order, visiting the low successor before the high successor.
     *
     * @param node    The root of the traversal.
     * @param visitor The visitor called with each node and its variable.
     */
    void forEachNodeBelowOnce(int node, NodeVisitor visitor);

    /**
     * Counts the decision nodes reachable from {@code node}.
     */
    default int reachableNodeCount(int node) {
        int[] count = {0};
        forEachNodeBelowOnce(node, (child, variable) -> count[0]++);
        return count[0];
    }

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}. The support
     * of a function are all variables which have an influence on its value.
     *
     * @param node The node whose support should be computed.
     * @return A bit set with bit {@code i} is set iff the {@code i}-th variable is in the support.
     */
    default BitSet support(int node) {
        BitSet bitSet = new BitSet(numberOfVariables());
        forEachNodeBelowOnce(node, (child, variable) -> bitSet.set(variable));
        return bitSet;
    }

    /**
     * Evaluates the function represented by {@code node} under the given assignment by following
     * the low and high edges down to a leaf.
     *
     * @param node       The root node.
     * @param assignment Value of each variable, indexed by its position in the ordering.
     * @return The value of the leaf reached.
     */
    default boolean evaluate(int node, boolean[] assignment) {
        int current = node;
        while (!isLeaf(current)) {
            current = assignment[variableOf(current)] ? high(current) : low(current);
        }
        return current == trueNode();
    }

    /**
     * Counts the assignments to the first {@code variableCount} variables under which the function
     * represented by {@code node} evaluates to true.
     */
    BigInteger satisfyingAssignmentCount(int node, int variableCount);

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check();

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    String statistics();

    @FunctionalInterface
    interface NodeVisitor {
        void visit(int node, int variable);
    }
}
