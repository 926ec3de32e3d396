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
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

final class RobddImpl implements Robdd {
    private static final Logger logger = Logger.getLogger(RobddImpl.class.getName());

    private final RobddConfiguration configuration;
    private final NodeStore store;
    private final UniqueTable uniqueTable;

    // Statistics
    private long buildCount = 0;
    private long expansionCount = 0;
    private long cacheLookups = 0;
    private long cacheHits = 0;

    RobddImpl(RobddConfiguration configuration) {
        this.configuration = configuration;
        this.store = new NodeStore(configuration.initialSize(), configuration.growthFactor());
        this.uniqueTable = new UniqueTable(store, configuration.initialSize(), configuration.growthFactor());
    }

    @Override
    public int build(Expression expression, VariableOrdering ordering) {
        Objects.requireNonNull(expression);
        Objects.requireNonNull(ordering);

        ShannonBuilder.validate(expression, ordering);
        store.adoptOrdering(ordering);

        ExpansionCache cache = configuration.useExpansionCache() ? new ExpansionCache() : null;
        ShannonBuilder builder = new ShannonBuilder(uniqueTable, ordering, cache);
        int nodesBefore = store.nodeCount();
        int root = builder.build(expression);
        assert check();

        buildCount += 1;
        expansionCount += builder.expansions();
        if (cache != null) {
            cacheLookups += cache.lookups();
            cacheHits += cache.hits();
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Built {0} along {1}: root {2}, {3} expansions, {4} new nodes, {5}", new Object[] {
                expression, ordering, root, builder.expansions(), store.nodeCount() - nodesBefore, cache
            });
        }
        if (configuration.logStatisticsOnBuild()) {
            logger.log(Level.INFO, statistics());
        }
        return root;
    }

    @Override
    public int falseNode() {
        return store.falseNode();
    }

    @Override
    public int trueNode() {
        return store.trueNode();
    }

    @Override
    public boolean isLeaf(int node) {
        return store.isLeaf(node);
    }

    @Override
    public int variableOf(int node) {
        return store.variableOf(node);
    }

    @Override
    public int low(int node) {
        return store.low(node);
    }

    @Override
    public int high(int node) {
        return store.high(node);
    }

    @Override
    public String variableName(int variable) {
        return store.variableName(variable);
    }

    @Override
    public int numberOfVariables() {
        return store.numberOfVariables();
    }

    @Override
    public int nodeCount() {
        return store.nodeCount();
    }

    @Override
    public void forEachNodeBelowOnce(int node, NodeVisitor visitor) {
        store.forEachNodeBelowOnce(node, visitor);
    }

    @Override
    public BigInteger satisfyingAssignmentCount(int node, int variableCount) {
        return store.satisfyingAssignmentCount(node, variableCount);
    }

    @Override
    public boolean check() {
        return store.check() && uniqueTable.check();
    }

    @Override
    public String statistics() {
        return String.format(
                "%s%n%s%n"
                        + "Builds: %d, %d expansions, expansion cache %d lookups / %d hits",
                store.statistics(),
                uniqueTable.statistics(),
                buildCount,
                expansionCount,
                cacheLookups,
                cacheHits);
    }

    NodeStore store() {
        return store;
    }

    @Override
    public String toString() {
        return String.format("ROBDD@%x[%d nodes, %d variables]", System.identityHashCode(this),
                store.nodeCount(), store.numberOfVariables());
    }
}
