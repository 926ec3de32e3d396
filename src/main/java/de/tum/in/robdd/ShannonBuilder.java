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

import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Recursive Shannon expansion of a single expression along a fixed ordering. An instance lives for
 * one build and owns that build's expansion cache; the unique table it creates nodes through may
 * be shared with other builds.
 */
final class ShannonBuilder {
    private final UniqueTable uniqueTable;
    private final NodeStore store;
    private final VariableOrdering ordering;
    @Nullable
    private final ExpansionCache cache;

    /* Statistics */
    private long expansions = 0;

    ShannonBuilder(UniqueTable uniqueTable, VariableOrdering ordering, @Nullable ExpansionCache cache) {
        this.uniqueTable = uniqueTable;
        this.store = uniqueTable.store();
        this.ordering = ordering;
        this.cache = cache;
    }

    /**
     * Checks that {@code expression} can be built along the ordering of this builder.
     *
     * @throws EmptyOrderingException   If the ordering is empty and the expression has variables.
     * @throws UnknownVariableException If the expression has variables outside of the ordering.
     */
    static void validate(Expression expression, VariableOrdering ordering) {
        Set<String> variables = expression.variables();
        if (variables.isEmpty()) {
            return;
        }
        if (ordering.isEmpty()) {
            throw new EmptyOrderingException(expression);
        }
        List<String> missing = ordering.missing(variables);
        if (!missing.isEmpty()) {
            throw new UnknownVariableException(missing, ordering);
        }
    }

    /**
     * Builds the diagram of {@code expression}, which must have passed {@link #validate}.
     *
     * @return The root node.
     */
    int build(Expression expression) {
        return buildRecursive(expression.foldConstants(), 0);
    }

    private int buildRecursive(Expression expression, int position) {
        if (expression.isConstant()) {
            return store.terminal(expression.constantValue());
        }
        checkState(position < ordering.size(), "Variables of %s remain after the ordering %s", expression, ordering);

        String variable = ordering.get(position);
        if (!expression.hasVariable(variable)) {
            // Both cofactors coincide, the node would be reduced away
            return buildRecursive(expression, position + 1);
        }

        if (cache != null) {
            int cached = cache.get(expression, position);
            if (cached != ExpansionCache.NOT_CACHED) {
                return cached;
            }
        }
        expansions += 1;

        int low = buildRecursive(expression.restrict(variable, false), position + 1);
        int high = buildRecursive(expression.restrict(variable, true), position + 1);
        int node = uniqueTable.makeNode(position, low, high);

        if (cache != null) {
            cache.put(expression, position, node);
        }
        return node;
    }

    long expansions() {
        return expansions;
    }

    @Nullable
    ExpansionCache cache() {
        return cache;
    }
}
