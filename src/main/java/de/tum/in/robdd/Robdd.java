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

import java.util.List;

/**
 * Builds canonical reduced ordered binary decision diagrams of expressions.
 *
 * <p>All builds on one instance share its node store and unique table. Equivalent expressions
 * built along compatible orderings on the same instance therefore yield the same root node. The
 * store remembers the variables of all orderings used so far; a new ordering has to list these
 * variables at the same positions and may only append further ones.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public interface Robdd extends DecisionDiagram {
    /**
     * Builds the diagram of {@code expression} along {@code ordering}.
     *
     * @param expression The expression, all of whose variables occur in the ordering.
     * @param ordering   The variable ordering, first variable at the root.
     * @return The root node of the diagram.
     * @throws EmptyOrderingException   If the ordering is empty and the expression has variables.
     * @throws UnknownVariableException If the expression has a variable outside of the ordering.
     * @throws IllegalArgumentException If the ordering is incompatible with earlier builds.
     */
    int build(Expression expression, VariableOrdering ordering);

    default int build(Expression expression, List<String> ordering) {
        return build(expression, VariableOrdering.of(ordering));
    }
}
