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
 * Thrown if an expression references variables which are not part of the supplied ordering.
 */
public class UnknownVariableException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final List<String> variables;

    public UnknownVariableException(List<String> variables, VariableOrdering ordering) {
        super(String.format("Variables %s are not part of the ordering %s", variables, ordering));
        this.variables = List.copyOf(variables);
    }

    /**
     * The unknown variables, sorted by name.
     */
    public List<String> variables() {
        return variables;
    }
}
