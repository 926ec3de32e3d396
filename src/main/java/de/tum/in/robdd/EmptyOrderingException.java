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

/**
 * Thrown if a non-constant expression is built with an empty ordering.
 */
public class EmptyOrderingException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public EmptyOrderingException(Expression expression) {
        super("Empty ordering for non-constant expression " + expression);
    }
}
