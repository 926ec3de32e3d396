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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memo table of a single build, mapping a residual expression and the position of the next
 * variable to branch on to the node already built for it. Expressions are compared structurally,
 * as restriction rebuilds equal sub-trees independently.
 */
final class ExpansionCache {
    static final int NOT_CACHED = -1;

    private final Map<Key, Integer> cache = new HashMap<>();

    // Statistics
    private long lookups = 0;
    private long hits = 0;

    int get(Expression expression, int position) {
        lookups += 1;
        Integer node = cache.get(new Key(expression, position));
        if (node == null) {
            return NOT_CACHED;
        }
        hits += 1;
        return node;
    }

    void put(Expression expression, int position, int node) {
        assert node >= 0;
        Integer previous = cache.put(new Key(expression, position), node);
        assert previous == null || previous == node : "Conflicting entries for " + expression;
    }

    int size() {
        return cache.size();
    }

    long lookups() {
        return lookups;
    }

    long hits() {
        return hits;
    }

    @Override
    public String toString() {
        return String.format("Expansion cache: %d entries, %d lookups, %d hits", cache.size(), lookups, hits);
    }

    private static final class Key {
        private final Expression expression;
        private final int position;
        private final int hashCode;

        Key(Expression expression, int position) {
            this.expression = expression;
            this.position = position;
            this.hashCode = 31 * expression.hashCode() + position;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Key)) {
                return false;
            }
            Key that = (Key) object;
            return position == that.position && hashCode == that.hashCode
                    && Objects.equals(expression, that.expression);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }
    }
}
