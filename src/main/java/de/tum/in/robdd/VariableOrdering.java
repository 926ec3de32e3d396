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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A fixed, duplicate-free sequence of variable names. The position of a name is the variable
 * index used by the diagram, so the first name is tested at the root.
 */
public final class VariableOrdering {
    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    private final List<String> names;
    private final Map<String, Integer> index;

    private VariableOrdering(List<String> names) {
        this.names = ImmutableList.copyOf(names);
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builderWithExpectedSize(names.size());
        for (int i = 0; i < this.names.size(); i++) {
            builder.put(this.names.get(i), i);
        }
        Map<String, Integer> indexMap;
        try {
            indexMap = builder.buildOrThrow();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Duplicate variable in ordering " + names, e);
        }
        this.index = indexMap;
    }

    /**
     * @throws IllegalArgumentException If a name occurs twice.
     */
    public static VariableOrdering of(List<String> names) {
        for (String name : names) {
            checkArgument(name != null && !name.isBlank(), "Invalid variable name in %s", names);
        }
        return new VariableOrdering(names);
    }

    public static VariableOrdering of(String... names) {
        return of(List.of(names));
    }

    /**
     * Parses a comma-separated list of names, e.g. {@code "a, b, c"}.
     */
    public static VariableOrdering parse(String commaSeparated) {
        return of(COMMA.splitToList(commaSeparated));
    }

    /**
     * The variables of {@code expression}, sorted alphabetically.
     */
    public static VariableOrdering alphabetical(Expression expression) {
        return of(expression.variables().stream().sorted().collect(ImmutableList.toImmutableList()));
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public String get(int position) {
        return names.get(position);
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /**
     * Returns the position of {@code name} or {@code -1} if it is not part of this ordering.
     */
    public int indexOf(String name) {
        Integer position = index.get(name);
        return position == null ? -1 : position;
    }

    public List<String> names() {
        return names;
    }

    /**
     * Returns the names of {@code variables} which are not part of this ordering, sorted.
     */
    List<String> missing(Collection<String> variables) {
        return variables.stream().filter(name -> !index.containsKey(name)).sorted()
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof VariableOrdering)) {
            return false;
        }
        return names.equals(((VariableOrdering) object).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
