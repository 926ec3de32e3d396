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

import com.google.common.collect.ImmutableList;
import de.tum.in.robdd.Expression.BinaryType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Generator {
    private static final Logger logger = Logger.getLogger(Generator.class.getName());
    private static final BinaryType[] BINARY_TYPES = BinaryType.values();

    private Generator() {
        // empty
    }

    public static List<String> variables(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(String.valueOf((char) ('a' + i)));
        }
        return ImmutableList.copyOf(names);
    }

    /**
     * Generates {@code count} distinct random expressions. It is important that generation is
     * ordered for the tests to be reproducible.
     */
    public static List<Expression> expressions(int seed, List<String> variables, int depth, int count) {
        logger.log(Level.FINE, "Generating {0} expressions of depth {1} over {2}",
                new Object[] {count, depth, variables});
        Random random = new Random(seed);
        Set<Expression> expressions = new LinkedHashSet<>();
        int attempts = 0;
        while (expressions.size() < count && attempts < 10 * count) {
            expressions.add(expression(random, variables, 1 + random.nextInt(depth)));
            attempts += 1;
        }
        return ImmutableList.copyOf(expressions);
    }

    public static Expression expression(Random random, List<String> variables, int depth) {
        if (depth <= 1) {
            //noinspection MagicNumber
            if (random.nextInt(20) == 0) {
                return Expression.constant(random.nextBoolean());
            }
            return Expression.variable(variables.get(random.nextInt(variables.size())));
        }
        if (random.nextInt(5) == 0) {
            return Expression.not(expression(random, variables, depth - 1));
        }
        BinaryType type = BINARY_TYPES[random.nextInt(BINARY_TYPES.length)];
        return Expression.binary(type,
                expression(random, variables, depth - 1),
                expression(random, variables, 1 + random.nextInt(depth - 1)));
    }

    /**
     * Rewrites the given expression into a logically equivalent but structurally different one,
     * using De Morgan, the definitions of the derived operators and commutativity.
     */
    public static Expression rewrite(Expression expression) {
        if (expression instanceof Expression.Constant) {
            return Expression.not(Expression.constant(!expression.constantValue()));
        }
        if (expression instanceof Expression.Variable) {
            return Expression.not(Expression.not(expression));
        }
        if (expression instanceof Expression.Not) {
            return Expression.not(rewrite(((Expression.Not) expression).child()));
        }
        Expression.Binary binary = (Expression.Binary) expression;
        Expression left = rewrite(binary.left());
        Expression right = rewrite(binary.right());
        switch (binary.type()) {
            case AND:
                return Expression.not(Expression.or(Expression.not(right), Expression.not(left)));
            case OR:
                return Expression.not(Expression.and(Expression.not(left), Expression.not(right)));
            case XOR:
                return Expression.or(Expression.and(left, Expression.not(right)),
                        Expression.and(Expression.not(left), right));
            case IMPLICATION:
                return Expression.or(right, Expression.not(left));
            case EQUIVALENCE:
                return Expression.not(Expression.xor(right, left));
            default:
                throw new AssertionError("Unknown type " + binary.type());
        }
    }

    public static List<String> shuffled(List<String> variables, Random random) {
        List<String> copy = new ArrayList<>(variables);
        Collections.shuffle(copy, random);
        return ImmutableList.copyOf(copy);
    }

    /**
     * Enumerates all assignments to {@code variableCount} variables; bit {@code i} of the index
     * is the value of variable {@code i}.
     */
    public static boolean[] assignment(int index, int variableCount) {
        boolean[] assignment = new boolean[variableCount];
        for (int i = 0; i < variableCount; i++) {
            assignment[i] = (index & (1 << i)) != 0;
        }
        return assignment;
    }
}
