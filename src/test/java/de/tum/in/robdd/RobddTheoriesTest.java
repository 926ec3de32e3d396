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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the defining properties of reduced ordered diagrams on random expressions.
 */
@SuppressWarnings("checkstyle:javadoc")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RobddTheoriesTest {
    private static final Logger logger = Logger.getLogger(RobddTheoriesTest.class.getName());

    private static final int variableCount = 6;
    private static final int treeDepth = 6;
    private static final int expressionCount = 300;

    private static final List<String> variables = Generator.variables(variableCount);
    private static final VariableOrdering ordering = VariableOrdering.of(variables);
    private static final List<Expression> expressions;
    private static final Robdd shared;
    private static final List<Integer> roots;

    static {
        /* All data points are built once on the same engine, so that later tests can check that
         * equivalent expressions end up at the same node. */
        expressions = Generator.expressions(0, variables, treeDepth, expressionCount);
        shared = RobddFactory.buildRobdd();
        roots = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            roots.add(shared.build(expression, ordering));
        }
        logger.log(Level.INFO, "Built {0} expressions into {1} nodes",
                new Object[] {expressions.size(), shared.nodeCount()});
    }

    public static Stream<DataPoint> dataPoints() {
        List<DataPoint> points = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            points.add(new DataPoint(expressions.get(i), roots.get(i)));
        }
        return points.stream();
    }

    private static boolean evaluate(Expression expression, boolean[] assignment) {
        return expression.evaluate(name -> assignment[ordering.indexOf(name)]);
    }

    private static boolean isomorphic(DecisionDiagram first, int firstNode, DecisionDiagram second, int secondNode) {
        if (first.isLeaf(firstNode) || second.isLeaf(secondNode)) {
            return first.terminalValue(firstNode).equals(second.terminalValue(secondNode));
        }
        return first.variableName(first.variableOf(firstNode)).equals(second.variableName(second.variableOf(secondNode)))
                && isomorphic(first, first.low(firstNode), second, second.low(secondNode))
                && isomorphic(first, first.high(firstNode), second, second.high(secondNode));
    }

    @AfterAll
    public static void statistics() {
        logger.log(Level.FINE, shared.statistics());
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testPathSemantics(DataPoint dataPoint) {
        for (int i = 0; i < 1 << variableCount; i++) {
            boolean[] assignment = Generator.assignment(i, variableCount);
            assertThat(dataPoint.toString(), shared.evaluate(dataPoint.root, assignment),
                    is(evaluate(dataPoint.expression, assignment)));
        }
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testCanonicity(DataPoint dataPoint) {
        Expression rewritten = Generator.rewrite(dataPoint.expression);
        assertThat(rewritten, not(dataPoint.expression));
        assertThat(shared.build(rewritten, ordering), is(dataPoint.root));
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testReducedAndOrdered(DataPoint dataPoint) {
        shared.forEachNodeBelowOnce(dataPoint.root, (node, variable) -> {
            int low = shared.low(node);
            int high = shared.high(node);
            assertThat(low, not(high));
            if (!shared.isLeaf(low)) {
                assertThat(variable, lessThan(shared.variableOf(low)));
            }
            if (!shared.isLeaf(high)) {
                assertThat(variable, lessThan(shared.variableOf(high)));
            }
        });
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testSatisfyingAssignmentCount(DataPoint dataPoint) {
        long count = 0;
        for (int i = 0; i < 1 << variableCount; i++) {
            if (evaluate(dataPoint.expression, Generator.assignment(i, variableCount))) {
                count += 1;
            }
        }
        assertThat(shared.satisfyingAssignmentCount(dataPoint.root, variableCount), is(BigInteger.valueOf(count)));
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testIdempotence(DataPoint dataPoint) {
        Robdd first = RobddFactory.buildRobdd();
        Robdd second = RobddFactory.buildRobdd();
        int firstRoot = first.build(dataPoint.expression, ordering);
        int secondRoot = second.build(dataPoint.expression, ordering);
        assertThat(firstRoot, is(secondRoot));
        assertThat(first.nodeCount(), is(second.nodeCount()));
        assertThat(isomorphic(first, firstRoot, second, secondRoot), is(true));
        assertThat(isomorphic(first, firstRoot, shared, dataPoint.root), is(true));
    }

    @ParameterizedTest
    @MethodSource("dataPoints")
    public void testExpansionCacheDoesNotChangeResult(DataPoint dataPoint) {
        Robdd cached = RobddFactory.buildRobdd();
        Robdd uncached = RobddFactory.buildRobdd(ImmutableRobddConfiguration.builder()
                .useExpansionCache(false)
                .build());
        int cachedRoot = cached.build(dataPoint.expression, ordering);
        int uncachedRoot = uncached.build(dataPoint.expression, ordering);
        assertThat(cached.nodeCount(), is(uncached.nodeCount()));
        assertThat(isomorphic(cached, cachedRoot, uncached, uncachedRoot), is(true));
    }

    @Test
    public void testUniqueness() {
        Set<List<Integer>> triples = new HashSet<>();
        for (int node = 2; node < shared.nodeCount(); node++) {
            assertThat(triples.add(List.of(shared.variableOf(node), shared.low(node), shared.high(node))), is(true));
        }
        assertThat(shared.check(), is(true));
    }

    @Test
    public void testEquivalentExpressionsShareRoot() {
        for (int i = 0; i < expressions.size(); i++) {
            for (int j = i + 1; j < expressions.size(); j++) {
                boolean equivalent = true;
                for (int k = 0; k < 1 << variableCount && equivalent; k++) {
                    boolean[] assignment = Generator.assignment(k, variableCount);
                    equivalent = evaluate(expressions.get(i), assignment) == evaluate(expressions.get(j), assignment);
                }
                assertThat(expressions.get(i) + " / " + expressions.get(j), roots.get(i).equals(roots.get(j)),
                        is(equivalent));
            }
        }
    }

    @Test
    public void testRandomOrderings() {
        Random random = new Random(1L);
        for (Expression expression : expressions.subList(0, 50)) {
            VariableOrdering shuffled = VariableOrdering.of(Generator.shuffled(variables, random));
            Robdd robdd = RobddFactory.buildRobdd();
            int root = robdd.build(expression, shuffled);
            for (int i = 0; i < 1 << variableCount; i++) {
                boolean[] assignment = Generator.assignment(i, variableCount);
                boolean expected = expression.evaluate(name -> assignment[shuffled.indexOf(name)]);
                assertThat(robdd.evaluate(root, assignment), is(expected));
            }
        }
    }

    public static final class DataPoint {
        final Expression expression;
        final int root;

        DataPoint(Expression expression, int root) {
            this.expression = expression;
            this.root = root;
        }

        @Override
        public String toString() {
            return expression + " -> " + root;
        }
    }
}
