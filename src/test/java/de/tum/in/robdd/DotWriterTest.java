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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DotWriterTest {
    @Test
    public void testConjunction() throws FormulaParser.InvalidFormatException {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(FormulaParser.parse("a & b"), List.of("a", "b"));
        String dot = DotWriter.toDot(robdd, root);

        assertThat(dot, startsWith("digraph ROBDD {"));
        assertThat(dot, endsWith("}\n"));
        assertThat(dot, containsString("0 [label=\"0\", shape=box"));
        assertThat(dot, containsString("1 [label=\"1\", shape=box"));
        assertThat(dot, containsString("3 [label=\"a\", shape=circle];"));
        assertThat(dot, containsString("2 [label=\"b\", shape=circle];"));
        assertThat(dot, containsString("3 -> 0 [label=\"0\", style=dashed, color=red];"));
        assertThat(dot, containsString("3 -> 2 [label=\"1\", style=solid, color=blue];"));
        assertThat(dot, containsString("2 -> 1 [label=\"1\", style=solid, color=blue];"));
    }

    @Test
    public void testOnlyReachableNodes() throws FormulaParser.InvalidFormatException, IOException {
        Robdd robdd = RobddFactory.buildRobdd();
        robdd.build(FormulaParser.parse("a ^ b"), List.of("a", "b"));
        int root = robdd.build(FormulaParser.parse("b"), List.of("a", "b"));

        StringWriter writer = new StringWriter();
        DotWriter.write(robdd, root, writer);
        String dot = writer.toString();
        assertThat(dot, containsString(root + " [label=\"b\""));
        assertThat(dot, not(containsString("label=\"a\"")));
    }

    @Test
    public void testLeafRoot() {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(Expression.constant(true), List.of());
        String dot = DotWriter.toDot(robdd, root);
        assertThat(dot, containsString("1 [label=\"1\""));
        assertThat(dot.contains("->"), is(false));
    }

    @Test
    public void testNamesAreEscaped() {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(Expression.variable("say \"hi\""), List.of("say \"hi\""));
        assertThat(DotWriter.toDot(robdd, root), containsString("[label=\"say \\\"hi\\\"\", shape=circle]"));
    }
}
