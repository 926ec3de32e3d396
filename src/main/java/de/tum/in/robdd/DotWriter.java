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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the nodes reachable from a root in the Graphviz DOT language. The leaves are drawn as
 * boxes, decision nodes as circles labelled with their variable, low edges dashed and high edges
 * solid.
 */
public final class DotWriter {
    private DotWriter() {}

    public static String toDot(DecisionDiagram diagram, int root) {
        StringBuilder builder = new StringBuilder(128);
        try {
            write(diagram, root, builder);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return builder.toString();
    }

    public static void write(DecisionDiagram diagram, int root, Appendable output) throws IOException {
        // Collect first so that the diagram is not queried from inside its own traversal
        List<Integer> nodes = new ArrayList<>();
        diagram.forEachNodeBelowOnce(root, (node, variable) -> nodes.add(node));

        output.append("digraph ROBDD {\n");
        output.append("  rankdir=TB;\n");
        output.append("  ").append(Integer.toString(diagram.falseNode()))
                .append(" [label=\"0\", shape=box, style=filled, fillcolor=\"#ffcccc\"];\n");
        output.append("  ").append(Integer.toString(diagram.trueNode()))
                .append(" [label=\"1\", shape=box, style=filled, fillcolor=\"#ccffcc\"];\n");
        for (int node : nodes) {
            String name = diagram.variableName(diagram.variableOf(node));
            output.append("  ").append(Integer.toString(node))
                    .append(" [label=\"").append(escape(name)).append("\", shape=circle];\n");
        }
        for (int node : nodes) {
            output.append("  ").append(Integer.toString(node)).append(" -> ")
                    .append(Integer.toString(diagram.low(node)))
                    .append(" [label=\"0\", style=dashed, color=red];\n");
            output.append("  ").append(Integer.toString(node)).append(" -> ")
                    .append(Integer.toString(diagram.high(node)))
                    .append(" [label=\"1\", style=solid, color=blue];\n");
        }
        output.append("}\n");
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
