/*
 * This file is part of PropBDD.
 * Copyright (c) 2024 The PropBDD contributors.
 *
 * PropBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PropBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PropBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.propbdd;

import java.util.List;

/**
 * Renders diagrams in the Graphviz DOT language. Terminals are drawn as filled boxes, decisions as
 * ellipses, low edges dotted and high edges solid. Shared nodes are emitted once, keyed by their id.
 */
public final class DotWriter {
    private DotWriter() {}

    public static String toDot(Diagram diagram) {
        List<Node> nodes = diagram.allNodes();
        StringBuilder builder = new StringBuilder(64 * (nodes.size() + 1));
        builder.append("digraph BDD {\n  rankdir=TB;\n");
        if (diagram.formula() != null) {
            builder.append("  label=\"").append(escape(String.valueOf(diagram.formula()))).append("\";\n");
        }
        for (Node node : nodes) {
            if (node.isTerminal()) {
                builder.append(String.format(
                        "  n%d [label=\"%s\", shape=box, style=filled, fillcolor=%s, fontcolor=white];%n",
                        node.id(), node.label(), node.value() ? "green" : "red"));
            } else {
                builder.append(String.format(
                        "  n%d [label=\"%s\", shape=ellipse, style=filled, fillcolor=lightblue];%n",
                        node.id(), escape(node.label())));
                builder.append(String.format(
                        "  n%d -> n%d [style=dotted, color=red, label=\"F\"];%n", node.id(), node.low().id()));
                builder.append(String.format(
                        "  n%d -> n%d [style=solid, color=green, label=\"T\"];%n", node.id(), node.high().id()));
            }
        }
        return builder.append("}\n").toString();
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
