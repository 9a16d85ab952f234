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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

import java.util.List;
import org.junit.jupiter.api.Test;

public class DotWriterTest {
    @Test
    public void testSingleVariable() {
        Diagram diagram = Diagram.parse("p");
        Node root = diagram.root();
        String dot = DotWriter.toDot(diagram);

        assertThat(dot, startsWith("digraph BDD {\n  rankdir=TB;\n"));
        assertThat(dot, containsString("label=\"p\";"));
        assertThat(dot, containsString("n" + root.id() + " [label=\"p\", shape=ellipse"));
        assertThat(dot, containsString("n" + root.id() + " -> n" + Node.FALSE.id() + " [style=dotted"));
        assertThat(dot, containsString("n" + root.id() + " -> n" + Node.TRUE.id() + " [style=solid"));
        assertThat(dot, containsString("fillcolor=green"));
        assertThat(dot, containsString("fillcolor=red"));
        assertThat(dot, endsWith("}\n"));
    }

    @Test
    public void testSharedNodesAreEmittedOnce() {
        Diagram diagram = Diagram.parse("(p & q) | (~p & q)", List.of("p", "q"));
        diagram.reduce();
        String dot = DotWriter.toDot(diagram);
        assertThat(dot.split("->", -1).length - 1, is(2));
        assertThat(dot, not(containsString("label=\"p\", shape")));
    }

    @Test
    public void testEmptyDiagram() {
        assertThat(DotWriter.toDot(Diagram.empty()), is("digraph BDD {\n  rankdir=TB;\n}\n"));
    }

    @Test
    public void testDiagramWithoutFormula() {
        BddOperations operations = new BddOperations();
        Diagram diagram = Diagram.ofRoot(operations.variable("x"), List.of("x"));
        assertThat(DotWriter.toDot(diagram), not(containsString("  label=")));
    }
}
