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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class NodeTest {
    @Test
    public void testTerminals() {
        assertThat(Node.terminal(true), is(sameInstance(Node.TRUE)));
        assertThat(Node.terminal(false), is(sameInstance(Node.FALSE)));
        assertThat(Node.TRUE.isTerminal(), is(true));
        assertThat(Node.TRUE.value(), is(true));
        assertThat(Node.FALSE.value(), is(false));
        assertThat(Node.TRUE.label(), is("T"));
        assertThat(Node.FALSE.label(), is("F"));
        assertThrows(UnsupportedOperationException.class, Node.TRUE::low);
    }

    @Test
    public void testDecision() {
        Node node = new Node.Decision("p", Node.FALSE, Node.TRUE);
        assertThat(node.isTerminal(), is(false));
        assertThat(node.label(), is("p"));
        assertThat(node.low(), is(sameInstance(Node.FALSE)));
        assertThat(node.high(), is(sameInstance(Node.TRUE)));
        assertThat(node.isRedundant(), is(false));
        assertThrows(UnsupportedOperationException.class, node::value);
    }

    @Test
    public void testIdsAreDistinct() {
        Node first = new Node.Decision("p", Node.FALSE, Node.TRUE);
        Node second = new Node.Decision("p", Node.FALSE, Node.TRUE);
        assertThat(first.id(), is(not(second.id())));
        assertThat(first.id(), is(not(Node.TRUE.id())));
        assertThat(first.id(), is(not(Node.FALSE.id())));
    }

    @Test
    public void testRedundant() {
        assertThat(new Node.Decision("p", Node.TRUE, Node.TRUE).isRedundant(), is(true));
        Node left = new Node.Decision("q", Node.FALSE, Node.TRUE);
        Node right = new Node.Decision("q", Node.FALSE, Node.TRUE);
        assertThat(new Node.Decision("p", left, right).isRedundant(), is(true));
        assertThat(Node.TRUE.isRedundant(), is(false));
    }

    @Test
    public void testIsomorphic() {
        Node first = new Node.Decision("p", new Node.Decision("q", Node.FALSE, Node.TRUE), Node.TRUE);
        Node second = new Node.Decision("p", new Node.Decision("q", Node.FALSE, Node.TRUE), Node.TRUE);
        Node different = new Node.Decision("p", new Node.Decision("r", Node.FALSE, Node.TRUE), Node.TRUE);
        assertThat(Node.isomorphic(first, second), is(true));
        assertThat(Node.isomorphic(first, different), is(false));
        assertThat(Node.isomorphic(Node.TRUE, Node.TRUE), is(true));
        assertThat(Node.isomorphic(Node.TRUE, Node.FALSE), is(false));
        assertThat(Node.isomorphic(first, Node.TRUE), is(false));
    }
}
