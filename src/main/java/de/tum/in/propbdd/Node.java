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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A node of a decision diagram, either one of the two terminals or a decision on a variable.
 *
 * <p>Nodes are immutable and may be shared by arbitrarily many parents. The terminals {@link #TRUE}
 * and {@link #FALSE} are the only terminal instances which ever exist. Decision nodes are only
 * created by the builder, the reducer and the operations engine, each of which hash-conses them in
 * its own {@link UniqueTable}.</p>
 *
 * <p>Every node carries an {@link #id()} for display, e.g. by renderers. Signatures, caches and
 * traversals identify nodes by reference, {@code Node} does not override {@link Object#equals}.</p>
 */
public abstract class Node {
    private static final AtomicLong idCounter = new AtomicLong(2);

    public static final Terminal FALSE = new Terminal(false, 0);
    public static final Terminal TRUE = new Terminal(true, 1);

    private final long id;

    Node(long id) {
        this.id = id;
    }

    static long nextId() {
        return idCounter.getAndIncrement();
    }

    public static Terminal terminal(boolean value) {
        return value ? TRUE : FALSE;
    }

    public final long id() {
        return id;
    }

    public abstract boolean isTerminal();

    /**
     * Returns the variable of a decision node, or {@code "T"} / {@code "F"} for the terminals.
     */
    public abstract String label();

    /**
     * Returns the value of a terminal.
     *
     * @throws UnsupportedOperationException if this is a decision node.
     */
    public abstract boolean value();

    /**
     * Returns the successor taken when the variable is {@code false}.
     *
     * @throws UnsupportedOperationException if this is a terminal.
     */
    public abstract Node low();

    /**
     * Returns the successor taken when the variable is {@code true}.
     *
     * @throws UnsupportedOperationException if this is a terminal.
     */
    public abstract Node high();

    /**
     * Determines whether both edges of this node lead to structurally equal sub-diagrams, i.e. the
     * decision does not influence the result.
     */
    public boolean isRedundant() {
        return !isTerminal() && isomorphic(low(), high());
    }

    /**
     * Checks whether the two given sub-diagrams are structurally equal: terminals are equal by value,
     * decisions if they test the same variable and have structurally equal successors.
     */
    public static boolean isomorphic(Node first, Node second) {
        if (first == second) {
            return true;
        }
        // Pairs of nodes already known to be equal, compared by reference
        Set<List<Node>> equalPairs = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(first);
        pending.push(second);
        while (!pending.isEmpty()) {
            Node right = pending.pop();
            Node left = pending.pop();
            if (left == right) {
                continue;
            }
            if (left.isTerminal() || right.isTerminal()) {
                // Terminals are singletons, so distinct objects can only differ
                return false;
            }
            if (!left.label().equals(right.label())) {
                return false;
            }
            if (!equalPairs.add(List.of(left, right))) {
                continue;
            }
            pending.push(left.low());
            pending.push(right.low());
            pending.push(left.high());
            pending.push(right.high());
        }
        return true;
    }

    public static final class Terminal extends Node {
        private final boolean value;

        private Terminal(boolean value, long id) {
            super(id);
            this.value = value;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String label() {
            return value ? "T" : "F";
        }

        @Override
        public boolean value() {
            return value;
        }

        @Override
        public Node low() {
            throw new UnsupportedOperationException("Terminal has no successors");
        }

        @Override
        public Node high() {
            throw new UnsupportedOperationException("Terminal has no successors");
        }

        @Override
        public String toString() {
            return "[" + label() + "]";
        }
    }

    public static final class Decision extends Node {
        private final String label;
        private final Node low;
        private final Node high;

        Decision(String label, Node low, Node high) {
            super(nextId());
            this.label = label;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean isTerminal() {
            return false;
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public boolean value() {
            throw new UnsupportedOperationException("Decision node " + label + " has no value");
        }

        @Override
        public Node low() {
            return low;
        }

        @Override
        public Node high() {
            return high;
        }

        @Override
        public String toString() {
            return String.format("Node(id=%d, label=%s, low=%d, high=%d)", id(), label, low.id(), high.id());
        }
    }
}
