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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * A binary decision diagram: a root into a (possibly shared) graph of {@link Node}s together with
 * the variable order the graph was built under and, if known, the formula it represents.
 *
 * <p>All queries traverse the graph and visit shared nodes only once. The only mutating operation
 * is {@link #reduce()}, which replaces the root by the root of the canonical reduced graph.</p>
 */
public final class Diagram {
    private static final BigInteger TWO = BigInteger.ONE.add(BigInteger.ONE);

    @Nullable
    private final Formula formula;
    private final List<String> variableOrder;
    @Nullable
    private Node root;

    Diagram(@Nullable Formula formula, List<String> variableOrder, @Nullable Node root) {
        this.formula = formula;
        this.variableOrder = List.copyOf(variableOrder);
        this.root = root;
    }

    /**
     * Builds the (unreduced) diagram of {@code formula}, ordering its variables lexicographically.
     */
    public static Diagram of(Formula formula) {
        return BddFactory.buildDiagramBuilder().build(formula);
    }

    public static Diagram of(Formula formula, List<String> variableOrder) {
        return BddFactory.buildDiagramBuilder().build(formula, variableOrder);
    }

    /**
     * Parses {@code text} and builds the diagram of the resulting formula.
     *
     * @throws FormulaSyntaxException if the text is not a well-formed formula.
     */
    public static Diagram parse(String text) {
        return of(FormulaParser.parse(text));
    }

    public static Diagram parse(String text, List<String> variableOrder) {
        return of(FormulaParser.parse(text), variableOrder);
    }

    /**
     * Wraps a graph computed elsewhere, e.g. by {@link BddOperations}. The diagram has no formula.
     */
    public static Diagram ofRoot(Node root, List<String> variableOrder) {
        return new Diagram(null, variableOrder, root);
    }

    public static Diagram empty() {
        return new Diagram(null, List.of(), null);
    }

    @Nullable
    public Formula formula() {
        return formula;
    }

    public List<String> variableOrder() {
        return variableOrder;
    }

    @Nullable
    public Node root() {
        return root;
    }

    Node requireRoot() {
        Node node = root;
        if (node == null) {
            throw new EmptyDiagramException();
        }
        return node;
    }

    /**
     * Evaluates the represented function by following the edges selected by {@code interpretation}.
     *
     * @throws EmptyDiagramException if this diagram has no root.
     * @throws UnassignedVariableException if a variable tested along the path has no value.
     */
    public boolean evaluate(Interpretation interpretation) {
        Node current = requireRoot();
        while (!current.isTerminal()) {
            current = interpretation.valueOf(current.label()) ? current.high() : current.low();
        }
        return current.value();
    }

    /**
     * Determines whether some path leads to the {@code true} terminal.
     */
    public boolean isSatisfiable() {
        return reaches(requireRoot(), Node.TRUE);
    }

    /**
     * Determines whether every path leads to the {@code true} terminal.
     */
    public boolean isValid() {
        Node node = requireRoot();
        return node == Node.TRUE || !reaches(node, Node.FALSE);
    }

    private static boolean reaches(Node start, Node.Terminal target) {
        Set<Node> visited = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node == target) {
                return true;
            }
            if (node.isTerminal() || !visited.add(node)) {
                continue;
            }
            stack.push(node.high());
            stack.push(node.low());
        }
        return false;
    }

    /**
     * Counts the distinct nodes of this diagram, terminals included.
     */
    public int countNodes() {
        return allNodes().size();
    }

    /**
     * Returns the distinct nodes of this diagram in depth-first order, low successors first.
     */
    public List<Node> allNodes() {
        List<Node> nodes = new ArrayList<>();
        if (root == null) {
            return nodes;
        }
        Set<Node> visited = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            nodes.add(node);
            if (!node.isTerminal()) {
                stack.push(node.high());
                stack.push(node.low());
            }
        }
        return nodes;
    }

    /**
     * Checks that no decision node is redundant and no two decision nodes share their signature.
     * A diagram without root is considered reduced.
     */
    public boolean isReduced() {
        Set<List<Object>> signatures = new HashSet<>();
        for (Node node : allNodes()) {
            if (node.isTerminal()) {
                continue;
            }
            if (node.isRedundant()) {
                return false;
            }
            // Successors compare by reference
            if (!signatures.add(List.of(node.label(), node.low(), node.high()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks that every variable tested by the graph belongs to the variable order and that every
     * path tests the variables in that order. A diagram without root respects any order.
     */
    boolean respectsOrder() {
        Map<String, Integer> levels = levels();
        for (Node node : allNodes()) {
            if (node.isTerminal()) {
                continue;
            }
            Integer level = levels.get(node.label());
            if (level == null) {
                return false;
            }
            for (Node successor : List.of(node.low(), node.high())) {
                if (!successor.isTerminal() && levels.getOrDefault(successor.label(), -1) <= level) {
                    return false;
                }
            }
        }
        return true;
    }

    private Map<String, Integer> levels() {
        Map<String, Integer> levels = new HashMap<>();
        for (int i = 0; i < variableOrder.size(); i++) {
            levels.put(variableOrder.get(i), i);
        }
        return levels;
    }

    /**
     * Replaces this diagram's graph by its canonical reduced form.
     *
     * @return Statistics about the reduction.
     */
    public ReductionStatistics reduce() {
        return reduce(new DiagramReducer());
    }

    ReductionStatistics reduce(DiagramReducer reducer) {
        if (root == null) {
            return ReductionStatistics.empty();
        }
        int nodesBefore = countNodes();
        root = reducer.reduce(root);
        return ImmutableReductionStatistics.builder()
                .nodesRemoved(reducer.nodesRemoved())
                .nodesMerged(reducer.nodesMerged())
                .nodesBefore(nodesBefore)
                .nodesAfter(countNodes())
                .build();
    }

    /**
     * Returns the variables tested by some node of this diagram.
     */
    public SortedSet<String> support() {
        SortedSet<String> support = new TreeSet<>();
        for (Node node : allNodes()) {
            if (!node.isTerminal()) {
                support.add(node.label());
            }
        }
        return support;
    }

    /**
     * Returns the assignment along some path to the {@code true} terminal. Variables not tested on
     * that path are left unassigned.
     *
     * @throws NoSuchElementException if there is no satisfying assignment.
     */
    public Interpretation satisfyingAssignment() {
        Node current = requireRoot();
        Map<Node, Boolean> satisfiable = new HashMap<>();
        if (!canReachTrue(current, satisfiable)) {
            throw new NoSuchElementException("Diagram has no satisfying assignment");
        }
        Interpretation path = new Interpretation();
        while (!current.isTerminal()) {
            if (canReachTrue(current.low(), satisfiable)) {
                path.assign(current.label(), false);
                current = current.low();
            } else {
                path.assign(current.label(), true);
                current = current.high();
            }
        }
        assert current == Node.TRUE;
        return path;
    }

    private static boolean canReachTrue(Node node, Map<Node, Boolean> satisfiable) {
        if (node.isTerminal()) {
            return node.value();
        }
        Boolean known = satisfiable.get(node);
        if (known != null) {
            return known;
        }
        boolean result = canReachTrue(node.low(), satisfiable) || canReachTrue(node.high(), satisfiable);
        satisfiable.put(node, result);
        return result;
    }

    /**
     * Counts the assignments to all variables of the variable order under which this diagram
     * evaluates to {@code true}.
     *
     * @throws IllegalStateException if the graph tests a variable outside the order or violates it.
     */
    public BigInteger countSatisfyingAssignments() {
        Node node = requireRoot();
        Map<String, Integer> levels = levels();
        Map<Node, BigInteger> counts = new HashMap<>();
        BigInteger count = countRecursive(node, levels, counts);
        return count.multiply(TWO.pow(level(node, levels)));
    }

    // Number of satisfying assignments of the variables from the node's level on
    private BigInteger countRecursive(Node node, Map<String, Integer> levels, Map<Node, BigInteger> counts) {
        if (node.isTerminal()) {
            return node.value() ? BigInteger.ONE : BigInteger.ZERO;
        }
        BigInteger known = counts.get(node);
        if (known != null) {
            return known;
        }
        int level = level(node, levels);
        BigInteger result = BigInteger.ZERO;
        for (Node successor : List.of(node.low(), node.high())) {
            int successorLevel = level(successor, levels);
            if (successorLevel <= level) {
                throw new IllegalStateException("Variable " + successor.label() + " tested below "
                        + node.label() + ", violating the order " + variableOrder);
            }
            BigInteger skipped = TWO.pow(successorLevel - level - 1);
            result = result.add(countRecursive(successor, levels, counts).multiply(skipped));
        }
        counts.put(node, result);
        return result;
    }

    private int level(Node node, Map<String, Integer> levels) {
        if (node.isTerminal()) {
            return variableOrder.size();
        }
        Integer level = levels.get(node.label());
        if (level == null) {
            throw new IllegalStateException("Variable " + node.label() + " is not part of the order " + variableOrder);
        }
        return level;
    }

    @Override
    public String toString() {
        return "BDD(formula=" + formula + ", nodes=" + countNodes() + ", vars=" + variableOrder + ")";
    }
}
