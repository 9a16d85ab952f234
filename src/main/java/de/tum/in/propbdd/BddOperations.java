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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Boolean operations on decision diagrams via Shannon expansion.
 *
 * <p>All results are built through this engine's own unique table and are therefore reduced, and
 * structurally equal results of one engine are identical objects. Results of different engines are
 * never shared. Inputs are never modified and need not be reduced.</p>
 *
 * <p>The variable tested at the top of a result is the smaller of the two operand variables with
 * respect to the engine's variable order, which is lexicographic unless specified otherwise. Node
 * operands should be ordered consistently with it, otherwise the result still evaluates correctly
 * but is not canonical. The whole-diagram operations first rebuild operands that test their
 * variables in a different order, so their results always follow the engine's order.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
/* Implementation notes:
 * - The structure of apply, not and restrict is the same: cache lookup, case split on the top
 *   variable, recursion on the cofactors and hash-consed node creation.
 * - Since every node produced here comes out of the unique table, identity is structural equality
 *   for results, which makes the redundancy check in makeNode a reference comparison.
 */
@SuppressWarnings({"PMD.GodClass", "PMD.AvoidReassigningParameters", "AssignmentToMethodParameter"})
public final class BddOperations {
    private static final Logger logger = Logger.getLogger(BddOperations.class.getName());

    private final Comparator<String> variableOrder;
    private final UniqueTable uniqueTable = new UniqueTable();
    private final ApplyCache cache = new ApplyCache();
    private final Level statisticsLevel;

    public BddOperations() {
        this(Comparator.naturalOrder());
    }

    public BddOperations(Comparator<String> variableOrder) {
        this(variableOrder, false);
    }

    BddOperations(Comparator<String> variableOrder, boolean logStatistics) {
        this.variableOrder = variableOrder;
        this.statisticsLevel = logStatistics ? Level.INFO : Level.FINE;
    }

    /**
     * Returns a comparator ordering variables by their position in the given list. Variables not in
     * the list come last, lexicographically.
     */
    static Comparator<String> orderOf(List<String> order) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.putIfAbsent(order.get(i), i);
        }
        return Comparator.<String>comparingInt(variable -> index.getOrDefault(variable, Integer.MAX_VALUE))
                .thenComparing(Comparator.naturalOrder());
    }

    public Comparator<String> variableOrder() {
        return variableOrder;
    }

    /**
     * Returns the node representing the single variable {@code name}.
     */
    public Node variable(String name) {
        return makeNode(name, Node.FALSE, Node.TRUE);
    }

    /**
     * Constructs the node representing {@code left OPERATOR right}.
     *
     * @throws UnknownOperatorException if {@code operator} is not one of the supported operators.
     */
    public Node apply(String operator, Node left, Node right) {
        return apply(Operator.fromSymbol(operator), left, right);
    }

    /**
     * Constructs the node representing {@code left OPERATOR right}.
     */
    public Node apply(Operator operator, Node left, Node right) {
        return applyRecursive(operator, left, right);
    }

    private Node applyRecursive(Operator operator, Node left, Node right) {
        if (operator.isCommutative() && right.id() < left.id()) {
            Node swap = left;
            left = right;
            right = swap;
        }

        Node cached = cache.lookupBinary(operator, left, right);
        if (cached != null) {
            return cached;
        }

        Node result;
        if (left.isTerminal() && right.isTerminal()) {
            result = Node.terminal(operator.apply(left.value(), right.value()));
        } else {
            Node constant = shortCircuit(operator, left, right);
            if (constant == null) {
                result = expand(operator, left, right);
            } else {
                result = constant;
            }
        }
        cache.putBinary(operator, left, right, result);
        return result;
    }

    private Node expand(Operator operator, Node left, Node right) {
        assert !left.isTerminal() || !right.isTerminal();

        String variable;
        Node leftLow;
        Node leftHigh;
        Node rightLow;
        Node rightHigh;
        int comparison;
        if (left.isTerminal()) {
            comparison = 1;
        } else if (right.isTerminal()) {
            comparison = -1;
        } else {
            comparison = variableOrder.compare(left.label(), right.label());
        }
        if (comparison <= 0) {
            variable = left.label();
            leftLow = left.low();
            leftHigh = left.high();
            if (comparison == 0) {
                rightLow = right.low();
                rightHigh = right.high();
            } else {
                rightLow = right;
                rightHigh = right;
            }
        } else {
            variable = right.label();
            leftLow = left;
            leftHigh = left;
            rightLow = right.low();
            rightHigh = right.high();
        }

        Node low = applyRecursive(operator, leftLow, rightLow);
        Node high = applyRecursive(operator, leftHigh, rightHigh);
        return makeNode(variable, low, high);
    }

    /**
     * Returns the result if one terminal operand alone determines it.
     */
    @Nullable
    private static Node shortCircuit(Operator operator, Node left, Node right) {
        switch (operator) {
            case AND:
                return left == Node.FALSE || right == Node.FALSE ? Node.FALSE : null;
            case OR:
                return left == Node.TRUE || right == Node.TRUE ? Node.TRUE : null;
            case IMPLIES:
                return left == Node.FALSE || right == Node.TRUE ? Node.TRUE : null;
            default:
                return null;
        }
    }

    /**
     * Constructs the node representing {@code NOT node}.
     */
    public Node applyNot(Node node) {
        if (node.isTerminal()) {
            return Node.terminal(!node.value());
        }
        Node cached = cache.lookupNot(node);
        if (cached != null) {
            return cached;
        }
        Node low = applyNot(node.low());
        Node high = applyNot(node.high());
        Node result = makeNode(node.label(), low, high);
        cache.putNot(node, result);
        return result;
    }

    /**
     * Constructs the node representing {@code IF condition THEN thenNode ELSE elseNode}.
     */
    public Node ifThenElse(Node condition, Node thenNode, Node elseNode) {
        Node positive = apply(Operator.AND, condition, thenNode);
        Node negative = apply(Operator.AND, applyNot(condition), elseNode);
        return apply(Operator.OR, positive, negative);
    }

    /**
     * Computes the cofactor of {@code node} where {@code variable} is fixed to {@code value}.
     */
    public Node restrict(Node node, String variable, boolean value) {
        return restrictRecursive(node, variable, value, new HashMap<>());
    }

    private Node restrictRecursive(Node node, String variable, boolean value, Map<Node, Node> restricted) {
        if (node.isTerminal()) {
            return node;
        }
        Node known = restricted.get(node);
        if (known != null) {
            return known;
        }
        Node result;
        if (node.label().equals(variable)) {
            result = restrictRecursive(value ? node.high() : node.low(), variable, value, restricted);
        } else {
            Node low = restrictRecursive(node.low(), variable, value, restricted);
            Node high = restrictRecursive(node.high(), variable, value, restricted);
            result = makeNode(node.label(), low, high);
        }
        restricted.put(node, result);
        return result;
    }

    private Node makeNode(String variable, Node low, Node high) {
        assert (low == high) == Node.isomorphic(low, high);
        if (low == high) {
            return low;
        }
        return uniqueTable.makeNode(variable, low, high);
    }

    /**
     * Combines two diagrams. The result tests its variables in this engine's order and carries the
     * union of both variable orders, sorted by that order.
     */
    public Diagram apply(Operator operator, Diagram left, Diagram right) {
        Node root = apply(operator, conform(left.requireRoot()), conform(right.requireRoot()));
        return Diagram.ofRoot(root, mergeOrders(left.variableOrder(), right.variableOrder()));
    }

    public Diagram and(Diagram left, Diagram right) {
        return apply(Operator.AND, left, right);
    }

    public Diagram or(Diagram left, Diagram right) {
        return apply(Operator.OR, left, right);
    }

    public Diagram xor(Diagram left, Diagram right) {
        return apply(Operator.XOR, left, right);
    }

    public Diagram implies(Diagram left, Diagram right) {
        return apply(Operator.IMPLIES, left, right);
    }

    public Diagram iff(Diagram left, Diagram right) {
        return apply(Operator.IFF, left, right);
    }

    public Diagram not(Diagram diagram) {
        return Diagram.ofRoot(applyNot(diagram.requireRoot()), diagram.variableOrder());
    }

    public Diagram ifThenElse(Diagram condition, Diagram thenDiagram, Diagram elseDiagram) {
        Node root = ifThenElse(
                conform(condition.requireRoot()), conform(thenDiagram.requireRoot()), conform(elseDiagram.requireRoot()));
        List<String> order = mergeOrders(
                mergeOrders(condition.variableOrder(), thenDiagram.variableOrder()), elseDiagram.variableOrder());
        return Diagram.ofRoot(root, order);
    }

    public Diagram restrict(Diagram diagram, String variable, boolean value) {
        Node root = restrict(diagram.requireRoot(), variable, value);
        List<String> order = new ArrayList<>(diagram.variableOrder());
        order.remove(variable);
        return Diagram.ofRoot(root, order);
    }

    /**
     * Returns {@code node} if its graph tests variables in this engine's order, otherwise an
     * equivalent graph of this engine which does.
     */
    private Node conform(Node node) {
        if (followsOrder(node)) {
            return node;
        }
        logger.log(Level.FINE, "Rebuilding operand {0} in engine order", node);
        return rebuild(node, new HashMap<>());
    }

    private boolean followsOrder(Node root) {
        Set<Node> visited = new HashSet<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isTerminal() || !visited.add(node)) {
                continue;
            }
            for (Node successor : List.of(node.low(), node.high())) {
                if (!successor.isTerminal() && variableOrder.compare(node.label(), successor.label()) >= 0) {
                    return false;
                }
                stack.push(successor);
            }
        }
        return true;
    }

    private Node rebuild(Node node, Map<Node, Node> rebuilt) {
        if (node.isTerminal()) {
            return node;
        }
        Node known = rebuilt.get(node);
        if (known != null) {
            return known;
        }
        Node low = rebuild(node.low(), rebuilt);
        Node high = rebuild(node.high(), rebuilt);
        Node result = ifThenElse(variable(node.label()), high, low);
        rebuilt.put(node, result);
        return result;
    }

    private List<String> mergeOrders(List<String> first, List<String> second) {
        Set<String> union = new TreeSet<>(variableOrder);
        union.addAll(first);
        union.addAll(second);
        return new ArrayList<>(union);
    }

    /**
     * Checks whether the two diagrams denote the same boolean function.
     *
     * <p>Both diagrams are reduced (without modifying them) and compared structurally, which decides
     * equivalence since reduced diagrams are canonical for a fixed variable order. If the two
     * diagrams order their common variables differently, or one of them tests its variables out of
     * its declared order, a structural comparison is meaningless and the truth tables over the joint
     * variables are compared instead.</p>
     */
    public static boolean areEquivalent(Diagram first, Diagram second) {
        Node firstRoot = first.requireRoot();
        Node secondRoot = second.requireRoot();

        if (!consistentlyOrdered(first.variableOrder(), second.variableOrder())
                || !first.respectsOrder() || !second.respectsOrder()) {
            logger.log(Level.FINE, "Variable orders {0} and {1} disagree, comparing truth tables",
                    new Object[] {first.variableOrder(), second.variableOrder()});
            Set<String> variables = new TreeSet<>(first.variableOrder());
            variables.addAll(second.variableOrder());
            variables.addAll(first.support());
            variables.addAll(second.support());
            Iterator<Interpretation> interpretations = TruthTable.interpretations(new ArrayList<>(variables));
            while (interpretations.hasNext()) {
                Interpretation interpretation = interpretations.next();
                if (first.evaluate(interpretation) != second.evaluate(interpretation)) {
                    return false;
                }
            }
            return true;
        }

        Node firstReduced = first.isReduced() ? firstRoot : new DiagramReducer().reduce(firstRoot);
        Node secondReduced = second.isReduced() ? secondRoot : new DiagramReducer().reduce(secondRoot);
        return Node.isomorphic(firstReduced, secondReduced);
    }

    private static boolean consistentlyOrdered(List<String> first, List<String> second) {
        List<String> common = new ArrayList<>(first);
        common.retainAll(second);
        List<String> otherCommon = new ArrayList<>(second);
        otherCommon.retainAll(first);
        return common.equals(otherCommon);
    }

    /**
     * Drops all memoised results. The unique table is kept, so later results still share nodes with
     * earlier ones.
     */
    public void clearCache() {
        if (logger.isLoggable(statisticsLevel)) {
            logger.log(statisticsLevel, statistics());
        }
        cache.invalidate();
    }

    public int uniqueNodeCount() {
        return uniqueTable.size();
    }

    public int cacheSize() {
        return cache.size();
    }

    /**
     * Returns a string containing some statistics about this engine. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    public String statistics() {
        return String.format("Unique table: %d nodes, %d hits%n", uniqueTable.size(), uniqueTable.hitCount())
                + cache.getStatistics();
    }
}
