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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns formulas into diagrams under a fixed variable order.
 *
 * <p>With {@link BddConfiguration.BuildStrategy#TREE} the builder performs a case split on each
 * variable of the order in turn and evaluates the formula at full depth, which yields the complete
 * decision tree with {@code 2^n - 1} decision nodes and no sharing besides the two terminals. With
 * {@link BddConfiguration.BuildStrategy#APPLY} the diagram is instead composed along the syntax tree
 * and is reduced right away. Both denote the same function.</p>
 */
public final class DiagramBuilder {
    private static final Logger logger = Logger.getLogger(DiagramBuilder.class.getName());

    private final BddConfiguration configuration;

    DiagramBuilder(BddConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Builds the diagram of {@code formula}, ordering its variables lexicographically.
     */
    public Diagram build(Formula formula) {
        return build(formula, List.copyOf(formula.variables()));
    }

    /**
     * Builds the diagram of {@code formula} under the given variable order. The order may contain
     * variables which do not occur in the formula.
     *
     * @throws IllegalArgumentException if the order contains duplicates or misses a variable of the
     *     formula.
     */
    public Diagram build(Formula formula, List<String> variableOrder) {
        checkOrder(formula, variableOrder);

        Node root;
        switch (configuration.buildStrategy()) {
            case TREE:
                root = buildTree(formula, variableOrder, 0, new Interpretation());
                break;
            case APPLY:
                BddOperations operations =
                        new BddOperations(BddOperations.orderOf(variableOrder), configuration.logStatistics());
                root = compose(formula, operations);
                break;
            default:
                throw new IllegalStateException("Unknown strategy " + configuration.buildStrategy());
        }

        Diagram diagram = new Diagram(formula, variableOrder, root);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Built diagram for {0} with {1} nodes",
                    new Object[] {formula, diagram.countNodes()});
        }
        if (configuration.reduceOnBuild()) {
            diagram.reduce(new DiagramReducer(configuration.logStatistics()));
        }
        return diagram;
    }

    private static void checkOrder(Formula formula, List<String> variableOrder) {
        Set<String> seen = new HashSet<>();
        for (String variable : variableOrder) {
            if (!seen.add(variable)) {
                throw new IllegalArgumentException("Variable " + variable + " occurs twice in " + variableOrder);
            }
        }
        for (String variable : formula.variables()) {
            if (!seen.contains(variable)) {
                throw new IllegalArgumentException("Variable " + variable + " missing from " + variableOrder);
            }
        }
    }

    private static Node buildTree(Formula formula, List<String> order, int level, Interpretation partial) {
        if (level == order.size()) {
            return Node.terminal(formula.evaluate(partial));
        }
        String variable = order.get(level);
        Node low = buildTree(formula, order, level + 1, partial.extend(variable, false));
        Node high = buildTree(formula, order, level + 1, partial.extend(variable, true));
        return new Node.Decision(variable, low, high);
    }

    private static Node compose(Formula formula, BddOperations operations) {
        if (formula instanceof Formula.Variable) {
            return operations.variable(((Formula.Variable) formula).name());
        }
        if (formula instanceof Formula.Not) {
            return operations.applyNot(compose(((Formula.Not) formula).operand(), operations));
        }
        if (formula instanceof Formula.BinaryOperation) {
            Formula.BinaryOperation operation = (Formula.BinaryOperation) formula;
            Node left = compose(operation.left(), operations);
            Node right = compose(operation.right(), operations);
            return operations.apply(operation.connective().operator(), left, right);
        }
        throw new IllegalArgumentException("Unknown type " + formula.getClass().getSimpleName());
    }
}
