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

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Abstract syntax tree of a propositional formula.
 *
 * <p>The set of node kinds is closed: {@link Variable}, {@link Not} and {@link BinaryOperation}
 * with one of the four {@link Connective}s. Instances are immutable trees, equality is structural.</p>
 */
@SuppressWarnings("AccessingNonPublicFieldOfAnotherObject")
public abstract class Formula {
    Formula() {
        // Only the nested variants
    }

    public static Formula variable(String name) {
        return new Variable(name);
    }

    public static Formula not(Formula operand) {
        return new Not(operand);
    }

    public static Formula and(Formula left, Formula right) {
        return new BinaryOperation(left, right, Connective.AND);
    }

    public static Formula or(Formula left, Formula right) {
        return new BinaryOperation(left, right, Connective.OR);
    }

    public static Formula implies(Formula left, Formula right) {
        return new BinaryOperation(left, right, Connective.IMPLIES);
    }

    public static Formula iff(Formula left, Formula right) {
        return new BinaryOperation(left, right, Connective.IFF);
    }

    /**
     * Evaluates this formula.
     *
     * @throws UnassignedVariableException if a variable of this formula has no value.
     */
    public abstract boolean evaluate(Interpretation interpretation);

    abstract void gatherVariables(Set<String> set);

    /**
     * Returns all variables occurring in this formula in lexicographic order.
     */
    public SortedSet<String> variables() {
        SortedSet<String> set = new TreeSet<>();
        gatherVariables(set);
        return Collections.unmodifiableSortedSet(set);
    }

    public enum Connective {
        AND("∧", Operator.AND),
        OR("∨", Operator.OR),
        IMPLIES("→", Operator.IMPLIES),
        IFF("↔", Operator.IFF);

        private final String symbol;
        private final Operator operator;

        Connective(String symbol, Operator operator) {
            this.symbol = symbol;
            this.operator = operator;
        }

        public String symbol() {
            return symbol;
        }

        public Operator operator() {
            return operator;
        }
    }

    public static final class Variable extends Formula {
        private final String name;

        Variable(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String name() {
            return name;
        }

        @Override
        public boolean evaluate(Interpretation interpretation) {
            return interpretation.valueOf(name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            set.add(name);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            Variable that = (Variable) object;
            return name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash("var", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Not extends Formula {
        private final Formula operand;

        Not(Formula operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        public Formula operand() {
            return operand;
        }

        @Override
        public boolean evaluate(Interpretation interpretation) {
            return !operand.evaluate(interpretation);
        }

        @Override
        void gatherVariables(Set<String> set) {
            operand.gatherVariables(set);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            Not that = (Not) object;
            return operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash("not", operand);
        }

        @Override
        public String toString() {
            return "¬" + operand;
        }
    }

    public static final class BinaryOperation extends Formula {
        private final Formula left;
        private final Formula right;
        private final Connective connective;

        BinaryOperation(Formula left, Formula right, Connective connective) {
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.connective = connective;
        }

        public Formula left() {
            return left;
        }

        public Formula right() {
            return right;
        }

        public Connective connective() {
            return connective;
        }

        @Override
        public boolean evaluate(Interpretation interpretation) {
            switch (connective) {
                case AND:
                    return left.evaluate(interpretation) && right.evaluate(interpretation);
                case OR:
                    return left.evaluate(interpretation) || right.evaluate(interpretation);
                case IMPLIES:
                    return !left.evaluate(interpretation) || right.evaluate(interpretation);
                case IFF:
                    return left.evaluate(interpretation) == right.evaluate(interpretation);
                default:
                    throw new IllegalStateException("Unknown connective " + connective);
            }
        }

        @Override
        void gatherVariables(Set<String> set) {
            left.gatherVariables(set);
            right.gatherVariables(set);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof BinaryOperation)) {
                return false;
            }
            BinaryOperation that = (BinaryOperation) object;
            return connective == that.connective && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(connective.symbol(), left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + connective.symbol() + " " + right + ")";
        }
    }
}
