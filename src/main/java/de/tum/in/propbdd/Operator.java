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

import java.util.Locale;

/**
 * The binary operators supported by {@link BddOperations#apply(Operator, Node, Node)}.
 */
public enum Operator {
    AND(true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left && right;
        }
    },
    OR(true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left || right;
        }
    },
    XOR(true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left ^ right;
        }
    },
    IMPLIES(false) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return !left || right;
        }
    },
    IFF(true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left == right;
        }
    };

    private final boolean commutative;

    Operator(boolean commutative) {
        this.commutative = commutative;
    }

    /**
     * The two-valued truth function of this operator.
     */
    public abstract boolean apply(boolean left, boolean right);

    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Resolves an operator by its name, case-insensitively.
     *
     * @throws UnknownOperatorException if the symbol does not name one of the supported operators.
     */
    public static Operator fromSymbol(String symbol) {
        switch (symbol.toUpperCase(Locale.ROOT)) {
            case "AND":
                return AND;
            case "OR":
                return OR;
            case "XOR":
                return XOR;
            case "IMPLIES":
                return IMPLIES;
            case "IFF":
                return IFF;
            default:
                throw new UnknownOperatorException(symbol);
        }
    }
}
