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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The truth table of a boolean function over a set of variables, obtained by evaluating the
 * function on every interpretation. This is exponential in the number of variables by nature and
 * only meant as reference for small functions.
 */
public final class TruthTable {
    private final List<String> variables;
    private final List<Row> rows;

    private TruthTable(List<String> variables, List<Row> rows) {
        this.variables = variables;
        this.rows = rows;
    }

    /**
     * Returns all interpretations of the given variables, from all {@code false} to all
     * {@code true}, the last variable changing fastest.
     */
    public static Iterator<Interpretation> interpretations(List<String> variables) {
        return new InterpretationIterator(variables);
    }

    public static TruthTable of(Collection<String> variables, Predicate<Interpretation> function) {
        List<String> sorted = List.copyOf(new TreeSet<>(variables));
        List<Row> rows = new ArrayList<>();
        interpretations(sorted).forEachRemaining(
                interpretation -> rows.add(new Row(interpretation, function.test(interpretation))));
        return new TruthTable(sorted, Collections.unmodifiableList(rows));
    }

    public static TruthTable of(Formula formula) {
        return of(formula.variables(), formula::evaluate);
    }

    /**
     * Tabulates the diagram over the variables of its order.
     */
    public static TruthTable of(Diagram diagram) {
        return of(diagram.variableOrder(), diagram::evaluate);
    }

    public List<String> variables() {
        return variables;
    }

    public List<Row> rows() {
        return rows;
    }

    public boolean isTautology() {
        return rows.stream().allMatch(Row::result);
    }

    public boolean isContradiction() {
        return rows.stream().noneMatch(Row::result);
    }

    public boolean isSatisfiable() {
        return rows.stream().anyMatch(Row::result);
    }

    /**
     * Returns the interpretations under which the function is true.
     */
    public List<Interpretation> models() {
        return rows.stream().filter(Row::result).map(Row::interpretation).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        String header = String.join(" | ", variables) + (variables.isEmpty() ? "" : " | ") + "Result";
        StringBuilder builder = new StringBuilder(header.length() * (rows.size() + 2))
                .append(header).append('\n')
                .append("-".repeat(header.length()));
        for (Row row : rows) {
            builder.append('\n');
            for (String variable : variables) {
                builder.append(row.interpretation().valueOf(variable) ? 'T' : 'F').append(" | ");
            }
            builder.append("  ").append(row.result() ? 'T' : 'F');
        }
        return builder.toString();
    }

    public static final class Row {
        private final Interpretation interpretation;
        private final boolean result;

        Row(Interpretation interpretation, boolean result) {
            this.interpretation = interpretation;
            this.result = result;
        }

        public Interpretation interpretation() {
            return interpretation.copy();
        }

        public boolean result() {
            return result;
        }

        @Override
        public String toString() {
            return interpretation + " -> " + result;
        }
    }
}
