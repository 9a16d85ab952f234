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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * An assignment of truth values to some or all variables.
 *
 * <p>{@link #copy()} and {@link #extend(String, boolean)} always produce independent instances,
 * which allows traversals to branch on a variable without backtracking the assignment.</p>
 */
public final class Interpretation {
    private final Map<String, Boolean> assignments;

    public Interpretation() {
        this.assignments = new HashMap<>();
    }

    public Interpretation(Map<String, Boolean> assignments) {
        this.assignments = new HashMap<>(assignments);
    }

    public static Interpretation of(Map<String, Boolean> assignments) {
        return new Interpretation(assignments);
    }

    public void assign(String variable, boolean value) {
        assignments.put(variable, value);
    }

    /**
     * Returns the value of the given variable or {@code null} if it is not assigned.
     */
    @Nullable
    public Boolean get(String variable) {
        return assignments.get(variable);
    }

    /**
     * Returns the value of the given variable.
     *
     * @throws UnassignedVariableException if the variable is not assigned.
     */
    public boolean valueOf(String variable) {
        Boolean value = assignments.get(variable);
        if (value == null) {
            throw new UnassignedVariableException(variable);
        }
        return value;
    }

    public boolean isDefinedFor(String variable) {
        return assignments.containsKey(variable);
    }

    public boolean isComplete(Collection<String> variables) {
        return assignments.keySet().containsAll(variables);
    }

    public Interpretation copy() {
        return new Interpretation(assignments);
    }

    /**
     * Returns a new interpretation which additionally assigns {@code value} to {@code variable}. This
     * interpretation is left unchanged.
     */
    public Interpretation extend(String variable, boolean value) {
        Interpretation extended = copy();
        extended.assign(variable, value);
        return extended;
    }

    public Set<String> variables() {
        return Collections.unmodifiableSet(assignments.keySet());
    }

    public Map<String, Boolean> asMap() {
        return Collections.unmodifiableMap(assignments);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Interpretation)) {
            return false;
        }
        Interpretation that = (Interpretation) object;
        return Objects.equals(assignments, that.assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return new TreeMap<>(assignments).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "I(", ")"));
    }
}
