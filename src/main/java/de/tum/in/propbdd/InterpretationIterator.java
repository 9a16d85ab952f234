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

import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates all interpretations of the given variables in binary counting order, where the first
 * variable is the most significant bit, i.e. from all {@code false} to all {@code true}.
 */
final class InterpretationIterator implements Iterator<Interpretation> {
    private final List<String> variables;
    private final BitSet iteration;
    private int numSetBits = -1;

    InterpretationIterator(List<String> variables) {
        this.variables = List.copyOf(variables);
        this.iteration = new BitSet(variables.size());
    }

    @Override
    public boolean hasNext() {
        return numSetBits < variables.size();
    }

    @Override
    public Interpretation next() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return current();
        }

        if (numSetBits == variables.size()) {
            throw new NoSuchElementException("No next element");
        }

        // Binary increment, the last variable toggles fastest
        for (int index = variables.size() - 1; index >= 0; index--) {
            if (iteration.get(index)) {
                iteration.clear(index);
                numSetBits -= 1;
            } else {
                iteration.set(index);
                numSetBits += 1;
                break;
            }
        }
        return current();
    }

    private Interpretation current() {
        Interpretation interpretation = new Interpretation();
        for (int index = 0; index < variables.size(); index++) {
            interpretation.assign(variables.get(index), iteration.get(index));
        }
        return interpretation;
    }
}
