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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Hash-consing table mapping the signature {@code (label, low, high)} of a decision node to its
 * canonical instance. Successors are compared by identity, so two signatures only coincide if they
 * refer to the very same successor objects.
 *
 * <p>The scope of a table is one reduction pass or one operations engine, there is no global table.
 * Structurally identical nodes of unrelated diagrams thus are distinct objects.</p>
 */
final class UniqueTable {
    private final Map<Signature, Node.Decision> table = new HashMap<>();
    private int hitCount = 0;

    @Nullable
    Node.Decision lookup(String label, Node low, Node high) {
        Node.Decision existing = table.get(new Signature(label, low, high));
        if (existing != null) {
            hitCount++;
        }
        return existing;
    }

    Node.Decision register(String label, Node low, Node high) {
        Node.Decision node = new Node.Decision(label, low, high);
        Node.Decision previous = table.put(new Signature(label, low, high), node);
        assert previous == null : "Duplicate signature " + node;
        return node;
    }

    /**
     * Returns the canonical node with the given signature, creating it if necessary.
     */
    Node.Decision makeNode(String label, Node low, Node high) {
        Node.Decision existing = lookup(label, low, high);
        return existing == null ? register(label, low, high) : existing;
    }

    int size() {
        return table.size();
    }

    int hitCount() {
        return hitCount;
    }

    void clear() {
        table.clear();
        hitCount = 0;
    }

    private static final class Signature {
        private final String label;
        private final Node low;
        private final Node high;
        private final int hash;

        Signature(String label, Node low, Node high) {
            this.label = label;
            this.low = low;
            this.high = high;
            this.hash = HashUtil.hash(label, low, high);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Signature)) {
                return false;
            }
            Signature that = (Signature) object;
            return low == that.low && high == that.high && label.equals(that.label);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
