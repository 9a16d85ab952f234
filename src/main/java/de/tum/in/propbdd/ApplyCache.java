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
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Memoisation of the operations engine: binary results keyed by {@code (operator, left, right)}
 * and negation results keyed by the operand. Operands are keyed by reference, so entries keep their
 * operands reachable until the next {@link #invalidate()}.
 */
final class ApplyCache {
    private static final Logger logger = Logger.getLogger(ApplyCache.class.getName());

    private final Counters binaryCounters = new Counters("Binary");
    private final Counters negationCounters = new Counters("Negation");
    private final Map<BinaryKey, Node> binaryCache = new HashMap<>();
    private final Map<Node, Node> negationCache = new HashMap<>();

    @Nullable
    Node lookupBinary(Operator operator, Node left, Node right) {
        Node result = binaryCache.get(new BinaryKey(operator, left, right));
        binaryCounters.lookup(result != null);
        return result;
    }

    void putBinary(Operator operator, Node left, Node right, Node result) {
        binaryCounters.stored++;
        binaryCache.put(new BinaryKey(operator, left, right), result);
    }

    @Nullable
    Node lookupNot(Node node) {
        Node result = negationCache.get(node);
        negationCounters.lookup(result != null);
        return result;
    }

    void putNot(Node node, Node result) {
        negationCounters.stored++;
        negationCache.put(node, result);
    }

    void invalidate() {
        logger.log(Level.FINER, "Dropping {0} binary and {1} negation results",
                new Object[] {binaryCache.size(), negationCache.size()});
        binaryCache.clear();
        negationCache.clear();
        binaryCounters.clears++;
        negationCounters.clears++;
    }

    int size() {
        return binaryCache.size() + negationCache.size();
    }

    String getStatistics() {
        return binaryCounters + "\n" + negationCounters;
    }

    private static final class BinaryKey {
        private final Operator operator;
        private final Node left;
        private final Node right;

        BinaryKey(Operator operator, Node left, Node right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof BinaryKey)) {
                return false;
            }
            BinaryKey that = (BinaryKey) object;
            return left == that.left && right == that.right && operator == that.operator;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(operator, left, right);
        }
    }

    private static final class Counters {
        private final String name;
        private int lookups = 0;
        private int hits = 0;
        private int stored = 0;
        private int clears = 0;

        Counters(String name) {
            this.name = name;
        }

        void lookup(boolean hit) {
            lookups++;
            if (hit) {
                hits++;
            }
        }

        @Override
        public String toString() {
            return String.format("%s cache: %d of %d lookups answered, %d results stored, cleared %d times",
                    name, hits, lookups, stored, clears);
        }
    }
}
