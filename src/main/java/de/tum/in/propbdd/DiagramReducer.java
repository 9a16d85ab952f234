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

/**
 * Transforms a decision graph into its canonical reduced form by eliminating redundant decisions and
 * merging decisions with identical signature, bottom-up.
 *
 * <p>The reducer never modifies the nodes it is given; it only creates new ones. Each call to
 * {@link #reduce(Node)} uses a fresh unique table.</p>
 */
public final class DiagramReducer {
    private static final Logger logger = Logger.getLogger(DiagramReducer.class.getName());

    private final UniqueTable uniqueTable = new UniqueTable();
    // Shared input nodes only need to be reduced once
    private final Map<Node, Node> reduced = new HashMap<>();
    private final Level statisticsLevel;
    private int nodesRemoved = 0;
    private int nodesMerged = 0;

    public DiagramReducer() {
        this(false);
    }

    DiagramReducer(boolean logStatistics) {
        this.statisticsLevel = logStatistics ? Level.INFO : Level.FINE;
    }

    /**
     * Returns the root of the reduced graph equivalent to the graph below {@code root}.
     */
    public Node reduce(Node root) {
        uniqueTable.clear();
        reduced.clear();
        nodesRemoved = 0;
        nodesMerged = 0;

        Node result = reduceRecursive(root);
        reduced.clear();
        logger.log(statisticsLevel, "Reduction removed {0} and merged {1} nodes, {2} unique nodes remain",
                new Object[] {nodesRemoved, nodesMerged, uniqueTable.size()});
        return result;
    }

    private Node reduceRecursive(Node node) {
        if (node.isTerminal()) {
            return Node.terminal(node.value());
        }
        Node known = reduced.get(node);
        if (known != null) {
            return known;
        }

        Node low = reduceRecursive(node.low());
        Node high = reduceRecursive(node.high());
        Node result;
        // Both successors are canonical within this pass, hence identity coincides with structural equality
        assert (low == high) == Node.isomorphic(low, high);
        if (low == high) {
            nodesRemoved++;
            result = low;
        } else {
            Node existing = uniqueTable.lookup(node.label(), low, high);
            if (existing == null) {
                result = uniqueTable.register(node.label(), low, high);
            } else {
                nodesMerged++;
                result = existing;
            }
        }
        reduced.put(node, result);
        return result;
    }

    public int nodesRemoved() {
        return nodesRemoved;
    }

    public int nodesMerged() {
        return nodesMerged;
    }
}
