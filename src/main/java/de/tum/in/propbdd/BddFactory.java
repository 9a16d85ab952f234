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

import java.util.Comparator;

public final class BddFactory {
    private BddFactory() {}

    public static DiagramBuilder buildDiagramBuilder() {
        return buildDiagramBuilder(ImmutableBddConfiguration.builder().build());
    }

    public static DiagramBuilder buildDiagramBuilder(BddConfiguration configuration) {
        return new DiagramBuilder(configuration);
    }

    public static BddOperations buildOperations() {
        return buildOperations(ImmutableBddConfiguration.builder().build());
    }

    /**
     * Creates an operations engine with lexicographic variable order.
     */
    public static BddOperations buildOperations(BddConfiguration configuration) {
        return new BddOperations(Comparator.naturalOrder(), configuration.logStatistics());
    }
}
