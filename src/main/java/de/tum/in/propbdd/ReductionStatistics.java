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

import org.immutables.value.Value;

/**
 * Outcome of a {@link Diagram#reduce()} call.
 */
@Value.Immutable
public abstract class ReductionStatistics {
    /**
     * Number of decision nodes dropped because both successors were equal.
     */
    public abstract int nodesRemoved();

    /**
     * Number of decision nodes replaced by an already existing node with the same signature.
     */
    public abstract int nodesMerged();

    public abstract int nodesBefore();

    public abstract int nodesAfter();

    @Value.Derived
    public int totalReduced() {
        return nodesRemoved() + nodesMerged();
    }

    static ReductionStatistics empty() {
        return ImmutableReductionStatistics.builder()
                .nodesRemoved(0)
                .nodesMerged(0)
                .nodesBefore(0)
                .nodesAfter(0)
                .build();
    }
}
