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

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final BuildStrategy DEFAULT_BUILD_STRATEGY = BuildStrategy.TREE;

    /**
     * How a {@link DiagramBuilder} turns a formula into a diagram.
     */
    public enum BuildStrategy {
        /**
         * Case-split on every variable of the order and evaluate the formula at each leaf, yielding
         * the complete, unreduced decision tree.
         */
        TREE,
        /**
         * Compose the diagram bottom-up along the syntax tree with {@link BddOperations}, yielding
         * the reduced diagram directly.
         */
        APPLY
    }

    @Value.Default
    public BuildStrategy buildStrategy() {
        return DEFAULT_BUILD_STRATEGY;
    }

    @Value.Default
    public boolean reduceOnBuild() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }
}
