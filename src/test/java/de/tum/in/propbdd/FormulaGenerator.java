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
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates random formulas over a fixed set of variables. Generation only depends on the seed, so
 * tests using it are reproducible.
 */
public final class FormulaGenerator {
    private static final Logger logger = Logger.getLogger(FormulaGenerator.class.getName());

    private FormulaGenerator() {
        // empty
    }

    public static List<Formula> generate(long seed, List<String> variables, int depth, int count) {
        logger.log(Level.FINE, "Generating {0} formulas of depth {1} over {2}",
                new Object[] {count, depth, variables});
        Random random = new Random(seed);
        List<Formula> formulas = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            formulas.add(generate(random, variables, depth));
        }
        return formulas;
    }

    private static Formula generate(Random random, List<String> variables, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            return Formula.variable(variables.get(random.nextInt(variables.size())));
        }
        int choice = random.nextInt(6);
        if (choice == 0) {
            return Formula.not(generate(random, variables, depth - 1));
        }
        Formula left = generate(random, variables, depth - 1);
        Formula right = generate(random, variables, depth - 1);
        switch (choice) {
            case 1:
                return Formula.and(left, right);
            case 2:
                return Formula.or(left, right);
            case 3:
                return Formula.implies(left, right);
            case 4:
                return Formula.iff(left, right);
            default:
                return Formula.not(Formula.and(left, Formula.not(right)));
        }
    }
}
