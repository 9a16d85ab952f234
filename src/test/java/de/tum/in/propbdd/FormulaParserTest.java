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

import static de.tum.in.propbdd.Formula.and;
import static de.tum.in.propbdd.Formula.iff;
import static de.tum.in.propbdd.Formula.implies;
import static de.tum.in.propbdd.Formula.not;
import static de.tum.in.propbdd.Formula.or;
import static de.tum.in.propbdd.Formula.variable;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class FormulaParserTest {
    private static final Formula p = variable("p");
    private static final Formula q = variable("q");
    private static final Formula r = variable("r");

    static Stream<Arguments> spellings() {
        return Stream.of(
                Arguments.of("p ∧ q", and(p, q)),
                Arguments.of("p & q", and(p, q)),
                Arguments.of("p /\\ q", and(p, q)),
                Arguments.of("p ∨ q", or(p, q)),
                Arguments.of("p | q", or(p, q)),
                Arguments.of("p \\/ q", or(p, q)),
                Arguments.of("p → q", implies(p, q)),
                Arguments.of("p -> q", implies(p, q)),
                Arguments.of("p => q", implies(p, q)),
                Arguments.of("p ↔ q", iff(p, q)),
                Arguments.of("p <-> q", iff(p, q)),
                Arguments.of("p <=> q", iff(p, q)),
                Arguments.of("¬p", not(p)),
                Arguments.of("~p", not(p)),
                Arguments.of("!p", not(p)));
    }

    @ParameterizedTest
    @MethodSource("spellings")
    public void testSpellings(String text, Formula expected) {
        assertThat(FormulaParser.parse(text), is(expected));
    }

    @Test
    public void testSingleVariable() {
        assertThat(FormulaParser.parse("p"), is(p));
        assertThat(FormulaParser.parse("  var_1  "), is(variable("var_1")));
    }

    @Test
    public void testWhitespaceIsInsignificant() {
        assertThat(FormulaParser.parse("p<->q"), is(iff(p, q)));
        assertThat(FormulaParser.parse("p->q"), is(implies(p, q)));
        assertThat(FormulaParser.parse("(p&q)|r"), is(or(and(p, q), r)));
    }

    @Test
    public void testPrecedence() {
        assertThat(FormulaParser.parse("p | q & r"), is(or(p, and(q, r))));
        assertThat(FormulaParser.parse("p & q | r"), is(or(and(p, q), r)));
        assertThat(FormulaParser.parse("~p & q"), is(and(not(p), q)));
        assertThat(FormulaParser.parse("p | q -> r"), is(implies(or(p, q), r)));
        assertThat(FormulaParser.parse("p -> q <-> r"), is(iff(implies(p, q), r)));
    }

    @Test
    public void testParentheses() {
        assertThat(FormulaParser.parse("(p | q) & r"), is(and(or(p, q), r)));
        assertThat(FormulaParser.parse("((p))"), is(p));
        assertThat(FormulaParser.parse("¬(p ∧ q)"), is(not(and(p, q))));
    }

    @Test
    public void testImplicationIsRightAssociative() {
        assertThat(FormulaParser.parse("p -> q -> r"), is(implies(p, implies(q, r))));
    }

    @Test
    public void testLeftAssociativeChains() {
        assertThat(FormulaParser.parse("p & q & r"), is(and(and(p, q), r)));
        assertThat(FormulaParser.parse("p | q | r"), is(or(or(p, q), r)));
        assertThat(FormulaParser.parse("p <-> q <-> r"), is(iff(iff(p, q), r)));
    }

    @Test
    public void testStackedNegation() {
        assertThat(FormulaParser.parse("¬¬p"), is(not(not(p))));
        assertThat(FormulaParser.parse("~!~p"), is(not(not(not(p)))));
    }

    @Test
    public void testToStringParsesBack() {
        Formula formula = FormulaParser.parse("(p & ~q) -> (r <-> p) | q");
        assertThat(FormulaParser.parse(formula.toString()), is(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "p &", "& p", "(p", "p)", "p q", "()", "p # q", "p - q", "1p", "p <- q", "~"})
    public void testMalformed(String text) {
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(text));
    }

    @Test
    public void testErrorPosition() {
        FormulaSyntaxException exception =
                assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("p & $"));
        assertThat(exception.position(), is(4));
        assertThat(exception.getMessage(), containsString("'$'"));

        FormulaSyntaxException trailing =
                assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("p q"));
        assertThat(trailing.position(), is(2));

        FormulaSyntaxException unmatched =
                assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("(p & q"));
        assertThat(unmatched.position(), is(-1));
    }
}
